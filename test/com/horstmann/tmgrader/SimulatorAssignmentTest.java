package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class SimulatorAssignmentTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final GraderConfig config = GraderConfig.withOverrides("sandbox.run-timeout = 2s");
    private final LocalProcessRuntime runtime = new LocalProcessRuntime(config);
    private final ReferenceMachines references = new ReferenceMachines(new TuringMachineSimulator(config));
    private final List<TestCase> tests = List.of(new TestCase("invert", "01"), new TestCase("increment", "1"));

    @After
    public void tearDown() {
        references.close();
        runtime.close();
    }

    private SimulatorAssignment assignment(String build) {
        LanguageProfile shell = new LanguageProfile("shell", List.of("sh"), List.of(), "alpine:3", null, null,
            build, "sh {code}/{entrypoint}");
        EntrypointResolver resolver = new EntrypointResolver(new LanguageProfiles(List.of(shell)));
        return new SimulatorAssignment(tests, references, resolver, EntrypointResolver.Overrides.none(),
            new SandboxRunner(runtime, config));
    }

    private SubmissionGroup group(String name, String script) throws IOException {
        Path root = folder.newFolder().toPath();
        Files.write(root.resolve(name), script.getBytes(StandardCharsets.UTF_8));
        return new SubmissionGroup(3, root, Util.descendantFiles(root));
    }

    /**
     * A "simulator" that knows the answer to the first test only, and checks that it was
     * started with the machine file and input.
     */
    private String cheat() {
        return "[ -f \"$1\" ] || exit 9\n"
            + "if [ \"$1 $2\" = \"invert.tm 01\" ]; then\n"
            + "cat <<'END'\n" + references.expectedTrace(tests.get(0)) + "\nEND\n"
            + "else\n"
            + "echo '...[right]1...'\n"
            + "fi\n";
    }

    @Test
    public void comparesTraceWithReference() throws IOException {
        List<TestOutcome> outcomes = assignment(null).grade(group("sim.sh", cheat()));
        assertEquals(2, outcomes.size());
        assertEquals(Verdict.pass(), outcomes.get(0).getVerdict());
        assertEquals("invert on '01'", outcomes.get(0).getTest());
        assertEquals(Verdict.Kind.FORMAT_MISMATCH, outcomes.get(1).getVerdict().getKind());
    }

    @Test
    public void garbageIsUnparseable() throws IOException {
        List<TestOutcome> outcomes = assignment(null).grade(group("sim.sh", "echo 'I do not know'"));
        assertEquals(Verdict.Kind.UNPARSEABLE, outcomes.get(0).getVerdict().getKind());
        assertTrue(outcomes.get(0).getVerdict().getDetail().startsWith("I do not know"));
    }

    @Test
    public void buildFailureAppliesToEveryTest() throws IOException {
        List<TestOutcome> outcomes = assignment("echo 'syntax error' >&2; exit 1").grade(group("sim.sh", cheat()));
        assertEquals(2, outcomes.size());
        for (TestOutcome outcome : outcomes)
            assertEquals(Verdict.Kind.BUILD_FAILURE, outcome.getVerdict().getKind());
        assertEquals(outcomes.get(0).getVerdict(), outcomes.get(1).getVerdict());
    }

    @Test
    public void crashIsARuntimeFailure() throws IOException {
        List<TestOutcome> outcomes = assignment(null).grade(group("sim.sh", "exit 4"));
        assertEquals(Verdict.Kind.RUNTIME_FAILURE, outcomes.get(0).getVerdict().getKind());
    }

    @Test
    public void submissionWithoutSourcesIsADiscoveryFailure() throws IOException {
        List<TestOutcome> outcomes = assignment(null).grade(group("notes.txt", "todo"));
        assertEquals(Verdict.discoveryFailure("no recognized source files"), outcomes.get(1).getVerdict());
    }
}
