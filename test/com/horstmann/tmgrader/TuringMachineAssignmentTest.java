package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TuringMachineAssignmentTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final TuringMachineSimulator simulator = new TuringMachineSimulator(10_000, 4096, 256);
    private final ReferenceMachines references = new ReferenceMachines(simulator);
    private final List<TestCase> tests = List.of(
        new TestCase("invert", "0101"), new TestCase("equal", "1#1"), new TestCase("increment", "11"));
    private final TuringMachineAssignment assignment = new TuringMachineAssignment(tests, references, simulator);

    private SubmissionGroup group(String... namesAndContents) throws IOException {
        Path root = folder.newFolder().toPath();
        for (int i = 0; i < namesAndContents.length; i += 2) {
            Path file = root.resolve(namesAndContents[i]);
            Files.createDirectories(file.getParent());
            Files.write(file, namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
        }
        return new SubmissionGroup(7, root, Util.descendantFiles(root));
    }

    private static Verdict.Kind kind(List<TestOutcome> outcomes, int i) {
        return outcomes.get(i).getVerdict().getKind();
    }

    @Test
    public void gradesEachMachine() throws IOException {
        String loop = String.join("\n",
            "states: a, b",
            "input: 0, 1",
            "start: a",
            "accept: b",
            "a,1 -> a,1,S");
        List<TestOutcome> outcomes = assignment.grade(group(
            "tms/Invert.TM", references.getDescription("invert"),
            "equal.txt", loop,
            "increment.tm", "states: q0\nstart q0\n"));
        assertEquals(3, outcomes.size());
        assertEquals(Verdict.Kind.PASS, kind(outcomes, 0));
        assertEquals(Verdict.Kind.CYCLE_DETECTED, kind(outcomes, 1));
        assertEquals(Verdict.Kind.INVALID_MACHINE, kind(outcomes, 2));
        assertEquals("line 2: expected a declaration such as states: ... or a rule such as q0,1 -> q1,0,R",
            outcomes.get(2).getVerdict().getDetail());
    }

    @Test
    public void missingMachineIsADiscoveryFailure() throws IOException {
        List<TestOutcome> outcomes = assignment.grade(group("invert.tm", references.getDescription("invert")));
        assertEquals(Verdict.Kind.PASS, kind(outcomes, 0));
        assertEquals(Verdict.discoveryFailure("No file equal.tm"), outcomes.get(1).getVerdict());
    }

    @Test
    public void differentOutputIsAWrongResult() throws IOException {
        String identity = String.join("\n",
            "states: s",
            "input: 0, 1",
            "start: s",
            "accept: s");
        List<TestOutcome> outcomes = assignment.grade(group("increment.tm", identity, "invert.tm", identity));
        assertEquals(Verdict.Kind.WRONG_RESULT, kind(outcomes, 0));
        assertEquals("- ACCEPT with output '1010'\n+ ACCEPT with output '0101'", outcomes.get(0).getVerdict().getDetail());
        assertEquals(Verdict.Kind.WRONG_RESULT, kind(outcomes, 2));
    }

    @Test
    public void runawayMachineHitsTheStepLimit() throws IOException {
        String writer = String.join("\n",
            "states: w",
            "input: 0, 1",
            "start: w",
            "accept: w",
            "w,0 -> w,1,R",
            "w,1 -> w,0,R",
            "w,B -> w,1,R");
        List<TestOutcome> outcomes = assignment.grade(group("invert.tm", writer));
        assertEquals(Verdict.Kind.STEP_LIMIT_EXCEEDED, kind(outcomes, 0));
    }
}
