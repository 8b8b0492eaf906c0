package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class EntrypointResolverTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final EntrypointResolver resolver = new EntrypointResolver(
        new LanguageProfiles(GraderConfig.load().getLanguages()));

    private SubmissionGroup group(String... namesAndContents) throws IOException {
        Path root = folder.newFolder().toPath();
        for (int i = 0; i < namesAndContents.length; i += 2) {
            Path file = root.resolve(namesAndContents[i]);
            Files.createDirectories(file.getParent());
            Files.write(file, namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
        }
        return new SubmissionGroup(1, root, Util.descendantFiles(root));
    }

    @Test
    public void singleMainMarkerWins() throws IOException {
        Resolution resolution = resolver.resolve(group(
            "tm/Tape.java", "package tm; class Tape {}",
            "tm/Runner.java", "package tm;\npublic class Runner { public static void main(String[] args) {} }",
            "README.md", "Run it"));
        assertTrue(resolution.toString(), resolution.isResolved());
        ExecutionPlan plan = resolution.getPlan();
        assertEquals("java", plan.getLanguage().getId());
        assertEquals(Paths.get("tm/Runner.java"), plan.getEntrypoint());
        assertEquals(2, plan.getSourceFiles().size());
        assertEquals("tm.Runner", plan.variables("/code", "/compiled", "/data").get("class"));
    }

    @Test
    public void fileNameBreaksTie() throws IOException {
        Resolution resolution = resolver.resolve(group(
            "helpers.py", "def step(): pass",
            "simulator.py", "import helpers",
            "tape.py", "class Tape: pass"));
        assertTrue(resolution.toString(), resolution.isResolved());
        assertEquals(Paths.get("simulator.py"), resolution.getPlan().getEntrypoint());
        assertNull(resolution.getPlan().getBuildTemplate());
    }

    @Test
    public void twoMainsAreAmbiguous() throws IOException {
        Resolution resolution = resolver.resolve(group(
            "b.c", "int main() { return 0; }",
            "a.c", "int main(void) { return 1; }"));
        assertFalse(resolution.isResolved());
        Verdict failure = resolution.getFailure();
        assertEquals(Verdict.Kind.AMBIGUOUS_ENTRYPOINT, failure.getKind());
        assertEquals(List.of(Paths.get("a.c"), Paths.get("b.c")), failure.getCandidates());
    }

    @Test
    public void nothingToRun() throws IOException {
        Resolution resolution = resolver.resolve(group("notes.txt", "hello", "tape.h", "int x;"));
        assertEquals(Verdict.discoveryFailure("no recognized source files, only the c file tape.h"),
            resolution.getFailure());
    }

    @Test
    public void explicitEntrypointIsUsed() throws IOException {
        SubmissionGroup group = group(
            "b.c", "int main() { return 0; }",
            "a.c", "int main(void) { return 1; }");
        Resolution resolution = resolver.resolve(group,
            new EntrypointResolver.Overrides(Paths.get("b.c"), null, null));
        assertEquals(Paths.get("b.c"), resolution.getPlan().getEntrypoint());
        Resolution missing = resolver.resolve(group,
            new EntrypointResolver.Overrides(Paths.get("c.c"), null, null));
        assertEquals(Verdict.Kind.DISCOVERY_FAILURE, missing.getFailure().getKind());
    }

    @Test
    public void runOverrideResolvesAmbiguity() throws IOException {
        SubmissionGroup group = group(
            "b.c", "int main() { return 0; }",
            "a.c", "int main(void) { return 1; }",
            "x.py", "if __name__ == '__main__': pass");
        Resolution resolution = resolver.resolve(group,
            new EntrypointResolver.Overrides(null, "make", "./sim"));
        assertTrue(resolution.toString(), resolution.isResolved());
        assertEquals(Paths.get("a.c"), resolution.getPlan().getEntrypoint());
        assertEquals("make", resolution.getPlan().getBuildTemplate());
        assertEquals("./sim", resolution.getPlan().getRunTemplate());
    }

    @Test
    public void expandsTemplates() {
        String command = LanguageProfile.expand("cd {code} && run {stem} {unknown}",
            Map.of("code", "'/code'", "stem", "'Sim'"));
        assertEquals("cd '/code' && run 'Sim' {unknown}", command);
    }
}
