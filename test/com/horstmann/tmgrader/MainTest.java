package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MainTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    private final Main main = new Main(GraderConfig.withOverrides("workers = 2"));

    @Test
    public void usageErrors() {
        assertEquals(Main.USAGE, main.run(new String[] {}, out));
        assertEquals(Main.USAGE, main.run(new String[] { "rams", "." }, out));
        assertEquals(Main.USAGE, main.run(new String[] { "tms", ".", "--group", "x" }, out));
    }

    @Test
    public void missingFolderIsFatal() {
        assertEquals(Main.FATAL, main.run(new String[] { "tms", folder.getRoot() + "/missing" }, out));
    }

    @Test
    public void emptyFolderIsFatal() {
        assertEquals(Main.FATAL, main.run(new String[] { "tms", folder.getRoot().toString() }, out));
    }

    @Test
    public void gradesMachines() throws IOException {
        Path group = folder.newFolder("group4").toPath();
        ReferenceMachines references = new ReferenceMachines(new TuringMachineSimulator(GraderConfig.load()));
        for (String name : new String[] { "invert", "equal", "increment" })
            Files.write(group.resolve(name + ".tm"), references.getDescription(name).getBytes(StandardCharsets.UTF_8));
        folder.newFolder("group5");

        int status = main.run(new String[] { "tms", folder.getRoot().toString(), "--json" }, out);
        assertEquals(Main.OK, status);
        String report = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(report, report.contains("\"group\" : 4"));
        assertTrue(report, report.contains("\"passed\" : 6"));
        assertTrue(report, report.contains("DISCOVERY_FAILURE"));
    }

    @Test
    public void onlySelectedGroup() throws IOException {
        folder.newFolder("group4");
        folder.newFolder("group5");
        int status = main.run(new String[] { "tms", folder.getRoot().toString(), "-g", "5" }, out);
        assertEquals(Main.OK, status);
        String report = bytes.toString(StandardCharsets.UTF_8);
        assertTrue(report, report.contains("Group 5"));
        assertTrue(report, !report.contains("Group 4"));
    }
}
