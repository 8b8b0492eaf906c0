package com.horstmann.tmgrader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The machines that test cases refer to, loaded from the tms folder on the class path.
 */
public class ReferenceMachines implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ReferenceMachines.class);
    private static final String FOLDER = "/tms/";

    private final TuringMachineSimulator simulator;
    private final Map<String, String> descriptions = new ConcurrentHashMap<>();
    private final Map<String, TuringMachine> machines = new ConcurrentHashMap<>();
    private final Map<TestCase, TuringMachineRun> runs = new ConcurrentHashMap<>();
    private Path directory;

    public ReferenceMachines(TuringMachineSimulator simulator) {
        this.simulator = simulator;
    }

    /**
     * @return the text of the machine with the given name
     */
    public String getDescription(String name) {
        return descriptions.computeIfAbsent(name, this::load);
    }

    private String load(String name) {
        String resource = FOLDER + name + ".tm";
        try (InputStream in = getClass().getResourceAsStream(resource)) {
            if (in == null) throw new GraderException("No reference machine " + resource);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new GraderException("Cannot read " + resource, ex);
        }
    }

    public TuringMachine getMachine(String name) {
        return machines.computeIfAbsent(name, n -> {
            ParseResult result = TuringMachineParser.parse(getDescription(n));
            if (!result.isValid())
                throw new GraderException("Reference machine " + n + ": " + result.getError());
            return result.getMachine();
        });
    }

    /**
     * @return the traced run of the test's machine on its input
     */
    public TuringMachineRun run(TestCase test) {
        return runs.computeIfAbsent(test, t -> simulator.run(getMachine(t.getMachine()), t.getInput(), true));
    }

    /**
     * @return the configurations of the reference run, one per line
     */
    public String expectedTrace(TestCase test) {
        List<String> lines = new ArrayList<>();
        for (Configuration configuration : run(test).getTrace()) lines.add(configuration.toString());
        return String.join("\n", lines);
    }

    /**
     * Writes the machines of the given tests to a scratch directory, as name.tm, and
     * returns it. The directory is removed by close.
     */
    public synchronized Path writeDirectory(List<TestCase> tests) throws IOException {
        if (directory == null) directory = Files.createTempDirectory("tmgrader-tms");
        for (TestCase test : tests) {
            Path file = directory.resolve(test.getMachineFile());
            if (!Files.exists(file))
                Files.write(file, getDescription(test.getMachine()).getBytes(StandardCharsets.UTF_8));
        }
        return directory;
    }

    @Override
    public synchronized void close() {
        if (directory == null) return;
        try {
            Util.deleteDirectory(directory);
        } catch (IOException ex) {
            logger.warn("Cannot delete " + directory, ex);
        }
        directory = null;
    }
}
