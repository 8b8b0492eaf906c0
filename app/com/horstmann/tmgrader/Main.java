package com.horstmann.tmgrader;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;

/**
 * Command line entry point:
 *
 * <pre>
 * tmgrader simulators|tms path [-g group]... [-b build] [-r run] [-e entrypoint] [--local] [--json]
 * </pre>
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static final int OK = 0;
    public static final int FATAL = 1;
    public static final int USAGE = 2;

    private final OptionParser parser = new OptionParser();
    private final OptionSpec<Integer> groupOption = parser.acceptsAll(List.of("g", "group"),
        "Only grade this group (repeatable)").withRequiredArg().ofType(Integer.class);
    private final OptionSpec<String> buildOption = parser.acceptsAll(List.of("b", "build-command"),
        "Build command, replacing the detected one (needs exactly one -g)").withRequiredArg();
    private final OptionSpec<String> runOption = parser.acceptsAll(List.of("r", "run-command"),
        "Run command, replacing the detected one (needs exactly one -g)").withRequiredArg();
    private final OptionSpec<String> entrypointOption = parser.acceptsAll(List.of("e", "entrypoint"),
        "File with the program's entry point, relative to the group folder (needs exactly one -g)").withRequiredArg();
    private final OptionSpec<Void> localOption = parser.accepts("local",
        "Run programs as local processes instead of Docker containers");
    private final OptionSpec<Void> jsonOption = parser.accepts("json", "Print a JSON report");
    private final OptionSpec<Void> helpOption = parser.acceptsAll(List.of("h", "help"), "Print this help message").forHelp();
    private final OptionSpec<String> arguments = parser.nonOptions("simulators|tms path");

    private final GraderConfig config;

    public Main(GraderConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        System.exit(new Main(GraderConfig.load()).run(args, System.out));
    }

    /**
     * @return the exit code
     */
    public int run(String[] args, PrintStream out) {
        OptionSet options;
        TreeSet<Integer> groups;
        try {
            options = parser.parse(args);
            groups = new TreeSet<>(options.valuesOf(groupOption));
        } catch (OptionException ex) {
            return usage(ex.getMessage());
        }
        if (options.has(helpOption)) return usage(null);
        List<String> positional = options.valuesOf(arguments);
        if (positional.size() != 2) return usage("Expected an assignment and a path");
        String kind = positional.get(0);
        if (!kind.equals("simulators") && !kind.equals("tms")) return usage("Unknown assignment " + kind);
        Path path = Paths.get(positional.get(1));

        EntrypointResolver.Overrides overrides = new EntrypointResolver.Overrides(
            options.has(entrypointOption) ? Paths.get(options.valueOf(entrypointOption)) : null,
            options.valueOf(buildOption), options.valueOf(runOption));
        if (!overrides.isEmpty() && groups.size() != 1) {
            logger.warn("Ignoring build, run and entrypoint overrides: they need exactly one group");
            overrides = EntrypointResolver.Overrides.none();
        }

        try (SubmissionWalker walker = new SubmissionWalker(path);
                SandboxRuntime runtime = kind.equals("simulators") ? runtime(options) : null;
                ReferenceMachines references = new ReferenceMachines(new TuringMachineSimulator(config))) {
            List<SubmissionGroup> submissions = walker.walk(groups);
            if (submissions.isEmpty()) throw new GraderException("No submissions found in " + path);
            Assignment assignment;
            if (kind.equals("simulators")) {
                runtime.verify();
                LanguageProfiles profiles = new LanguageProfiles(config.getLanguages());
                assignment = new SimulatorAssignment(config.getTests(), references, new EntrypointResolver(profiles),
                    overrides, new SandboxRunner(runtime, config));
            } else {
                assignment = new TuringMachineAssignment(config.getTests(), references,
                    new TuringMachineSimulator(config));
            }
            GradingResults results = new GradingOrchestrator(config.getWorkers()).grade(assignment, submissions);
            Report report = options.has(jsonOption) ? new JSONReport() : new TextReport();
            report.header(assignment.getName(), submissions.size(), assignment.getTests().size());
            results.report(report);
            report.close();
            out.println(report.getText());
            return OK;
        } catch (GraderException ex) {
            logger.error(ex.getMessage(), ex.getCause());
            return FATAL;
        } catch (IOException ex) {
            logger.error("I/O error", ex);
            return FATAL;
        }
    }

    private SandboxRuntime runtime(OptionSet options) {
        return options.has(localOption) ? new LocalProcessRuntime(config) : new DockerRuntime(config);
    }

    private int usage(String message) {
        if (message != null) System.err.println(message);
        try {
            parser.printHelpOn(System.err);
        } catch (IOException ex) {
            logger.debug("Cannot print help", ex);
        }
        return USAGE;
    }
}
