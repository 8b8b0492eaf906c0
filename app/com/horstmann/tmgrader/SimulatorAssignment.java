package com.horstmann.tmgrader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Students write a program that simulates a Turing machine. It is started with the
 * arguments machine-file input in a directory holding the machine descriptions, and
 * must print every configuration of the run, one per line.
 */
public class SimulatorAssignment implements Assignment {
    private static final Logger logger = LoggerFactory.getLogger(SimulatorAssignment.class);

    private final List<TestCase> tests;
    private final ReferenceMachines references;
    private final EntrypointResolver resolver;
    private final EntrypointResolver.Overrides overrides;
    private final SandboxRunner runner;
    private final OutputReconciler reconciler = new OutputReconciler();
    private Path dataDir;

    public SimulatorAssignment(List<TestCase> tests, ReferenceMachines references, EntrypointResolver resolver,
            EntrypointResolver.Overrides overrides, SandboxRunner runner) {
        this.tests = tests;
        this.references = references;
        this.resolver = resolver;
        this.overrides = overrides;
        this.runner = runner;
    }

    @Override
    public String getName() { return "simulators"; }

    @Override
    public List<TestCase> getTests() { return tests; }

    @Override
    public void prepare() throws IOException {
        dataDir = references.writeDirectory(tests);
    }

    @Override
    public List<TestOutcome> grade(SubmissionGroup group) throws IOException {
        if (dataDir == null) prepare();
        Resolution resolution = resolver.resolve(group, overrides);
        if (!resolution.isResolved()) return replicate(resolution.getFailure());
        ExecutionPlan plan = resolution.getPlan();
        logger.info("Group {}: running {} ({})", group.getId(), plan.getEntrypoint(), plan.getLanguage().getId());
        try (SandboxRunner.PreparedProgram program = runner.prepare(plan, dataDir)) {
            ExecutionResult build = program.getBuildFailure();
            if (build != null) return replicate(runner.classify(build));
            List<TestOutcome> outcomes = new ArrayList<>();
            for (TestCase test : tests) {
                ExecutionResult result = program.run(List.of(test.getMachineFile(), test.getInput()), null);
                Verdict verdict = runner.classify(result);
                if (verdict == null) {
                    OutputSchema schema = new ConfigurationSchema(references.getMachine(test.getMachine()));
                    verdict = reconciler.reconcile(result.getStdout(), references.expectedTrace(test), schema);
                }
                outcomes.add(new TestOutcome(test.toString(), verdict));
            }
            return outcomes;
        }
    }
}
