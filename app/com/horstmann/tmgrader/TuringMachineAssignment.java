package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Students write Turing machines. A group's machine for a test is the file name.tm (or
 * name.txt) anywhere in its submission. It passes a test if it halts the same way as the
 * reference machine and leaves the same output word.
 */
public class TuringMachineAssignment implements Assignment {
    private static final String[] EXTENSIONS = { "tm", "txt" };

    private final List<TestCase> tests;
    private final ReferenceMachines references;
    private final TuringMachineSimulator simulator;

    public TuringMachineAssignment(List<TestCase> tests, ReferenceMachines references,
            TuringMachineSimulator simulator) {
        this.tests = tests;
        this.references = references;
        this.simulator = simulator;
    }

    @Override
    public String getName() { return "tms"; }

    @Override
    public List<TestCase> getTests() { return tests; }

    @Override
    public List<TestOutcome> grade(SubmissionGroup group) {
        Map<String, ParseResult> parsed = new HashMap<>();
        List<TestOutcome> outcomes = new ArrayList<>();
        for (TestCase test : tests) {
            ParseResult result = parsed.computeIfAbsent(test.getMachine(), name -> load(group, name));
            Verdict verdict;
            if (result == null)
                verdict = Verdict.discoveryFailure("No file " + test.getMachineFile());
            else if (!result.isValid())
                verdict = Verdict.invalidMachine(result.getError().toString());
            else
                verdict = check(result.getMachine(), test);
            outcomes.add(new TestOutcome(test.toString(), verdict));
        }
        return outcomes;
    }

    /**
     * @return the parsed machine, or null if the group has no readable file for it
     */
    private static ParseResult load(SubmissionGroup group, String name) {
        Path file = find(group, name);
        if (file == null) return null;
        String contents = Util.read(group.getRoot().resolve(file));
        return contents == null ? null : TuringMachineParser.parse(contents);
    }

    static Path find(SubmissionGroup group, String name) {
        for (String extension : EXTENSIONS)
            for (Path file : group.getFiles())
                if (file.getFileName().toString().equalsIgnoreCase(name + "." + extension))
                    return file;
        return null;
    }

    private Verdict check(TuringMachine machine, TestCase test) {
        TuringMachineRun actual = simulator.run(machine, test.getInput());
        switch (actual.getOutcome()) {
        case STEP_LIMIT_EXCEEDED:
            return Verdict.stepLimitExceeded(actual.getConfiguration().toString());
        case CYCLE_DETECTED:
            return Verdict.cycleDetected(actual.getConfiguration().toString());
        default:
            TuringMachineRun expected = references.run(test);
            if (expected.getOutcome() == actual.getOutcome() && expected.getOutput().equals(actual.getOutput()))
                return Verdict.pass();
            return Verdict.wrongResult("- " + describe(expected) + "\n+ " + describe(actual));
        }
    }

    private static String describe(TuringMachineRun run) {
        return run.getOutcome() + " with output '" + run.getOutput() + "'";
    }
}
