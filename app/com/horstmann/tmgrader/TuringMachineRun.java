package com.horstmann.tmgrader;

import java.util.List;

/**
 * How a simulation ended.
 */
public class TuringMachineRun {
    public enum Outcome { ACCEPT, REJECT, STEP_LIMIT_EXCEEDED, CYCLE_DETECTED }

    private final Outcome outcome;
    private final Configuration configuration;
    private final long steps;
    private final String output;
    private final List<Configuration> trace;

    public TuringMachineRun(Outcome outcome, Configuration configuration, long steps, String output,
            List<Configuration> trace) {
        this.outcome = outcome;
        this.configuration = configuration;
        this.steps = steps;
        this.output = output;
        this.trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public Outcome getOutcome() { return outcome; }

    /**
     * @return the halting configuration, or the one where the simulation was stopped
     */
    public Configuration getConfiguration() { return configuration; }
    public long getSteps() { return steps; }

    /**
     * @return the input symbols from the head rightwards
     */
    public String getOutput() { return output; }

    /**
     * @return every configuration from the initial one on, or an empty list if no trace
     * was requested
     */
    public List<Configuration> getTrace() { return trace; }

    public String toString() {
        return outcome + " after " + steps + " steps in " + configuration + ", output '" + output + "'";
    }
}
