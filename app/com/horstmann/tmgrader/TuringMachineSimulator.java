package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs Turing machines with a step limit and cycle detection. A machine halts when no
 * rule applies; it accepts if it halts in an accepting state and rejects otherwise.
 *
 * Cycle detection remembers the most recent configurations whose non-blank tape fits
 * into a window. Meeting one of them again means the machine loops forever. Machines
 * that keep writing new cells are stopped by the step limit instead.
 */
public class TuringMachineSimulator {
    private static final Logger logger = LoggerFactory.getLogger(TuringMachineSimulator.class);

    private final long maxSteps;
    private final int cycleHistory;
    private final int cycleWindow;

    public TuringMachineSimulator(long maxSteps, int cycleHistory, int cycleWindow) {
        this.maxSteps = maxSteps;
        this.cycleHistory = cycleHistory;
        this.cycleWindow = cycleWindow;
    }

    public TuringMachineSimulator(GraderConfig config) {
        this(config.getMaxSteps(), config.getCycleHistory(), config.getCycleWindow());
    }

    public TuringMachineRun run(TuringMachine machine, String input) {
        return run(machine, input, false);
    }

    /**
     * @param trace true to record every configuration
     */
    public TuringMachineRun run(TuringMachine machine, String input, boolean trace) {
        Tape tape = new Tape(input, machine.getBlank());
        String state = machine.getStart();
        List<Configuration> configurations = trace ? new ArrayList<>() : null;
        if (trace) configurations.add(tape.configuration(state));
        LinkedHashSet<String> seen = new LinkedHashSet<>();
        long steps = 0;
        while (true) {
            TuringMachine.Action action = machine.transition(state, tape.read());
            if (action == null) {
                TuringMachineRun.Outcome outcome = machine.getAccepting().contains(state)
                    ? TuringMachineRun.Outcome.ACCEPT : TuringMachineRun.Outcome.REJECT;
                return finish(outcome, machine, tape, state, steps, configurations);
            }
            if (steps >= maxSteps)
                return finish(TuringMachineRun.Outcome.STEP_LIMIT_EXCEEDED, machine, tape, state, steps, configurations);
            if (cycleHistory > 0 && tape.getExtent() <= cycleWindow) {
                if (!seen.add(tape.fingerprint(state)))
                    return finish(TuringMachineRun.Outcome.CYCLE_DETECTED, machine, tape, state, steps, configurations);
                if (seen.size() > cycleHistory) {
                    Iterator<String> oldest = seen.iterator();
                    oldest.next();
                    oldest.remove();
                }
            }
            tape.write(action.symbol);
            tape.move(action.move);
            state = action.state;
            steps++;
            if (trace) configurations.add(tape.configuration(state));
        }
    }

    private static TuringMachineRun finish(TuringMachineRun.Outcome outcome, TuringMachine machine, Tape tape,
            String state, long steps, List<Configuration> configurations) {
        TuringMachineRun result = new TuringMachineRun(outcome, tape.configuration(state), steps,
            tape.wordAtHead(machine.getInputAlphabet()), configurations);
        logger.debug("{}", result);
        return result;
    }
}
