package com.horstmann.tmgrader;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.List;

import org.junit.Test;

public class TuringMachineSimulatorTest {
    private final TuringMachineSimulator simulator = new TuringMachineSimulator(1_000_000, 4096, 256);

    private static TuringMachine machine(String text) {
        ParseResult result = TuringMachineParser.parse(text);
        assertTrue(result.toString(), result.isValid());
        return result.getMachine();
    }

    private static final String TWO_STEPS = String.join("\n",
        "states: q0, q1, accept",
        "input: 0, 1",
        "start: q0",
        "accept: accept",
        "q0,1 -> q1,1,R",
        "q1,B -> accept,B,S");

    @Test
    public void acceptsAfterTwoSteps() {
        TuringMachineRun run = simulator.run(machine(TWO_STEPS), "1", true);
        assertEquals(TuringMachineRun.Outcome.ACCEPT, run.getOutcome());
        assertEquals(2, run.getSteps());
        assertEquals("...1[accept]...", run.getConfiguration().toString());
        List<Configuration> trace = run.getTrace();
        assertEquals(3, trace.size());
        assertEquals("...[q0]1...", trace.get(0).toString());
        assertEquals("...1[q1]...", trace.get(1).toString());
    }

    @Test
    public void haltingOutsideAcceptingStatesRejects() {
        TuringMachineRun run = simulator.run(machine(TWO_STEPS), "0");
        assertEquals(TuringMachineRun.Outcome.REJECT, run.getOutcome());
        assertEquals(0, run.getSteps());
        assertEquals("0", run.getOutput());
        assertTrue(run.getTrace().isEmpty());
    }

    @Test
    public void detectsCycleOnBoundedTape() {
        TuringMachine machine = machine(String.join("\n",
            "states: a, b",
            "input: 0",
            "start: a",
            "accept: b",
            "a,0 -> a,0,R",
            "a,B -> a,B,L"));
        TuringMachineRun run = simulator.run(machine, "00");
        assertEquals(TuringMachineRun.Outcome.CYCLE_DETECTED, run.getOutcome());
        assertTrue(run.getSteps() < 10);
    }

    @Test
    public void cycleHistoryForgetsOldestConfigurations() {
        TuringMachine machine = machine(String.join("\n",
            "states: a, b, c",
            "input: 0",
            "start: a",
            "accept: c",
            "a,B -> b,B,S",
            "b,B -> c,B,S",
            "c,B -> a,B,S"));
        TuringMachineRun remembered = new TuringMachineSimulator(100, 3, 256).run(machine, "");
        assertEquals(TuringMachineRun.Outcome.CYCLE_DETECTED, remembered.getOutcome());
        assertEquals(3, remembered.getSteps());
        TuringMachineRun forgotten = new TuringMachineSimulator(100, 2, 256).run(machine, "");
        assertEquals(TuringMachineRun.Outcome.STEP_LIMIT_EXCEEDED, forgotten.getOutcome());
        assertEquals(100, forgotten.getSteps());
    }

    @Test
    public void stopsMachineThatWritesForever() {
        TuringMachine machine = machine(String.join("\n",
            "states: a",
            "input: 1",
            "start: a",
            "accept: a",
            "a,B -> a,1,R"));
        TuringMachineRun run = new TuringMachineSimulator(1000, 4096, 256).run(machine, "");
        assertEquals(TuringMachineRun.Outcome.STEP_LIMIT_EXCEEDED, run.getOutcome());
        assertEquals(1000, run.getSteps());
    }

    @Test
    public void stepLimitIsTheGuardWithoutCycleDetection() {
        TuringMachine machine = machine(String.join("\n",
            "states: a",
            "input: 1",
            "start: a",
            "accept: a",
            "a,B -> a,B,S"));
        TuringMachineRun run = new TuringMachineSimulator(500, 0, 256).run(machine, "");
        assertEquals(TuringMachineRun.Outcome.STEP_LIMIT_EXCEEDED, run.getOutcome());
        assertEquals(500, run.getSteps());
    }

    @Test
    public void outputIsTheInputWordAtTheHead() {
        TuringMachine machine = machine(String.join("\n",
            "states: a, done",
            "input: 0, 1",
            "tape: X",
            "start: a",
            "accept: done",
            "a,0 -> a,X,R",
            "a,1 -> done,1,S"));
        TuringMachineRun run = simulator.run(machine, "0110X1");
        assertEquals(TuringMachineRun.Outcome.ACCEPT, run.getOutcome());
        assertEquals("110", run.getOutput());
        assertEquals("...X[done]110X1...", run.getConfiguration().toString());
    }

    @Test
    public void referenceMachinesComputeTheirFunctions() {
        ReferenceMachines references = new ReferenceMachines(simulator);
        assertEquals("1010", references.run(new TestCase("invert", "0101")).getOutput());
        assertEquals("1100", references.run(new TestCase("increment", "1011")).getOutput());
        assertEquals("1000", references.run(new TestCase("increment", "111")).getOutput());
        assertEquals(TuringMachineRun.Outcome.ACCEPT, references.run(new TestCase("equal", "101#101")).getOutcome());
        assertEquals(TuringMachineRun.Outcome.REJECT, references.run(new TestCase("equal", "11000#001")).getOutcome());
        assertEquals(TuringMachineRun.Outcome.REJECT, references.run(new TestCase("equal", "10#1")).getOutcome());
    }

    @Test
    public void referenceTraceStartsWithInitialConfiguration() {
        ReferenceMachines references = new ReferenceMachines(simulator);
        String[] lines = references.expectedTrace(new TestCase("invert", "01")).split("\n");
        assertEquals("...[flip]01...", lines[0]);
        assertEquals("...1[flip]1...", lines[1]);
        assertEquals("...[done]10...", lines[lines.length - 1]);
    }
}
