package com.horstmann.tmgrader;

import java.util.Objects;

/**
 * Run the machine with the given name on the given input.
 */
public class TestCase {
    private final String machine;
    private final String input;

    public TestCase(String machine, String input) {
        this.machine = machine;
        this.input = input;
    }

    public String getMachine() { return machine; }
    public String getInput() { return input; }

    /**
     * @return the file name of the machine description, e.g. invert.tm
     */
    public String getMachineFile() { return machine + ".tm"; }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof TestCase)) return false;
        TestCase that = (TestCase) other;
        return machine.equals(that.machine) && input.equals(that.input);
    }

    @Override
    public int hashCode() {
        return Objects.hash(machine, input);
    }

    public String toString() {
        return machine + " on '" + input + "'";
    }
}
