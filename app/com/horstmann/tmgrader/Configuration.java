package com.horstmann.tmgrader;

import java.util.Objects;

/**
 * A snapshot of a Turing machine: its state and the tape to the left of the head and
 * from the head rightwards. Rendered as ...left[state]right... with blanks trimmed at
 * the outer ends.
 */
public class Configuration {
    private final String state;
    private final String left;
    private final String right;

    /**
     * @param left the cells left of the head
     * @param right the cell under the head and the cells to its right
     * @param blank leading blanks of left and trailing blanks of right are dropped
     */
    public Configuration(String state, String left, String right, char blank) {
        this.state = state;
        this.left = trimLeading(left, blank);
        this.right = trimTrailing(right, blank);
    }

    public String getState() { return state; }
    public String getLeft() { return left; }
    public String getRight() { return right; }

    private static String trimLeading(String s, char c) {
        int i = 0;
        while (i < s.length() && s.charAt(i) == c) i++;
        return s.substring(i);
    }

    private static String trimTrailing(String s, char c) {
        int i = s.length();
        while (i > 0 && s.charAt(i - 1) == c) i--;
        return s.substring(0, i);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof Configuration)) return false;
        Configuration that = (Configuration) other;
        return state.equals(that.state) && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, left, right);
    }

    @Override
    public String toString() {
        return "..." + left + "[" + state + "]" + right + "...";
    }
}
