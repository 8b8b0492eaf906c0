package com.horstmann.tmgrader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A validated, deterministic Turing machine. Instances are produced by
 * {@link TuringMachineParser} and never change afterwards.
 */
public class TuringMachine {
    public enum Move {
        LEFT(-1), RIGHT(1), STAY(0);

        private final int delta;

        Move(int delta) { this.delta = delta; }

        public int getDelta() { return delta; }

        /**
         * @return the move for L, R, S or N (either case), or null
         */
        public static Move parse(String s) {
            switch (s.toUpperCase()) {
            case "L": return LEFT;
            case "R": return RIGHT;
            case "S": case "N": return STAY;
            default: return null;
            }
        }
    }

    /**
     * The right hand side of a rule: go to state, write symbol, move head.
     */
    public static class Action {
        public final String state;
        public final char symbol;
        public final Move move;

        public Action(String state, char symbol, Move move) {
            this.state = state;
            this.symbol = symbol;
            this.move = move;
        }

        @Override
        public boolean equals(Object other) {
            if (!(other instanceof Action)) return false;
            Action that = (Action) other;
            return state.equals(that.state) && symbol == that.symbol && move == that.move;
        }

        @Override
        public int hashCode() {
            return Objects.hash(state, symbol, move);
        }

        public String toString() {
            return state + "," + symbol + "," + move.name().charAt(0);
        }
    }

    private final Set<String> states;
    private final Set<Character> inputAlphabet;
    private final Set<Character> tapeAlphabet;
    private final char blank;
    private final Map<String, Map<Character, Action>> transitions;
    private final String start;
    private final Set<String> accepting;
    private final Set<String> rejecting;

    TuringMachine(Set<String> states, Set<Character> inputAlphabet, Set<Character> tapeAlphabet, char blank,
            Map<String, Map<Character, Action>> transitions, String start, Set<String> accepting,
            Set<String> rejecting) {
        this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
        this.inputAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(inputAlphabet));
        this.tapeAlphabet = Collections.unmodifiableSet(new LinkedHashSet<>(tapeAlphabet));
        this.blank = blank;
        Map<String, Map<Character, Action>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Map<Character, Action>> entry : transitions.entrySet())
            copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
        this.transitions = Collections.unmodifiableMap(copy);
        this.start = start;
        this.accepting = Collections.unmodifiableSet(new LinkedHashSet<>(accepting));
        this.rejecting = Collections.unmodifiableSet(new LinkedHashSet<>(rejecting));
    }

    public Set<String> getStates() { return states; }
    public Set<Character> getInputAlphabet() { return inputAlphabet; }
    public Set<Character> getTapeAlphabet() { return tapeAlphabet; }
    public char getBlank() { return blank; }
    public String getStart() { return start; }
    public Set<String> getAccepting() { return accepting; }
    public Set<String> getRejecting() { return rejecting; }

    /**
     * @return the action for this state and symbol, or null if the machine halts
     */
    public Action transition(String state, char symbol) {
        Map<Character, Action> row = transitions.get(state);
        return row == null ? null : row.get(symbol);
    }

    public int getTransitionCount() {
        int count = 0;
        for (Map<Character, Action> row : transitions.values()) count += row.size();
        return count;
    }

    public String toString() {
        return "TuringMachine[" + states.size() + " states, " + getTransitionCount() + " transitions, start " + start + "]";
    }
}
