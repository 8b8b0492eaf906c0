package com.horstmann.tmgrader;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * A tape that is blank everywhere except for finitely many cells. Only non-blank cells
 * are stored, so the tape can grow in both directions.
 */
public class Tape {
    private final char blank;
    private final TreeMap<Integer, Character> cells = new TreeMap<>();
    private int head;

    /**
     * Writes the input starting at position 0 and puts the head there.
     */
    public Tape(String input, char blank) {
        this.blank = blank;
        for (int i = 0; i < input.length(); i++)
            write(i, input.charAt(i));
    }

    public char read() {
        return read(head);
    }

    public char read(int position) {
        Character symbol = cells.get(position);
        return symbol == null ? blank : symbol;
    }

    public void write(char symbol) {
        write(head, symbol);
    }

    private void write(int position, char symbol) {
        if (symbol == blank) cells.remove(position);
        else cells.put(position, symbol);
    }

    public void move(TuringMachine.Move move) {
        head += move.getDelta();
    }

    /**
     * @return the number of cells from the leftmost to the rightmost non-blank cell
     */
    public int getExtent() {
        return cells.isEmpty() ? 0 : cells.lastKey() - cells.firstKey() + 1;
    }

    /**
     * @return the symbols from position from up to (excluding) to
     */
    public String contents(int from, int to) {
        StringBuilder result = new StringBuilder();
        for (int i = from; i < to; i++) result.append(read(i));
        return result.toString();
    }

    /**
     * @return the symbols from the head rightwards while they belong to the given alphabet
     */
    public String wordAtHead(Set<Character> alphabet) {
        StringBuilder result = new StringBuilder();
        int last = cells.isEmpty() ? head : Math.max(head, cells.lastKey());
        for (int i = head; i <= last && alphabet.contains(read(i)); i++)
            result.append(read(i));
        return result.toString();
    }

    /**
     * A snapshot of the machine in the given state on this tape.
     */
    public Configuration configuration(String state) {
        if (cells.isEmpty()) return new Configuration(state, "", "", blank);
        int first = Math.min(cells.firstKey(), head);
        int last = Math.max(cells.lastKey(), head);
        return new Configuration(state, contents(first, head), contents(head, last + 1), blank);
    }

    /**
     * A key that identifies state, head and tape contents. Two machines with the same
     * fingerprint behave the same from here on.
     */
    String fingerprint(String state) {
        StringBuilder result = new StringBuilder(state).append('\u0000').append(head);
        if (!cells.isEmpty()) {
            result.append('\u0000').append(cells.firstKey()).append('\u0000');
            for (Map.Entry<Integer, Character> entry : cells.entrySet()) {
                result.append(entry.getKey()).append('=').append(entry.getValue()).append(' ');
            }
        }
        return result.toString();
    }

    public String toString() {
        return configuration("?").toString();
    }
}
