package com.horstmann.tmgrader;

/**
 * Either a valid machine or the first problem found in its description.
 */
public class ParseResult {
    public static class ParseError {
        public enum Kind { SYNTAX, AMBIGUOUS_TRANSITION, UNDECLARED_SYMBOL, MISSING_START }

        public final Kind kind;
        public final int line;
        public final String message;

        /**
         * @param line the 1-based line number, or 0 if the problem has no single location
         */
        public ParseError(Kind kind, int line, String message) {
            this.kind = kind;
            this.line = line;
            this.message = message;
        }

        public String toString() {
            return line > 0 ? "line " + line + ": " + message : message;
        }
    }

    private final TuringMachine machine;
    private final ParseError error;

    private ParseResult(TuringMachine machine, ParseError error) {
        this.machine = machine;
        this.error = error;
    }

    public static ParseResult of(TuringMachine machine) { return new ParseResult(machine, null); }

    public static ParseResult error(ParseError.Kind kind, int line, String message) {
        return new ParseResult(null, new ParseError(kind, line, message));
    }

    public boolean isValid() { return machine != null; }
    public TuringMachine getMachine() { return machine; }
    public ParseError getError() { return error; }

    public String toString() {
        return isValid() ? machine.toString() : error.toString();
    }
}
