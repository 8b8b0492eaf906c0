package com.horstmann.tmgrader;

import java.util.ArrayList;
import java.util.List;

/**
 * Compares the output of a program with the expected output, first exactly and then
 * after normalizing whitespace. Output that parses but differs is a format mismatch;
 * output that cannot be parsed at all is unparseable.
 */
public class OutputReconciler {
    private static final int MANY_MORE_LINES = 10;
        // If actual lines > expected + MANY_MORE_LINES, truncate actual output

    public Verdict reconcile(String actual, String expected, OutputSchema schema) {
        List<String> actualLines = Util.lines(actual);
        List<String> expectedLines = Util.lines(expected);
        List<Object> expectedValues = schema.parse(expectedLines);
        if (expectedValues == null) expectedValues = schema.parseLenient(normalize(expectedLines));
        if (expectedValues == null)
            throw new GraderException("Expected output does not follow " + schema + ":\n" + expected);

        List<Object> strict = schema.parse(actualLines);
        if (expectedValues.equals(strict)) return Verdict.pass();
        List<Object> lenient = schema.parseLenient(normalize(actualLines));
        if (expectedValues.equals(lenient)) return Verdict.pass();

        String diff = diff(normalize(expectedLines), normalize(actualLines));
        if (strict != null || lenient != null) return Verdict.formatMismatch(diff);
        return Verdict.unparseable(actual, diff);
    }

    /**
     * Trims lines, collapses whitespace runs and drops blank lines.
     */
    static List<String> normalize(List<String> lines) {
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            String normalized = line.replaceAll("\\s+", " ").trim();
            if (!normalized.isEmpty()) result.add(normalized);
        }
        return result;
    }

    /**
     * Lists matching lines once and differing lines as - expected and + actual.
     */
    static String diff(List<String> expected, List<String> actual) {
        List<String> result = new ArrayList<>();
        int i;
        for (i = 0; i < expected.size() && i < actual.size(); i++) {
            if (expected.get(i).equals(actual.get(i)))
                result.add("  " + expected.get(i));
            else {
                result.add("- " + expected.get(i));
                result.add("+ " + actual.get(i));
            }
        }
        while (i < expected.size()) {
            result.add("- " + expected.get(i));
            i++;
        }
        while (i < actual.size() && i < expected.size() + MANY_MORE_LINES) {
            result.add("+ " + actual.get(i));
            i++;
        }
        if (i < actual.size()) result.add("+ . . .");
        return String.join("\n", result);
    }
}
