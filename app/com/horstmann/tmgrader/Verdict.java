package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The outcome of grading one test case of one group. Verdicts are values: two verdicts
 * with the same kind, detail and candidates are equal.
 */
public class Verdict {
    public enum Kind {
        PASS("Pass"),
        FORMAT_MISMATCH("Output mismatch"),
        UNPARSEABLE("Unparseable output"),
        BUILD_FAILURE("Build failure"),
        RUNTIME_FAILURE("Runtime failure"),
        TIMEOUT("Timeout"),
        AMBIGUOUS_ENTRYPOINT("Ambiguous entrypoint"),
        DISCOVERY_FAILURE("Nothing to grade"),
        INVALID_MACHINE("Invalid machine"),
        WRONG_RESULT("Wrong result"),
        STEP_LIMIT_EXCEEDED("Step limit exceeded"),
        CYCLE_DETECTED("Cycle detected"),
        GRADER_ERROR("Grader error");

        private final String caption;

        Kind(String caption) { this.caption = caption; }

        public String getCaption() { return caption; }
    }

    private final Kind kind;
    private final String detail;
    private final List<Path> candidates;

    private Verdict(Kind kind, String detail, List<Path> candidates) {
        this.kind = kind;
        this.detail = detail == null ? "" : detail;
        this.candidates = List.copyOf(candidates);
    }

    private Verdict(Kind kind, String detail) {
        this(kind, detail, List.of());
    }

    public static Verdict pass() { return new Verdict(Kind.PASS, null); }
    public static Verdict formatMismatch(String diff) { return new Verdict(Kind.FORMAT_MISMATCH, diff); }

    /**
     * @param raw the actual output, verbatim
     * @param diff a line diff against the expected output
     */
    public static Verdict unparseable(String raw, String diff) {
        return new Verdict(Kind.UNPARSEABLE, raw + "\n" + diff);
    }

    public static Verdict buildFailure(String log) { return new Verdict(Kind.BUILD_FAILURE, log); }
    public static Verdict runtimeFailure(String log) { return new Verdict(Kind.RUNTIME_FAILURE, log); }
    public static Verdict timeout(int millis) { return new Verdict(Kind.TIMEOUT, "Killed after " + millis + " ms"); }

    public static Verdict ambiguousEntrypoint(List<Path> candidates) {
        List<Path> sorted = new ArrayList<>(candidates);
        sorted.sort(null);
        return new Verdict(Kind.AMBIGUOUS_ENTRYPOINT, "Candidates: " + Util.join(sorted, ", "), sorted);
    }

    public static Verdict discoveryFailure(String reason) { return new Verdict(Kind.DISCOVERY_FAILURE, reason); }
    public static Verdict invalidMachine(String error) { return new Verdict(Kind.INVALID_MACHINE, error); }
    public static Verdict wrongResult(String diff) { return new Verdict(Kind.WRONG_RESULT, diff); }
    public static Verdict stepLimitExceeded(String configuration) { return new Verdict(Kind.STEP_LIMIT_EXCEEDED, configuration); }
    public static Verdict cycleDetected(String configuration) { return new Verdict(Kind.CYCLE_DETECTED, configuration); }
    public static Verdict graderError(String message) { return new Verdict(Kind.GRADER_ERROR, message); }

    public Kind getKind() { return kind; }
    public String getDetail() { return detail; }

    /**
     * @return the candidate entry points of an AMBIGUOUS_ENTRYPOINT verdict, sorted;
     * empty otherwise
     */
    public List<Path> getCandidates() { return candidates; }

    public boolean isPass() { return kind == Kind.PASS; }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;
        Verdict that = (Verdict) other;
        return kind == that.kind && detail.equals(that.detail) && candidates.equals(that.candidates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, detail, candidates);
    }

    @Override
    public String toString() {
        return detail.isEmpty() ? kind.getCaption() : kind.getCaption() + ": " + detail;
    }
}
