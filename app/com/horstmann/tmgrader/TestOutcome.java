package com.horstmann.tmgrader;

import java.util.Objects;

public class TestOutcome {
    private final String test;
    private final Verdict verdict;

    public TestOutcome(String test, Verdict verdict) {
        this.test = test;
        this.verdict = verdict;
    }

    public String getTest() { return test; }
    public Verdict getVerdict() { return verdict; }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof TestOutcome)) return false;
        TestOutcome that = (TestOutcome) other;
        return test.equals(that.test) && verdict.equals(that.verdict);
    }

    @Override
    public int hashCode() {
        return Objects.hash(test, verdict);
    }

    public String toString() {
        return test + ": " + verdict;
    }
}
