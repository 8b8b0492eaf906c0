package com.horstmann.tmgrader;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Collects the outcomes of all groups. Safe for concurrent use.
 */
public class GradingResults {
    private final Map<Integer, List<TestOutcome>> outcomes = new ConcurrentSkipListMap<>();

    public void put(int group, List<TestOutcome> groupOutcomes) {
        outcomes.put(group, List.copyOf(groupOutcomes));
    }

    /**
     * @return the outcomes by group number, in ascending order
     */
    public Map<Integer, List<TestOutcome>> getOutcomes() {
        return outcomes;
    }

    public int getPassed(int group) {
        int passed = 0;
        for (TestOutcome outcome : outcomes.getOrDefault(group, List.of()))
            if (outcome.getVerdict().isPass()) passed++;
        return passed;
    }

    public void report(Report report) {
        for (Map.Entry<Integer, List<TestOutcome>> entry : outcomes.entrySet())
            for (TestOutcome outcome : entry.getValue())
                report.verdict(entry.getKey(), outcome.getTest(), outcome.getVerdict());
    }
}
