package com.horstmann.tmgrader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One kind of coursework. Grading a group yields one outcome per test case, in test
 * order.
 */
public interface Assignment {
    String getName();

    List<TestCase> getTests();

    /**
     * Called once before any group is graded.
     */
    default void prepare() throws IOException {}

    List<TestOutcome> grade(SubmissionGroup group) throws IOException;

    /**
     * @return the same verdict for every test case
     */
    default List<TestOutcome> replicate(Verdict verdict) {
        List<TestOutcome> outcomes = new ArrayList<>();
        for (TestCase test : getTests()) outcomes.add(new TestOutcome(test.toString(), verdict));
        return outcomes;
    }
}
