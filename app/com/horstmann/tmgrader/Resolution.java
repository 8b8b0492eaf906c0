package com.horstmann.tmgrader;

/**
 * The result of entry point resolution: either a plan or the verdict explaining why
 * there is none.
 */
public class Resolution {
    private final ExecutionPlan plan;
    private final Verdict failure;

    private Resolution(ExecutionPlan plan, Verdict failure) {
        this.plan = plan;
        this.failure = failure;
    }

    public static Resolution of(ExecutionPlan plan) { return new Resolution(plan, null); }
    public static Resolution failed(Verdict failure) { return new Resolution(null, failure); }

    public boolean isResolved() { return plan != null; }

    /**
     * @return the plan, or null if resolution failed
     */
    public ExecutionPlan getPlan() { return plan; }

    /**
     * @return a DISCOVERY_FAILURE or AMBIGUOUS_ENTRYPOINT verdict, or null if resolved
     */
    public Verdict getFailure() { return failure; }

    public String toString() {
        return isResolved() ? plan.toString() : failure.toString();
    }
}
