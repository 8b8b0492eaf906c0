package com.horstmann.tmgrader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Grades groups on a fixed pool of workers. A failure while grading one group becomes a
 * grader error for that group, except that an unavailable sandbox stops the whole run.
 */
public class GradingOrchestrator {
    private static final Logger logger = LoggerFactory.getLogger(GradingOrchestrator.class);

    private final int workers;

    public GradingOrchestrator(int workers) {
        this.workers = workers;
    }

    public GradingResults grade(Assignment assignment, List<SubmissionGroup> groups) throws IOException {
        assignment.prepare();
        GradingResults results = new GradingResults();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(workers, groups.size())));
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (SubmissionGroup group : groups)
                futures.add(executor.submit(() -> results.put(group.getId(), gradeGroup(assignment, group))));
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause();
                    if (cause instanceof SandboxUnavailableException) {
                        logger.error("Sandbox unavailable, stopping: {}", cause.getMessage());
                        executor.shutdownNow();
                        throw (SandboxUnavailableException) cause;
                    }
                    throw new GraderException("Unexpected failure", cause);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    executor.shutdownNow();
                    throw new GraderException("Interrupted", ex);
                }
            }
        } finally {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(1, TimeUnit.MINUTES))
                    logger.warn("Workers did not finish");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }
        return results;
    }

    private List<TestOutcome> gradeGroup(Assignment assignment, SubmissionGroup group) {
        logger.info("Grading {}", group);
        try {
            List<TestOutcome> outcomes = assignment.grade(group);
            logger.debug("Group {}: {}", group.getId(), outcomes);
            return outcomes;
        } catch (SandboxUnavailableException ex) {
            throw ex;
        } catch (IOException | RuntimeException ex) {
            logger.warn("Grader error in " + group, ex);
            String message = ex.getMessage() == null ? ex.getClass().getName() : ex.getMessage();
            return assignment.replicate(Verdict.graderError(message));
        }
    }
}
