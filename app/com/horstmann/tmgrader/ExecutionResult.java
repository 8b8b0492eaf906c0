package com.horstmann.tmgrader;

/**
 * What happened when a command ran in the sandbox.
 */
public class ExecutionResult {
    public enum Status { COMPLETED, TIMED_OUT, BUILD_FAILED }

    private final Status status;
    private final int exitCode;
    private final String stdout;
    private final boolean stdoutTruncated;
    private final String stderr;
    private final boolean stderrTruncated;
    private final long elapsedMillis;

    public ExecutionResult(Status status, int exitCode, String stdout, boolean stdoutTruncated,
            String stderr, boolean stderrTruncated, long elapsedMillis) {
        this.status = status;
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stdoutTruncated = stdoutTruncated;
        this.stderr = stderr;
        this.stderrTruncated = stderrTruncated;
        this.elapsedMillis = elapsedMillis;
    }

    public ExecutionResult(Status status, int exitCode, BoundedOutput stdout, BoundedOutput stderr, long elapsedMillis) {
        this(status, exitCode, stdout.toString(), stdout.isTruncated(), stderr.toString(), stderr.isTruncated(), elapsedMillis);
    }

    /**
     * Turns the result of a build command into a build failure.
     */
    public ExecutionResult asBuildFailure() {
        return new ExecutionResult(Status.BUILD_FAILED, exitCode, stdout, stdoutTruncated, stderr, stderrTruncated, elapsedMillis);
    }

    public Status getStatus() { return status; }

    /**
     * @return the exit code, or -1 if the process was killed
     */
    public int getExitCode() { return exitCode; }
    public String getStdout() { return stdout; }
    public boolean isStdoutTruncated() { return stdoutTruncated; }
    public String getStderr() { return stderr; }
    public boolean isStderrTruncated() { return stderrTruncated; }
    public long getElapsedMillis() { return elapsedMillis; }

    public boolean succeeded() {
        return status == Status.COMPLETED && exitCode == 0;
    }

    /**
     * The combined output of a failed command, for display.
     */
    public String log() {
        StringBuilder result = new StringBuilder();
        result.append(stderr);
        if (stderrTruncated) result.append("\n[stderr truncated]");
        if (!stdout.isEmpty()) {
            if (result.length() > 0 && result.charAt(result.length() - 1) != '\n') result.append("\n");
            result.append(stdout);
            if (stdoutTruncated) result.append("\n[stdout truncated]");
        }
        if (status != Status.TIMED_OUT && exitCode != 0) {
            if (result.length() > 0 && result.charAt(result.length() - 1) != '\n') result.append("\n");
            result.append("Exit code ").append(exitCode);
        }
        return result.toString();
    }

    public String toString() {
        return status + " exit=" + exitCode + " after " + elapsedMillis + " ms";
    }
}
