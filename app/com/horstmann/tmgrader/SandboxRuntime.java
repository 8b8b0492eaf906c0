package com.horstmann.tmgrader;

import java.nio.file.Path;

/**
 * The execution context for one grading run. It is acquired once when the run starts,
 * hands out one session per group, and is closed when the run ends.
 */
public interface SandboxRuntime extends AutoCloseable {
    /**
     * Checks that the runtime can be used.
     * @throws SandboxUnavailableException if it can't
     */
    void verify();

    /**
     * Sets up an isolated environment for one program.
     * @param plan the program to run
     * @param dataDir a directory made available read-only to the program as {data}
     * @throws SandboxUnavailableException if the environment can't be created
     */
    SandboxSession open(ExecutionPlan plan, Path dataDir);

    @Override
    void close();
}
