package com.horstmann.tmgrader;

import java.util.Map;

/**
 * An isolated environment holding one submission. Closing it kills anything still
 * running and discards the environment.
 */
public interface SandboxSession extends AutoCloseable {
    enum Phase { BUILD, RUN }

    /**
     * @return the values of {code}, {compiled}, {data} and the other template variables
     * as seen inside this session
     */
    Map<String, String> variables();

    /**
     * Runs a shell command. The build phase runs in the submission directory, the run
     * phase in the data directory.
     * @param command the command, with all variables expanded
     * @param stdin the input to supply, or null for none
     * @param timeoutMillis the wall clock limit
     * @return a COMPLETED or TIMED_OUT result
     */
    ExecutionResult exec(Phase phase, String command, String stdin, int timeoutMillis);

    @Override
    void close();
}
