package com.horstmann.tmgrader;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and runs programs in a sandbox, keeping build failures, runtime failures and
 * timeouts apart.
 */
public class SandboxRunner {
    private static final Logger logger = LoggerFactory.getLogger(SandboxRunner.class);

    private final SandboxRuntime runtime;
    private final GraderConfig config;

    public SandboxRunner(SandboxRuntime runtime, GraderConfig config) {
        this.runtime = runtime;
        this.config = config;
    }

    /**
     * Opens a sandbox session for the plan and runs the build command, if there is one.
     * The caller must close the returned program.
     * @param dataDir the directory to make available as {data}, or null
     */
    public PreparedProgram prepare(ExecutionPlan plan, Path dataDir) {
        SandboxSession session = runtime.open(plan, dataDir);
        try {
            Map<String, String> variables = session.variables();
            ExecutionResult build = null;
            if (plan.getBuildTemplate() != null) {
                String command = LanguageProfile.expand(plan.getBuildTemplate(), variables);
                int timeout = config.getBuildTimeoutMillis();
                build = session.exec(SandboxSession.Phase.BUILD, command, null, timeout);
                logger.debug("Build of {}: {}", plan, build);
                if (build.getStatus() == ExecutionResult.Status.TIMED_OUT)
                    build = new ExecutionResult(ExecutionResult.Status.BUILD_FAILED, -1, build.getStdout(),
                        build.isStdoutTruncated(), build.getStderr() + "\nBuild timed out after " + timeout + " ms",
                        build.isStderrTruncated(), build.getElapsedMillis());
                else if (!build.succeeded())
                    build = build.asBuildFailure();
            }
            return new PreparedProgram(plan, session, variables, build);
        } catch (RuntimeException ex) {
            session.close();
            throw ex;
        }
    }

    /**
     * Turns an unsuccessful execution into a verdict.
     * @return the verdict, or null if the program completed with exit code 0
     */
    public Verdict classify(ExecutionResult result) {
        switch (result.getStatus()) {
        case BUILD_FAILED:
            return Verdict.buildFailure(result.log());
        case TIMED_OUT:
            return Verdict.timeout(config.getRunTimeoutMillis());
        default:
            if (result.getExitCode() != 0) return Verdict.runtimeFailure(result.log());
            return null;
        }
    }

    public class PreparedProgram implements AutoCloseable {
        private final ExecutionPlan plan;
        private final SandboxSession session;
        private final Map<String, String> variables;
        private final ExecutionResult build;

        private PreparedProgram(ExecutionPlan plan, SandboxSession session, Map<String, String> variables,
                ExecutionResult build) {
            this.plan = plan;
            this.session = session;
            this.variables = variables;
            this.build = build;
        }

        /**
         * @return the BUILD_FAILED result, or null if the build succeeded or there was none
         */
        public ExecutionResult getBuildFailure() {
            return build != null && build.getStatus() == ExecutionResult.Status.BUILD_FAILED ? build : null;
        }

        /**
         * Runs the program. After a failed build, the program is not run and the build
         * failure is returned.
         * @param args the arguments to append to the run command
         * @param stdin the input, or null
         */
        public ExecutionResult run(List<String> args, String stdin) {
            if (getBuildFailure() != null) return build;
            StringBuilder command = new StringBuilder(LanguageProfile.expand(plan.getRunTemplate(), variables));
            for (String arg : args)
                command.append(" ").append(Util.shellQuote(arg));
            ExecutionResult result = session.exec(SandboxSession.Phase.RUN, command.toString(), stdin,
                config.getRunTimeoutMillis());
            logger.debug("Run of {} {}: {}", plan.getEntrypoint(), args, result);
            return result;
        }

        @Override
        public void close() {
            session.close();
        }
    }
}
