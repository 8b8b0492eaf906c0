package com.horstmann.tmgrader;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs programs as plain child processes in a scratch copy of the submission. Timeouts
 * and output caps are enforced, but there is no memory or network isolation, so this
 * is only suitable for trusted code or hosts without Docker.
 */
public class LocalProcessRuntime implements SandboxRuntime {
    private static final Logger logger = LoggerFactory.getLogger(LocalProcessRuntime.class);
    private static final int DRAIN_MILLIS = 2000;

    private final GraderConfig config;

    public LocalProcessRuntime(GraderConfig config) {
        this.config = config;
    }

    @Override
    public void verify() {
        ExecutionResult result = run(List.of("sh", "-c", "true"), Path.of(System.getProperty("java.io.tmpdir")), null, 10000);
        if (!result.succeeded())
            throw new SandboxUnavailableException("Cannot run sh: " + result.log());
    }

    @Override
    public SandboxSession open(ExecutionPlan plan, Path dataDir) {
        try {
            Path scratch = Files.createTempDirectory("tmgrader");
            Path code = scratch.resolve("code");
            Path compiled = scratch.resolve("compiled");
            Files.createDirectories(compiled);
            for (Path p : Util.descendantFiles(plan.getRoot())) {
                Path target = code.resolve(p.toString());
                Files.createDirectories(target.getParent());
                Files.copy(plan.getRoot().resolve(p), target);
            }
            Files.createDirectories(code);
            Path data = dataDir == null ? scratch.resolve("data") : dataDir.toAbsolutePath();
            Files.createDirectories(data);
            return new Session(plan, scratch, code, compiled, data);
        } catch (IOException ex) {
            throw new SandboxUnavailableException("Cannot prepare scratch directory for " + plan, ex);
        }
    }

    @Override
    public void close() {
    }

    private class Session implements SandboxSession {
        private final ExecutionPlan plan;
        private final Path scratch;
        private final Path code;
        private final Path compiled;
        private final Path data;

        Session(ExecutionPlan plan, Path scratch, Path code, Path compiled, Path data) {
            this.plan = plan;
            this.scratch = scratch;
            this.code = code;
            this.compiled = compiled;
            this.data = data;
        }

        @Override
        public Map<String, String> variables() {
            return plan.variables(code.toString(), compiled.toString(), data.toString());
        }

        @Override
        public ExecutionResult exec(Phase phase, String command, String stdin, int timeoutMillis) {
            logger.debug("{} {}: {}", phase, plan.getEntrypoint(), command);
            return run(List.of("sh", "-c", command), phase == Phase.BUILD ? code : data, stdin, timeoutMillis);
        }

        @Override
        public void close() {
            try {
                Util.deleteDirectory(scratch);
            } catch (IOException ex) {
                logger.warn("Cannot delete " + scratch, ex);
            }
        }
    }

    private ExecutionResult run(List<String> command, Path dir, String stdin, int timeoutMillis) {
        int maxOutput = config.getMaxOutputBytes();
        BoundedOutput out = new BoundedOutput(maxOutput);
        BoundedOutput err = new BoundedOutput(maxOutput);
        long start = System.currentTimeMillis();
        Process process;
        try {
            process = new ProcessBuilder(command).directory(dir.toFile()).start();
        } catch (IOException ex) {
            throw new SandboxUnavailableException("Cannot start " + command, ex);
        }
        Thread outReader = drain(process.getInputStream(), out);
        Thread errReader = drain(process.getErrorStream(), err);
        Thread inWriter = new Thread(() -> {
            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) in.write(stdin.getBytes(StandardCharsets.UTF_8));
            } catch (IOException ex) {
                // The program exited without reading all of its input
                logger.debug("stdin closed early: {}", ex.getMessage());
            }
        });
        inWriter.setDaemon(true);
        inWriter.start();
        try {
            boolean completed = process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS);
            if (!completed) kill(process);
            outReader.join(DRAIN_MILLIS);
            errReader.join(DRAIN_MILLIS);
            long elapsed = System.currentTimeMillis() - start;
            if (!completed)
                return new ExecutionResult(ExecutionResult.Status.TIMED_OUT, -1, out, err, elapsed);
            return new ExecutionResult(ExecutionResult.Status.COMPLETED, process.exitValue(), out, err, elapsed);
        } catch (InterruptedException ex) {
            kill(process);
            Thread.currentThread().interrupt();
            throw new GraderException("Interrupted while running " + command, ex);
        }
    }

    private static void kill(Process process) {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        for (ProcessHandle handle : descendants)
            handle.destroyForcibly();
        process.destroyForcibly();
        try {
            process.waitFor(DRAIN_MILLIS, TimeUnit.MILLISECONDS);
            for (ProcessHandle handle : descendants)
                handle.onExit().get(DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } catch (Exception ex) {
            logger.warn("Process {} did not terminate: {}", process.pid(), ex.toString());
        }
    }

    private static Thread drain(InputStream in, BoundedOutput target) {
        Thread thread = new Thread(() -> {
            try (in) {
                target.drain(in);
            } catch (IOException ex) {
                // The stream is closed when the process is killed
                logger.debug("Output stream closed: {}", ex.getMessage());
            }
        });
        thread.setDaemon(true);
        thread.start();
        return thread;
    }
}
