package com.horstmann.tmgrader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.ExecStartCmd;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AccessMode;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.Volume;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;

/**
 * Runs each submission in its own Docker container. The submission is mounted read-only
 * at /code, the test data read-only at /data, and build output goes to a tmpfs at
 * /compiled. Containers have no network, a memory cap and a process cap.
 */
public class DockerRuntime implements SandboxRuntime {
    private static final Logger logger = LoggerFactory.getLogger(DockerRuntime.class);
    private static final String CODE = "/code";
    private static final String COMPILED = "/compiled";
    private static final String DATA = "/data";
    private static final int KILL_MILLIS = 5000;
    static final int EXIT_POLLS = 50;
    private static final int EXIT_POLL_MILLIS = 20;

    private final GraderConfig config;
    private final DockerClient client;
    private final Set<String> pulledImages = ConcurrentHashMap.newKeySet();

    public DockerRuntime(GraderConfig config) {
        this(config, createClient(config));
    }

    DockerRuntime(GraderConfig config, DockerClient client) {
        this.config = config;
        this.client = client;
    }

    private static DockerClient createClient(GraderConfig config) {
        DefaultDockerClientConfig.Builder builder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (!config.getDockerHost().isEmpty())
            builder.withDockerHost(config.getDockerHost());
        DockerClientConfig clientConfig = builder.build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
            .dockerHost(clientConfig.getDockerHost())
            .sslConfig(clientConfig.getSSLConfig())
            .connectionTimeout(Duration.ofSeconds(30))
            .responseTimeout(Duration.ofMinutes(10))
            .build();
        return DockerClientImpl.getInstance(clientConfig, httpClient);
    }

    @Override
    public void verify() {
        try {
            client.pingCmd().exec();
        } catch (RuntimeException ex) {
            throw new SandboxUnavailableException(
                "Could not connect to the Docker daemon. Make sure Docker is installed and running.", ex);
        }
    }

    @Override
    public SandboxSession open(ExecutionPlan plan, Path dataDir) {
        String image = plan.getLanguage().getImage();
        try {
            ensureImage(image);
            List<Bind> binds = new ArrayList<>();
            binds.add(new Bind(plan.getRoot().toAbsolutePath().toString(), new Volume(CODE), AccessMode.ro));
            if (dataDir != null)
                binds.add(new Bind(dataDir.toAbsolutePath().toString(), new Volume(DATA), AccessMode.ro));
            HostConfig hostConfig = HostConfig.newHostConfig()
                .withBinds(binds)
                .withMemory(config.getMemoryBytes())
                .withMemorySwap(config.getMemoryBytes())
                .withPidsLimit(config.getPidsLimit())
                .withNetworkMode("none")
                .withTmpFs(Map.of(COMPILED, "rw,exec,size=256m"));
            CreateContainerResponse container = client.createContainerCmd(image)
                .withCmd("sleep", "infinity")
                .withWorkingDir(CODE)
                .withNetworkDisabled(true)
                .withHostConfig(hostConfig)
                .exec();
            try {
                client.startContainerCmd(container.getId()).exec();
            } catch (DockerException ex) {
                remove(container.getId());
                throw ex;
            }
            logger.debug("Started container {} for {}", container.getId(), plan);
            return new Session(plan, container.getId(), dataDir != null);
        } catch (DockerException ex) {
            throw new SandboxUnavailableException("Cannot create a container from " + image, ex);
        }
    }

    private void ensureImage(String image) {
        if (pulledImages.contains(image)) return;
        synchronized (pulledImages) {
            if (pulledImages.contains(image)) return;
            try {
                client.inspectImageCmd(image).exec();
            } catch (NotFoundException ex) {
                logger.info("Pulling image {}", image);
                try {
                    client.pullImageCmd(image).start().awaitCompletion();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new GraderException("Interrupted while pulling " + image, e);
                }
            }
            pulledImages.add(image);
        }
    }

    private void remove(String containerId) {
        try {
            client.removeContainerCmd(containerId).withForce(true).exec();
        } catch (DockerException ex) {
            logger.warn("Cannot remove container " + containerId, ex);
        }
    }

    /**
     * Inspects an exec whose output stream has ended. Docker may still report it as
     * running for a short while, and only then has its exit code.
     */
    InspectExecResponse awaitExit(String execId) throws InterruptedException {
        InspectExecResponse inspection = client.inspectExecCmd(execId).exec();
        for (int i = 0; Boolean.TRUE.equals(inspection.isRunning()) && i < EXIT_POLLS; i++) {
            Thread.sleep(EXIT_POLL_MILLIS);
            inspection = client.inspectExecCmd(execId).exec();
        }
        return inspection;
    }

    @Override
    public void close() {
        try {
            client.close();
        } catch (IOException ex) {
            logger.warn("Cannot close Docker client", ex);
        }
    }

    private class Session implements SandboxSession {
        private final ExecutionPlan plan;
        private final String containerId;
        private final boolean hasData;

        Session(ExecutionPlan plan, String containerId, boolean hasData) {
            this.plan = plan;
            this.containerId = containerId;
            this.hasData = hasData;
        }

        @Override
        public Map<String, String> variables() {
            return plan.variables(CODE, COMPILED, DATA);
        }

        @Override
        public ExecutionResult exec(Phase phase, String command, String stdin, int timeoutMillis) {
            logger.debug("{} in {}: {}", phase, containerId, command);
            int maxOutput = config.getMaxOutputBytes();
            BoundedOutput out = new BoundedOutput(maxOutput);
            BoundedOutput err = new BoundedOutput(maxOutput);
            String workDir = phase == Phase.RUN && hasData ? DATA : CODE;
            try {
                return execute(command, stdin, timeoutMillis, workDir, out, err);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new GraderException("Interrupted while running " + command, ex);
            } catch (DockerException ex) {
                throw new SandboxUnavailableException("Lost connection to container " + containerId, ex);
            }
        }

        private ExecutionResult execute(String command, String stdin, int timeoutMillis, String workDir,
                BoundedOutput out, BoundedOutput err) throws InterruptedException {
            ExecCreateCmdResponse exec = client.execCreateCmd(containerId)
                .withCmd("sh", "-c", command)
                .withWorkingDir(workDir)
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withAttachStdin(stdin != null)
                .exec();
            long start = System.currentTimeMillis();
            ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<Frame>() {
                @Override
                public void onNext(Frame frame) {
                    if (frame.getStreamType() == StreamType.STDERR)
                        err.write(frame.getPayload(), 0, frame.getPayload().length);
                    else
                        out.write(frame.getPayload(), 0, frame.getPayload().length);
                }
            };
            ExecStartCmd startCmd = client.execStartCmd(exec.getId());
            if (stdin != null)
                startCmd.withStdIn(new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)));
            boolean completed = startCmd.exec(callback).awaitCompletion(timeoutMillis, TimeUnit.MILLISECONDS);
            long elapsed = System.currentTimeMillis() - start;
            if (!completed) {
                killAll();
                closeQuietly(callback);
                return new ExecutionResult(ExecutionResult.Status.TIMED_OUT, -1, out, err, elapsed);
            }
            InspectExecResponse inspection = awaitExit(exec.getId());
            Long exitCode = inspection.getExitCodeLong();
            return new ExecutionResult(ExecutionResult.Status.COMPLETED, exitCode == null ? -1 : exitCode.intValue(),
                out, err, elapsed);
        }

        private void closeQuietly(ResultCallback.Adapter<Frame> callback) {
            try {
                callback.close();
            } catch (IOException ex) {
                logger.debug("Cannot close exec stream: {}", ex.getMessage());
            }
        }

        /**
         * Kills every process in the container except the idle init process.
         */
        private void killAll() {
            try {
                ExecCreateCmdResponse kill = client.execCreateCmd(containerId)
                    .withCmd("sh", "-c", "kill -9 -1")
                    .exec();
                client.execStartCmd(kill.getId()).start().awaitCompletion(KILL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
        }

        @Override
        public void close() {
            remove(containerId);
        }
    }
}
