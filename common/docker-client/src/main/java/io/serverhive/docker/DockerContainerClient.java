package io.serverhive.docker;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.InspectContainerResponse;
import com.github.dockerjava.api.command.LogContainerCmd;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.ConflictException;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.Bind;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Info;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.api.model.RestartPolicy;
import com.github.dockerjava.api.model.StreamType;
import com.github.dockerjava.api.model.SwarmInfo;
import com.github.dockerjava.api.model.SwarmNode;
import com.github.dockerjava.api.model.Volume;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link ContainerRuntimeGateway} backed by docker-java.
 */
public class DockerContainerClient implements ContainerRuntimeGateway {
    private static final Logger log = LoggerFactory.getLogger(DockerContainerClient.class);
    private static final String DOCKER_HINT =
        "Ensure Docker is installed, running, and that the process can access the Docker socket "
            + "(for example /var/run/docker.sock) or an explicit DOCKER_HOST.";
    private static final Duration STDIN_FLUSH_GRACE = Duration.ofMillis(500);

    private final DockerClient dockerClient;

    public DockerContainerClient(DockerClient dockerClient) {
        this.dockerClient = Objects.requireNonNull(dockerClient, "dockerClient");
    }

    @Override
    public ContainerState inspect(String containerRef) {
        return callDocker("inspect container " + containerRef, () -> {
            try {
                return toState(dockerClient.inspectContainerCmd(containerRef).exec());
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerRef, e);
            }
        });
    }

    @Override
    public String create(ContainerSpec spec) {
        return callDocker("create container " + spec.name(), () -> {
            ExposedPort exposed = ExposedPort.tcp(spec.port());
            Ports bindings = new Ports();
            bindings.bind(exposed, Ports.Binding.bindIpAndPort("0.0.0.0", spec.port()));
            HostConfig hostConfig = HostConfig.newHostConfig()
                .withPortBindings(bindings)
                .withBinds(new Bind(spec.hostDataPath(), new Volume(spec.containerDataPath())))
                .withRestartPolicy(RestartPolicy.unlessStoppedRestart())
                .withNetworkMode(spec.networkName())
                .withPrivileged(false);
            if (spec.memoryBytes() > 0) {
                hostConfig = hostConfig.withMemory(spec.memoryBytes());
            }
            if (spec.cpuShares() > 0) {
                hostConfig = hostConfig.withCpuShares(spec.cpuShares());
            }
            CreateContainerCmd createCmd = dockerClient.createContainerCmd(spec.image())
                .withName(spec.name())
                .withEnv(toEnvArray(spec.env()))
                .withLabels(spec.labels())
                .withExposedPorts(exposed)
                .withStdinOpen(true)
                .withTty(true)
                .withHostConfig(hostConfig);
            if (spec.hasStartCommand()) {
                createCmd = createCmd.withEntrypoint("sh", "-c").withCmd("exec " + spec.startCommand());
            }
            CreateContainerResponse response = createCmd.exec();
            return response.getId();
        });
    }

    @Override
    public void start(String containerId) {
        callDocker("start container " + containerId, () -> {
            try {
                dockerClient.startContainerCmd(containerId).exec();
            } catch (NotModifiedException e) {
                log.debug("container {} already running", containerId);
            } catch (DockerException e) {
                if (mentionsMissingNetwork(e)) {
                    throw new NetworkNotFoundException(containerId, e);
                }
                if (e instanceof NotFoundException) {
                    throw new ContainerNotFoundException(containerId, e);
                }
                throw e;
            }
        });
    }

    @Override
    public void stop(String containerId, Duration timeout) {
        callDocker("stop container " + containerId, () -> {
            try {
                dockerClient.stopContainerCmd(containerId).withTimeout(toSeconds(timeout)).exec();
            } catch (NotModifiedException e) {
                log.debug("container {} already stopped", containerId);
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerId, e);
            }
        });
    }

    @Override
    public void restart(String containerId, Duration timeout) {
        callDocker("restart container " + containerId, () -> {
            try {
                dockerClient.restartContainerCmd(containerId).withTimeout(toSeconds(timeout)).exec();
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerId, e);
            }
        });
    }

    @Override
    public void remove(String containerId, boolean force) {
        callDocker("remove container " + containerId, () -> {
            try {
                dockerClient.removeContainerCmd(containerId).withForce(force).withRemoveVolumes(false).exec();
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerId, e);
            }
        });
    }

    @Override
    public List<ContainerSummary> list(Map<String, String> labelFilter) {
        return callDocker("list containers", () -> {
            List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(labelFilter == null ? Map.of() : labelFilter)
                .exec();
            List<ContainerSummary> result = new ArrayList<>(containers.size());
            for (Container container : containers) {
                List<String> names = container.getNames() == null
                    ? List.of()
                    : Arrays.stream(container.getNames()).map(DockerContainerClient::stripSlash).toList();
                result.add(new ContainerSummary(container.getId(), names, container.getState(), container.getLabels()));
            }
            return result;
        });
    }

    @Override
    public void logs(String containerId, LogOptions options, LogSink sink) {
        Objects.requireNonNull(sink, "sink");
        LogOptions window = options == null ? LogOptions.all() : options;
        callDocker("read logs of container " + containerId, () -> {
            LogContainerCmd cmd = dockerClient.logContainerCmd(containerId)
                .withStdOut(true)
                .withStdErr(true)
                .withFollowStream(window.follow())
                .withTimestamps(window.until() != null);
            cmd = window.tail() != null ? cmd.withTail(window.tail()) : cmd.withTailAll();
            if (window.since() != null) {
                cmd = cmd.withSince((int) window.since().getEpochSecond());
            }
            ResultCallback.Adapter<Frame> callback = new ResultCallback.Adapter<>() {
                @Override
                public void onNext(Frame frame) {
                    byte[] payload = window.until() == null
                        ? frame.getPayload()
                        : clipAfter(frame.getPayload(), window.until());
                    if (payload.length > 0) {
                        sink.accept(toLogStream(frame.getStreamType()), payload);
                    }
                }
            };
            try {
                cmd.exec(callback).awaitCompletion();
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerId, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException("interrupted while reading logs of container " + containerId, e);
            }
        });
    }

    @Override
    public void attachStdin(String containerId, byte[] payload, Duration timeout) {
        callDocker("attach to container " + containerId, () -> {
            ResultCallback.Adapter<Frame> callback;
            try {
                callback = dockerClient.attachContainerCmd(containerId)
                    .withStdIn(new ByteArrayInputStream(payload))
                    .withFollowStream(true)
                    .withStdOut(false)
                    .withStdErr(false)
                    .exec(new ResultCallback.Adapter<>());
            } catch (NotFoundException e) {
                throw new ContainerNotFoundException(containerId, e);
            }
            try {
                if (!callback.awaitStarted(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    throw new ContainerRuntimeException(
                        "attach to container " + containerId + " did not start within " + timeout);
                }
                // stdin is copied asynchronously once the stream is up
                callback.awaitCompletion(Math.min(STDIN_FLUSH_GRACE.toMillis(), timeout.toMillis()),
                    TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ContainerRuntimeException("interrupted while attached to container " + containerId, e);
            } finally {
                closeQuietly(callback, containerId);
            }
        });
    }

    @Override
    public List<NetworkSummary> listNetworks(String name) {
        return callDocker("list networks", () -> {
            List<Network> networks = dockerClient.listNetworksCmd().withNameFilter(name).exec();
            // the engine matches names by substring
            return networks.stream()
                .filter(network -> name.equals(network.getName()))
                .map(network -> new NetworkSummary(network.getId(), network.getName(), network.getDriver(),
                    network.getLabels()))
                .toList();
        });
    }

    @Override
    public String createNetwork(String name, String driver, Map<String, String> labels) {
        return callDocker("create network " + name, () -> {
            try {
                return dockerClient.createNetworkCmd()
                    .withName(name)
                    .withDriver(driver)
                    .withLabels(labels)
                    .withCheckDuplicate(true)
                    .exec()
                    .getId();
            } catch (ConflictException e) {
                log.debug("network {} created concurrently", name);
                return listNetworks(name).stream()
                    .findFirst()
                    .map(NetworkSummary::id)
                    .orElseThrow(() -> e);
            }
        });
    }

    @Override
    public boolean imageExists(String image) {
        return callDocker("inspect image " + image, () -> {
            try {
                dockerClient.inspectImageCmd(image).exec();
                return true;
            } catch (NotFoundException e) {
                return false;
            }
        });
    }

    @Override
    public void pullImage(String image, Duration timeout) {
        callDocker("pull image " + image, () -> {
            PullImageResultCallback callback = new PullImageResultCallback() {
                @Override
                public void onNext(PullResponseItem item) {
                    if (item.getStatus() != null) {
                        if (item.getProgress() != null) {
                            log.debug("pull {}: {} {}", image, item.getStatus(), item.getProgress());
                        } else {
                            log.info("pull {}: {}", image, item.getStatus());
                        }
                    }
                    super.onNext(item);
                }
            };
            String[] reference = splitReference(image);
            try {
                boolean completed = reference[1] == null
                    ? dockerClient.pullImageCmd(reference[0]).exec(callback)
                        .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : dockerClient.pullImageCmd(reference[0]).withTag(reference[1]).exec(callback)
                        .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!completed) {
                    closeQuietly(callback, image);
                    throw new ContainerRuntimeException("pull of image " + image + " timed out after " + timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                closeQuietly(callback, image);
                throw new ContainerRuntimeException("interrupted while pulling image " + image, e);
            }
        });
    }

    @Override
    public EngineInfo info() {
        return callDocker("read engine info", () -> {
            Info info = dockerClient.infoCmd().exec();
            SwarmInfo swarm = info.getSwarm();
            String nodeId = swarm == null ? null : swarm.getNodeID();
            // a manager is an active local node with control available
            boolean manager = swarm != null
                && swarm.getLocalNodeState() != null
                && "active".equalsIgnoreCase(swarm.getLocalNodeState().name())
                && Boolean.TRUE.equals(swarm.getControlAvailable());
            int cpus = info.getNCPU() == null ? 0 : info.getNCPU();
            long memory = info.getMemTotal() == null ? 0L : info.getMemTotal();
            return new EngineInfo(info.getName(), cpus, memory, nodeId, manager);
        });
    }

    @Override
    public List<SwarmNodeInfo> listSwarmNodes() {
        return callDocker("list swarm nodes", () -> {
            List<SwarmNode> nodes = dockerClient.listSwarmNodesCmd().exec();
            List<SwarmNodeInfo> result = new ArrayList<>(nodes.size());
            for (SwarmNode node : nodes) {
                String hostname = null;
                long nanoCpus = 0L;
                long memory = 0L;
                if (node.getDescription() != null) {
                    hostname = node.getDescription().getHostname();
                    if (node.getDescription().getResources() != null) {
                        nanoCpus = orZero(node.getDescription().getResources().getNanoCPUs());
                        memory = orZero(node.getDescription().getResources().getMemoryBytes());
                    }
                }
                String role = null;
                String availability = null;
                Map<String, String> labels = Map.of();
                if (node.getSpec() != null) {
                    role = lowerName(node.getSpec().getRole());
                    availability = lowerName(node.getSpec().getAvailability());
                    labels = node.getSpec().getLabels();
                }
                String state = null;
                String address = null;
                if (node.getStatus() != null) {
                    state = lowerName(node.getStatus().getState());
                    address = node.getStatus().getAddress();
                }
                result.add(new SwarmNodeInfo(node.getId(), hostname, address, role, availability, state, nanoCpus,
                    memory, labels));
            }
            return result;
        });
    }

    static String[] splitReference(String image) {
        if (image.contains("@")) {
            return new String[] {image, null};
        }
        int colon = image.lastIndexOf(':');
        int slash = image.lastIndexOf('/');
        if (colon > slash) {
            return new String[] {image.substring(0, colon), image.substring(colon + 1)};
        }
        return new String[] {image, "latest"};
    }

    static byte[] clipAfter(byte[] payload, Instant until) {
        String text = new String(payload, StandardCharsets.UTF_8);
        StringBuilder kept = new StringBuilder(text.length());
        for (String line : text.split("(?<=\n)")) {
            int space = line.indexOf(' ');
            if (space <= 0) {
                kept.append(line);
                continue;
            }
            try {
                Instant stamp = Instant.parse(line.substring(0, space));
                if (!stamp.isAfter(until)) {
                    kept.append(line, space + 1, line.length());
                }
            } catch (DateTimeParseException e) {
                kept.append(line);
            }
        }
        return kept.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static ContainerState toState(InspectContainerResponse response) {
        boolean running = response.getState() != null && Boolean.TRUE.equals(response.getState().getRunning());
        long exitCode = response.getState() == null ? 0L : orZero(response.getState().getExitCodeLong());
        Map<String, String> labels = response.getConfig() == null ? Map.of() : response.getConfig().getLabels();
        List<String> binds = new ArrayList<>();
        if (response.getHostConfig() != null && response.getHostConfig().getBinds() != null) {
            for (Bind bind : response.getHostConfig().getBinds()) {
                binds.add(bind.getPath() + ":" + bind.getVolume().getPath());
            }
        }
        return new ContainerState(response.getId(), stripSlash(response.getName()), running, exitCode, labels, binds);
    }

    private static LogStream toLogStream(StreamType type) {
        if (type == StreamType.STDERR) {
            return LogStream.STDERR;
        }
        if (type == StreamType.STDOUT) {
            return LogStream.STDOUT;
        }
        return LogStream.RAW;
    }

    private static String stripSlash(String name) {
        return name != null && name.startsWith("/") ? name.substring(1) : name;
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }

    private static String lowerName(Enum<?> value) {
        return value == null ? null : value.name().toLowerCase(Locale.ROOT);
    }

    private static String[] toEnvArray(Map<String, String> env) {
        return env.entrySet().stream()
            .map(e -> e.getKey() + "=" + e.getValue())
            .toArray(String[]::new);
    }

    private static void closeQuietly(ResultCallback<?> callback, String ref) {
        try {
            callback.close();
        } catch (IOException e) {
            log.debug("failed to close docker stream for {}: {}", ref, e.getMessage());
        }
    }

    private boolean mentionsMissingNetwork(DockerException e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.contains("network") && lower.contains("not found");
    }

    private int toSeconds(Duration timeout) {
        return (int) Math.max(0L, timeout.toSeconds());
    }

    private <T> T callDocker(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private void callDocker(String action, Runnable runnable) {
        try {
            runnable.run();
        } catch (RuntimeException e) {
            throw translate(action, e);
        }
    }

    private RuntimeException translate(String action, RuntimeException e) {
        if (e instanceof ContainerRuntimeException) {
            return e;
        }
        if (isDockerUnavailable(e)) {
            return new DockerDaemonUnavailableException(
                "Unable to " + action + " because the Docker daemon is unavailable. " + DOCKER_HINT,
                e);
        }
        return new ContainerRuntimeException("Unable to " + action + ": " + e.getMessage(), e);
    }

    private boolean isDockerUnavailable(Throwable throwable) {
        for (Throwable t = throwable; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                || t instanceof NoRouteToHostException
                || t instanceof SocketTimeoutException
                || t instanceof UnknownHostException
                || t instanceof FileNotFoundException
                || t instanceof NoSuchFileException
                || (t instanceof IOException && messageContains(t, "No such file or directory"))) {
                return true;
            }
            if ("com.sun.jna.LastErrorException".equals(t.getClass().getName())
                && messageContains(t, "No such file or directory")) {
                return true;
            }
            if (messageContains(t, "permission denied") && messageContains(t, "docker")) {
                return true;
            }
        }
        return false;
    }

    private boolean messageContains(Throwable t, String needle) {
        String message = t.getMessage();
        return message != null && message.toLowerCase(Locale.ROOT)
            .contains(needle.toLowerCase(Locale.ROOT));
    }
}
