package io.serverhive.docker;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Synchronous access to the container engine of the local node.
 * <p>
 * Implementations translate engine failures into the {@link ContainerRuntimeException} hierarchy so callers
 * never have to look at error text: a missing container surfaces as {@link ContainerNotFoundException}, a start
 * that fails because the attached network vanished as {@link NetworkNotFoundException}, and an unreachable
 * engine as {@link DockerDaemonUnavailableException}.
 */
public interface ContainerRuntimeGateway {

    /**
     * @throws ContainerNotFoundException when no container matches {@code containerRef} (id or name)
     */
    ContainerState inspect(String containerRef);

    /**
     * Creates the container without starting it and returns its id.
     */
    String create(ContainerSpec spec);

    /**
     * Starts the container; starting a running container is a no-op.
     *
     * @throws NetworkNotFoundException when a network the container is attached to no longer exists
     */
    void start(String containerId);

    /**
     * Stops the container, waiting up to {@code timeout} before the engine kills it. Stopping a stopped
     * container is a no-op.
     */
    void stop(String containerId, Duration timeout);

    void restart(String containerId, Duration timeout);

    void remove(String containerId, boolean force);

    List<ContainerSummary> list(Map<String, String> labelFilter);

    /**
     * Streams log frames to {@code sink}, blocking until the stream ends. With {@link LogOptions#follow()} the
     * stream ends when the container stops or the calling thread is interrupted.
     */
    void logs(String containerId, LogOptions options, LogSink sink);

    /**
     * Collects the last {@code lines} lines of combined output as text.
     */
    default String tailLogs(String containerId, int lines) {
        StringBuilder out = new StringBuilder();
        logs(containerId, LogOptions.tail(lines),
            (stream, payload) -> out.append(new String(payload, StandardCharsets.UTF_8)));
        return out.toString();
    }

    /**
     * Writes {@code payload} to the container's stdin through a dedicated attach that is bounded by
     * {@code timeout}, independent of any caller deadline.
     */
    void attachStdin(String containerId, byte[] payload, Duration timeout);

    /**
     * Networks whose name equals {@code name} exactly.
     */
    List<NetworkSummary> listNetworks(String name);

    /**
     * Creates a network and returns its id. A concurrent creation under the same name is tolerated and
     * yields the existing network's id.
     */
    String createNetwork(String name, String driver, Map<String, String> labels);

    boolean imageExists(String image);

    /**
     * Pulls {@code image}, giving up after {@code timeout} regardless of caller cancellation.
     */
    void pullImage(String image, Duration timeout);

    EngineInfo info();

    /**
     * Lists swarm nodes; only valid on a swarm manager.
     */
    List<SwarmNodeInfo> listSwarmNodes();
}
