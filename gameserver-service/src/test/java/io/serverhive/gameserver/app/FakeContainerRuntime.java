package io.serverhive.gameserver.app;

import io.serverhive.docker.ContainerNotFoundException;
import io.serverhive.docker.ContainerRuntimeException;
import io.serverhive.docker.ContainerRuntimeGateway;
import io.serverhive.docker.ContainerSpec;
import io.serverhive.docker.ContainerState;
import io.serverhive.docker.ContainerSummary;
import io.serverhive.docker.EngineInfo;
import io.serverhive.docker.LogOptions;
import io.serverhive.docker.LogSink;
import io.serverhive.docker.LogStream;
import io.serverhive.docker.NetworkNotFoundException;
import io.serverhive.docker.NetworkSummary;
import io.serverhive.docker.SwarmNodeInfo;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Engine double that keeps containers and networks in memory. Images listed in {@link #crashOnStart} exit
 * with the given code as soon as they are started.
 */
class FakeContainerRuntime implements ContainerRuntimeGateway {

    final Map<String, Container> containers = new LinkedHashMap<>();
    final Map<String, String> networks = new LinkedHashMap<>();
    final Set<String> images = new HashSet<>();
    final List<String> pulled = new ArrayList<>();
    final Map<String, Long> crashOnStart = new HashMap<>();
    final Set<String> failing = new HashSet<>();
    private int sequence;

    static final class Container {
        final String id;
        final ContainerSpec spec;
        final Map<String, String> labels;
        boolean running;
        long exitCode;
        String output = "";
        final List<String> stdin = new ArrayList<>();
        int starts;
        int restarts;

        Container(String id, ContainerSpec spec, Map<String, String> labels) {
            this.id = id;
            this.spec = spec;
            this.labels = labels;
        }
    }

    /**
     * Registers a container that was not created through this runtime, for example by an operator.
     */
    Container addForeign(String name, boolean running, Map<String, String> labels) {
        ContainerSpec spec = new ContainerSpec(name, "foreign:latest", Map.of(), labels, 1, "/tmp", "/data", 0, 0,
            "bridge", null);
        Container container = new Container(nextId(), spec, labels);
        container.running = running;
        containers.put(container.id, container);
        return container;
    }

    Container byName(String name) {
        return containers.values().stream().filter(c -> c.spec.name().equals(name)).findFirst().orElse(null);
    }

    void vanish(String containerId) {
        containers.remove(containerId);
    }

    void exit(String containerId, long exitCode) {
        Container container = containers.get(containerId);
        container.running = false;
        container.exitCode = exitCode;
    }

    @Override
    public ContainerState inspect(String containerRef) {
        check("inspect");
        Container container = resolve(containerRef);
        return new ContainerState(container.id, container.spec.name(), container.running, container.exitCode,
            container.labels, List.of(container.spec.bindMount()));
    }

    @Override
    public String create(ContainerSpec spec) {
        check("create");
        if (byName(spec.name()) != null) {
            throw new ContainerRuntimeException("Conflict. The container name " + spec.name() + " is already in use");
        }
        if (!networks.containsKey(spec.networkName())) {
            throw new ContainerRuntimeException("network " + spec.networkName() + " not found");
        }
        Container container = new Container(nextId(), spec, spec.labels());
        containers.put(container.id, container);
        return container.id;
    }

    @Override
    public void start(String containerId) {
        check("start");
        Container container = resolve(containerId);
        if (container.running) {
            return;
        }
        if (!networks.containsKey(container.spec.networkName())) {
            throw new NetworkNotFoundException(containerId, null);
        }
        container.starts++;
        Long crash = crashOnStart.get(container.spec.image());
        if (crash != null) {
            container.running = false;
            container.exitCode = crash;
            container.output = "Exception in server tick loop\n";
            return;
        }
        container.running = true;
        container.exitCode = 0;
    }

    @Override
    public void stop(String containerId, Duration timeout) {
        check("stop");
        resolve(containerId).running = false;
    }

    @Override
    public void restart(String containerId, Duration timeout) {
        check("restart");
        Container container = resolve(containerId);
        container.restarts++;
        container.running = true;
    }

    @Override
    public void remove(String containerId, boolean force) {
        check("remove");
        Container container = resolve(containerId);
        if (container.running && !force) {
            throw new ContainerRuntimeException("container " + containerId + " is running");
        }
        containers.remove(container.id);
    }

    @Override
    public List<ContainerSummary> list(Map<String, String> labelFilter) {
        List<ContainerSummary> matches = new ArrayList<>();
        for (Container container : containers.values()) {
            boolean matchesAll = labelFilter.entrySet().stream()
                .allMatch(e -> e.getValue().equals(container.labels.get(e.getKey())));
            if (matchesAll) {
                matches.add(new ContainerSummary(container.id, List.of("/" + container.spec.name()),
                    container.running ? "running" : "exited", container.labels));
            }
        }
        return matches;
    }

    @Override
    public void logs(String containerId, LogOptions options, LogSink sink) {
        check("logs");
        Container container = resolve(containerId);
        sink.accept(LogStream.STDOUT, container.output.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public void attachStdin(String containerId, byte[] payload, Duration timeout) {
        check("attach");
        resolve(containerId).stdin.add(new String(payload, StandardCharsets.UTF_8));
    }

    @Override
    public List<NetworkSummary> listNetworks(String name) {
        String id = networks.get(name);
        return id == null ? List.of() : List.of(new NetworkSummary(id, name, "bridge", Map.of()));
    }

    @Override
    public String createNetwork(String name, String driver, Map<String, String> labels) {
        return networks.computeIfAbsent(name, n -> "net-" + nextId());
    }

    @Override
    public boolean imageExists(String image) {
        return images.contains(image);
    }

    @Override
    public void pullImage(String image, Duration timeout) {
        check("pull");
        pulled.add(image);
        images.add(image);
    }

    @Override
    public EngineInfo info() {
        return new EngineInfo("node-a", 4, 8L << 30, null, false);
    }

    @Override
    public List<SwarmNodeInfo> listSwarmNodes() {
        return List.of();
    }

    private Container resolve(String ref) {
        Container container = containers.get(ref);
        if (container == null) {
            container = byName(ref);
        }
        if (container == null) {
            throw new ContainerNotFoundException(ref, null);
        }
        return container;
    }

    private void check(String operation) {
        if (failing.contains(operation)) {
            throw new ContainerRuntimeException("Unable to " + operation + ": engine error");
        }
    }

    private String nextId() {
        sequence++;
        return String.format("%064x", sequence);
    }
}
