package io.serverhive.gameserver.config;

import io.serverhive.gameserver.domain.PlacementStrategy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "serverhive.gameservers")
public class GameServerProperties {

    private final Node node;
    private final Docker docker;
    private final Runtime runtime;
    private final Placement placement;
    private final Forwarding forwarding;
    private final Locking locking;
    private final Cache cache;
    private final Reconciler reconciler;

    public GameServerProperties(Node node,
                                @Valid Docker docker,
                                @Valid Runtime runtime,
                                @Valid Placement placement,
                                @Valid Forwarding forwarding,
                                @Valid Locking locking,
                                @Valid Cache cache,
                                @Valid Reconciler reconciler) {
        this.node = node == null ? new Node(null, null) : node;
        this.docker = Objects.requireNonNull(docker, "docker");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.placement = Objects.requireNonNull(placement, "placement");
        this.forwarding = Objects.requireNonNull(forwarding, "forwarding");
        this.locking = Objects.requireNonNull(locking, "locking");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler");
    }

    public Node getNode() {
        return node;
    }

    public Docker getDocker() {
        return docker;
    }

    public Runtime getRuntime() {
        return runtime;
    }

    public Placement getPlacement() {
        return placement;
    }

    public Forwarding getForwarding() {
        return forwarding;
    }

    public Locking getLocking() {
        return locking;
    }

    public Cache getCache() {
        return cache;
    }

    public Reconciler getReconciler() {
        return reconciler;
    }

    /**
     * Identity overrides for the local node. Both are optional; the engine is asked when they are absent.
     */
    public static final class Node {

        private final String id;
        private final String ip;

        public Node(String id, String ip) {
            this.id = blankToNull(id);
            this.ip = blankToNull(ip);
        }

        public String getId() {
            return id;
        }

        public String getIp() {
            return ip;
        }
    }

    @Validated
    public static final class Docker {

        private final String networkName;
        private final String volumeRoot;
        private final String labelPrefix;

        public Docker(@NotBlank String networkName, @NotBlank String volumeRoot, @NotBlank String labelPrefix) {
            this.networkName = requireNonBlank(networkName, "networkName");
            String root = requireNonBlank(volumeRoot, "volumeRoot").trim();
            while (root.length() > 1 && root.endsWith("/")) {
                root = root.substring(0, root.length() - 1);
            }
            this.volumeRoot = root;
            this.labelPrefix = requireNonBlank(labelPrefix, "labelPrefix");
        }

        public String getNetworkName() {
            return networkName;
        }

        public String getVolumeRoot() {
            return volumeRoot;
        }

        public String getLabelPrefix() {
            return labelPrefix;
        }

        public String getManagedLabel() {
            return labelPrefix + ".managed";
        }

        public String label(String name) {
            return labelPrefix + "." + name;
        }
    }

    @Validated
    public static final class Runtime {

        private final Duration stopTimeout;
        private final Duration restartTimeout;
        private final Duration pullTimeout;
        private final Duration attachTimeout;
        private final Duration startGrace;
        private final int crashLogLines;

        public Runtime(@NotNull Duration stopTimeout,
                       @NotNull Duration restartTimeout,
                       @NotNull Duration pullTimeout,
                       @NotNull Duration attachTimeout,
                       @NotNull Duration startGrace,
                       @NotNull @Positive Integer crashLogLines) {
            this.stopTimeout = Objects.requireNonNull(stopTimeout, "stopTimeout");
            this.restartTimeout = Objects.requireNonNull(restartTimeout, "restartTimeout");
            this.pullTimeout = Objects.requireNonNull(pullTimeout, "pullTimeout");
            this.attachTimeout = Objects.requireNonNull(attachTimeout, "attachTimeout");
            this.startGrace = Objects.requireNonNull(startGrace, "startGrace");
            this.crashLogLines = Objects.requireNonNull(crashLogLines, "crashLogLines");
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public Duration getRestartTimeout() {
            return restartTimeout;
        }

        public Duration getPullTimeout() {
            return pullTimeout;
        }

        public Duration getAttachTimeout() {
            return attachTimeout;
        }

        public Duration getStartGrace() {
            return startGrace;
        }

        public int getCrashLogLines() {
            return crashLogLines;
        }
    }

    @Validated
    public static final class Placement {

        private final PlacementStrategy strategy;
        private final int maxGameServersPerNode;
        private final boolean swarmEnabled;

        public Placement(@NotBlank String strategy,
                         @NotNull @Positive Integer maxGameServersPerNode,
                         @NotNull Boolean swarmEnabled) {
            this.strategy = PlacementStrategy.fromValue(requireNonBlank(strategy, "strategy"));
            this.maxGameServersPerNode = Objects.requireNonNull(maxGameServersPerNode, "maxGameServersPerNode");
            this.swarmEnabled = Objects.requireNonNull(swarmEnabled, "swarmEnabled");
        }

        public PlacementStrategy getStrategy() {
            return strategy;
        }

        public int getMaxGameServersPerNode() {
            return maxGameServersPerNode;
        }

        public boolean isSwarmEnabled() {
            return swarmEnabled;
        }
    }

    @Validated
    public static final class Forwarding {

        private final boolean enabled;
        private final String apiUrlTemplate;
        private final Duration connectTimeout;
        private final Duration requestTimeout;

        public Forwarding(@NotNull Boolean enabled,
                          String apiUrlTemplate,
                          Duration connectTimeout,
                          Duration requestTimeout) {
            this.enabled = Objects.requireNonNull(enabled, "enabled");
            this.apiUrlTemplate = blankToNull(apiUrlTemplate);
            this.connectTimeout = connectTimeout;
            this.requestTimeout = requestTimeout;
        }

        public boolean isEnabled() {
            return enabled;
        }

        /**
         * Base URL of a peer node's API with {@code {ip}} and {@code {hostname}} placeholders, e.g.
         * {@code http://{ip}:8080}. Optional; a node's {@code api_url} label takes precedence.
         */
        public String getApiUrlTemplate() {
            return apiUrlTemplate;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }
    }

    @Validated
    public static final class Locking {

        private final LockingMode mode;

        public Locking(@NotNull LockingMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        public LockingMode getMode() {
            return mode;
        }
    }

    public enum LockingMode {
        IN_MEMORY,
        POSTGRES_ADVISORY;

        @Override
        public String toString() {
            return name().toLowerCase(Locale.ROOT).replace('_', '-');
        }
    }

    @Validated
    public static final class Cache {

        private final boolean enabled;
        private final Duration ttl;

        public Cache(@NotNull Boolean enabled, Duration ttl) {
            this.enabled = Objects.requireNonNull(enabled, "enabled");
            this.ttl = ttl == null || ttl.isZero() || ttl.isNegative() ? Duration.ofMinutes(5) : ttl;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Duration getTtl() {
            return ttl;
        }
    }

    @Validated
    public static final class Reconciler {

        private final boolean enabled;
        private final Duration interval;

        public Reconciler(@NotNull Boolean enabled, @NotNull Duration interval) {
            this.enabled = Objects.requireNonNull(enabled, "enabled");
            this.interval = Objects.requireNonNull(interval, "interval");
        }

        public boolean isEnabled() {
            return enabled;
        }

        public Duration getInterval() {
            return interval;
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
