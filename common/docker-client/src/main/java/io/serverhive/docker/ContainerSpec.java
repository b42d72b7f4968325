package io.serverhive.docker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Everything needed to create a single-port workload container.
 *
 * @param name          deterministic container name
 * @param image         image reference, pulled beforehand
 * @param env           environment in insertion order
 * @param labels        labels applied to the container
 * @param port          TCP port published on {@code 0.0.0.0} with the same host and container port
 * @param hostDataPath  host directory bind-mounted into the container
 * @param containerDataPath mount point of {@code hostDataPath} inside the container
 * @param memoryBytes   memory limit, {@code 0} for none
 * @param cpuShares     relative CPU weight, {@code 0} for the engine default
 * @param networkName   network the container joins
 * @param startCommand  optional command run through {@code sh -c "exec ..."} instead of the image entrypoint
 */
public record ContainerSpec(
    String name,
    String image,
    Map<String, String> env,
    Map<String, String> labels,
    int port,
    String hostDataPath,
    String containerDataPath,
    long memoryBytes,
    int cpuShares,
    String networkName,
    String startCommand) {

    public ContainerSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(hostDataPath, "hostDataPath");
        Objects.requireNonNull(containerDataPath, "containerDataPath");
        Objects.requireNonNull(networkName, "networkName");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 but was " + port);
        }
        env = env == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(env));
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }

    public boolean hasStartCommand() {
        return startCommand != null && !startCommand.isBlank();
    }

    public String bindMount() {
        return hostDataPath + ":" + containerDataPath;
    }
}
