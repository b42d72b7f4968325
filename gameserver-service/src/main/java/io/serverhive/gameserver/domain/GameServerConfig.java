package io.serverhive.gameserver.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a container for a game server is created from.
 */
public record GameServerConfig(
    String id,
    String image,
    int port,
    Map<String, String> envVars,
    long memoryBytes,
    double cpuCores,
    String startCommand) {

    public GameServerConfig {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (image == null || image.isBlank()) {
            throw new IllegalArgumentException("image must not be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535 but was " + port);
        }
        if (memoryBytes < 0) {
            throw new IllegalArgumentException("memoryBytes must not be negative");
        }
        if (cpuCores < 0) {
            throw new IllegalArgumentException("cpuCores must not be negative");
        }
        envVars = envVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
        startCommand = startCommand == null || startCommand.isBlank() ? null : startCommand;
    }

    public int cpuShares() {
        return (int) Math.round(cpuCores * 1024);
    }
}
