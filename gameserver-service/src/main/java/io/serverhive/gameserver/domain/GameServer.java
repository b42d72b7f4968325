package io.serverhive.gameserver.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted game-server aggregate. A recorded {@code containerId} only says which container was last created
 * for this server; it may have vanished from the engine since.
 */
public record GameServer(
    String id,
    String image,
    int port,
    Map<String, String> envVars,
    long memoryBytes,
    double cpuCores,
    String startCommand,
    String containerId,
    String containerName,
    GameServerStatus status,
    Instant lastStartedAt,
    Instant createdAt,
    Instant updatedAt) {

    public GameServer {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(status, "status");
        envVars = envVars == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(envVars));
    }

    public static GameServer newServer(GameServerConfig config) {
        return new GameServer(config.id(), config.image(), config.port(), config.envVars(), config.memoryBytes(),
            config.cpuCores(), config.startCommand(), null, null, GameServerStatus.CREATED, null, null, null);
    }

    public boolean hasContainer() {
        return containerId != null && !containerId.isBlank();
    }

    public GameServerConfig toConfig() {
        return new GameServerConfig(id, image, port, envVars, memoryBytes, cpuCores, startCommand);
    }
}
