package io.serverhive.docker;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of an inspected container.
 *
 * @param exitCode last exit code reported by the engine, {@code 0} while it has never exited
 * @param binds    bind mounts as {@code hostPath:containerPath}
 */
public record ContainerState(
    String id,
    String name,
    boolean running,
    long exitCode,
    Map<String, String> labels,
    List<String> binds) {

    public ContainerState {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
        binds = binds == null ? List.of() : List.copyOf(binds);
    }

    public boolean hasLabel(String key, String value) {
        return value.equals(labels.get(key));
    }
}
