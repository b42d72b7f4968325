package io.serverhive.docker;

/**
 * A container could not be started because a network it is attached to no longer exists.
 * <p>
 * The container itself is intact; it has to be removed and recreated against the current
 * network before it can run again.
 */
public class NetworkNotFoundException extends ContainerRuntimeException {

    private final String containerId;

    public NetworkNotFoundException(String containerId, Throwable cause) {
        super("network referenced by container " + containerId + " not found", cause);
        this.containerId = containerId;
    }

    public String getContainerId() {
        return containerId;
    }
}
