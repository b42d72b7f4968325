package io.serverhive.docker;

/**
 * Indicates that the Docker daemon could not be reached from the current node.
 */
public class DockerDaemonUnavailableException extends ContainerRuntimeException {

    public DockerDaemonUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
