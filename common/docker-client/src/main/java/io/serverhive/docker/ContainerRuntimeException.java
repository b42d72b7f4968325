package io.serverhive.docker;

/**
 * Base type for failures reported by a {@link ContainerRuntimeGateway}.
 */
public class ContainerRuntimeException extends RuntimeException {

    public ContainerRuntimeException(String message) {
        super(message);
    }

    public ContainerRuntimeException(String message, Throwable cause) {
        super(message, cause);
    }
}
