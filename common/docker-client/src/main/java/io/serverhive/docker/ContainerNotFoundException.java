package io.serverhive.docker;

/**
 * The referenced container does not exist in the engine (removed out-of-band or never created).
 */
public class ContainerNotFoundException extends ContainerRuntimeException {

    private final String containerRef;

    public ContainerNotFoundException(String containerRef, Throwable cause) {
        super("container " + containerRef + " not found", cause);
        this.containerRef = containerRef;
    }

    public String getContainerRef() {
        return containerRef;
    }
}
