package io.serverhive.docker;

/**
 * Receives log frames as they arrive from the engine.
 */
@FunctionalInterface
public interface LogSink {

    void accept(LogStream stream, byte[] payload);
}
