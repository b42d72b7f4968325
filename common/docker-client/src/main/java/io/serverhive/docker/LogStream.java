package io.serverhive.docker;

public enum LogStream {
    STDOUT,
    STDERR,
    RAW
}
