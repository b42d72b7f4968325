package io.serverhive.docker;

import java.time.Instant;

/**
 * Log retrieval window.
 *
 * @param tail   number of trailing lines, {@code null} for all
 * @param follow keep streaming until the container stops
 * @param since  lower bound, inclusive, or {@code null}
 * @param until  upper bound, inclusive, or {@code null}
 */
public record LogOptions(Integer tail, boolean follow, Instant since, Instant until) {

    public LogOptions {
        if (tail != null && tail < 0) {
            throw new IllegalArgumentException("tail must not be negative");
        }
        if (since != null && until != null && until.isBefore(since)) {
            throw new IllegalArgumentException("until must not be before since");
        }
    }

    public static LogOptions tail(int lines) {
        return new LogOptions(lines, false, null, null);
    }

    public static LogOptions all() {
        return new LogOptions(null, false, null, null);
    }
}
