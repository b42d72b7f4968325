package io.serverhive.gameserver.domain;

import java.util.Locale;

public enum LocationStatus {
    CREATED,
    STARTING,
    RUNNING,
    STOPPED,
    FAILED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LocationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
