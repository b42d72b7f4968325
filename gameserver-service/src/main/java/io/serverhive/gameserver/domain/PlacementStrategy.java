package io.serverhive.gameserver.domain;

import java.util.Locale;

public enum PlacementStrategy {
    LEAST_LOADED("least-loaded"),
    ROUND_ROBIN("round-robin"),
    RESOURCE_BASED("resource-based");

    private final String value;

    PlacementStrategy(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Resolves a configured strategy name; unknown names fall back to {@link #LEAST_LOADED}.
     */
    public static PlacementStrategy fromValue(String value) {
        if (value == null) {
            return LEAST_LOADED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PlacementStrategy strategy : values()) {
            if (strategy.value.equals(normalized)) {
                return strategy;
            }
        }
        return LEAST_LOADED;
    }
}
