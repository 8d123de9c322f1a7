package com.koni.energy.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.util.UUID;

/**
 * Energy reading of a device, owned by the reading store.
 * Read-only for the alerting service.
 */
@Getter
@AllArgsConstructor
public class Reading {

    public static final String POWER_W = "power_w";
    public static final String VOLTAGE_V = "voltage_v";
    public static final String CURRENT_A = "current_a";
    public static final String ENERGY_WH = "energy_wh";

    private final UUID deviceId;
    private final Instant timestamp;
    private final Double powerW;
    private final Double voltageV;
    private final Double currentA;
    private final Double energyWh;
    private final String source;

    /**
     * Looks up a metric by its column name.
     *
     * @param metric metric name such as {@code power_w}
     * @return the value, or null if the reading has no value for it or the name is unknown
     */
    public Double metric(String metric) {
        if (metric == null) {
            return null;
        }
        switch (metric) {
            case POWER_W:
                return powerW;
            case VOLTAGE_V:
                return voltageV;
            case CURRENT_A:
                return currentA;
            case ENERGY_WH:
                return energyWh;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        return "Reading{" +
                "deviceId=" + deviceId +
                ", timestamp=" + timestamp +
                ", powerW=" + powerW +
                ", source=" + source +
                '}';
    }
}
