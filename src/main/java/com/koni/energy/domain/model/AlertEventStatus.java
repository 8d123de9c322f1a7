package com.koni.energy.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an alert event.
 */
public enum AlertEventStatus {
    TRIGGERED,
    ACKNOWLEDGED,
    RESOLVED,
    SUPPRESSED;

    /**
     * Statuses that start a cooldown window for their (rule, device) pair.
     */
    public static final Set<AlertEventStatus> COOLDOWN_STATUSES = EnumSet.of(TRIGGERED, SUPPRESSED);

    /**
     * Statuses an event may be acknowledged from.
     */
    public static final Set<AlertEventStatus> ACKNOWLEDGEABLE = EnumSet.of(TRIGGERED, SUPPRESSED);

    /**
     * Statuses an event may be resolved from.
     */
    public static final Set<AlertEventStatus> RESOLVABLE = EnumSet.of(TRIGGERED, ACKNOWLEDGED, SUPPRESSED);

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertEventStatus fromCode(String code) {
        return valueOf(code.toUpperCase(Locale.ROOT));
    }
}
