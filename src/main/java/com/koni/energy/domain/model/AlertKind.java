package com.koni.energy.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.energy.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Kind of an alert rule. Decides which evaluation policy the engine applies.
 */
public enum AlertKind {

    THRESHOLD,

    /**
     * Evaluated with the threshold policy until a dedicated anomaly detector exists.
     */
    ANOMALY,

    OFFLINE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AlertKind fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (AlertKind kind : values()) {
            if (kind.code().equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw new ValidationException("Unknown alert_type: " + code);
    }

    /**
     * @return true if rules of this kind compare a metric against a threshold
     */
    public boolean requiresThreshold() {
        return this != OFFLINE;
    }
}
