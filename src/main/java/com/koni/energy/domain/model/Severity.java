package com.koni.energy.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.energy.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Severity label of a rule. Informational only, evaluation ignores it.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Severity fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.code().equalsIgnoreCase(code)) {
                return severity;
            }
        }
        throw new ValidationException("Unknown severity: " + code);
    }
}
