package com.koni.energy.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.koni.energy.domain.exception.ValidationException;

import java.util.Locale;

/**
 * Comparison operator of a threshold rule.
 *
 * EQ and NEQ use exact floating point equality, no tolerance is applied.
 */
public enum Comparison {

    GT {
        @Override
        public boolean test(double value, double threshold) {
            return value > threshold;
        }
    },
    GTE {
        @Override
        public boolean test(double value, double threshold) {
            return value >= threshold;
        }
    },
    LT {
        @Override
        public boolean test(double value, double threshold) {
            return value < threshold;
        }
    },
    LTE {
        @Override
        public boolean test(double value, double threshold) {
            return value <= threshold;
        }
    },
    EQ {
        @Override
        public boolean test(double value, double threshold) {
            return value == threshold;
        }
    },
    NEQ {
        @Override
        public boolean test(double value, double threshold) {
            return value != threshold;
        }
    };

    /**
     * Applies the operator with the observed value on the left-hand side.
     *
     * @param value the observed metric value
     * @param threshold the configured threshold
     * @return true if {@code value <op> threshold} holds
     */
    public abstract boolean test(double value, double threshold);

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Comparison fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (Comparison comparison : values()) {
            if (comparison.code().equalsIgnoreCase(code)) {
                return comparison;
            }
        }
        throw new ValidationException("Unknown comparison: " + code);
    }
}
