package com.koni.energy.domain.model;

import com.koni.energy.domain.exception.ValidationException;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Partial update of an alert rule.
 *
 * Every field is tri-state: a null field was not provided and stays unchanged,
 * {@code Optional.empty()} is an explicit null, and a present value replaces the current one.
 * Explicit null is only accepted for the nullable attributes (device scope, threshold, window).
 */
@Getter
@Builder
public class AlertRulePatch {

    /**
     * Rule attributes a patch can change.
     */
    public enum Field {
        NAME,
        KIND,
        DEVICE_ID,
        METRIC,
        COMPARISON,
        THRESHOLD,
        WINDOW_SECONDS,
        SEVERITY,
        ENABLED,
        COOLDOWN_SECONDS
    }

    private final Optional<String> name;
    private final Optional<AlertKind> kind;
    private final Optional<UUID> deviceId;
    private final Optional<String> metric;
    private final Optional<Comparison> comparison;
    private final Optional<Double> threshold;
    private final Optional<Integer> windowSeconds;
    private final Optional<Severity> severity;
    private final Optional<Boolean> enabled;
    private final Optional<Integer> cooldownSeconds;

    /**
     * @return the attributes this patch provides, in declaration order
     */
    public Set<Field> changedFields() {
        Set<Field> fields = EnumSet.noneOf(Field.class);
        if (name != null) fields.add(Field.NAME);
        if (kind != null) fields.add(Field.KIND);
        if (deviceId != null) fields.add(Field.DEVICE_ID);
        if (metric != null) fields.add(Field.METRIC);
        if (comparison != null) fields.add(Field.COMPARISON);
        if (threshold != null) fields.add(Field.THRESHOLD);
        if (windowSeconds != null) fields.add(Field.WINDOW_SECONDS);
        if (severity != null) fields.add(Field.SEVERITY);
        if (enabled != null) fields.add(Field.ENABLED);
        if (cooldownSeconds != null) fields.add(Field.COOLDOWN_SECONDS);
        return fields;
    }

    public boolean isEmpty() {
        return changedFields().isEmpty();
    }

    /**
     * @return true if the patch sets a name different from {@code currentName}
     */
    public boolean renames(String currentName) {
        return name != null && name.isPresent() && !name.get().equals(currentName);
    }

    /**
     * Produces the rule with this patch applied. The result is not validated.
     *
     * @param rule the current rule
     * @param now update time, stored as {@code updatedAt}
     * @return the patched rule
     * @throws ValidationException if a non-nullable attribute is explicitly set to null
     */
    public AlertRule applyTo(AlertRule rule, Instant now) {
        AlertRule.AlertRuleBuilder builder = rule.toBuilder();
        if (name != null) builder.name(required(name, "name"));
        if (kind != null) builder.kind(required(kind, "alert_type"));
        if (deviceId != null) builder.deviceId(deviceId.orElse(null));
        if (metric != null) builder.metric(required(metric, "metric"));
        if (comparison != null) builder.comparison(required(comparison, "comparison"));
        if (threshold != null) builder.threshold(threshold.orElse(null));
        if (windowSeconds != null) builder.windowSeconds(windowSeconds.orElse(null));
        if (severity != null) builder.severity(required(severity, "severity"));
        if (enabled != null) builder.enabled(required(enabled, "is_enabled"));
        if (cooldownSeconds != null) builder.cooldownSeconds(required(cooldownSeconds, "cooldown_seconds"));
        return builder.updatedAt(now).build();
    }

    private static <T> T required(Optional<T> value, String field) {
        return value.orElseThrow(() -> new ValidationException(field + " cannot be null"));
    }
}
