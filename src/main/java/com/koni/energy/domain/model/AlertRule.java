package com.koni.energy.domain.model;

import com.koni.energy.domain.exception.ValidationException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Alert rule owned by a user.
 *
 * A rule is immutable; updates produce a new instance through {@link AlertRulePatch}.
 * The evaluation policy of each kind lives here so that it can be exercised without
 * any repository.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class AlertRule {

    public static final String DEFAULT_METRIC = Reading.POWER_W;
    public static final int DEFAULT_COOLDOWN_SECONDS = 300;
    public static final int DEFAULT_OFFLINE_WINDOW_SECONDS = 900;
    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_METRIC_LENGTH = 64;

    private final UUID id;
    private final UUID ownerId;
    private final String name;
    private final AlertKind kind;

    /**
     * Device scope, null means every active device of the owner.
     */
    private final UUID deviceId;

    @Builder.Default
    private final String metric = DEFAULT_METRIC;

    @Builder.Default
    private final Comparison comparison = Comparison.GT;

    private final Double threshold;
    private final Integer windowSeconds;

    @Builder.Default
    private final Severity severity = Severity.MEDIUM;

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final int cooldownSeconds = DEFAULT_COOLDOWN_SECONDS;

    private final Instant createdAt;
    private final Instant updatedAt;

    /**
     * Validates the rule definition.
     *
     * @throws ValidationException if the rule cannot be evaluated as defined
     */
    public void validate() {
        if (ownerId == null) {
            throw new ValidationException("ownerId is required");
        }
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        if (kind == null) {
            throw new ValidationException("alert_type is required");
        }
        if (metric == null || metric.isBlank()) {
            throw new ValidationException("metric is required");
        }
        if (metric.length() > MAX_METRIC_LENGTH) {
            throw new ValidationException("metric must be at most " + MAX_METRIC_LENGTH + " characters");
        }
        if (comparison == null) {
            throw new ValidationException("comparison is required");
        }
        if (severity == null) {
            throw new ValidationException("severity is required");
        }
        if (kind.requiresThreshold() && threshold == null) {
            throw new ValidationException("threshold is required for " + kind.code() + " alerts");
        }
        if (threshold != null && (threshold.isNaN() || threshold.isInfinite())) {
            throw new ValidationException("threshold must be a finite number");
        }
        if (windowSeconds != null && windowSeconds < 1) {
            throw new ValidationException("window_seconds must be at least 1");
        }
        if (cooldownSeconds < 0) {
            throw new ValidationException("cooldown_seconds cannot be negative");
        }
    }

    /**
     * @return true if the rule targets a single device
     */
    public boolean isScoped() {
        return deviceId != null;
    }

    /**
     * Staleness window used by offline rules.
     */
    public int effectiveWindowSeconds() {
        return windowSeconds != null ? windowSeconds : DEFAULT_OFFLINE_WINDOW_SECONDS;
    }

    /**
     * Checks whether a previous event still suppresses new ones.
     *
     * @param lastEventAt timestamp of the most recent triggered or suppressed event
     * @param now evaluation time
     * @return true if less than {@code cooldownSeconds} elapsed since {@code lastEventAt}
     */
    public boolean isCoolingDown(Instant lastEventAt, Instant now) {
        if (lastEventAt == null) {
            return false;
        }
        return Duration.between(lastEventAt, now).compareTo(Duration.ofSeconds(cooldownSeconds)) < 0;
    }

    /**
     * Applies the rule's policy to the latest reading of one device.
     *
     * @param latest the latest reading of the device, empty if it never reported
     * @param now evaluation time
     * @return the trigger to record, or empty if the rule does not fire
     */
    public Optional<AlertTrigger> evaluate(Optional<Reading> latest, Instant now) {
        switch (kind) {
            case OFFLINE:
                return evaluateOffline(latest, now);
            case ANOMALY:
                // Placeholder: anomaly rules share the threshold path until a detector is implemented.
            case THRESHOLD:
                return evaluateThreshold(latest);
            default:
                throw new IllegalStateException("Unsupported alert kind: " + kind);
        }
    }

    private Optional<AlertTrigger> evaluateOffline(Optional<Reading> latest, Instant now) {
        int window = effectiveWindowSeconds();
        boolean stale = latest
                .map(reading -> Duration.between(reading.getTimestamp(), now).compareTo(Duration.ofSeconds(window)) > 0)
                .orElse(true);
        if (!stale) {
            return Optional.empty();
        }
        return Optional.of(new AlertTrigger("Device offline (no reading within " + window + "s)", null));
    }

    private Optional<AlertTrigger> evaluateThreshold(Optional<Reading> latest) {
        if (latest.isEmpty() || threshold == null) {
            return Optional.empty();
        }
        Double value = latest.get().metric(metric);
        if (value == null) {
            return Optional.empty();
        }
        if (!comparison.test(value, threshold)) {
            return Optional.empty();
        }
        String message = metric + " " + comparison.code() + " " + formatThreshold(threshold);
        return Optional.of(new AlertTrigger(message, value));
    }

    private static String formatThreshold(double threshold) {
        return BigDecimal.valueOf(threshold).stripTrailingZeros().toPlainString();
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id=" + id +
                ", ownerId=" + ownerId +
                ", name='" + name + '\'' +
                ", kind=" + kind +
                ", deviceId=" + deviceId +
                ", enabled=" + enabled +
                '}';
    }
}
