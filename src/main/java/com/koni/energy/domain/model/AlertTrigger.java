package com.koni.energy.domain.model;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a rule that fired for one device: the event message and the observed value, if any.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public final class AlertTrigger {

    private final String message;
    private final Double metricValue;
}
