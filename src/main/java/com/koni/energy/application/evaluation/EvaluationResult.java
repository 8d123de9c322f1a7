package com.koni.energy.application.evaluation;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of an evaluation pass.
 */
@Getter
@AllArgsConstructor
public class EvaluationResult {

    /**
     * Number of alert events inserted by the pass.
     */
    private final int triggeredCount;

    public String toMessage() {
        return "Evaluated alerts. Triggered " + triggeredCount + " events.";
    }
}
