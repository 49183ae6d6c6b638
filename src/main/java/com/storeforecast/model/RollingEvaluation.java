package com.storeforecast.model;

/**
 * Result of a rolling-origin evaluation. {@code mape} is the mean over folds in percent and is
 * null when no fold was scored; {@code modelVersion} is the version current after the run.
 */
public record RollingEvaluation(EvaluationOutcome outcome, Double mape, int folds,
                                String modelVersion, String reason) {

    public static RollingEvaluation noModel() {
        return new RollingEvaluation(EvaluationOutcome.NO_MODEL, null, 0, null, "No trained model exists");
    }

    public static RollingEvaluation skipped(String modelVersion, String reason) {
        return new RollingEvaluation(EvaluationOutcome.SKIPPED, null, 0, modelVersion, reason);
    }
}
