package com.storeforecast.model;

/**
 * Outcome of the train/validation MAPE computation. Accuracy is {@code 100 - validation MAPE}
 * clamped to [0, 100]; it is a reporting convention rather than a statistical accuracy.
 */
public record AccuracyResult(AccuracyStatus status, Double trainMape, Double validationMape,
                             Double accuracy, String detail) {

    public static AccuracyResult computed(double trainMape, double validationMape, double accuracy) {
        return new AccuracyResult(AccuracyStatus.COMPUTED, trainMape, validationMape, accuracy, null);
    }

    /** A single held-out score with no matching train MAPE. */
    public static AccuracyResult scored(double mape, double accuracy) {
        return new AccuracyResult(AccuracyStatus.COMPUTED, null, mape, accuracy, null);
    }

    public static AccuracyResult insufficientData(String detail) {
        return new AccuracyResult(AccuracyStatus.INSUFFICIENT_DATA, null, null, null, detail);
    }

    public static AccuracyResult computationError(String detail) {
        return new AccuracyResult(AccuracyStatus.COMPUTATION_ERROR, null, null, null, detail);
    }

    public boolean isComputed() {
        return status == AccuracyStatus.COMPUTED;
    }
}
