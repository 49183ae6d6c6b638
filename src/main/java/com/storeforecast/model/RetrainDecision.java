package com.storeforecast.model;

public record RetrainDecision(boolean shouldRetrain, String reason) {

    public static RetrainDecision retrain(String reason) {
        return new RetrainDecision(true, reason);
    }

    public static RetrainDecision keep(String reason) {
        return new RetrainDecision(false, reason);
    }
}
