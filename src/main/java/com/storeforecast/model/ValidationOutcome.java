package com.storeforecast.model;

import java.util.List;

/** Result of checking model output: {@code ok} is false when any anomaly was corrected or flagged. */
public record ValidationOutcome(boolean ok, List<String> warnings, PredictionFrame corrected) {

    public ValidationOutcome {
        warnings = List.copyOf(warnings);
    }
}
