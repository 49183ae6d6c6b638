package com.storeforecast.exception;

import lombok.Getter;

import java.util.List;

@Getter
public class SynthesisValidationException extends ForecastPipelineException {
    private final List<String> violations;

    public SynthesisValidationException(List<String> violations) {
        super("SYNTHESIS_INVALID", "Synthesized feature frame is invalid: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
