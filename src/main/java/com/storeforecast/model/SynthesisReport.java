package com.storeforecast.model;

import java.util.List;

public record SynthesisReport(boolean ok, List<String> errors) {

    public SynthesisReport {
        errors = List.copyOf(errors);
    }

    public static SynthesisReport of(List<String> errors) {
        return new SynthesisReport(errors.isEmpty(), errors);
    }
}
