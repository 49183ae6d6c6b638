package com.storeforecast.config;

import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class SchedulerProperties {

    private boolean enabled = true;

    /** {@code daily} or {@code weekly} (Mondays). */
    private String schedule = "daily";

    @Pattern(regexp = "^([01]\\d|2[0-3]):[0-5]\\d$")
    private String time = "02:00";

    private List<String> storeIds = new ArrayList<>(List.of("1"));

    private double lowAccuracyWarning = 65.0;

    private int poolSize = 2;
}
