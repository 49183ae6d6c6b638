package com.storeforecast.model;

import java.time.LocalDate;
import java.util.Objects;

/** One day of store history. */
public record Observation(
    LocalDate date,
    double target,
    double transactionCount,
    double averageTicket,
    CalendarFlags flags,
    EventIntensities intensities
) {
    public Observation {
        Objects.requireNonNull(date, "date");
        flags = flags != null ? flags : CalendarFlags.of(date, false, false);
        intensities = intensities != null ? intensities : EventIntensities.NONE;
    }

    public Observation withTarget(double value) {
        return new Observation(date, value, transactionCount, averageTicket, flags, intensities);
    }
}
