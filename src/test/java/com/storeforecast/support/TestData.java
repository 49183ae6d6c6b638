package com.storeforecast.support;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.model.CalendarFlags;
import com.storeforecast.model.EventIntensities;
import com.storeforecast.model.Observation;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.function.IntToDoubleFunction;

public final class TestData {

    public static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
    public static final Clock CLOCK = Clock.fixed(TODAY.atTime(12, 0).toInstant(ZoneOffset.UTC), ZoneOffset.UTC);

    private TestData() {
    }

    public static ForecastProperties properties(Path modelDir) {
        ForecastProperties properties = new ForecastProperties();
        properties.setZoneId("UTC");
        properties.setModelDir(modelDir.toString());
        properties.getTraining().setEngineEpochs(30);
        return properties;
    }

    /** {@code days} consecutive observations ending on {@code end}; index 0 is the oldest. */
    public static List<Observation> series(LocalDate end, int days, IntToDoubleFunction target) {
        List<Observation> rows = new ArrayList<>(days);
        LocalDate start = end.minusDays(days - 1L);
        for (int i = 0; i < days; i++) {
            LocalDate date = start.plusDays(i);
            double y = target.applyAsDouble(i);
            double transactions = Math.max(1, Math.round(y / 10.0));
            rows.add(new Observation(date, y, transactions, y / transactions,
                CalendarFlags.of(date, false, false), EventIntensities.NONE));
        }
        return rows;
    }

    public static List<Observation> normalSeries(LocalDate end, int days, double mean, double std, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            values[i] = Math.max(1.0, mean + std * random.nextGaussian());
        }
        return series(end, days, i -> values[i]);
    }

    /** Values 400..600 repeating every seven days. */
    public static double weeklyPattern(int i) {
        return 500 + 100 * ((i % 7) - 3) / 3.0;
    }
}
