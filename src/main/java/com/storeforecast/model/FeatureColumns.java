package com.storeforecast.model;

import java.util.List;

/** Column names shared by the feature frame, scaler parameters and the regression engine. */
public final class FeatureColumns {
    public static final String TARGET = "y";
    public static final String TARGET_ORIGINAL = "y_original";

    public static final String TRANSACTIONS_COUNT = "transactions_count";
    public static final String AVG_TICKET = "avg_ticket";

    public static final String PROMO_INTENSITY = "promo_intensity";
    public static final String HOLIDAY_INTENSITY = "holiday_intensity";
    public static final String EVENT_INTENSITY = "event_intensity";
    public static final String CLOSURE_INTENSITY = "closure_intensity";

    public static final String LAG_7 = "lag_7";
    public static final String ROLLING_MEAN_7 = "rolling_mean_7";
    public static final String ROLLING_STD_7 = "rolling_std_7";

    public static final String IS_WEEKEND = "is_weekend";
    public static final String IS_PAYDAY = "is_payday";
    public static final String IS_DAY_BEFORE_HOLIDAY = "is_day_before_holiday";
    public static final String IS_SCHOOL_HOLIDAY = "is_school_holiday";
    public static final String IS_MONTH_START = "is_month_start";
    public static final String IS_MONTH_END = "is_month_end";

    public static final List<String> INTENSITIES =
        List.of(PROMO_INTENSITY, HOLIDAY_INTENSITY, EVENT_INTENSITY, CLOSURE_INTENSITY);

    public static final List<String> LAG_FEATURES = List.of(LAG_7, ROLLING_MEAN_7, ROLLING_STD_7);

    public static final List<String> FLAGS = List.of(
        IS_WEEKEND, IS_PAYDAY, IS_DAY_BEFORE_HOLIDAY, IS_SCHOOL_HOLIDAY, IS_MONTH_START, IS_MONTH_END);

    private FeatureColumns() {
    }
}
