package com.storeforecast.config;

import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.storeforecast.model.FeatureColumns.*;

@Data
public class RegressorProperties {

    /** Continuous regressors standardized by the scaler. */
    private List<String> scaled = new ArrayList<>(List.of(
        PROMO_INTENSITY, HOLIDAY_INTENSITY, EVENT_INTENSITY, CLOSURE_INTENSITY,
        TRANSACTIONS_COUNT, AVG_TICKET, LAG_7, ROLLING_MEAN_7, ROLLING_STD_7));

    /** 0/1 regressors passed to the engine unscaled. */
    private List<String> binary = new ArrayList<>(List.of(
        IS_WEEKEND, IS_PAYDAY, IS_DAY_BEFORE_HOLIDAY, IS_SCHOOL_HOLIDAY, IS_MONTH_START, IS_MONTH_END));

    /** Prior scale per regressor; a regressor without an entry is not registered with the engine. */
    private Map<String, Double> priorScales = new LinkedHashMap<>(defaultPriorScales());

    private static Map<String, Double> defaultPriorScales() {
        Map<String, Double> scales = new LinkedHashMap<>();
        scales.put(CLOSURE_INTENSITY, 0.20);
        scales.put(PROMO_INTENSITY, 0.15);
        scales.put(HOLIDAY_INTENSITY, 0.15);
        scales.put(EVENT_INTENSITY, 0.10);
        scales.put(TRANSACTIONS_COUNT, 0.05);
        scales.put(AVG_TICKET, 0.05);
        scales.put(LAG_7, 0.12);
        scales.put(ROLLING_MEAN_7, 0.10);
        scales.put(ROLLING_STD_7, 0.05);
        scales.put(IS_WEEKEND, 0.08);
        scales.put(IS_PAYDAY, 0.06);
        scales.put(IS_DAY_BEFORE_HOLIDAY, 0.06);
        scales.put(IS_SCHOOL_HOLIDAY, 0.04);
        scales.put(IS_MONTH_START, 0.05);
        scales.put(IS_MONTH_END, 0.05);
        return scales;
    }
}
