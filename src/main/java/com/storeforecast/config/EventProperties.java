package com.storeforecast.config;

import com.storeforecast.model.EventCategory;
import lombok.Data;

import java.util.EnumMap;
import java.util.Map;

@Data
public class EventProperties {

    /** Impact used when a calendar entry carries no explicit weight. */
    private Map<EventCategory, Double> defaultImpacts = new EnumMap<>(Map.of(
        EventCategory.PROMOTION, 0.4,
        EventCategory.HOLIDAY, 0.9,
        EventCategory.EVENT, 0.5,
        EventCategory.STORE_CLOSED, 1.0));

    private double fallbackImpact = 0.3;

    public double impactFor(EventCategory category) {
        return defaultImpacts.getOrDefault(category, fallbackImpact);
    }
}
