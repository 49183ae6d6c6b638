package com.storeforecast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Map;

@Getter
@RequiredArgsConstructor
public enum EventCategory {
    PROMOTION("promotion"),
    HOLIDAY("holiday"),
    EVENT("event"),
    STORE_CLOSED("store-closed");

    private static final Map<String, EventCategory> ALIASES = Map.ofEntries(
        Map.entry("promotion", PROMOTION),
        Map.entry("promo", PROMOTION),
        Map.entry("sale", PROMOTION),
        Map.entry("discount", PROMOTION),
        Map.entry("holiday", HOLIDAY),
        Map.entry("event", EVENT),
        Map.entry("store-closed", STORE_CLOSED),
        Map.entry("store_closed", STORE_CLOSED),
        Map.entry("closure", STORE_CLOSED),
        Map.entry("closed", STORE_CLOSED));

    @JsonValue
    private final String code;

    /** Unknown or blank names fall back to {@link #EVENT}. */
    @JsonCreator
    public static EventCategory fromCode(String raw) {
        if (raw == null || raw.isBlank()) {
            return EVENT;
        }
        return ALIASES.getOrDefault(raw.trim().toLowerCase(Locale.ROOT), EVENT);
    }
}
