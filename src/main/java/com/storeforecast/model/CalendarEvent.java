package com.storeforecast.model;

import java.time.LocalDate;

/**
 * An accepted calendar entry. A null impact weight means the category default applies.
 */
public record CalendarEvent(LocalDate date, EventCategory category, String title, Double impactWeight) {
}
