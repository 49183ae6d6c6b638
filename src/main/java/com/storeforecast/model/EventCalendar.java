package com.storeforecast.model;

import com.storeforecast.config.EventProperties;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Calendar entries grouped by date, with per-category intensities summed per day.
 */
public final class EventCalendar {

    private final Map<LocalDate, List<CalendarEvent>> byDate;
    private final EventProperties eventProperties;

    private EventCalendar(Map<LocalDate, List<CalendarEvent>> byDate, EventProperties eventProperties) {
        this.byDate = byDate;
        this.eventProperties = eventProperties;
    }

    public static EventCalendar of(Collection<CalendarEvent> events, EventProperties eventProperties) {
        Map<LocalDate, List<CalendarEvent>> byDate = new TreeMap<>();
        for (CalendarEvent e : events) {
            if (e == null || e.date() == null) {
                continue;
            }
            byDate.computeIfAbsent(e.date(), d -> new ArrayList<>()).add(e);
        }
        return new EventCalendar(byDate, eventProperties);
    }

    public static EventCalendar empty(EventProperties eventProperties) {
        return new EventCalendar(Collections.emptyMap(), eventProperties);
    }

    public List<CalendarEvent> eventsOn(LocalDate date) {
        return byDate.getOrDefault(date, List.of());
    }

    public List<CalendarEvent> all() {
        return byDate.values().stream().flatMap(List::stream).toList();
    }

    public boolean hasCategory(LocalDate date, EventCategory category) {
        return eventsOn(date).stream().anyMatch(e -> e.category() == category);
    }

    public EventIntensities intensitiesOn(LocalDate date) {
        double promo = 0;
        double holiday = 0;
        double event = 0;
        double closure = 0;
        for (CalendarEvent e : eventsOn(date)) {
            double weight = e.impactWeight() != null && Double.isFinite(e.impactWeight())
                ? Math.max(0.0, Math.min(1.0, e.impactWeight()))
                : eventProperties.impactFor(e.category());
            switch (e.category()) {
                case PROMOTION -> promo += weight;
                case HOLIDAY -> holiday += weight;
                case STORE_CLOSED -> closure += weight;
                default -> event += weight;
            }
        }
        return new EventIntensities(promo, holiday, event, closure);
    }

    public int size() {
        return byDate.values().stream().mapToInt(List::size).sum();
    }
}
