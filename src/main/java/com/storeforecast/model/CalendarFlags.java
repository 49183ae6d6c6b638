package com.storeforecast.model;

import java.time.DayOfWeek;
import java.time.LocalDate;

public record CalendarFlags(
    boolean weekend,
    boolean payday,
    boolean dayBeforeHoliday,
    boolean schoolHoliday,
    boolean monthStart,
    boolean monthEnd
) {

    /**
     * Flags that depend only on the date. Day-before-holiday and school-holiday come from
     * the calendar and are passed in.
     */
    public static CalendarFlags of(LocalDate date, boolean dayBeforeHoliday, boolean schoolHoliday) {
        int day = date.getDayOfMonth();
        return new CalendarFlags(
            isWeekend(date),
            day >= 25 || day <= 5,
            dayBeforeHoliday,
            schoolHoliday,
            day <= 5,
            day >= 26);
    }

    public static boolean isWeekend(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY;
    }
}
