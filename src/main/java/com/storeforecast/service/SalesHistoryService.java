package com.storeforecast.service;

import com.storeforecast.entity.CalendarEventRecord;
import com.storeforecast.entity.DailySalesRecord;
import com.storeforecast.model.CalendarEvent;
import com.storeforecast.model.CalendarFlags;
import com.storeforecast.model.EventCategory;
import com.storeforecast.model.EventIntensities;
import com.storeforecast.model.Observation;
import com.storeforecast.repository.CalendarEventRepository;
import com.storeforecast.repository.DailySalesRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * Read side of the sales history and the event calendar.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SalesHistoryService {

    private final DailySalesRepository salesRepository;
    private final CalendarEventRepository calendarRepository;

    public List<Observation> window(String storeId, LocalDate from, LocalDate to) {
        return salesRepository.findByStoreIdAndSalesDateBetweenOrderBySalesDateAsc(storeId, from, to)
            .stream().map(SalesHistoryService::toObservation).toList();
    }

    public List<Observation> history(String storeId) {
        return salesRepository.findByStoreIdOrderBySalesDateAsc(storeId)
            .stream().map(SalesHistoryService::toObservation).toList();
    }

    public List<CalendarEvent> acceptedEvents() {
        return calendarRepository.findAccepted().stream().map(SalesHistoryService::toEvent).toList();
    }

    static Observation toObservation(DailySalesRecord r) {
        return new Observation(
            r.getSalesDate(),
            r.getTotalSales(),
            r.getTransactionsCount(),
            r.getAvgTicket(),
            CalendarFlags.of(r.getSalesDate(), r.isDayBeforeHoliday(), r.isSchoolHoliday()),
            new EventIntensities(r.getPromoIntensity(), r.getHolidayIntensity(),
                r.getEventIntensity(), r.getClosureIntensity()));
    }

    static CalendarEvent toEvent(CalendarEventRecord r) {
        return new CalendarEvent(r.getEventDate(), EventCategory.fromCode(r.getType()), r.getTitle(), r.getImpactWeight());
    }
}
