package com.storeforecast.repository;

import com.storeforecast.entity.CalendarEventRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface CalendarEventRepository extends JpaRepository<CalendarEventRecord, Long> {

    @Query("""
        SELECT e FROM CalendarEventRecord e
        WHERE e.userDecision IS NULL OR LOWER(e.userDecision) <> 'rejected'
        ORDER BY e.eventDate ASC
    """)
    List<CalendarEventRecord> findAccepted();
}
