package com.storeforecast.repository;

import com.storeforecast.entity.DailySalesRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;

public interface DailySalesRepository extends JpaRepository<DailySalesRecord, Long> {

    List<DailySalesRecord> findByStoreIdAndSalesDateBetweenOrderBySalesDateAsc(
        String storeId, LocalDate from, LocalDate to);

    List<DailySalesRecord> findByStoreIdOrderBySalesDateAsc(String storeId);
}
