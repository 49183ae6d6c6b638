package com.storeforecast.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;

@Entity
@Table(
    name = "daily_sales_summary",
    uniqueConstraints = @UniqueConstraint(name = "uk_sales_store_date", columnNames = {"store_id", "sales_date"}),
    indexes = {
        @Index(name = "idx_sales_store_date", columnList = "store_id, sales_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySalesRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "store_id", nullable = false, length = 64)
    private String storeId;

    @Column(name = "sales_date", nullable = false)
    private LocalDate salesDate;

    @Column(name = "total_sales", nullable = false)
    private double totalSales;

    @Column(name = "transactions_count")
    private int transactionsCount;

    @Column(name = "avg_ticket")
    private double avgTicket;

    @Column(name = "is_day_before_holiday")
    private boolean dayBeforeHoliday;

    @Column(name = "is_school_holiday")
    private boolean schoolHoliday;

    @Column(name = "promo_intensity")
    private double promoIntensity;

    @Column(name = "holiday_intensity")
    private double holidayIntensity;

    @Column(name = "event_intensity")
    private double eventIntensity;

    @Column(name = "closure_intensity")
    private double closureIntensity;
}
