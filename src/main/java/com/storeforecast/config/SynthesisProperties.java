package com.storeforecast.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class SynthesisProperties {

    @Min(1)
    private int meanWindowDays = 14;

    @Min(1)
    private int medianWindowDays = 30;

    @DecimalMin("0.0") @DecimalMax("1.0")
    private double smoothingAlpha = 0.3;

    private double paydayMultiplier = 1.08;

    /** Applied only when no same-weekday history exists to condition on. */
    private double weekendMultiplier = 1.15;

    private double promoTransactionUplift = 0.20;
    private double holidayTransactionUplift = 0.10;
    private double eventTransactionUplift = 0.10;
    private double promoTicketDiscount = 0.05;

    private double defaultTransactions = 50.0;
    private double defaultAvgTicket = 75.0;

    private double minTransactions = 1.0;
    private double maxTransactions = 500.0;
    private double minAvgTicket = 10.0;
    private double maxAvgTicket = 1000.0;
    private double maxIntensity = 2.0;
}
