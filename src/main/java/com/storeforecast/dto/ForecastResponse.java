package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    String storeId;
    List<ChartPoint> chartData;
    List<EventAnnotation> eventAnnotations;
    List<RestockRecommendation> recommendations;
    List<String> warnings;
    Meta meta;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChartPoint {
        LocalDate date;
        Double historical;
        Double predicted;
        Double lowerBound;
        Double upperBound;
        boolean holiday;
        String holidayName;
    }

    @Value
    @Builder
    public static class EventAnnotation {
        LocalDate date;
        String title;
        String category;
        double impact;
    }

    @Value
    @Builder
    public static class RestockRecommendation {
        Long productId;
        String productName;
        String category;
        int currentStock;
        long unitsSoldLastPeriod;
        long predictedDemand;
        long recommendedRestock;
        RiskLevel urgency;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Meta {
        String modelVersion;
        Double accuracy;
        int forecastDays;
        int historicalDays;
        LocalDate lastHistoricalDate;
        double growthFactor;
        boolean logTransform;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant trainedAt;
    }
}
