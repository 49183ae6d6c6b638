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
public class ModelHistoryResponse {
    String storeId;
    String currentVersion;
    int historyCount;
    List<Entry> history;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        String modelVersion;
        @JsonFormat(shape = JsonFormat.Shape.STRING)
        Instant savedAt;
        Double accuracy;
        int dataPoints;
        LocalDate startDate;
        LocalDate endDate;
        double trainingTimeSeconds;
    }
}
