package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.storeforecast.model.ModelMetadata;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrainingJobResponse {
    UUID jobId;
    String storeId;
    boolean forceRetrain;
    TrainingJobStatus status;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant createdAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant startedAt;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant completedAt;
    String message;
    String errorCode;
    ModelMetadata result;
}
