package com.storeforecast.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

/** A calendar event supplied with a forecast request, merged with stored events. */
@Value
@Builder
@Jacksonized
public class ForecastEventInput {

    @NotNull(message = "date is required")
    @JsonFormat(pattern = "yyyy-MM-dd")
    LocalDate date;

    @NotBlank(message = "type is required")
    @Size(max = 50)
    String type;

    @Size(max = 200)
    String title;

    @DecimalMin(value = "0.0", message = "impact must be >= 0")
    @DecimalMax(value = "1.0", message = "impact must be <= 1")
    Double impact;
}
