package com.storeforecast.config;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class JobProperties {

    @Min(1)
    private int poolSize = 2;

    @Min(1)
    private int maxRetained = 200;
}
