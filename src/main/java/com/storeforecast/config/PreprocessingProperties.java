package com.storeforecast.config;

import com.storeforecast.model.OutlierPolicy;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PreprocessingProperties {

    @NotNull
    private OutlierPolicy outlierPolicy = OutlierPolicy.CLIP;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double clipLowerPercentile = 1.0;

    @DecimalMin("0.0") @DecimalMax("100.0")
    private double clipUpperPercentile = 99.0;

    @DecimalMin("0.0")
    private double removeZThreshold = 3.5;

    private boolean smoothingEnabled = true;

    @Min(1)
    private int smoothingWindow = 3;
}
