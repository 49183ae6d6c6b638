package com.storeforecast.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Every tuning constant of the pipeline. Components receive this object through their
 * constructor, so tests build one with {@code new ForecastProperties()} and override fields.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    @NotBlank
    private String zoneId = "Asia/Jakarta";

    @NotBlank
    private String modelDir = "./models";

    @Valid
    @NestedConfigurationProperty
    private TrainingProperties training = new TrainingProperties();

    @Valid
    @NestedConfigurationProperty
    private PreprocessingProperties preprocessing = new PreprocessingProperties();

    @Valid
    @NestedConfigurationProperty
    private ParameterProperties parameters = new ParameterProperties();

    @Valid
    @NestedConfigurationProperty
    private RegressorProperties regressors = new RegressorProperties();

    @Valid
    @NestedConfigurationProperty
    private EventProperties events = new EventProperties();

    @Valid
    @NestedConfigurationProperty
    private SynthesisProperties synthesis = new SynthesisProperties();

    @Valid
    @NestedConfigurationProperty
    private ValidationProperties validation = new ValidationProperties();

    @Valid
    @NestedConfigurationProperty
    private PredictionProperties prediction = new PredictionProperties();

    @Valid
    @NestedConfigurationProperty
    private SchedulerProperties scheduler = new SchedulerProperties();

    @Valid
    @NestedConfigurationProperty
    private JobProperties jobs = new JobProperties();

    @Valid
    @NestedConfigurationProperty
    private EvaluationProperties evaluation = new EvaluationProperties();
}
