package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.PredictionProperties;
import com.storeforecast.dto.FitStatus;
import com.storeforecast.dto.ForecastEventInput;
import com.storeforecast.dto.ForecastResponse;
import com.storeforecast.dto.ModelAccuracyResponse;
import com.storeforecast.dto.ModelHealth;
import com.storeforecast.dto.ModelHistoryResponse;
import com.storeforecast.dto.ModelStatusResponse;
import com.storeforecast.dto.RetrainCheckResponse;
import com.storeforecast.dto.RetrainOutcome;
import com.storeforecast.exception.DataQualityException;
import com.storeforecast.exception.ForecastFailedException;
import com.storeforecast.exception.ForecastPipelineException;
import com.storeforecast.exception.InvalidForecastRequestException;
import com.storeforecast.exception.ModelStoreException;
import com.storeforecast.exception.StoreBusyException;
import com.storeforecast.exception.SynthesisValidationException;
import com.storeforecast.model.AccuracyResult;
import com.storeforecast.model.CalendarEvent;
import com.storeforecast.model.EventCalendar;
import com.storeforecast.model.EventCategory;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.model.Observation;
import com.storeforecast.model.OutlierPolicy;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.PredictionPoint;
import com.storeforecast.model.RetrainDecision;
import com.storeforecast.model.RollingEvaluation;
import com.storeforecast.model.SynthesisMode;
import com.storeforecast.model.SynthesisReport;
import com.storeforecast.model.TrainedModel;
import com.storeforecast.model.ValidationOutcome;
import com.storeforecast.pipeline.ForecastValidator;
import com.storeforecast.pipeline.FutureFeatureSynthesizer;
import com.storeforecast.pipeline.Scaler;
import com.storeforecast.pipeline.SeriesStats;
import com.storeforecast.pipeline.TargetTransform;
import com.storeforecast.store.ModelStore;
import com.storeforecast.store.StoreLease;
import com.storeforecast.store.StoreLockRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry points for training and serving. Pipeline errors pass through unchanged; anything
 * else is logged and rethrown as {@link ForecastFailedException}.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class ForecastPipelineService {

    private static final int HISTORY_LIMIT = 10;
    private static final double OVERFITTING_GAP = 20.0;
    private static final double UNDERFITTING_MAPE = 25.0;
    private static final double ESTIMATED_TRAIN_SHARE = 0.6;

    private final ForecastProperties properties;
    private final ModelLifecycleManager lifecycle;
    private final SalesHistoryService salesHistory;
    private final FutureFeatureSynthesizer synthesizer;
    private final Scaler scaler;
    private final ForecastValidator validator;
    private final ModelStore modelStore;
    private final StoreLockRegistry locks;
    private final RestockAdvisor restockAdvisor;
    private final RetrainScheduler retrainScheduler;
    private final Clock clock;

    public ModelMetadata train(String storeId, boolean forceRetrain) {
        return guarded(storeId, true, () -> lifecycle.train(storeId, null, forceRetrain).metadata());
    }

    /**
     * Forecasts {@code horizonDays} days after the last observed day (default when null).
     * Trains a first model when the store has none.
     */
    public ForecastResponse predict(String storeId, Integer horizonDays, @Valid List<ForecastEventInput> events) {
        PredictionProperties p = properties.getPrediction();
        int horizon = horizonDays != null ? horizonDays : p.getDefaultHorizonDays();
        if (horizon < p.getMinHorizonDays() || horizon > p.getMaxHorizonDays()) {
            throw new InvalidForecastRequestException("Forecast days must be between "
                + p.getMinHorizonDays() + " and " + p.getMaxHorizonDays() + ", got " + horizon);
        }
        return guarded(storeId, false, () -> forecast(storeId, horizon, events != null ? events : List.of()));
    }

    public ModelStatusResponse modelStatus(String storeId) {
        double threshold = properties.getTraining().getMinAccuracyThreshold();
        Optional<ModelMetadata> current = modelStore.loadMetadata(storeId);
        ModelStatusResponse.ModelStatusResponseBuilder builder = ModelStatusResponse.builder()
            .storeId(storeId)
            .accuracyThreshold(threshold)
            .nextScheduledRetrain(retrainScheduler.nextRunTime(storeId).orElse(null))
            .nextScheduledEvaluation(retrainScheduler.nextEvaluationTime(storeId).orElse(null));
        if (current.isEmpty()) {
            return builder.status(ModelHealth.NO_MODEL)
                .shouldRetrain(true)
                .reason("No trained model exists")
                .build();
        }
        ModelMetadata m = current.get();
        RetrainDecision decision = lifecycle.shouldRetrain(storeId);
        return builder
            .status(decision.shouldRetrain() ? ModelHealth.NEEDS_RETRAIN : ModelHealth.HEALTHY)
            .modelVersion(m.getModelVersion())
            .modelAgeDays(lifecycle.modelAgeDays(m))
            .dataAgeDays(m.getEndDate() != null ? ChronoUnit.DAYS.between(m.getEndDate(), LocalDate.now(clock)) : null)
            .accuracy(m.getAccuracy())
            .trainingWindowDays(m.getTrainingWindowDays())
            .dataPoints(m.getDataPoints())
            .startDate(m.getStartDate())
            .endDate(m.getEndDate())
            .shouldRetrain(decision.shouldRetrain())
            .reason(decision.reason())
            .qualityReport(m.getQualityReport())
            .savedAt(m.getSavedAt())
            .build();
    }

    public RetrainCheckResponse checkAndRetrain(String storeId) {
        RetrainDecision decision = lifecycle.shouldRetrain(storeId);
        if (!decision.shouldRetrain()) {
            return RetrainCheckResponse.builder()
                .storeId(storeId)
                .status(RetrainOutcome.UP_TO_DATE)
                .reason(decision.reason())
                .modelVersion(modelStore.currentVersion(storeId).orElse(null))
                .build();
        }
        ModelMetadata m = guarded(storeId, true, () -> lifecycle.train(storeId, null, true).metadata());
        return RetrainCheckResponse.builder()
            .storeId(storeId)
            .status(RetrainOutcome.RETRAINED)
            .reason(decision.reason())
            .modelVersion(m.getModelVersion())
            .accuracy(m.getAccuracy())
            .dataPoints(m.getDataPoints())
            .build();
    }

    public ModelHistoryResponse modelHistory(String storeId) {
        List<ModelHistoryResponse.Entry> entries = modelStore.history(storeId, HISTORY_LIMIT).stream()
            .map(m -> ModelHistoryResponse.Entry.builder()
                .modelVersion(m.getModelVersion())
                .savedAt(m.getSavedAt())
                .accuracy(m.getAccuracy())
                .dataPoints(m.getDataPoints())
                .startDate(m.getStartDate())
                .endDate(m.getEndDate())
                .trainingTimeSeconds(m.getTrainingTimeSeconds())
                .build())
            .toList();
        return ModelHistoryResponse.builder()
            .storeId(storeId)
            .currentVersion(modelStore.currentVersion(storeId).orElse(null))
            .historyCount(entries.size())
            .history(entries)
            .build();
    }

    /**
     * Stored train/validation accuracy plus a fresh score of the published model on recent
     * observed data. Metadata that carries an accuracy but no MAPE gets estimated MAPE values
     * (validation = 100 - accuracy, train = 60% of that), flagged as such.
     */
    public ModelAccuracyResponse modelAccuracy(String storeId) {
        ModelMetadata m = modelStore.loadMetadata(storeId)
            .orElseThrow(() -> new ModelStoreException("No trained model for store '" + storeId + "'"));
        Double trainMape = m.getTrainMape();
        Double validationMape = m.getValidationMape();
        boolean estimated = false;
        if (validationMape == null && m.getAccuracy() != null && m.getAccuracy() > 0) {
            validationMape = SeriesStats.round(100.0 - m.getAccuracy(), 2);
            trainMape = SeriesStats.round(validationMape * ESTIMATED_TRAIN_SHARE, 2);
            estimated = true;
        }
        Double gap = trainMape != null && validationMape != null
            ? SeriesStats.round(Math.abs(validationMape - trainMape), 2)
            : null;
        AccuracyResult actual = lifecycle.actualDataAccuracy(storeId);
        return ModelAccuracyResponse.builder()
            .storeId(storeId)
            .modelVersion(m.getModelVersion())
            .accuracyStatus(m.getAccuracyStatus())
            .accuracy(m.getAccuracy())
            .trainMape(trainMape)
            .validationMape(validationMape)
            .errorGap(gap)
            .mapeEstimated(estimated)
            .fitStatus(fitStatus(trainMape, validationMape))
            .validationDays(m.getValidationDays())
            .dataPoints(m.getDataPoints())
            .lastTrained(m.getSavedAt())
            .actualDataStatus(actual.status())
            .actualDataMape(actual.validationMape())
            .actualDataAccuracy(actual.accuracy())
            .build();
    }

    /** Rolling-origin evaluation of the current model, retraining it when it degraded. */
    public RollingEvaluation evaluateAndTune(String storeId) {
        return guarded(storeId, true, () -> lifecycle.evaluateRollingOrigin(storeId));
    }

    static FitStatus fitStatus(Double trainMape, Double validationMape) {
        if (trainMape == null || validationMape == null) {
            return FitStatus.UNKNOWN;
        }
        if (Math.abs(validationMape - trainMape) > OVERFITTING_GAP) {
            return FitStatus.OVERFITTING;
        }
        if (trainMape > UNDERFITTING_MAPE && validationMape > UNDERFITTING_MAPE) {
            return FitStatus.UNDERFITTING;
        }
        return FitStatus.GOOD;
    }

    private ForecastResponse forecast(String storeId, int horizon, List<ForecastEventInput> events) {
        List<Observation> history = salesHistory.history(storeId);
        int minDays = properties.getTraining().getMinTrainingDays();
        if (history.size() < minDays) {
            throw new DataQualityException("Insufficient historical data: " + history.size()
                + " days available, minimum " + minDays + " required");
        }
        if (modelStore.loadMetadata(storeId).isEmpty()) {
            log.info("No model for store, training first | store={}", storeId);
            lifecycle.train(storeId, null, true);
        }

        try (StoreLease lease = locks.tryShared(storeId)
                .orElseThrow(() -> new StoreBusyException(storeId, "prediction"))) {
            TrainedModel trained = lifecycle.load(storeId)
                .orElseThrow(() -> new ModelStoreException("No loadable model for store '" + storeId + "'"));
            ModelMetadata metadata = trained.metadata();
            scaler.requireComplete(metadata.getScalerParams());

            EventCalendar calendar = calendarWith(events);
            LocalDate lastDate = history.get(history.size() - 1).date();
            List<LocalDate> dates = lastDate.plusDays(1).datesUntil(lastDate.plusDays(horizon + 1L)).toList();

            OutlierPolicy lagPolicy = metadata.getOutlierPolicy() != null
                ? metadata.getOutlierPolicy() : properties.getPreprocessing().getOutlierPolicy();
            FeatureFrame synthesized = synthesizer.synthesize(dates, history, calendar, SynthesisMode.FORECAST, lagPolicy);
            SynthesisReport report = synthesizer.validate(synthesized);
            if (!report.ok()) {
                throw new SynthesisValidationException(report.errors());
            }
            FeatureFrame input = scaler.transform(synthesized, metadata.getScalerParams())
                .select(trained.model().regressors());
            PredictionFrame raw = trained.model().predict(input);
            PredictionFrame original = metadata.isLogTransform()
                ? raw.map(pt -> pt.withValues(TargetTransform.inverse(pt.yhat()),
                    TargetTransform.inverse(pt.yhatLower()), TargetTransform.inverse(pt.yhatUpper())))
                : raw;

            int window = properties.getTraining().getWindowDays();
            List<Observation> recent = history.subList(Math.max(0, history.size() - window), history.size());
            ValidationOutcome outcome = validator.validateAndCorrect(original, recent);

            double[] lastMonth = tail(history, properties.getPrediction().getRestockLookbackDays()).stream()
                .mapToDouble(Observation::target).toArray();
            double growth = restockAdvisor.growthFactor(lastMonth, outcome.corrected().yhat());

            log.info("Forecast produced | store={} | version={} | days={} | warnings={}",
                storeId, metadata.getModelVersion(), horizon, outcome.warnings().size());
            return ForecastResponse.builder()
                .storeId(storeId)
                .chartData(chart(history, outcome.corrected(), calendar))
                .eventAnnotations(annotations(calendar, chartStart(history), dates.get(dates.size() - 1)))
                .recommendations(restockAdvisor.recommend(growth))
                .warnings(outcome.warnings())
                .meta(ForecastResponse.Meta.builder()
                    .modelVersion(metadata.getModelVersion())
                    .accuracy(metadata.getAccuracy())
                    .forecastDays(horizon)
                    .historicalDays(history.size())
                    .lastHistoricalDate(lastDate)
                    .growthFactor(growth)
                    .logTransform(metadata.isLogTransform())
                    .trainedAt(metadata.getSavedAt())
                    .build())
                .build();
        }
    }

    private EventCalendar calendarWith(List<ForecastEventInput> requested) {
        List<CalendarEvent> events = new ArrayList<>(salesHistory.acceptedEvents());
        for (ForecastEventInput e : requested) {
            String title = e.getTitle() != null && !e.getTitle().isBlank() ? e.getTitle() : e.getType();
            events.add(new CalendarEvent(e.getDate(), EventCategory.fromCode(e.getType()), title, e.getImpact()));
        }
        return EventCalendar.of(events, properties.getEvents());
    }

    private List<ForecastResponse.ChartPoint> chart(List<Observation> history, PredictionFrame forecast,
                                                    EventCalendar calendar) {
        List<ForecastResponse.ChartPoint> rows = new ArrayList<>();
        for (Observation o : tail(history, properties.getPrediction().getChartHistoryDays())) {
            rows.add(ForecastResponse.ChartPoint.builder()
                .date(o.date())
                .historical(SeriesStats.round(o.target(), 2))
                .holiday(!calendar.eventsOn(o.date()).isEmpty())
                .holidayName(eventName(calendar, o.date()))
                .build());
        }
        for (PredictionPoint pt : forecast.points()) {
            rows.add(ForecastResponse.ChartPoint.builder()
                .date(pt.date())
                .predicted(SeriesStats.round(pt.yhat(), 2))
                .lowerBound(SeriesStats.round(pt.yhatLower(), 2))
                .upperBound(SeriesStats.round(pt.yhatUpper(), 2))
                .holiday(!calendar.eventsOn(pt.date()).isEmpty())
                .holidayName(eventName(calendar, pt.date()))
                .build());
        }
        return rows;
    }

    private List<ForecastResponse.EventAnnotation> annotations(EventCalendar calendar, LocalDate from, LocalDate to) {
        return calendar.all().stream()
            .filter(e -> !e.date().isBefore(from) && !e.date().isAfter(to))
            .map(e -> ForecastResponse.EventAnnotation.builder()
                .date(e.date())
                .title(e.title())
                .category(e.category().getCode())
                .impact(e.impactWeight() != null ? e.impactWeight() : properties.getEvents().impactFor(e.category()))
                .build())
            .toList();
    }

    private LocalDate chartStart(List<Observation> history) {
        List<Observation> shown = tail(history, properties.getPrediction().getChartHistoryDays());
        return shown.isEmpty() ? history.get(history.size() - 1).date().plusDays(1) : shown.get(0).date();
    }

    private static String eventName(EventCalendar calendar, LocalDate date) {
        List<CalendarEvent> events = calendar.eventsOn(date);
        return events.isEmpty() ? null : events.get(0).title();
    }

    private static <T> List<T> tail(List<T> list, int n) {
        return list.subList(Math.max(0, list.size() - n), list.size());
    }

    private <T> T guarded(String storeId, boolean training, Supplier<T> action) {
        try {
            return action.get();
        } catch (ForecastPipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} failed | store={}", training ? "Training" : "Prediction", storeId, e);
            throw training ? ForecastFailedException.training(storeId, e) : ForecastFailedException.prediction(storeId, e);
        }
    }
}
