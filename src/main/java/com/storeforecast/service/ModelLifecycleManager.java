package com.storeforecast.service;

import com.storeforecast.config.EvaluationProperties;
import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.PreprocessingProperties;
import com.storeforecast.config.TrainingProperties;
import com.storeforecast.engine.ForecastModel;
import com.storeforecast.engine.RegressionEngine;
import com.storeforecast.exception.DataQualityException;
import com.storeforecast.exception.StoreBusyException;
import com.storeforecast.exception.SynthesisValidationException;
import com.storeforecast.model.AccuracyResult;
import com.storeforecast.model.AccuracyStatus;
import com.storeforecast.model.EngineParams;
import com.storeforecast.model.EvaluationOutcome;
import com.storeforecast.model.EventCalendar;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.model.Observation;
import com.storeforecast.model.PredictionFrame;
import com.storeforecast.model.QualityReport;
import com.storeforecast.model.RetrainDecision;
import com.storeforecast.model.RollingEvaluation;
import com.storeforecast.model.ScalerParams;
import com.storeforecast.model.SmoothingConfig;
import com.storeforecast.model.SynthesisMode;
import com.storeforecast.model.SynthesisReport;
import com.storeforecast.model.TrainedModel;
import com.storeforecast.pipeline.FeatureEngineer;
import com.storeforecast.pipeline.FutureFeatureSynthesizer;
import com.storeforecast.pipeline.ParameterSelector;
import com.storeforecast.pipeline.Scaler;
import com.storeforecast.pipeline.SeriesStats;
import com.storeforecast.pipeline.TargetTransform;
import com.storeforecast.store.ModelStore;
import com.storeforecast.store.StoreLease;
import com.storeforecast.store.StoreLockRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.storeforecast.model.FeatureColumns.TARGET;
import static com.storeforecast.model.FeatureColumns.TARGET_ORIGINAL;

/**
 * Trains, evaluates, publishes and reloads per-store models, and decides when a model is due
 * for retraining.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ModelLifecycleManager {

    private final ForecastProperties properties;
    private final SalesHistoryService salesHistory;
    private final FeatureEngineer featureEngineer;
    private final Scaler scaler;
    private final ParameterSelector parameterSelector;
    private final FutureFeatureSynthesizer synthesizer;
    private final RegressionEngine engine;
    private final ModelStore modelStore;
    private final StoreLockRegistry locks;
    private final Clock clock;

    /**
     * Returns the current model unchanged when it is younger than the maximum age and
     * {@code forceRetrain} is false; otherwise trains on the window ending at {@code endDate}
     * (today when null) and publishes the result.
     *
     * @throws StoreBusyException   when another training run holds the store
     * @throws DataQualityException when the window fails the quality checks
     */
    public TrainedModel train(String storeId, LocalDate endDate, boolean forceRetrain) {
        try (StoreLease lease = locks.tryExclusive(storeId)
                .orElseThrow(() -> new StoreBusyException(storeId, "training"))) {
            if (!forceRetrain) {
                Optional<TrainedModel> existing = modelStore.load(storeId);
                if (existing.isPresent()
                        && modelAgeDays(existing.get().metadata()) < properties.getTraining().getMaxModelAgeDays()) {
                    log.info("Existing model reused | store={} | version={}",
                        storeId, existing.get().metadata().getModelVersion());
                    return existing.get();
                }
            }
            return fitAndPublish(storeId, endDate != null ? endDate : LocalDate.now(clock));
        }
    }

    public Optional<TrainedModel> load(String storeId) {
        return modelStore.load(storeId);
    }

    public RetrainDecision shouldRetrain(String storeId) {
        TrainingProperties t = properties.getTraining();
        Optional<ModelMetadata> current = modelStore.loadMetadata(storeId);
        if (current.isEmpty()) {
            return RetrainDecision.retrain("No trained model exists");
        }
        ModelMetadata metadata = current.get();
        long age = modelAgeDays(metadata);
        if (age >= t.getMaxModelAgeDays()) {
            return RetrainDecision.retrain("Model age " + age + " days reached the maximum of "
                + t.getMaxModelAgeDays() + " days");
        }
        // a short history is skipped; any other missing accuracy counts as zero
        boolean accuracyKnown = metadata.getAccuracy() != null;
        if (!accuracyKnown && metadata.getAccuracyStatus() != AccuracyStatus.INSUFFICIENT_DATA) {
            return RetrainDecision.retrain("Model accuracy could not be computed ("
                + Objects.requireNonNullElse(metadata.getAccuracyDetail(), "no detail")
                + "), treated as below the threshold of " + t.getMinAccuracyThreshold() + "%");
        }
        if (accuracyKnown && metadata.getAccuracy() < t.getMinAccuracyThreshold()) {
            return RetrainDecision.retrain("Model accuracy " + metadata.getAccuracy()
                + "% is below the threshold of " + t.getMinAccuracyThreshold() + "%");
        }
        if (metadata.getEndDate() != null) {
            long sinceWindowEnd = ChronoUnit.DAYS.between(metadata.getEndDate(), LocalDate.now(clock));
            if (sinceWindowEnd > t.getMaxDataStalenessDays()) {
                return RetrainDecision.retrain("Training data is stale: " + sinceWindowEnd
                    + " days since the window ended on " + metadata.getEndDate());
            }
        }
        return RetrainDecision.keep("Model is up to date (age " + age + " days, accuracy "
            + (accuracyKnown ? metadata.getAccuracy() + "%" : "not evaluated") + ")");
    }

    /** Retrains when {@link #shouldRetrain} says so; empty when the current model is kept. */
    public Optional<TrainedModel> autoRetrainIfNeeded(String storeId) {
        RetrainDecision decision = shouldRetrain(storeId);
        if (!decision.shouldRetrain()) {
            log.info("Retrain skipped | store={} | reason={}", storeId, decision.reason());
            return Optional.empty();
        }
        log.info("Retrain triggered | store={} | reason={}", storeId, decision.reason());
        return Optional.of(train(storeId, null, true));
    }

    public long modelAgeDays(ModelMetadata metadata) {
        if (metadata.getSavedAt() == null) {
            return Long.MAX_VALUE;
        }
        LocalDate saved = metadata.getSavedAt().atZone(clock.getZone()).toLocalDate();
        return ChronoUnit.DAYS.between(saved, LocalDate.now(clock));
    }

    private TrainedModel fitAndPublish(String storeId, LocalDate endDate) {
        long started = System.nanoTime();
        TrainingProperties t = properties.getTraining();
        PreprocessingProperties pre = properties.getPreprocessing();
        LocalDate startDate = endDate.minusDays(t.getWindowDays() - 1L);

        List<Observation> window = salesHistory.window(storeId, startDate, endDate);
        QualityReport quality = assessQuality(window);
        SmoothingConfig smoothing = new SmoothingConfig(pre.isSmoothingEnabled(), pre.getSmoothingWindow());
        FeatureFrame frame = featureEngineer.prepare(window, pre.getOutlierPolicy(), smoothing);
        if (frame.size() < t.getMinTrainingDays()) {
            throw new DataQualityException("Only " + frame.size() + " rows left after outlier handling, minimum "
                + t.getMinTrainingDays() + " required");
        }

        double cv = ParameterSelector.coefficientOfVariation(frame.column(TARGET_ORIGINAL));
        EngineParams params = parameterSelector.select(frame.size(), cv);
        Map<String, Double> priors = activePriorScales(frame);
        List<String> scaledColumns = properties.getRegressors().getScaled().stream()
            .filter(priors::containsKey).toList();

        ScalerParams scalerParams = scaler.fit(frame, scaledColumns);
        ForecastModel model = engine.fit(trainingInput(scaler.transform(frame, scalerParams), priors), params, priors);

        EventCalendar calendar = EventCalendar.of(salesHistory.acceptedEvents(), properties.getEvents());
        AccuracyResult accuracy = evaluate(window, frame, params, priors, scaledColumns, calendar);

        ModelMetadata metadata = ModelMetadata.builder()
            .modelVersion(modelStore.nextVersion(storeId))
            .storeId(storeId)
            .trainingWindowDays(t.getWindowDays())
            .dataPoints(frame.size())
            .startDate(frame.date(0))
            .endDate(frame.date(frame.size() - 1))
            .logTransform(t.isLogTransform())
            .outlierPolicy(pre.getOutlierPolicy())
            .smoothingApplied(smoothing.enabled())
            .smoothingWindow(smoothing.window())
            .scalerParams(scalerParams)
            .regressors(List.copyOf(priors.keySet()))
            .regressorPriorScales(priors)
            .engineParams(params)
            .changepointPriorScale(params.getChangepointPriorScale())
            .coefficientOfVariation(SeriesStats.round(cv, 4))
            .trainMape(accuracy.trainMape())
            .validationMape(accuracy.validationMape())
            .accuracy(accuracy.accuracy())
            .accuracyStatus(accuracy.status())
            .accuracyDetail(accuracy.detail())
            .validationDays(t.getValidationDays())
            .qualityReport(quality)
            .trainingTimeSeconds(SeriesStats.round((System.nanoTime() - started) / 1e9, 2))
            .savedAt(Instant.now(clock))
            .build();
        modelStore.publish(storeId, model, metadata);
        log.info("Training completed | store={} | version={} | rows={} | tier={} | accuracy={} | status={}",
            storeId, metadata.getModelVersion(), metadata.getDataPoints(), params.getTier(),
            metadata.getAccuracy(), metadata.getAccuracyStatus());
        return new TrainedModel(model, metadata);
    }

    /**
     * @throws DataQualityException when the window is too short, mostly zero, or too noisy
     */
    QualityReport assessQuality(List<Observation> window) {
        TrainingProperties t = properties.getTraining();
        int total = window.size();
        if (total < t.getMinTrainingDays()) {
            throw new DataQualityException("Insufficient data: " + total + " days available, minimum "
                + t.getMinTrainingDays() + " required");
        }
        double[] y = window.stream().mapToDouble(Observation::target).toArray();
        long nonZero = window.stream().filter(o -> o.target() > 0).count();
        double nonZeroRatio = (double) nonZero / total;
        if (nonZeroRatio < t.getMinNonZeroRatio()) {
            throw new DataQualityException(String.format("Too many zero-sales days: non-zero ratio %.2f below %.2f",
                nonZeroRatio, t.getMinNonZeroRatio()));
        }
        double mean = SeriesStats.mean(y);
        double std = SeriesStats.sampleStd(y);
        int outliers = 0;
        if (std > 0) {
            for (double v : y) {
                if (Math.abs(v - mean) / std > t.getOutlierZThreshold()) {
                    outliers++;
                }
            }
        }
        double outlierRatio = (double) outliers / total;
        if (outlierRatio > t.getMaxOutlierRatio()) {
            throw new DataQualityException(String.format("Too many outliers: ratio %.3f above %.3f",
                outlierRatio, t.getMaxOutlierRatio()));
        }
        LocalDate last = window.stream().map(Observation::date).max(LocalDate::compareTo).orElseThrow();
        return QualityReport.builder()
            .totalDays(total)
            .nonZeroRatio(SeriesStats.round(nonZeroRatio, 4))
            .outlierCount(outliers)
            .outlierRatio(SeriesStats.round(outlierRatio, 4))
            .dataAgeDays(ChronoUnit.DAYS.between(last, LocalDate.now(clock)))
            .build();
    }

    /**
     * Fits a separate model on everything but the last validation days and scores it on the
     * held-out days. The held-out regressors are synthesized from the earlier rows only, and
     * are scaled with parameters fitted on the earlier rows only.
     */
    AccuracyResult evaluate(List<Observation> window, FeatureFrame frame, EngineParams params,
                            Map<String, Double> priors, List<String> scaledColumns, EventCalendar calendar) {
        TrainingProperties t = properties.getTraining();
        int validationDays = t.getValidationDays();
        if (frame.size() < t.getMinTrainingDays() + validationDays) {
            return AccuracyResult.insufficientData("Need " + (t.getMinTrainingDays() + validationDays)
                + " rows to hold out " + validationDays + " validation days, have " + frame.size());
        }
        try {
            HoldoutScore score = scoreHoldout(window, frame, frame.size() - validationDays, frame.size(),
                params, priors, scaledColumns, calendar);
            double roundedValidation = SeriesStats.round(score.validationMape(), 2);
            double accuracy = accuracyFrom(roundedValidation);
            log.info("Accuracy computed | train_mape={} | validation_mape={} | accuracy={}",
                SeriesStats.round(score.trainMape(), 2), roundedValidation, accuracy);
            return AccuracyResult.computed(SeriesStats.round(score.trainMape(), 2), roundedValidation, accuracy);
        } catch (RuntimeException e) {
            log.error("Accuracy computation failed", e);
            return AccuracyResult.computationError(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Cross-validates the current configuration over rolling cutoffs of the full history and
     * retrains the store when the mean fold MAPE is above the configured threshold.
     */
    public RollingEvaluation evaluateRollingOrigin(String storeId) {
        EvaluationProperties e = properties.getEvaluation();
        Optional<ModelMetadata> current = modelStore.loadMetadata(storeId);
        if (current.isEmpty()) {
            log.info("Rolling evaluation skipped, no model | store={}", storeId);
            return RollingEvaluation.noModel();
        }
        String version = current.get().getModelVersion();
        List<Observation> history = salesHistory.history(storeId);
        int required = e.getInitialDays() + e.getHorizonDays();
        if (history.size() < required) {
            return RollingEvaluation.skipped(version, "Need " + required + " days of history, have " + history.size());
        }

        PreprocessingProperties pre = properties.getPreprocessing();
        FeatureFrame frame = featureEngineer.prepare(history, pre.getOutlierPolicy(),
            new SmoothingConfig(pre.isSmoothingEnabled(), pre.getSmoothingWindow()));
        List<LocalDate> cutoffs = rollingCutoffs(frame.date(0), frame.date(frame.size() - 1), e);
        EngineParams params = current.get().getEngineParams() != null
            ? current.get().getEngineParams()
            : parameterSelector.select(e.getInitialDays(),
                ParameterSelector.coefficientOfVariation(frame.column(TARGET_ORIGINAL)));
        Map<String, Double> priors = activePriorScales(frame);
        List<String> scaledColumns = properties.getRegressors().getScaled().stream()
            .filter(priors::containsKey).toList();
        EventCalendar calendar = EventCalendar.of(salesHistory.acceptedEvents(), properties.getEvents());

        List<Double> foldMapes = new ArrayList<>();
        for (LocalDate cutoff : cutoffs) {
            int split = rowsThrough(frame, cutoff);
            int end = rowsThrough(frame, cutoff.plusDays(e.getHorizonDays()));
            if (split < properties.getTraining().getMinTrainingDays() || end <= split) {
                continue;
            }
            double mape = scoreHoldout(history, frame, split, end, params, priors, scaledColumns, calendar)
                .validationMape();
            log.debug("Rolling fold scored | store={} | cutoff={} | mape={}", storeId, cutoff, SeriesStats.round(mape, 2));
            foldMapes.add(mape);
        }
        if (foldMapes.isEmpty()) {
            return RollingEvaluation.skipped(version, "No fold fits between the initial period and the horizon");
        }

        double mape = SeriesStats.round(foldMapes.stream().mapToDouble(Double::doubleValue).average().orElseThrow(), 2);
        log.info("Rolling evaluation | store={} | version={} | folds={} | mape={} | threshold={}",
            storeId, version, foldMapes.size(), mape, e.getMapeThreshold());
        if (mape > e.getMapeThreshold()) {
            TrainedModel retrained = train(storeId, null, true);
            return new RollingEvaluation(EvaluationOutcome.RETRAINED, mape, foldMapes.size(),
                retrained.metadata().getModelVersion(),
                "Mean MAPE " + mape + "% above " + e.getMapeThreshold() + "%, model retrained");
        }
        return new RollingEvaluation(EvaluationOutcome.GOOD, mape, foldMapes.size(), version,
            "Mean MAPE " + mape + "% within " + e.getMapeThreshold() + "%");
    }

    /**
     * Scores the published model on the last validation days of observed history, feeding the
     * observed regressors instead of synthesized ones. Compared with the stored validation MAPE
     * this separates model error from regressor synthesis error.
     *
     * @throws StoreBusyException when the store is being trained
     */
    public AccuracyResult actualDataAccuracy(String storeId) {
        TrainingProperties t = properties.getTraining();
        try (StoreLease lease = locks.tryShared(storeId)
                .orElseThrow(() -> new StoreBusyException(storeId, "accuracy check"))) {
            Optional<TrainedModel> trained = modelStore.load(storeId);
            if (trained.isEmpty()) {
                return AccuracyResult.insufficientData("No loadable model");
            }
            ModelMetadata m = trained.get().metadata();
            ForecastModel model = trained.get().model();
            List<Observation> history = salesHistory.history(storeId);
            List<Observation> recent = history.subList(Math.max(0, history.size() - t.getWindowDays()), history.size());
            if (recent.size() < t.getMinTrainingDays()) {
                return AccuracyResult.insufficientData("Need " + t.getMinTrainingDays()
                    + " days of history, have " + recent.size());
            }
            try {
                FeatureFrame frame = featureEngineer.prepare(recent, m.getOutlierPolicy(),
                    new SmoothingConfig(m.isSmoothingApplied(), m.getSmoothingWindow()));
                int days = Math.min(t.getValidationDays(), frame.size());
                FeatureFrame scored = frame.slice(frame.size() - days, frame.size());
                PredictionFrame predicted = model.predict(
                    scaler.transform(scored, m.getScalerParams()).select(model.regressors()));
                double[] yhat = predicted.yhat();
                if (m.isLogTransform()) {
                    for (int i = 0; i < yhat.length; i++) {
                        yhat[i] = TargetTransform.inverse(yhat[i]);
                    }
                }
                double mape = SeriesStats.round(SeriesStats.mape(scored.column(TARGET_ORIGINAL), yhat), 2);
                log.info("Actual-data accuracy | store={} | version={} | days={} | mape={}",
                    storeId, m.getModelVersion(), days, mape);
                return AccuracyResult.scored(mape, accuracyFrom(mape));
            } catch (RuntimeException e) {
                log.error("Actual-data accuracy failed | store={}", storeId, e);
                return AccuracyResult.computationError(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
        }
    }

    /** Ascending fold cutoffs: the last one leaves a full horizon, the first leaves the initial period. */
    static List<LocalDate> rollingCutoffs(LocalDate first, LocalDate last, EvaluationProperties e) {
        LocalDate earliest = first.plusDays(e.getInitialDays() - 1L);
        List<LocalDate> cutoffs = new ArrayList<>();
        for (LocalDate c = last.minusDays(e.getHorizonDays()); !c.isBefore(earliest); c = c.minusDays(e.getPeriodDays())) {
            cutoffs.add(0, c);
        }
        return cutoffs;
    }

    /**
     * Fits on rows {@code [0, split)} and scores rows {@code [split, end)}. The scored rows'
     * regressors are synthesized from earlier history only and scaled with parameters fitted
     * on the training rows only.
     */
    private HoldoutScore scoreHoldout(List<Observation> history, FeatureFrame frame, int split, int end,
                                      EngineParams params, Map<String, Double> priors,
                                      List<String> scaledColumns, EventCalendar calendar) {
        FeatureFrame trainPart = frame.slice(0, split);
        ScalerParams trainScaler = scaler.fit(trainPart, scaledColumns);
        FeatureFrame scaledTrain = scaler.transform(trainPart, trainScaler);
        ForecastModel evalModel = engine.fit(trainingInput(scaledTrain, priors), params, priors);

        double[] trainPredicted = toOriginalScale(evalModel.predict(scaledTrain.select(evalModel.regressors())));
        double trainMape = SeriesStats.mape(trainPart.column(TARGET_ORIGINAL), trainPredicted);

        List<LocalDate> dates = frame.date(split).datesUntil(frame.date(end - 1).plusDays(1)).toList();
        FeatureFrame synthesized = synthesizer.synthesize(dates, history, calendar, SynthesisMode.VALIDATION);
        SynthesisReport report = synthesizer.validate(synthesized);
        if (!report.ok()) {
            throw new SynthesisValidationException(report.errors());
        }
        PredictionFrame predicted = evalModel.predict(
            scaler.transform(synthesized, trainScaler).select(evalModel.regressors()));
        double[] predictedValues = toOriginalScale(predicted);
        Map<LocalDate, Double> byDate = new HashMap<>();
        for (int i = 0; i < predicted.size(); i++) {
            byDate.put(predicted.get(i).date(), predictedValues[i]);
        }
        List<Double> actual = new ArrayList<>();
        List<Double> forecast = new ArrayList<>();
        for (int i = split; i < end; i++) {
            Double p = byDate.get(frame.date(i));
            if (p != null) {
                actual.add(frame.value(TARGET_ORIGINAL, i));
                forecast.add(p);
            }
        }
        double validationMape = SeriesStats.mape(
            actual.stream().mapToDouble(Double::doubleValue).toArray(),
            forecast.stream().mapToDouble(Double::doubleValue).toArray());
        return new HoldoutScore(trainMape, validationMape);
    }

    private static double accuracyFrom(double validationMape) {
        return SeriesStats.round(SeriesStats.clamp(100.0 - validationMape, 0.0, 100.0), 1);
    }

    private static int rowsThrough(FeatureFrame frame, LocalDate date) {
        int rows = 0;
        while (rows < frame.size() && !frame.date(rows).isAfter(date)) {
            rows++;
        }
        return rows;
    }

    private Map<String, Double> activePriorScales(FeatureFrame frame) {
        Map<String, Double> active = new LinkedHashMap<>();
        properties.getRegressors().getPriorScales().forEach((name, scale) -> {
            if (frame.hasColumn(name)) {
                active.put(name, scale);
            }
        });
        return active;
    }

    private static FeatureFrame trainingInput(FeatureFrame scaled, Map<String, Double> priors) {
        List<String> columns = new ArrayList<>();
        columns.add(TARGET);
        columns.addAll(priors.keySet());
        return scaled.select(columns);
    }

    private double[] toOriginalScale(PredictionFrame prediction) {
        double[] yhat = prediction.yhat();
        if (properties.getTraining().isLogTransform()) {
            for (int i = 0; i < yhat.length; i++) {
                yhat[i] = TargetTransform.inverse(yhat[i]);
            }
        }
        return yhat;
    }

    private record HoldoutScore(double trainMape, double validationMape) {
    }
}
