package com.storeforecast.service;

import com.storeforecast.config.EvaluationProperties;
import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.SchedulerProperties;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.model.RollingEvaluation;
import com.storeforecast.model.TrainedModel;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Per store, a cron job that retrains when the current model is due and a weekly rolling-origin
 * evaluation. A failed run is logged and the next run is attempted on schedule.
 */
@Slf4j
@Service
public class RetrainScheduler {

    private final ForecastProperties properties;
    private final ModelLifecycleManager lifecycle;
    private final Clock clock;
    private final Map<String, ScheduledFuture<?>> jobs = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> evaluations = new ConcurrentHashMap<>();
    private ThreadPoolTaskScheduler taskScheduler;

    public RetrainScheduler(ForecastProperties properties, ModelLifecycleManager lifecycle, Clock clock) {
        this.properties = properties;
        this.lifecycle = lifecycle;
        this.clock = clock;
    }

    @PostConstruct
    void start() {
        SchedulerProperties s = properties.getScheduler();
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(Math.max(1, s.getPoolSize()));
        taskScheduler.setThreadNamePrefix("retrain-");
        taskScheduler.initialize();
        if (!s.isEnabled()) {
            log.info("Automatic retraining disabled");
            return;
        }
        s.getStoreIds().forEach(this::schedule);
        if (properties.getEvaluation().isEnabled()) {
            s.getStoreIds().forEach(this::scheduleEvaluation);
        }
    }

    @PreDestroy
    void stop() {
        jobs.values().forEach(f -> f.cancel(false));
        jobs.clear();
        evaluations.values().forEach(f -> f.cancel(false));
        evaluations.clear();
        if (taskScheduler != null) {
            taskScheduler.shutdown();
        }
    }

    public void schedule(String storeId) {
        String cron = cronExpression(properties.getScheduler());
        ScheduledFuture<?> previous = jobs.remove(storeId);
        if (previous != null) {
            previous.cancel(false);
        }
        ScheduledFuture<?> future = taskScheduler.schedule(() -> runRetrainCycle(storeId), new CronTrigger(cron, zone()));
        jobs.put(storeId, future);
        log.info("Retrain scheduled | store={} | cron='{}' | zone={} | next={}",
            storeId, cron, zone(), nextRunTime(storeId).orElse(null));
    }

    public void scheduleEvaluation(String storeId) {
        String cron = evaluationCronExpression(properties.getEvaluation());
        ScheduledFuture<?> previous = evaluations.remove(storeId);
        if (previous != null) {
            previous.cancel(false);
        }
        evaluations.put(storeId, taskScheduler.schedule(() -> runEvaluationCycle(storeId), new CronTrigger(cron, zone())));
        log.info("Rolling evaluation scheduled | store={} | cron='{}' | zone={}", storeId, cron, zone());
    }

    /** Cancels both the retrain job and the weekly evaluation of a store. */
    public void cancel(String storeId) {
        ScheduledFuture<?> future = jobs.remove(storeId);
        if (future != null) {
            future.cancel(false);
            log.info("Retrain schedule cancelled | store={}", storeId);
        }
        ScheduledFuture<?> evaluation = evaluations.remove(storeId);
        if (evaluation != null) {
            evaluation.cancel(false);
        }
    }

    public boolean isScheduled(String storeId) {
        return active(jobs.get(storeId));
    }

    public boolean isEvaluationScheduled(String storeId) {
        return active(evaluations.get(storeId));
    }

    /** Runs one cycle now on the scheduler's threads. */
    public CompletableFuture<Optional<ModelMetadata>> triggerNow(String storeId) {
        log.info("Manual retrain requested | store={}", storeId);
        return CompletableFuture.supplyAsync(() -> runRetrainCycle(storeId), taskScheduler);
    }

    public Optional<ZonedDateTime> nextRunTime(String storeId) {
        return isScheduled(storeId) ? next(cronExpression(properties.getScheduler())) : Optional.empty();
    }

    public Optional<ZonedDateTime> nextEvaluationTime(String storeId) {
        return isEvaluationScheduled(storeId)
            ? next(evaluationCronExpression(properties.getEvaluation()))
            : Optional.empty();
    }

    /**
     * Retrains if due. Never throws: failures are logged and reported as empty.
     */
    public Optional<ModelMetadata> runRetrainCycle(String storeId) {
        try {
            Optional<ModelMetadata> result = lifecycle.autoRetrainIfNeeded(storeId).map(TrainedModel::metadata);
            result.ifPresent(m -> {
                log.info("Scheduled retrain finished | store={} | version={} | accuracy={}",
                    storeId, m.getModelVersion(), m.getAccuracy());
                if (m.getAccuracy() != null && m.getAccuracy() < properties.getScheduler().getLowAccuracyWarning()) {
                    log.warn("Retrained model accuracy is low | store={} | accuracy={} | warn_below={}",
                        storeId, m.getAccuracy(), properties.getScheduler().getLowAccuracyWarning());
                }
            });
            return result;
        } catch (Exception e) {
            log.error("Scheduled retrain failed | store={} | error={}", storeId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Evaluates the current model and retrains it when it degraded. Never throws.
     */
    public Optional<RollingEvaluation> runEvaluationCycle(String storeId) {
        try {
            RollingEvaluation result = lifecycle.evaluateRollingOrigin(storeId);
            log.info("Scheduled evaluation finished | store={} | outcome={} | mape={} | folds={}",
                storeId, result.outcome(), result.mape(), result.folds());
            return Optional.of(result);
        } catch (Exception e) {
            log.error("Scheduled evaluation failed | store={} | error={}", storeId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /** Spring cron (seconds first) for {@code daily} or {@code weekly} at the configured time. */
    static String cronExpression(SchedulerProperties s) {
        String[] parts = s.getTime().split(":");
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        String schedule = s.getSchedule() == null ? "daily" : s.getSchedule().toLowerCase(Locale.ROOT);
        switch (schedule) {
            case "weekly":
                return String.format("0 %d %d * * MON", minute, hour);
            case "daily":
                return String.format("0 %d %d * * *", minute, hour);
            default:
                log.warn("Unknown retrain schedule '{}', using daily", s.getSchedule());
                return String.format("0 %d %d * * *", minute, hour);
        }
    }

    static String evaluationCronExpression(EvaluationProperties e) {
        String[] parts = e.getTime().split(":");
        return String.format("0 %d %d * * MON", Integer.parseInt(parts[1]), Integer.parseInt(parts[0]));
    }

    private Optional<ZonedDateTime> next(String expression) {
        CronExpression cron = CronExpression.parse(expression);
        return Optional.ofNullable(cron.next(ZonedDateTime.now(clock.withZone(zone()))));
    }

    private static boolean active(ScheduledFuture<?> future) {
        return future != null && !future.isCancelled() && !future.isDone();
    }

    private ZoneId zone() {
        return ZoneId.of(properties.getZoneId());
    }
}
