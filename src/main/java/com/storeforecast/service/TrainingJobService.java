package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.dto.TrainingJobResponse;
import com.storeforecast.dto.TrainingJobStatus;
import com.storeforecast.exception.ForecastPipelineException;
import com.storeforecast.exception.JobNotFoundException;
import com.storeforecast.model.ModelMetadata;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs training on a dedicated pool so callers get a job id back immediately.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TrainingJobService {

    private final ForecastProperties properties;
    private final ForecastPipelineService pipeline;
    private final Clock clock;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(1, properties.getJobs().getPoolSize()));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public TrainingJobResponse submitTraining(String storeId, boolean forceRetrain) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, storeId, forceRetrain, Instant.now(clock));
        jobs.put(jobId, state);
        cleanupIfNeeded();

        CompletableFuture.runAsync(() -> execute(state), executor);
        log.info("Training job queued | job={} | store={} | force={}", jobId, storeId, forceRetrain);
        return state.toResponse();
    }

    public TrainingJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state) {
        state.markRunning(Instant.now(clock));
        try {
            ModelMetadata result = pipeline.train(state.storeId, state.forceRetrain);
            state.markCompleted(result, Instant.now(clock));
            log.info("Training job completed | job={} | store={} | version={}",
                state.jobId, state.storeId, result.getModelVersion());
        } catch (ForecastPipelineException ex) {
            state.markFailed(ex.getErrorCode(), ex.getMessage(), Instant.now(clock));
            log.warn("Training job failed | job={} | store={} | code={} | message={}",
                state.jobId, state.storeId, ex.getErrorCode(), ex.getMessage());
        } catch (RuntimeException ex) {
            state.markFailed("TRAINING_FAILED",
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), Instant.now(clock));
            log.error("Training job failed | job={} | store={}", state.jobId, state.storeId, ex);
        }
    }

    private void cleanupIfNeeded() {
        int maxRetained = properties.getJobs().getMaxRetained();
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().status == TrainingJobStatus.COMPLETED || e.getValue().status == TrainingJobStatus.FAILED)
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String storeId;
        private final boolean forceRetrain;
        private final Instant createdAt;
        private volatile Instant startedAt;
        private volatile Instant completedAt;
        private volatile TrainingJobStatus status;
        private volatile String message;
        private volatile String errorCode;
        private volatile ModelMetadata result;

        private JobState(UUID jobId, String storeId, boolean forceRetrain, Instant createdAt) {
            this.jobId = jobId;
            this.storeId = storeId;
            this.forceRetrain = forceRetrain;
            this.createdAt = createdAt;
            this.status = TrainingJobStatus.QUEUED;
            this.message = "Queued";
        }

        private synchronized void markRunning(Instant now) {
            this.startedAt = now;
            this.status = TrainingJobStatus.RUNNING;
            this.message = "Training started";
        }

        private synchronized void markCompleted(ModelMetadata result, Instant now) {
            this.completedAt = now;
            this.status = TrainingJobStatus.COMPLETED;
            this.result = result;
            this.message = "Model " + result.getModelVersion() + " ready";
        }

        private synchronized void markFailed(String errorCode, String message, Instant now) {
            this.completedAt = now;
            this.status = TrainingJobStatus.FAILED;
            this.errorCode = errorCode;
            this.message = message;
        }

        private synchronized TrainingJobResponse toResponse() {
            return TrainingJobResponse.builder()
                .jobId(jobId)
                .storeId(storeId)
                .forceRetrain(forceRetrain)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .build();
        }
    }
}
