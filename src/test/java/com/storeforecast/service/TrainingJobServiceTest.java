package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.dto.TrainingJobResponse;
import com.storeforecast.dto.TrainingJobStatus;
import com.storeforecast.exception.DataQualityException;
import com.storeforecast.exception.JobNotFoundException;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.support.TestData;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TrainingJobServiceTest {

    @Mock ForecastPipelineService pipeline;

    private TrainingJobService service;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        service = new TrainingJobService(properties, pipeline, TestData.CLOCK);
        service.init();
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
    }

    private TrainingJobResponse awaitFinished(UUID jobId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5_000;
        TrainingJobResponse job = service.getJob(jobId);
        while (job.getStatus() != TrainingJobStatus.COMPLETED && job.getStatus() != TrainingJobStatus.FAILED
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
            job = service.getJob(jobId);
        }
        return job;
    }

    @Test
    void submitTraining_completesWithModelMetadata() throws Exception {
        ModelMetadata m = ModelMetadata.builder().modelVersion("20240630_120000").storeId("1").build();
        when(pipeline.train("1", true)).thenReturn(m);

        TrainingJobResponse queued = service.submitTraining("1", true);
        TrainingJobResponse done = awaitFinished(queued.getJobId());

        assertThat(queued.getStoreId()).isEqualTo("1");
        assertThat(done.getStatus()).isEqualTo(TrainingJobStatus.COMPLETED);
        assertThat(done.getResult()).isEqualTo(m);
        assertThat(done.getMessage()).contains("20240630_120000");
    }

    @Test
    void submitTraining_pipelineError_failsWithErrorCode() throws Exception {
        when(pipeline.train("1", false)).thenThrow(new DataQualityException("Insufficient data: 3 days"));

        TrainingJobResponse done = awaitFinished(service.submitTraining("1", false).getJobId());

        assertThat(done.getStatus()).isEqualTo(TrainingJobStatus.FAILED);
        assertThat(done.getErrorCode()).isEqualTo("DATA_QUALITY");
        assertThat(done.getMessage()).contains("Insufficient data");
    }

    @Test
    void getJob_unknownId_throwsJobNotFound() {
        UUID unknown = UUID.randomUUID();

        assertThatThrownBy(() -> service.getJob(unknown))
            .isInstanceOf(JobNotFoundException.class)
            .hasMessageContaining(unknown.toString());
    }
}
