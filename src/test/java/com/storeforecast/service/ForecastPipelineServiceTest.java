package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.dto.FitStatus;
import com.storeforecast.dto.ModelAccuracyResponse;
import com.storeforecast.dto.ModelHealth;
import com.storeforecast.dto.ModelHistoryResponse;
import com.storeforecast.dto.ModelStatusResponse;
import com.storeforecast.dto.RetrainCheckResponse;
import com.storeforecast.dto.RetrainOutcome;
import com.storeforecast.exception.DataQualityException;
import com.storeforecast.exception.ForecastFailedException;
import com.storeforecast.exception.InvalidForecastRequestException;
import com.storeforecast.exception.ModelStoreException;
import com.storeforecast.exception.StoreBusyException;
import com.storeforecast.model.AccuracyResult;
import com.storeforecast.model.AccuracyStatus;
import com.storeforecast.model.EvaluationOutcome;
import com.storeforecast.model.ModelMetadata;
import com.storeforecast.model.RetrainDecision;
import com.storeforecast.model.RollingEvaluation;
import com.storeforecast.model.TrainedModel;
import com.storeforecast.pipeline.ForecastValidator;
import com.storeforecast.pipeline.FutureFeatureSynthesizer;
import com.storeforecast.pipeline.Scaler;
import com.storeforecast.store.ModelStore;
import com.storeforecast.store.StoreLockRegistry;
import com.storeforecast.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ForecastPipelineServiceTest {

    @Mock ModelLifecycleManager lifecycle;
    @Mock SalesHistoryService   salesHistory;
    @Mock ModelStore            modelStore;
    @Mock StoreLockRegistry     locks;
    @Mock RestockAdvisor        restockAdvisor;
    @Mock RetrainScheduler      retrainScheduler;

    private ForecastPipelineService service;

    @BeforeEach
    void setUp() {
        ForecastProperties properties = new ForecastProperties();
        service = new ForecastPipelineService(properties, lifecycle, salesHistory,
            new FutureFeatureSynthesizer(properties, TestData.CLOCK), new Scaler(), new ForecastValidator(properties),
            modelStore, locks, restockAdvisor, retrainScheduler, TestData.CLOCK);
    }

    private static ModelMetadata metadata(String version, Double trainMape, Double validationMape, Double accuracy) {
        return ModelMetadata.builder()
            .modelVersion(version)
            .storeId("1")
            .trainingWindowDays(180)
            .dataPoints(180)
            .startDate(TestData.TODAY.minusDays(179))
            .endDate(TestData.TODAY)
            .trainMape(trainMape)
            .validationMape(validationMape)
            .accuracy(accuracy)
            .accuracyStatus(accuracy != null ? AccuracyStatus.COMPUTED : AccuracyStatus.INSUFFICIENT_DATA)
            .validationDays(14)
            .savedAt(Instant.parse("2024-06-29T12:00:00Z"))
            .build();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -3, 366})
    void predict_horizonOutOfRange_rejectedBeforeAnyWork(int days) {
        assertThatThrownBy(() -> service.predict("1", days, List.of()))
            .isInstanceOf(InvalidForecastRequestException.class)
            .hasMessageContaining("between 1 and 365");
        verifyNoInteractions(salesHistory, lifecycle, modelStore);
    }

    @Test
    void predict_insufficientHistory_throwsDataQuality() {
        when(salesHistory.history("1")).thenReturn(TestData.series(TestData.TODAY, 10, i -> 100.0));

        assertThatThrownBy(() -> service.predict("1", null, null))
            .isInstanceOf(DataQualityException.class)
            .hasMessageContaining("10 days");
        verifyNoInteractions(lifecycle);
    }

    @Test
    void predict_withoutModel_trainsFirst() {
        when(salesHistory.history("1")).thenReturn(TestData.series(TestData.TODAY, 60, TestData::weeklyPattern));
        when(modelStore.loadMetadata("1")).thenReturn(Optional.empty());
        when(locks.tryShared("1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.predict("1", 7, List.of()))
            .isInstanceOf(StoreBusyException.class);
        verify(lifecycle).train("1", null, true);
    }

    @Test
    void predict_storeBusy_throwsStoreBusy() {
        when(salesHistory.history("1")).thenReturn(TestData.series(TestData.TODAY, 60, TestData::weeklyPattern));
        when(modelStore.loadMetadata("1")).thenReturn(Optional.of(metadata("v1", 5.0, 8.0, 92.0)));
        when(locks.tryShared("1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.predict("1", 7, List.of()))
            .isInstanceOf(StoreBusyException.class)
            .hasMessageContaining("prediction");
        verify(lifecycle, never()).train(anyString(), any(), anyBoolean());
    }

    @Test
    void predict_unexpectedFailure_wrappedAsPredictionFailure() {
        when(salesHistory.history("1")).thenThrow(new IllegalStateException("connection reset"));

        assertThatThrownBy(() -> service.predict("1", 7, List.of()))
            .isInstanceOf(ForecastFailedException.class)
            .hasRootCauseMessage("connection reset")
            .extracting("errorCode").isEqualTo("PREDICTION_FAILED");
    }

    @Test
    void train_unexpectedFailure_wrappedAsTrainingFailure() {
        when(lifecycle.train("1", null, true)).thenThrow(new IllegalStateException("disk full"));

        assertThatThrownBy(() -> service.train("1", true))
            .isInstanceOf(ForecastFailedException.class)
            .extracting("errorCode").isEqualTo("TRAINING_FAILED");
    }

    @Test
    void train_pipelineErrorPassesThroughUnchanged() {
        DataQualityException error = new DataQualityException("Insufficient data");
        when(lifecycle.train("1", null, false)).thenThrow(error);

        assertThatThrownBy(() -> service.train("1", false)).isSameAs(error);
    }

    @Test
    void train_returnsMetadataOfTrainedModel() {
        ModelMetadata m = metadata("v1", 5.0, 8.0, 92.0);
        when(lifecycle.train("1", null, false)).thenReturn(new TrainedModel(null, m));

        assertThat(service.train("1", false)).isSameAs(m);
    }

    @Test
    void modelStatus_noModel_reportsNoModel() {
        when(modelStore.loadMetadata("1")).thenReturn(Optional.empty());
        when(retrainScheduler.nextRunTime("1")).thenReturn(Optional.empty());

        ModelStatusResponse status = service.modelStatus("1");

        assertThat(status.getStatus()).isEqualTo(ModelHealth.NO_MODEL);
        assertThat(status.isShouldRetrain()).isTrue();
        assertThat(status.getAccuracyThreshold()).isEqualTo(82.0);
    }

    @Test
    void modelStatus_existingModel_reportsDecisionAndAges() {
        ModelMetadata m = metadata("v1", 5.0, 8.0, 92.0);
        when(modelStore.loadMetadata("1")).thenReturn(Optional.of(m));
        when(retrainScheduler.nextRunTime("1")).thenReturn(Optional.empty());
        when(lifecycle.shouldRetrain("1")).thenReturn(RetrainDecision.keep("Model is up to date"));
        when(lifecycle.modelAgeDays(m)).thenReturn(1L);

        ModelStatusResponse status = service.modelStatus("1");

        assertThat(status.getStatus()).isEqualTo(ModelHealth.HEALTHY);
        assertThat(status.getModelVersion()).isEqualTo("v1");
        assertThat(status.getModelAgeDays()).isEqualTo(1L);
        assertThat(status.getDataAgeDays()).isZero();
        assertThat(status.getAccuracy()).isEqualTo(92.0);
    }

    @Test
    void checkAndRetrain_upToDate_doesNotTrain() {
        when(lifecycle.shouldRetrain("1")).thenReturn(RetrainDecision.keep("Model is up to date"));
        when(modelStore.currentVersion("1")).thenReturn(Optional.of("v1"));

        RetrainCheckResponse response = service.checkAndRetrain("1");

        assertThat(response.getStatus()).isEqualTo(RetrainOutcome.UP_TO_DATE);
        assertThat(response.getModelVersion()).isEqualTo("v1");
        verify(lifecycle, never()).train(anyString(), any(), anyBoolean());
    }

    @Test
    void checkAndRetrain_due_trainsAndReportsNewVersion() {
        when(lifecycle.shouldRetrain("1")).thenReturn(RetrainDecision.retrain("Model age 9 days reached the maximum of 7 days"));
        when(lifecycle.train("1", null, true)).thenReturn(new TrainedModel(null, metadata("v2", 5.0, 9.0, 91.0)));

        RetrainCheckResponse response = service.checkAndRetrain("1");

        assertThat(response.getStatus()).isEqualTo(RetrainOutcome.RETRAINED);
        assertThat(response.getModelVersion()).isEqualTo("v2");
        assertThat(response.getReason()).contains("age");
    }

    @Test
    void modelHistory_listsArchivedVersions() {
        when(modelStore.history("1", 10)).thenReturn(List.of(metadata("v2", 5.0, 9.0, 91.0), metadata("v1", 5.0, 8.0, 92.0)));
        when(modelStore.currentVersion("1")).thenReturn(Optional.of("v3"));

        ModelHistoryResponse history = service.modelHistory("1");

        assertThat(history.getCurrentVersion()).isEqualTo("v3");
        assertThat(history.getHistoryCount()).isEqualTo(2);
        assertThat(history.getHistory()).extracting(ModelHistoryResponse.Entry::getModelVersion).containsExactly("v2", "v1");
    }

    @Test
    void modelAccuracy_reportsGapAndFitStatus() {
        when(modelStore.loadMetadata("1")).thenReturn(Optional.of(metadata("v1", 4.0, 30.5, 69.5)));
        when(lifecycle.actualDataAccuracy("1")).thenReturn(AccuracyResult.scored(6.2, 93.8));

        ModelAccuracyResponse accuracy = service.modelAccuracy("1");

        assertThat(accuracy.getErrorGap()).isEqualTo(26.5);
        assertThat(accuracy.getFitStatus()).isEqualTo(FitStatus.OVERFITTING);
        assertThat(accuracy.isMapeEstimated()).isFalse();
        assertThat(accuracy.getLastTrained()).isEqualTo(Instant.parse("2024-06-29T12:00:00Z"));
        assertThat(accuracy.getActualDataStatus()).isEqualTo(AccuracyStatus.COMPUTED);
        assertThat(accuracy.getActualDataMape()).isEqualTo(6.2);
        assertThat(accuracy.getActualDataAccuracy()).isEqualTo(93.8);
    }

    @Test
    void modelAccuracy_accuracyWithoutMape_estimatesMapeValues() {
        when(modelStore.loadMetadata("1")).thenReturn(Optional.of(metadata("v1", null, null, 85.0)));
        when(lifecycle.actualDataAccuracy("1")).thenReturn(AccuracyResult.insufficientData("Need 30 days"));

        ModelAccuracyResponse accuracy = service.modelAccuracy("1");

        assertThat(accuracy.isMapeEstimated()).isTrue();
        assertThat(accuracy.getValidationMape()).isEqualTo(15.0);
        assertThat(accuracy.getTrainMape()).isEqualTo(9.0);
        assertThat(accuracy.getErrorGap()).isEqualTo(6.0);
        assertThat(accuracy.getFitStatus()).isEqualTo(FitStatus.GOOD);
        assertThat(accuracy.getActualDataStatus()).isEqualTo(AccuracyStatus.INSUFFICIENT_DATA);
        assertThat(accuracy.getActualDataMape()).isNull();
    }

    @Test
    void evaluateAndTune_returnsLifecycleResult() {
        RollingEvaluation result = new RollingEvaluation(EvaluationOutcome.GOOD, 9.4, 2, "v1", "Mean MAPE 9.4% within 18.0%");
        when(lifecycle.evaluateRollingOrigin("1")).thenReturn(result);

        assertThat(service.evaluateAndTune("1")).isEqualTo(result);
    }

    @Test
    void evaluateAndTune_unexpectedFailure_wrappedAsTrainingFailure() {
        when(lifecycle.evaluateRollingOrigin("1")).thenThrow(new IllegalStateException("fold failed"));

        assertThatThrownBy(() -> service.evaluateAndTune("1"))
            .isInstanceOf(ForecastFailedException.class)
            .extracting("errorCode").isEqualTo("TRAINING_FAILED");
    }

    @Test
    void modelAccuracy_noModel_throwsModelStoreException() {
        when(modelStore.loadMetadata("1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.modelAccuracy("1")).isInstanceOf(ModelStoreException.class);
    }

    @Test
    void fitStatus_classifiesTrainValidationGap() {
        assertThat(ForecastPipelineService.fitStatus(null, 10.0)).isEqualTo(FitStatus.UNKNOWN);
        assertThat(ForecastPipelineService.fitStatus(5.0, 30.0)).isEqualTo(FitStatus.OVERFITTING);
        assertThat(ForecastPipelineService.fitStatus(30.0, 35.0)).isEqualTo(FitStatus.UNDERFITTING);
        assertThat(ForecastPipelineService.fitStatus(8.0, 12.0)).isEqualTo(FitStatus.GOOD);
    }
}
