package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.dto.ForecastResponse.RestockRecommendation;
import com.storeforecast.dto.RiskLevel;
import com.storeforecast.model.ProductSales;
import com.storeforecast.repository.ProductRepository;
import com.storeforecast.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RestockAdvisorTest {

    @Mock ProductRepository productRepository;

    private RestockAdvisor advisor;

    @BeforeEach
    void setUp() {
        advisor = new RestockAdvisor(new ForecastProperties(), productRepository, TestData.CLOCK);
    }

    @Test
    void growthFactor_ratioOfForecastToRecentMean() {
        assertThat(advisor.growthFactor(new double[]{100, 100}, new double[]{120, 130})).isEqualTo(1.25);
    }

    @Test
    void growthFactor_clampedAndDefaultedWithoutHistory() {
        assertThat(advisor.growthFactor(new double[]{100}, new double[]{1_000})).isEqualTo(1.9);
        assertThat(advisor.growthFactor(new double[]{100}, new double[]{10})).isEqualTo(0.6);
        assertThat(advisor.growthFactor(new double[]{0, 0}, new double[]{50})).isEqualTo(1.1);
        assertThat(advisor.growthFactor(new double[0], new double[]{50})).isEqualTo(1.1);
    }

    @Test
    void toRecommendation_lowCoverage_isHighUrgency() {
        RestockRecommendation r = advisor.toRecommendation(new ProductSales(1L, "Rice 5kg", "Staples", 10, 100L), 1.2);

        assertThat(r.getPredictedDemand()).isEqualTo(120);
        assertThat(r.getRecommendedRestock()).isEqualTo(110);
        assertThat(r.getUrgency()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void toRecommendation_coverageBands() {
        assertThat(advisor.toRecommendation(new ProductSales(2L, "Oil", "Staples", 50, 100L), 1.0).getUrgency())
            .isEqualTo(RiskLevel.MEDIUM);
        RestockRecommendation stocked = advisor.toRecommendation(new ProductSales(3L, "Salt", "Staples", 200, 100L), 1.0);
        assertThat(stocked.getUrgency()).isEqualTo(RiskLevel.LOW);
        assertThat(stocked.getRecommendedRestock()).isZero();
    }

    @Test
    void toRecommendation_noSalesOrStock_stillRecommendsOneUnit() {
        RestockRecommendation r = advisor.toRecommendation(new ProductSales(4L, "New item", null, null, null), 1.0);

        assertThat(r.getPredictedDemand()).isEqualTo(1);
        assertThat(r.getCurrentStock()).isZero();
        assertThat(r.getRecommendedRestock()).isEqualTo(1);
    }

    @Test
    void recommend_queriesTopSellersOverLookbackWindow() {
        when(productRepository.findTopSellersSince(TestData.TODAY.minusDays(30), PageRequest.of(0, 5)))
            .thenReturn(List.of(new ProductSales(1L, "Rice 5kg", "Staples", 10, 100L)));

        List<RestockRecommendation> result = advisor.recommend(1.0);

        assertThat(result).singleElement().extracting(RestockRecommendation::getProductName).isEqualTo("Rice 5kg");
    }
}
