package com.storeforecast.service;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.config.PredictionProperties;
import com.storeforecast.dto.ForecastResponse.RestockRecommendation;
import com.storeforecast.dto.RiskLevel;
import com.storeforecast.model.ProductSales;
import com.storeforecast.pipeline.SeriesStats;
import com.storeforecast.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Scales recent product sales by the forecast's growth over recent store sales and turns the
 * result into restock quantities for the best sellers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RestockAdvisor {

    private final ForecastProperties properties;
    private final ProductRepository productRepository;
    private final Clock clock;

    /** Mean predicted over mean recent actual, clamped; the configured default when there is no positive history. */
    public double growthFactor(double[] recentActual, double[] predicted) {
        PredictionProperties p = properties.getPrediction();
        double recent = SeriesStats.mean(recentActual);
        double future = SeriesStats.mean(predicted);
        if (!(recent > 0) || !Double.isFinite(future)) {
            return p.getDefaultGrowthFactor();
        }
        return SeriesStats.round(SeriesStats.clamp(future / recent, p.getMinGrowthFactor(), p.getMaxGrowthFactor()), 3);
    }

    @Transactional(readOnly = true)
    public List<RestockRecommendation> recommend(double growthFactor) {
        PredictionProperties p = properties.getPrediction();
        LocalDate since = LocalDate.now(clock).minusDays(p.getRestockLookbackDays());
        List<ProductSales> sellers = productRepository.findTopSellersSince(
            since, PageRequest.of(0, p.getRestockProductLimit()));
        log.debug("Restock candidates | since={} | products={} | growth_factor={}", since, sellers.size(), growthFactor);
        return sellers.stream().map(s -> toRecommendation(s, growthFactor)).toList();
    }

    RestockRecommendation toRecommendation(ProductSales sales, double growthFactor) {
        PredictionProperties p = properties.getPrediction();
        long sold = sales.unitsSold() != null ? sales.unitsSold() : 0L;
        int stock = sales.stock() != null ? sales.stock() : 0;
        long demand = Math.max(1L, Math.round(Math.max(sold, 1L) * growthFactor));
        double coverage = (double) stock / demand;
        RiskLevel urgency = coverage < p.getHighUrgencyCoverage() ? RiskLevel.HIGH
            : coverage < p.getMediumUrgencyCoverage() ? RiskLevel.MEDIUM
            : RiskLevel.LOW;
        return RestockRecommendation.builder()
            .productId(sales.productId())
            .productName(sales.name())
            .category(sales.category())
            .currentStock(stock)
            .unitsSoldLastPeriod(sold)
            .predictedDemand(demand)
            .recommendedRestock(Math.max(0L, demand - stock))
            .urgency(urgency)
            .build();
    }
}
