package com.forecastmonitor.analysis;

import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.TimeSeries;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Heuristic fit of a model to the statistical profile of a series. Advisory only: the score ranks
 * and annotates models, it never prevents one from being used.
 */
@Component
public class CompatibilityScorer {

    static final int BASE_SCORE = 70;
    static final int MIN_SCORE = 40;
    static final int MAX_SCORE = 95;
    static final int MIN_POINTS = 3;

    private static final Set<String> SEASONAL_TYPES = Set.of("sales", "revenue");

    @Value("${forecast.recommended-score:85}")
    private int recommendedScore = 85;

    public int score(ModelDescriptor model, TimeSeries series, String seriesType) {
        if (series.size() < MIN_POINTS) {
            return BASE_SCORE;
        }
        SeriesStatistics stats = SeriesStatisticsCalculator.compute(series);
        double volatility = stats.getVolatilityPct();
        double trend = Math.abs(stats.getTrendStrengthPct());
        int n = stats.getSize();

        int score = BASE_SCORE;
        switch (model.getFamily()) {
            case TREND -> {
                score += trend > 10 ? 20 : 0;
                score += volatility < 20 ? 10 : -10;
            }
            case ENSEMBLE, NEURAL -> {
                score += volatility > 20 ? 15 : 0;
                score += n > 20 ? 10 : -5;
            }
            case MOVING_AVERAGE -> {
                score += volatility < 30 ? 15 : -10;
                score += trend < 15 ? 10 : 0;
            }
            case AUTOREGRESSIVE -> {
                score += n > 12 ? 15 : -10;
                score += trend > 5 ? 10 : 0;
            }
            case SEASONAL -> {
                score += seriesType != null && SEASONAL_TYPES.contains(seriesType.toLowerCase()) ? 15 : 0;
                score += n > 24 ? 10 : -5;
            }
            case SMOOTHING -> {
                score += trend > 5 && trend < 25 ? 15 : 0;
                score += volatility < 25 ? 10 : 0;
            }
            default -> {
                // base score only
            }
        }
        return Math.min(MAX_SCORE, Math.max(MIN_SCORE, score));
    }

    public boolean isRecommended(int score) {
        return score >= recommendedScore;
    }

    public List<ModelScore> rank(Collection<ModelDescriptor> models, TimeSeries series, String seriesType) {
        return models.stream()
            .map(model -> {
                int score = score(model, series, seriesType);
                return ModelScore.builder()
                    .model(model)
                    .score(score)
                    .recommended(isRecommended(score))
                    .build();
            })
            .sorted(Comparator.comparingInt(ModelScore::getScore).reversed()
                .thenComparing(s -> s.getModel().getName()))
            .toList();
    }
}
