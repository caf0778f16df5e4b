package com.forecastmonitor.analysis;

import com.forecastmonitor.exception.InsufficientDataException;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.SeriesPoint;
import com.forecastmonitor.model.TimeSeries;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects a series forward with the algorithm of the descriptor's {@link com.forecastmonitor.model.ModelFamily}.
 *
 * <p>Output points follow the calendar step of the input, are non-negative and rounded to two
 * decimals. All randomness comes from the injected {@link NoiseSource}.
 */
@Component
@RequiredArgsConstructor
public class PredictionGenerator {

    static final int DEFAULT_WINDOW_SIZE = 3;
    static final int DEFAULT_TREE_COUNT = 5;
    static final int DEFAULT_SEASONAL_PERIOD = 12;

    private final NoiseSource noiseSource;

    @Value("${forecast.default-step:MONTHLY}")
    private ForecastStep defaultStep = ForecastStep.MONTHLY;

    public TimeSeries generate(TimeSeries series, ModelDescriptor model, int horizonPeriods) {
        if (series.isEmpty()) {
            throw new InsufficientDataException(0, 1);
        }
        if (horizonPeriods < 1) {
            throw new InvalidRequestException("Horizon must be at least 1 period, was " + horizonPeriods + ".");
        }

        SeriesStatistics stats = SeriesStatisticsCalculator.compute(series);
        Period step = ForecastStep.infer(series, defaultStep);
        LocalDate baseDate = series.last().date();

        List<SeriesPoint> predictions = new ArrayList<>(horizonPeriods);
        for (int i = 1; i <= horizonPeriods; i++) {
            double value = predictValue(model, series, stats, i);
            double noise = (noiseSource.next() - 0.5) * stats.getStdDev() * 0.1;
            value = Double.isFinite(value) ? value + noise : series.last().value();
            predictions.add(new SeriesPoint(ForecastStep.advance(baseDate, step, i), round(Math.max(0.0, value))));
        }
        return TimeSeries.of(predictions);
    }

    double predictValue(ModelDescriptor model, TimeSeries series, SeriesStatistics stats, int i) {
        double last = series.last().value();
        double trend = stats.getTrendPerPeriod();
        double mean = stats.getMean();

        return switch (model.getFamily()) {
            case TREND -> last + trend * mean * i;
            case MOVING_AVERAGE -> {
                int window = Math.min(series.size(), model.intParameter("window_size", DEFAULT_WINDOW_SIZE));
                double sum = 0.0;
                for (int k = series.size() - window; k < series.size(); k++) {
                    sum += series.get(k).value();
                }
                yield (sum / window) * (1 + trend * i * 0.5);
            }
            case SMOOTHING -> last * Math.pow(1 + trend, i) * (0.85 + noiseSource.next() * 0.3);
            case POLYNOMIAL -> {
                double a = trend * 0.001;
                double b = trend;
                yield a * i * i + b * i + last;
            }
            case NEURAL -> {
                double hidden1 = Math.tanh((trend + i * 0.1) * 0.5);
                double hidden2 = 1.0 / (1.0 + Math.exp(-(hidden1 + trend)));
                yield last * (1 + hidden2 * trend * i + Math.sin(i * 0.3) * 0.1);
            }
            case AUTOREGRESSIVE -> last * 0.7 + mean * 0.3 + trend * mean * i * 0.8;
            case ENSEMBLE -> {
                int trees = model.intParameter("tree_count", DEFAULT_TREE_COUNT);
                double ensemble = 0.0;
                for (int t = 0; t < trees; t++) {
                    ensemble += last * (1 + trend * i + (noiseSource.next() - 0.5) * 0.2);
                }
                yield ensemble / trees;
            }
            case SEASONAL -> {
                int period = model.intParameter("period", DEFAULT_SEASONAL_PERIOD);
                double seasonalFactor = 1 + 0.1 * Math.sin((i * 2 * Math.PI) / period);
                yield (last + trend * mean * i) * seasonalFactor;
            }
            case DEFAULT -> last * (1 + trend * i);
        };
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
