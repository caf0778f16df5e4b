package com.forecastmonitor.service;

import com.forecastmonitor.dto.AccuracySummaryResponse;
import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.entity.OutcomeRecord;
import com.forecastmonitor.exception.DateNotPredictedException;
import com.forecastmonitor.exception.DuplicateOutcomeException;
import com.forecastmonitor.exception.ForecastNotFoundException;
import com.forecastmonitor.model.AccuracyTrend;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.model.OutcomePriority;
import com.forecastmonitor.model.PendingOutcome;
import com.forecastmonitor.model.SeriesPoint;
import com.forecastmonitor.repository.ForecastRepository;
import com.forecastmonitor.repository.OutcomeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Matches recorded actuals against predictions and keeps each forecast's windowed accuracy
 * current.
 *
 * <p>The duplicate check is check-then-act; the unique constraint on
 * {@code (forecast_id, outcome_date)} makes a concurrent second insert fail, and that failure is
 * reported as a duplicate as well.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutcomeCorrelationService {

    static final int TREND_RECENT_COUNT = 3;
    static final double TREND_BAND = 2.0;

    private final ForecastRepository forecastRepository;
    private final OutcomeRepository  outcomeRepository;
    private final Clock              clock;

    @Value("${forecast.accuracy-window:5}")
    private int accuracyWindow = 5;

    @Transactional
    public OutcomeRecord recordOutcome(UUID forecastId, LocalDate date, double actualValue) {
        ForecastRecord forecast = forecastRepository.findById(forecastId)
            .orElseThrow(() -> new ForecastNotFoundException(forecastId));
        SeriesPoint prediction = forecast.getPredictedSeries().points().stream()
            .filter(p -> p.date().equals(date))
            .findFirst()
            .orElseThrow(() -> new DateNotPredictedException(forecastId, date));
        if (outcomeRepository.existsByForecastIdAndOutcomeDate(forecastId, date)) {
            throw new DuplicateOutcomeException(forecastId, date);
        }

        OutcomeRecord outcome = OutcomeRecord.builder()
            .forecastId(forecastId)
            .outcomeDate(date)
            .actualValue(actualValue)
            .predictedValue(prediction.value())
            .variance(actualValue - prediction.value())
            .accuracyPercentage(pointAccuracy(prediction.value(), actualValue))
            .recordedAt(clock.instant())
            .build();

        OutcomeRecord saved;
        try {
            saved = outcomeRepository.saveAndFlush(outcome);
        } catch (DataIntegrityViolationException ex) {
            throw new DuplicateOutcomeException(forecastId, date, ex);
        }
        log.info("Outcome recorded | forecastId={} | date={} | predicted={} | actual={} | accuracy={}",
                 forecastId, date, prediction.value(), actualValue, saved.getAccuracyPercentage());

        reevaluate(forecast);
        return saved;
    }

    /**
     * Per-point accuracy: {@code 100 * (1 - |predicted - actual| / |actual|)} clamped to [0, 100].
     * A zero actual scores 100 only when the prediction is zero too.
     */
    public static double pointAccuracy(double predicted, double actual) {
        if (actual == 0.0) {
            return predicted == 0.0 ? 100.0 : 0.0;
        }
        double accuracy = 100.0 * (1.0 - Math.abs(predicted - actual) / Math.abs(actual));
        return Math.min(100.0, Math.max(0.0, accuracy));
    }

    @Transactional(readOnly = true)
    public OptionalDouble computeAccuracy(UUID forecastId) {
        if (!forecastRepository.existsById(forecastId)) {
            throw new ForecastNotFoundException(forecastId);
        }
        return windowedAccuracy(outcomeRepository.findByForecastIdOrderByRecordedAtDescOutcomeDateDesc(forecastId));
    }

    /**
     * Refreshes {@code accuracyScore} and completes the forecast once every predicted date has an
     * outcome. Returns the windowed accuracy, empty when nothing has been recorded yet.
     */
    @Transactional
    public OptionalDouble reevaluate(ForecastRecord forecast) {
        List<OutcomeRecord> outcomes =
            outcomeRepository.findByForecastIdOrderByRecordedAtDescOutcomeDateDesc(forecast.getId());
        OptionalDouble accuracy = windowedAccuracy(outcomes);
        forecast.setAccuracyScore(accuracy.isPresent() ? round(accuracy.getAsDouble()) : null);

        Set<LocalDate> recorded = outcomes.stream().map(OutcomeRecord::getOutcomeDate).collect(Collectors.toSet());
        boolean allRecorded = !forecast.getPredictedSeries().isEmpty() && forecast.getPredictedSeries().points().stream()
            .allMatch(p -> recorded.contains(p.date()));
        if (allRecorded && forecast.getStatus() == ForecastStatus.ACTIVE) {
            forecast.setStatus(ForecastStatus.COMPLETED);
            log.info("Forecast completed, all periods tracked | id={}", forecast.getId());
        }
        forecastRepository.save(forecast);
        return accuracy;
    }

    OptionalDouble windowedAccuracy(List<OutcomeRecord> newestFirst) {
        return newestFirst.stream()
            .limit(accuracyWindow)
            .mapToDouble(OutcomeRecord::getAccuracyPercentage)
            .average();
    }

    @Transactional(readOnly = true)
    public List<OutcomeRecord> listOutcomes(UUID forecastId) {
        if (!forecastRepository.existsById(forecastId)) {
            throw new ForecastNotFoundException(forecastId);
        }
        return outcomeRepository.findByForecastIdOrderByOutcomeDateAsc(forecastId);
    }

    @Transactional(readOnly = true)
    public AccuracySummaryResponse summarize(UUID forecastId) {
        ForecastRecord forecast = forecastRepository.findById(forecastId)
            .orElseThrow(() -> new ForecastNotFoundException(forecastId));
        List<OutcomeRecord> byDate = outcomeRepository.findByForecastIdOrderByOutcomeDateAsc(forecastId);
        int predictedPeriods = forecast.getPredictedSeries().size();

        if (byDate.isEmpty()) {
            return AccuracySummaryResponse.builder()
                .forecastId(forecastId)
                .window(accuracyWindow)
                .trend(AccuracyTrend.STABLE)
                .remainingPeriods(predictedPeriods)
                .build();
        }

        double[] accuracies = byDate.stream().mapToDouble(OutcomeRecord::getAccuracyPercentage).toArray();
        List<OutcomeRecord> newestFirst = new ArrayList<>(byDate);
        newestFirst.sort(Comparator.comparing(OutcomeRecord::getRecordedAt)
            .thenComparing(OutcomeRecord::getOutcomeDate).reversed());

        return AccuracySummaryResponse.builder()
            .forecastId(forecastId)
            .sampleCount(byDate.size())
            .window(accuracyWindow)
            .windowedAccuracy(round(windowedAccuracy(newestFirst).orElse(0.0)))
            .averageAccuracy(round(mean(accuracies, 0, accuracies.length)))
            .bestAccuracy(round(Arrays.stream(accuracies).max().orElse(0.0)))
            .worstAccuracy(round(Arrays.stream(accuracies).min().orElse(0.0)))
            .averageVariance(round(byDate.stream().mapToDouble(o -> Math.abs(o.getVariance())).average().orElse(0.0)))
            .trend(trend(accuracies))
            .trackedPeriods(byDate.size())
            .remainingPeriods(Math.max(0, predictedPeriods - byDate.size()))
            .build();
    }

    // Last three outcomes against everything before them, in outcome-date order.
    static AccuracyTrend trend(double[] accuracies) {
        if (accuracies.length <= TREND_RECENT_COUNT) {
            return AccuracyTrend.STABLE;
        }
        int split = accuracies.length - TREND_RECENT_COUNT;
        double recent = mean(accuracies, split, accuracies.length);
        double earlier = mean(accuracies, 0, split);
        if (recent > earlier + TREND_BAND) return AccuracyTrend.IMPROVING;
        if (recent < earlier - TREND_BAND) return AccuracyTrend.DECLINING;
        return AccuracyTrend.STABLE;
    }

    @Transactional(readOnly = true)
    public List<PendingOutcome> findPendingOutcomes(LocalDate asOf) {
        return findPendingOutcomes(
            forecastRepository.findByStatusOrderByCreatedAtAsc(ForecastStatus.ACTIVE),
            outcomeRepository.findAll(),
            asOf);
    }

    /**
     * Every predicted date on or before {@code asOf} of an active forecast that has no outcome yet,
     * highest priority first, then most overdue first.
     */
    public List<PendingOutcome> findPendingOutcomes(
            List<ForecastRecord> forecasts, List<OutcomeRecord> outcomes, LocalDate asOf) {
        Map<UUID, Set<LocalDate>> recorded = outcomes.stream()
            .collect(Collectors.groupingBy(OutcomeRecord::getForecastId,
                Collectors.mapping(OutcomeRecord::getOutcomeDate, Collectors.toSet())));

        List<PendingOutcome> pending = new ArrayList<>();
        for (ForecastRecord forecast : forecasts) {
            if (forecast.getStatus() != ForecastStatus.ACTIVE) {
                continue;
            }
            Set<LocalDate> done = recorded.getOrDefault(forecast.getId(), Set.of());
            for (SeriesPoint prediction : forecast.getPredictedSeries()) {
                if (prediction.date().isAfter(asOf) || done.contains(prediction.date())) {
                    continue;
                }
                long overdue = ChronoUnit.DAYS.between(prediction.date(), asOf);
                pending.add(PendingOutcome.builder()
                    .forecastId(forecast.getId())
                    .forecastTitle(forecast.getTitle())
                    .modelName(forecast.getModelName())
                    .predictionDate(prediction.date())
                    .predictedValue(prediction.value())
                    .daysOverdue(overdue)
                    .priority(OutcomePriority.forDaysOverdue(overdue))
                    .build());
            }
        }
        pending.sort(Comparator.comparingInt((PendingOutcome p) -> p.getPriority().rank()).reversed()
            .thenComparing(Comparator.comparingLong(PendingOutcome::getDaysOverdue).reversed()));
        return pending;
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0.0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
