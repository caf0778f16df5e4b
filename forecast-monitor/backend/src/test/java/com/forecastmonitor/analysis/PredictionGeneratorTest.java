package com.forecastmonitor.analysis;

import com.forecastmonitor.exception.InsufficientDataException;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.ModelFamily;
import com.forecastmonitor.model.SeriesPoint;
import com.forecastmonitor.model.TimeSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.time.Period;
import java.util.List;

import static com.forecastmonitor.analysis.SeriesStatisticsCalculatorTest.monthly;
import static org.assertj.core.api.Assertions.*;

class PredictionGeneratorTest {

    // 0.5 cancels the additive noise and makes the smoothing factor exactly 1
    private final PredictionGenerator generator = new PredictionGenerator(NoiseSource.constant(0.5));

    private final TimeSeries linear = monthly(100, 110, 120, 130, 140, 150, 160, 170, 180, 190, 200, 210);

    private static ModelDescriptor model(ModelFamily family) {
        return ModelDescriptor.builder().id(family.name()).name(family.name()).family(family).build();
    }

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    void everyFamily_emitsHorizonPointsAfterInputInStepOrder(ModelFamily family) {
        TimeSeries predicted = generator.generate(linear, model(family), 6);

        assertThat(predicted.size()).isEqualTo(6);
        assertThat(predicted.get(0).date()).isEqualTo(LocalDate.of(2025, 1, 1));
        assertThat(predicted.last().date()).isEqualTo(LocalDate.of(2025, 6, 1));
        assertThat(predicted.points()).allSatisfy(p -> assertThat(p.value()).isGreaterThanOrEqualTo(0.0));
    }

    @ParameterizedTest
    @EnumSource(ModelFamily.class)
    void collapsingSeries_isClampedAtZero(ModelFamily family) {
        TimeSeries falling = monthly(100, 80, 60, 40, 20, 5);
        TimeSeries predicted = generator.generate(falling, model(family), 12);

        assertThat(predicted.points()).allSatisfy(p -> assertThat(p.value()).isGreaterThanOrEqualTo(0.0));
    }

    @Test
    void linearTrend_lastPointIsNearStraightLineExtension() {
        TimeSeries predicted = generator.generate(linear, model(ModelFamily.TREND), 6);

        assertThat(predicted.last().value()).isCloseTo(270.0, withinPercentage(10));
        assertThat(predicted.last().value()).isEqualTo(284.4);
        assertThat(predicted.get(0).value()).isEqualTo(222.4);
        assertThat(predicted.points()).extracting(SeriesPoint::value).isSorted();
    }

    @Test
    void linearTrend_withNoise_staysNonDecreasingWithinNoiseBand() {
        PredictionGenerator noisy = new PredictionGenerator(new RandomNoiseSource(42));
        // two points can each move by 5% of the standard deviation, plus rounding
        double band = SeriesStatisticsCalculator.compute(linear).getStdDev() * 0.1 + 0.1;

        List<SeriesPoint> points = noisy.generate(linear, model(ModelFamily.TREND), 12).points();

        for (int i = 1; i < points.size(); i++) {
            assertThat(points.get(i).value()).isGreaterThanOrEqualTo(points.get(i - 1).value() - band);
        }
    }

    @Test
    void movingAverage_usesConfiguredWindow() {
        ModelDescriptor ma = ModelDescriptor.builder().id("ma").name("MA")
            .family(ModelFamily.MOVING_AVERAGE).parameter("window_size", 2).build();
        TimeSeries flat = monthly(10, 10, 10, 20, 20);

        // window of the last two points averages to 20; trend of 10,10 vs 20,20
        double trend = SeriesStatisticsCalculator.compute(flat).getTrendPerPeriod();
        TimeSeries predicted = generator.generate(flat, ma, 1);

        assertThat(predicted.get(0).value()).isCloseTo(20 * (1 + trend * 0.5), within(0.01));
    }

    @Test
    void singlePoint_usesDefaultStepFromBaseDate() {
        TimeSeries single = TimeSeries.of(List.of(new SeriesPoint(LocalDate.of(2024, 1, 31), 50)));
        TimeSeries predicted = generator.generate(single, model(ModelFamily.TREND), 3);

        assertThat(predicted.points()).extracting(SeriesPoint::date).containsExactly(
            LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 31), LocalDate.of(2024, 4, 30));
        assertThat(predicted.points()).extracting(SeriesPoint::value).containsOnly(50.0);
    }

    @Test
    void weeklyInput_keepsWeeklyStep() {
        LocalDate start = LocalDate.of(2024, 5, 6);
        TimeSeries weekly = TimeSeries.of(List.of(
            new SeriesPoint(start, 10), new SeriesPoint(start.plusWeeks(1), 12),
            new SeriesPoint(start.plusWeeks(2), 14), new SeriesPoint(start.plusWeeks(3), 16)));

        TimeSeries predicted = generator.generate(weekly, model(ModelFamily.DEFAULT), 2);

        assertThat(predicted.points()).extracting(SeriesPoint::date)
            .containsExactly(start.plusWeeks(4), start.plusWeeks(5));
    }

    @Test
    void biweeklyInput_stepsByMedianGapInDays() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        TimeSeries biweekly = TimeSeries.of(List.of(
            new SeriesPoint(start, 10), new SeriesPoint(start.plusDays(14), 12),
            new SeriesPoint(start.plusDays(28), 14), new SeriesPoint(start.plusDays(42), 16),
            new SeriesPoint(start.plusDays(56), 18), new SeriesPoint(LocalDate.of(2024, 3, 11), 20)));

        TimeSeries predicted = generator.generate(biweekly, model(ModelFamily.TREND), 2);

        assertThat(predicted.points()).extracting(SeriesPoint::date)
            .containsExactly(LocalDate.of(2024, 3, 25), LocalDate.of(2024, 4, 8));
    }

    @Test
    void irregularSpacing_usesMedianGap() {
        LocalDate start = LocalDate.of(2024, 1, 1);
        TimeSeries everyFewDays = TimeSeries.of(List.of(
            new SeriesPoint(start, 5), new SeriesPoint(start.plusDays(3), 6),
            new SeriesPoint(start.plusDays(6), 7), new SeriesPoint(start.plusDays(11), 8)));

        assertThat(ForecastStep.infer(everyFewDays, ForecastStep.MONTHLY)).isEqualTo(Period.ofDays(3));
        assertThat(ForecastStep.infer(TimeSeries.of(List.of(new SeriesPoint(start, 5))), ForecastStep.WEEKLY))
            .isEqualTo(Period.ofWeeks(1));
    }

    @Test
    void seededNoise_isReproducible() {
        PredictionGenerator a = new PredictionGenerator(new RandomNoiseSource(42));
        PredictionGenerator b = new PredictionGenerator(new RandomNoiseSource(42));

        assertThat(a.generate(linear, model(ModelFamily.ENSEMBLE), 6))
            .isEqualTo(b.generate(linear, model(ModelFamily.ENSEMBLE), 6));
    }

    @Test
    void emptySeries_throwsInsufficientData() {
        assertThatThrownBy(() -> generator.generate(TimeSeries.empty(), model(ModelFamily.TREND), 3))
            .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void nonPositiveHorizon_isRejected() {
        assertThatThrownBy(() -> generator.generate(linear, model(ModelFamily.TREND), 0))
            .isInstanceOf(InvalidRequestException.class);
    }
}
