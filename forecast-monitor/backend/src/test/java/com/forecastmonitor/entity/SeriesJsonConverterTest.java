package com.forecastmonitor.entity;

import com.forecastmonitor.model.SeriesPoint;
import com.forecastmonitor.model.TimeSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SeriesJsonConverterTest {

    private final SeriesJsonConverter converter = new SeriesJsonConverter();

    @Test
    void storesIsoDatesAndRestoresExactValues() {
        TimeSeries series = TimeSeries.of(List.of(
            new SeriesPoint(LocalDate.of(2024, 2, 29), 0.1 + 0.2),
            new SeriesPoint(LocalDate.of(2024, 3, 31), 1234567.891)));

        String json = converter.convertToDatabaseColumn(series);

        assertThat(json).contains("\"2024-02-29\"");
        assertThat(converter.convertToEntityAttribute(json)).isEqualTo(series);
    }

    @Test
    void corruptColumn_isRejected() {
        assertThatThrownBy(() -> converter.convertToEntityAttribute("{not json"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
