package com.forecastmonitor.entity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.forecastmonitor.model.SeriesPoint;
import com.forecastmonitor.model.TimeSeries;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores a {@link TimeSeries} as a JSON array of {@code {"date","value"}} objects.
 */
@Converter
public class SeriesJsonConverter implements AttributeConverter<TimeSeries, String> {

    static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final TypeReference<List<SeriesPoint>> POINTS = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(TimeSeries series) {
        if (series == null) {
            return null;
        }
        try {
            return MAPPER.writeValueAsString(series.points());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialise series", e);
        }
    }

    @Override
    public TimeSeries convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) {
            return TimeSeries.empty();
        }
        try {
            return TimeSeries.of(MAPPER.readValue(json, POINTS));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Stored series is not valid JSON", e);
        }
    }
}
