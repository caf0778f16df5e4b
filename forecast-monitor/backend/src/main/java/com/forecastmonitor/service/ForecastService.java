package com.forecastmonitor.service;

import com.forecastmonitor.analysis.CompatibilityScorer;
import com.forecastmonitor.analysis.PredictionGenerator;
import com.forecastmonitor.dto.ForecastRequest;
import com.forecastmonitor.dto.ForecastResponse;
import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.exception.ForecastNotFoundException;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.exception.ModelNotFoundException;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.TimeSeries;
import com.forecastmonitor.repository.ForecastRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    private final ForecastRepository   repository;
    private final ModelRegistryService modelRegistry;
    private final PredictionGenerator  generator;
    private final CompatibilityScorer  scorer;

    @Value("${forecast.max-horizon:60}")
    private int maxHorizon;

    @Transactional
    public ForecastResponse createForecast(ForecastRequest req, String requestId) {
        if (req.getHorizon() < 1 || req.getHorizon() > maxHorizon) {
            throw new InvalidRequestException(
                "Horizon " + req.getHorizon() + " is outside the allowed range 1.." + maxHorizon + ".");
        }
        TimeSeries series = TimeSeries.of(req.getSeries());
        ModelDescriptor model = modelRegistry.getModel(req.getModelId());
        TimeSeries predicted = generator.generate(series, model, req.getHorizon());

        ForecastRecord saved = repository.save(ForecastRecord.builder()
            .title(req.getTitle()).type(req.getType())
            .modelId(model.getId()).modelName(model.getName())
            .inputSeries(series).predictedSeries(predicted)
            .timeHorizon(req.getHorizon())
            .status(ForecastStatus.ACTIVE)
            .build());
        log.info("Forecast saved | id={} | model={} | points={} | horizon={} | requestId={}",
                 saved.getId(), model.getName(), series.size(), req.getHorizon(), requestId);
        return toResponse(saved, requestId);
    }

    @Transactional(readOnly = true)
    public ForecastResponse getForecast(UUID id) {
        return toResponse(find(id), null);
    }

    @Transactional(readOnly = true)
    public Page<ForecastResponse> listForecasts(ForecastStatus status, Pageable pageable) {
        Page<ForecastRecord> page = status == null
            ? repository.findAllByOrderByCreatedAtDesc(pageable)
            : repository.findByStatusOrderByCreatedAtDesc(status, pageable);
        return page.map(r -> toResponse(r, null));
    }

    @Transactional
    public ForecastResponse updateStatus(UUID id, ForecastStatus status) {
        ForecastRecord record = find(id);
        ForecastStatus previous = record.getStatus();
        record.setStatus(status);
        ForecastRecord saved = repository.save(record);
        log.info("Forecast status changed | id={} | from={} | to={}", id, previous, status);
        return toResponse(saved, null);
    }

    private ForecastRecord find(UUID id) {
        return repository.findById(id).orElseThrow(() -> new ForecastNotFoundException(id));
    }

    private ForecastResponse toResponse(ForecastRecord r, String requestId) {
        return ForecastResponse.builder()
            .forecastId(r.getId()).title(r.getTitle()).type(r.getType())
            .modelId(r.getModelId()).modelName(r.getModelName())
            .compatibilityScore(compatibility(r))
            .inputSeries(r.getInputSeries().points())
            .predictedSeries(r.getPredictedSeries().points())
            .accuracyScore(r.getAccuracyScore())
            .timeHorizon(r.getTimeHorizon())
            .status(r.getStatus())
            .createdAt(r.getCreatedAt()).updatedAt(r.getUpdatedAt())
            .requestId(requestId)
            .build();
    }

    private Integer compatibility(ForecastRecord r) {
        try {
            return scorer.score(modelRegistry.getModel(r.getModelId()), r.getInputSeries(), r.getType());
        } catch (ModelNotFoundException ex) {
            log.warn("Stored forecast references an unregistered model | id={} | modelId={}", r.getId(), r.getModelId());
            return null;
        }
    }
}
