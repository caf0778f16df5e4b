package com.forecastmonitor.controller;

import com.forecastmonitor.config.RequestIdFilter;
import com.forecastmonitor.dto.AccuracySummaryResponse;
import com.forecastmonitor.dto.ForecastRequest;
import com.forecastmonitor.dto.ForecastResponse;
import com.forecastmonitor.dto.ForecastStatusRequest;
import com.forecastmonitor.dto.OutcomeRequest;
import com.forecastmonitor.dto.OutcomeResponse;
import com.forecastmonitor.entity.OutcomeRecord;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.model.ForecastStatus;
import com.forecastmonitor.model.PendingOutcome;
import com.forecastmonitor.service.ForecastService;
import com.forecastmonitor.service.OutcomeCorrelationService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ForecastController {

    private final ForecastService           forecastService;
    private final OutcomeCorrelationService correlationService;
    private final Clock                     clock;

    @PostMapping("/forecasts")
    public ResponseEntity<ForecastResponse> createForecast(
            @Valid @RequestBody ForecastRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts | model={} | points={} | horizon={} | requestId={}",
                 request.getModelId(), request.getSeries().size(), request.getHorizon(), requestId);
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(forecastService.createForecast(request, requestId));
    }

    @GetMapping("/forecasts")
    public ResponseEntity<Page<ForecastResponse>> listForecasts(
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(forecastService.listForecasts(parseStatus(status), PageRequest.of(page, size)));
    }

    @GetMapping("/forecasts/{id}")
    public ResponseEntity<ForecastResponse> getForecast(@PathVariable UUID id) {
        return ResponseEntity.ok(forecastService.getForecast(id));
    }

    @PatchMapping("/forecasts/{id}/status")
    public ResponseEntity<ForecastResponse> updateStatus(
            @PathVariable UUID id, @Valid @RequestBody ForecastStatusRequest request) {
        log.info("PATCH /forecasts/{}/status | status={}", id, request.getStatus());
        return ResponseEntity.ok(forecastService.updateStatus(id, request.getStatus()));
    }

    @PostMapping("/forecasts/{id}/outcomes")
    public ResponseEntity<OutcomeResponse> recordOutcome(
            @PathVariable UUID id, @Valid @RequestBody OutcomeRequest request, HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /forecasts/{}/outcomes | date={} | actual={} | requestId={}",
                 id, request.getDate(), request.getActualValue(), requestId);
        OutcomeRecord saved = correlationService.recordOutcome(id, request.getDate(), request.getActualValue());
        Double forecastAccuracy = forecastService.getForecast(id).getAccuracyScore();
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(toResponse(saved, forecastAccuracy));
    }

    @GetMapping("/forecasts/{id}/outcomes")
    public ResponseEntity<List<OutcomeResponse>> listOutcomes(@PathVariable UUID id) {
        return ResponseEntity.ok(correlationService.listOutcomes(id).stream()
            .map(o -> toResponse(o, null))
            .toList());
    }

    @GetMapping("/forecasts/{id}/accuracy")
    public ResponseEntity<AccuracySummaryResponse> accuracy(@PathVariable UUID id) {
        return ResponseEntity.ok(correlationService.summarize(id));
    }

    @GetMapping("/outcomes/pending")
    public ResponseEntity<List<PendingOutcome>> pendingOutcomes(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate asOf,
            @RequestParam(defaultValue = "50") @Min(1) @Max(500) int limit) {
        LocalDate date = asOf != null ? asOf : LocalDate.now(clock);
        return ResponseEntity.ok(correlationService.findPendingOutcomes(date).stream().limit(limit).toList());
    }

    private static OutcomeResponse toResponse(OutcomeRecord o, Double forecastAccuracy) {
        return OutcomeResponse.builder()
            .outcomeId(o.getId())
            .forecastId(o.getForecastId())
            .outcomeDate(o.getOutcomeDate())
            .actualValue(o.getActualValue())
            .predictedValue(o.getPredictedValue())
            .variance(o.getVariance())
            .accuracyPercentage(o.getAccuracyPercentage())
            .recordedAt(o.getRecordedAt())
            .forecastAccuracy(forecastAccuracy)
            .build();
    }

    private static ForecastStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ForecastStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("Unknown forecast status '" + value + "'.");
        }
    }

    private String resolveRequestId(HttpServletRequest request) {
        return RequestIdFilter.resolveRequestId(request);
    }
}
