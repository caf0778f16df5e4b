package com.forecastmonitor.controller;

import com.forecastmonitor.analysis.CompatibilityScorer;
import com.forecastmonitor.analysis.ModelScore;
import com.forecastmonitor.dto.ModelRankingRequest;
import com.forecastmonitor.exception.InvalidRequestException;
import com.forecastmonitor.model.ModelCategory;
import com.forecastmonitor.model.ModelDescriptor;
import com.forecastmonitor.model.TimeSeries;
import com.forecastmonitor.service.ModelRegistryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@Slf4j
@RestController
@RequestMapping("/api/v1/models")
@RequiredArgsConstructor
public class ModelController {

    private final ModelRegistryService modelRegistry;
    private final CompatibilityScorer  scorer;

    @GetMapping
    public ResponseEntity<List<ModelDescriptor>> listModels(@RequestParam(required = false) String category) {
        if (category == null || category.isBlank()) {
            return ResponseEntity.ok(modelRegistry.listModels());
        }
        return ResponseEntity.ok(modelRegistry.listModels(parseCategory(category)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<ModelDescriptor> getModel(@PathVariable String id) {
        return ResponseEntity.ok(modelRegistry.getModel(id));
    }

    @PostMapping("/rankings")
    public ResponseEntity<List<ModelScore>> rank(@Valid @RequestBody ModelRankingRequest request) {
        TimeSeries series = TimeSeries.of(request.getSeries());
        log.info("POST /models/rankings | points={} | type={}", series.size(), request.getType());
        return ResponseEntity.ok(scorer.rank(modelRegistry.listModels(), series, request.getType()));
    }

    private static ModelCategory parseCategory(String value) {
        try {
            return ModelCategory.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new InvalidRequestException("Unknown model category '" + value + "'.");
        }
    }
}
