package com.forecastmonitor.controller;

import com.forecastmonitor.dto.TaskExecutionResponse;
import com.forecastmonitor.dto.TaskResponse;
import com.forecastmonitor.scheduler.SchedulerService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1/tasks")
@RequiredArgsConstructor
public class SchedulerController {

    private final SchedulerService schedulerService;

    @GetMapping
    public ResponseEntity<List<TaskResponse>> tasks() {
        return ResponseEntity.ok(schedulerService.tasks());
    }

    @PostMapping("/{id}/enable")
    public ResponseEntity<TaskResponse> enable(@PathVariable String id) {
        log.info("POST /tasks/{}/enable", id);
        return ResponseEntity.ok(schedulerService.enable(id));
    }

    @PostMapping("/{id}/disable")
    public ResponseEntity<TaskResponse> disable(@PathVariable String id) {
        log.info("POST /tasks/{}/disable", id);
        return ResponseEntity.ok(schedulerService.disable(id));
    }

    @PostMapping("/{id}/run")
    public ResponseEntity<TaskExecutionResponse> runNow(@PathVariable String id) {
        log.info("POST /tasks/{}/run", id);
        return ResponseEntity.ok(schedulerService.runNow(id));
    }

    @GetMapping("/history")
    public ResponseEntity<List<TaskExecutionResponse>> history(
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {
        return ResponseEntity.ok(schedulerService.history(limit));
    }
}
