package com.forecastmonitor.repository;

import com.forecastmonitor.entity.TaskExecutionResult;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TaskExecutionRepository extends JpaRepository<TaskExecutionResult, UUID> {

    List<TaskExecutionResult> findAllByOrderByExecutionTimeDesc(Pageable pageable);

    List<TaskExecutionResult> findAllByOrderByExecutionTimeDesc();
}
