package com.forecastmonitor.repository;

import com.forecastmonitor.entity.ForecastRecord;
import com.forecastmonitor.model.ForecastStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface ForecastRepository extends JpaRepository<ForecastRecord, UUID> {

    List<ForecastRecord> findByStatusOrderByCreatedAtAsc(ForecastStatus status);

    Page<ForecastRecord> findAllByOrderByCreatedAtDesc(Pageable pageable);

    Page<ForecastRecord> findByStatusOrderByCreatedAtDesc(ForecastStatus status, Pageable pageable);
}
