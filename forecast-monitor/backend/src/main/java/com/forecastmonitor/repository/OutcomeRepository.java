package com.forecastmonitor.repository;

import com.forecastmonitor.entity.OutcomeRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public interface OutcomeRepository extends JpaRepository<OutcomeRecord, UUID> {

    boolean existsByForecastIdAndOutcomeDate(UUID forecastId, LocalDate outcomeDate);

    List<OutcomeRecord> findByForecastIdOrderByOutcomeDateAsc(UUID forecastId);

    List<OutcomeRecord> findByForecastIdOrderByRecordedAtDescOutcomeDateDesc(UUID forecastId);

    List<OutcomeRecord> findByRecordedAtGreaterThanEqual(Instant since);

    long countByForecastId(UUID forecastId);
}
