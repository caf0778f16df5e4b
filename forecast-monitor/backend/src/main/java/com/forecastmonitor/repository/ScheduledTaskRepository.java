package com.forecastmonitor.repository;

import com.forecastmonitor.entity.ScheduledTask;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScheduledTaskRepository extends JpaRepository<ScheduledTask, String> {

    List<ScheduledTask> findAllByOrderByRegistrationOrderAsc();
}
