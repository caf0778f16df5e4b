package com.forecastmonitor.scheduler;

import com.forecastmonitor.entity.ScheduledTask;
import com.forecastmonitor.entity.TaskExecutionResult;
import com.forecastmonitor.repository.ScheduledTaskRepository;
import com.forecastmonitor.repository.TaskExecutionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaTaskStore implements TaskStore {

    private final ScheduledTaskRepository taskRepository;
    private final TaskExecutionRepository executionRepository;

    @Value("${scheduler.history-limit:100}")
    private int historyLimit = 100;

    @Override
    @Transactional(readOnly = true)
    public List<ScheduledTask> loadTasks() {
        return taskRepository.findAllByOrderByRegistrationOrderAsc();
    }

    @Override
    @Transactional
    public void saveTasks(List<ScheduledTask> tasks) {
        taskRepository.saveAll(tasks);
    }

    @Override
    @Transactional
    public void appendHistory(TaskExecutionResult result) {
        executionRepository.save(result);
        List<TaskExecutionResult> all = executionRepository.findAllByOrderByExecutionTimeDesc();
        if (all.size() > historyLimit) {
            List<TaskExecutionResult> overflow = all.subList(historyLimit, all.size());
            executionRepository.deleteAll(overflow);
            log.debug("Execution history pruned | removed={} | limit={}", overflow.size(), historyLimit);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<TaskExecutionResult> history() {
        return executionRepository.findAllByOrderByExecutionTimeDesc(PageRequest.of(0, historyLimit));
    }
}
