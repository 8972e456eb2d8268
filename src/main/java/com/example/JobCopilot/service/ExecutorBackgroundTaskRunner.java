package com.example.JobCopilot.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class ExecutorBackgroundTaskRunner implements BackgroundTaskRunner {

    private final TaskExecutor executor;

    public ExecutorBackgroundTaskRunner(@Qualifier("reindexExecutor") TaskExecutor executor) {
        this.executor = executor;
    }

    @Override
    public void submit(String name, Runnable task) {
        try {
            executor.execute(() -> run(name, task));
        } catch (TaskRejectedException e) {
            log.error("Background task {} rejected: {}", name, e.getMessage());
        }
    }

    private void run(String name, Runnable task) {
        long start = System.currentTimeMillis();
        try {
            task.run();
            log.debug("Background task {} finished in {} ms", name, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("Background task {} failed", name, e);
        }
    }
}
