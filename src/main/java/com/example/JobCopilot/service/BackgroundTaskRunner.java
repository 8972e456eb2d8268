package com.example.JobCopilot.service;

/**
 * Fire-and-forget work that must not hold up the response, e.g. reindexing after a write.
 * Each task is attempted once; failures are logged, never retried or surfaced.
 */
public interface BackgroundTaskRunner {

    void submit(String name, Runnable task);
}
