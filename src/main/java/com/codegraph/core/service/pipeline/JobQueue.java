package com.codegraph.core.service.pipeline;

import java.util.Optional;

/**
 * Bounded queue of jobs waiting for a worker.
 */
public interface JobQueue {

    /**
     * Attempts to enqueue a work item without blocking.
     *
     * @return true if enqueued, false if the queue is full
     */
    boolean enqueue(JobWorkItem item);

    /**
     * Attempts to dequeue a work item with timeout.
     *
     * @param timeoutMs timeout in milliseconds
     * @return the work item if available, empty otherwise
     */
    Optional<JobWorkItem> dequeue(long timeoutMs);

    int size();

    int getCapacity();

    /**
     * Gets the queue utilization as a percentage (0-100).
     */
    default int getUtilizationPercent() {
        int capacity = getCapacity();
        return capacity > 0 ? (size() * 100) / capacity : 0;
    }

    default boolean isFull() {
        return size() >= getCapacity();
    }
}
