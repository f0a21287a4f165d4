package org.burrow.rabbit.lifecycle;

/**
 * State of a {@link BackgroundWorker}.
 */
public enum WorkerState {
    STOPPED,
    RUNNING,
    STOPPING
}
