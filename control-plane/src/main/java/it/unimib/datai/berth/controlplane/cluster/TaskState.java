package it.unimib.datai.berth.controlplane.cluster;

import java.util.Locale;

/**
 * Lifecycle states of a Swarm task, in scheduling order. {@link #UNKNOWN} stands for any
 * state this client does not recognise.
 */
public enum TaskState {
    NEW,
    ALLOCATED,
    PENDING,
    ASSIGNED,
    ACCEPTED,
    READY,
    PREPARING,
    STARTING,
    RUNNING,
    COMPLETE,
    SHUTDOWN,
    FAILED,
    REJECTED,
    REMOVE,
    ORPHANED,
    UNKNOWN;

    public static TaskState fromWire(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        try {
            return TaskState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
