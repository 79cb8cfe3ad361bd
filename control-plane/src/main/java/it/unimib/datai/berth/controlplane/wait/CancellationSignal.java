package it.unimib.datai.berth.controlplane.wait;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polled between remote calls by long-running operations. The owner of the unit of work
 * (typically a job executor) flips it to request a cooperative stop.
 */
@FunctionalInterface
public interface CancellationSignal {
    CancellationSignal NONE = () -> false;

    boolean cancelled();

    static CancellationSignal of(AtomicBoolean flag) {
        return flag::get;
    }
}
