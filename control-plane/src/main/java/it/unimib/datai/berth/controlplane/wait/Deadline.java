package it.unimib.datai.berth.controlplane.wait;

import java.time.Duration;

/**
 * A point on a {@link WaitClock}'s monotonic timeline.
 */
public record Deadline(WaitClock clock, long deadlineNanos) {

    public static Deadline after(WaitClock clock, Duration budget) {
        return new Deadline(clock, clock.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        long left = deadlineNanos - clock.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public double remainingSeconds() {
        return (deadlineNanos - clock.nanoTime()) / 1_000_000_000.0;
    }

    public boolean expired() {
        return clock.nanoTime() - deadlineNanos >= 0;
    }

    /**
     * A deadline that ends at {@code cap} from now, or at this deadline if that comes first.
     */
    public Deadline cappedAt(Duration cap) {
        long capped = clock.nanoTime() + cap.toNanos();
        return capped - deadlineNanos < 0 ? new Deadline(clock, capped) : this;
    }
}
