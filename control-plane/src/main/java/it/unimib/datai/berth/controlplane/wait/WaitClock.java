package it.unimib.datai.berth.controlplane.wait;

import java.time.Duration;

/**
 * Monotonic time source used by every bounded wait.
 */
public interface WaitClock {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    static WaitClock system() {
        return SystemWaitClock.INSTANCE;
    }

    final class SystemWaitClock implements WaitClock {
        private static final SystemWaitClock INSTANCE = new SystemWaitClock();

        private SystemWaitClock() {
        }

        @Override
        public long nanoTime() {
            return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
            if (!duration.isNegative() && !duration.isZero()) {
                Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
            }
        }
    }
}
