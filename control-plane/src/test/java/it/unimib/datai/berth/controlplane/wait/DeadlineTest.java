package it.unimib.datai.berth.controlplane.wait;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

class DeadlineTest {

    @Test
    void remaining_countsDownAndStopsAtZero() {
        FakeWaitClock clock = new FakeWaitClock();
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(4));
        assertThat(deadline.remaining()).isEqualTo(Duration.ofSeconds(6));
        assertThat(deadline.expired()).isFalse();

        clock.advance(Duration.ofSeconds(7));
        assertThat(deadline.remaining()).isEqualTo(Duration.ZERO);
        assertThat(deadline.remainingSeconds()).isEqualTo(-1.0);
        assertThat(deadline.expired()).isTrue();
    }

    @Test
    void cappedAt_picksEarlierOfCapAndDeadline() {
        FakeWaitClock clock = new FakeWaitClock();
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(10));

        assertThat(deadline.cappedAt(Duration.ofSeconds(5)).remaining()).isEqualTo(Duration.ofSeconds(5));

        clock.advance(Duration.ofSeconds(8));
        assertThat(deadline.cappedAt(Duration.ofSeconds(5))).isSameAs(deadline);
    }

    @Test
    void cancellationSignal_followsFlag() {
        AtomicBoolean flag = new AtomicBoolean();
        CancellationSignal signal = CancellationSignal.of(flag);

        assertThat(signal.cancelled()).isFalse();
        flag.set(true);
        assertThat(signal.cancelled()).isTrue();
        assertThat(CancellationSignal.NONE.cancelled()).isFalse();
    }
}
