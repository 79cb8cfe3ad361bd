package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.HealthCheckSpec;
import it.unimib.datai.berth.controlplane.TestServices;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterRequestTimeoutException;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.cluster.ExecResult;
import it.unimib.datai.berth.controlplane.cluster.TaskState;
import it.unimib.datai.berth.controlplane.wait.Deadline;
import it.unimib.datai.berth.controlplane.wait.FakeWaitClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandHealthProbeTest {

    private final ClusterClient client = mock(ClusterClient.class);
    private final CommandHealthProbe probe = new CommandHealthProbe(client);
    private final FakeWaitClock clock = new FakeWaitClock();
    private final Deployment deployment = TestServices.deployment(
            TestServices.web(HealthCheckSpec.command("curl -f 'http://localhost/health'", 30)));

    @Test
    void probe_zeroExit_isHealthy() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, "c1", null, null, null);
        when(client.exec("c1", List.of("curl", "-f", "http://localhost/health"), Duration.ofSeconds(30)))
                .thenReturn(new ExecResult(0, "ok"));

        ProbeResult result = probe.probe(deployment, task, null, Deadline.after(clock, Duration.ofSeconds(30)));

        assertThat(result).isEqualTo(ProbeResult.healthy("ok"));
    }

    @Test
    void probe_nonZeroExit_isUnhealthyWithOutput() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, "c1", null, null, null);
        when(client.exec(anyString(), any(), any())).thenReturn(new ExecResult(7, "connection refused"));

        ProbeResult result = probe.probe(deployment, task, null, Deadline.after(clock, Duration.ofSeconds(30)));

        assertThat(result).isEqualTo(ProbeResult.unhealthy("connection refused"));
    }

    @Test
    void probe_execTimeout_throwsProbeTimeout() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, "c1", null, null, null);
        when(client.exec(anyString(), any(), any()))
                .thenThrow(new ClusterRequestTimeoutException("Timed out during start exec", null));

        assertThatThrownBy(() -> probe.probe(deployment, task, null, Deadline.after(clock, Duration.ofSeconds(30))))
                .isInstanceOf(ProbeTimeoutException.class);
    }

    @Test
    void deadlineAlreadyPassed_timesOutWithoutStartingExec() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, "c1", null, null, null);
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(30));

        assertThatThrownBy(() -> probe.probe(deployment, task, null, deadline))
                .isInstanceOf(ProbeTimeoutException.class)
                .hasMessage(HealthMonitor.PROBE_TIMEOUT_REASON);
        verify(client, never()).exec(any(), any(), any());
    }

    @Test
    void execIsGivenOnlyTheTimeLeft() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, "c1", null, null, null);
        Deadline deadline = Deadline.after(clock, Duration.ofSeconds(30));
        clock.advance(Duration.ofMillis(29_750));
        when(client.exec(anyString(), any(), any())).thenReturn(new ExecResult(0, "ok"));

        probe.probe(deployment, task, null, deadline);

        verify(client).exec("c1", List.of("curl", "-f", "http://localhost/health"), Duration.ofMillis(250));
    }

    @Test
    void probe_withoutContainer_isUnhealthy() {
        ClusterTask task = new ClusterTask("t1", 1, TaskState.RUNNING, null, null, null, null);

        ProbeResult result = probe.probe(deployment, task, null, Deadline.after(clock, Duration.ofSeconds(30)));

        assertThat(result.healthy()).isFalse();
        verify(client, never()).exec(any(), any(), any());
    }
}
