package it.unimib.datai.berth.controlplane.reclaim;

import com.github.dockerjava.api.model.ServiceSpec;
import it.unimib.datai.berth.common.model.ArchivedProject;
import it.unimib.datai.berth.common.model.ArchivedService;
import it.unimib.datai.berth.controlplane.TestServices;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterEvent;
import it.unimib.datai.berth.controlplane.cluster.ClusterNetwork;
import it.unimib.datai.berth.controlplane.cluster.ClusterResourceNotFoundException;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.EventFilter;
import it.unimib.datai.berth.controlplane.cluster.LabelSelector;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.TaskState;
import it.unimib.datai.berth.controlplane.cluster.WorkloadHandle;
import it.unimib.datai.berth.controlplane.cluster.WorkloadInfo;
import it.unimib.datai.berth.controlplane.config.ReclaimProperties;
import it.unimib.datai.berth.controlplane.provision.ProxyNetworkAttacher;
import it.unimib.datai.berth.controlplane.proxy.ProxyRouteManager;
import it.unimib.datai.berth.controlplane.wait.CancellationSignal;
import it.unimib.datai.berth.controlplane.wait.FakeWaitClock;
import it.unimib.datai.berth.controlplane.wait.OperationCancelledException;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;

class ResourceReclaimerTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
    private static final WorkloadInfo WORKLOAD = new WorkloadInfo("w1", TestServices.WORKLOAD, 5,
            new ServiceSpec().withName(TestServices.WORKLOAD));
    private static final ArchivedService ARCHIVED = ArchivedService.snapshotOf(TestServices.web(null), List.of());

    private final ClusterClient client = mock(ClusterClient.class);
    private final ProxyRouteManager routes = mock(ProxyRouteManager.class);
    private final ProxyNetworkAttacher attacher = mock(ProxyNetworkAttacher.class);
    private final FakeWaitClock clock = new FakeWaitClock();
    private final ResourceReclaimer reclaimer = new ResourceReclaimer(client, routes, attacher,
            new ReclaimProperties(10, 10, 1000L), clock, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void reclaimService_absentWorkload_onlyUnroutes() {
        when(client.findWorkload(TestServices.WORKLOAD)).thenReturn(Optional.empty());

        reclaimer.reclaimService(ARCHIVED, CancellationSignal.NONE);

        verify(routes).unexposeService(ARCHIVED);
        verify(client).findWorkload(TestServices.WORKLOAD);
        verifyNoMoreInteractions(client);
    }

    @Test
    void reclaimService_scalesDownWaitsThenRemovesVolumesAndWorkload() {
        when(client.findWorkload(TestServices.WORKLOAD)).thenReturn(Optional.of(WORKLOAD));
        when(client.listTasks(TestServices.WORKLOAD))
                .thenReturn(List.of(task()), List.of(task()), List.of());
        when(client.listVolumesByLabel(any(LabelSelector.class))).thenReturn(List.of(
                new ClusterVolume("vol-a", Map.of()), new ClusterVolume("vol-b", Map.of())));
        doThrow(new ClusterResourceNotFoundException("gone", null)).when(client).removeVolume("vol-a");

        reclaimer.reclaimService(ARCHIVED, CancellationSignal.NONE);

        InOrder order = inOrder(routes, client);
        order.verify(routes).unexposeService(ARCHIVED);
        order.verify(client).scaleWorkload(WORKLOAD, 0);
        order.verify(client).removeVolume("vol-b");
        order.verify(client).removeWorkload("w1");
        verify(client).listVolumesByLabel(ResourceLabels.serviceVolumes(TestServices.PROJECT, TestServices.SERVICE));
        assertThat(clock.sleeps()).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(1));
    }

    @Test
    void reclaimService_tasksNeverDrain_throwsTimeout() {
        when(client.findWorkload(TestServices.WORKLOAD)).thenReturn(Optional.of(WORKLOAD));
        when(client.listTasks(TestServices.WORKLOAD)).thenReturn(List.of(task()));

        assertThatThrownBy(() -> reclaimer.reclaimService(ARCHIVED, CancellationSignal.NONE))
                .isInstanceOf(ReclaimTimeoutException.class);
        verify(client, never()).removeVolume(anyString());
        verify(client, never()).removeWorkload(anyString());
        assertThat(clock.nanoTime()).isEqualTo(Duration.ofSeconds(10).toNanos());
    }

    @Test
    void reclaimService_cancelledWhileDraining_stops() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(client.findWorkload(TestServices.WORKLOAD)).thenReturn(Optional.of(WORKLOAD));
        when(client.listTasks(TestServices.WORKLOAD)).thenAnswer(inv -> {
            cancelled.set(true);
            return List.of(task());
        });

        assertThatThrownBy(() -> reclaimer.reclaimService(ARCHIVED, CancellationSignal.of(cancelled)))
                .isInstanceOf(OperationCancelledException.class);
        verify(client, never()).removeWorkload(anyString());
    }

    @Test
    void reclaimProject_detachedProxy_waitsForUpdateBeforeRemovingNetwork() {
        ArchivedProject project = ArchivedProject.snapshotOf(TestServices.PROJECT, "acme", List.of());
        when(client.findNetwork("net-prj_1")).thenReturn(Optional.of(new ClusterNetwork("n1", "net-prj_1", null)));
        when(attacher.detach("n1")).thenReturn(Optional.of(new WorkloadHandle("p1", "proxy")));
        when(client.awaitEvent(any(), any(), any(), any())).thenAnswer(inv -> {
            Duration window = inv.getArgument(2);
            clock.advance(window);
            Predicate<ClusterEvent> predicate = inv.getArgument(3);
            return clock.nanoTime() >= Duration.ofSeconds(3).toNanos()
                    && predicate.test(new ClusterEvent("service", "update", "p1",
                    Map.of("updatestate.new", "completed")));
        });

        reclaimer.reclaimProject(project, CancellationSignal.NONE);

        InOrder order = inOrder(attacher, client);
        order.verify(attacher).detach("n1");
        order.verify(client, atLeastOnce()).awaitEvent(eq(EventFilter.workload("p1")), eq(NOW), eq(Duration.ofSeconds(1)), any());
        order.verify(client).removeNetwork("n1");
        verify(client, times(3)).awaitEvent(any(), any(), any(), any());
    }

    @Test
    void reclaimProject_proxyNotAttached_removesNetworkWithoutWaiting() {
        ArchivedProject project = ArchivedProject.snapshotOf(TestServices.PROJECT, "acme", List.of());
        when(client.findNetwork("net-prj_1")).thenReturn(Optional.of(new ClusterNetwork("n1", "net-prj_1", null)));
        when(attacher.detach("n1")).thenReturn(Optional.empty());

        reclaimer.reclaimProject(project, CancellationSignal.NONE);

        verify(client, never()).awaitEvent(any(), any(), any(), any());
        verify(client).removeNetwork("n1");
    }

    @Test
    void reclaimProject_proxyUpdateNeverCompletes_throwsTimeout() {
        ArchivedProject project = ArchivedProject.snapshotOf(TestServices.PROJECT, "acme", List.of());
        when(client.findNetwork("net-prj_1")).thenReturn(Optional.of(new ClusterNetwork("n1", "net-prj_1", null)));
        when(attacher.detach("n1")).thenReturn(Optional.of(new WorkloadHandle("p1", "proxy")));
        when(client.awaitEvent(any(), any(), any(), any())).thenAnswer(inv -> {
            clock.advance(inv.getArgument(2));
            return false;
        });

        assertThatThrownBy(() -> reclaimer.reclaimProject(project, CancellationSignal.NONE))
                .isInstanceOf(ReclaimTimeoutException.class);
        verify(client, never()).removeNetwork(anyString());
    }

    @Test
    void reclaimProject_reclaimsServicesFirstAndToleratesMissingNetwork() {
        ArchivedProject project = ArchivedProject.snapshotOf(TestServices.PROJECT, "acme", List.of(ARCHIVED));
        when(client.findWorkload(TestServices.WORKLOAD)).thenReturn(Optional.empty());
        when(client.findNetwork("net-prj_1")).thenReturn(Optional.empty());

        reclaimer.reclaimProject(project, CancellationSignal.NONE);

        verify(routes).unexposeService(ARCHIVED);
        verify(attacher, never()).detach(anyString());
    }

    private static ClusterTask task() {
        return new ClusterTask("t1", 1, TaskState.SHUTDOWN, "c1", 0, null, "shutdown");
    }
}
