package it.unimib.datai.berth.controlplane.reclaim;

import it.unimib.datai.berth.common.model.ArchivedProject;
import it.unimib.datai.berth.common.model.ArchivedService;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterEvent;
import it.unimib.datai.berth.controlplane.cluster.ClusterNetwork;
import it.unimib.datai.berth.controlplane.cluster.ClusterResourceNotFoundException;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.EventFilter;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.ResourceNames;
import it.unimib.datai.berth.controlplane.cluster.WorkloadHandle;
import it.unimib.datai.berth.controlplane.cluster.WorkloadInfo;
import it.unimib.datai.berth.controlplane.config.ReclaimProperties;
import it.unimib.datai.berth.controlplane.provision.ProxyNetworkAttacher;
import it.unimib.datai.berth.controlplane.proxy.ProxyRouteManager;
import it.unimib.datai.berth.controlplane.wait.CancellationSignal;
import it.unimib.datai.berth.controlplane.wait.Deadline;
import it.unimib.datai.berth.controlplane.wait.OperationCancelledException;
import it.unimib.datai.berth.controlplane.wait.WaitClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Tears down the cluster resources of archived services and projects.
 *
 * <p>Removal order matters: a volume cannot be removed while a task still mounts it, and a
 * network cannot be removed while the proxy is attached to it. Both waits are bounded and
 * poll the {@link CancellationSignal} between remote calls.</p>
 */
@Component
public class ResourceReclaimer {
    private static final Logger log = LoggerFactory.getLogger(ResourceReclaimer.class);

    private static final Duration EVENT_WINDOW = Duration.ofSeconds(1);
    private static final Predicate<ClusterEvent> UPDATE_COMPLETED = event ->
            "update".equals(event.action()) && "completed".equals(event.attribute("updatestate.new"));

    private final ClusterClient client;
    private final ProxyRouteManager routes;
    private final ProxyNetworkAttacher proxyNetworks;
    private final ReclaimProperties properties;
    private final WaitClock waitClock;
    private final Clock wallClock;

    @Autowired
    public ResourceReclaimer(ClusterClient client, ProxyRouteManager routes, ProxyNetworkAttacher proxyNetworks,
                             ReclaimProperties properties) {
        this(client, routes, proxyNetworks, properties, WaitClock.system(), Clock.systemUTC());
    }

    ResourceReclaimer(ClusterClient client, ProxyRouteManager routes, ProxyNetworkAttacher proxyNetworks,
                      ReclaimProperties properties, WaitClock waitClock, Clock wallClock) {
        this.client = client;
        this.routes = routes;
        this.proxyNetworks = proxyNetworks;
        this.properties = properties;
        this.waitClock = waitClock;
        this.wallClock = wallClock;
    }

    public void reclaimService(ArchivedService service, CancellationSignal signal) {
        routes.unexposeService(service);

        String name = ResourceNames.workload(service.projectOriginalId(), service.originalId());
        Optional<WorkloadInfo> workload = client.findWorkload(name);
        if (workload.isEmpty()) {
            log.info("Workload {} already gone, nothing to reclaim", name);
            return;
        }

        checkCancelled(signal, name);
        client.scaleWorkload(workload.get(), 0);
        awaitDrained(name, signal);

        for (ClusterVolume volume : client.listVolumesByLabel(
                ResourceLabels.serviceVolumes(service.projectOriginalId(), service.originalId()))) {
            checkCancelled(signal, name);
            try {
                client.removeVolume(volume.name());
            } catch (ClusterResourceNotFoundException e) {
                log.debug("Volume {} already removed", volume.name());
            }
        }

        try {
            client.removeWorkload(workload.get().id());
        } catch (ClusterResourceNotFoundException e) {
            log.debug("Workload {} already removed", name);
        }
        log.info("Reclaimed service {} ({})", service.slug(), name);
    }

    public void reclaimProject(ArchivedProject project, CancellationSignal signal) {
        for (ArchivedService service : project.services()) {
            reclaimService(service, signal);
        }

        String networkName = ResourceNames.network(project.originalId());
        Optional<ClusterNetwork> network = client.findNetwork(networkName);
        if (network.isEmpty()) {
            log.info("Network {} already gone", networkName);
            return;
        }

        checkCancelled(signal, networkName);
        Instant since = wallClock.instant();
        Optional<WorkloadHandle> proxy = proxyNetworks.detach(network.get().id());
        if (proxy.isPresent()) {
            awaitProxyUpdated(proxy.get(), since, signal);
        }

        try {
            client.removeNetwork(network.get().id());
        } catch (ClusterResourceNotFoundException e) {
            log.debug("Network {} already removed", networkName);
        }
        log.info("Reclaimed project {} ({})", project.slug(), networkName);
    }

    private void awaitDrained(String workloadName, CancellationSignal signal) {
        Deadline deadline = Deadline.after(waitClock, Duration.ofSeconds(properties.drainTimeoutSecondsOrDefault()));
        Duration pollInterval = Duration.ofMillis(properties.pollIntervalMsOrDefault());
        while (true) {
            checkCancelled(signal, workloadName);
            int tasks = client.listTasks(workloadName).size();
            if (tasks == 0) {
                return;
            }
            if (deadline.expired()) {
                throw new ReclaimTimeoutException("Workload " + workloadName + " still has " + tasks
                        + " task(s) after " + properties.drainTimeoutSecondsOrDefault() + "s");
            }
            log.debug("Waiting for {} task(s) of {} to stop", tasks, workloadName);
            Duration remaining = deadline.remaining();
            sleep(pollInterval.compareTo(remaining) < 0 ? pollInterval : remaining, workloadName);
        }
    }

    private void awaitProxyUpdated(WorkloadHandle proxy, Instant since, CancellationSignal signal) {
        Deadline deadline = Deadline.after(waitClock, Duration.ofSeconds(properties.eventTimeoutSecondsOrDefault()));
        EventFilter filter = EventFilter.workload(proxy.id());
        while (!deadline.expired()) {
            checkCancelled(signal, proxy.name());
            Duration window = deadline.cappedAt(EVENT_WINDOW).remaining();
            if (client.awaitEvent(filter, since, window, UPDATE_COMPLETED)) {
                log.debug("Proxy workload {} finished updating", proxy.name());
                return;
            }
        }
        throw new ReclaimTimeoutException("Proxy workload " + proxy.name() + " did not finish updating within "
                + properties.eventTimeoutSecondsOrDefault() + "s");
    }

    private void sleep(Duration duration, String resource) {
        try {
            waitClock.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while reclaiming " + resource);
        }
    }

    private static void checkCancelled(CancellationSignal signal, String resource) {
        if (signal.cancelled()) {
            throw new OperationCancelledException("Reclaim of " + resource + " cancelled");
        }
    }
}
