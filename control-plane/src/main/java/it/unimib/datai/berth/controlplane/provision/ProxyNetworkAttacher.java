package it.unimib.datai.berth.controlplane.provision;

import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.cluster.ClusterResourceNotFoundException;
import it.unimib.datai.berth.controlplane.cluster.LabelSelector;
import it.unimib.datai.berth.controlplane.cluster.WorkloadHandle;
import it.unimib.datai.berth.controlplane.cluster.WorkloadInfo;
import it.unimib.datai.berth.controlplane.config.ProxyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keeps the shared proxy workload attached to every project network so it can dial
 * workloads by name.
 */
@Component
public class ProxyNetworkAttacher {
    private static final Logger log = LoggerFactory.getLogger(ProxyNetworkAttacher.class);

    private final ClusterClient client;
    private final LabelSelector proxySelector;

    public ProxyNetworkAttacher(ClusterClient client, ProxyProperties properties) {
        this.client = client;
        this.proxySelector = properties.workloadSelector();
    }

    public WorkloadInfo proxyWorkload() {
        List<WorkloadInfo> found = client.listWorkloadsByLabel(proxySelector);
        if (found.isEmpty()) {
            throw new ClusterResourceNotFoundException("No proxy workload labeled " + proxySelector.filterValues(), null);
        }
        return found.get(0);
    }

    /**
     * @return true when the proxy had to be updated
     */
    public boolean attach(String networkId) {
        WorkloadInfo proxy = proxyWorkload();
        List<String> networks = new ArrayList<>(proxy.networkIds());
        if (networks.contains(networkId)) {
            return false;
        }
        networks.add(networkId);
        client.updateWorkloadNetworks(proxy, networks);
        log.info("Attached network {} to proxy workload {}", networkId, proxy.name());
        return true;
    }

    /**
     * @return the proxy workload when an update was written, empty if the network was not attached
     */
    public Optional<WorkloadHandle> detach(String networkId) {
        WorkloadInfo proxy = proxyWorkload();
        List<String> networks = new ArrayList<>(proxy.networkIds());
        if (!networks.remove(networkId)) {
            return Optional.empty();
        }
        client.updateWorkloadNetworks(proxy, networks);
        log.info("Detached network {} from proxy workload {}", networkId, proxy.name());
        return Optional.of(proxy.handle());
    }
}
