package it.unimib.datai.berth.controlplane.cluster;

import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.TaskSpec;

import java.util.ArrayList;
import java.util.List;

/**
 * A workload as currently stored by the cluster. {@code spec} is the stored declarative spec;
 * partial updates (scale, networks) are applied on top of it so fields this client does not
 * model are written back unchanged.
 */
public record WorkloadInfo(String id, String name, long version, ServiceSpec spec) {

    public WorkloadInfo {
        spec = spec == null ? new ServiceSpec() : spec;
    }

    public WorkloadHandle handle() {
        return new WorkloadHandle(id, name);
    }

    public List<String> networkIds() {
        List<String> ids = new ArrayList<>();
        TaskSpec taskTemplate = spec.getTaskTemplate();
        List<NetworkAttachmentConfig> networks = taskTemplate != null ? taskTemplate.getNetworks() : null;
        if (networks == null) {
            // older daemons keep the attachments at the top level of the spec
            networks = spec.getNetworks();
        }
        if (networks != null) {
            for (NetworkAttachmentConfig network : networks) {
                if (network.getTarget() != null) {
                    ids.add(network.getTarget());
                }
            }
        }
        return ids;
    }
}
