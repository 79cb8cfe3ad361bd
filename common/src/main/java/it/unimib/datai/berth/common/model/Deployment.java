package it.unimib.datai.berth.common.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One deploy request of a service. The service snapshot pins the image tag used for this
 * deployment; network aliases are always recomputed from it and the slot.
 */
public record Deployment(
        String hash,
        ServiceDefinition service,
        DeploymentSlot slot,
        DeploymentStatus status,
        String statusReason,
        boolean currentProduction,
        String previewUrl,
        String redeployOf
) {
    public Deployment {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Deployment hash is required");
        }
        if (service == null) {
            throw new IllegalArgumentException("Deployment service is required");
        }
        if (slot == null) {
            slot = DeploymentSlot.BLUE;
        }
        if (status == null) {
            status = DeploymentStatus.QUEUED;
        }
    }

    public static Deployment queued(String hash, ServiceDefinition service, DeploymentSlot slot, String previewUrl) {
        return new Deployment(hash, service, slot, DeploymentStatus.QUEUED, null, true, previewUrl, null);
    }

    public List<String> networkAliases(String privateDomain) {
        List<String> base = service.networkAliases(privateDomain);
        if (base.isEmpty()) {
            return base;
        }
        List<String> aliases = new ArrayList<>(base);
        aliases.add(service.networkAlias() + "." + slot.label() + "." + privateDomain);
        return List.copyOf(aliases);
    }

    public Deployment withStatus(DeploymentStatus newStatus, String reason) {
        return new Deployment(hash, service, slot, newStatus, reason, currentProduction, previewUrl, redeployOf);
    }
}
