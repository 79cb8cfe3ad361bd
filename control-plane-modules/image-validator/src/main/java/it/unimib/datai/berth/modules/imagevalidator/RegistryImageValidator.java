package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.common.model.ImageReference;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.controlplane.cluster.ClusterApiException;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.registry.ImageValidationException;
import it.unimib.datai.berth.controlplane.registry.ImageValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Asks the cluster's registry distribution endpoint whether the image exists, with the
 * service's registry credentials, before anything is provisioned.
 */
public class RegistryImageValidator implements ImageValidator {
    private static final Logger log = LoggerFactory.getLogger(RegistryImageValidator.class);

    private final ObjectProvider<ClusterClient> clientProvider;

    public RegistryImageValidator(ObjectProvider<ClusterClient> clientProvider) {
        this.clientProvider = clientProvider;
    }

    @Override
    public void validate(ServiceDefinition service) {
        ImageReference image = service.image();

        ClusterClient client;
        try {
            client = clientProvider.getObject();
        } catch (Exception e) {
            throw ImageValidationException.registryUnavailable(image.fullName(), "Cluster client unavailable");
        }

        boolean exists;
        try {
            exists = client.imageExists(image, service.credentials());
        } catch (ClusterApiException e) {
            throw ImageValidationException.registryUnavailable(image.fullName(), e.getMessage());
        }
        if (!exists) {
            throw ImageValidationException.notFound(image.fullName());
        }
        log.debug("Image {} found in its registry", image.fullName());
    }
}
