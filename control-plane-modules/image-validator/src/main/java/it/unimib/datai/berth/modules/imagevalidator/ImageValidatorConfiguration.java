package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.registry.ImageValidator;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnBean(ClusterClient.class)
public class ImageValidatorConfiguration {

    @Bean
    ImageValidator moduleImageValidator(ObjectProvider<ClusterClient> clientProvider) {
        return new RegistryImageValidator(clientProvider);
    }
}
