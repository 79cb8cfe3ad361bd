package it.unimib.datai.berth.controlplane.config;

import it.unimib.datai.berth.controlplane.deploy.DeploymentRecordStore;
import it.unimib.datai.berth.controlplane.registry.ImageValidator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Fallback;

@Configuration
public class CoreDefaults {

    @Bean
    @ConditionalOnMissingBean(DeploymentRecordStore.class)
    public DeploymentRecordStore deploymentRecordStore() {
        return DeploymentRecordStore.noOp();
    }

    @Bean
    @Fallback
    @ConditionalOnMissingBean(ImageValidator.class)
    public ImageValidator imageValidator() {
        return ImageValidator.noOp();
    }
}
