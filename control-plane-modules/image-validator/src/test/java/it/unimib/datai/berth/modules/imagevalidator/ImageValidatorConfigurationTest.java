package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.config.CoreDefaults;
import it.unimib.datai.berth.controlplane.registry.ImageValidator;
import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ImageValidatorConfigurationTest {

    @Test
    void moduleBeanOverridesCoreDefaultWhenClusterClientPresent() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.registerBean(ClusterClient.class, () -> mock(ClusterClient.class));
            context.register(CoreDefaults.class, ImageValidatorConfiguration.class);
            context.refresh();

            ImageValidator imageValidator = context.getBean(ImageValidator.class);
            assertThat(imageValidator).isInstanceOf(RegistryImageValidator.class);
            assertThat(context.getBeansOfType(ImageValidator.class)).containsKey("moduleImageValidator");
        }
    }

    @Test
    void moduleBeanIsNotCreatedWithoutClusterClient() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.register(CoreDefaults.class, ImageValidatorConfiguration.class);
            context.refresh();

            assertThat(context.getBeansOfType(RegistryImageValidator.class)).isEmpty();
            assertThat(context.getBean(ImageValidator.class)).isNotInstanceOf(RegistryImageValidator.class);
        }
    }
}
