package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.common.controlplane.ControlPlaneModule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class ImageValidatorModuleTest {

    @Test
    void moduleIsDiscoveredThroughServiceLoader() {
        List<ControlPlaneModule> modules = ServiceLoader.load(ControlPlaneModule.class).stream()
                .map(ServiceLoader.Provider::get)
                .collect(Collectors.toList());

        assertThat(modules).anySatisfy(module -> {
            assertThat(module).isInstanceOf(ImageValidatorModule.class);
            assertThat(module.name()).isEqualTo("image-validator");
            assertThat(module.configurationClasses()).containsExactly(ImageValidatorConfiguration.class);
        });
    }
}
