package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.common.controlplane.ControlPlaneModule;

import java.util.Set;

public final class ImageValidatorModule implements ControlPlaneModule {
    @Override
    public String name() {
        return "image-validator";
    }

    @Override
    public Set<Class<?>> configurationClasses() {
        return Set.of(ImageValidatorConfiguration.class);
    }
}
