package it.unimib.datai.berth.controlplane.registry;

import it.unimib.datai.berth.common.model.ServiceDefinition;

@FunctionalInterface
public interface ImageValidator {
    void validate(ServiceDefinition service);

    static ImageValidator noOp() {
        return service -> {};
    }
}
