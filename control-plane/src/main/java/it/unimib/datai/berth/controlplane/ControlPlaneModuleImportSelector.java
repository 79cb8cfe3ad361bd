package it.unimib.datai.berth.controlplane;

import it.unimib.datai.berth.common.controlplane.ControlPlaneModule;
import org.springframework.context.annotation.DeferredImportSelector;
import org.springframework.core.type.AnnotationMetadata;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Imports the {@code @Configuration} classes of modules found on the classpath, also when
 * the context is bootstrapped without {@link ControlPlaneApplication#main}. Deferred so that
 * module conditions see the core beans.
 */
public final class ControlPlaneModuleImportSelector implements DeferredImportSelector {

    @Override
    public String[] selectImports(AnnotationMetadata importingClassMetadata) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        Set<String> moduleConfigurations = new LinkedHashSet<>();
        ServiceLoader.load(ControlPlaneModule.class, classLoader).forEach(module -> module.configurationClasses().stream()
                .filter(Objects::nonNull)
                .map(Class::getName)
                .forEach(moduleConfigurations::add));
        return moduleConfigurations.toArray(String[]::new);
    }
}
