package it.unimib.datai.berth.modules.imagevalidator;

import it.unimib.datai.berth.common.model.ImageReference;
import it.unimib.datai.berth.common.model.RegistryCredentials;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.controlplane.cluster.ClusterApiException;
import it.unimib.datai.berth.controlplane.cluster.ClusterClient;
import it.unimib.datai.berth.controlplane.registry.ImageValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RegistryImageValidatorTest {

    private static final RegistryCredentials CREDENTIALS = new RegistryCredentials("robot", "s3cret");

    @Test
    void validate_existingImage_passesCredentialsAndSucceeds() {
        ClusterClient client = mock(ClusterClient.class);
        ServiceDefinition service = service("ghcr.io/acme/api", "1.2.0");
        when(client.imageExists(service.image(), CREDENTIALS)).thenReturn(true);

        assertThatCode(() -> new RegistryImageValidator(provider(client)).validate(service))
                .doesNotThrowAnyException();
        verify(client).imageExists(new ImageReference("ghcr.io/acme/api", "1.2.0"), CREDENTIALS);
    }

    @Test
    void validate_missingImage_throwsNotFound() {
        ClusterClient client = mock(ClusterClient.class);
        ServiceDefinition service = service("ghcr.io/acme/api", "nope");
        when(client.imageExists(service.image(), CREDENTIALS)).thenReturn(false);

        assertThatThrownBy(() -> new RegistryImageValidator(provider(client)).validate(service))
                .isInstanceOf(ImageValidationException.class)
                .hasMessageContaining("ghcr.io/acme/api:nope")
                .extracting(e -> ((ImageValidationException) e).errorCode())
                .isEqualTo("IMAGE_NOT_FOUND");
    }

    @Test
    void validate_clusterApiFailure_isRegistryUnavailable() {
        ClusterClient client = mock(ClusterClient.class);
        ServiceDefinition service = service("redis", null);
        when(client.imageExists(service.image(), CREDENTIALS))
                .thenThrow(new ClusterApiException(0, "I/O error during inspect distribution", (String) null));

        assertThatThrownBy(() -> new RegistryImageValidator(provider(client)).validate(service))
                .isInstanceOf(ImageValidationException.class)
                .extracting(e -> ((ImageValidationException) e).errorCode())
                .isEqualTo("IMAGE_REGISTRY_UNAVAILABLE");
    }

    @Test
    void validate_clientUnavailable_isRegistryUnavailable() {
        @SuppressWarnings("unchecked")
        ObjectProvider<ClusterClient> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenThrow(new IllegalStateException("no bean"));

        assertThatThrownBy(() -> new RegistryImageValidator(provider).validate(service("redis", "7")))
                .isInstanceOf(ImageValidationException.class)
                .hasMessageContaining("Cluster client unavailable");
    }

    @SuppressWarnings("unchecked")
    private static ObjectProvider<ClusterClient> provider(ClusterClient client) {
        ObjectProvider<ClusterClient> provider = mock(ObjectProvider.class);
        when(provider.getObject()).thenReturn(client);
        return provider;
    }

    private static ServiceDefinition service(String repository, String tag) {
        return new ServiceDefinition("prj1", "srv1", "api", new ImageReference(repository, tag), null,
                CREDENTIALS, List.of(), List.of(), List.of(), null, null, List.of());
    }
}
