package it.unimib.datai.berth.controlplane.config;

import it.unimib.datai.berth.controlplane.cluster.LabelSelector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesDefaultsTest {

    @Test
    void proxyProperties_defaults() {
        ProxyProperties properties = new ProxyProperties(null, null, null, null, null, null, 0, " ");

        assertThat(properties.adminUrlOrDefault()).isEqualTo("http://localhost:2019");
        assertThat(properties.serverNameOrDefault()).isEqualTo("berth");
        assertThat(properties.serverIdOrDefault()).isEqualTo("berth-server");
        assertThat(properties.maxWriteAttemptsOrDefault()).isEqualTo(3);
        assertThat(properties.workloadLabelOrDefault()).isEqualTo("berth.role=proxy");
        assertThat(properties.workloadSelector()).isEqualTo(LabelSelector.of("berth.role", "proxy"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"no-equals-sign", "berth.role=", "=proxy", "="})
    void proxyProperties_incompleteWorkloadLabel_isRejected(String label) {
        assertThatThrownBy(() -> new ProxyProperties(null, null, null, null, null, null, null, label))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("berth.proxy.workload-label");
    }

    @Test
    void proxyProperties_workloadLabel_isSplitAtFirstEquals() {
        ProxyProperties properties = new ProxyProperties(null, null, null, null, null, null, null, "tier=edge=1");

        assertThat(properties.workloadSelector()).isEqualTo(LabelSelector.of("tier", "edge=1"));
    }

    @Test
    void healthCheckProperties_defaults() {
        HealthCheckProperties properties = new HealthCheckProperties(-1, null, null, " ");

        assertThat(properties.defaultTimeoutSecondsOrDefault()).isEqualTo(60);
        assertThat(properties.waitIntervalSecondsOrDefault()).isEqualTo(1.0);
        assertThat(properties.probeRequestCapSecondsOrDefault()).isEqualTo(5);
        assertThat(properties.probeSchemeOrDefault()).isEqualTo("http");
    }

    @Test
    void reclaimAndPlatformProperties_defaults() {
        ReclaimProperties reclaim = new ReclaimProperties(null, null, null);
        PlatformProperties platform = new PlatformProperties(null);

        assertThat(reclaim.drainTimeoutSecondsOrDefault()).isEqualTo(10);
        assertThat(reclaim.eventTimeoutSecondsOrDefault()).isEqualTo(10);
        assertThat(reclaim.pollIntervalMsOrDefault()).isEqualTo(1000);
        assertThat(platform.privateDomainOrDefault()).isEqualTo("berth.internal");
    }

    @Test
    void explicitValues_winOverDefaults() {
        DockerProperties docker = new DockerProperties("http://m:2375", "v1.45", 100L, 200L, 300L);

        assertThat(docker.apiVersionOrDefault()).isEqualTo("v1.45");
        assertThat(docker.connectTimeoutMsOrDefault()).isEqualTo(100);
        assertThat(docker.requestTimeoutMsOrDefault()).isEqualTo(200);
        assertThat(docker.pullTimeoutMsOrDefault()).isEqualTo(300);
    }
}
