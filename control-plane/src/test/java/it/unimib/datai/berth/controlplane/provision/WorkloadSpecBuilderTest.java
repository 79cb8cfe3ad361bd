package it.unimib.datai.berth.controlplane.provision;

import it.unimib.datai.berth.common.model.Deployment;
import it.unimib.datai.berth.common.model.DeploymentSlot;
import it.unimib.datai.berth.common.model.PortBinding;
import it.unimib.datai.berth.common.model.ServiceDefinition;
import it.unimib.datai.berth.common.model.VolumeMode;
import it.unimib.datai.berth.common.model.VolumeMount;
import it.unimib.datai.berth.controlplane.TestServices;
import it.unimib.datai.berth.controlplane.cluster.ClusterResourceNotFoundException;
import it.unimib.datai.berth.controlplane.cluster.ClusterVolume;
import it.unimib.datai.berth.controlplane.cluster.ResourceLabels;
import it.unimib.datai.berth.controlplane.cluster.WorkloadSpec;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkloadSpecBuilderTest {

    private static final Instant CREATED = Instant.parse("2024-05-01T10:00:00Z");
    private final WorkloadSpecBuilder builder = new WorkloadSpecBuilder("berth.internal");

    @Test
    void build_mapsIdentityLabelsAndNetwork() {
        Deployment deployment = Deployment.queued("dpl_1", TestServices.web(null), DeploymentSlot.GREEN, null);

        WorkloadSpec spec = builder.build(deployment, List.of());

        assertThat(spec.name()).isEqualTo(TestServices.WORKLOAD);
        assertThat(spec.image()).isEqualTo("nginx:1.27");
        assertThat(spec.env()).containsExactly("MODE=prod");
        assertThat(spec.labels())
                .containsEntry(ResourceLabels.DEPLOYMENT_HASH, "dpl_1")
                .containsEntry(ResourceLabels.PROJECT, TestServices.PROJECT);
        assertThat(spec.containerLabels()).isEqualTo(spec.labels());
        assertThat(spec.networks()).singleElement().satisfies(network -> {
            assertThat(network.target()).isEqualTo("net-prj_1");
            assertThat(network.aliases()).containsExactly("web.berth.internal", "web", "web.green.berth.internal");
        });
        assertThat(spec.replicas()).isEqualTo(1);
        assertThat(spec.restartPolicy().condition()).isEqualTo("on-failure");
        assertThat(spec.restartPolicy().delay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(spec.restartPolicy().maxAttempts()).isEqualTo(3);
    }

    @Test
    void build_splitsCommandIntoWords() {
        WorkloadSpec spec = builder.build(TestServices.deployment(TestServices.worker()), List.of());

        assertThat(spec.command()).containsExactly("python", "worker.py");
        assertThat(spec.networks().get(0).aliases()).isEmpty();
    }

    @Test
    void publishedPorts_skipsProxyRoutedAndHttpHostPorts() {
        List<WorkloadSpec.PublishedPort> ports = WorkloadSpecBuilder.publishedPorts(List.of(
                PortBinding.http(3000),
                new PortBinding(80, 8080),
                new PortBinding(5432, 5432)));

        assertThat(ports).containsExactly(new WorkloadSpec.PublishedPort(5432, 5432));
    }

    @Test
    void mounts_namedVolumesInClusterOrderThenHostPaths() {
        ServiceDefinition service = TestServices.withVolumes(List.of(), List.of(
                new VolumeMount("vol_a", "a", "/a", null, VolumeMode.READ_WRITE, CREATED),
                new VolumeMount("vol_h", "h", "/h", "/srv/h", VolumeMode.READ_ONLY, null),
                new VolumeMount("vol_b", "b", "/b", null, VolumeMode.READ_ONLY, CREATED)));
        List<ClusterVolume> volumes = List.of(
                volume("vol-vol_b-1", "vol_b"),
                volume("vol-stale", "vol_x"),
                volume("vol-vol_a-1", "vol_a"));

        List<WorkloadSpec.Mount> mounts = WorkloadSpecBuilder.mounts(service, volumes);

        assertThat(mounts).containsExactly(
                new WorkloadSpec.Mount(WorkloadSpec.MountType.VOLUME, "vol-vol_b-1", "/b", true),
                new WorkloadSpec.Mount(WorkloadSpec.MountType.VOLUME, "vol-vol_a-1", "/a", false),
                new WorkloadSpec.Mount(WorkloadSpec.MountType.BIND, "/srv/h", "/h", true));
    }

    @Test
    void mounts_missingClusterVolume_throwsNotFound() {
        ServiceDefinition service = TestServices.withVolumes(List.of(), List.of(
                new VolumeMount("vol_a", "a", "/a", null, VolumeMode.READ_WRITE, CREATED)));

        assertThatThrownBy(() -> WorkloadSpecBuilder.mounts(service, List.of()))
                .isInstanceOf(ClusterResourceNotFoundException.class)
                .hasMessageContaining("vol_a");
    }

    private static ClusterVolume volume(String name, String volumeId) {
        return new ClusterVolume(name, Map.of(ResourceLabels.VOLUME_ID, volumeId));
    }
}
