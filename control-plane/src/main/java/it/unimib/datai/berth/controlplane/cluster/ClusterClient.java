package it.unimib.datai.berth.controlplane.cluster;

import it.unimib.datai.berth.common.model.ImageReference;
import it.unimib.datai.berth.common.model.RegistryCredentials;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Query and command interface over the container cluster. One instance is created at startup
 * and shared; implementations are expected to be thread-safe.
 *
 * <p>Lookups return {@link Optional#empty()} for missing resources. Mutations addressing a
 * missing resource throw {@link ClusterResourceNotFoundException}; every other API failure
 * surfaces as {@link ClusterApiException}.</p>
 */
public interface ClusterClient {

    ClusterNetwork createNetwork(String name, Map<String, String> labels);

    Optional<ClusterNetwork> findNetwork(String name);

    void removeNetwork(String id);

    ClusterVolume createVolume(String name, Map<String, String> labels);

    List<ClusterVolume> listVolumesByLabel(LabelSelector selector);

    /** Fails with status 409 while a container still mounts the volume. */
    void removeVolume(String name);

    Optional<WorkloadInfo> findWorkload(String name);

    List<WorkloadInfo> listWorkloadsByLabel(LabelSelector selector);

    /** Host ports published by any workload of the cluster, mapped to the owning workload name. */
    Map<Integer, String> publishedPorts();

    WorkloadHandle createWorkload(WorkloadSpec spec, RegistryCredentials credentials);

    WorkloadHandle updateWorkload(WorkloadInfo current, WorkloadSpec spec, RegistryCredentials credentials);

    void scaleWorkload(WorkloadInfo current, int replicas);

    void updateWorkloadNetworks(WorkloadInfo current, List<String> networkIds);

    void removeWorkload(String id);

    List<ClusterTask> listTasks(String workloadName);

    List<ClusterTask> listTasksByLabel(String workloadName, String labelKey, String labelValue);

    /**
     * Blocks until an event matching {@code filter} and {@code predicate} is observed, reading
     * events emitted from {@code since} on, or until {@code timeout} elapses.
     *
     * @return true when a matching event was seen
     */
    boolean awaitEvent(EventFilter filter, Instant since, Duration timeout, Predicate<ClusterEvent> predicate);

    /**
     * Runs {@code command} in a container and waits for it to exit.
     *
     * @param timeout bound on the whole exchange (creating, running and inspecting the exec)
     * @throws ClusterRequestTimeoutException when {@code timeout} elapses first, or is zero
     */
    ExecResult exec(String containerId, List<String> command, Duration timeout);

    void pullImage(ImageReference image, RegistryCredentials credentials);

    boolean imageExists(ImageReference image, RegistryCredentials credentials);
}
