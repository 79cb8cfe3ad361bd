package it.unimib.datai.berth.controlplane.cluster;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateServiceCmd;
import com.github.dockerjava.api.command.PullImageCmd;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.AuthConfig;
import com.github.dockerjava.api.model.ContainerSpec;
import com.github.dockerjava.api.model.EndpointSpec;
import com.github.dockerjava.api.model.Event;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.command.InspectVolumeResponse;
import com.github.dockerjava.api.model.Mount;
import com.github.dockerjava.api.model.MountType;
import com.github.dockerjava.api.model.Network;
import com.github.dockerjava.api.model.NetworkAttachmentConfig;
import com.github.dockerjava.api.model.PortConfig;
import com.github.dockerjava.api.model.PortConfigProtocol;
import com.github.dockerjava.api.model.PullResponseItem;
import com.github.dockerjava.api.model.Service;
import com.github.dockerjava.api.model.ServiceModeConfig;
import com.github.dockerjava.api.model.ServiceReplicatedModeOptions;
import com.github.dockerjava.api.model.ServiceRestartCondition;
import com.github.dockerjava.api.model.ServiceRestartPolicy;
import com.github.dockerjava.api.model.ServiceSpec;
import com.github.dockerjava.api.model.Task;
import com.github.dockerjava.api.model.TaskSpec;
import com.github.dockerjava.api.model.TaskStatus;
import com.github.dockerjava.api.model.TaskStatusContainerStatus;
import com.github.dockerjava.transport.DockerHttpClient;
import it.unimib.datai.berth.common.model.ImageReference;
import it.unimib.datai.berth.common.model.RegistryCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * {@link ClusterClient} over the Docker Engine API of a Swarm manager, through docker-java.
 *
 * <p>docker-java failures are translated at this boundary: callers only ever see the
 * {@link ClusterApiException} hierarchy.</p>
 */
public final class DockerEngineClient implements ClusterClient {
    private static final Logger log = LoggerFactory.getLogger(DockerEngineClient.class);
    private static final String DOCKER_HUB = "https://index.docker.io/v1/";
    private static final AtomicInteger EXEC_THREADS = new AtomicInteger();

    private final DockerClient docker;
    private final DockerHttpClient http;
    private final String apiVersion;
    private final Duration requestTimeout;
    private final Duration pullTimeout;
    private final ObjectMapper mapper = new ObjectMapper();
    private final ExecutorService execWaits = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "docker-exec-" + EXEC_THREADS.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    /**
     * @param http the transport {@code docker} was built on, used for the endpoints docker-java
     *             has no command for
     * @param apiVersion the version prefix of raw request paths, e.g. {@code v1.43}
     */
    public DockerEngineClient(DockerClient docker, DockerHttpClient http, String apiVersion,
                              Duration requestTimeout, Duration pullTimeout) {
        this.docker = docker;
        this.http = http;
        this.apiVersion = apiVersion.startsWith("v") ? apiVersion : "v" + apiVersion;
        this.requestTimeout = requestTimeout;
        this.pullTimeout = pullTimeout;
    }

    // --- networks ---

    @Override
    public ClusterNetwork createNetwork(String name, Map<String, String> labels) {
        String id = call("create network " + name, () -> docker.createNetworkCmd()
                .withName(name)
                .withDriver("overlay")
                .withAttachable(true)
                .withCheckDuplicate(true)
                .withLabels(labels)
                .exec()
                .getId());
        log.info("Created network {} ({})", name, id);
        return new ClusterNetwork(id, name, labels);
    }

    @Override
    public Optional<ClusterNetwork> findNetwork(String name) {
        try {
            Network network = call("inspect network " + name,
                    () -> docker.inspectNetworkCmd().withNetworkId(name).exec());
            return Optional.of(new ClusterNetwork(network.getId(), network.getName(), network.getLabels()));
        } catch (ClusterResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public void removeNetwork(String id) {
        run("remove network " + id, () -> docker.removeNetworkCmd(id).exec());
    }

    // --- volumes ---

    @Override
    public ClusterVolume createVolume(String name, Map<String, String> labels) {
        String created = call("create volume " + name, () -> docker.createVolumeCmd()
                .withName(name)
                .withDriver("local")
                .withLabels(labels)
                .exec()
                .getName());
        return new ClusterVolume(created != null ? created : name, labels);
    }

    @Override
    public List<ClusterVolume> listVolumesByLabel(LabelSelector selector) {
        List<InspectVolumeResponse> found = call("list volumes", () -> docker.listVolumesCmd()
                .withFilter("label", selector.filterValues())
                .exec()
                .getVolumes());
        List<ClusterVolume> volumes = new ArrayList<>();
        if (found != null) {
            for (InspectVolumeResponse volume : found) {
                volumes.add(new ClusterVolume(volume.getName(), volume.getLabels()));
            }
        }
        return volumes;
    }

    @Override
    public void removeVolume(String name) {
        run("remove volume " + name, () -> docker.removeVolumeCmd(name).exec());
    }

    // --- workloads ---

    @Override
    public Optional<WorkloadInfo> findWorkload(String name) {
        try {
            Service service = call("inspect service " + name, () -> docker.inspectServiceCmd(name).exec());
            return Optional.of(toWorkloadInfo(service));
        } catch (ClusterResourceNotFoundException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<WorkloadInfo> listWorkloadsByLabel(LabelSelector selector) {
        List<Service> services = call("list services",
                () -> docker.listServicesCmd().withLabelFilter(selector.labels()).exec());
        List<WorkloadInfo> workloads = new ArrayList<>();
        for (Service service : services) {
            workloads.add(toWorkloadInfo(service));
        }
        return workloads;
    }

    @Override
    public Map<Integer, String> publishedPorts() {
        List<Service> services = call("list services", () -> docker.listServicesCmd().exec());
        Map<Integer, String> owners = new HashMap<>();
        for (Service service : services) {
            ServiceSpec spec = service.getSpec();
            EndpointSpec endpoint = spec != null ? spec.getEndpointSpec() : null;
            if (endpoint == null || endpoint.getPorts() == null) {
                continue;
            }
            for (PortConfig port : endpoint.getPorts()) {
                if (port.getPublishedPort() > 0) {
                    owners.put(port.getPublishedPort(), spec.getName());
                }
            }
        }
        return owners;
    }

    @Override
    public WorkloadHandle createWorkload(WorkloadSpec spec, RegistryCredentials credentials) {
        String id = call("create service " + spec.name(), () -> {
            CreateServiceCmd create = docker.createServiceCmd(serviceSpec(spec));
            if (credentials != null) {
                create.withAuthConfig(authConfig(spec.image(), credentials));
            }
            return create.exec().getId();
        });
        log.info("Created workload {} ({})", spec.name(), id);
        return new WorkloadHandle(id, spec.name());
    }

    /**
     * The update command carries no registry credentials: the image is pulled beforehand with
     * them, and the daemon resolves the tag from its local store.
     */
    @Override
    public WorkloadHandle updateWorkload(WorkloadInfo current, WorkloadSpec spec, RegistryCredentials credentials) {
        writeSpec(current, serviceSpec(spec), "update service");
        log.info("Updated workload {} ({}) from version {}", spec.name(), current.id(), current.version());
        return new WorkloadHandle(current.id(), spec.name());
    }

    @Override
    public void scaleWorkload(WorkloadInfo current, int replicas) {
        ServiceSpec spec = copy(current.spec());
        spec.withMode(new ServiceModeConfig()
                .withReplicated(new ServiceReplicatedModeOptions().withReplicas(replicas)));
        writeSpec(current, spec, "scale service");
        log.info("Scaled workload {} to {} replicas", current.name(), replicas);
    }

    @Override
    public void updateWorkloadNetworks(WorkloadInfo current, List<String> networkIds) {
        ServiceSpec spec = copy(current.spec());
        TaskSpec taskTemplate = spec.getTaskTemplate() != null ? spec.getTaskTemplate() : new TaskSpec();
        Map<String, NetworkAttachmentConfig> existing = new HashMap<>();
        if (taskTemplate.getNetworks() != null) {
            for (NetworkAttachmentConfig network : taskTemplate.getNetworks()) {
                existing.put(network.getTarget(), network);
            }
        }
        List<NetworkAttachmentConfig> networks = new ArrayList<>();
        for (String id : networkIds) {
            NetworkAttachmentConfig kept = existing.get(id);
            networks.add(kept != null ? kept : new NetworkAttachmentConfig().withTarget(id));
        }
        spec.withTaskTemplate(taskTemplate.withNetworks(networks));
        spec.withNetworks(null);
        writeSpec(current, spec, "update service networks");
    }

    @Override
    public void removeWorkload(String id) {
        run("remove service " + id, () -> docker.removeServiceCmd(id).exec());
        log.info("Removed workload {}", id);
    }

    private void writeSpec(WorkloadInfo current, ServiceSpec spec, String action) {
        run(action + " " + current.id(), () -> docker.updateServiceCmd(current.id(), spec)
                .withVersion(current.version())
                .exec());
    }

    // --- tasks ---

    @Override
    public List<ClusterTask> listTasks(String workloadName) {
        return toTasks(call("list tasks", () -> docker.listTasksCmd().withServiceFilter(workloadName).exec()));
    }

    @Override
    public List<ClusterTask> listTasksByLabel(String workloadName, String labelKey, String labelValue) {
        return toTasks(call("list tasks", () -> docker.listTasksCmd()
                .withServiceFilter(workloadName)
                .withLabelFilter(Map.of(labelKey, labelValue))
                .exec()));
    }

    // --- events ---

    @Override
    public boolean awaitEvent(EventFilter filter, Instant since, Duration timeout, Predicate<ClusterEvent> predicate) {
        Instant until = Instant.now().plus(timeout);
        AtomicBoolean matched = new AtomicBoolean();
        ResultCallback.Adapter<Event> callback = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Event item) {
                ClusterEvent event = toEvent(item);
                log.debug("Cluster event {} {} on {}", event.type(), event.action(), event.actorId());
                if (filter.matches(event) && predicate.test(event)) {
                    matched.set(true);
                    closeStream(this);
                }
            }
        };
        try {
            docker.eventsCmd()
                    .withSince(timestamp(since))
                    .withUntil(timestamp(until))
                    .exec(callback);
            callback.awaitCompletion(timeout.plus(requestTimeout).toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterApiException(0, "Interrupted while reading events", e);
        } catch (RuntimeException e) {
            ClusterApiException translated = translate("read events", e);
            if (!(translated instanceof ClusterRequestTimeoutException)) {
                throw translated;
            }
        } finally {
            closeStream(callback);
        }
        return matched.get();
    }

    // --- exec ---

    @Override
    public ExecResult exec(String containerId, List<String> command, Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            throw new ClusterRequestTimeoutException("No time left to exec in " + containerId, null);
        }
        Future<ExecResult> pending = execWaits.submit(() -> runExec(containerId, command));
        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw new ClusterRequestTimeoutException("Timed out during exec in " + containerId, e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            Thread.currentThread().interrupt();
            throw new ClusterApiException(0, "Interrupted during exec in " + containerId, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw translate("exec in " + containerId, cause);
            }
            throw new ClusterApiException(0, "exec in " + containerId + " failed: " + e.getCause(), e.getCause());
        }
    }

    private ExecResult runExec(String containerId, List<String> command) throws InterruptedException {
        String execId = docker.execCreateCmd(containerId)
                .withAttachStdout(true)
                .withAttachStderr(true)
                .withCmd(command.toArray(new String[0]))
                .exec()
                .getId();

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        ResultCallback.Adapter<Frame> frames = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(Frame frame) {
                byte[] payload = frame.getPayload();
                if (payload != null) {
                    synchronized (output) {
                        output.write(payload, 0, payload.length);
                    }
                }
            }
        };
        try {
            docker.execStartCmd(execId).withDetach(false).withTty(false).exec(frames).awaitCompletion();
        } finally {
            closeStream(frames);
        }

        Number exitCode = docker.inspectExecCmd(execId).exec().getExitCode();
        synchronized (output) {
            return new ExecResult(exitCode != null ? exitCode.intValue() : -1,
                    output.toString(StandardCharsets.UTF_8));
        }
    }

    // --- images ---

    @Override
    public void pullImage(ImageReference image, RegistryCredentials credentials) {
        AtomicReference<String> failure = new AtomicReference<>();
        ResultCallback.Adapter<PullResponseItem> progress = new ResultCallback.Adapter<>() {
            @Override
            public void onNext(PullResponseItem item) {
                String error = item.getErrorDetail() != null ? item.getErrorDetail().getMessage() : null;
                if (error != null && failure.compareAndSet(null, error)) {
                    closeStream(this);
                }
            }
        };

        log.info("Pulling image {}", image.fullName());
        boolean finished;
        try {
            PullImageCmd pull = docker.pullImageCmd(image.repository()).withTag(image.tag());
            if (credentials != null) {
                pull.withAuthConfig(authConfig(image.fullName(), credentials));
            }
            pull.exec(progress);
            finished = progress.awaitCompletion(pullTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ClusterApiException(0, "Interrupted pulling image " + image.fullName(), e);
        } catch (RuntimeException e) {
            throw translate("pull image " + image.fullName(), e);
        } finally {
            closeStream(progress);
        }
        if (failure.get() != null) {
            throw new ClusterApiException(200, "Image pull failed for " + image.fullName() + ": " + failure.get(),
                    failure.get());
        }
        if (!finished) {
            throw new ClusterRequestTimeoutException("Timed out pulling image " + image.fullName(), null);
        }
    }

    /**
     * Asks the registry, through the daemon, whether {@code image} resolves. docker-java has no
     * command for the distribution endpoint, so this goes through the raw transport.
     */
    @Override
    public boolean imageExists(ImageReference image, RegistryCredentials credentials) {
        Map<String, String> headers = credentials != null
                ? Map.of("X-Registry-Auth", registryAuthHeader(image.fullName(), credentials))
                : Map.of();
        DockerHttpClient.Request request = DockerHttpClient.Request.builder()
                .method(DockerHttpClient.Request.Method.GET)
                .path("/" + apiVersion + "/distribution/" + image.fullName() + "/json")
                .headers(headers)
                .build();
        int status;
        try {
            DockerHttpClient.Response response = http.execute(request);
            status = response.getStatusCode();
            closeStream(response);
        } catch (RuntimeException e) {
            throw translate("inspect distribution " + image.fullName(), e);
        }
        if (status == 200) {
            return true;
        }
        log.debug("Distribution lookup of {} answered {}", image.fullName(), status);
        return false;
    }

    // --- model mapping ---

    static ServiceSpec serviceSpec(WorkloadSpec spec) {
        List<Mount> mounts = new ArrayList<>();
        for (WorkloadSpec.Mount mount : spec.mounts()) {
            mounts.add(new Mount()
                    .withType(mount.type() == WorkloadSpec.MountType.BIND ? MountType.BIND : MountType.VOLUME)
                    .withSource(mount.source())
                    .withTarget(mount.target())
                    .withReadOnly(mount.readOnly()));
        }
        ContainerSpec container = new ContainerSpec()
                .withImage(spec.image())
                .withCommand(spec.command().isEmpty() ? null : spec.command())
                .withEnv(spec.env())
                .withLabels(spec.containerLabels())
                .withMounts(mounts);

        List<NetworkAttachmentConfig> networks = new ArrayList<>();
        for (WorkloadSpec.NetworkAttachment network : spec.networks()) {
            networks.add(new NetworkAttachmentConfig()
                    .withTarget(network.target())
                    .withAliases(network.aliases().isEmpty() ? null : network.aliases()));
        }
        TaskSpec taskTemplate = new TaskSpec()
                .withContainerSpec(container)
                .withNetworks(networks);
        if (spec.restartPolicy() != null) {
            taskTemplate.withRestartPolicy(new ServiceRestartPolicy()
                    .withCondition(restartCondition(spec.restartPolicy().condition()))
                    .withDelay(Long.valueOf(spec.restartPolicy().delay().toNanos()))
                    .withMaxAttempts(Long.valueOf(spec.restartPolicy().maxAttempts())));
        }

        List<PortConfig> ports = new ArrayList<>();
        for (WorkloadSpec.PublishedPort port : spec.ports()) {
            ports.add(new PortConfig()
                    .withProtocol(PortConfigProtocol.TCP)
                    .withPublishedPort(port.published())
                    .withTargetPort(port.target()));
        }

        return new ServiceSpec()
                .withName(spec.name())
                .withLabels(spec.labels())
                .withTaskTemplate(taskTemplate)
                .withMode(new ServiceModeConfig()
                        .withReplicated(new ServiceReplicatedModeOptions().withReplicas(spec.replicas())))
                .withEndpointSpec(new EndpointSpec().withPorts(ports));
    }

    private static ServiceRestartCondition restartCondition(String condition) {
        if ("any".equals(condition)) {
            return ServiceRestartCondition.ANY;
        }
        if ("none".equals(condition)) {
            return ServiceRestartCondition.NONE;
        }
        return ServiceRestartCondition.ON_FAILURE;
    }

    private static WorkloadInfo toWorkloadInfo(Service service) {
        ServiceSpec spec = service.getSpec() != null ? service.getSpec() : new ServiceSpec();
        long version = service.getVersion() != null && service.getVersion().getIndex() != null
                ? service.getVersion().getIndex() : 0L;
        return new WorkloadInfo(service.getId(), spec.getName(), version, spec);
    }

    private static List<ClusterTask> toTasks(List<Task> tasks) {
        List<ClusterTask> result = new ArrayList<>();
        for (Task task : tasks) {
            result.add(toTask(task));
        }
        return result;
    }

    static ClusterTask toTask(Task task) {
        TaskStatus status = task.getStatus();
        TaskStatusContainerStatus containerStatus = status != null ? status.getContainerStatus() : null;
        Number exitCode = containerStatus != null ? containerStatus.getExitCode() : null;
        long version = task.getVersion() != null && task.getVersion().getIndex() != null
                ? task.getVersion().getIndex() : 0L;
        return new ClusterTask(
                task.getId(),
                version,
                TaskState.fromWire(status != null && status.getState() != null ? status.getState().name() : null),
                containerStatus != null ? containerStatus.getContainerID() : null,
                exitCode != null ? exitCode.intValue() : null,
                status != null ? status.getErr() : null,
                status != null ? status.getMessage() : null);
    }

    private static ClusterEvent toEvent(Event event) {
        return new ClusterEvent(
                event.getType() != null ? event.getType().getValue() : null,
                event.getAction(),
                event.getActor() != null ? event.getActor().getId() : null,
                event.getActor() != null ? event.getActor().getAttributes() : null);
    }

    private ServiceSpec copy(ServiceSpec spec) {
        return mapper.convertValue(spec, ServiceSpec.class);
    }

    private static AuthConfig authConfig(String image, RegistryCredentials credentials) {
        return new AuthConfig()
                .withUsername(credentials.username())
                .withPassword(credentials.password())
                .withRegistryAddress(registryAddress(image));
    }

    private String registryAuthHeader(String image, RegistryCredentials credentials) {
        Map<String, String> auth = new LinkedHashMap<>();
        auth.put("username", credentials.username());
        auth.put("password", credentials.password());
        auth.put("serveraddress", registryAddress(image));
        try {
            return Base64.getUrlEncoder().encodeToString(mapper.writeValueAsBytes(auth));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode registry credentials", e);
        }
    }

    static String registryAddress(String image) {
        int slash = image.indexOf('/');
        if (slash > 0) {
            String first = image.substring(0, slash);
            if (first.contains(".") || first.contains(":") || first.equals("localhost")) {
                return first;
            }
        }
        return DOCKER_HUB;
    }

    static String timestamp(Instant instant) {
        return instant.getEpochSecond() + "." + String.format("%09d", instant.getNano());
    }

    // --- error translation ---

    private <T> T call(String action, Callable<T> command) {
        try {
            return command.call();
        } catch (RuntimeException e) {
            throw translate(action, e);
        } catch (Exception e) {
            throw new ClusterApiException(0, "Error during " + action + ": " + e.getMessage(), e);
        }
    }

    private void run(String action, Runnable command) {
        call(action, () -> {
            command.run();
            return null;
        });
    }

    ClusterApiException translate(String action, RuntimeException e) {
        if (e instanceof ClusterApiException api) {
            return api;
        }
        if (e instanceof DockerException docker) {
            int status = docker.getHttpStatus();
            String body = responseBody(docker.getMessage());
            String detail = errorMessage(body);
            String msg = "Docker HTTP " + status + " during " + action + (detail != null ? ": " + detail : "");
            if (e instanceof NotFoundException || status == 404) {
                return new ClusterResourceNotFoundException(msg, body);
            }
            return new ClusterApiException(status, msg, body);
        }
        if (causedByTimeout(e)) {
            return new ClusterRequestTimeoutException("Timed out during " + action, e);
        }
        return new ClusterApiException(0, "I/O error during " + action + ": " + e.getMessage(), e);
    }

    private static boolean causedByTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    // docker-java messages read "Status 409: {...}"
    private static String responseBody(String message) {
        if (message == null) {
            return null;
        }
        int colon = message.indexOf(": ");
        return message.startsWith("Status ") && colon > 0 ? message.substring(colon + 2) : message;
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("message")) {
                return node.get("message").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Non-JSON Docker error body: {}", body);
        }
        return body.trim();
    }

    private static void closeStream(Closeable stream) {
        try {
            stream.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
