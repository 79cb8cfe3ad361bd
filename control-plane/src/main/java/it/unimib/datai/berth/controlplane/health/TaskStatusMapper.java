package it.unimib.datai.berth.controlplane.health;

import it.unimib.datai.berth.common.model.DeploymentStatus;
import it.unimib.datai.berth.controlplane.cluster.ClusterTask;
import it.unimib.datai.berth.controlplane.cluster.TaskState;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Converts raw task state into a deployment status.
 */
public final class TaskStatusMapper {

    private static final Comparator<ClusterTask> RECENCY = Comparator
            .comparingLong(ClusterTask::versionIndex)
            .thenComparing(ClusterTask::id, Comparator.nullsFirst(Comparator.naturalOrder()));

    private TaskStatusMapper() {
    }

    /**
     * The task with the greatest version index; equal indexes resolve to the greatest task id.
     */
    public static Optional<ClusterTask> mostRecent(List<ClusterTask> tasks) {
        return tasks.stream().max(RECENCY);
    }

    /**
     * Unrecognised states count as still starting, so the caller keeps polling.
     *
     * @param taskCount number of tasks carrying the deployment hash; more than one means
     *                  the cluster already replaced a task
     */
    public static DeploymentStatus statusOf(TaskState state, int taskCount) {
        return switch (state) {
            case NEW, ALLOCATED, PENDING, ASSIGNED, ACCEPTED, READY, PREPARING, STARTING, UNKNOWN ->
                    taskCount > 1 ? DeploymentStatus.RESTARTING : DeploymentStatus.STARTING;
            case RUNNING -> DeploymentStatus.HEALTHY;
            case COMPLETE, SHUTDOWN, REMOVE -> DeploymentStatus.OFFLINE;
            case FAILED, REJECTED, ORPHANED -> DeploymentStatus.UNHEALTHY;
        };
    }

    public static HealthCheckOutcome outcomeOf(ClusterTask task, int taskCount) {
        DeploymentStatus status = statusOf(task.state(), taskCount);
        if (task.state() == TaskState.SHUTDOWN) {
            Integer exitCode = task.exitCode();
            if ((exitCode != null && exitCode != 0) || task.error() != null) {
                status = DeploymentStatus.UNHEALTHY;
            }
        }
        return new HealthCheckOutcome(status, task.statusReason());
    }
}
