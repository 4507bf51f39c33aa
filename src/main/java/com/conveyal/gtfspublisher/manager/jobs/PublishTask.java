package com.conveyal.gtfspublisher.manager.jobs;

import com.conveyal.gtfspublisher.common.status.MonitorableJob;

import java.util.Collections;
import java.util.List;

/**
 * A node of a {@link PublishTaskGraph}: one publish step, the steps it depends on, and once it has run, its result or
 * the reason it failed.
 *
 * @param <T> type of the value the step produces for its dependents
 */
public class PublishTask<T> extends MonitorableJob {

    public enum State { PENDING, RUNNING, SUCCEEDED, FAILED }

    /** The work of a step. Any exception fails the step. */
    @FunctionalInterface
    public interface TaskLogic<T> {
        T execute() throws Exception;
    }

    public final String id;
    private final TaskLogic<T> logic;
    private final List<PublishTask<?>> dependencies;
    private volatile T result;

    PublishTask(String id, TaskLogic<T> logic, List<PublishTask<?>> dependencies) {
        super(id, JobType.PUBLISH_TASK);
        this.id = id;
        this.logic = logic;
        this.dependencies = Collections.unmodifiableList(dependencies);
    }

    @Override
    public void jobLogic() {
        try {
            result = logic.execute();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status.fail(String.format("%s interrupted", id), e);
        } catch (Exception e) {
            status.fail(String.format("%s failed: %s", id, e.getMessage()), e);
        }
    }

    public State getState() {
        if (status.completed) return status.error ? State.FAILED : State.SUCCEEDED;
        return active ? State.RUNNING : State.PENDING;
    }

    /**
     * @throws IllegalStateException if the task has not succeeded. Dependents only run after their dependencies
     *   succeeded, so they can always read dependency results.
     */
    public T getResult() {
        if (getState() != State.SUCCEEDED) {
            throw new IllegalStateException(String.format("Task %s has no result in state %s", id, getState()));
        }
        return result;
    }

    /** @return the failure message, or null unless the task failed. */
    public String getFailureReason() {
        return getState() == State.FAILED ? status.message : null;
    }

    public List<PublishTask<?>> getDependencies() {
        return dependencies;
    }

    /** @return the first dependency that failed, or null if none did. */
    PublishTask<?> failedDependency() {
        for (PublishTask<?> dependency : dependencies) {
            if (dependency.getState() == State.FAILED) return dependency;
        }
        return null;
    }

    @Override
    public String toString() {
        return String.format("PublishTask{%s %s}", id, getState());
    }
}
