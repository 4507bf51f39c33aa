package com.conveyal.gtfspublisher.manager.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * A dataflow graph of publish steps. A task is handed to the executor as soon as all of its dependencies have
 * resolved: it runs if they all succeeded and is failed without running otherwise. Tasks with no dependency
 * relationship run concurrently. Running tasks are never cancelled, so a failure in one branch leaves other branches
 * to finish.
 *
 * Dependencies have to be added to the graph before their dependents, which keeps the graph acyclic.
 */
public class PublishTaskGraph {
    private static final Logger LOG = LoggerFactory.getLogger(PublishTaskGraph.class);

    private final ExecutorService executor;
    private final Map<String, PublishTask<?>> tasks = new LinkedHashMap<>();
    private final List<PublishTask<?>> resolutionOrder = Collections.synchronizedList(new ArrayList<>());
    private boolean executed = false;

    public PublishTaskGraph(ExecutorService executor) {
        this.executor = executor;
    }

    /**
     * Add a task that runs once every listed dependency has succeeded.
     */
    public synchronized <T> PublishTask<T> addTask(
        String id,
        PublishTask.TaskLogic<T> logic,
        PublishTask<?>... dependencies
    ) {
        if (executed) throw new IllegalStateException("Cannot add tasks to a graph that has been executed");
        if (tasks.containsKey(id)) throw new IllegalArgumentException(String.format("Duplicate task id %s", id));
        for (PublishTask<?> dependency : dependencies) {
            if (tasks.get(dependency.id) != dependency) {
                throw new IllegalArgumentException(
                    String.format("Dependency %s of %s is not part of this graph", dependency.id, id)
                );
            }
        }
        PublishTask<T> task = new PublishTask<>(id, logic, Arrays.asList(dependencies));
        tasks.put(id, task);
        return task;
    }

    public synchronized int size() {
        return tasks.size();
    }

    /**
     * Run the whole graph and block until every task has resolved, then inspect each terminal state once.
     *
     * @return the ids of succeeded tasks and the failure reasons of failed tasks, both in resolution order
     */
    public ImportResult execute() {
        List<CompletableFuture<Void>> allFutures = new ArrayList<>();
        synchronized (this) {
            if (executed) throw new IllegalStateException("A task graph can only be executed once");
            executed = true;
            Map<PublishTask<?>, CompletableFuture<Void>> futures = new HashMap<>();
            // Insertion order is a topological order, so dependency futures always exist already.
            for (PublishTask<?> task : tasks.values()) {
                CompletableFuture<?>[] dependencyFutures = task.getDependencies().stream()
                    .map(futures::get)
                    .toArray(CompletableFuture[]::new);
                CompletableFuture<Void> future = CompletableFuture.allOf(dependencyFutures)
                    .thenRunAsync(() -> resolve(task), executor);
                futures.put(task, future);
                allFutures.add(future);
            }
        }
        LOG.info("Executing {} publish tasks", allFutures.size());
        CompletableFuture.allOf(allFutures.toArray(new CompletableFuture[0])).join();
        List<PublishTask<?>> resolved;
        synchronized (resolutionOrder) {
            resolved = new ArrayList<>(resolutionOrder);
        }
        ImportResult result = ImportResult.fromTasks(resolved);
        LOG.info("Publish tasks resolved: {} succeeded, {} failed", result.succeededTasks.size(), result.failures.size());
        return result;
    }

    private void resolve(PublishTask<?> task) {
        PublishTask<?> failedDependency = task.failedDependency();
        if (failedDependency != null) {
            task.cancel(String.format("%s cancelled due to failure of %s", task.id, failedDependency.id));
        } else {
            task.run();
        }
        resolutionOrder.add(task);
    }
}
