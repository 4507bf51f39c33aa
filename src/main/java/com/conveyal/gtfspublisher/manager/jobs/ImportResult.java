package com.conveyal.gtfspublisher.manager.jobs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Outcome of running a publish task graph.
 */
public class ImportResult {
    /** Ids of the tasks that succeeded, in the order they resolved. */
    public final List<String> succeededTasks;
    /** Distinct failure reasons, in the order the failed tasks resolved. */
    public final List<String> failures;

    public ImportResult(List<String> succeededTasks, List<String> failures) {
        this.succeededTasks = Collections.unmodifiableList(new ArrayList<>(succeededTasks));
        this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
    }

    static ImportResult fromTasks(List<PublishTask<?>> resolvedTasks) {
        List<String> succeeded = new ArrayList<>();
        Set<String> failures = new LinkedHashSet<>();
        for (PublishTask<?> task : resolvedTasks) {
            if (task.getState() == PublishTask.State.SUCCEEDED) succeeded.add(task.id);
            else failures.add(task.getFailureReason());
        }
        return new ImportResult(succeeded, new ArrayList<>(failures));
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    public String getFailureMessage() {
        return String.join("\n", failures);
    }
}
