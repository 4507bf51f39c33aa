package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.manager.arcgis.ArcgisException;
import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Splits datasets into chunks that fit in one request and runs one call per chunk concurrently.
 */
public class ChunkedRequests {
    private static final Logger LOG = LoggerFactory.getLogger(ChunkedRequests.class);

    /** The most records the portal accepts in a single generate or addFeatures request. */
    public static final int MAX_CHUNK_SIZE = 1000;

    /**
     * @return consecutive, order-preserving views of at most {@link #MAX_CHUNK_SIZE} items.
     */
    public static <T> List<List<T>> partition(List<T> items) {
        return Lists.partition(items, MAX_CHUNK_SIZE);
    }

    /**
     * Run every chunk task on the executor and wait until all of them have finished. Results are returned in task
     * order. A failed chunk does not stop its siblings; once all have finished, a single exception listing every
     * failed chunk is thrown, with the individual failures attached as suppressed exceptions.
     */
    public static <T> List<T> executeAll(ExecutorService executor, List<Callable<T>> tasks, String description)
        throws ArcgisException, InterruptedException {
        List<T> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        List<Throwable> causes = new ArrayList<>();
        int chunkNumber = 1;
        for (Future<T> future : executor.invokeAll(tasks)) {
            try {
                results.add(future.get());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                failures.add(String.format("chunk %d: %s", chunkNumber, cause.getMessage()));
                causes.add(cause);
            }
            chunkNumber++;
        }
        if (!failures.isEmpty()) {
            ArcgisException exception = new ArcgisException(String.format(
                "%s: %d of %d chunks failed (%s)",
                description,
                failures.size(),
                tasks.size(),
                String.join("; ", failures)
            ));
            causes.forEach(exception::addSuppressed);
            throw exception;
        }
        LOG.debug("{}: {} chunks completed", description, tasks.size());
        return results;
    }
}
