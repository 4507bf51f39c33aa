package com.conveyal.gtfspublisher.manager.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Holds the thread pools that publish work runs on.
 */
public class JobUtils {
    private static final Logger LOG = LoggerFactory.getLogger(JobUtils.class);

    public static final int DEFAULT_STEP_THREADS = 4;
    public static final int DEFAULT_CHUNK_THREADS = 8;

    // Step executor runs the publish steps of a task graph, which mostly wait on their chunk work.
    public static ExecutorService stepExecutor = Executors.newFixedThreadPool(DEFAULT_STEP_THREADS);

    // Chunk executor runs the individual remote calls a step fans out into. It must be distinct from the step executor
    // so that steps blocked on their chunks cannot starve the chunks of threads.
    public static ExecutorService chunkExecutor = Executors.newFixedThreadPool(DEFAULT_CHUNK_THREADS);

    /**
     * Replace the default pools with pools of the given sizes. Must be called before any work is submitted.
     */
    public static void initialize(int stepThreads, int chunkThreads) {
        LOG.info("Using {} step threads and {} chunk threads", stepThreads, chunkThreads);
        stepExecutor.shutdown();
        chunkExecutor.shutdown();
        stepExecutor = Executors.newFixedThreadPool(stepThreads);
        chunkExecutor = Executors.newFixedThreadPool(chunkThreads);
    }

    /**
     * Shut down both pools, waiting for running work to finish.
     */
    public static void shutdown() throws InterruptedException {
        stepExecutor.shutdown();
        chunkExecutor.shutdown();
        stepExecutor.awaitTermination(1, TimeUnit.HOURS);
        chunkExecutor.awaitTermination(1, TimeUnit.HOURS);
    }
}
