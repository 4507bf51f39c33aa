package com.conveyal.gtfspublisher.common.status;

import org.apache.commons.lang3.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * A unit of import work whose progress and outcome can be watched from other threads through its {@link Status}.
 * Subclasses put their work in {@link #jobLogic()}; {@link #run()} adds the bookkeeping shared by all jobs.
 */
public abstract class MonitorableJob implements Runnable {
    private static final Logger LOG = LoggerFactory.getLogger(MonitorableJob.class);

    public final JobType type;
    public final String jobId = UUID.randomUUID().toString();
    public String name;

    /** True while {@link #run()} is executing. */
    public volatile boolean active = false;

    public Status status = new Status();

    public enum JobType {
        IMPORT_GTFS,
        PUBLISH_TASK
    }

    public MonitorableJob(String name, JobType type) {
        this.name = name;
        this.type = type;
        status.name = name;
    }

    /**
     * The work of the job. Expected failures should be recorded with {@link Status#fail}; anything thrown is recorded
     * as an unhandled failure.
     */
    public abstract void jobLogic() throws Exception;

    /**
     * Hook called after {@link #jobLogic()} returns, whether or not it recorded a failure.
     */
    public void jobFinished() {
        // Nothing by default.
    }

    /**
     * Run the job logic and move the status to its terminal state. Subclasses override jobLogic and jobFinished, not
     * this method.
     */
    public void run() {
        active = true;
        try {
            jobLogic();
            if (status.error) status.complete(true);
            else status.completeSuccessfully("Job complete!");
            jobFinished();
        } catch (Exception e) {
            status.fail("Job failed due to unhandled exception!", e);
        } finally {
            active = false;
            LOG.info("{} `{}` ({}) {} after {} ms", type, name, jobId, status.error ? "failed" : "succeeded",
                status.duration);
        }
    }

    /**
     * Resolve the job as failed without running it, for example because work it needs did not succeed.
     */
    public void cancel(String message) {
        status.fail(message);
    }

    /**
     * Progress and outcome of a job. Fields written by the job thread and read by others are volatile.
     */
    public static class Status {
        public String name;
        public volatile String message;
        public volatile double percentComplete;
        public volatile boolean completed = false;
        public volatile boolean error = false;

        /** Message and stack trace of the exception behind a failure, if there was one. */
        public String exceptionType;
        public String exceptionDetails;

        public final long startTime = System.currentTimeMillis();
        public String initialized = LocalDateTime.now().format(DateTimeFormatter.ISO_DATE_TIME);
        public long duration;

        /** Record progress of a job that is still running. */
        public void update(String message, double percentComplete) {
            LOG.info("`{}`: {} ({}%)", name, message, percentComplete);
            this.message = message;
            this.percentComplete = percentComplete;
        }

        /** Complete successfully, unless the job has already reached a terminal state. */
        public void completeSuccessfully(String message) {
            if (!completed) complete(false, message);
        }

        /** Complete in error, keeping the exception details for whoever reports the failure. */
        public void fail(String message, Exception e) {
            if (e != null) {
                exceptionType = e.getMessage();
                exceptionDetails = ExceptionUtils.getStackTrace(e);
                LOG.warn(String.format("`%s` failed: %s", name, message), e);
            } else {
                LOG.error("`{}` failed: {}", name, message);
            }
            complete(true, message);
        }

        public void fail(String message) {
            fail(message, null);
        }

        private void complete(boolean isError) {
            complete(isError, null);
        }

        // completed is written last so that a reader who sees it also sees the other fields.
        private synchronized void complete(boolean isError, String message) {
            error = isError;
            if (message != null) this.message = message;
            percentComplete = 100;
            duration = System.currentTimeMillis() - startTime;
            completed = true;
        }
    }
}
