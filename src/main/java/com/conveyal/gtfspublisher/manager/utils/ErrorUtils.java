package com.conveyal.gtfspublisher.manager.utils;

import com.bugsnag.Bugsnag;
import com.bugsnag.Report;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports import failures to Bugsnag. Reporting is off until {@link #initialize(String)} is called with the notifier
 * API key of a Bugsnag project (BUGSNAG_KEY in env.yml); without it failures are only logged.
 */
public class ErrorUtils {
    private static final Logger LOG = LoggerFactory.getLogger(ErrorUtils.class);

    private static Bugsnag bugsnag;

    /**
     * Send the throwable to Bugsnag with the given entries on the report's debugging tab. Does nothing (beyond a
     * log line) when reporting is off or there is nothing to report.
     */
    public static void reportToBugsnag(Throwable e, Map<String, String> debugging) {
        if (bugsnag == null || e == null) {
            LOG.warn("Not reporting {} to Bugsnag (reporting {})", e, bugsnag == null ? "disabled" : "enabled");
            return;
        }
        Report report = bugsnag.buildReport(e);
        if (debugging != null) debugging.forEach((key, value) -> report.addToTab("debugging", key, value));
        bugsnag.notify(report);
    }

    /**
     * Report a failed import, tagged with the archive name and, once known, the group being shared with.
     */
    public static void reportImportFailure(Throwable e, String gtfsFileName, String groupId) {
        Map<String, String> debuggingMessages = new LinkedHashMap<>();
        debuggingMessages.put("gtfsFile", gtfsFileName);
        if (groupId != null) debuggingMessages.put("groupId", groupId);
        reportToBugsnag(e, debuggingMessages);
    }

    /**
     * Turn on Bugsnag reporting if a key is provided.
     */
    public static void initialize(String bugsnagKey) {
        if (bugsnagKey != null && !bugsnagKey.isEmpty()) {
            bugsnag = new Bugsnag(bugsnagKey);
        } else {
            LOG.info("No BUGSNAG_KEY configured, errors will only be logged");
        }
    }
}
