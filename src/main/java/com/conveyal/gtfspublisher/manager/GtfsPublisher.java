package com.conveyal.gtfspublisher.manager;

import com.conveyal.gtfspublisher.manager.arcgis.ArcgisConnection;
import com.conveyal.gtfspublisher.manager.arcgis.HttpArcgisConnection;
import com.conveyal.gtfspublisher.manager.gtfs.KmlGenerator;
import com.conveyal.gtfspublisher.manager.jobs.FeatureServicePublisher;
import com.conveyal.gtfspublisher.manager.jobs.GtfsImportJob;
import com.conveyal.gtfspublisher.manager.utils.ErrorUtils;
import com.conveyal.gtfspublisher.manager.utils.JobUtils;
import com.conveyal.gtfspublisher.manager.utils.json.JsonUtil;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Command line entry point. Loads env.yml and server.yml, connects to the configured portal and runs a single GTFS
 * import. It also holds the configuration, which is referenced throughout the application.
 */
public class GtfsPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(GtfsPublisher.class);

    // Secrets (env.yml) and application settings (server.yml).
    private static JsonNode envConfig;
    private static JsonNode serverConfig;

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private static final String DEFAULT_ENV = "configurations/default/env.yml";
    private static final String DEFAULT_CONFIG = "configurations/default/server.yml";
    private static final String DEFAULT_KML_COMMAND = "./transitfeed/kmlwriter.py";
    private static final String DEFAULT_SERVICE_NAME = "GTFS";

    public static void main(String[] args) throws IOException, InterruptedException {
        long startTime = System.currentTimeMillis();
        loadConfig(args);
        ErrorUtils.initialize(getConfigPropertyAsText("BUGSNAG_KEY", null));
        JobUtils.initialize(
            getConfigPropertyAsInt("application.publish.step_threads", JobUtils.DEFAULT_STEP_THREADS),
            getConfigPropertyAsInt("application.publish.chunk_threads", JobUtils.DEFAULT_CHUNK_THREADS)
        );

        GtfsImportJob job = createImportJob(createConnection());
        job.run();
        JobUtils.shutdown();

        double seconds = (System.currentTimeMillis() - startTime) / 1000D;
        if (job.status.error) {
            LOG.error("GTFS import failed after {} seconds:\n{}", seconds, job.status.message);
            System.exit(1);
        }
        LOG.info("GTFS import completed in {} seconds.", seconds);
    }

    /**
     * Create the portal connection from the ARCGIS_* secrets and the connection and sharing settings.
     */
    static ArcgisConnection createConnection() {
        return new HttpArcgisConnection(
            getConfigPropertyAsText("ARCGIS_PORTAL_URL"),
            getConfigPropertyAsText("ARCGIS_USERNAME"),
            getConfigPropertyAsText("ARCGIS_TOKEN"),
            getConfigPropertyAsInt("application.connection_timeout", HttpArcgisConnection.DEFAULT_CONNECTION_TIMEOUT),
            "true".equals(getConfigPropertyAsText("application.share.everyone", "false")),
            "true".equals(getConfigPropertyAsText("application.share.org", "false"))
        );
    }

    /**
     * Build the import job described by the application settings.
     */
    static GtfsImportJob createImportJob(ArcgisConnection connection) {
        String gtfsFile = getConfigPropertyAsText("application.gtfs_file");
        if (gtfsFile == null) throw new IllegalStateException("application.gtfs_file must be configured");
        KmlGenerator kmlGenerator = isModuleEnabled("kml")
            ? new KmlGenerator(getConfigPropertyAsText("modules.kml.command", DEFAULT_KML_COMMAND))
            : null;
        return new GtfsImportJob(
            new File(gtfsFile),
            connection,
            new FeatureServicePublisher(connection, JobUtils.stepExecutor, JobUtils.chunkExecutor),
            JobUtils.stepExecutor,
            getConfigPropertyAsText("application.service_name", DEFAULT_SERVICE_NAME),
            getConfigPropertyAsText("application.group_id", null),
            getConfigPropertyAsText("application.group_title", GtfsImportJob.DEFAULT_GROUP_TITLE),
            kmlGenerator
        );
    }

    /**
     * Whether a dotted property path such as "share.everyone" is defined in server.yml or env.yml.
     */
    public static boolean hasConfigProperty(String name) {
        return getConfigProperty(name) != null;
    }

    /**
     * Look up a dotted property path, preferring server.yml over env.yml. Returns null when neither defines it.
     */
    public static JsonNode getConfigProperty(String name) {
        JsonNode value = lookup(serverConfig, name);
        return value != null ? value : lookup(envConfig, name);
    }

    private static JsonNode lookup(JsonNode root, String path) {
        JsonNode node = root;
        for (String key : path.split("\\.")) {
            if (node == null) break;
            node = node.get(key);
        }
        return node;
    }

    /** Text value of a property, or null (logged) when it is missing. */
    public static String getConfigPropertyAsText(String name) {
        String text = getConfigPropertyAsText(name, null);
        if (text == null) LOG.warn("No value configured for {}", name);
        return text;
    }

    public static String getConfigPropertyAsText(String name, String defaultValue) {
        JsonNode value = getConfigProperty(name);
        return value == null || value.isNull() ? defaultValue : value.asText();
    }

    /** Integer value of a property, falling back to the default when it is missing or not numeric. */
    public static int getConfigPropertyAsInt(String name, int defaultValue) {
        return NumberUtils.toInt(getConfigPropertyAsText(name, null), defaultValue);
    }

    /** An optional module such as kml runs only when modules.NAME.enabled is true. */
    public static boolean isModuleEnabled(String moduleName) {
        return "true".equals(getConfigPropertyAsText("modules." + moduleName + ".enabled", "false"));
    }

    /**
     * Replace a server.yml value in memory, creating intermediate objects as needed. Used by tests.
     */
    public static void overrideConfigProperty(String name, String value) {
        String[] keys = name.split("\\.");
        ObjectNode parent = (ObjectNode) serverConfig;
        for (int i = 0; i < keys.length - 1; i++) {
            JsonNode child = parent.get(keys[i]);
            if (child == null || !child.isObject()) {
                child = JsonUtil.objectMapper.createObjectNode();
                parent.set(keys[i], child);
            }
            parent = (ObjectNode) child;
        }
        parent.put(keys[keys.length - 1], value);
    }

    /**
     * Read env.yml and server.yml from the first two program arguments, or from the default locations under
     * configurations/default when they are not given.
     */
    public static void loadConfig(String[] args) throws IOException {
        boolean useDefaults = args.length < 2;
        String envPath = useDefaults ? DEFAULT_ENV : args[0];
        String serverPath = useDefaults ? DEFAULT_CONFIG : args[1];
        if (useDefaults) LOG.warn("No config paths given, falling back to {} and {}", envPath, serverPath);
        else LOG.info("Reading config from {} and {}", envPath, serverPath);
        try (
            InputStream envStream = new FileInputStream(envPath);
            InputStream serverStream = new FileInputStream(serverPath)
        ) {
            envConfig = yamlMapper.readTree(envStream);
            serverConfig = yamlMapper.readTree(serverStream);
        }
    }
}
