package com.conveyal.gtfspublisher.manager.jobs;

import com.conveyal.gtfspublisher.common.status.MonitorableJob;
import com.conveyal.gtfspublisher.manager.arcgis.ArcgisConnection;
import com.conveyal.gtfspublisher.manager.arcgis.ArcgisException;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsArchive;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsFeed;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsFile;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsValidationException;
import com.conveyal.gtfspublisher.manager.gtfs.KmlGenerator;
import com.conveyal.gtfspublisher.manager.utils.ErrorUtils;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Imports a GTFS archive into an ArcGIS portal. Every standard GTFS file becomes a CSV item, the feed is rendered as
 * a KML item when a {@link KmlGenerator} is supplied, and stops and shapes are published as layers of a new feature
 * service. Everything is shared with a group, which is created first unless an existing group id is given.
 *
 * All remote steps run in one {@link PublishTaskGraph}, so item uploads proceed alongside the feature service.
 */
public class GtfsImportJob extends MonitorableJob {
    private static final Logger LOG = LoggerFactory.getLogger(GtfsImportJob.class);

    public static final String DEFAULT_GROUP_TITLE = "GTFS Import";
    public static final String GROUP_ACCESS = "account";
    public static final String GROUP_DESCRIPTION = "An import of GTFS data";
    public static final String ITEM_TAGS = "gtfs";
    public static final String KML_TITLE = "gtfs.kml";

    public static final String GENERATE_KML = "generateKml";
    public static final String CREATE_KML_ITEM = "createKmlItem";
    public static final String SHARE_KML_ITEM = "shareKmlItem";

    private final File gtfsFile;
    private final ArcgisConnection connection;
    private final FeatureServicePublisher publisher;
    private final ExecutorService stepExecutor;
    private final KmlGenerator kmlGenerator;
    private final String serviceName;
    private final String groupTitle;
    private String groupId;
    private File workingDirectory;
    private ImportResult result;

    /**
     * @param groupId      existing group to share with, or null to create one titled {@code groupTitle}
     * @param kmlGenerator KML writer, or null to skip the KML item
     */
    public GtfsImportJob(
        File gtfsFile,
        ArcgisConnection connection,
        FeatureServicePublisher publisher,
        ExecutorService stepExecutor,
        String serviceName,
        String groupId,
        String groupTitle,
        KmlGenerator kmlGenerator
    ) {
        super(String.format("Import %s", gtfsFile.getName()), JobType.IMPORT_GTFS);
        this.gtfsFile = gtfsFile;
        this.connection = connection;
        this.publisher = publisher;
        this.stepExecutor = stepExecutor;
        this.serviceName = serviceName;
        this.groupId = groupId;
        this.groupTitle = groupTitle != null ? groupTitle : DEFAULT_GROUP_TITLE;
        this.kmlGenerator = kmlGenerator;
    }

    @Override
    public void jobLogic() throws IOException {
        workingDirectory = Files.createTempDirectory("gtfs_import").toFile();
        try {
            status.update("Extracting GTFS archive", 5);
            List<GtfsFile> files = GtfsArchive.extract(gtfsFile, workingDirectory);
            GtfsArchive.validate(files);
            files = GtfsArchive.standardFiles(files);

            status.update("Parsing GTFS tables", 15);
            GtfsFeed feed = GtfsFeed.load(files);

            if (groupId == null) {
                status.update(String.format("Creating group %s", groupTitle), 20);
                groupId = connection.createGroup(groupTitle, GROUP_ACCESS, GROUP_DESCRIPTION);
                LOG.info("Created group {} ({})", groupTitle, groupId);
            }

            PublishTaskGraph graph = new PublishTaskGraph(stepExecutor);
            if (kmlGenerator != null) addKmlTasks(graph);
            for (GtfsFile file : files) addItemTasks(graph, file);
            publisher.addTasks(graph, groupId, feed, serviceName);

            status.update(String.format("Running %d publish tasks", graph.size()), 30);
            result = graph.execute();
            if (result.isSuccessful()) {
                status.completeSuccessfully("Everything has been imported successfully.");
            } else {
                status.fail(result.getFailureMessage());
                ErrorUtils.reportImportFailure(
                    new ArcgisException(result.getFailureMessage()),
                    gtfsFile.getName(),
                    groupId
                );
            }
        } catch (GtfsValidationException e) {
            status.fail(e.getMessage(), e);
        } catch (ArcgisException e) {
            status.fail(String.format("Could not create group %s: %s", groupTitle, e.getMessage()), e);
            ErrorUtils.reportImportFailure(e, gtfsFile.getName(), null);
        } finally {
            deleteWorkingDirectory();
        }
    }

    @Override
    public void jobFinished() {
        if (result != null) {
            LOG.info("Import of {} finished: {} tasks succeeded, {} failed",
                gtfsFile.getName(), result.succeededTasks.size(), result.failures.size());
        }
    }

    private void addItemTasks(PublishTaskGraph graph, GtfsFile file) {
        PublishTask<String> createItem = graph.addTask(
            String.format("createItem:%s", file.fileName),
            () -> connection.addItem(
                file.name,
                "CSV",
                ITEM_TAGS,
                Files.readString(file.path.toPath(), StandardCharsets.UTF_8)
            )
        );
        graph.addTask(
            String.format("shareItem:%s", file.fileName),
            () -> share(createItem.getResult()),
            createItem
        );
    }

    private void addKmlTasks(PublishTaskGraph graph) {
        File kmlFile = new File(workingDirectory, KML_TITLE);
        PublishTask<File> generateKml = graph.addTask(GENERATE_KML, () -> {
            if (!kmlGenerator.generate(gtfsFile, kmlFile)) {
                throw new IOException("KML generator did not produce a KML file");
            }
            return kmlFile;
        });
        PublishTask<String> createKmlItem = graph.addTask(
            CREATE_KML_ITEM,
            () -> connection.addItem(
                KML_TITLE,
                "KML",
                ITEM_TAGS,
                Files.readString(generateKml.getResult().toPath(), StandardCharsets.UTF_8)
            ),
            generateKml
        );
        graph.addTask(SHARE_KML_ITEM, () -> share(createKmlItem.getResult()), createKmlItem);
    }

    private String share(String itemId) throws ArcgisException {
        connection.share(itemId, groupId);
        return itemId;
    }

    private void deleteWorkingDirectory() {
        try {
            FileUtils.deleteDirectory(workingDirectory);
        } catch (IOException e) {
            LOG.error("Could not delete working directory {}", workingDirectory, e);
        }
    }

    /** @return the outcome of the publish tasks, or null if the job failed before they ran. */
    public ImportResult getResult() {
        return result;
    }

    public String getGroupId() {
        return groupId;
    }

    public File getWorkingDirectory() {
        return workingDirectory;
    }

    public KmlGenerator getKmlGenerator() {
        return kmlGenerator;
    }

    public String getServiceName() {
        return serviceName;
    }
}
