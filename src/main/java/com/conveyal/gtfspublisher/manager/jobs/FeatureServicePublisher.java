package com.conveyal.gtfspublisher.manager.jobs;

import com.conveyal.gtfspublisher.manager.arcgis.ArcgisConnection;
import com.conveyal.gtfspublisher.manager.arcgis.ArcgisException;
import com.conveyal.gtfspublisher.manager.arcgis.GeneratedFeature;
import com.conveyal.gtfspublisher.manager.arcgis.ServiceConnection;
import com.conveyal.gtfspublisher.manager.features.ChunkedRequests;
import com.conveyal.gtfspublisher.manager.features.CoordinateBatchTranslator;
import com.conveyal.gtfspublisher.manager.features.CsvText;
import com.conveyal.gtfspublisher.manager.features.FeatureBatchBuilder;
import com.conveyal.gtfspublisher.manager.features.ServiceDefinitions;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsFeed;
import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.conveyal.gtfspublisher.manager.models.ShapeLine;
import com.conveyal.gtfspublisher.manager.shapes.ShapeAssembler;
import com.conveyal.gtfspublisher.manager.shapes.ShapeStyler;
import com.conveyal.gtfspublisher.manager.utils.JobUtils;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import static com.conveyal.gtfspublisher.manager.features.ServiceDefinitions.SHAPES_LAYER;
import static com.conveyal.gtfspublisher.manager.features.ServiceDefinitions.STOPS_LAYER;

/**
 * Publishes the stops and shapes of a feed as layers of a new hosted feature service and shares the service with a
 * group. The work is laid out as a {@link PublishTaskGraph}:
 *
 * <pre>
 *   createService --> addLayers --> uploadStops
 *        |                    \--> uploadShapes (only if the feed has shapes)
 *        \--> shareService
 * </pre>
 */
public class FeatureServicePublisher {
    private static final Logger LOG = LoggerFactory.getLogger(FeatureServicePublisher.class);

    public static final String CREATE_SERVICE = "createService";
    public static final String ADD_LAYERS = "addLayers";
    public static final String UPLOAD_STOPS = "uploadStops";
    public static final String UPLOAD_SHAPES = "uploadShapes";
    public static final String SHARE_SERVICE = "shareService";

    private final ArcgisConnection connection;
    private final ExecutorService stepExecutor;
    private final ExecutorService chunkExecutor;
    private final CoordinateBatchTranslator translator;

    public FeatureServicePublisher(
        ArcgisConnection connection,
        ExecutorService stepExecutor,
        ExecutorService chunkExecutor
    ) {
        this.connection = connection;
        this.stepExecutor = stepExecutor;
        this.chunkExecutor = chunkExecutor;
        this.translator = new CoordinateBatchTranslator(connection, chunkExecutor);
    }

    public FeatureServicePublisher(ArcgisConnection connection) {
        this(connection, JobUtils.stepExecutor, JobUtils.chunkExecutor);
    }

    /**
     * Publish the feed and block until every step has resolved.
     */
    public ImportResult publish(String groupId, GtfsFeed feed, String serviceName) {
        PublishTaskGraph graph = new PublishTaskGraph(stepExecutor);
        addTasks(graph, groupId, feed, serviceName);
        return graph.execute();
    }

    /**
     * Add the feature service steps to a graph that may hold other, unrelated steps.
     */
    public void addTasks(PublishTaskGraph graph, String groupId, GtfsFeed feed, String serviceName) {
        List<ShapeLine> shapeLines = ShapeAssembler.constructLines(feed.shapeRows).collect(Collectors.toList());
        boolean includeShapes = !shapeLines.isEmpty();
        Map<String, int[]> shapeColors = ShapeStyler.shapeColors(feed.routes, feed.trips);

        PublishTask<ServiceConnection> createService = graph.addTask(
            CREATE_SERVICE,
            () -> connection.createService(ServiceDefinitions.createParameters(serviceName))
        );
        PublishTask<Map<String, Integer>> addLayers = graph.addTask(
            ADD_LAYERS,
            () -> connection.addToDefinition(
                createService.getResult(),
                ServiceDefinitions.layers(includeShapes, shapeColors)
            ),
            createService
        );
        graph.addTask(
            UPLOAD_STOPS,
            () -> uploadStops(createService.getResult(), layerId(addLayers.getResult(), STOPS_LAYER), feed.stops),
            addLayers
        );
        if (includeShapes) {
            graph.addTask(
                UPLOAD_SHAPES,
                () -> uploadShapes(createService.getResult(), layerId(addLayers.getResult(), SHAPES_LAYER), shapeLines),
                addLayers
            );
        }
        graph.addTask(
            SHARE_SERVICE,
            () -> {
                connection.share(createService.getResult().itemId, groupId);
                return groupId;
            },
            createService
        );
    }

    /**
     * Generate stop points from the stop rows and add them to the stops layer, one generate and addFeatures round
     * trip per chunk.
     *
     * @return the number of stop features added
     */
    int uploadStops(ServiceConnection service, int layerId, List<GtfsStop> stops)
        throws ArcgisException, InterruptedException {
        if (stops.isEmpty()) {
            LOG.info("Feed has no stops to upload");
            return 0;
        }
        // Analyze the full set once so every chunk is generated against the same field types.
        ObjectNode publishParameters = connection.analyze(CsvText.stops(stops, 0));
        ObjectNode generateParameters = CoordinateBatchTranslator.withCoordinateLocation(
            publishParameters,
            CsvText.STOP_LATITUDE_FIELD,
            CsvText.STOP_LONGITUDE_FIELD
        );
        List<Callable<Integer>> tasks = new ArrayList<>();
        int firstRowId = 0;
        for (List<GtfsStop> chunk : ChunkedRequests.partition(stops)) {
            final int chunkFirstRowId = firstRowId;
            tasks.add(() -> {
                List<GeneratedFeature> generated = connection.generate(
                    CsvText.stops(chunk, chunkFirstRowId),
                    generateParameters
                );
                CoordinateBatchTranslator.verifyPairing(generated, chunkFirstRowId, chunk.size());
                return connection.addFeatures(
                    service,
                    layerId,
                    FeatureBatchBuilder.stopFeatures(generated, chunkFirstRowId)
                );
            });
            firstRowId += chunk.size();
        }
        int added = sum(ChunkedRequests.executeAll(chunkExecutor, tasks, "Stop upload"));
        LOG.info("Added {} stop features to {}", added, service.name);
        return added;
    }

    /**
     * Project every shape coordinate, rebuild the shape lines from the projected points and add them to the shapes
     * layer in chunks.
     *
     * @return the number of shape features added
     */
    int uploadShapes(ServiceConnection service, int layerId, List<ShapeLine> shapeLines)
        throws ArcgisException, InterruptedException {
        List<Coordinate> coordinates = new ArrayList<>();
        shapeLines.forEach(line -> coordinates.addAll(line.coordinates));
        List<Coordinate> projected = translator.translate(coordinates);

        List<ShapeLine> projectedLines = new ArrayList<>(shapeLines.size());
        int offset = 0;
        for (ShapeLine line : shapeLines) {
            projectedLines.add(new ShapeLine(line.shapeId, projected.subList(offset, offset + line.size())));
            offset += line.size();
        }

        List<Callable<Integer>> tasks = new ArrayList<>();
        for (List<ShapeLine> chunk : ChunkedRequests.partition(projectedLines)) {
            tasks.add(() -> connection.addFeatures(service, layerId, FeatureBatchBuilder.shapeFeatures(chunk)));
        }
        int added = sum(ChunkedRequests.executeAll(chunkExecutor, tasks, "Shape upload"));
        LOG.info("Added {} shape features to {}", added, service.name);
        return added;
    }

    private static int layerId(Map<String, Integer> layerIds, String layerName) throws ArcgisException {
        Integer id = layerIds.get(layerName);
        if (id == null) {
            throw new ArcgisException(String.format("Service definition has no %s layer", layerName));
        }
        return id;
    }

    private static int sum(List<Integer> counts) {
        return counts.stream().mapToInt(Integer::intValue).sum();
    }
}
