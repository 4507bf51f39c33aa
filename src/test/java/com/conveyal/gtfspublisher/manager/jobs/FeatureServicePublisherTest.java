package com.conveyal.gtfspublisher.manager.jobs;

import com.conveyal.gtfspublisher.TestUtils;
import com.conveyal.gtfspublisher.UnitTest;
import com.conveyal.gtfspublisher.manager.arcgis.FakeArcgisConnection;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsFeed;
import com.conveyal.gtfspublisher.manager.gtfs.GtfsRecordParser;
import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.conveyal.gtfspublisher.manager.gtfs.GtfsRecordParser.fromString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;

class FeatureServicePublisherTest extends UnitTest {
    private static final String GROUP_ID = "group-1";
    private static ExecutorService stepExecutor;
    private static ExecutorService chunkExecutor;

    @BeforeAll
    static void setUp() {
        stepExecutor = Executors.newFixedThreadPool(2);
        chunkExecutor = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    static void tearDown() {
        stepExecutor.shutdown();
        chunkExecutor.shutdown();
    }

    private static GtfsFeed simpleFeed() throws IOException {
        return new GtfsFeed(
            GtfsRecordParser.readStops(fromString(TestUtils.STOPS)),
            GtfsRecordParser.readRoutes(fromString(TestUtils.ROUTES)),
            GtfsRecordParser.readTrips(fromString(TestUtils.TRIPS)),
            GtfsRecordParser.readShapeRows(fromString(TestUtils.SHAPES))
        );
    }

    private static ImportResult publish(FakeArcgisConnection connection, GtfsFeed feed) {
        return new FeatureServicePublisher(connection, stepExecutor, chunkExecutor).publish(GROUP_ID, feed, "Transit");
    }

    @Test
    void canPublishStopsAndShapes() throws IOException {
        FakeArcgisConnection connection = new FakeArcgisConnection();
        ImportResult result = publish(connection, simpleFeed());

        assertThat(result.getFailureMessage(), result.isSuccessful(), equalTo(true));
        assertThat(result.succeededTasks, containsInAnyOrder(
            "createService", "addLayers", "uploadStops", "uploadShapes", "shareService"
        ));
        assertThat(connection.shares.get(FakeArcgisConnection.SERVICE_ITEM_ID), equalTo(GROUP_ID));

        List<JsonNode> stops = connection.layerFeatures.get(0);
        assertThat(stops, hasSize(3));
        List<String> rowIds = new ArrayList<>();
        stops.forEach(stop -> rowIds.add(stop.path("attributes").path("row_id").asText()));
        assertThat(rowIds, contains("0", "1", "2"));
        assertThat(stops.get(0).path("geometry").path("x").asDouble(), equalTo(-75000.0));

        // The route has no color, so the shape is drawn grey.
        JsonNode shapesLayer = connection.lastDefinition.path("layers").get(1);
        JsonNode info = shapesLayer.path("drawingInfo").path("renderer").path("uniqueValueInfos").get(0);
        assertThat(info.path("value").asText(), equalTo("sh1"));
        List<Integer> color = new ArrayList<>();
        info.path("symbol").path("color").forEach(c -> color.add(c.asInt()));
        assertThat(color, contains(136, 136, 136, 255));

        // Shape points arrive as sequence [2, 1] and are published as [1, 2].
        List<JsonNode> shapes = connection.layerFeatures.get(1);
        assertThat(shapes, hasSize(1));
        JsonNode path = shapes.get(0).path("geometry").path("paths").get(0);
        assertThat(path.size(), equalTo(2));
        assertThat(path.get(0).get(0).asDouble(), equalTo(-75000.0));
        assertThat(path.get(0).get(1).asDouble(), equalTo(40000.0));
        assertThat(path.get(1).get(1).asDouble(), closeTo(40100.0, 1e-6));
    }

    @Test
    void malformedStopCoordinatesArePublishedAsZero() throws IOException {
        GtfsFeed feed = simpleFeed();
        List<GtfsStop> stops = GtfsRecordParser.readStops(fromString(
            TestUtils.STOPS.replace("s1,Main St,40.0,-75.0", "s1,Main St,n/a,-75.0")
        ));
        FakeArcgisConnection connection = new FakeArcgisConnection();
        ImportResult result = publish(connection, new GtfsFeed(stops, feed.routes, feed.trips, feed.shapeRows));

        assertThat(result.getFailureMessage(), result.isSuccessful(), equalTo(true));
        List<JsonNode> published = connection.layerFeatures.get(0);
        assertThat(published, hasSize(3));
        assertThat(published.get(0).path("geometry").path("y").asDouble(), equalTo(0.0));
        assertThat(published.get(0).path("geometry").path("x").asDouble(), equalTo(-75000.0));
    }

    @Test
    void failedServiceCreationFailsEveryOtherStep() throws IOException {
        FakeArcgisConnection connection = new FakeArcgisConnection().failOn("createService");
        ImportResult result = publish(connection, simpleFeed());

        assertThat(result.succeededTasks, hasSize(0));
        assertThat(result.failures, hasSize(5));
        assertThat(result.failures.get(0), startsWith("createService failed:"));
        assertThat(result.failures, hasItems(
            "addLayers cancelled due to failure of createService",
            "shareService cancelled due to failure of createService",
            "uploadStops cancelled due to failure of addLayers",
            "uploadShapes cancelled due to failure of addLayers"
        ));
        assertThat(connection.calls, contains("createService"));
    }

    @Test
    void failedStopUploadLeavesShapesPublished() throws IOException {
        FakeArcgisConnection connection = new FakeArcgisConnection().failAddFeaturesOnLayer(0);
        ImportResult result = publish(connection, simpleFeed());

        assertThat(result.failures, hasSize(1));
        assertThat(result.failures.get(0), startsWith("uploadStops failed: Stop upload: 1 of 1 chunks failed"));
        assertThat(result.succeededTasks, containsInAnyOrder(
            "createService", "addLayers", "uploadShapes", "shareService"
        ));
        assertThat(connection.layerFeatures.get(1), hasSize(1));
    }

    @Test
    void feedWithoutShapesGetsNoShapesLayer() throws IOException {
        FakeArcgisConnection connection = new FakeArcgisConnection();
        GtfsFeed feed = simpleFeed();
        GtfsFeed withoutShapes = new GtfsFeed(feed.stops, feed.routes, feed.trips, List.of());
        ImportResult result = publish(connection, withoutShapes);

        assertThat(result.isSuccessful(), equalTo(true));
        assertThat(result.succeededTasks, containsInAnyOrder("createService", "addLayers", "uploadStops", "shareService"));
        assertThat(connection.lastDefinition.path("layers").size(), equalTo(1));
        assertThat(connection.countCalls("analyze"), equalTo(1));
    }

    @Test
    void largeStopSetsAreUploadedInChunks() {
        List<GtfsStop> stops = new ArrayList<>();
        for (int i = 0; i < 2500; i++) {
            double lat = 40 + i * 0.0001;
            double lon = -75 - i * 0.0001;
            stops.add(new GtfsStop(
                lat,
                lon,
                Map.of("stop_id", "s" + i, "stop_lat", Double.toString(lat), "stop_lon", Double.toString(lon))
            ));
        }
        FakeArcgisConnection connection = new FakeArcgisConnection();
        ImportResult result = publish(connection, new GtfsFeed(stops, List.of(), List.of(), List.of()));

        assertThat(result.isSuccessful(), equalTo(true));
        assertThat(connection.countCalls("analyze"), equalTo(1));
        assertThat(connection.countCalls("generate"), equalTo(3));
        assertThat(connection.countCalls("addFeatures"), equalTo(3));
        assertThat(connection.layerFeatures.get(0), hasSize(2500));
    }
}
