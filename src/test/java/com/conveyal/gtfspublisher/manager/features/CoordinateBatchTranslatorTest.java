package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.UnitTest;
import com.conveyal.gtfspublisher.manager.arcgis.ArcgisException;
import com.conveyal.gtfspublisher.manager.arcgis.FakeArcgisConnection;
import com.conveyal.gtfspublisher.manager.arcgis.GeneratedFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.conveyal.gtfspublisher.manager.arcgis.FakeArcgisConnection.PROJECTION_SCALE;
import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CoordinateBatchTranslatorTest extends UnitTest {
    private static ExecutorService chunkExecutor;

    @BeforeAll
    static void setUp() {
        chunkExecutor = Executors.newFixedThreadPool(4);
    }

    @AfterAll
    static void tearDown() {
        chunkExecutor.shutdown();
    }

    private static List<Coordinate> coordinates(int count) {
        List<Coordinate> coordinates = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            coordinates.add(new Coordinate(-75 + i * 0.0001, 40 + i * 0.0001));
        }
        return coordinates;
    }

    @Test
    void emptyInputMakesNoRemoteCalls() throws Exception {
        FakeArcgisConnection connection = new FakeArcgisConnection();
        List<Coordinate> translated = new CoordinateBatchTranslator(connection, chunkExecutor).translate(List.of());
        assertThat(translated, empty());
        assertThat(connection.calls, empty());
    }

    @Test
    void preservesLengthAndOrderAcrossChunks() throws Exception {
        FakeArcgisConnection connection = new FakeArcgisConnection();
        List<Coordinate> input = coordinates(2500);
        List<Coordinate> translated = new CoordinateBatchTranslator(connection, chunkExecutor).translate(input);

        assertThat(translated, hasSize(2500));
        for (int i = 0; i < input.size(); i++) {
            assertThat(translated.get(i).x, closeTo(input.get(i).x * PROJECTION_SCALE, 1e-6));
            assertThat(translated.get(i).y, closeTo(input.get(i).y * PROJECTION_SCALE, 1e-6));
        }
        assertThat(connection.countCalls("analyze"), equalTo(1));
        assertThat(connection.countCalls("generate"), equalTo(3));
        // Header plus one line per row.
        List<Integer> chunkRows = connection.generatedCsv.stream()
            .map(csv -> csv.split("\n").length - 1)
            .collect(Collectors.toList());
        assertThat(chunkRows, containsInAnyOrder(1000, 1000, 500));
    }

    @Test
    void chunkedTranslationMatchesSingleChunkTranslation() throws Exception {
        List<Coordinate> input = coordinates(1500);
        List<Coordinate> chunked = new CoordinateBatchTranslator(new FakeArcgisConnection(), chunkExecutor)
            .translate(input);
        List<Coordinate> tail = new CoordinateBatchTranslator(new FakeArcgisConnection(), chunkExecutor)
            .translate(input.subList(1000, 1500));
        assertThat(chunked.subList(1000, 1500), equalTo(tail));
    }

    @Test
    void rejectsGeneratedRowsOutOfOrder() {
        FakeArcgisConnection connection = new FakeArcgisConnection();
        connection.reverseGeneratedRows = true;
        ArcgisException e = assertThrows(
            ArcgisException.class,
            () -> new CoordinateBatchTranslator(connection, chunkExecutor).translate(coordinates(3))
        );
        assertThat(e.getMessage(), containsString("row_id"));
    }

    @Test
    void reportsEveryFailedChunk() {
        FakeArcgisConnection connection = new FakeArcgisConnection().failOn("generate");
        ArcgisException e = assertThrows(
            ArcgisException.class,
            () -> new CoordinateBatchTranslator(connection, chunkExecutor).translate(coordinates(2001))
        );
        assertThat(e.getMessage(), containsString("3 of 3 chunks failed"));
        assertThat(e.getSuppressed().length, equalTo(3));
        assertThat(connection.countCalls("generate"), equalTo(3));
    }

    @Test
    void pairingRequiresOneFeaturePerRow() {
        GeneratedFeature feature = new GeneratedFeature(objectMapper.createObjectNode(), objectMapper.createObjectNode());
        ArcgisException e = assertThrows(
            ArcgisException.class,
            () -> CoordinateBatchTranslator.verifyPairing(List.of(feature), 0, 2)
        );
        assertThat(e.getMessage(), containsString("1 features for 2 rows"));
    }

    @Test
    void locationParametersAreAddedToACopy() {
        ObjectNode shared = objectMapper.createObjectNode().put("type", "csv");
        ObjectNode parameters = CoordinateBatchTranslator.withCoordinateLocation(shared, "lat", "lon");
        assertThat(parameters.path("locationType").asText(), equalTo("coordinates"));
        assertThat(parameters.path("latitudeFieldName").asText(), equalTo("lat"));
        assertThat(parameters.path("longitudeFieldName").asText(), equalTo("lon"));
        assertThat(parameters.path("type").asText(), equalTo("csv"));
        assertThat(shared.has("locationType"), equalTo(false));
    }
}
