package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.manager.arcgis.ArcgisConnection;
import com.conveyal.gtfspublisher.manager.arcgis.ArcgisException;
import com.conveyal.gtfspublisher.manager.arcgis.GeneratedFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

import static com.conveyal.gtfspublisher.manager.features.CsvText.LATITUDE_FIELD;
import static com.conveyal.gtfspublisher.manager.features.CsvText.LONGITUDE_FIELD;
import static com.conveyal.gtfspublisher.manager.features.CsvText.ROW_ID_FIELD;

/**
 * Projects lat/lon pairs into the spatial reference of the hosted layers by running them through the portal's
 * analyze and generate operations.
 *
 * The whole dataset is analyzed once so that every chunk is generated with the same publish parameters. Chunks are
 * generated concurrently and their outputs concatenated in chunk order, so output[i] is the projection of input[i].
 */
public class CoordinateBatchTranslator {
    private static final Logger LOG = LoggerFactory.getLogger(CoordinateBatchTranslator.class);

    private final ArcgisConnection connection;
    private final ExecutorService chunkExecutor;

    public CoordinateBatchTranslator(ArcgisConnection connection, ExecutorService chunkExecutor) {
        this.connection = connection;
        this.chunkExecutor = chunkExecutor;
    }

    /**
     * @param coordinates input points, x = longitude and y = latitude
     * @return projected points, same length and order as the input
     */
    public List<Coordinate> translate(List<Coordinate> coordinates) throws ArcgisException, InterruptedException {
        if (coordinates.isEmpty()) return new ArrayList<>();

        ObjectNode publishParameters = connection.analyze(CsvText.coordinates(coordinates, 0));
        ObjectNode generateParameters = withCoordinateLocation(publishParameters, LATITUDE_FIELD, LONGITUDE_FIELD);

        List<Callable<List<Coordinate>>> tasks = new ArrayList<>();
        int firstRowId = 0;
        for (List<Coordinate> chunk : ChunkedRequests.partition(coordinates)) {
            final int chunkFirstRowId = firstRowId;
            tasks.add(() -> translateChunk(chunk, chunkFirstRowId, generateParameters));
            firstRowId += chunk.size();
        }
        LOG.info("Translating {} coordinates in {} chunks", coordinates.size(), tasks.size());

        List<Coordinate> translated = new ArrayList<>(coordinates.size());
        for (List<Coordinate> chunkResult : ChunkedRequests.executeAll(chunkExecutor, tasks, "Coordinate translation")) {
            translated.addAll(chunkResult);
        }
        return translated;
    }

    private List<Coordinate> translateChunk(List<Coordinate> chunk, int firstRowId, ObjectNode generateParameters)
        throws ArcgisException {
        List<GeneratedFeature> features = connection.generate(CsvText.coordinates(chunk, firstRowId), generateParameters);
        verifyPairing(features, firstRowId, chunk.size());
        List<Coordinate> projected = new ArrayList<>(features.size());
        for (GeneratedFeature feature : features) {
            projected.add(new Coordinate(feature.getX(), feature.getY()));
        }
        return projected;
    }

    /**
     * Copy the publish parameters and add the location descriptor naming the latitude and longitude columns. The
     * shared parameters are left untouched so that concurrent chunks can all start from them.
     */
    public static ObjectNode withCoordinateLocation(
        ObjectNode publishParameters,
        String latitudeField,
        String longitudeField
    ) {
        ObjectNode parameters = publishParameters.deepCopy();
        parameters.put("locationType", "coordinates");
        parameters.put("latitudeFieldName", latitudeField);
        parameters.put("longitudeFieldName", longitudeField);
        return parameters;
    }

    /**
     * Check that the generator returned exactly one feature per input row and, where it echoes the row_id column, that
     * features are in input order. Positional matching is only correct if both hold.
     */
    public static void verifyPairing(List<GeneratedFeature> features, int firstRowId, int expectedCount)
        throws ArcgisException {
        if (features.size() != expectedCount) {
            throw new ArcgisException(String.format(
                "Generate returned %d features for %d rows starting at row %d",
                features.size(), expectedCount, firstRowId
            ));
        }
        for (int i = 0; i < features.size(); i++) {
            JsonNode rowId = features.get(i).attributes.get(ROW_ID_FIELD);
            if (rowId != null && !rowId.isNull() && rowId.asInt(-1) != firstRowId + i) {
                throw new ArcgisException(String.format(
                    "Generated feature %d carries row_id %s, expected %d",
                    firstRowId + i, rowId.asText(), firstRowId + i
                ));
            }
        }
    }
}
