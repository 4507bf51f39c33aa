package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.manager.arcgis.GeneratedFeature;
import com.conveyal.gtfspublisher.manager.models.ShapeLine;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.locationtech.jts.geom.Coordinate;

import java.util.List;

import static com.conveyal.gtfspublisher.manager.features.CsvText.ROW_ID_FIELD;
import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;

/**
 * Turns generated rows and projected shape lines into the feature JSON accepted by addFeatures.
 */
public class FeatureBatchBuilder {
    /** The only stop attributes published. Anything else the generator returns is dropped. */
    public static final List<String> STOP_ATTRIBUTES = List.of("stop_name", "stop_lat", "stop_lon");
    public static final String SHAPE_ID_FIELD = "shape_id";

    /**
     * @param firstRowId row id of the first generated feature within the full stops dataset
     */
    public static ArrayNode stopFeatures(List<GeneratedFeature> generated, int firstRowId) {
        ArrayNode features = objectMapper.createArrayNode();
        for (int i = 0; i < generated.size(); i++) {
            GeneratedFeature source = generated.get(i);
            ObjectNode feature = features.addObject();
            ObjectNode geometry = source.geometry.deepCopy();
            if (!geometry.has("spatialReference")) {
                geometry.set("spatialReference", ServiceDefinitions.spatialReference());
            }
            feature.set("geometry", geometry);
            ObjectNode attributes = feature.putObject("attributes");
            for (String field : STOP_ATTRIBUTES) {
                JsonNode value = source.attributes.get(field);
                if (value != null) attributes.set(field, value.deepCopy());
            }
            attributes.put(ROW_ID_FIELD, Integer.toString(firstRowId + i));
        }
        return features;
    }

    /**
     * One polyline feature per shape, keyed by shape id.
     */
    public static ArrayNode shapeFeatures(List<ShapeLine> lines) {
        ArrayNode features = objectMapper.createArrayNode();
        for (ShapeLine line : lines) {
            ObjectNode feature = features.addObject();
            feature.set("geometry", pathGeometry(line.coordinates));
            ObjectNode attributes = feature.putObject("attributes");
            attributes.put(SHAPE_ID_FIELD, line.shapeId);
            attributes.put(ROW_ID_FIELD, line.shapeId);
        }
        return features;
    }

    /** A polyline geometry made of a single path. */
    public static ObjectNode pathGeometry(List<Coordinate> coordinates) {
        ObjectNode geometry = objectMapper.createObjectNode();
        ArrayNode path = geometry.putArray("paths").addArray();
        for (Coordinate coordinate : coordinates) {
            path.addArray().add(coordinate.x).add(coordinate.y);
        }
        geometry.set("spatialReference", ServiceDefinitions.spatialReference());
        return geometry;
    }
}
