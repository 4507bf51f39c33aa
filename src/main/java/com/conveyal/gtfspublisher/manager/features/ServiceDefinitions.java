package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.manager.models.RouteColor;
import com.conveyal.gtfspublisher.manager.shapes.ShapeStyler;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

import static com.conveyal.gtfspublisher.manager.features.CsvText.ROW_ID_FIELD;
import static com.conveyal.gtfspublisher.manager.features.FeatureBatchBuilder.SHAPE_ID_FIELD;
import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;

/**
 * JSON definitions of the hosted feature service and its layers.
 */
public class ServiceDefinitions {
    /** Web Mercator, the spatial reference the generator projects into. */
    public static final int TARGET_WKID = 102100;
    public static final String STOPS_LAYER = "Stops";
    public static final String SHAPES_LAYER = "Shapes";
    private static final String OBJECT_ID_FIELD = "FID";

    public static ObjectNode spatialReference() {
        return objectMapper.createObjectNode().put("wkid", TARGET_WKID);
    }

    public static ObjectNode createParameters(String serviceName) {
        ObjectNode parameters = objectMapper.createObjectNode();
        parameters.put("name", serviceName);
        parameters.put("serviceDescription", "GTFS stops and shapes");
        parameters.put("hasStaticData", false);
        parameters.put("maxRecordCount", ChunkedRequests.MAX_CHUNK_SIZE);
        parameters.put("supportedQueryFormats", "JSON");
        parameters.put("capabilities", "Create,Query");
        parameters.set("spatialReference", spatialReference());
        parameters.put("allowGeometryUpdates", true);
        parameters.put("units", "esriMeters");
        return parameters;
    }

    /**
     * The layers added to a new service: stops always, shapes only if the feed has shapes.
     *
     * @param shapeColors colors of the shapes that could be styled; other shapes are drawn in the default grey
     */
    public static ObjectNode layers(boolean includeShapes, Map<String, int[]> shapeColors) {
        ObjectNode definition = objectMapper.createObjectNode();
        ArrayNode layers = definition.putArray("layers");
        layers.add(stopsLayer(0));
        if (includeShapes) layers.add(shapesLayer(1, shapeColors));
        return definition;
    }

    static ObjectNode stopsLayer(int id) {
        ObjectNode layer = baseLayer(id, STOPS_LAYER, "esriGeometryPoint");
        ArrayNode fields = layer.putArray("fields");
        fields.add(field(OBJECT_ID_FIELD, "esriFieldTypeOID"));
        fields.add(field(ROW_ID_FIELD, "esriFieldTypeString"));
        fields.add(field("stop_name", "esriFieldTypeString"));
        fields.add(field("stop_lat", "esriFieldTypeDouble"));
        fields.add(field("stop_lon", "esriFieldTypeDouble"));

        ObjectNode symbol = objectMapper.createObjectNode();
        symbol.put("type", "esriSMS");
        symbol.put("style", "esriSMSCircle");
        ArrayNode color = symbol.putArray("color");
        for (int component : RouteColor.defaultRgba()) color.add(component);
        symbol.put("size", 6);
        ObjectNode renderer = layer.putObject("drawingInfo").putObject("renderer");
        renderer.put("type", "simple");
        renderer.set("symbol", symbol);
        return layer;
    }

    static ObjectNode shapesLayer(int id, Map<String, int[]> shapeColors) {
        ObjectNode layer = baseLayer(id, SHAPES_LAYER, "esriGeometryPolyline");
        ArrayNode fields = layer.putArray("fields");
        fields.add(field(OBJECT_ID_FIELD, "esriFieldTypeOID"));
        fields.add(field(ROW_ID_FIELD, "esriFieldTypeString"));
        fields.add(field(SHAPE_ID_FIELD, "esriFieldTypeString"));

        ObjectNode renderer = layer.putObject("drawingInfo").putObject("renderer");
        renderer.put("type", "uniqueValue");
        renderer.put("field1", SHAPE_ID_FIELD);
        renderer.set("defaultSymbol", ShapeStyler.lineSymbol(RouteColor.defaultRgba()));
        renderer.put("defaultLabel", "Other");
        renderer.set("uniqueValueInfos", ShapeStyler.uniqueValueInfos(shapeColors));
        return layer;
    }

    private static ObjectNode baseLayer(int id, String name, String geometryType) {
        ObjectNode layer = objectMapper.createObjectNode();
        layer.put("id", id);
        layer.put("name", name);
        layer.put("type", "Feature Layer");
        layer.put("geometryType", geometryType);
        layer.put("objectIdField", OBJECT_ID_FIELD);
        layer.put("displayField", ROW_ID_FIELD);
        layer.put("hasAttachments", false);
        layer.put("capabilities", "Create,Query");
        return layer;
    }

    private static ObjectNode field(String name, String type) {
        ObjectNode field = objectMapper.createObjectNode();
        field.put("name", name);
        field.put("type", type);
        field.put("alias", name);
        field.put("nullable", !"esriFieldTypeOID".equals(type));
        field.put("editable", !"esriFieldTypeOID".equals(type));
        if ("esriFieldTypeString".equals(type)) field.put("length", 256);
        return field;
    }
}
