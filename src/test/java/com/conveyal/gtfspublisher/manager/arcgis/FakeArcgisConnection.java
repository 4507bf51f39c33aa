package com.conveyal.gtfspublisher.manager.arcgis;

import com.csvreader.CsvReader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;

/**
 * In-memory portal that records every call. Generated geometries are the input coordinates scaled by
 * {@link #PROJECTION_SCALE}, so tests can tell which input produced which output. Any operation can be made to fail.
 */
public class FakeArcgisConnection implements ArcgisConnection {
    public static final double PROJECTION_SCALE = 1000;
    public static final String SERVICE_ITEM_ID = "service-item";
    public static final String GROUP_ID = "created-group";

    /** Operation names, in call order. */
    public final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    public final List<String> generatedCsv = Collections.synchronizedList(new ArrayList<>());
    /** Features added to each layer, in arrival order. */
    public final Map<Integer, List<JsonNode>> layerFeatures = new ConcurrentHashMap<>();
    /** Item title to item text. */
    public final Map<String, String> items = Collections.synchronizedMap(new LinkedHashMap<>());
    /** Item id to the group it was shared with. */
    public final Map<String, String> shares = new ConcurrentHashMap<>();
    public volatile ObjectNode lastDefinition;
    public volatile boolean reverseGeneratedRows = false;

    private final Set<String> failingOperations = Collections.synchronizedSet(new HashSet<>());
    private final Set<Integer> failingLayers = Collections.synchronizedSet(new HashSet<>());
    private final AtomicInteger itemCounter = new AtomicInteger();

    /** Make every call of the named operation (e.g. "createService") fail. */
    public FakeArcgisConnection failOn(String operation) {
        failingOperations.add(operation);
        return this;
    }

    /** Make addFeatures fail for one layer only. */
    public FakeArcgisConnection failAddFeaturesOnLayer(int layerId) {
        failingLayers.add(layerId);
        return this;
    }

    public int countCalls(String operation) {
        synchronized (calls) {
            return (int) calls.stream().filter(operation::equals).count();
        }
    }

    private void record(String operation) throws ArcgisException {
        calls.add(operation);
        if (failingOperations.contains(operation)) {
            throw new ArcgisException(String.format("%s rejected by fake portal", operation), 500);
        }
    }

    @Override
    public String createGroup(String title, String access, String description) throws ArcgisException {
        record("createGroup");
        return GROUP_ID;
    }

    @Override
    public String addItem(String title, String type, String tags, String text) throws ArcgisException {
        record("addItem");
        items.put(title, text);
        return String.format("item-%d", itemCounter.incrementAndGet());
    }

    @Override
    public ServiceConnection createService(ObjectNode createParameters) throws ArcgisException {
        record("createService");
        String name = createParameters.path("name").asText();
        return new ServiceConnection(
            SERVICE_ITEM_ID,
            name,
            String.format("https://services.example.com/org/arcgis/rest/services/%s/FeatureServer", name)
        );
    }

    @Override
    public Map<String, Integer> addToDefinition(ServiceConnection service, ObjectNode definition)
        throws ArcgisException {
        record("addToDefinition");
        lastDefinition = definition;
        Map<String, Integer> layerIds = new LinkedHashMap<>();
        for (JsonNode layer : definition.path("layers")) {
            layerIds.put(layer.path("name").asText(), layer.path("id").asInt());
        }
        return layerIds;
    }

    @Override
    public ObjectNode analyze(String csvText) throws ArcgisException {
        record("analyze");
        ObjectNode publishParameters = objectMapper.createObjectNode();
        publishParameters.put("type", "csv");
        publishParameters.put("sourceSR", 4326);
        return publishParameters;
    }

    @Override
    public List<GeneratedFeature> generate(String csvText, ObjectNode publishParameters) throws ArcgisException {
        record("generate");
        generatedCsv.add(csvText);
        String latitudeField = publishParameters.path("latitudeFieldName").asText();
        String longitudeField = publishParameters.path("longitudeFieldName").asText();
        List<GeneratedFeature> features = new ArrayList<>();
        CsvReader reader = new CsvReader(new StringReader(csvText));
        try {
            reader.readHeaders();
            String[] headers = reader.getHeaders();
            while (reader.readRecord()) {
                ObjectNode geometry = objectMapper.createObjectNode();
                geometry.put("x", Double.parseDouble(reader.get(longitudeField)) * PROJECTION_SCALE);
                geometry.put("y", Double.parseDouble(reader.get(latitudeField)) * PROJECTION_SCALE);
                ObjectNode attributes = objectMapper.createObjectNode();
                for (String header : headers) {
                    if ("row_id".equals(header)) attributes.put(header, Integer.parseInt(reader.get(header)));
                    else attributes.put(header, reader.get(header));
                }
                features.add(new GeneratedFeature(geometry, attributes));
            }
        } catch (IOException e) {
            throw new ArcgisException("Fake portal could not read CSV", e);
        } finally {
            reader.close();
        }
        if (reverseGeneratedRows) Collections.reverse(features);
        return features;
    }

    @Override
    public int addFeatures(ServiceConnection service, int layerId, ArrayNode features) throws ArcgisException {
        record("addFeatures");
        if (failingLayers.contains(layerId)) {
            throw new ArcgisException(String.format("addFeatures to layer %d rejected by fake portal", layerId));
        }
        List<JsonNode> added = layerFeatures.computeIfAbsent(layerId, id -> Collections.synchronizedList(new ArrayList<>()));
        features.forEach(added::add);
        return features.size();
    }

    @Override
    public void share(String itemId, String groupId) throws ArcgisException {
        record("share");
        shares.put(itemId, groupId);
    }
}
