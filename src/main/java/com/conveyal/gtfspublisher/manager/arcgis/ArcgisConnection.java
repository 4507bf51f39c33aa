package com.conveyal.gtfspublisher.manager.arcgis;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * Authenticated access to an ArcGIS portal. Implementations must be safe to share between threads; all methods block
 * until the portal responds.
 */
public interface ArcgisConnection {

    /** @return the id of the new group. */
    String createGroup(String title, String access, String description) throws ArcgisException;

    /** Add a content item whose data is the given text. @return the id of the new item. */
    String addItem(String title, String type, String tags, String text) throws ArcgisException;

    /** Create an empty hosted feature service from a service definition. */
    ServiceConnection createService(ObjectNode createParameters) throws ArcgisException;

    /** Add layers to a service. @return layer ids keyed by layer name. */
    Map<String, Integer> addToDefinition(ServiceConnection service, ObjectNode definition) throws ArcgisException;

    /** Infer publish parameters (field types, location fields) from CSV text. */
    ObjectNode analyze(String csvText) throws ArcgisException;

    /** Generate one feature per CSV row, in row order, using the given publish parameters. */
    List<GeneratedFeature> generate(String csvText, ObjectNode publishParameters) throws ArcgisException;

    /** Append features to a layer of a service. @return the number of features added. */
    int addFeatures(ServiceConnection service, int layerId, ArrayNode features) throws ArcgisException;

    /** Share an item (a plain item or a feature service) with a group. */
    void share(String itemId, String groupId) throws ArcgisException;
}
