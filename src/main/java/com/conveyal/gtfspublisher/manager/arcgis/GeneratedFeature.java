package com.conveyal.gtfspublisher.manager.arcgis;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One feature produced by the generate operation: a geometry in the target spatial reference and the attributes the
 * generator inferred from the source row.
 */
public class GeneratedFeature {
    public final ObjectNode geometry;
    public final ObjectNode attributes;

    public GeneratedFeature(ObjectNode geometry, ObjectNode attributes) {
        this.geometry = geometry;
        this.attributes = attributes;
    }

    public double getX() {
        return geometry.path("x").asDouble();
    }

    public double getY() {
        return geometry.path("y").asDouble();
    }
}
