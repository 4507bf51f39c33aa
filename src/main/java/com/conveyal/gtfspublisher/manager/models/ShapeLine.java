package com.conveyal.gtfspublisher.manager.models;

import org.locationtech.jts.geom.Coordinate;

import java.util.Collections;
import java.util.List;

/**
 * The ordered path of one GTFS shape. Coordinates follow the JTS convention of x = longitude and y = latitude until
 * they are projected, after which they hold the projected x/y.
 */
public class ShapeLine {
    public final String shapeId;
    public final List<Coordinate> coordinates;

    public ShapeLine(String shapeId, List<Coordinate> coordinates) {
        this.shapeId = shapeId;
        this.coordinates = Collections.unmodifiableList(coordinates);
    }

    public int size() {
        return coordinates.size();
    }
}
