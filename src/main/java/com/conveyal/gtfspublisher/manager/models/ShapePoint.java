package com.conveyal.gtfspublisher.manager.models;

import org.apache.commons.lang3.math.NumberUtils;

/**
 * A single row of shapes.txt. Numeric fields that cannot be parsed are read as zero.
 */
public class ShapePoint {
    public final String shapeId;
    public final double lat;
    public final double lon;
    public final int sequence;
    public final double distTraveled;

    public ShapePoint(String shapeId, double lat, double lon, int sequence, double distTraveled) {
        this.shapeId = shapeId;
        this.lat = lat;
        this.lon = lon;
        this.sequence = sequence;
        this.distTraveled = distTraveled;
    }

    /**
     * Parse a shape point from a raw row in canonical column order: shape_id, shape_pt_lat, shape_pt_lon,
     * shape_pt_sequence, shape_dist_traveled. Missing trailing columns are treated as empty.
     */
    public static ShapePoint fromRow(String[] row) {
        return new ShapePoint(
            field(row, 0),
            NumberUtils.toDouble(field(row, 1).trim()),
            NumberUtils.toDouble(field(row, 2).trim()),
            NumberUtils.toInt(field(row, 3).trim()),
            NumberUtils.toDouble(field(row, 4).trim())
        );
    }

    private static String field(String[] row, int index) {
        return row.length > index && row[index] != null ? row[index] : "";
    }

    @Override
    public String toString() {
        return String.format("ShapePoint{%s #%d (%f, %f)}", shapeId, sequence, lat, lon);
    }
}
