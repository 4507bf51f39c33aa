package com.conveyal.gtfspublisher.manager.shapes;

import com.conveyal.gtfspublisher.manager.models.ShapeLine;
import com.conveyal.gtfspublisher.manager.models.ShapePoint;
import org.locationtech.jts.geom.Coordinate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds ordered lines out of the points of shapes.txt.
 */
public class ShapeAssembler {

    public static List<ShapePoint> parse(List<String[]> rows) {
        return rows.stream().map(ShapePoint::fromRow).collect(Collectors.toList());
    }

    /**
     * Group points by shape id, keeping shape ids in the order they are first seen, and order each group by
     * shape_pt_sequence. List.sort is stable, so points with equal sequence keep their input order.
     */
    public static Map<String, List<ShapePoint>> groupPoints(List<ShapePoint> points) {
        Map<String, List<ShapePoint>> pointsByShapeId = new LinkedHashMap<>();
        for (ShapePoint point : points) {
            pointsByShapeId.computeIfAbsent(point.shapeId, id -> new ArrayList<>()).add(point);
        }
        for (List<ShapePoint> group : pointsByShapeId.values()) {
            group.sort(Comparator.comparingInt(p -> p.sequence));
        }
        return pointsByShapeId;
    }

    /**
     * Construct one line per distinct shape id. The returned stream is lazy and can only be consumed once; collect it
     * if the lines are needed more than once.
     */
    public static Stream<ShapeLine> constructLines(List<String[]> rows) {
        return groupPoints(parse(rows)).entrySet().stream()
            .map(entry -> new ShapeLine(entry.getKey(), toCoordinates(entry.getValue())));
    }

    private static List<Coordinate> toCoordinates(List<ShapePoint> points) {
        return points.stream()
            .map(point -> new Coordinate(point.lon, point.lat))
            .collect(Collectors.toList());
    }
}
