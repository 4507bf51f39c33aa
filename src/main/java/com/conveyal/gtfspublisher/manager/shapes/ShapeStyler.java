package com.conveyal.gtfspublisher.manager.shapes;

import com.conveyal.gtfspublisher.manager.models.GtfsRoute;
import com.conveyal.gtfspublisher.manager.models.GtfsTrip;
import com.conveyal.gtfspublisher.manager.models.RouteColor;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.conveyal.gtfspublisher.manager.utils.json.JsonUtil.objectMapper;

/**
 * Computes shape colors from route colors and the trips that link shapes to routes, and turns them into line symbols
 * for the shapes layer renderer. Every method here is a pure function of its arguments.
 */
public class ShapeStyler {
    public static final int LINE_WIDTH = 2;

    public static Map<String, RouteColor> routeColors(List<GtfsRoute> routes) {
        Map<String, RouteColor> colorsByRouteId = new LinkedHashMap<>();
        for (GtfsRoute route : routes) {
            colorsByRouteId.put(route.route_id, RouteColor.fromHex(route.route_id, route.route_color));
        }
        return colorsByRouteId;
    }

    /**
     * Resolve the color of each shape through the trips that use it. Trips referencing an unknown route, or no shape,
     * are skipped. If several trips share a shape, the last one wins.
     */
    public static Map<String, int[]> shapeColors(List<GtfsRoute> routes, List<GtfsTrip> trips) {
        Map<String, RouteColor> colorsByRouteId = routeColors(routes);
        Map<String, int[]> colorsByShapeId = new LinkedHashMap<>();
        for (GtfsTrip trip : trips) {
            if (StringUtils.isEmpty(trip.shape_id)) continue;
            RouteColor routeColor = colorsByRouteId.get(trip.route_id);
            if (routeColor == null) continue;
            colorsByShapeId.put(trip.shape_id, routeColor.getRgba());
        }
        return colorsByShapeId;
    }

    /** Simple line symbol descriptor for the given color. */
    public static ObjectNode lineSymbol(int[] rgba) {
        ObjectNode symbol = objectMapper.createObjectNode();
        symbol.put("type", "esriSLS");
        symbol.put("style", "esriSLSSolid");
        ArrayNode color = symbol.putArray("color");
        for (int component : rgba) color.add(component);
        symbol.put("width", LINE_WIDTH);
        return symbol;
    }

    /**
     * Build the unique value infos of a renderer keyed on shape id, one per colored shape.
     */
    public static ArrayNode uniqueValueInfos(Map<String, int[]> shapeColors) {
        ArrayNode infos = objectMapper.createArrayNode();
        shapeColors.forEach((shapeId, rgba) -> {
            ObjectNode info = infos.addObject();
            info.put("value", shapeId);
            info.put("label", shapeId);
            info.set("symbol", lineSymbol(rgba));
        });
        return infos;
    }
}
