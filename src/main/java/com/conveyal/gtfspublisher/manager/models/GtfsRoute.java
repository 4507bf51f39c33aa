package com.conveyal.gtfspublisher.manager.models;

/**
 * The fields of routes.txt needed for styling.
 */
public class GtfsRoute {
    public final String route_id;
    public final String route_color;

    public GtfsRoute(String route_id, String route_color) {
        this.route_id = route_id;
        this.route_color = route_color;
    }
}
