package com.conveyal.gtfspublisher.manager.models;

public class GtfsTrip {
    public final String trip_id;
    public final String route_id;
    public final String shape_id;

    public GtfsTrip(String trip_id, String route_id, String shape_id) {
        this.trip_id = trip_id;
        this.route_id = route_id;
        this.shape_id = shape_id;
    }
}
