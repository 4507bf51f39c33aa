package com.conveyal.gtfspublisher.manager.models;

import java.util.Collections;
import java.util.Map;

/**
 * A row of stops.txt. All source columns are kept in file order in {@link #fields} so that the stop can be sent to
 * the feature generator with its full schema; the coordinates are parsed, defaulting to 0.
 */
public class GtfsStop {
    public final double stop_lat;
    public final double stop_lon;
    public final Map<String, String> fields;

    public GtfsStop(double stop_lat, double stop_lon, Map<String, String> fields) {
        this.stop_lat = stop_lat;
        this.stop_lon = stop_lon;
        this.fields = Collections.unmodifiableMap(fields);
    }
}
