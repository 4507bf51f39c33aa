package com.conveyal.gtfspublisher.manager.gtfs;

import com.conveyal.gtfspublisher.manager.models.GtfsRoute;
import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.conveyal.gtfspublisher.manager.models.GtfsTrip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The parsed tables of a GTFS feed that are published as feature layers. Tables absent from the archive are empty.
 */
public class GtfsFeed {
    private static final Logger LOG = LoggerFactory.getLogger(GtfsFeed.class);

    public final List<GtfsStop> stops;
    public final List<GtfsRoute> routes;
    public final List<GtfsTrip> trips;
    /** Raw shapes.txt rows in {@link GtfsRecordParser#SHAPE_COLUMNS} order. */
    public final List<String[]> shapeRows;

    public GtfsFeed(List<GtfsStop> stops, List<GtfsRoute> routes, List<GtfsTrip> trips, List<String[]> shapeRows) {
        this.stops = Collections.unmodifiableList(stops);
        this.routes = Collections.unmodifiableList(routes);
        this.trips = Collections.unmodifiableList(trips);
        this.shapeRows = Collections.unmodifiableList(shapeRows);
    }

    public static GtfsFeed load(List<GtfsFile> files) throws IOException {
        List<GtfsStop> stops = new ArrayList<>();
        List<GtfsRoute> routes = new ArrayList<>();
        List<GtfsTrip> trips = new ArrayList<>();
        List<String[]> shapeRows = new ArrayList<>();
        for (GtfsFile file : files) {
            if (file.kind == null) continue;
            switch (file.kind) {
                case STOPS:
                    stops = GtfsRecordParser.readStops(file.path);
                    break;
                case ROUTES:
                    routes = GtfsRecordParser.readRoutes(file.path);
                    break;
                case TRIPS:
                    trips = GtfsRecordParser.readTrips(file.path);
                    break;
                case SHAPES:
                    shapeRows = GtfsRecordParser.readShapeRows(file.path);
                    break;
                default:
                    // Other tables are uploaded as plain items only.
                    break;
            }
        }
        LOG.info("Loaded feed with {} stops, {} routes, {} trips, {} shape points",
            stops.size(), routes.size(), trips.size(), shapeRows.size());
        return new GtfsFeed(stops, routes, trips, shapeRows);
    }
}
