package com.conveyal.gtfspublisher.manager.gtfs;

import com.conveyal.gtfspublisher.UnitTest;
import com.conveyal.gtfspublisher.manager.models.GtfsRoute;
import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.conveyal.gtfspublisher.manager.models.GtfsTrip;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static com.conveyal.gtfspublisher.manager.gtfs.GtfsRecordParser.fromString;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

class GtfsRecordParserTest extends UnitTest {

    @Test
    void shapeRowsAreInCanonicalColumnOrder() throws IOException {
        List<String[]> rows = GtfsRecordParser.readShapeRows(fromString(
            "shape_pt_sequence,shape_pt_lon,shape_id,shape_pt_lat\n" +
            "1,-75.0,sh1,40.0\n"
        ));
        assertThat(rows, hasSize(1));
        assertThat(rows.get(0), equalTo(new String[] {"sh1", "40.0", "-75.0", "1", ""}));
    }

    @Test
    void stopsKeepEverySourceColumnInOrder() throws IOException {
        List<GtfsStop> stops = GtfsRecordParser.readStops(fromString(
            "stop_id,stop_code,stop_name,stop_lat,stop_lon\n" +
            "s1,100, Main St ,40.5,-75.5\n" +
            "s2,101,Bad Coordinates,north,\n"
        ));
        assertThat(stops, hasSize(2));
        GtfsStop first = stops.get(0);
        assertThat(first.fields.get("stop_name"), equalTo("Main St"));
        assertThat(first.stop_lat, equalTo(40.5));
        assertThat(first.stop_lon, equalTo(-75.5));
        assertThat(first.fields.keySet(), contains("stop_id", "stop_code", "stop_name", "stop_lat", "stop_lon"));
        assertThat(first.fields.get("stop_code"), equalTo("100"));
        assertThat(stops.get(1).stop_lat, equalTo(0.0));
        assertThat(stops.get(1).stop_lon, equalTo(0.0));
    }

    @Test
    void canReadRoutesAndTrips() throws IOException {
        List<GtfsRoute> routes = GtfsRecordParser.readRoutes(fromString(
            "route_id,route_short_name,route_long_name,route_type,route_color\n" +
            "r1,1,Crosstown,3,00FF00\n" +
            "r2,2,Uptown,3\n"
        ));
        assertThat(routes.get(0).route_color, equalTo("00FF00"));
        assertThat(routes.get(1).route_color, equalTo(""));

        List<GtfsTrip> trips = GtfsRecordParser.readTrips(fromString(
            "route_id,service_id,trip_id\n" +
            "r1,weekday,t1\n"
        ));
        assertThat(trips.get(0).trip_id, equalTo("t1"));
        assertThat(trips.get(0).route_id, equalTo("r1"));
        assertThat(trips.get(0).shape_id, equalTo(""));
    }

    @Test
    void byteOrderMarkIsStrippedFromFirstHeader() throws IOException {
        List<GtfsTrip> trips = GtfsRecordParser.readTrips(fromString(
            "\uFEFFroute_id,trip_id,shape_id\n" +
            "r1,t1,sh1\n"
        ));
        assertThat(trips.get(0).route_id, equalTo("r1"));
    }
}
