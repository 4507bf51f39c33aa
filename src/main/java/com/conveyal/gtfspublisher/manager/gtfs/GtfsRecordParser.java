package com.conveyal.gtfspublisher.manager.gtfs;

import com.conveyal.gtfspublisher.manager.models.GtfsRoute;
import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.conveyal.gtfspublisher.manager.models.GtfsTrip;
import com.csvreader.CsvReader;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads GTFS text files into typed records. Columns are looked up by header name so that column order in the source
 * file does not matter; absent columns read as empty strings.
 */
public class GtfsRecordParser {
    public static final String[] SHAPE_COLUMNS = {
        "shape_id", "shape_pt_lat", "shape_pt_lon", "shape_pt_sequence", "shape_dist_traveled"
    };
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Read shapes.txt into raw rows in {@link #SHAPE_COLUMNS} order. Numeric fields are left as text.
     */
    public static List<String[]> readShapeRows(File file) throws IOException {
        try (Reader reader = openReader(file)) {
            return readShapeRows(reader);
        }
    }

    public static List<String[]> readShapeRows(Reader reader) throws IOException {
        List<String[]> rows = new ArrayList<>();
        CsvReader csvReader = openCsv(reader);
        try {
            while (csvReader.readRecord()) {
                String[] row = new String[SHAPE_COLUMNS.length];
                for (int i = 0; i < SHAPE_COLUMNS.length; i++) {
                    row[i] = csvReader.get(SHAPE_COLUMNS[i]);
                }
                rows.add(row);
            }
        } finally {
            csvReader.close();
        }
        return rows;
    }

    public static List<GtfsRoute> readRoutes(File file) throws IOException {
        try (Reader reader = openReader(file)) {
            return readRoutes(reader);
        }
    }

    public static List<GtfsRoute> readRoutes(Reader reader) throws IOException {
        List<GtfsRoute> routes = new ArrayList<>();
        CsvReader csvReader = openCsv(reader);
        try {
            while (csvReader.readRecord()) {
                routes.add(new GtfsRoute(
                    csvReader.get("route_id"),
                    csvReader.get("route_color")
                ));
            }
        } finally {
            csvReader.close();
        }
        return routes;
    }

    public static List<GtfsTrip> readTrips(File file) throws IOException {
        try (Reader reader = openReader(file)) {
            return readTrips(reader);
        }
    }

    public static List<GtfsTrip> readTrips(Reader reader) throws IOException {
        List<GtfsTrip> trips = new ArrayList<>();
        CsvReader csvReader = openCsv(reader);
        try {
            while (csvReader.readRecord()) {
                trips.add(new GtfsTrip(
                    csvReader.get("trip_id"),
                    csvReader.get("route_id"),
                    csvReader.get("shape_id")
                ));
            }
        } finally {
            csvReader.close();
        }
        return trips;
    }

    public static List<GtfsStop> readStops(File file) throws IOException {
        try (Reader reader = openReader(file)) {
            return readStops(reader);
        }
    }

    public static List<GtfsStop> readStops(Reader reader) throws IOException {
        List<GtfsStop> stops = new ArrayList<>();
        CsvReader csvReader = openCsv(reader);
        try {
            String[] headers = csvReader.getHeaders();
            while (csvReader.readRecord()) {
                Map<String, String> fields = new LinkedHashMap<>();
                for (String header : headers) {
                    fields.put(header, csvReader.get(header));
                }
                stops.add(new GtfsStop(
                    NumberUtils.toDouble(csvReader.get("stop_lat")),
                    NumberUtils.toDouble(csvReader.get("stop_lon")),
                    fields
                ));
            }
        } finally {
            csvReader.close();
        }
        return stops;
    }

    /** Convenience for parsing file contents held in memory. */
    public static Reader fromString(String text) {
        return new StringReader(text);
    }

    private static Reader openReader(File file) throws IOException {
        return new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8);
    }

    /**
     * Wrap the reader and consume the header row. A leading byte order mark, which some feed producers emit, is
     * removed from the first header.
     */
    private static CsvReader openCsv(Reader reader) throws IOException {
        CsvReader csvReader = new CsvReader(reader);
        csvReader.setTrimWhitespace(true);
        if (csvReader.readHeaders()) {
            String[] headers = csvReader.getHeaders();
            if (headers.length > 0 && !headers[0].isEmpty() && headers[0].charAt(0) == BYTE_ORDER_MARK) {
                headers[0] = headers[0].substring(1);
                csvReader.setHeaders(headers);
            }
        }
        return csvReader;
    }
}
