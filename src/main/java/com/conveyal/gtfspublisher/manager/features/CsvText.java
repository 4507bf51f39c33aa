package com.conveyal.gtfspublisher.manager.features;

import com.conveyal.gtfspublisher.manager.models.GtfsStop;
import com.csvreader.CsvWriter;
import org.locationtech.jts.geom.Coordinate;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Builds the CSV text sent to the analyze and generate operations. Every row starts with a row_id column holding its
 * position in the full dataset, which the generator echoes back and which is used to check that output rows line up
 * with input rows.
 */
public class CsvText {
    public static final String ROW_ID_FIELD = "row_id";
    public static final String LATITUDE_FIELD = "latitude";
    public static final String LONGITUDE_FIELD = "longitude";
    public static final String STOP_LATITUDE_FIELD = "stop_lat";
    public static final String STOP_LONGITUDE_FIELD = "stop_lon";

    /**
     * @param firstRowId row id of the first coordinate, i.e. its index in the full dataset
     */
    public static String coordinates(List<Coordinate> coordinates, int firstRowId) {
        List<String[]> rows = new ArrayList<>();
        int rowId = firstRowId;
        for (Coordinate coordinate : coordinates) {
            rows.add(new String[] {
                Integer.toString(rowId++),
                Double.toString(coordinate.y),
                Double.toString(coordinate.x)
            });
        }
        return write(new String[] {ROW_ID_FIELD, LATITUDE_FIELD, LONGITUDE_FIELD}, rows);
    }

    /**
     * Write stops with every source column, so the generator sees the full stops.txt schema. The coordinate columns
     * always hold the parsed values, which are 0 where the source text was not a number.
     */
    public static String stops(List<GtfsStop> stops, int firstRowId) {
        Set<String> columns = new LinkedHashSet<>();
        for (GtfsStop stop : stops) columns.addAll(stop.fields.keySet());
        columns.remove(ROW_ID_FIELD);
        columns.add(STOP_LATITUDE_FIELD);
        columns.add(STOP_LONGITUDE_FIELD);
        List<String> headers = new ArrayList<>();
        headers.add(ROW_ID_FIELD);
        headers.addAll(columns);

        List<String[]> rows = new ArrayList<>();
        int rowId = firstRowId;
        for (GtfsStop stop : stops) {
            String[] row = new String[headers.size()];
            row[0] = Integer.toString(rowId++);
            for (int i = 1; i < headers.size(); i++) {
                String column = headers.get(i);
                if (STOP_LATITUDE_FIELD.equals(column)) row[i] = Double.toString(stop.stop_lat);
                else if (STOP_LONGITUDE_FIELD.equals(column)) row[i] = Double.toString(stop.stop_lon);
                else row[i] = stop.fields.getOrDefault(column, "");
            }
            rows.add(row);
        }
        return write(headers.toArray(new String[0]), rows);
    }

    private static String write(String[] headers, List<String[]> rows) {
        StringWriter out = new StringWriter();
        CsvWriter writer = new CsvWriter(out, ',');
        writer.setRecordDelimiter('\n');
        try {
            writer.writeRecord(headers);
            for (String[] row : rows) writer.writeRecord(row);
        } catch (IOException e) {
            // Writing to a StringWriter does not perform I/O.
            throw new UncheckedIOException(e);
        } finally {
            writer.close();
        }
        return out.toString();
    }
}
