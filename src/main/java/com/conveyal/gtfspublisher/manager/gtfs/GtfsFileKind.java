package com.conveyal.gtfspublisher.manager.gtfs;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The files that make up a GTFS feed. Any other file found in an archive is not part of the specification and is
 * ignored by the import.
 */
public enum GtfsFileKind {
    AGENCY("agency.txt", true),
    STOPS("stops.txt", true),
    ROUTES("routes.txt", true),
    TRIPS("trips.txt", true),
    STOP_TIMES("stop_times.txt", true),
    CALENDAR("calendar.txt", true),
    CALENDAR_DATES("calendar_dates.txt", false),
    FARE_ATTRIBUTES("fare_attributes.txt", false),
    FARE_RULES("fare_rules.txt", false),
    SHAPES("shapes.txt", false),
    FREQUENCIES("frequencies.txt", false),
    TRANSFERS("transfers.txt", false),
    FEED_INFO("feed_info.txt", false);

    public final String fileName;
    public final boolean required;

    GtfsFileKind(String fileName, boolean required) {
        this.fileName = fileName;
        this.required = required;
    }

    /**
     * @return the kind matching the file name, or null if the file is not a standard GTFS file.
     */
    public static GtfsFileKind fromFileName(String fileName) {
        for (GtfsFileKind kind : values()) {
            if (kind.fileName.equals(fileName)) return kind;
        }
        return null;
    }

    /**
     * @return the file names of required kinds that are absent from the provided file names, in declaration order.
     */
    public static List<String> missingRequiredFiles(Collection<String> fileNames) {
        Set<String> present = Set.copyOf(fileNames);
        return Arrays.stream(values())
            .filter(kind -> kind.required && !present.contains(kind.fileName))
            .map(kind -> kind.fileName)
            .collect(Collectors.toList());
    }
}
