package com.conveyal.gtfspublisher.manager.gtfs;

import java.io.File;
import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * A file extracted from a GTFS archive. The path stays valid until the directory it was extracted into is deleted.
 */
public class GtfsFile {
    /** Display title, e.g. "Stop Times" for stop_times.txt. */
    public final String name;
    public final String fileName;
    /** Null for files that are not part of the GTFS specification. */
    public final GtfsFileKind kind;
    public final File path;

    public GtfsFile(String fileName, File path) {
        this.fileName = fileName;
        this.name = displayName(fileName);
        this.kind = GtfsFileKind.fromFileName(fileName);
        this.path = path;
    }

    public boolean isStandard() {
        return kind != null;
    }

    static String displayName(String fileName) {
        String baseName = fileName.replace(".txt", "");
        return Arrays.stream(baseName.split("_"))
            .filter(part -> !part.isEmpty())
            .map(part -> Character.toUpperCase(part.charAt(0)) + part.substring(1).toLowerCase())
            .collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return String.format("%s (%s)", fileName, path);
    }
}
