package com.conveyal.gtfspublisher.manager.gtfs;

import java.util.List;

/**
 * Thrown when an archive does not contain every required GTFS file. Nothing is uploaded when this occurs.
 */
public class GtfsValidationException extends Exception {
    public final List<String> missingFiles;

    public GtfsValidationException(List<String> missingFiles) {
        super(String.format("Invalid GTFS format. Missing required files: %s. No files were uploaded.",
            String.join(", ", missingFiles)));
        this.missingFiles = List.copyOf(missingFiles);
    }
}
