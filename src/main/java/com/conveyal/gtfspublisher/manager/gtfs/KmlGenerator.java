package com.conveyal.gtfspublisher.manager.gtfs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs an external KML writer (for example transitfeed's kmlwriter.py) that renders a GTFS archive as a KML file.
 * The tool is invoked as {@code <command> <gtfs zip> <kml output>}.
 */
public class KmlGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(KmlGenerator.class);

    private final List<String> command;

    /**
     * @param command executable and any leading arguments, separated by whitespace
     */
    public KmlGenerator(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("KML generator command must not be empty");
        }
        this.command = Arrays.asList(command.trim().split("\\s+"));
    }

    /**
     * @return true if the tool exited with status 0 and wrote the output file
     */
    public boolean generate(File gtfsZip, File kmlFile) throws IOException, InterruptedException {
        List<String> args = new ArrayList<>(command);
        args.add(gtfsZip.getAbsolutePath());
        args.add(kmlFile.getAbsolutePath());
        LOG.info("Generating KML: {}", String.join(" ", args));
        Process process = new ProcessBuilder(args)
            .redirectErrorStream(true)
            .redirectOutput(ProcessBuilder.Redirect.DISCARD)
            .start();
        int exitCode = process.waitFor();
        if (exitCode != 0) {
            LOG.warn("KML generator exited with status {}", exitCode);
            return false;
        }
        return kmlFile.exists();
    }

    public List<String> getCommand() {
        return command;
    }
}
