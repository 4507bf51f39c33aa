package com.conveyal.gtfspublisher.manager.gtfs;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Extracts GTFS zip archives and checks that they contain the required files.
 */
public class GtfsArchive {
    private static final Logger LOG = LoggerFactory.getLogger(GtfsArchive.class);

    /**
     * Extract every file member of the zip into the directory, re-encoding contents as UTF-8 text. Directory entries
     * are skipped. Entries nested in folders are written under their bare file name; when several members share a
     * file name, the first one in the archive is kept and the others are skipped.
     */
    public static List<GtfsFile> extract(File zipFile, File dir) throws IOException {
        List<GtfsFile> files = new ArrayList<>();
        Set<String> fileNames = new HashSet<>();
        String dirPath = dir.getCanonicalPath() + File.separator;
        try (ZipFile zip = new ZipFile(zipFile)) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                if (entry.isDirectory()) continue;
                String fileName = new File(entry.getName()).getName();
                if (!fileNames.add(fileName)) {
                    LOG.warn("Skipping {} in {}: an earlier member is already named {}", entry.getName(),
                        zipFile.getName(), fileName);
                    continue;
                }
                File out = new File(dir, fileName);
                if (!out.getCanonicalPath().startsWith(dirPath)) {
                    throw new IOException(String.format("Zip entry %s is outside of the target directory", entry.getName()));
                }
                try (InputStream in = zip.getInputStream(entry)) {
                    String text = IOUtils.toString(in, StandardCharsets.UTF_8);
                    Files.writeString(out.toPath(), text, StandardCharsets.UTF_8);
                }
                files.add(new GtfsFile(fileName, out));
            }
        }
        LOG.info("Extracted {} files from {}", files.size(), zipFile.getName());
        return files;
    }

    /**
     * @throws GtfsValidationException if any required GTFS file is missing.
     */
    public static void validate(List<GtfsFile> files) throws GtfsValidationException {
        List<String> missing = GtfsFileKind.missingRequiredFiles(
            files.stream().map(f -> f.fileName).collect(Collectors.toList())
        );
        if (!missing.isEmpty()) throw new GtfsValidationException(missing);
    }

    /** Strip out nonstandard files. */
    public static List<GtfsFile> standardFiles(List<GtfsFile> files) {
        return files.stream().filter(GtfsFile::isStandard).collect(Collectors.toList());
    }
}
