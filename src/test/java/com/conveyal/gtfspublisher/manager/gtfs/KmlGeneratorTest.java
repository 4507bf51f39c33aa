package com.conveyal.gtfspublisher.manager.gtfs;

import com.conveyal.gtfspublisher.TestUtils;
import com.conveyal.gtfspublisher.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Uses coreutils commands in place of a real KML writer: cp "writes" the output file, false fails.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class KmlGeneratorTest extends UnitTest {
    @TempDir
    File workingDirectory;

    @Test
    void succeedsWhenToolWritesOutput() throws IOException, InterruptedException {
        File zip = TestUtils.zipFiles(TestUtils.simpleFeedFiles());
        File kml = new File(workingDirectory, "gtfs.kml");
        assertThat(new KmlGenerator("cp").generate(zip, kml), equalTo(true));
        assertThat(kml.exists(), equalTo(true));
    }

    @Test
    void failsWhenToolExitsWithError() throws IOException, InterruptedException {
        File zip = TestUtils.zipFiles(TestUtils.simpleFeedFiles());
        File kml = new File(workingDirectory, "gtfs.kml");
        assertThat(new KmlGenerator("false").generate(zip, kml), equalTo(false));
    }

    @Test
    void commandIsSplitOnWhitespace() {
        assertThat(new KmlGenerator("  python3 kmlwriter.py ").getCommand(), contains("python3", "kmlwriter.py"));
        assertThrows(IllegalArgumentException.class, () -> new KmlGenerator(" "));
    }
}
