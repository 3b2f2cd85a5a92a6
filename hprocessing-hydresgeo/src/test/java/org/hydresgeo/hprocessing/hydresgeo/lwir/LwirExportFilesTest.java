package org.hydresgeo.hprocessing.hydresgeo.lwir;

import org.hydresgeo.hprocessing.hydresgeo.HydReSGeoTestFiles;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class LwirExportFilesTest {

    private static final ZoneOffset OFFSET = ZoneOffset.ofHours(2);

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testParseTimestamp() {
        assertEquals(Instant.parse("2017-08-15T11:31:40Z"),
                     LwirExportFiles.parseTimestamp("ir_export_20170815_1_2_13-31-40.csv", OFFSET));
        assertEquals(Instant.parse("2017-08-15T13:31:40Z"),
                     LwirExportFiles.parseTimestamp("ir_export_20170815_1_2_13-31-40.csv", ZoneOffset.UTC));
        assertNull(LwirExportFiles.parseTimestamp("ir_export_20170815.csv", OFFSET));
        assertNull(LwirExportFiles.parseTimestamp("ir_export_20170815_1_2_13:31:40.csv", OFFSET));
        assertNull(LwirExportFiles.parseTimestamp("Auto017.hdr", OFFSET));
    }

    @Test
    public void testFindNearest() throws IOException {
        final Path directory = temporaryFolder.getRoot().toPath();
        HydReSGeoTestFiles.writeText(directory.resolve("ir_export_20170815_1_2_14-20-00.csv"), "1;2\n");
        HydReSGeoTestFiles.writeText(directory.resolve("ir_export_20170815_1_2_14-27-00.csv"), "1;2\n");
        HydReSGeoTestFiles.writeText(directory.resolve("ir_export_20170815_1_2_15-00-00.csv"), "1;2\n");
        HydReSGeoTestFiles.writeText(directory.resolve("notes.txt"), "nothing");

        final Map<Path, Instant> files = LwirExportFiles.list(directory, OFFSET);
        assertEquals(3, files.size());

        final Instant captureTime = Instant.parse("2017-08-15T12:25:00Z");
        assertEquals(directory.resolve("ir_export_20170815_1_2_14-27-00.csv"),
                     LwirExportFiles.findNearest(directory, captureTime, 6, OFFSET));
        assertNull(LwirExportFiles.findNearest(directory, captureTime, 2, OFFSET));
    }

    @Test
    public void testMissingDirectory() throws IOException {
        final Path directory = temporaryFolder.getRoot().toPath().resolve("lwir");
        assertNull(LwirExportFiles.findNearest(directory, Instant.parse("2017-08-15T12:25:00Z"), 6, OFFSET));
    }
}
