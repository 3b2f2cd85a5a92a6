package org.hydresgeo.hprocessing.hydresgeo;

import org.hydresgeo.hprocessing.core.datamodel.ArraySpectralImage;
import org.hydresgeo.hprocessing.hydresgeo.config.ProcessingConfig;
import org.hydresgeo.hprocessing.hydresgeo.soilmoisture.SoilMoistureData;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class HydReSGeoCaptureProcessorTest {

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    private HydReSGeoDatasetFixture fixture;
    private ProcessingConfig config;
    private SoilMoistureData soilMoistureData;

    @Before
    public void setUp() throws IOException {
        fixture = new HydReSGeoDatasetFixture(temporaryFolder.getRoot().toPath());
        fixture.write(1, 1, false);
        config = ProcessingConfig.read(fixture.getConfigFile(), fixture.getDataDirectory());
        soilMoistureData = SoilMoistureData.read(config.getSoilMoistureFile());
    }

    @Test
    public void testGetHighresHeaderPath() {
        assertEquals(Paths.get("hyp", "m_hyp", "Auto017_highres.hdr"),
                     HydReSGeoCaptureProcessor.getHighresHeaderPath(Paths.get("hyp", "m_hyp", "Auto017.hdr")));
    }

    @Test
    public void testProcessCapture() throws IOException {
        final Path header = fixture.getMeasurementDirectory().resolve("Auto017.hdr");
        final List<DatasetRow> rows = new HydReSGeoCaptureProcessor(config, soilMoistureData, header,
                                                                    HydReSGeoDatasetFixture.MEASUREMENT,
                                                                    Arrays.asList("zone3", "zone1")).process();

        assertEquals(2, rows.size());
        assertEquals("zone3", rows.get(0).getZone());
        assertEquals(30.2, rows.get(0).getSoilMoisture().getVolumetricSoilMoisture(), 0.0);
        assertEquals(20.7, rows.get(1).getSoilMoisture().getVolumetricSoilMoisture(), 0.0);
        assertFalse(rows.get(0).getLwirStatistics().isAvailable());
        assertTrue(rows.get(1).getLwirStatistics().isAvailable());
        assertEquals(OffsetDateTime.parse("2017-08-15T14:25:00+02:00"), rows.get(0).getDateTime());
    }

    @Test
    public void testEmptyCapture() throws IOException {
        final Path header = fixture.getMeasurementDirectory().resolve("Auto018.hdr");
        final List<DatasetRow> rows = new HydReSGeoCaptureProcessor(config, soilMoistureData, header,
                                                                    HydReSGeoDatasetFixture.MEASUREMENT,
                                                                    HydReSGeoConstants.getDefaultZones()).process();
        assertTrue(rows.isEmpty());
    }

    @Test(expected = IOException.class)
    public void testMissingHighresHeader() throws IOException {
        final Path header = fixture.getMeasurementDirectory().resolve("Auto019.hdr");
        new HydReSGeoCaptureProcessor(config, soilMoistureData, header, HydReSGeoDatasetFixture.MEASUREMENT,
                                      HydReSGeoConstants.getDefaultZones()).process();
    }

    @Test(expected = IOException.class)
    public void testMeasurementWithoutMask() throws IOException {
        final Path header = fixture.getMeasurementDirectory().resolve("Auto017.hdr");
        new HydReSGeoCaptureProcessor(config, soilMoistureData, header, "20170901_meas9",
                                      Arrays.asList("zone1")).process();
    }

    @Test
    public void testIsEmpty() {
        final ArraySpectralImage image = new ArraySpectralImage(2, 2, 7);
        assertTrue(HydReSGeoCaptureProcessor.isEmpty(image));

        image.set(1, 1, 4, 3.0);
        assertTrue(HydReSGeoCaptureProcessor.isEmpty(image));

        image.set(1, 1, HydReSGeoConstants.EMPTY_CHECK_BAND, 3.0);
        assertFalse(HydReSGeoCaptureProcessor.isEmpty(image));
        assertFalse(HydReSGeoCaptureProcessor.isEmpty(new ArraySpectralImage(2, 2, 3)));
    }
}
