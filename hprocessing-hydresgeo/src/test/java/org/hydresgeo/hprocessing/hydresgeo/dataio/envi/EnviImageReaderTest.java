package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import org.hydresgeo.hprocessing.core.datamodel.ArraySpectralImage;
import org.hydresgeo.hprocessing.hydresgeo.HydReSGeoTestFiles;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.Assert.assertEquals;

public class EnviImageReaderTest {

    private static final int LINES = 3;
    private static final int SAMPLES = 4;
    private static final int BANDS = 2;

    @Rule
    public TemporaryFolder temporaryFolder = new TemporaryFolder();

    @Test
    public void testGetImagePath() {
        assertEquals(Paths.get("data", "meas_hyp", "Auto017.cue"),
                     EnviImageReader.getImagePath(Paths.get("data", "meas_hyp", "Auto017.hdr")));
    }

    @Test
    public void testReadBsqLittleEndian() throws IOException {
        assertReadsCube("bsq", ByteOrder.LITTLE_ENDIAN, 2);
    }

    @Test
    public void testReadBilBigEndian() throws IOException {
        assertReadsCube("bil", ByteOrder.BIG_ENDIAN, 2);
    }

    @Test
    public void testReadBip() throws IOException {
        assertReadsCube("bip", ByteOrder.LITTLE_ENDIAN, 2);
    }

    @Test
    public void testReadFloat32() throws IOException {
        assertReadsCube("bil", ByteOrder.BIG_ENDIAN, 4);
    }

    @Test(expected = IOException.class)
    public void testFileTooShort() throws IOException {
        final Path imageFile = temporaryFolder.newFile("Auto001.cue").toPath();
        Files.write(imageFile, new byte[10]);
        EnviImageReader.readImage(createHeader("bsq", 0, 2), imageFile);
    }

    @Test(expected = IOException.class)
    public void testUnsupportedDataType() throws IOException {
        final Path imageFile = temporaryFolder.newFile("Auto001.cue").toPath();
        Files.write(imageFile, new byte[LINES * SAMPLES * BANDS * 8]);
        EnviImageReader.readImage(createHeader("bsq", 0, 6), imageFile);
    }

    @Test(expected = IOException.class)
    public void testUnsupportedInterleave() throws IOException {
        final Path imageFile = temporaryFolder.newFile("Auto001.cue").toPath();
        Files.write(imageFile, new byte[LINES * SAMPLES * BANDS * 2]);
        EnviImageReader.readImage(createHeader("bsx", 0, 2), imageFile);
    }

    private void assertReadsCube(String interleave, ByteOrder byteOrder, int dataType) throws IOException {
        final double[][][] cube = new double[LINES][SAMPLES][BANDS];
        for (int line = 0; line < LINES; line++) {
            for (int sample = 0; sample < SAMPLES; sample++) {
                for (int band = 0; band < BANDS; band++) {
                    cube[line][sample][band] = 100 * band + 10 * line + sample - 5;
                }
            }
        }
        final Path headerFile = temporaryFolder.getRoot().toPath().resolve("Auto002.hdr");
        final int byteOrderCode = byteOrder == ByteOrder.BIG_ENDIAN ? 1 : 0;
        HydReSGeoTestFiles.writeText(headerFile, HydReSGeoTestFiles.createHeader(LINES, SAMPLES, BANDS, dataType,
                                                                                   interleave, byteOrderCode));
        if (dataType == 2) {
            HydReSGeoTestFiles.writeInt16Cube(EnviImageReader.getImagePath(headerFile), cube, interleave, byteOrder);
        } else {
            HydReSGeoTestFiles.writeFloat32Cube(EnviImageReader.getImagePath(headerFile), cube, interleave, byteOrder);
        }

        final ArraySpectralImage image = EnviImageReader.readImage(headerFile);
        assertEquals(LINES, image.getRowCount());
        assertEquals(SAMPLES, image.getColumnCount());
        assertEquals(BANDS, image.getBandCount());
        for (int line = 0; line < LINES; line++) {
            for (int sample = 0; sample < SAMPLES; sample++) {
                for (int band = 0; band < BANDS; band++) {
                    assertEquals(cube[line][sample][band], image.get(line, sample, band), 0.0);
                }
            }
        }
    }

    private static EnviHeader createHeader(String interleave, int byteOrder, int dataType) throws IOException {
        return EnviHeaderReader.readHeader(new StringReader(
                HydReSGeoTestFiles.createHeader(LINES, SAMPLES, BANDS, dataType, interleave, byteOrder)));
    }
}
