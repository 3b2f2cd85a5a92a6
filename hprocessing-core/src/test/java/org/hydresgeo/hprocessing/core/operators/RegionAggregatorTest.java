package org.hydresgeo.hprocessing.core.operators;

import org.hydresgeo.hprocessing.core.AggregationMode;
import org.hydresgeo.hprocessing.core.DegenerateGeometryException;
import org.hydresgeo.hprocessing.core.InsufficientPixelsException;
import org.hydresgeo.hprocessing.core.LengthMismatchException;
import org.hydresgeo.hprocessing.core.datamodel.ArrayPixelMask;
import org.hydresgeo.hprocessing.core.datamodel.ArraySpectralImage;
import org.hydresgeo.hprocessing.core.datamodel.GridCell;
import org.hydresgeo.hprocessing.core.datamodel.GridCellSpectrum;
import org.hydresgeo.hprocessing.core.datamodel.GridSpec;
import org.hydresgeo.hprocessing.core.datamodel.Spectrum;
import org.hydresgeo.hprocessing.core.util.RectangleUtils;
import org.junit.Before;
import org.junit.Test;

import java.awt.Rectangle;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegionAggregatorTest {

    private static final double[][] BAND_0 = {
            {1, 2, 3, 4},
            {5, 6, 7, 8},
            {9, 10, 11, 100},
            {0, 0, 0, 0}
    };

    private ArraySpectralImage image;
    private RegionAggregator aggregator;

    // the 12 pixels 1..11 and 100
    private final Rectangle upperRectangle = RectangleUtils.createRectangle(0, 3, 0, 4);

    @Before
    public void setUp() {
        image = new ArraySpectralImage(4, 4, 2);
        for (int row = 0; row < 4; row++) {
            for (int col = 0; col < 4; col++) {
                image.set(row, col, 0, BAND_0[row][col]);
                image.set(row, col, 1, 2 * BAND_0[row][col]);
            }
        }
        aggregator = new RegionAggregator(image, new BandFilter(new double[]{500.0, 600.0}, new int[]{1, 1}));
    }

    @Test
    public void testMedian() {
        final Spectrum spectrum = aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MEDIAN, null);
        assertArrayEquals(new double[]{500.0, 600.0}, spectrum.getWavelengths(), 0.0);
        assertArrayEquals(new double[]{6.5, 13.0}, spectrum.getValues(), 1.0e-12);
    }

    @Test
    public void testMean() {
        final Spectrum spectrum = aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MEAN, null);
        assertArrayEquals(new double[]{166.0 / 12.0, 332.0 / 12.0}, spectrum.getValues(), 1.0e-12);
    }

    @Test
    public void testMax() {
        final Spectrum spectrum = aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX, null);
        assertArrayEquals(new double[]{100.0, 200.0}, spectrum.getValues(), 0.0);
    }

    @Test
    public void testMax10() {
        final Spectrum spectrum = aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX10, null);
        assertArrayEquals(new double[]{16.3, 32.6}, spectrum.getValues(), 1.0e-12);
    }

    @Test
    public void testNaNPixelsPropagate() {
        final double[] values = {1.0, 2.0, Double.NaN, 4.0};
        assertTrue(Double.isNaN(RegionAggregator.aggregate(values.clone(), AggregationMode.MEDIAN)));
        assertTrue(Double.isNaN(RegionAggregator.aggregate(values.clone(), AggregationMode.MEAN)));
        assertTrue(Double.isNaN(RegionAggregator.aggregate(values.clone(), AggregationMode.MAX)));

        final double[] elevenValues = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, Double.NaN};
        assertTrue(Double.isNaN(RegionAggregator.aggregate(elevenValues, AggregationMode.MAX10)));
        assertEquals(2.5, RegionAggregator.aggregate(new double[]{1.0, 2.0, 3.0, 4.0}, AggregationMode.MEDIAN), 0.0);
    }

    @Test
    public void testMax10WithExactlyTenPixelsIsTheMean() {
        final ArraySpectralImage wideImage = new ArraySpectralImage(2, 5, 2);
        for (int col = 0; col < 5; col++) {
            wideImage.set(0, col, 0, col);
            wideImage.set(1, col, 0, 10 + col);
        }
        final RegionAggregator wideAggregator =
                new RegionAggregator(wideImage, new BandFilter(new double[]{500.0, 600.0}, new int[]{1, 0}));
        final Rectangle tenPixels = RectangleUtils.createRectangle(0, 2, 0, 5);

        final Spectrum max10 = wideAggregator.computeRegionSpectrum(tenPixels, AggregationMode.MAX10, null);
        final Spectrum mean = wideAggregator.computeRegionSpectrum(tenPixels, AggregationMode.MEAN, null);
        assertEquals(1, max10.getBandCount());
        assertEquals(7.0, max10.getValue(0), 1.0e-12);
        assertArrayEquals(mean.getValues(), max10.getValues(), 1.0e-12);
    }

    @Test
    public void testMax10WithFewerThanTenPixels() {
        try {
            aggregator.computeRegionSpectrum(RectangleUtils.createRectangle(0, 2, 0, 4), AggregationMode.MAX10, null);
            fail("InsufficientPixelsException expected");
        } catch (InsufficientPixelsException expected) {
            assertEquals(10, expected.getRequired());
            assertEquals(8, expected.getAvailable());
        }
    }

    @Test
    public void testMaskedPixelsAreNotAggregated() {
        final ArrayPixelMask mask = new ArrayPixelMask(4, 4);
        mask.exclude(2, 3);

        assertArrayEquals(new double[]{6.0, 12.0},
                          aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MEDIAN, mask).getValues(),
                          1.0e-12);
        assertArrayEquals(new double[]{11.0, 22.0},
                          aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX, mask).getValues(),
                          0.0);
        // top ten of 1..11
        assertArrayEquals(new double[]{6.5, 13.0},
                          aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX10, mask).getValues(),
                          1.0e-12);
    }

    @Test
    public void testMaskValuesOtherThanOneAreIncluded() {
        final ArrayPixelMask mask = new ArrayPixelMask(4, 4);
        mask.setValue(2, 3, 2);
        mask.setValue(0, 0, -1);

        assertArrayEquals(new double[]{100.0, 200.0},
                          aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX, mask).getValues(),
                          0.0);
    }

    @Test(expected = InsufficientPixelsException.class)
    public void testMax10AfterMaskingTooManyPixels() {
        final ArrayPixelMask mask = new ArrayPixelMask(4, 4);
        mask.exclude(0, 0);
        mask.exclude(0, 1);
        mask.exclude(0, 2);
        aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MAX10, mask);
    }

    @Test
    public void testFullyMaskedRegionYieldsNaN() {
        final ArrayPixelMask mask = new ArrayPixelMask(4, 4);
        mask.exclude(3, 0);
        final Rectangle singlePixel = RectangleUtils.createRectangle(3, 4, 0, 1);

        for (AggregationMode mode : new AggregationMode[]{AggregationMode.MEDIAN, AggregationMode.MEAN, AggregationMode.MAX}) {
            final Spectrum spectrum = aggregator.computeRegionSpectrum(singlePixel, mode, mask);
            assertTrue(mode.name(), Double.isNaN(spectrum.getValue(0)));
        }
    }

    @Test
    public void testBadBandsAreRemoved() {
        final RegionAggregator filtered =
                new RegionAggregator(image, new BandFilter(new double[]{500.0, 600.0}, new int[]{0, 1}));
        final Spectrum spectrum = filtered.computeRegionSpectrum(upperRectangle, AggregationMode.MAX, null);
        assertArrayEquals(new double[]{600.0}, spectrum.getWavelengths(), 0.0);
        assertArrayEquals(new double[]{200.0}, spectrum.getValues(), 0.0);
    }

    @Test
    public void testGridSpectra() {
        final List<GridCellSpectrum> gridSpectra =
                aggregator.computeGridSpectra(RectangleUtils.createRectangle(0, 2, 0, 4), new GridSpec(1, 2),
                                              AggregationMode.MEDIAN, null);
        assertEquals(2, gridSpectra.size());
        assertEquals(new GridCell(0, 0), gridSpectra.get(0).getGridCell());
        assertEquals(3.5, gridSpectra.get(0).getSpectrum().getValue(0), 1.0e-12);
        assertEquals(new GridCell(0, 1), gridSpectra.get(1).getGridCell());
        assertEquals(5.5, gridSpectra.get(1).getSpectrum().getValue(0), 1.0e-12);
    }

    @Test
    public void testGridSpectraAtFullResolution() {
        final List<GridCellSpectrum> gridSpectra =
                aggregator.computeGridSpectra(upperRectangle, null, AggregationMode.MEDIAN, null);
        assertEquals(12, gridSpectra.size());
        assertEquals(new GridCell(2, 3), gridSpectra.get(11).getGridCell());
        assertEquals(100.0, gridSpectra.get(11).getSpectrum().getValue(0), 0.0);
        assertEquals(new GridCell(1, 0), gridSpectra.get(4).getGridCell());
        assertEquals(5.0, gridSpectra.get(4).getSpectrum().getValue(0), 0.0);
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testGridSpectraWithTruncatedCellsAndFewerLabels() {
        final ArraySpectralImage largeImage = new ArraySpectralImage(20, 10, 2);
        final RegionAggregator largeAggregator =
                new RegionAggregator(largeImage, new BandFilter(new double[]{500.0, 600.0}, new int[]{1, 1}));
        // six truncated cells, four labels
        largeAggregator.computeGridSpectra(RectangleUtils.createRectangle(10, 15, 5, 8), new GridSpec(2, 2),
                                           AggregationMode.MEDIAN, null);
    }

    @Test(expected = LengthMismatchException.class)
    public void testImageWithTooFewBands() {
        new RegionAggregator(image, new BandFilter(new double[]{500.0, 600.0, 700.0}, new int[]{1, 1, 1}));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMaskOfWrongShape() {
        aggregator.computeRegionSpectrum(upperRectangle, AggregationMode.MEDIAN, new ArrayPixelMask(3, 4));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void testRectangleOutsideImage() {
        aggregator.computeRegionSpectrum(RectangleUtils.createRectangle(2, 6, 0, 2), AggregationMode.MEDIAN, null);
    }

    @Test
    public void testRepeatedComputationYieldsIdenticalResults() {
        final ArrayPixelMask mask = new ArrayPixelMask(4, 4);
        mask.exclude(1, 1);
        for (AggregationMode mode : AggregationMode.values()) {
            final Spectrum first = aggregator.computeRegionSpectrum(upperRectangle, mode, mask);
            final Spectrum second = aggregator.computeRegionSpectrum(upperRectangle, mode, mask);
            assertEquals(mode.name(), first, second);
        }
        assertEquals(1.0, image.get(0, 0, 0), 0.0);
    }
}
