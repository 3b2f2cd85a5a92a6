package org.hydresgeo.hprocessing.core.datamodel;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class ArrayPixelMaskTest {

    @Test
    public void testRasterIsCopied() {
        final int[][] raster = {{0, 1, 0}, {0, 0, 2}};
        final ArrayPixelMask mask = new ArrayPixelMask(raster);

        raster[0][0] = 1;
        assertFalse(mask.isExcluded(0, 0));

        mask.exclude(1, 0);
        assertEquals(0, raster[1][0]);

        assertEquals(2, mask.getRowCount());
        assertEquals(3, mask.getColumnCount());
        assertTrue(mask.isExcluded(0, 1));
        assertFalse(mask.isExcluded(1, 2));
        assertEquals(2, mask.getExcludedPixelCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedRaster() {
        new ArrayPixelMask(new int[][]{{0, 0}, {0}});
    }

    @Test
    public void testSetValue() {
        final ArrayPixelMask mask = new ArrayPixelMask(2, 2);
        assertEquals(0, mask.getExcludedPixelCount());

        mask.setValue(1, 1, 1);
        assertEquals(1, mask.getValue(1, 1));
        assertTrue(mask.isExcluded(1, 1));
    }
}
