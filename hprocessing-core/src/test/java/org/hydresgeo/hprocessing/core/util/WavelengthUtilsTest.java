package org.hydresgeo.hprocessing.core.util;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class WavelengthUtilsTest {

    @Test
    public void testConvertNanometers() {
        assertEquals("300", WavelengthUtils.convertWavelength("300"));
        assertEquals("300", WavelengthUtils.convertWavelength(300.0));
        assertEquals("2400", WavelengthUtils.convertWavelength("2400.7"));
    }

    @Test
    public void testConvertMicrometers() {
        assertEquals("2500", WavelengthUtils.convertWavelength("2.5"));
        assertEquals("2000", WavelengthUtils.convertWavelength(2));
        assertEquals("450", WavelengthUtils.convertWavelength(" 0.45 "));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testValueBetweenUnits() {
        WavelengthUtils.convertWavelength("10");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNotANumber() {
        WavelengthUtils.convertWavelength("nm");
    }
}
