package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import org.junit.Test;

import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.Assert.assertEquals;

public class EnviAcquisitionTimeTest {

    @Test
    public void testFormatTime() {
        assertEquals("6:02:24", EnviAcquisitionTime.formatTime("6:02:24", "A"));
        assertEquals("18:02:24", EnviAcquisitionTime.formatTime("6:02:24", "P"));
        assertEquals("18:02:24", EnviAcquisitionTime.formatTime("6:02:24", "PM"));
        assertEquals("12:30:00", EnviAcquisitionTime.formatTime("12:30:00", "P"));
        assertEquals("10:02:24", EnviAcquisitionTime.formatTime("10:02:24", "AM"));
    }

    @Test
    public void testParseDescription() throws IOException {
        final EnviAcquisitionTime time = EnviAcquisitionTime.parse("Date: 05/17/2017,\nTime: 6:02:24.34 P,\nfoo");

        assertEquals("20170517", time.getDate());
        assertEquals("18:02:24", time.getTime());
    }

    @Test
    public void testMorningCapture() throws IOException {
        final EnviAcquisitionTime time = EnviAcquisitionTime.parse("Date: 08/15/2017,\nTime: 9:45:10.00 A,");

        assertEquals("20170815", time.getDate());
        assertEquals("9:45:10", time.getTime());
        assertEquals(OffsetDateTime.of(2017, 8, 15, 9, 45, 10, 0, ZoneOffset.ofHours(2)),
                     time.toOffsetDateTime(EnviAcquisitionTime.DEFAULT_ZONE_OFFSET));
    }

    @Test
    public void testToOffsetDateTime() throws IOException {
        final EnviAcquisitionTime time = EnviAcquisitionTime.parse("Date: 05/17/2017,\nTime: 6:02:24.34 P,");

        final OffsetDateTime dateTime = time.toOffsetDateTime(ZoneOffset.ofHours(2));
        assertEquals(OffsetDateTime.of(2017, 5, 17, 16, 2, 24, 0, ZoneOffset.UTC).toInstant(), dateTime.toInstant());
    }

    @Test(expected = IOException.class)
    public void testMissingTimeLine() throws IOException {
        EnviAcquisitionTime.parse("Date: 05/17/2017,");
    }

    @Test(expected = IOException.class)
    public void testInvalidDate() throws IOException {
        EnviAcquisitionTime.parse("Datum: 17.05.2017,\nTime: 6:02:24.34 P,");
    }
}
