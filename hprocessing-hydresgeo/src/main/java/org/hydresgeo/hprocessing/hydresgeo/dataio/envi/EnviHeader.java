package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Ints;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Key/value content of an ENVI header file. Keys are stored lower case, so lookups are case-insensitive.
 * Values given in braces are additionally available as comma separated lists.
 */
public class EnviHeader {

    public static final String SAMPLES = "samples";
    public static final String LINES = "lines";
    public static final String BANDS = "bands";
    public static final String HEADER_OFFSET = "header offset";
    public static final String DATA_TYPE = "data type";
    public static final String INTERLEAVE = "interleave";
    public static final String BYTE_ORDER = "byte order";
    public static final String WAVELENGTH = "wavelength";
    public static final String BAD_BAND_LIST = "bbl";
    public static final String DESCRIPTION = "description";

    private final Map<String, String> values;
    private final Map<String, List<String>> lists;

    EnviHeader(Map<String, String> values, Map<String, List<String>> lists) {
        this.values = ImmutableMap.copyOf(values);
        this.lists = ImmutableMap.copyOf(lists);
    }

    public boolean containsKey(String key) {
        return values.containsKey(normalize(key));
    }

    /**
     * @return the raw value, braces removed, or {@code null} if the key is absent
     */
    public String getString(String key) {
        return values.get(normalize(key));
    }

    /**
     * @return the comma separated items of a braced value, a single item list for plain values,
     * an empty list if the key is absent
     */
    public List<String> getList(String key) {
        final String normalizedKey = normalize(key);
        if (lists.containsKey(normalizedKey)) {
            return lists.get(normalizedKey);
        }
        final String value = values.get(normalizedKey);
        return value == null ? ImmutableList.of() : ImmutableList.of(value);
    }

    public int getInt(String key) throws IOException {
        final String value = getString(key);
        if (value == null) {
            throw new IOException("ENVI header does not contain '" + key + "'");
        }
        final Integer intValue = Ints.tryParse(value.trim());
        if (intValue == null) {
            throw new IOException("ENVI header value of '" + key + "' is not an integer: " + value);
        }
        return intValue;
    }

    public int getInt(String key, int defaultValue) throws IOException {
        return containsKey(key) ? getInt(key) : defaultValue;
    }

    public int getSamples() throws IOException {
        return getInt(SAMPLES);
    }

    public int getLines() throws IOException {
        return getInt(LINES);
    }

    public int getBands() throws IOException {
        return getInt(BANDS);
    }

    public int getHeaderOffset() throws IOException {
        return getInt(HEADER_OFFSET, 0);
    }

    public int getDataType() throws IOException {
        return getInt(DATA_TYPE);
    }

    public String getInterleave() {
        final String interleave = getString(INTERLEAVE);
        return interleave == null ? "bsq" : interleave.trim().toLowerCase(Locale.ENGLISH);
    }

    public int getByteOrder() throws IOException {
        return getInt(BYTE_ORDER, 0);
    }

    public List<String> getWavelengths() {
        return getList(WAVELENGTH);
    }

    public List<String> getBadBandList() {
        return getList(BAD_BAND_LIST);
    }

    public String getDescription() {
        return getString(DESCRIPTION);
    }

    static String normalize(String key) {
        return key.trim().toLowerCase(Locale.ENGLISH);
    }
}
