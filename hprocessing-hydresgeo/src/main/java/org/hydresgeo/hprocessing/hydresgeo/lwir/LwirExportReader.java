package org.hydresgeo.hprocessing.hydresgeo.lwir;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the temperature matrix of an LWIR camera CSV export. Values are separated by {@code ;} or
 * {@code ,}; lines that are not fully numeric, like export headers, are skipped.
 */
public class LwirExportReader {

    private static final Splitter VALUE_SPLITTER = Splitter.on(CharMatcher.anyOf(";,")).trimResults();

    private LwirExportReader() {
    }

    public static double[][] read(Path csvFile) throws IOException {
        try (Reader reader = Files.newBufferedReader(csvFile, StandardCharsets.ISO_8859_1)) {
            return read(reader);
        } catch (IOException e) {
            throw new IOException("Failed to read LWIR export " + csvFile + ": " + e.getMessage(), e);
        }
    }

    public static double[][] read(Reader reader) throws IOException {
        final BufferedReader bufferedReader = new BufferedReader(reader);
        List<double[]> rows = new ArrayList<>();
        String line;
        while ((line = bufferedReader.readLine()) != null) {
            final double[] row = parseRow(line);
            if (row != null) {
                rows.add(row);
            }
        }
        return rows.toArray(new double[0][]);
    }

    static double[] parseRow(String line) {
        List<String> tokens = new ArrayList<>(VALUE_SPLITTER.splitToList(line));
        // trailing separator
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).isEmpty()) {
            tokens.remove(tokens.size() - 1);
        }
        if (tokens.isEmpty()) {
            return null;
        }
        final double[] values = new double[tokens.size()];
        for (int i = 0; i < values.length; i++) {
            final Double value = Doubles.tryParse(tokens.get(i));
            if (value == null) {
                return null;
            }
            values[i] = value;
        }
        return values;
    }
}
