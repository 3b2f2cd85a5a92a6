package org.hydresgeo.hprocessing.hydresgeo.config;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

/**
 * Table of whitespace separated values with one header line, as used by the positions, masks and ignore
 * files of the dataset.
 */
public class WhitespaceTable {

    public static final String MEASUREMENT_COLUMN = "measurement";

    private final List<String> columnNames;
    private final List<String[]> rows;

    WhitespaceTable(List<String> columnNames, List<String[]> rows) {
        this.columnNames = ImmutableList.copyOf(columnNames);
        this.rows = ImmutableList.copyOf(rows);
    }

    public static WhitespaceTable read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        } catch (IOException e) {
            throw new IOException("Failed to read table " + path + ": " + e.getMessage(), e);
        }
    }

    public static WhitespaceTable read(Reader reader) throws IOException {
        final BufferedReader bufferedReader = new BufferedReader(reader);
        List<String> columnNames = null;
        List<String[]> rows = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = bufferedReader.readLine()) != null) {
            lineNumber++;
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            final List<String> tokens = tokenize(line);
            if (columnNames == null) {
                columnNames = tokens;
                continue;
            }
            if (tokens.size() != columnNames.size()) {
                throw new IOException("Line " + lineNumber + " has " + tokens.size() + " values, but the header has " +
                                      columnNames.size() + " columns");
            }
            rows.add(tokens.toArray(new String[0]));
        }
        if (columnNames == null) {
            throw new IOException("Table has no header line");
        }
        return new WhitespaceTable(columnNames, rows);
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getRowCount() {
        return rows.size();
    }

    public boolean hasColumn(String columnName) {
        return columnNames.contains(columnName);
    }

    public String getString(int rowIndex, String columnName) {
        return rows.get(rowIndex)[getColumnIndex(columnName)];
    }

    /**
     * @throws NumberFormatException if the cell is not numeric
     */
    public double getDouble(int rowIndex, String columnName) {
        final String value = getString(rowIndex, columnName);
        final Double doubleValue = Doubles.tryParse(value);
        if (doubleValue == null) {
            throw new NumberFormatException("Value '" + value + "' of column '" + columnName + "' is not numeric");
        }
        return doubleValue;
    }

    /**
     * Integer cell value, {@code "10"} and {@code "10.0"} both give 10.
     *
     * @throws NumberFormatException if the cell is not numeric
     */
    public int getInt(int rowIndex, String columnName) {
        final Integer intValue = Ints.tryParse(getString(rowIndex, columnName));
        return intValue != null ? intValue : (int) getDouble(rowIndex, columnName);
    }

    public List<String> getColumn(String columnName) {
        final int columnIndex = getColumnIndex(columnName);
        List<String> values = new ArrayList<>(rows.size());
        for (String[] row : rows) {
            values.add(row[columnIndex]);
        }
        return values;
    }

    /**
     * @return the index of the first row holding the value in the given column, -1 if there is none
     */
    public int findRow(String columnName, String value) {
        if (!hasColumn(columnName)) {
            return -1;
        }
        final int columnIndex = getColumnIndex(columnName);
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i)[columnIndex].equals(value)) {
                return i;
            }
        }
        return -1;
    }

    public int findMeasurementRow(String measurement) {
        return findRow(MEASUREMENT_COLUMN, measurement);
    }

    /**
     * @return whether any cell of the table equals the value
     */
    public boolean containsValue(String value) {
        for (String[] row : rows) {
            for (String cell : row) {
                if (cell.equals(value)) {
                    return true;
                }
            }
        }
        return false;
    }

    private int getColumnIndex(String columnName) {
        final int columnIndex = columnNames.indexOf(columnName);
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Table has no column '" + columnName + "'");
        }
        return columnIndex;
    }

    private static List<String> tokenize(String line) {
        final StringTokenizer st = new StringTokenizer(line);
        List<String> tokens = new ArrayList<>();
        while (st.hasMoreTokens()) {
            tokens.add(st.nextToken());
        }
        return tokens;
    }
}
