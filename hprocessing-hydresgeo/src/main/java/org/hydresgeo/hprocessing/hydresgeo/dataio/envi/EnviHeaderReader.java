package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import com.google.common.base.Splitter;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reader for ENVI header ({@code .hdr}) files.
 * <p>
 * The first line must read {@code ENVI}. Every further entry is a {@code key = value} pair; values enclosed
 * in braces may span several lines. Lines starting with {@code ;} are comments.
 */
public class EnviHeaderReader {

    private static final String MAGIC = "ENVI";
    private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

    private EnviHeaderReader() {
    }

    public static EnviHeader readHeader(Path headerPath) throws IOException {
        try (Reader reader = Files.newBufferedReader(headerPath, StandardCharsets.UTF_8)) {
            return readHeader(reader);
        } catch (IOException e) {
            throw new IOException("Failed to read ENVI header " + headerPath + ": " + e.getMessage(), e);
        }
    }

    public static EnviHeader readHeader(Reader reader) throws IOException {
        final BufferedReader bufferedReader = new BufferedReader(reader);
        String line = bufferedReader.readLine();
        if (line == null || !line.trim().startsWith(MAGIC)) {
            throw new IOException("Not an ENVI header, first line must be '" + MAGIC + "'");
        }

        Map<String, String> values = new HashMap<>();
        Map<String, List<String>> lists = new HashMap<>();
        while ((line = bufferedReader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            final int equalsIndex = line.indexOf('=');
            if (equalsIndex < 0) {
                throw new IOException("Malformed ENVI header line: " + line);
            }
            final String key = EnviHeader.normalize(line.substring(0, equalsIndex));
            String value = line.substring(equalsIndex + 1).trim();

            if (value.startsWith("{")) {
                StringBuilder braced = new StringBuilder(value);
                while (!value.endsWith("}")) {
                    value = bufferedReader.readLine();
                    if (value == null) {
                        throw new IOException("Unterminated value of ENVI header key '" + key + "'");
                    }
                    value = value.trim();
                    braced.append('\n').append(value);
                }
                final String content = braced.substring(1, braced.length() - 1).trim();
                values.put(key, content);
                lists.put(key, LIST_SPLITTER.splitToList(content.replace('\n', ' ')));
            } else {
                values.put(key, value);
            }
        }
        return new EnviHeader(values, lists);
    }
}
