package org.hydresgeo.hprocessing.hydresgeo.dataio.envi;

import org.hydresgeo.hprocessing.core.datamodel.ArraySpectralImage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a raw ENVI image cube fully into memory.
 *
 * @see EnviHeader
 */
public class EnviImageReader {

    public static final String HEADER_EXTENSION = ".hdr";
    public static final String IMAGE_EXTENSION = ".cue";

    private EnviImageReader() {
    }

    /**
     * @return the image file next to the header, {@code Auto017.hdr} gives {@code Auto017.cue}
     */
    public static Path getImagePath(Path headerPath) {
        final String fileName = headerPath.getFileName().toString();
        final String baseName = fileName.endsWith(HEADER_EXTENSION)
                ? fileName.substring(0, fileName.length() - HEADER_EXTENSION.length())
                : fileName;
        return headerPath.resolveSibling(baseName + IMAGE_EXTENSION);
    }

    public static ArraySpectralImage readImage(Path headerPath) throws IOException {
        return readImage(EnviHeaderReader.readHeader(headerPath), getImagePath(headerPath));
    }

    /**
     * Reads the cube described by the header.
     *
     * @param header    the header giving dimensions, data type, interleave and byte order
     * @param imagePath the raw image file
     * @return image indexed as {@code [line, sample, band]}
     * @throws IOException if the file cannot be read, is too short, or uses an unsupported layout
     */
    public static ArraySpectralImage readImage(EnviHeader header, Path imagePath) throws IOException {
        final int lines = header.getLines();
        final int samples = header.getSamples();
        final int bands = header.getBands();
        final DataType dataType = DataType.fromCode(header.getDataType());
        final Interleave interleave = Interleave.fromName(header.getInterleave());
        final ByteOrder byteOrder = getByteOrder(header.getByteOrder());
        final int headerOffset = header.getHeaderOffset();

        final long valueCount = (long) lines * samples * bands;
        final long requiredSize = headerOffset + valueCount * dataType.size;
        final long fileSize = Files.size(imagePath);
        if (fileSize < requiredSize) {
            throw new IOException("ENVI image " + imagePath + " has " + fileSize + " bytes, but " + requiredSize +
                                  " bytes are required for " + lines + "x" + samples + "x" + bands + " " +
                                  dataType + " values");
        }

        final ByteBuffer buffer = ByteBuffer.wrap(Files.readAllBytes(imagePath)).order(byteOrder);
        ArraySpectralImage image = new ArraySpectralImage(lines, samples, bands);
        for (int line = 0; line < lines; line++) {
            for (int sample = 0; sample < samples; sample++) {
                for (int band = 0; band < bands; band++) {
                    final long index = interleave.getIndex(line, sample, band, lines, samples, bands);
                    final int position = (int) (headerOffset + index * dataType.size);
                    image.set(line, sample, band, dataType.read(buffer, position));
                }
            }
        }
        return image;
    }

    private static ByteOrder getByteOrder(int code) throws IOException {
        switch (code) {
            case 0:
                return ByteOrder.LITTLE_ENDIAN;
            case 1:
                return ByteOrder.BIG_ENDIAN;
            default:
                throw new IOException("Unsupported ENVI byte order " + code);
        }
    }

    enum Interleave {
        BSQ {
            @Override
            long getIndex(int line, int sample, int band, int lines, int samples, int bands) {
                return ((long) band * lines + line) * samples + sample;
            }
        },
        BIL {
            @Override
            long getIndex(int line, int sample, int band, int lines, int samples, int bands) {
                return ((long) line * bands + band) * samples + sample;
            }
        },
        BIP {
            @Override
            long getIndex(int line, int sample, int band, int lines, int samples, int bands) {
                return ((long) line * samples + sample) * bands + band;
            }
        };

        abstract long getIndex(int line, int sample, int band, int lines, int samples, int bands);

        static Interleave fromName(String name) throws IOException {
            for (Interleave interleave : values()) {
                if (interleave.name().equalsIgnoreCase(name)) {
                    return interleave;
                }
            }
            throw new IOException("Unsupported ENVI interleave '" + name + "'");
        }
    }

    enum DataType {
        BYTE(1, 1) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.get(position) & 0xFF;
            }
        },
        INT16(2, 2) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getShort(position);
            }
        },
        INT32(3, 4) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getInt(position);
            }
        },
        FLOAT32(4, 4) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getFloat(position);
            }
        },
        FLOAT64(5, 8) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getDouble(position);
            }
        },
        UINT16(12, 2) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getShort(position) & 0xFFFF;
            }
        },
        UINT32(13, 4) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getInt(position) & 0xFFFFFFFFL;
            }
        },
        INT64(14, 8) {
            @Override
            double read(ByteBuffer buffer, int position) {
                return buffer.getLong(position);
            }
        },
        UINT64(15, 8) {
            @Override
            double read(ByteBuffer buffer, int position) {
                final long value = buffer.getLong(position);
                return value >= 0 ? value : (value >>> 1) * 2.0 + (value & 1);
            }
        };

        private final int code;
        private final int size;

        DataType(int code, int size) {
            this.code = code;
            this.size = size;
        }

        abstract double read(ByteBuffer buffer, int position);

        static DataType fromCode(int code) throws IOException {
            for (DataType dataType : values()) {
                if (dataType.code == code) {
                    return dataType;
                }
            }
            throw new IOException("Unsupported ENVI data type " + code);
        }
    }
}
