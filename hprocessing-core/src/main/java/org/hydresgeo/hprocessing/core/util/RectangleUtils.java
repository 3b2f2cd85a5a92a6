package org.hydresgeo.hprocessing.core.util;

import org.hydresgeo.hprocessing.core.DegenerateGeometryException;

import java.awt.Rectangle;

/**
 * Conversion between half-open row/column edges and {@link Rectangle}s.
 * The rectangle's {@code y} axis holds image rows, its {@code x} axis image columns.
 */
public class RectangleUtils {

    private RectangleUtils() {
    }

    /**
     * Creates the rectangle covering rows {@code [rowStart, rowEnd)} and columns {@code [colStart, colEnd)}.
     *
     * @throws DegenerateGeometryException if the rectangle would hold no pixel
     */
    public static Rectangle createRectangle(int rowStart, int rowEnd, int colStart, int colEnd) {
        if (rowStart >= rowEnd || colStart >= colEnd) {
            throw new DegenerateGeometryException("Rectangle [" + rowStart + ", " + rowEnd + ", " + colStart + ", " +
                                                  colEnd + "] holds no pixels");
        }
        return new Rectangle(colStart, rowStart, colEnd - colStart, rowEnd - rowStart);
    }

    /**
     * @return {@code {rowStart, rowEnd, colStart, colEnd}}
     */
    public static int[] toEdges(Rectangle rectangle) {
        return new int[]{
                rectangle.y,
                rectangle.y + rectangle.height,
                rectangle.x,
                rectangle.x + rectangle.width
        };
    }

    public static String toEdgeString(Rectangle rectangle) {
        final int[] edges = toEdges(rectangle);
        return "[" + edges[0] + ", " + edges[1] + ", " + edges[2] + ", " + edges[3] + "]";
    }
}
