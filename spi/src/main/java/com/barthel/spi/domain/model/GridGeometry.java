package com.barthel.spi.domain.model;

/**
 * Placement of a raster in its coordinate reference system.
 *
 * @param originX  x coordinate of the western edge of the first column
 * @param originY  y coordinate of the northern edge of the first row
 * @param cellSize edge length of a square cell
 * @param width    number of columns
 * @param height   number of rows
 */
public record GridGeometry(double originX, double originY, double cellSize, int width, int height) {
    public GridGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive");
        }
        if (!(cellSize > 0)) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
    }

    /**
     * Unit cell geometry anchored at the origin, for grids without a georeference.
     */
    public static GridGeometry ofSize(int width, int height) {
        return new GridGeometry(0.0, 0.0, 1.0, width, height);
    }

    public int cellCount() {
        return width * height;
    }

    public boolean sameShape(GridGeometry other) {
        return width == other.width && height == other.height;
    }
}
