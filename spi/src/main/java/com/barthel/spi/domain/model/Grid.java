package com.barthel.spi.domain.model;

import com.barthel.spi.domain.exception.SpiConfigurationException;

import java.util.Arrays;

/**
 * Immutable two-dimensional raster of scalar values stored row-major.
 * <p>
 * {@link #UNDEFINED} marks a cell without a value: a masked pixel in an input grid
 * or an index cell that cannot be computed.
 */
public final class Grid {

    public static final double UNDEFINED = Double.NaN;

    private final GridGeometry geometry;
    private final double[] values;

    public Grid(GridGeometry geometry, double[] values) {
        if (geometry == null || values == null) {
            throw new IllegalArgumentException("Geometry and values are required");
        }
        if (values.length != geometry.cellCount()) {
            throw new IllegalArgumentException("Expected " + geometry.cellCount()
                    + " values for a " + geometry.width() + "x" + geometry.height() + " grid, got " + values.length);
        }
        this.geometry = geometry;
        this.values = values.clone();
    }

    public static Grid filled(GridGeometry geometry, double value) {
        double[] values = new double[geometry.cellCount()];
        Arrays.fill(values, value);
        return new Grid(geometry, values);
    }

    public GridGeometry geometry() {
        return geometry;
    }

    public int width() {
        return geometry.width();
    }

    public int height() {
        return geometry.height();
    }

    public int cellCount() {
        return values.length;
    }

    public double get(int row, int col) {
        return values[row * geometry.width() + col];
    }

    public double cell(int index) {
        return values[index];
    }

    public double[] values() {
        return values.clone();
    }

    public static boolean isDefined(double value) {
        return !Double.isNaN(value);
    }

    public int definedCellCount() {
        int count = 0;
        for (double v : values) {
            if (isDefined(v)) {
                count++;
            }
        }
        return count;
    }

    public Grid scale(double factor) {
        double[] scaled = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factor;
        }
        return new Grid(geometry, scaled);
    }

    /**
     * Sub-grid of the cells touched by the extent. Cells are kept whole, so the result may
     * reach slightly beyond the extent edges.
     *
     * @throws SpiConfigurationException if the extent does not intersect the grid
     */
    public Grid clip(SpatialExtent extent) {
        double cs = geometry.cellSize();
        int colFrom = Math.max(0, (int) Math.floor((extent.minX() - geometry.originX()) / cs));
        int colTo = Math.min(geometry.width(), (int) Math.ceil((extent.maxX() - geometry.originX()) / cs));
        int rowFrom = Math.max(0, (int) Math.floor((geometry.originY() - extent.maxY()) / cs));
        int rowTo = Math.min(geometry.height(), (int) Math.ceil((geometry.originY() - extent.minY()) / cs));
        if (colFrom >= colTo || rowFrom >= rowTo) {
            throw new SpiConfigurationException("Spatial extent " + extent + " does not intersect grid " + geometry);
        }
        if (colFrom == 0 && rowFrom == 0 && colTo == geometry.width() && rowTo == geometry.height()) {
            return this;
        }

        int width = colTo - colFrom;
        int height = rowTo - rowFrom;
        double[] clipped = new double[width * height];
        for (int row = 0; row < height; row++) {
            System.arraycopy(values, (rowFrom + row) * geometry.width() + colFrom, clipped, row * width, width);
        }
        GridGeometry clippedGeometry = new GridGeometry(
                geometry.originX() + colFrom * cs,
                geometry.originY() - rowFrom * cs,
                cs, width, height);
        return new Grid(clippedGeometry, clipped);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid other)) return false;
        return geometry.equals(other.geometry) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * geometry.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Grid[" + geometry.width() + "x" + geometry.height() + "]";
    }
}
