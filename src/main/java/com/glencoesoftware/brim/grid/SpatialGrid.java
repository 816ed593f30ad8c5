/*
 * Copyright (C) 2025 Glencoe Software, Inc. All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package com.glencoesoftware.brim.grid;

import com.glencoesoftware.brim.store.NdArray;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * A dense, regular image reconstructed from stored data. The leading
 * dimensions are the spatial axes, any further dimension (frequency, matrix
 * rows and columns) trails them. Cells without data hold {@link Double#NaN}.
 */
public final class SpatialGrid {

    private final double[] values;

    private final int[] shape;

    private final List<Axis> axes;

    private final double[] pixelSize;

    private final String pixelUnits;

    private final String units;

    public SpatialGrid(double[] values, int[] shape, List<Axis> axes, double[] pixelSize,
        String pixelUnits, String units) {
        if (NdArray.length(shape) != values.length) {
            throw new IllegalArgumentException(String.format(
                "%d values do not fill shape %s", values.length, Arrays.toString(shape)));
        }
        if (axes.size() > shape.length || axes.size() != pixelSize.length) {
            throw new IllegalArgumentException(
                "Axes " + axes + " do not match pixel size " + Arrays.toString(pixelSize)
                + " and shape " + Arrays.toString(shape));
        }
        this.values = values;
        this.shape = shape.clone();
        this.axes = Collections.unmodifiableList(axes);
        this.pixelSize = pixelSize.clone();
        this.pixelUnits = pixelUnits;
        this.units = units;
    }

    /**
     * Flat, row-major values. The array is owned by this grid and is not
     * shared with any other grid.
     */
    public double[] getValues() {
        return values;
    }

    public int[] getShape() {
        return shape.clone();
    }

    /** Shape of the spatial dimensions only. */
    public int[] getSpatialShape() {
        return Arrays.copyOf(shape, axes.size());
    }

    public List<Axis> getAxes() {
        return axes;
    }

    /** Pixel size per spatial axis, 0 for an axis collapsed to a single line. */
    public double[] getPixelSize() {
        return pixelSize.clone();
    }

    public String getPixelUnits() {
        return pixelUnits;
    }

    /** Units of the values. */
    public String getUnits() {
        return units;
    }

    /**
     * Returns one value.
     *
     * @param index index along every dimension
     * @return See above.
     */
    public double get(int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected an index of rank " + shape.length + ": " + Arrays.toString(index));
        }
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    Arrays.toString(index) + " outside " + Arrays.toString(shape));
            }
        }
        return values[NdArray.flatIndex(shape, index)];
    }

    @Override
    public String toString() {
        return "SpatialGrid{shape=" + Arrays.toString(shape) + ", axes=" + axes
            + ", pixelSize=" + Arrays.toString(pixelSize) + ' ' + pixelUnits
            + ", units=" + units + '}';
    }
}
