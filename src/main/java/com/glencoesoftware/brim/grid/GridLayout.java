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

import com.glencoesoftware.brim.exceptions.DuplicateCoordinateException;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.store.NdArray;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.perf4j.StopWatch;
import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.LoggerFactory;

/**
 * Maps the cells of a dense regular grid to the stored samples of a data
 * group. Dense data is stored on the grid already; sparse data is stored as
 * a list of samples and each grid cell refers to at most one of them.
 */
public final class GridLayout {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(GridLayout.class);

    private final List<Axis> axes;

    private final int[] shape;

    private final double[] pixelSize;

    private final String pixelUnits;

    /** Sample stored for each grid cell, -1 if none; {@code null} when dense. */
    private final int[] cellToSample;

    /** Further samples which landed on an already occupied cell. */
    private final ListMultimap<Integer, Integer> duplicates;

    private final int sampleCount;

    private GridLayout(List<Axis> axes, int[] shape, double[] pixelSize, String pixelUnits,
        int[] cellToSample, ListMultimap<Integer, Integer> duplicates, int sampleCount) {
        if (axes.size() != shape.length || axes.size() != pixelSize.length) {
            throw new IllegalArgumentException("Axes " + axes + " do not match shape "
                + Arrays.toString(shape) + " and pixel size " + Arrays.toString(pixelSize));
        }
        this.axes = new ArrayList<>(axes);
        this.shape = shape.clone();
        this.pixelSize = pixelSize.clone();
        this.pixelUnits = pixelUnits;
        this.cellToSample = cellToSample;
        this.duplicates = duplicates;
        this.sampleCount = sampleCount;
    }

    /**
     * Layout of data stored directly on the grid.
     *
     * @param axes       spatial axes, in storage order
     * @param shape      extent along each axis
     * @param pixelSize  spacing along each axis
     * @param pixelUnits units of the spacing
     * @return See above.
     */
    public static GridLayout dense(List<Axis> axes, int[] shape, double[] pixelSize,
        String pixelUnits) {
        return new GridLayout(axes, shape, pixelSize, pixelUnits, null,
            ArrayListMultimap.create(), (int) NdArray.length(shape));
    }

    /**
     * Layout of sparse data given, for every cell, the index of its sample or
     * -1 when the cell has none.
     *
     * @param axes         spatial axes of the grid
     * @param shape        grid extent
     * @param pixelSize    spacing along each axis
     * @param pixelUnits   units of the spacing
     * @param cellToSample sample per cell, row-major
     * @param sampleCount  number of stored samples
     * @return See above.
     */
    public static GridLayout indexed(List<Axis> axes, int[] shape, double[] pixelSize,
        String pixelUnits, int[] cellToSample, int sampleCount) {
        if (cellToSample.length != NdArray.length(shape)) {
            throw new IllegalArgumentException(String.format(
                "Index map of %d cells does not match shape %s",
                cellToSample.length, Arrays.toString(shape)));
        }
        for (int sample : cellToSample) {
            if (sample < -1 || sample >= sampleCount) {
                throw new IllegalArgumentException(String.format(
                    "Index map refers to sample %d, only %d are stored", sample, sampleCount));
            }
        }
        return new GridLayout(axes, shape, pixelSize, pixelUnits, cellToSample.clone(),
            ArrayListMultimap.create(), sampleCount);
    }

    static GridLayout sparse(List<Axis> axes, int[] shape, double[] pixelSize,
        String pixelUnits, int[] cellToSample, ListMultimap<Integer, Integer> duplicates,
        int sampleCount) {
        return new GridLayout(axes, shape, pixelSize, pixelUnits, cellToSample, duplicates,
            sampleCount);
    }

    public List<Axis> getAxes() {
        return new ArrayList<>(axes);
    }

    public int[] getShape() {
        return shape.clone();
    }

    public double[] getPixelSize() {
        return pixelSize.clone();
    }

    public String getPixelUnits() {
        return pixelUnits;
    }

    public boolean isSparse() {
        return cellToSample != null;
    }

    /** Number of samples along the leading dimension(s) of stored arrays. */
    public int getSampleCount() {
        return sampleCount;
    }

    /** Shape of the leading, spatial part of stored arrays. */
    public int[] getStoredSpatialShape() {
        return isSparse() ? new int[] { sampleCount } : shape.clone();
    }

    /**
     * Resolves a grid index to the stored samples of its cell, including
     * any further samples which landed on the same cell.
     *
     * @param index grid index, one entry per axis
     * @return See above.
     * @throws IndexOutOfRangeException if the index lies outside the grid
     */
    public GridCell cell(int... index) throws IndexOutOfRangeException {
        GridCell.checkIndex(index, shape, axes);
        int rank = getStoredSpatialShape().length;
        if (!isSparse()) {
            return new GridCell(index, Collections.singletonList(index.clone()), rank);
        }
        int flat = NdArray.flatIndex(shape, index);
        int sample = cellToSample[flat];
        List<int[]> offsets = new ArrayList<>();
        if (sample >= 0) {
            offsets.add(new int[] { sample });
            for (int other : duplicates.get(flat)) {
                offsets.add(new int[] { other });
            }
        }
        return new GridCell(index, offsets, rank);
    }

    /**
     * Places stored values on the grid. The leading dimensions of
     * {@code stored} follow {@link #getStoredSpatialShape()}; any trailing
     * dimensions are carried over to the result.
     *
     * @param stored stored values
     * @param units  units of the values
     * @return a newly allocated grid, NaN where no sample exists
     * @throws DuplicateCoordinateException if two samples on the same cell
     *                                      differ
     */
    public SpatialGrid scatter(NdArray stored, String units)
        throws DuplicateCoordinateException {
        int[] storedShape = stored.getShape();
        int[] leading = getStoredSpatialShape();
        if (storedShape.length < leading.length
            || !Arrays.equals(Arrays.copyOf(storedShape, leading.length), leading)) {
            throw new IllegalArgumentException(String.format(
                "Stored shape %s does not start with %s",
                Arrays.toString(storedShape), Arrays.toString(leading)));
        }
        int[] trailing = Arrays.copyOfRange(storedShape, leading.length, storedShape.length);
        int[] gridShape = new int[shape.length + trailing.length];
        System.arraycopy(shape, 0, gridShape, 0, shape.length);
        System.arraycopy(trailing, 0, gridShape, shape.length, trailing.length);

        if (!isSparse()) {
            double[] values = stored.asDoubles();
            if (values == stored.getData()) {
                values = values.clone();
            }
            return new SpatialGrid(values, gridShape, axes, pixelSize, pixelUnits, units);
        }

        StopWatch t0 = new Slf4JStopWatch("GridLayout.scatter()");
        try {
            int block = (int) NdArray.length(trailing);
            double[] values = new double[cellToSample.length * block];
            Arrays.fill(values, Double.NaN);
            for (int cell = 0; cell < cellToSample.length; cell++) {
                int sample = cellToSample[cell];
                if (sample < 0) {
                    continue;
                }
                for (int i = 0; i < block; i++) {
                    values[cell * block + i] = stored.getDouble(sample * block + i);
                }
            }
            int identical = 0;
            for (Integer cell : duplicates.keySet()) {
                int first = cellToSample[cell];
                for (int other : duplicates.get(cell)) {
                    for (int i = 0; i < block; i++) {
                        double a = stored.getDouble(first * block + i);
                        double b = stored.getDouble(other * block + i);
                        if (Double.doubleToLongBits(a) != Double.doubleToLongBits(b)) {
                            throw new DuplicateCoordinateException(String.format(
                                "Samples %d and %d share grid cell %s with different values"
                                + " (%s != %s)", first, other,
                                Arrays.toString(cellIndex(cell)), a, b));
                        }
                    }
                    identical++;
                }
            }
            if (identical > 0) {
                log.warn("{} sample(s) share a grid cell with an identical sample", identical);
            }
            return new SpatialGrid(values, gridShape, axes, pixelSize, pixelUnits, units);
        } finally {
            t0.stop();
        }
    }

    private int[] cellIndex(int flat) {
        int[] index = new int[shape.length];
        for (int i = shape.length - 1; i >= 0; i--) {
            index[i] = flat % shape[i];
            flat /= shape[i];
        }
        return index;
    }

    @Override
    public String toString() {
        return "GridLayout{axes=" + axes + ", shape=" + Arrays.toString(shape)
            + ", pixelSize=" + Arrays.toString(pixelSize) + ' ' + pixelUnits
            + ", sparse=" + isSparse() + '}';
    }
}
