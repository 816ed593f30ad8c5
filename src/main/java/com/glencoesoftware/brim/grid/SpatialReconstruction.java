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

import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.IrregularGridException;
import com.glencoesoftware.brim.store.NdArray;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * Derives a regular grid from scan coordinates.
 *
 * <p>Along each axis the coordinates are grouped into grid lines, values
 * closer than {@code relativeTolerance} times the axis range falling on the
 * same line. The spacing is the smallest distance between two lines and the
 * extent is {@code range / spacing + 1}. An axis with a single line collapses
 * to one pixel with a spacing of 0. Every coordinate must then sit within
 * {@code integerTolerance} pixels of a grid position.</p>
 *
 * <p>Reconstruction holds no state; identical coordinates always produce an
 * identical layout.</p>
 */
public final class SpatialReconstruction {

    private static final org.slf4j.Logger log =
        LoggerFactory.getLogger(SpatialReconstruction.class);

    /** Largest number of cells a reconstructed grid may have. */
    static final long MAX_CELLS = Integer.MAX_VALUE - 8;

    private final double relativeTolerance;

    private final double integerTolerance;

    public SpatialReconstruction(double relativeTolerance, double integerTolerance) {
        this.relativeTolerance = relativeTolerance;
        this.integerTolerance = integerTolerance;
    }

    /**
     * Builds the grid layout of sparse samples.
     *
     * @param axes        the axes coordinates are given for
     * @param coordinates one array per axis, each holding one coordinate per
     *                    sample
     * @param units       units of the coordinates
     * @return See above.
     * @throws IrregularGridException if the coordinates do not lie on a
     *                                regular grid
     */
    public GridLayout reconstruct(List<Axis> axes, double[][] coordinates, String units)
        throws IrregularGridException {
        AxisGrid[] grids = resolveAxes(axes, coordinates);
        int samples = sampleCount(coordinates);
        int[] shape = shape(grids);
        double[] pixelSize = new double[grids.length];
        for (int a = 0; a < grids.length; a++) {
            pixelSize[a] = grids[a].spacing;
        }

        int[] cellToSample = new int[(int) NdArray.length(shape)];
        Arrays.fill(cellToSample, -1);
        ListMultimap<Integer, Integer> duplicates = ArrayListMultimap.create();
        int[] index = new int[axes.size()];
        for (int s = 0; s < samples; s++) {
            for (int a = 0; a < index.length; a++) {
                index[a] = grids[a].positions[s];
            }
            int cell = NdArray.flatIndex(shape, index);
            if (cellToSample[cell] < 0) {
                cellToSample[cell] = s;
            } else {
                duplicates.put(cell, s);
            }
        }
        if (!duplicates.isEmpty()) {
            log.debug("{} samples share a grid cell with another sample", duplicates.size());
        }
        log.debug("Reconstructed grid of shape {} pixel size {} from {} samples",
            Arrays.toString(shape), Arrays.toString(pixelSize), samples);
        return GridLayout.sparse(axes, shape, pixelSize, units, cellToSample, duplicates,
            samples);
    }

    /**
     * Finds the samples on one cell of the grid derived from scan
     * coordinates, without allocating the grid. The grid is the one
     * {@link #reconstruct(List, double[][], String)} builds.
     *
     * @param axes        the axes coordinates are given for
     * @param coordinates one array per axis, each holding one coordinate per
     *                    sample
     * @param index       grid index, one entry per axis
     * @return See above.
     * @throws IrregularGridException   if the coordinates do not lie on a
     *                                  regular grid
     * @throws IndexOutOfRangeException if the index lies outside the grid
     */
    public GridCell locate(List<Axis> axes, double[][] coordinates, int... index)
        throws IrregularGridException, IndexOutOfRangeException {
        AxisGrid[] grids = resolveAxes(axes, coordinates);
        GridCell.checkIndex(index, shape(grids), axes);
        List<int[]> offsets = new ArrayList<>();
        int samples = sampleCount(coordinates);
        for (int s = 0; s < samples; s++) {
            boolean match = true;
            for (int a = 0; a < grids.length && match; a++) {
                match = grids[a].positions[s] == index[a];
            }
            if (match) {
                offsets.add(new int[] { s });
            }
        }
        return new GridCell(index, offsets, 1);
    }

    private static int sampleCount(double[][] coordinates) {
        return coordinates.length == 0 ? 0 : coordinates[0].length;
    }

    private static int[] shape(AxisGrid[] grids) {
        int[] shape = new int[grids.length];
        for (int a = 0; a < grids.length; a++) {
            shape[a] = grids[a].extent;
        }
        return shape;
    }

    private AxisGrid[] resolveAxes(List<Axis> axes, double[][] coordinates)
        throws IrregularGridException {
        if (axes.size() != coordinates.length) {
            throw new IllegalArgumentException(
                coordinates.length + " coordinate arrays given for axes " + axes);
        }
        int samples = sampleCount(coordinates);
        for (double[] c : coordinates) {
            if (c.length != samples) {
                throw new IllegalArgumentException(
                    "Coordinate arrays differ in length for axes " + axes);
            }
        }
        AxisGrid[] grids = new AxisGrid[axes.size()];
        long cells = 1;
        for (int a = 0; a < axes.size(); a++) {
            grids[a] = resolveAxis(axes.get(a), coordinates[a]);
            cells *= grids[a].extent;
            if (cells > MAX_CELLS) {
                throw new IrregularGridException(String.format(
                    "Grid of %d samples on axes %s would exceed %d cells",
                    samples, axes, MAX_CELLS));
            }
        }
        return grids;
    }

    private AxisGrid resolveAxis(Axis axis, double[] values) throws IrregularGridException {
        AxisGrid grid = new AxisGrid();
        grid.positions = new int[values.length];
        if (values.length == 0) {
            grid.extent = 1;
            grid.spacing = 0;
            return grid;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new IrregularGridException(
                    "Non-finite coordinate " + v + " on axis " + axis.getKey());
            }
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double range = max - min;
        double tolerance = relativeTolerance * range;

        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double spacing = Double.POSITIVE_INFINITY;
        double line = sorted[0];
        int lines = 1;
        for (int i = 1; i < sorted.length; i++) {
            if (sorted[i] - line > tolerance) {
                spacing = Math.min(spacing, sorted[i] - line);
                line = sorted[i];
                lines++;
            }
        }
        if (lines < 2) {
            grid.extent = 1;
            grid.spacing = 0;
            return grid;
        }

        double steps = range / spacing;
        long rounded = Math.round(steps);
        if (Math.abs(steps - rounded) > integerTolerance) {
            throw new IrregularGridException(String.format(
                "Axis %s spans %s with spacing %s, which is not a whole number of pixels (%s)",
                axis.getKey(), range, spacing, steps));
        }
        if (rounded + 1 > MAX_CELLS) {
            throw new IrregularGridException(String.format(
                "Axis %s would have %d pixels", axis.getKey(), rounded + 1));
        }
        for (int i = 0; i < values.length; i++) {
            double position = (values[i] - min) / spacing;
            long p = Math.round(position);
            if (Math.abs(position - p) > integerTolerance) {
                throw new IrregularGridException(String.format(
                    "Coordinate %s of sample %d on axis %s is off the grid of spacing %s"
                    + " starting at %s", values[i], i, axis.getKey(), spacing, min));
            }
            grid.positions[i] = (int) p;
        }
        grid.extent = (int) rounded + 1;
        grid.spacing = spacing;
        return grid;
    }

    /** Resolved grid along one axis. */
    private static class AxisGrid {
        int extent;
        double spacing;
        int[] positions;
    }
}
