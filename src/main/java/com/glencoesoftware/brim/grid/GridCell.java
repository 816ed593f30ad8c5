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
import com.glencoesoftware.brim.store.ArrayInfo;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.NdArray;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.slf4j.LoggerFactory;

/**
 * One cell of the spatial grid together with the stored samples which land
 * on it: none for an empty cell, one normally, several when scan
 * coordinates coincide.
 */
public final class GridCell {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(GridCell.class);

    private final int[] index;

    /** Leading offsets in stored arrays, the first one being the primary sample. */
    private final List<int[]> offsets;

    /** Number of leading, spatial dimensions of stored arrays. */
    private final int storedRank;

    GridCell(int[] index, List<int[]> offsets, int storedRank) {
        this.index = index.clone();
        this.offsets = new ArrayList<>(offsets);
        this.storedRank = storedRank;
    }

    /**
     * Checks that an index addresses a cell of a grid.
     *
     * @param index grid index, one entry per axis
     * @param shape grid extent
     * @param axes  grid axes, for messages
     * @throws IndexOutOfRangeException if the index lies outside the grid
     */
    static void checkIndex(int[] index, int[] shape, List<Axis> axes)
        throws IndexOutOfRangeException {
        if (index.length != shape.length) {
            throw new IllegalArgumentException(String.format(
                "Index %s has rank %d but the grid axes are %s",
                Arrays.toString(index), index.length, axes));
        }
        for (int i = 0; i < index.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfRangeException(String.format(
                    "Index %s outside grid of shape %s",
                    Arrays.toString(index), Arrays.toString(shape)));
            }
        }
    }

    public int[] getIndex() {
        return index.clone();
    }

    /** Whether no sample was acquired at this cell. */
    public boolean isEmpty() {
        return offsets.isEmpty();
    }

    /** Number of stored samples on this cell. */
    public int getSampleCount() {
        return offsets.size();
    }

    /**
     * Leading offsets of the samples of this cell in stored arrays.
     *
     * @return See above.
     */
    public List<int[]> getOffsets() {
        List<int[]> copy = new ArrayList<>(offsets.size());
        for (int[] offset : offsets) {
            copy.add(offset.clone());
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Reads the values of this cell from an array whose leading dimensions
     * are the stored spatial ones.
     *
     * @see #read(ArrayStore, StorePath, int)
     */
    public NdArray read(ArrayStore store, StorePath array) throws IOException {
        return read(store, array, storedRank);
    }

    /**
     * Reads the values of this cell from an array whose leading
     * {@code spatialRank} dimensions are the innermost stored spatial ones.
     * Only the chunks holding the cell are read. When several samples land
     * on the cell their values must be identical.
     *
     * @param store       the store
     * @param array       the array
     * @param spatialRank number of leading, spatial dimensions of the array
     * @return the trailing values as doubles, NaN if the cell is empty
     * @throws DuplicateCoordinateException if samples on the cell differ
     * @throws IOException                  if the array cannot be read
     */
    public NdArray read(ArrayStore store, StorePath array, int spatialRank)
        throws IOException {
        if (spatialRank < 0 || spatialRank > storedRank) {
            throw new IllegalArgumentException(String.format(
                "%d spatial dimensions requested, stored arrays have %d",
                spatialRank, storedRank));
        }
        ArrayInfo info = store.getArrayInfo(array);
        if (info.getRank() < spatialRank) {
            throw new IllegalStateException(String.format(
                "%s has rank %d, below the %d spatial dimensions",
                array, info.getRank(), spatialRank));
        }
        int[] trailing = Arrays.copyOfRange(info.getShape(), spatialRank, info.getRank());
        if (offsets.isEmpty()) {
            double[] missing = new double[(int) NdArray.length(trailing)];
            Arrays.fill(missing, Double.NaN);
            return NdArray.of(missing, trailing);
        }
        int[] regionShape = info.getShape();
        Arrays.fill(regionShape, 0, spatialRank, 1);

        double[] first = readRegion(store, array, regionShape, offsets.get(0), spatialRank);
        for (int[] other : offsets.subList(1, offsets.size())) {
            double[] values = readRegion(store, array, regionShape, other, spatialRank);
            for (int i = 0; i < first.length; i++) {
                if (Double.doubleToLongBits(first[i]) != Double.doubleToLongBits(values[i])) {
                    throw new DuplicateCoordinateException(String.format(
                        "Samples %s and %s of %s share grid cell %s with different values"
                        + " (%s != %s)", Arrays.toString(offsets.get(0)),
                        Arrays.toString(other), array, Arrays.toString(index), first[i],
                        values[i]));
                }
            }
        }
        if (offsets.size() > 1) {
            log.warn("{} sample(s) share grid cell {} with an identical sample",
                offsets.size() - 1, Arrays.toString(index));
        }
        return NdArray.of(first, trailing);
    }

    private static double[] readRegion(ArrayStore store, StorePath array, int[] regionShape,
        int[] offset, int spatialRank) throws IOException {
        int[] regionOffset = new int[regionShape.length];
        System.arraycopy(offset, offset.length - spatialRank, regionOffset, 0, spatialRank);
        double[] values = store.readArray(array, regionShape, regionOffset).asDoubles();
        return values.clone();
    }

    @Override
    public String toString() {
        return "GridCell{index=" + Arrays.toString(index) + ", samples=" + offsets.size() + '}';
    }
}
