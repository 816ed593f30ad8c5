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

import com.glencoesoftware.brim.BrimLayout;
import com.glencoesoftware.brim.Utils;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.NotAContainerException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.store.ArrayInfo;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.NdArray;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Resolves the {@link GridLayout} of a data group from what is stored in
 * it: the PSD shape of dense data, the Cartesian index map of sparse data
 * when present, otherwise the scan coordinates of sparse data. The PSD holds
 * the spatial axes, then any parameter axes, then the frequency axis.
 */
public class SpatialMapping {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(SpatialMapping.class);

    private final SpatialReconstruction reconstruction;

    public SpatialMapping(SpatialReconstruction reconstruction) {
        this.reconstruction = reconstruction;
    }

    /**
     * Resolves the layout of a data group. Nothing is cached; the layout
     * always reflects the current content of the store.
     *
     * @param dataGroup the data group
     * @return See above.
     * @throws NotFoundException      if the data group holds no PSD
     * @throws NotAContainerException if the spatial description is missing
     *                                or malformed
     * @throws IOException            if the store cannot be read
     */
    public GridLayout resolve(StorePath dataGroup) throws IOException {
        ArrayStore store = dataGroup.store;
        PsdShape psd = describe(dataGroup);
        if (!psd.sparse) {
            int[] shape = Arrays.copyOf(psd.shape, psd.spatialRank);
            return GridLayout.dense(trailingAxes(psd.spatialRank), shape,
                pixelSize(psd.attributes, psd.spatialRank, dataGroup),
                Utils.getString(psd.attributes, BrimLayout.ELEMENT_SIZE_UNITS_ATTR,
                    BrimLayout.DEFAULT_SPATIAL_UNITS));
        }

        int samples = psd.shape[0];
        StorePath indexMap = dataGroup.resolve(BrimLayout.CARTESIAN_VISUALISATION);
        if (store.isArray(indexMap)) {
            checkIndexMap(store.getArrayInfo(indexMap), indexMap);
            NdArray map = store.readArray(indexMap);
            Map<String, Object> mapAttributes = store.getAttributes(indexMap);
            try {
                return GridLayout.indexed(trailingAxes(map.getRank()), map.getShape(),
                    pixelSize(mapAttributes, map.getRank(), indexMap),
                    Utils.getString(mapAttributes, BrimLayout.ELEMENT_SIZE_UNITS_ATTR,
                        BrimLayout.DEFAULT_SPATIAL_UNITS),
                    map.asInts(), samples);
            } catch (IllegalArgumentException e) {
                throw new NotAContainerException("Malformed index map " + indexMap, e);
            }
        }

        ScanCoordinates scan = readCoordinates(dataGroup, samples);
        return reconstruction.reconstruct(scan.axes, scan.values, scan.units);
    }

    /**
     * Resolves one cell of the layout of a data group. Dense data and index
     * maps are resolved from array shapes and the one index map entry of the
     * cell; scan coordinates are read but no grid is allocated.
     *
     * @param dataGroup the data group
     * @param index     grid index, one entry per spatial axis
     * @return See above.
     * @throws NotFoundException        if the data group holds no PSD
     * @throws NotAContainerException   if the spatial description is missing
     *                                  or malformed
     * @throws IndexOutOfRangeException if the index lies outside the grid
     * @throws IOException              if the store cannot be read
     */
    public GridCell locate(StorePath dataGroup, int... index) throws IOException {
        ArrayStore store = dataGroup.store;
        PsdShape psd = describe(dataGroup);
        if (!psd.sparse) {
            GridCell.checkIndex(index, Arrays.copyOf(psd.shape, psd.spatialRank),
                trailingAxes(psd.spatialRank));
            return new GridCell(index, Collections.singletonList(index.clone()),
                psd.spatialRank);
        }

        int samples = psd.shape[0];
        StorePath indexMap = dataGroup.resolve(BrimLayout.CARTESIAN_VISUALISATION);
        if (store.isArray(indexMap)) {
            ArrayInfo info = store.getArrayInfo(indexMap);
            checkIndexMap(info, indexMap);
            GridCell.checkIndex(index, info.getShape(), trailingAxes(info.getRank()));
            int[] one = new int[info.getRank()];
            Arrays.fill(one, 1);
            int sample;
            try {
                sample = store.readArray(indexMap, one, index).asInts()[0];
            } catch (IllegalArgumentException e) {
                throw new NotAContainerException("Malformed index map " + indexMap, e);
            }
            if (sample < -1 || sample >= samples) {
                throw new NotAContainerException(String.format(
                    "Index map %s refers to sample %d, only %d are stored",
                    indexMap, sample, samples));
            }
            List<int[]> offsets = sample < 0 ? Collections.<int[]>emptyList()
                : Collections.singletonList(new int[] { sample });
            return new GridCell(index, offsets, 1);
        }

        ScanCoordinates scan = readCoordinates(dataGroup, samples);
        return reconstruction.locate(scan.axes, scan.values, index);
    }

    /**
     * Gets the shape of the parameters the spectra of a data group were
     * acquired over; empty when there are none.
     *
     * @param dataGroup the data group
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public static int[] parameterShape(StorePath dataGroup) throws IOException {
        StorePath parameters = dataGroup.resolve(BrimLayout.PARAMETERS);
        ArrayStore store = dataGroup.store;
        return store.isArray(parameters) ? store.getArrayInfo(parameters).getShape()
            : new int[0];
    }

    /** Shape of the PSD of a data group, split into its parts. */
    private static final class PsdShape {
        int[] shape;
        boolean sparse;
        int spatialRank;
        Map<String, Object> attributes;
    }

    private static PsdShape describe(StorePath dataGroup) throws IOException {
        ArrayStore store = dataGroup.store;
        StorePath psdPath = dataGroup.resolve(BrimLayout.PSD);
        if (!store.isArray(psdPath)) {
            throw new NotFoundException("No spectral data in " + dataGroup);
        }
        PsdShape psd = new PsdShape();
        psd.shape = store.getArrayInfo(psdPath).getShape();
        psd.attributes = store.getAttributes(dataGroup);
        psd.sparse = Boolean.TRUE.equals(psd.attributes.get(BrimLayout.SPARSE_ATTR));
        int[] parameters = parameterShape(dataGroup);

        if (psd.sparse) {
            psd.spatialRank = 1;
            // extra axes without a Parameters array are accepted as unnamed parameters
            boolean valid = psd.shape.length >= 2
                && (parameters.length == 0 || psd.shape.length == 2 + parameters.length);
            if (!valid) {
                throw new NotAContainerException(String.format(
                    "Sparse PSD of %s has shape %s for parameters %s", dataGroup,
                    Arrays.toString(psd.shape), Arrays.toString(parameters)));
            }
        } else {
            psd.spatialRank = psd.shape.length - 1 - parameters.length;
            if (psd.spatialRank < 1 || psd.spatialRank > 3) {
                throw new NotAContainerException(String.format(
                    "Dense PSD of %s has shape %s for parameters %s", dataGroup,
                    Arrays.toString(psd.shape), Arrays.toString(parameters)));
            }
        }
        int[] parameterAxes = Arrays.copyOfRange(psd.shape, psd.spatialRank,
            psd.spatialRank + parameters.length);
        if (!Arrays.equals(parameterAxes, parameters)) {
            throw new NotAContainerException(String.format(
                "PSD of %s has shape %s, which does not hold parameters of shape %s",
                dataGroup, Arrays.toString(psd.shape), Arrays.toString(parameters)));
        }
        return psd;
    }

    private static void checkIndexMap(ArrayInfo info, StorePath indexMap)
        throws NotAContainerException {
        if (!info.getDType().isIntegral() || info.getRank() < 1 || info.getRank() > 3) {
            throw new NotAContainerException("Malformed index map " + indexMap);
        }
    }

    /** Scan coordinates of sparse data, one array per axis. */
    private static final class ScanCoordinates {
        final List<Axis> axes = new ArrayList<>();
        double[][] values;
        String units;
    }

    private static ScanCoordinates readCoordinates(StorePath dataGroup, int samples)
        throws IOException {
        ArrayStore store = dataGroup.store;
        StorePath spatialMap = dataGroup.resolve(BrimLayout.SPATIAL_MAP);
        if (!store.isGroup(spatialMap)) {
            throw new NotAContainerException(
                "Sparse data group " + dataGroup + " has no scan coordinates");
        }
        ScanCoordinates scan = new ScanCoordinates();
        List<double[]> coordinates = new ArrayList<>();
        for (Axis axis : Axis.values()) {
            StorePath array = spatialMap.resolve(axis.getKey());
            if (!store.isArray(array)) {
                continue;
            }
            double[] values = store.readArray(array).asDoubles();
            if (values.length != samples) {
                throw new NotAContainerException(String.format(
                    "%d %s coordinates for %d spectra in %s",
                    values.length, axis.getKey(), samples, dataGroup));
            }
            scan.axes.add(axis);
            coordinates.add(values);
        }
        if (scan.axes.isEmpty()) {
            throw new NotAContainerException(
                "Sparse data group " + dataGroup + " has no scan coordinates");
        }
        scan.values = coordinates.toArray(new double[0][]);
        scan.units = Utils.getString(store.getAttributes(spatialMap),
            BrimLayout.UNITS_ATTR, BrimLayout.DEFAULT_SPATIAL_UNITS);
        return scan;
    }

    private static double[] pixelSize(Map<String, Object> attributes, int rank, StorePath node)
        throws NotAContainerException {
        Object value = attributes.get(BrimLayout.ELEMENT_SIZE_ATTR);
        if (value == null) {
            log.warn("No pixel size recorded for {}", node);
            double[] unknown = new double[rank];
            Arrays.fill(unknown, Double.NaN);
            return unknown;
        }
        double[] size;
        try {
            size = Utils.castToDoubleArray(value);
        } catch (IllegalArgumentException e) {
            throw new NotAContainerException("Malformed pixel size of " + node, e);
        }
        if (size.length != rank) {
            throw new NotAContainerException(String.format(
                "%d pixel sizes for %d spatial dimensions in %s", size.length, rank, node));
        }
        return size;
    }

    /** The last {@code rank} axes of z, y, x. */
    public static List<Axis> trailingAxes(int rank) {
        List<Axis> all = Arrays.asList(Axis.values());
        return new ArrayList<>(all.subList(all.size() - rank, all.size()));
    }
}
