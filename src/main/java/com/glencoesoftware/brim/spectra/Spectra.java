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

package com.glencoesoftware.brim.spectra;

import com.glencoesoftware.brim.BrimLayout;
import com.glencoesoftware.brim.grid.Axis;
import com.glencoesoftware.brim.grid.SpatialMapping;
import com.glencoesoftware.brim.store.NdArray;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Spectra to be written to a data group, either on a regular grid (dense)
 * or as a list of spectra with their scan coordinates (sparse).
 *
 * <p>The PSD holds the spatial axes, then the axes of any parameters the
 * spectra were acquired over, then the frequency axis.</p>
 */
public final class Spectra {

    private final NdArray psd;

    private final NdArray frequency;

    private final boolean sparse;

    /** Number of leading, spatial axes of the PSD. */
    private final int spatialRank;

    private final List<Axis> axes;

    /** Pixel size per axis of dense data or of the index map. */
    private final double[] pixelSize;

    private final String pixelUnits;

    /** Scan coordinates of sparse data per axis. */
    private final Map<Axis, double[]> coordinates;

    private final String coordinateUnits;

    private final NdArray indexMap;

    private final String psdUnits;

    private final String frequencyUnits;

    private final NdArray parameters;

    private final List<String> parameterNames;

    private final NdArray timestamp;

    private Spectra(Builder b) {
        this.psd = b.psd;
        this.frequency = b.frequency;
        this.sparse = b.sparse;
        this.spatialRank = b.spatialRank;
        this.axes = b.axes;
        this.pixelSize = b.pixelSize;
        this.pixelUnits = b.pixelUnits;
        this.coordinates = b.coordinates;
        this.coordinateUnits = b.coordinateUnits;
        this.indexMap = b.indexMap;
        this.psdUnits = b.psdUnits;
        this.frequencyUnits = b.frequencyUnits;
        this.parameters = b.parameters;
        this.parameterNames = b.parameterNames;
        this.timestamp = b.timestamp;
    }

    /** Field holder for the copies made by the {@code with*} methods. */
    private static final class Builder {
        NdArray psd;
        NdArray frequency;
        boolean sparse;
        int spatialRank;
        List<Axis> axes;
        double[] pixelSize;
        String pixelUnits;
        Map<Axis, double[]> coordinates = Collections.emptyMap();
        String coordinateUnits;
        NdArray indexMap;
        String psdUnits = BrimLayout.DEFAULT_PSD_UNITS;
        String frequencyUnits = BrimLayout.DEFAULT_FREQUENCY_UNITS;
        NdArray parameters;
        List<String> parameterNames = Collections.emptyList();
        NdArray timestamp;

        Builder() {
        }

        Builder(Spectra s) {
            psd = s.psd;
            frequency = s.frequency;
            sparse = s.sparse;
            spatialRank = s.spatialRank;
            axes = s.axes;
            pixelSize = s.pixelSize;
            pixelUnits = s.pixelUnits;
            coordinates = s.coordinates;
            coordinateUnits = s.coordinateUnits;
            indexMap = s.indexMap;
            psdUnits = s.psdUnits;
            frequencyUnits = s.frequencyUnits;
            parameters = s.parameters;
            parameterNames = s.parameterNames;
            timestamp = s.timestamp;
        }
    }

    /**
     * Spectra on a regular grid.
     *
     * @param psd        PSD of shape (spatial..., [parameters...], frequency)
     *                   with one to three spatial dimensions ordered z, y, x
     * @param frequency  frequencies, of a shape matching the trailing
     *                   dimensions of {@code psd}: 1-D when shared by every
     *                   spectrum, the shape of {@code psd} when not
     * @param pixelSize  pixel size along each spatial dimension, which also
     *                   gives the number of spatial dimensions
     * @param pixelUnits units of the pixel size
     * @return See above.
     */
    public static Spectra dense(NdArray psd, NdArray frequency, double[] pixelSize,
        String pixelUnits) {
        int spatialRank = pixelSize.length;
        if (spatialRank < 1 || spatialRank > 3) {
            throw new IllegalArgumentException(
                "Dense spectra must have 1 to 3 spatial dimensions, got pixel size "
                + Arrays.toString(pixelSize));
        }
        if (psd.getRank() < spatialRank + 1) {
            throw new IllegalArgumentException(String.format(
                "PSD of shape %s has no frequency axis after %d spatial dimensions",
                Arrays.toString(psd.getShape()), spatialRank));
        }
        checkFrequency(psd, frequency);
        Builder b = new Builder();
        b.psd = psd;
        b.frequency = frequency;
        b.spatialRank = spatialRank;
        b.axes = SpatialMapping.trailingAxes(spatialRank);
        b.pixelSize = pixelSize.clone();
        b.pixelUnits = pixelUnits == null ? BrimLayout.DEFAULT_SPATIAL_UNITS : pixelUnits;
        return new Spectra(b);
    }

    /**
     * Spectra at arbitrary scan positions.
     *
     * @param psd             PSD of shape (n, [parameters...], frequency)
     * @param frequency       frequencies, of a shape matching the trailing
     *                        dimensions of {@code psd}
     * @param coordinates     coordinates of each spectrum, one array of
     *                        length n per axis
     * @param coordinateUnits units of the coordinates
     * @return See above.
     */
    public static Spectra sparse(NdArray psd, NdArray frequency, Map<Axis, double[]> coordinates,
        String coordinateUnits) {
        if (psd.getRank() < 2) {
            throw new IllegalArgumentException(
                "Sparse PSD must have shape (n, frequency): " + Arrays.toString(psd.getShape()));
        }
        if (coordinates.isEmpty()) {
            throw new IllegalArgumentException("Sparse spectra need scan coordinates");
        }
        checkFrequency(psd, frequency);
        int n = psd.getShape()[0];
        Map<Axis, double[]> copy = new EnumMap<>(Axis.class);
        for (Map.Entry<Axis, double[]> e : coordinates.entrySet()) {
            if (e.getValue().length != n) {
                throw new IllegalArgumentException(String.format(
                    "%d %s coordinates for %d spectra", e.getValue().length,
                    e.getKey().getKey(), n));
            }
            copy.put(e.getKey(), e.getValue().clone());
        }
        String units = coordinateUnits == null ? BrimLayout.DEFAULT_SPATIAL_UNITS
            : coordinateUnits;
        Builder b = new Builder();
        b.psd = psd;
        b.frequency = frequency;
        b.sparse = true;
        b.spatialRank = 1;
        b.axes = new ArrayList<>(copy.keySet());
        b.pixelUnits = units;
        b.coordinates = copy;
        b.coordinateUnits = units;
        return new Spectra(b);
    }

    /**
     * Adds an explicit grid to sparse spectra: each cell of {@code map} holds
     * the index of its spectrum or -1.
     *
     * @param map        integer map with one to three dimensions ordered z, y, x
     * @param pixelSize  pixel size along each dimension of {@code map}
     * @param pixelUnits units of the pixel size
     * @return See above.
     */
    public Spectra withIndexMap(NdArray map, double[] pixelSize, String pixelUnits) {
        if (!sparse) {
            throw new IllegalStateException("Only sparse spectra take an index map");
        }
        if (!map.getDType().isIntegral()) {
            throw new IllegalArgumentException("Index map must be integral: " + map.getDType());
        }
        if (map.getRank() < 1 || map.getRank() > 3 || pixelSize.length != map.getRank()) {
            throw new IllegalArgumentException(String.format(
                "Index map of shape %s with pixel size %s", Arrays.toString(map.getShape()),
                Arrays.toString(pixelSize)));
        }
        int n = psd.getShape()[0];
        for (int value : map.asInts()) {
            if (value < -1 || value >= n) {
                throw new IllegalArgumentException(String.format(
                    "Index map refers to spectrum %d, only %d are given", value, n));
            }
        }
        Builder b = new Builder(this);
        b.axes = SpatialMapping.trailingAxes(map.getRank());
        b.pixelSize = pixelSize.clone();
        b.pixelUnits = pixelUnits == null ? BrimLayout.DEFAULT_SPATIAL_UNITS : pixelUnits;
        b.indexMap = map;
        return new Spectra(b);
    }

    /**
     * Sets the units of the PSD and of the frequencies.
     *
     * @param psdUnits       units of the PSD
     * @param frequencyUnits units of the frequencies
     * @return See above.
     */
    public Spectra withUnits(String psdUnits, String frequencyUnits) {
        Builder b = new Builder(this);
        b.psdUnits = psdUnits;
        b.frequencyUnits = frequencyUnits;
        return new Spectra(b);
    }

    /**
     * Records the parameters the spectra were acquired over, for example a
     * set of polarization angles. Their shape must match the PSD axes
     * between the spatial and the frequency axes.
     *
     * @param values values of the parameters
     * @param names  one name per parameter axis
     * @return See above.
     */
    public Spectra withParameters(NdArray values, List<String> names) {
        int[] axes = Arrays.copyOfRange(psd.getShape(), spatialRank, psd.getRank() - 1);
        if (!Arrays.equals(axes, values.getShape())) {
            throw new IllegalArgumentException(String.format(
                "Parameters of shape %s do not match the PSD of shape %s",
                Arrays.toString(values.getShape()), Arrays.toString(psd.getShape())));
        }
        if (names.size() != values.getRank()) {
            throw new IllegalArgumentException(String.format(
                "%d parameter names for %d parameter axes", names.size(), values.getRank()));
        }
        Builder b = new Builder(this);
        b.parameters = values;
        b.parameterNames = Collections.unmodifiableList(new ArrayList<>(names));
        return new Spectra(b);
    }

    /**
     * Records when each spectrum was acquired.
     *
     * @param values one time per spectrum in milliseconds, shaped like the
     *               spatial axes of the PSD
     * @return See above.
     */
    public Spectra withTimestamp(NdArray values) {
        int[] expected = Arrays.copyOf(psd.getShape(), spatialRank);
        if (!Arrays.equals(expected, values.getShape())) {
            throw new IllegalArgumentException(String.format(
                "Timestamp of shape %s does not match spectra of shape %s",
                Arrays.toString(values.getShape()), Arrays.toString(expected)));
        }
        Builder b = new Builder(this);
        b.timestamp = values;
        return new Spectra(b);
    }

    /**
     * Checks that every PSD axis between the spatial and the frequency axes
     * is described by the parameters.
     */
    void checkParameters() {
        int extra = psd.getRank() - 1 - spatialRank;
        int described = parameters == null ? 0 : parameters.getRank();
        if (extra != described) {
            throw new IllegalArgumentException(String.format(
                "PSD of shape %s has %d parameter axes, %d are described",
                Arrays.toString(psd.getShape()), extra, described));
        }
    }

    private static void checkFrequency(NdArray psd, NdArray frequency) {
        int[] shape = psd.getShape();
        int[] f = frequency.getShape();
        boolean trailing = f.length >= 1 && f.length <= shape.length
            && Arrays.equals(f, Arrays.copyOfRange(shape, shape.length - f.length, shape.length));
        if (!trailing) {
            throw new IllegalArgumentException(String.format(
                "Frequency of shape %s does not match PSD of shape %s",
                Arrays.toString(f), Arrays.toString(shape)));
        }
    }

    public NdArray getPsd() {
        return psd;
    }

    public NdArray getFrequency() {
        return frequency;
    }

    public boolean isSparse() {
        return sparse;
    }

    /** Number of leading, spatial axes of the PSD. */
    public int getSpatialRank() {
        return spatialRank;
    }

    /** Spatial axes of dense data or of the index map. */
    public List<Axis> getAxes() {
        return Collections.unmodifiableList(axes);
    }

    public double[] getPixelSize() {
        return pixelSize == null ? null : pixelSize.clone();
    }

    public String getPixelUnits() {
        return pixelUnits;
    }

    public Map<Axis, double[]> getCoordinates() {
        return Collections.unmodifiableMap(coordinates);
    }

    public String getCoordinateUnits() {
        return coordinateUnits;
    }

    public NdArray getIndexMap() {
        return indexMap;
    }

    public String getPsdUnits() {
        return psdUnits;
    }

    public String getFrequencyUnits() {
        return frequencyUnits;
    }

    /** Parameter values, {@code null} if none were recorded. */
    public NdArray getParameters() {
        return parameters;
    }

    public List<String> getParameterNames() {
        return parameterNames;
    }

    /** Acquisition times, {@code null} if none were recorded. */
    public NdArray getTimestamp() {
        return timestamp;
    }
}
