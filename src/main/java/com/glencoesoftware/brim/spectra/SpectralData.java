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
import com.glencoesoftware.brim.Utils;
import com.glencoesoftware.brim.exceptions.DuplicateCoordinateException;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotAContainerException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.grid.Axis;
import com.glencoesoftware.brim.grid.GridCell;
import com.glencoesoftware.brim.grid.GridLayout;
import com.glencoesoftware.brim.grid.SpatialGrid;
import com.glencoesoftware.brim.grid.SpatialMapping;
import com.glencoesoftware.brim.store.ArrayInfo;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.NdArray;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.perf4j.StopWatch;
import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.LoggerFactory;

/**
 * Spectra of one data group, addressed by position on the spatial grid.
 */
public class SpectralData {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(SpectralData.class);

    private final StorePath group;

    private final SpatialMapping mapping;

    public SpectralData(StorePath group, SpatialMapping mapping) {
        this.group = group;
        this.mapping = mapping;
    }

    private ArrayStore store() {
        return group.store;
    }

    private StorePath psdPath() {
        return group.resolve(BrimLayout.PSD);
    }

    private StorePath frequencyPath() {
        return group.resolve(BrimLayout.FREQUENCY);
    }

    /** Current layout of the spatial grid. */
    public GridLayout getLayout() throws IOException {
        return mapping.resolve(group);
    }

    public boolean isSparse() throws IOException {
        return getLayout().isSparse();
    }

    /** Number of frequency samples per spectrum. */
    public int getSpectrumLength() throws IOException {
        int[] shape = store().getArrayInfo(psdPath()).getShape();
        return shape[shape.length - 1];
    }

    public String getPsdUnits() throws IOException {
        return Utils.getString(store().getAttributes(psdPath()), BrimLayout.UNITS_ATTR,
            BrimLayout.DEFAULT_PSD_UNITS);
    }

    public String getFrequencyUnits() throws IOException {
        return Utils.getString(store().getAttributes(frequencyPath()), BrimLayout.UNITS_ATTR,
            BrimLayout.DEFAULT_FREQUENCY_UNITS);
    }

    /**
     * Reads the whole frequency array, either 1-D or shaped like the PSD.
     *
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public NdArray getFrequency() throws IOException {
        return store().readArray(frequencyPath());
    }

    /**
     * Reads the spectrum at one grid position. Only the chunks holding that
     * spectrum are read. With parameters, the spectrum has one row per
     * parameter value. The frequencies are broadcast to the shape of the
     * spectrum.
     *
     * @param index position on the grid, one entry per spatial axis
     * @return See above.
     * @throws IndexOutOfRangeException     if the position is outside the
     *                                      grid or no spectrum was acquired
     *                                      there
     * @throws DuplicateCoordinateException if several spectra with different
     *                                      values were acquired there
     * @throws IOException                  if the store cannot be read
     */
    public Spectrum getSpectrumInImage(int... index) throws IOException {
        GridCell cell = mapping.locate(group, index);
        if (cell.isEmpty()) {
            throw new IndexOutOfRangeException(String.format(
                "No spectrum acquired at %s in %s", Arrays.toString(index), group));
        }
        NdArray psd = cell.read(store(), psdPath());
        ArrayInfo frequencyInfo = store().getArrayInfo(frequencyPath());
        int spatialRank = frequencyInfo.getRank() - psd.getRank();
        NdArray frequency = spatialRank <= 0 ? store().readArray(frequencyPath())
            : cell.read(store(), frequencyPath(), spatialRank);
        return new Spectrum(psd.asDoubles(), broadcast(frequency.asDoubles(), psd.size()),
            psd.getShape(), getPsdUnits(), getFrequencyUnits());
    }

    private double[] broadcast(double[] frequency, int size) throws NotAContainerException {
        if (frequency.length == size) {
            return frequency;
        }
        if (frequency.length == 0 || size % frequency.length != 0) {
            throw new NotAContainerException(String.format(
                "%d frequencies cannot be broadcast to a spectrum of %d values in %s",
                frequency.length, size, group));
        }
        double[] out = new double[size];
        for (int i = 0; i < size; i++) {
            out[i] = frequency[i % frequency.length];
        }
        return out;
    }

    public boolean hasParameters() throws IOException {
        return store().isArray(group.resolve(BrimLayout.PARAMETERS));
    }

    /**
     * Gets the shape of the parameters the spectra were acquired over.
     *
     * @return See above, empty without parameters.
     * @throws IOException if the store cannot be read
     */
    public int[] getParameterShape() throws IOException {
        return SpatialMapping.parameterShape(group);
    }

    /**
     * Reads the values of the parameters the spectra were acquired over.
     *
     * @return See above.
     * @throws NotFoundException if no parameters were recorded
     * @throws IOException       if the store cannot be read
     */
    public NdArray getParameters() throws IOException {
        if (!hasParameters()) {
            throw new NotFoundException("No parameters in " + group);
        }
        return store().readArray(group.resolve(BrimLayout.PARAMETERS));
    }

    /**
     * Gets the names of the parameters, one per parameter axis.
     *
     * @return See above, empty without parameters.
     * @throws IOException if the store cannot be read
     */
    public List<String> getParameterNames() throws IOException {
        if (!hasParameters()) {
            return Collections.emptyList();
        }
        Object names = store().getAttributes(group.resolve(BrimLayout.PARAMETERS))
            .get(BrimLayout.NAME_ATTR);
        if (names == null) {
            return Collections.emptyList();
        }
        if (names instanceof List) {
            List<String> list = new ArrayList<>();
            for (Object name : (List<?>) names) {
                list.add(String.valueOf(name));
            }
            return list;
        }
        return Collections.singletonList(names.toString());
    }

    public boolean hasTimestamp() throws IOException {
        return store().isArray(timestampPath());
    }

    private StorePath timestampPath() {
        return group.resolve(BrimLayout.TIMESTAMP);
    }

    /**
     * Reads the acquisition time of every spectrum, shaped like the stored
     * spatial axes.
     *
     * @return See above.
     * @throws NotFoundException if no acquisition times were recorded
     * @throws IOException       if the store cannot be read
     */
    public NdArray getTimestamp() throws IOException {
        if (!hasTimestamp()) {
            throw new NotFoundException("No timestamp in " + group);
        }
        return store().readArray(timestampPath());
    }

    public String getTimestampUnits() throws IOException {
        return Utils.getString(store().getAttributes(timestampPath()), BrimLayout.UNITS_ATTR,
            BrimLayout.DEFAULT_TIMESTAMP_UNITS);
    }

    /**
     * Reads the acquisition time of the spectrum at one grid position.
     *
     * @param index position on the grid, one entry per spatial axis
     * @return See above.
     * @throws NotFoundException        if no acquisition times were recorded
     * @throws IndexOutOfRangeException if the position is outside the grid or
     *                                  no spectrum was acquired there
     * @throws IOException              if the store cannot be read
     */
    public double getTimestampInImage(int... index) throws IOException {
        if (!hasTimestamp()) {
            throw new NotFoundException("No timestamp in " + group);
        }
        GridCell cell = mapping.locate(group, index);
        if (cell.isEmpty()) {
            throw new IndexOutOfRangeException(String.format(
                "No spectrum acquired at %s in %s", Arrays.toString(index), group));
        }
        return cell.read(store(), timestampPath()).getDouble(0);
    }

    /**
     * Places every spectrum on the spatial grid. The result has the spatial
     * dimensions followed by the frequency dimension; positions without a
     * spectrum are NaN.
     *
     * @return a newly allocated grid
     * @throws IOException if the store cannot be read or the grid cannot be
     *                     reconstructed
     */
    public SpatialGrid getPsdAsSpatialMap() throws IOException {
        StopWatch t0 = new Slf4JStopWatch("getPsdAsSpatialMap()");
        try {
            GridLayout layout = getLayout();
            return layout.scatter(store().readArray(psdPath()), getPsdUnits());
        } finally {
            t0.stop();
        }
    }

    /**
     * Writes spectra to an empty data group.
     *
     * @param group   the data group
     * @param spectra the spectra
     * @throws NameCollisionException   if the group already holds spectra
     * @throws IllegalArgumentException if PSD axes are left without
     *                                  parameters
     * @throws IOException              if the store cannot be written
     */
    public static void write(StorePath group, Spectra spectra) throws IOException {
        spectra.checkParameters();
        ArrayStore store = group.store;
        StorePath psd = group.resolve(BrimLayout.PSD);
        if (store.isArray(psd)) {
            throw new NameCollisionException("Data group " + group + " already holds spectra");
        }
        Map<String, Object> attributes = store.getAttributes(group);
        attributes.put(BrimLayout.SPARSE_ATTR, spectra.isSparse());

        if (spectra.isSparse()) {
            StorePath spatialMap = store.createGroup(group.resolve(BrimLayout.SPATIAL_MAP).path);
            for (Map.Entry<Axis, double[]> e : spectra.getCoordinates().entrySet()) {
                double[] values = e.getValue();
                store.writeArray(spatialMap.resolve(e.getKey().getKey()),
                    NdArray.of(values, values.length), Collections.emptyMap());
            }
            Map<String, Object> mapAttributes = store.getAttributes(spatialMap);
            mapAttributes.put(BrimLayout.UNITS_ATTR, spectra.getCoordinateUnits());
            store.setAttributes(spatialMap, mapAttributes);
            if (spectra.getIndexMap() != null) {
                Map<String, Object> indexAttributes = new HashMap<>();
                indexAttributes.put(BrimLayout.ELEMENT_SIZE_ATTR,
                    toList(spectra.getPixelSize()));
                indexAttributes.put(BrimLayout.ELEMENT_SIZE_UNITS_ATTR, spectra.getPixelUnits());
                NdArray map = spectra.getIndexMap();
                store.writeArray(group.resolve(BrimLayout.CARTESIAN_VISUALISATION),
                    NdArray.of(map.asInts(), map.getShape()), indexAttributes);
            }
        } else {
            attributes.put(BrimLayout.ELEMENT_SIZE_ATTR, toList(spectra.getPixelSize()));
            attributes.put(BrimLayout.ELEMENT_SIZE_UNITS_ATTR, spectra.getPixelUnits());
        }

        store.writeArray(psd, spectra.getPsd(), Collections.<String, Object>singletonMap(
            BrimLayout.UNITS_ATTR, spectra.getPsdUnits()));
        store.writeArray(group.resolve(BrimLayout.FREQUENCY), spectra.getFrequency(),
            Collections.<String, Object>singletonMap(
                BrimLayout.UNITS_ATTR, spectra.getFrequencyUnits()));
        if (spectra.getParameters() != null) {
            store.writeArray(group.resolve(BrimLayout.PARAMETERS), spectra.getParameters(),
                Collections.<String, Object>singletonMap(BrimLayout.NAME_ATTR,
                    new ArrayList<>(spectra.getParameterNames())));
        }
        if (spectra.getTimestamp() != null) {
            store.writeArray(group.resolve(BrimLayout.TIMESTAMP), spectra.getTimestamp(),
                Collections.<String, Object>singletonMap(BrimLayout.UNITS_ATTR,
                    BrimLayout.DEFAULT_TIMESTAMP_UNITS));
        }
        store.setAttributes(group, attributes);
        log.info("Wrote {} spectra of shape {} to {}", spectra.isSparse() ? "sparse" : "dense",
            Arrays.toString(spectra.getPsd().getShape()), group);
    }

    private static List<Double> toList(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }
}
