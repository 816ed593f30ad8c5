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

package com.glencoesoftware.brim.analysis;

import com.glencoesoftware.brim.BrimLayout;
import com.glencoesoftware.brim.Utils;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.grid.GridCell;
import com.glencoesoftware.brim.grid.GridLayout;
import com.glencoesoftware.brim.grid.SpatialGrid;
import com.glencoesoftware.brim.grid.SpatialMapping;
import com.glencoesoftware.brim.metadata.Metadata;
import com.glencoesoftware.brim.metadata.MetadataCategory;
import com.glencoesoftware.brim.metadata.MetadataItem;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.NdArray;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.LoggerFactory;

/**
 * A named set of quantities derived from the spectra of a data group.
 *
 * <p>Each quantity is stored per peak and per peak index (for multi-peak
 * fits) with one value per stored spectrum, as {@code <Quantity>_<peak>_<k>};
 * fit errors are grouped under {@code Fit_error_<peak>_<k>}. The average
 * peak and the elastic contrast are computed on read and never cached.</p>
 */
public class AnalysisResults {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(AnalysisResults.class);

    /** Metadata entries the elastic contrast is computed from. */
    static final String WAVELENGTH_KEY = "Wavelength";

    static final String TEMPERATURE_KEY = "Temperature";

    static final String SCATTERING_ANGLE_KEY = "Scattering_angle";

    private final StorePath group;

    private final StorePath dataGroup;

    private final SpatialMapping mapping;

    private final Metadata metadata;

    /**
     * Default constructor.
     *
     * @param group     group of this result set
     * @param dataGroup data group the results were derived from
     * @param mapping   resolves the spatial grid of the data group
     * @param metadata  metadata of the data group
     */
    public AnalysisResults(StorePath group, StorePath dataGroup, SpatialMapping mapping,
        Metadata metadata) {
        this.group = group;
        this.dataGroup = dataGroup;
        this.mapping = mapping;
        this.metadata = metadata;
    }

    private ArrayStore store() {
        return group.store;
    }

    /**
     * Name of the stored array of a quantity.
     *
     * @param quantity  a stored quantity
     * @param peak      a stored peak
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     */
    static String storedName(Quantity quantity, PeakType peak, int peakIndex) {
        if (quantity.isComputed()) {
            throw new IllegalArgumentException(quantity + " is computed and never stored");
        }
        if (peak.isComputed()) {
            throw new IllegalArgumentException(peak + " is computed and never stored");
        }
        if (peakIndex < 0) {
            throw new IllegalArgumentException("Negative peak index " + peakIndex);
        }
        if (quantity.isFitError()) {
            return fitErrorGroupName(peak, peakIndex) + "/" + quantity.getName();
        }
        return quantity.getName() + "_" + peak.getId() + "_" + peakIndex;
    }

    private static String fitErrorGroupName(PeakType peak, int peakIndex) {
        return BrimLayout.FIT_ERROR_PREFIX + "_" + peak.getId() + "_" + peakIndex;
    }

    private StorePath arrayPath(Quantity quantity, PeakType peak, int peakIndex) {
        return group.resolve(storedName(quantity, peak, peakIndex));
    }

    /** The group of this result set. */
    public StorePath getPath() {
        return group;
    }

    /** The data group the results were derived from. */
    public StorePath getDataGroupPath() {
        return dataGroup;
    }

    /**
     * Gets the name of this result set.
     *
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public String getName() throws IOException {
        return Utils.getString(store().getAttributes(group), BrimLayout.NAME_ATTR,
            group.getName());
    }

    /**
     * Gets the model fitted to derive this result set; {@link FitModel#UNDEFINED}
     * when none or an unknown one is recorded.
     *
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public FitModel getFitModel() throws IOException {
        Object value = store().getAttributes(group).get(BrimLayout.FIT_MODEL_ATTR);
        if (value == null) {
            return FitModel.UNDEFINED;
        }
        FitModel model = FitModel.fromValue(value.toString());
        if (model == null) {
            log.warn("Unknown fit model '{}' in {}", value, group);
            return FitModel.UNDEFINED;
        }
        return model;
    }

    /**
     * Records the model fitted to derive this result set.
     *
     * @param model the model
     * @throws IOException if the store cannot be written
     */
    public void setFitModel(FitModel model) throws IOException {
        Map<String, Object> attributes = store().getAttributes(group);
        attributes.put(BrimLayout.FIT_MODEL_ATTR, model.getValue());
        store().setAttributes(group, attributes);
    }

    /**
     * Stores a quantity for the first peak of a fit.
     *
     * @see #writeQuantity(Quantity, PeakType, int, NdArray, String)
     */
    public void writeQuantity(Quantity quantity, PeakType peak, NdArray values, String units)
        throws IOException {
        writeQuantity(quantity, peak, 0, values, units);
    }

    /**
     * Stores a quantity. Values have one entry per stored spectrum, so their
     * shape is that of the PSD without its spectral dimension, followed by
     * two matrix dimensions for {@link Quantity#COV_MATRIX}.
     *
     * @param quantity  a quantity which is not computed
     * @param peak      a peak which is not computed
     * @param peakIndex index of the peak in a multi-peak fit
     * @param values    the values
     * @param units     units of the values, empty for dimensionless values
     * @throws NameCollisionException if the quantity is already stored
     * @throws IOException            if the store cannot be written
     */
    public void writeQuantity(Quantity quantity, PeakType peak, int peakIndex, NdArray values,
        String units) throws IOException {
        Objects.requireNonNull(units, "units");
        StorePath path = arrayPath(quantity, peak, peakIndex);
        StorePath psd = dataGroup.resolve(BrimLayout.PSD);
        if (store().isArray(psd)) {
            int[] psdShape = store().getArrayInfo(psd).getShape();
            int[] expected = Arrays.copyOf(psdShape, psdShape.length - 1);
            int[] shape = values.getShape();
            int rank = expected.length + quantity.getTrailingRank();
            if (shape.length != rank
                || !Arrays.equals(Arrays.copyOf(shape, expected.length), expected)) {
                throw new IllegalArgumentException(String.format(
                    "%s of shape %s does not match the spectra, expected %s%s", quantity,
                    Arrays.toString(shape), Arrays.toString(expected),
                    quantity.getTrailingRank() > 0 ? " followed by a matrix" : ""));
            }
        } else {
            log.warn("Writing {} to {} before the spectra; its shape is not checked",
                quantity, group);
        }
        if (store().isArray(path)) {
            throw new NameCollisionException(String.format(
                "%s of peak %s %d already stored in %s", quantity, peak, peakIndex, group));
        }
        if (quantity.isFitError()) {
            StorePath errors = group.resolve(fitErrorGroupName(peak, peakIndex));
            if (!store().isGroup(errors)) {
                store().createGroup(errors.path);
            }
        }
        store().writeArray(path, values,
            Collections.<String, Object>singletonMap(BrimLayout.UNITS_ATTR, units));
        log.debug("Stored {} of peak {} {} in {}", quantity, peak, peakIndex, group);
    }

    /** A quantity found in the store. */
    private static final class Stored {
        final Quantity quantity;
        final PeakType peak;
        final int peakIndex;

        Stored(Quantity quantity, PeakType peak, int peakIndex) {
            this.quantity = quantity;
            this.peak = peak;
            this.peakIndex = peakIndex;
        }
    }

    private List<Stored> listStored() throws IOException {
        List<Stored> stored = new ArrayList<>();
        for (String child : store().listChildren(group)) {
            StorePath path = group.resolve(child);
            if (store().isGroup(path)) {
                if (!child.startsWith(BrimLayout.FIT_ERROR_PREFIX + "_")) {
                    continue;
                }
                String[] parts = child.substring(BrimLayout.FIT_ERROR_PREFIX.length() + 1)
                    .split("_");
                if (parts.length != 2) {
                    log.debug("Ignoring {} in {}", child, group);
                    continue;
                }
                for (String name : store().listChildren(path)) {
                    Stored s = parse(name, parts[0], parts[1]);
                    if (s != null && s.quantity.isFitError()) {
                        stored.add(s);
                    }
                }
            } else {
                int last = child.lastIndexOf('_');
                int previous = last > 0 ? child.lastIndexOf('_', last - 1) : -1;
                if (previous <= 0) {
                    log.debug("Ignoring {} in {}", child, group);
                    continue;
                }
                Stored s = parse(child.substring(0, previous),
                    child.substring(previous + 1, last), child.substring(last + 1));
                if (s != null && !s.quantity.isFitError()) {
                    stored.add(s);
                }
            }
        }
        return stored;
    }

    private Stored parse(String quantity, String peak, String index) {
        try {
            Quantity q = Quantity.fromName(quantity);
            PeakType p = PeakType.fromId(peak);
            int i = Integer.parseInt(index);
            if (q.isComputed() || p.isComputed() || i < 0) {
                return null;
            }
            return new Stored(q, p, i);
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring {}_{}_{} in {}: {}", quantity, peak, index, group,
                e.getMessage());
            return null;
        }
    }

    /**
     * Lists the peaks stored for the first peak of a fit.
     *
     * @see #listExistingPeakTypes(int)
     */
    public List<PeakType> listExistingPeakTypes() throws IOException {
        return listExistingPeakTypes(0);
    }

    /**
     * Lists the peaks with at least one stored quantity, anti-Stokes and
     * Stokes first.
     *
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public List<PeakType> listExistingPeakTypes(int peakIndex) throws IOException {
        Set<PeakType> peaks = new LinkedHashSet<>();
        List<Stored> stored = listStored();
        for (PeakType standard : new PeakType[] { PeakType.ANTI_STOKES, PeakType.STOKES }) {
            for (Stored s : stored) {
                if (s.peakIndex == peakIndex && s.peak.equals(standard)) {
                    peaks.add(standard);
                }
            }
        }
        for (Stored s : stored) {
            if (s.peakIndex == peakIndex) {
                peaks.add(s.peak);
            }
        }
        return new ArrayList<>(peaks);
    }

    /**
     * Lists the quantities available for a peak, including the computed
     * elastic contrast when the shift is stored. For the average peak the
     * quantities of either the anti-Stokes or the Stokes peak are listed.
     *
     * @param peak      the peak
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public List<Quantity> listExistingQuantities(PeakType peak, int peakIndex)
        throws IOException {
        List<PeakType> peaks = peak.isComputed()
            ? Arrays.asList(PeakType.ANTI_STOKES, PeakType.STOKES)
            : Collections.singletonList(peak);
        Set<Quantity> found = new LinkedHashSet<>();
        for (Stored s : listStored()) {
            if (s.peakIndex == peakIndex && peaks.contains(s.peak)) {
                found.add(s.quantity);
            }
        }
        List<Quantity> quantities = new ArrayList<>();
        for (Quantity q : Quantity.STANDARD) {
            if (found.contains(q)) {
                quantities.add(q);
            }
        }
        for (Quantity q : found) {
            if (q.getKind() == Quantity.Kind.CUSTOM) {
                quantities.add(q);
            }
        }
        if (found.contains(Quantity.SHIFT)) {
            quantities.add(Quantity.ELASTIC_CONTRAST);
        }
        return quantities;
    }

    private List<PeakType> averagedPeaks(Quantity quantity, int peakIndex) throws IOException {
        List<PeakType> peaks = new ArrayList<>();
        for (PeakType peak : new PeakType[] { PeakType.ANTI_STOKES, PeakType.STOKES }) {
            if (store().isArray(arrayPath(quantity, peak, peakIndex))) {
                peaks.add(peak);
            }
        }
        if (peaks.isEmpty()) {
            throw new NotFoundException(String.format(
                "No %s of the anti-Stokes or Stokes peak %d in %s to average",
                quantity, peakIndex, group));
        }
        return peaks;
    }

    private StorePath requireStored(Quantity quantity, PeakType peak, int peakIndex)
        throws IOException {
        StorePath path = arrayPath(quantity, peak, peakIndex);
        if (!store().isArray(path)) {
            throw new NotFoundException(String.format(
                "No %s of peak %s %d in %s", quantity, peak, peakIndex, group));
        }
        return path;
    }

    private String unitsOf(StorePath array) throws IOException {
        Object units = store().getAttributes(array).get(BrimLayout.UNITS_ATTR);
        if (units == null) {
            log.warn("No units recorded for {}", array);
            return null;
        }
        return units.toString();
    }

    /**
     * Gets the units of a quantity of the averaged peaks.
     *
     * @see #getUnits(Quantity, PeakType, int)
     */
    public String getUnits(Quantity quantity) throws IOException {
        return getUnits(quantity, PeakType.AVERAGE, 0);
    }

    /**
     * Gets the units of a quantity. The elastic contrast is dimensionless;
     * the average peak carries the units of the anti-Stokes peak, or of the
     * Stokes peak when only that one is stored.
     *
     * @param quantity  the quantity
     * @param peak      the peak
     * @param peakIndex index of the peak in a multi-peak fit
     * @return the units, {@code null} if none were recorded
     * @throws NotFoundException if the quantity is not stored
     * @throws IOException       if the store cannot be read
     */
    public String getUnits(Quantity quantity, PeakType peak, int peakIndex) throws IOException {
        if (quantity.isComputed()) {
            getUnits(Quantity.SHIFT, peak, peakIndex);
            return "";
        }
        if (peak.isComputed()) {
            List<PeakType> peaks = averagedPeaks(quantity, peakIndex);
            return averagedUnits(quantity, peaks, peakIndex);
        }
        return unitsOf(requireStored(quantity, peak, peakIndex));
    }

    private String averagedUnits(Quantity quantity, List<PeakType> peaks, int peakIndex)
        throws IOException {
        String units = unitsOf(arrayPath(quantity, peaks.get(0), peakIndex));
        for (PeakType peak : peaks.subList(1, peaks.size())) {
            String other = unitsOf(arrayPath(quantity, peak, peakIndex));
            if (!Objects.equals(units, other)) {
                log.warn("Inconsistent units of {} between peaks {}: {} and {}",
                    quantity, peaks, units, other);
            }
        }
        return units;
    }

    /**
     * Reconstructs the image of a quantity averaged over the anti-Stokes and
     * Stokes peaks.
     *
     * @see #getImage(Quantity, PeakType, int)
     */
    public SpatialGrid getImage(Quantity quantity) throws IOException {
        return getImage(quantity, PeakType.AVERAGE, 0);
    }

    /**
     * Reconstructs the image of a quantity of the first peak of a fit.
     *
     * @see #getImage(Quantity, PeakType, int)
     */
    public SpatialGrid getImage(Quantity quantity, PeakType peak) throws IOException {
        return getImage(quantity, peak, 0);
    }

    /**
     * Reconstructs the image of a quantity on the spatial grid of the data
     * group. Pixels without data are NaN. The average peak is
     * {@code (|AS| + |S|) / 2} and is NaN everywhere when only one of the
     * two peaks is stored.
     *
     * @param quantity  the quantity
     * @param peak      the peak
     * @param peakIndex index of the peak in a multi-peak fit
     * @return a newly allocated image
     * @throws NotFoundException if the quantity is neither stored nor
     *                           derivable from stored peaks
     * @throws IOException       if the store cannot be read or the grid
     *                           cannot be reconstructed
     */
    public SpatialGrid getImage(Quantity quantity, PeakType peak, int peakIndex)
        throws IOException {
        if (quantity.isComputed()) {
            SpatialGrid shift = getImage(Quantity.SHIFT, peak, peakIndex);
            double[] values = shift.getValues();
            double water = waterShift(nanMean(values));
            for (int i = 0; i < values.length; i++) {
                values[i] = values[i] / water - 1;
            }
            return new SpatialGrid(values, shift.getShape(), shift.getAxes(),
                shift.getPixelSize(), shift.getPixelUnits(), "");
        }
        GridLayout layout = mapping.resolve(dataGroup);
        if (!peak.isComputed()) {
            StorePath path = requireStored(quantity, peak, peakIndex);
            return layout.scatter(store().readArray(path), unitsOf(path));
        }

        List<PeakType> peaks = averagedPeaks(quantity, peakIndex);
        String units = averagedUnits(quantity, peaks, peakIndex);
        SpatialGrid first = layout.scatter(
            store().readArray(arrayPath(quantity, peaks.get(0), peakIndex)), units);
        double[] values = first.getValues();
        if (peaks.size() < 2) {
            log.debug("Only peak {} of {} stored, average undefined", peaks.get(0), quantity);
            Arrays.fill(values, Double.NaN);
        } else {
            SpatialGrid second = layout.scatter(
                store().readArray(arrayPath(quantity, peaks.get(1), peakIndex)), units);
            double[] other = second.getValues();
            for (int i = 0; i < values.length; i++) {
                values[i] = (Math.abs(values[i]) + Math.abs(other[i])) / 2;
            }
        }
        return new SpatialGrid(values, first.getShape(), first.getAxes(), first.getPixelSize(),
            first.getPixelUnits(), units);
    }

    /**
     * Reads a quantity averaged over the anti-Stokes and Stokes peaks at one
     * pixel.
     *
     * @see #getQuantityAtPixel(int[], Quantity, PeakType, int)
     */
    public PixelValue getQuantityAtPixel(int[] index, Quantity quantity) throws IOException {
        return getQuantityAtPixel(index, quantity, PeakType.AVERAGE, 0);
    }

    /**
     * Reads a quantity of the first peak of a fit at one pixel.
     *
     * @see #getQuantityAtPixel(int[], Quantity, PeakType, int)
     */
    public PixelValue getQuantityAtPixel(int[] index, Quantity quantity, PeakType peak)
        throws IOException {
        return getQuantityAtPixel(index, quantity, peak, 0);
    }

    /**
     * Reads a quantity at one pixel, touching only the chunks of the one or
     * two arrays involved. Follows the semantics of
     * {@link #getImage(Quantity, PeakType, int)}: a pixel without data, or
     * the average where only one peak is stored, is NaN, and samples sharing
     * the pixel must agree.
     *
     * @param index     position on the grid, one entry per spatial axis
     * @param quantity  the quantity
     * @param peak      the peak
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     * @throws NotFoundException if the quantity is neither stored nor
     *                           derivable from stored peaks
     * @throws com.glencoesoftware.brim.exceptions.IndexOutOfRangeException
     *                           if the position is outside the grid
     * @throws com.glencoesoftware.brim.exceptions.DuplicateCoordinateException
     *                           if samples sharing the pixel differ
     * @throws IOException       if the store cannot be read
     */
    public PixelValue getQuantityAtPixel(int[] index, Quantity quantity, PeakType peak,
        int peakIndex) throws IOException {
        if (quantity.isComputed()) {
            PixelValue shift = getQuantityAtPixel(index, Quantity.SHIFT, peak, peakIndex);
            return elasticContrast(shift);
        }
        GridCell cell = mapping.locate(dataGroup, index);
        if (!peak.isComputed()) {
            StorePath path = requireStored(quantity, peak, peakIndex);
            return readPixel(cell, path, unitsOf(path));
        }
        List<PeakType> peaks = averagedPeaks(quantity, peakIndex);
        String units = averagedUnits(quantity, peaks, peakIndex);
        PixelValue first = readPixel(cell, arrayPath(quantity, peaks.get(0), peakIndex), units);
        double[] values = first.getValues();
        if (peaks.size() < 2) {
            Arrays.fill(values, Double.NaN);
        } else {
            double[] other = readPixel(cell, arrayPath(quantity, peaks.get(1), peakIndex),
                units).getValues();
            for (int i = 0; i < values.length; i++) {
                values[i] = (Math.abs(values[i]) + Math.abs(other[i])) / 2;
            }
        }
        return new PixelValue(values, first.getShape(), units);
    }

    private PixelValue readPixel(GridCell cell, StorePath array, String units)
        throws IOException {
        NdArray values = cell.read(store(), array);
        return new PixelValue(values.asDoubles(), values.getShape(), units);
    }

    /**
     * Reads every available quantity at one pixel, as
     * {@code quantity -> peak -> value}. The average peak is reported for
     * quantities stored for both the anti-Stokes and Stokes peaks, and the
     * elastic contrast for every peak with a shift.
     *
     * @param index     position on the grid, one entry per spatial axis
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public Map<Quantity, Map<PeakType, PixelValue>> getAllQuantitiesAtPixel(int[] index,
        int peakIndex) throws IOException {
        GridCell cell = mapping.locate(dataGroup, index);
        Map<Quantity, Map<PeakType, PixelValue>> result = new LinkedHashMap<>();
        for (PeakType peak : listExistingPeakTypes(peakIndex)) {
            for (Quantity quantity : listExistingQuantities(peak, peakIndex)) {
                if (quantity.isComputed()) {
                    continue;
                }
                StorePath path = arrayPath(quantity, peak, peakIndex);
                result.computeIfAbsent(quantity, q -> new LinkedHashMap<>())
                    .put(peak, readPixel(cell, path, unitsOf(path)));
            }
        }
        for (Map.Entry<Quantity, Map<PeakType, PixelValue>> e : result.entrySet()) {
            PixelValue as = e.getValue().get(PeakType.ANTI_STOKES);
            PixelValue s = e.getValue().get(PeakType.STOKES);
            if (as == null || s == null) {
                continue;
            }
            if (!Objects.equals(as.getUnits(), s.getUnits())) {
                log.warn("Inconsistent units of {} between anti-Stokes and Stokes: {} and {}",
                    e.getKey(), as.getUnits(), s.getUnits());
            }
            double[] a = as.getValues();
            double[] b = s.getValues();
            for (int i = 0; i < a.length; i++) {
                a[i] = (Math.abs(a[i]) + Math.abs(b[i])) / 2;
            }
            e.getValue().put(PeakType.AVERAGE, new PixelValue(a, as.getShape(), as.getUnits()));
        }
        Map<PeakType, PixelValue> shifts = result.get(Quantity.SHIFT);
        if (shifts != null) {
            Map<PeakType, PixelValue> contrast = new LinkedHashMap<>();
            for (Map.Entry<PeakType, PixelValue> e : shifts.entrySet()) {
                contrast.put(e.getKey(), elasticContrast(e.getValue()));
            }
            result.put(Quantity.ELASTIC_CONTRAST, contrast);
        }
        return result;
    }

    private PixelValue elasticContrast(PixelValue shift) throws IOException {
        double[] values = shift.getValues();
        double water = waterShift(nanMean(values));
        for (int i = 0; i < values.length; i++) {
            values[i] = values[i] / water - 1;
        }
        return new PixelValue(values, shift.getShape(), "");
    }

    /**
     * Brillouin shift of water under the acquisition conditions recorded in
     * the metadata, with the sign of the measured shifts.
     */
    private double waterShift(double meanShift) throws IOException {
        MetadataItem wavelength;
        try {
            wavelength = metadata.get(MetadataCategory.OPTICS, WAVELENGTH_KEY);
        } catch (NotFoundException e) {
            throw new NotFoundException(
                "Elastic contrast needs the wavelength in Optics." + WAVELENGTH_KEY, e);
        }
        double wavelengthNm = BrillouinPhysics.toNanometers(
            wavelength.getValue().asDouble(), wavelength.getUnits());
        double temperature = optional(MetadataCategory.EXPERIMENT, TEMPERATURE_KEY,
            BrillouinPhysics.DEFAULT_TEMPERATURE_C);
        double angle = optional(MetadataCategory.BRILLOUIN, SCATTERING_ANGLE_KEY,
            BrillouinPhysics.DEFAULT_SCATTERING_ANGLE_DEG);
        double water = BrillouinPhysics.waterShiftGHz(wavelengthNm, temperature, angle);
        return meanShift < 0 ? -water : water;
    }

    private double optional(MetadataCategory category, String key, double defaultValue)
        throws IOException {
        if (!metadata.contains(category, key)) {
            log.warn("No {}.{} in the metadata, using {}", category.getName(), key,
                defaultValue);
            return defaultValue;
        }
        return metadata.get(category, key).getValue().asDouble();
    }

    private static double nanMean(double[] values) {
        double sum = 0;
        int n = 0;
        for (double v : values) {
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    @Override
    public String toString() {
        return "AnalysisResults{" + group + '}';
    }
}
