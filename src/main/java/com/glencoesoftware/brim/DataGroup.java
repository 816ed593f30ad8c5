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

package com.glencoesoftware.brim;

import com.glencoesoftware.brim.analysis.AnalysisResults;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.grid.SpatialMapping;
import com.glencoesoftware.brim.metadata.Metadata;
import com.glencoesoftware.brim.spectra.SpectralData;
import com.glencoesoftware.brim.spectra.Spectra;
import com.glencoesoftware.brim.spectra.Spectrum;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.StorePath;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One acquisition of a {@link BrimFile}: its spectra, metadata and the
 * analysis result sets derived from the spectra.
 */
public class DataGroup {

    private final StorePath group;

    private final StorePath brillouinData;

    private final SpatialMapping mapping;

    DataGroup(StorePath group, StorePath brillouinData, SpatialMapping mapping) {
        this.group = group;
        this.brillouinData = brillouinData;
        this.mapping = mapping;
    }

    private ArrayStore store() {
        return group.store;
    }

    public StorePath getPath() {
        return group;
    }

    /**
     * Gets the name of this data group.
     *
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public String getName() throws IOException {
        return nameOf(group);
    }

    static String nameOf(StorePath node) throws IOException {
        return Utils.getString(node.store.getAttributes(node), BrimLayout.NAME_ATTR,
            node.getName());
    }

    /**
     * Writes the spectra of this data group. Spectra can be written once.
     *
     * @param spectra the spectra
     * @throws NameCollisionException if spectra were already written
     * @throws IOException            if the store cannot be written
     */
    public void writeSpectra(Spectra spectra) throws IOException {
        SpectralData.write(group, spectra);
    }

    public boolean hasSpectralData() throws IOException {
        return store().isArray(group.resolve(BrimLayout.PSD));
    }

    /**
     * Gets the spectra of this data group.
     *
     * @return See above.
     * @throws NotFoundException if no spectra were written
     * @throws IOException       if the store cannot be read
     */
    public SpectralData getSpectralData() throws IOException {
        if (!hasSpectralData()) {
            throw new NotFoundException("No spectral data in " + group);
        }
        return new SpectralData(group, mapping);
    }

    /**
     * Gets the metadata of this data group; entries of the file are read
     * where this group has none.
     *
     * @return See above.
     */
    public Metadata getMetadata() {
        return new Metadata(group, brillouinData);
    }

    /**
     * Reads the spectrum at one grid position and every quantity of the
     * first peak of a fit at that position.
     *
     * @see #getSpectrumAndAllQuantitiesInImage(AnalysisResults, int[], int)
     */
    public SpectrumAndQuantities getSpectrumAndAllQuantitiesInImage(AnalysisResults results,
        int[] index) throws IOException {
        return getSpectrumAndAllQuantitiesInImage(results, index, 0);
    }

    /**
     * Reads the spectrum at one grid position and every quantity a result
     * set of this data group holds at that position. Only the chunks holding
     * that position are read.
     *
     * @param results   a result set of this data group
     * @param index     position on the grid, one entry per spatial axis
     * @param peakIndex index of the peak in a multi-peak fit
     * @return See above.
     * @throws com.glencoesoftware.brim.exceptions.IndexOutOfRangeException
     *                     if the position is outside the grid or no spectrum
     *                     was acquired there
     * @throws IOException if the store cannot be read
     */
    public SpectrumAndQuantities getSpectrumAndAllQuantitiesInImage(AnalysisResults results,
        int[] index, int peakIndex) throws IOException {
        if (!results.getDataGroupPath().equals(group)) {
            throw new IllegalArgumentException(
                results + " does not belong to data group " + group);
        }
        Spectrum spectrum = getSpectralData().getSpectrumInImage(index);
        return new SpectrumAndQuantities(spectrum,
            results.getAllQuantitiesAtPixel(index, peakIndex));
    }

    private List<StorePath> analysisNodes() throws IOException {
        return BrimFile.indexedChildren(group, BrimLayout.ANALYSIS_PREFIX);
    }

    /**
     * Lists the names of the analysis result sets, in creation order.
     *
     * @return See above.
     * @throws IOException if the store cannot be read
     */
    public List<String> listAnalysisResults() throws IOException {
        List<String> names = new ArrayList<>();
        for (StorePath node : analysisNodes()) {
            names.add(nameOf(node));
        }
        return names;
    }

    /**
     * Gets the first analysis result set.
     *
     * @see #getAnalysisResults(int)
     */
    public AnalysisResults getAnalysisResults() throws IOException {
        return getAnalysisResults(0);
    }

    /**
     * Gets an analysis result set by position in creation order.
     *
     * @param index the position
     * @return See above.
     * @throws NotFoundException if there is no such result set
     * @throws IOException       if the store cannot be read
     */
    public AnalysisResults getAnalysisResults(int index) throws IOException {
        List<StorePath> nodes = analysisNodes();
        if (index < 0 || index >= nodes.size()) {
            throw new NotFoundException(String.format(
                "No analysis results %d in %s, %d available", index, group, nodes.size()));
        }
        return bind(nodes.get(index));
    }

    /**
     * Gets an analysis result set by name.
     *
     * @param name the name
     * @return See above.
     * @throws NotFoundException if there is no such result set
     * @throws IOException       if the store cannot be read
     */
    public AnalysisResults getAnalysisResults(String name) throws IOException {
        for (StorePath node : analysisNodes()) {
            if (nameOf(node).equals(name)) {
                return bind(node);
            }
        }
        throw new NotFoundException("No analysis results named '" + name + "' in " + group);
    }

    /**
     * Creates an analysis result set with the next default name.
     *
     * @see #createAnalysisResults(String)
     */
    public AnalysisResults createAnalysisResults() throws IOException {
        return createAnalysisResults(null);
    }

    /**
     * Creates an analysis result set.
     *
     * @param name name of the set, {@code null} for the next unused
     *             {@code Analysis_<j>}
     * @return See above.
     * @throws NameCollisionException if a set with this name exists
     * @throws IOException            if the store cannot be written
     */
    public AnalysisResults createAnalysisResults(String name) throws IOException {
        StorePath node = BrimFile.createIndexedChild(group, BrimLayout.ANALYSIS_PREFIX, name);
        return bind(node);
    }

    private AnalysisResults bind(StorePath node) {
        return new AnalysisResults(node, group, mapping, getMetadata());
    }

    @Override
    public String toString() {
        return "DataGroup{" + group + '}';
    }
}
