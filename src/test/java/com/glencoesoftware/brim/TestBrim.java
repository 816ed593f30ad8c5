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
import com.glencoesoftware.brim.analysis.FitModel;
import com.glencoesoftware.brim.analysis.PeakType;
import com.glencoesoftware.brim.analysis.Quantity;
import com.glencoesoftware.brim.grid.Axis;
import com.glencoesoftware.brim.metadata.MetadataCategory;
import com.glencoesoftware.brim.metadata.MetadataValue;
import com.glencoesoftware.brim.spectra.Spectra;
import com.glencoesoftware.brim.store.NdArray;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TestBrim is a utility class for writing brim files holding synthetic
 * Lorentzian spectra on a Y/X grid, either dense or sparse, together with an
 * analysis result set of their shifts and widths.
 */
public class TestBrim {

    private int sizeY = 3;
    private int sizeX = 3;
    private int spectrumLength = 32;
    private double spacingY = 2.0;
    private double spacingX = 1.5;
    private boolean sparse = false;
    // Cells without a spectrum, sparse only
    private Set<Integer> missing = new HashSet<>();
    private boolean stokes = true;
    private boolean antiStokes = true;
    private Path path;

    /**
     * Create a new TestBrim writing to the given location.
     */
    public TestBrim(Path path) {
        this.path = path;
    }

    public TestBrim size(int sizeY, int sizeX) {
        this.sizeY = sizeY;
        this.sizeX = sizeX;
        return this;
    }

    public TestBrim spacing(double spacingY, double spacingX) {
        this.spacingY = spacingY;
        this.spacingX = spacingX;
        return this;
    }

    public TestBrim spectrumLength(int spectrumLength) {
        this.spectrumLength = spectrumLength;
        return this;
    }

    public TestBrim sparse(boolean sparse) {
        this.sparse = sparse;
        return this;
    }

    /**
     * Leave the cell (y, x) without a spectrum; implies sparse.
     */
    public TestBrim missing(int y, int x) {
        this.sparse = true;
        this.missing.add(y * sizeX + x);
        return this;
    }

    public TestBrim peaks(boolean antiStokes, boolean stokes) {
        this.antiStokes = antiStokes;
        this.stokes = stokes;
        return this;
    }

    public String location() {
        return path.toString();
    }

    /**
     * Anti-Stokes shift written at (y, x), in GHz.
     */
    public static double shift(int y, int x) {
        return 5.0 + 0.1 * y + 0.01 * x;
    }

    /**
     * Linewidth written at (y, x), in GHz.
     */
    public static double width(int y, int x) {
        return 0.5 + 0.001 * (y + x);
    }

    /**
     * Frequency axis of every spectrum, in GHz.
     */
    public double[] frequency() {
        double[] f = new double[spectrumLength];
        for (int i = 0; i < spectrumLength; i++) {
            f[i] = 2.0 + 6.0 * i / (spectrumLength - 1);
        }
        return f;
    }

    /**
     * Lorentzian spectrum expected at (y, x).
     */
    public double[] spectrum(int y, int x) {
        double[] f = frequency();
        double[] psd = new double[f.length];
        double w = width(y, x) / 2;
        for (int i = 0; i < f.length; i++) {
            double d = f[i] - shift(y, x);
            psd[i] = 100 * w * w / (d * d + w * w) + 1;
        }
        return psd;
    }

    /**
     * Grid cells holding a spectrum, in storage order. Sparse data is stored
     * in reverse scan order.
     */
    public List<int[]> storedCells() {
        List<int[]> cells = new ArrayList<>();
        for (int y = 0; y < sizeY; y++) {
            for (int x = 0; x < sizeX; x++) {
                if (!missing.contains(y * sizeX + x)) {
                    cells.add(new int[] {y, x});
                }
            }
        }
        if (sparse) {
            Collections.reverse(cells);
        }
        return cells;
    }

    /**
     * The spectra to write.
     */
    public Spectra spectra() {
        List<int[]> cells = storedCells();
        double[] psd = new double[cells.size() * spectrumLength];
        for (int i = 0; i < cells.size(); i++) {
            int[] c = cells.get(i);
            System.arraycopy(spectrum(c[0], c[1]), 0, psd, i * spectrumLength, spectrumLength);
        }
        NdArray frequency = NdArray.of(frequency(), spectrumLength);
        if (!sparse) {
            return Spectra.dense(NdArray.of(psd, sizeY, sizeX, spectrumLength), frequency,
                new double[] {spacingY, spacingX}, "um");
        }
        double[] ys = new double[cells.size()];
        double[] xs = new double[cells.size()];
        for (int i = 0; i < cells.size(); i++) {
            ys[i] = 10.0 + cells.get(i)[0] * spacingY;
            xs[i] = -4.0 + cells.get(i)[1] * spacingX;
        }
        Map<Axis, double[]> coordinates = new EnumMap<>(Axis.class);
        coordinates.put(Axis.Y, ys);
        coordinates.put(Axis.X, xs);
        return Spectra.sparse(NdArray.of(psd, cells.size(), spectrumLength), frequency,
            coordinates, "um");
    }

    /**
     * Per stored spectrum values of a function of (y, x), shaped like the
     * PSD without its spectral dimension.
     */
    public NdArray perSpectrum(ValueFunction function) {
        List<int[]> cells = storedCells();
        double[] values = new double[cells.size()];
        for (int i = 0; i < cells.size(); i++) {
            values[i] = function.apply(cells.get(i)[0], cells.get(i)[1]);
        }
        return sparse ? NdArray.of(values, values.length) : NdArray.of(values, sizeY, sizeX);
    }

    /**
     * Write the file: one data group with spectra, metadata and an analysis
     * result set holding shift and width of the selected peaks.
     */
    public TestBrim init() throws IOException {
        try (BrimFile file = BrimFile.create(location())) {
            file.getMetadata().set(MetadataCategory.OPTICS, "Wavelength",
                MetadataValue.of(660.0), "nm");
            DataGroup group = file.createDataGroup("test");
            group.writeSpectra(spectra());
            group.getMetadata().set(MetadataCategory.EXPERIMENT, "Temperature",
                MetadataValue.of(25.0), "C");
            AnalysisResults results = group.createAnalysisResults("fit");
            results.setFitModel(FitModel.LORENTZIAN);
            if (antiStokes) {
                results.writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES,
                    perSpectrum(TestBrim::shift), "GHz");
                results.writeQuantity(Quantity.WIDTH, PeakType.ANTI_STOKES,
                    perSpectrum(TestBrim::width), "GHz");
            }
            if (stokes) {
                results.writeQuantity(Quantity.SHIFT, PeakType.STOKES,
                    perSpectrum((y, x) -> -shift(y, x) - 0.2), "GHz");
                results.writeQuantity(Quantity.WIDTH, PeakType.STOKES,
                    perSpectrum((y, x) -> width(y, x) + 0.1), "GHz");
            }
        }
        return this;
    }

    /** A value per grid cell. */
    public interface ValueFunction {
        double apply(int y, int x);
    }
}
