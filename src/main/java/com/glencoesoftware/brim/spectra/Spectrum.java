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

import com.glencoesoftware.brim.store.NdArray;
import java.util.Arrays;

/**
 * The spectrum measured at one spatial position. When the spectra were
 * acquired over parameters it holds one spectrum per parameter value, with
 * the parameter axes first and the frequency axis last.
 */
public final class Spectrum {

    private final double[] psd;

    private final double[] frequency;

    private final int[] shape;

    private final String psdUnits;

    private final String frequencyUnits;

    public Spectrum(double[] psd, double[] frequency, String psdUnits, String frequencyUnits) {
        this(psd, frequency, new int[] { psd.length }, psdUnits, frequencyUnits);
    }

    /**
     * Default constructor.
     *
     * @param psd            flat, row-major PSD values
     * @param frequency      frequency of every PSD value
     * @param shape          shape of the PSD, the frequency axis last
     * @param psdUnits       units of the PSD
     * @param frequencyUnits units of the frequency
     */
    public Spectrum(double[] psd, double[] frequency, int[] shape, String psdUnits,
        String frequencyUnits) {
        if (shape.length < 1 || NdArray.length(shape) != psd.length) {
            throw new IllegalArgumentException(String.format(
                "PSD of length %d with shape %s", psd.length, Arrays.toString(shape)));
        }
        if (psd.length != frequency.length) {
            throw new IllegalArgumentException(String.format(
                "PSD of length %d with %d frequencies", psd.length, frequency.length));
        }
        this.psd = psd;
        this.frequency = frequency;
        this.shape = shape.clone();
        this.psdUnits = psdUnits;
        this.frequencyUnits = frequencyUnits;
    }

    public double[] getPsd() {
        return psd.clone();
    }

    public double[] getFrequency() {
        return frequency.clone();
    }

    /** Shape of the PSD, the frequency axis last. */
    public int[] getShape() {
        return shape.clone();
    }

    /** Shape of the parameter axes, empty without parameters. */
    public int[] getParameterShape() {
        return Arrays.copyOf(shape, shape.length - 1);
    }

    public String getPsdUnits() {
        return psdUnits;
    }

    public String getFrequencyUnits() {
        return frequencyUnits;
    }

    /** Number of frequency samples. */
    public int length() {
        return shape[shape.length - 1];
    }
}
