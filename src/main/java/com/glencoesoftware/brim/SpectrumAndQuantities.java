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

import com.glencoesoftware.brim.analysis.PeakType;
import com.glencoesoftware.brim.analysis.PixelValue;
import com.glencoesoftware.brim.analysis.Quantity;
import com.glencoesoftware.brim.spectra.Spectrum;
import java.util.Collections;
import java.util.Map;

/**
 * The spectrum at one grid position together with every quantity an
 * analysis derived there.
 */
public final class SpectrumAndQuantities {

    private final Spectrum spectrum;

    private final Map<Quantity, Map<PeakType, PixelValue>> quantities;

    public SpectrumAndQuantities(Spectrum spectrum,
        Map<Quantity, Map<PeakType, PixelValue>> quantities) {
        this.spectrum = spectrum;
        this.quantities = quantities;
    }

    public Spectrum getSpectrum() {
        return spectrum;
    }

    /** Values as {@code quantity -> peak -> value}. */
    public Map<Quantity, Map<PeakType, PixelValue>> getQuantities() {
        return Collections.unmodifiableMap(quantities);
    }
}
