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

/**
 * Line shape fitted to the spectra to derive a result set.
 */
public enum FitModel {
    UNDEFINED("Undefined"),
    LORENTZIAN("Lorentzian"),
    DHO("DHO"),
    GAUSSIAN("Gaussian"),
    VOIGT("Voigt"),
    CUSTOM("Custom");

    private final String value;

    FitModel(String value) {
        this.value = value;
    }

    /** Value as stored in the {@code Fit_model} attribute. */
    public String getValue() {
        return value;
    }

    /**
     * Looks up a model by its stored value.
     *
     * @param value stored value
     * @return the model or {@code null} if the value is unknown
     */
    public static FitModel fromValue(String value) {
        for (FitModel model : values()) {
            if (model.value.equals(value)) {
                return model;
            }
        }
        return null;
    }
}
