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

import java.util.Arrays;

/**
 * The value of a quantity at one pixel: a scalar, or a small array such as
 * a covariance matrix. NaN marks a pixel without data.
 */
public final class PixelValue {

    private final double[] values;

    private final int[] shape;

    private final String units;

    public PixelValue(double[] values, int[] shape, String units) {
        this.values = values;
        this.shape = shape;
        this.units = units;
    }

    /**
     * The scalar value.
     *
     * @return See above.
     * @throws IllegalStateException if the value is not a scalar
     */
    public double getValue() {
        if (values.length != 1 || shape.length != 0) {
            throw new IllegalStateException(
                "Value of shape " + Arrays.toString(shape) + " is not a scalar");
        }
        return values[0];
    }

    /** Flat, row-major values. */
    public double[] getValues() {
        return values.clone();
    }

    /** Shape of the value, empty for a scalar. */
    public int[] getShape() {
        return shape.clone();
    }

    public String getUnits() {
        return units;
    }

    public boolean isMissing() {
        for (double v : values) {
            if (!Double.isNaN(v)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        String v = shape.length == 0 ? Double.toString(values[0]) : Arrays.toString(values);
        return units == null || units.isEmpty() ? v : v + " " + units;
    }
}
