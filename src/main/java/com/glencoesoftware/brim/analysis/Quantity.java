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
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A quantity derived by fitting spectra: one of the standard quantities or
 * a custom one identified by its name.
 */
public final class Quantity {

    /** Standard quantities and the custom escape. */
    public enum Kind {
        SHIFT("Shift"),
        WIDTH("Width"),
        AMPLITUDE("Amplitude"),
        OFFSET("Offset"),
        R2("R2"),
        RMSE("RMSE"),
        COV_MATRIX("Cov_matrix"),
        ELASTIC_CONTRAST("Elastic_contrast"),
        CUSTOM(null);

        private final String name;

        Kind(String name) {
            this.name = name;
        }
    }

    public static final Quantity SHIFT = new Quantity(Kind.SHIFT, Kind.SHIFT.name);

    public static final Quantity WIDTH = new Quantity(Kind.WIDTH, Kind.WIDTH.name);

    public static final Quantity AMPLITUDE = new Quantity(Kind.AMPLITUDE, Kind.AMPLITUDE.name);

    public static final Quantity OFFSET = new Quantity(Kind.OFFSET, Kind.OFFSET.name);

    public static final Quantity R2 = new Quantity(Kind.R2, Kind.R2.name);

    public static final Quantity RMSE = new Quantity(Kind.RMSE, Kind.RMSE.name);

    /** Covariance matrix of the fit parameters, two trailing dimensions. */
    public static final Quantity COV_MATRIX = new Quantity(Kind.COV_MATRIX, Kind.COV_MATRIX.name);

    /** Computed from the shift and the metadata; never stored. */
    public static final Quantity ELASTIC_CONTRAST =
        new Quantity(Kind.ELASTIC_CONTRAST, Kind.ELASTIC_CONTRAST.name);

    /** Standard quantities, in the order they are reported. */
    public static final List<Quantity> STANDARD = Collections.unmodifiableList(Arrays.asList(
        SHIFT, WIDTH, AMPLITUDE, OFFSET, R2, RMSE, COV_MATRIX, ELASTIC_CONTRAST));

    private final Kind kind;

    private final String name;

    private Quantity(Kind kind, String name) {
        this.kind = kind;
        this.name = name;
    }

    /**
     * A custom quantity.
     *
     * @param name name of the quantity, without {@code /}
     * @return See above.
     */
    public static Quantity custom(String name) {
        if (name == null || name.isEmpty() || name.contains("/")
            || name.startsWith("Fit_error")) {
            throw new IllegalArgumentException("Invalid quantity name: " + name);
        }
        for (Quantity q : STANDARD) {
            if (q.name.equals(name)) {
                throw new IllegalArgumentException(name + " is a standard quantity");
            }
        }
        return new Quantity(Kind.CUSTOM, name);
    }

    /**
     * Looks up a quantity by name, standard names first.
     *
     * @param name name of the quantity
     * @return See above.
     */
    public static Quantity fromName(String name) {
        for (Quantity q : STANDARD) {
            if (q.name.equals(name)) {
                return q;
            }
        }
        return custom(name);
    }

    public Kind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }

    /** Whether the quantity describes the fit quality and is stored as a fit error. */
    public boolean isFitError() {
        return kind == Kind.R2 || kind == Kind.RMSE || kind == Kind.COV_MATRIX;
    }

    /** Whether the quantity is computed on read. */
    public boolean isComputed() {
        return kind == Kind.ELASTIC_CONTRAST;
    }

    /** Number of dimensions a value adds to the spatial ones. */
    public int getTrailingRank() {
        return kind == Kind.COV_MATRIX ? 2 : 0;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Quantity)) {
            return false;
        }
        Quantity other = (Quantity) obj;
        return kind == other.kind && name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name);
    }

    @Override
    public String toString() {
        return name;
    }
}
