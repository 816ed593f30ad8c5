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

import java.util.Objects;

/**
 * A fitted peak: anti-Stokes, Stokes, a custom named peak or the computed
 * average of the anti-Stokes and Stokes peaks.
 */
public final class PeakType {

    public static final PeakType ANTI_STOKES = new PeakType("AS", "AntiStokes");

    public static final PeakType STOKES = new PeakType("S", "Stokes");

    /** Mean of the absolute anti-Stokes and Stokes values; never stored. */
    public static final PeakType AVERAGE = new PeakType("avg", "average");

    private final String id;

    private final String name;

    private PeakType(String id, String name) {
        this.id = id;
        this.name = name;
    }

    /**
     * A custom peak.
     *
     * @param id identifier of the peak, without {@code _} or {@code /}
     * @return See above.
     */
    public static PeakType custom(String id) {
        if (id == null || id.isEmpty() || id.contains("_") || id.contains("/")) {
            throw new IllegalArgumentException("Invalid peak identifier: " + id);
        }
        PeakType known = standard(id);
        if (known != null) {
            throw new IllegalArgumentException(id + " is a standard peak");
        }
        return new PeakType(id, id);
    }

    /**
     * Looks up a peak by the identifier used in stored names.
     *
     * @param id the identifier
     * @return See above.
     */
    public static PeakType fromId(String id) {
        PeakType known = standard(id);
        return known != null ? known : custom(id);
    }

    private static PeakType standard(String id) {
        for (PeakType peak : new PeakType[] { ANTI_STOKES, STOKES, AVERAGE }) {
            if (peak.id.equals(id)) {
                return peak;
            }
        }
        return null;
    }

    /** Identifier used in stored names. */
    public String getId() {
        return id;
    }

    /** Human readable name. */
    public String getName() {
        return name;
    }

    public boolean isComputed() {
        return this.equals(AVERAGE);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof PeakType && id.equals(((PeakType) obj).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return name;
    }
}
