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

package com.glencoesoftware.brim.metadata;

import java.util.Objects;

/**
 * A metadata value with its physical units. Items written without units
 * are unit-less, which is reported by {@link #isUnitless()} rather than
 * replaced by a default unit.
 */
public final class MetadataItem {

    private final MetadataValue value;

    private final String units;

    public MetadataItem(MetadataValue value, String units) {
        this.value = Objects.requireNonNull(value, "value");
        this.units = units;
    }

    public MetadataValue getValue() {
        return value;
    }

    public MetadataValue.Type getType() {
        return value.getType();
    }

    /** Units of the value or {@code null} if none were given. */
    public String getUnits() {
        return units;
    }

    public boolean isUnitless() {
        return units == null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MetadataItem)) {
            return false;
        }
        MetadataItem other = (MetadataItem) obj;
        return value.equals(other.value) && Objects.equals(units, other.units);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, units);
    }

    @Override
    public String toString() {
        return units == null ? value.toString() : value + " " + units;
    }
}
