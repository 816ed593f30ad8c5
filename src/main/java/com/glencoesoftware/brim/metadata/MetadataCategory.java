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

/**
 * Categories metadata entries are organized in.
 */
public enum MetadataCategory {
    EXPERIMENT("Experiment"),
    OPTICS("Optics"),
    BRILLOUIN("Brillouin"),
    ACQUISITION("Acquisition"),
    SPECTROMETER("Spectrometer");

    private final String name;

    MetadataCategory(String name) {
        this.name = name;
    }

    /** Name of the category as stored. */
    public String getName() {
        return name;
    }

    /**
     * Looks up a category by its stored name.
     *
     * @param name the stored name
     * @return See above.
     * @throws IllegalArgumentException if no category has this name
     */
    public static MetadataCategory fromName(String name) {
        for (MetadataCategory category : values()) {
            if (category.name.equals(name)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown metadata category: " + name);
    }
}
