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

package com.glencoesoftware.brim.grid;

/**
 * Spatial axes, in the order they appear in stored and reconstructed arrays.
 */
public enum Axis {
    Z("z"), Y("y"), X("x");

    private final String key;

    Axis(String key) {
        this.key = key;
    }

    /** Name of the coordinate array of this axis. */
    public String getKey() {
        return key;
    }

    /**
     * Looks up an axis by the name of its coordinate array.
     *
     * @param key one of {@code z}, {@code y} or {@code x}
     * @return the axis or {@code null} if the name is not an axis
     */
    public static Axis fromKey(String key) {
        for (Axis axis : values()) {
            if (axis.key.equals(key)) {
                return axis;
            }
        }
        return null;
    }
}
