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

package com.glencoesoftware.brim.store;

import com.bc.zarr.DataType;
import com.glencoesoftware.brim.exceptions.NotAContainerException;

/**
 * Element types of arrays held in a brim store, with their Zarr v2
 * counterparts.
 */
public enum DType {
    FLOAT64(DataType.f8, 8),
    FLOAT32(DataType.f4, 4),
    INT32(DataType.i4, 4),
    INT16(DataType.i2, 2),
    INT8(DataType.i1, 1),
    UINT32(DataType.u4, 4),
    UINT16(DataType.u2, 2),
    UINT8(DataType.u1, 1);

    private final DataType zarrType;

    private final int byteWidth;

    DType(DataType zarrType, int byteWidth) {
        this.zarrType = zarrType;
        this.byteWidth = byteWidth;
    }

    /**
     * Gets the jzarr data type.
     *
     * @return See above.
     */
    public DataType toZarr() {
        return zarrType;
    }

    /**
     * Gets the size in bytes of a single element.
     *
     * @return See above.
     */
    public int getByteWidth() {
        return byteWidth;
    }

    /**
     * Whether the type holds integral values.
     *
     * @return See above.
     */
    public boolean isIntegral() {
        return this != FLOAT64 && this != FLOAT32;
    }

    /**
     * Maps a jzarr data type to its {@link DType}.
     *
     * @param dataType the jzarr data type
     * @param array    the array of that type, for messages
     * @return See above.
     * @throws NotAContainerException if the data type is not supported
     */
    public static DType fromZarr(DataType dataType, StorePath array)
        throws NotAContainerException {
        for (DType type : values()) {
            if (type.zarrType == dataType) {
                return type;
            }
        }
        throw new NotAContainerException(
            "Data type " + dataType + " of " + array + " not supported");
    }
}
