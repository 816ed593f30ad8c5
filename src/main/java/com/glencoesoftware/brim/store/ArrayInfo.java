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

import java.util.Arrays;

/**
 * Shape, chunking and element type of a stored array, available without
 * reading any of its data.
 */
public final class ArrayInfo {

    private final int[] shape;

    private final int[] chunks;

    private final DType dtype;

    public ArrayInfo(int[] shape, int[] chunks, DType dtype) {
        this.shape = shape.clone();
        this.chunks = chunks.clone();
        this.dtype = dtype;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int[] getChunks() {
        return chunks.clone();
    }

    public DType getDType() {
        return dtype;
    }

    public int getRank() {
        return shape.length;
    }

    @Override
    public String toString() {
        return "ArrayInfo{shape=" + Arrays.toString(shape) + ", chunks="
            + Arrays.toString(chunks) + ", dtype=" + dtype + '}';
    }
}
