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
import java.util.stream.IntStream;

/**
 * An N-dimensional array held in memory as a flat, row-major Java primitive
 * array together with its shape and element type.
 */
public final class NdArray {

    /** One of double[], float[], int[], short[] or byte[]. */
    private final Object data;

    private final int[] shape;

    private final DType dtype;

    /**
     * Creates an array; the length of {@code data} must match the shape.
     *
     * @param data  flat row-major primitive array
     * @param shape the shape
     * @param dtype element type, which must be compatible with the Java type of {@code data}
     */
    public NdArray(Object data, int[] shape, DType dtype) {
        if (length(shape) != java.lang.reflect.Array.getLength(data)) {
            throw new IllegalArgumentException(String.format(
                "Data length %d does not match shape %s",
                java.lang.reflect.Array.getLength(data), Arrays.toString(shape)));
        }
        checkJavaType(data, dtype);
        this.data = data;
        this.shape = shape.clone();
        this.dtype = dtype;
    }

    public static NdArray of(double[] data, int... shape) {
        return new NdArray(data, shape, DType.FLOAT64);
    }

    public static NdArray of(float[] data, int... shape) {
        return new NdArray(data, shape, DType.FLOAT32);
    }

    public static NdArray of(int[] data, int... shape) {
        return new NdArray(data, shape, DType.INT32);
    }

    /**
     * Calculates the number of elements of a given NumPy like "shape".
     *
     * @param shape the shape
     * @return See above.
     */
    public static long length(int[] shape) {
        return IntStream.of(shape).mapToLong(a -> (long) a).reduce(1, Math::multiplyExact);
    }

    private static void checkJavaType(Object data, DType dtype) {
        boolean ok;
        switch (dtype) {
            case FLOAT64:
                ok = data instanceof double[];
                break;
            case FLOAT32:
                ok = data instanceof float[];
                break;
            case INT32:
            case UINT32:
                ok = data instanceof int[];
                break;
            case INT16:
            case UINT16:
                ok = data instanceof short[];
                break;
            default:
                ok = data instanceof byte[];
        }
        if (!ok) {
            throw new IllegalArgumentException(
                data.getClass().getSimpleName() + " cannot hold " + dtype);
        }
    }

    public Object getData() {
        return data;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public DType getDType() {
        return dtype;
    }

    public int size() {
        return java.lang.reflect.Array.getLength(data);
    }

    /**
     * Gets the element at a flat row-major position as a double.
     *
     * @param flatIndex the position
     * @return See above.
     */
    public double getDouble(int flatIndex) {
        switch (dtype) {
            case FLOAT64:
                return ((double[]) data)[flatIndex];
            case FLOAT32:
                return ((float[]) data)[flatIndex];
            case INT32:
                return ((int[]) data)[flatIndex];
            case UINT32:
                return Integer.toUnsignedLong(((int[]) data)[flatIndex]);
            case INT16:
                return ((short[]) data)[flatIndex];
            case UINT16:
                return Short.toUnsignedInt(((short[]) data)[flatIndex]);
            case INT8:
                return ((byte[]) data)[flatIndex];
            case UINT8:
                return Byte.toUnsignedInt(((byte[]) data)[flatIndex]);
            default:
                throw new IllegalStateException("Unhandled type " + dtype);
        }
    }

    /**
     * Converts every element to double; returns the backing array itself when
     * it already is a double[].
     *
     * @return See above.
     */
    public double[] asDoubles() {
        if (data instanceof double[]) {
            return (double[]) data;
        }
        double[] out = new double[size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = getDouble(i);
        }
        return out;
    }

    /**
     * Converts every element to int, which is only valid for integral types.
     *
     * @return See above.
     * @throws IllegalArgumentException if an unsigned value exceeds the int
     *                                  range
     */
    public int[] asInts() {
        if (!dtype.isIntegral()) {
            throw new IllegalStateException("Not an integral array: " + dtype);
        }
        if (dtype == DType.INT32) {
            return (int[]) data;
        }
        int[] out = new int[size()];
        for (int i = 0; i < out.length; i++) {
            double value = getDouble(i);
            if (value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException(String.format(
                    "Value %.0f at %d exceeds the int range", value, i));
            }
            out[i] = (int) value;
        }
        return out;
    }

    /**
     * Converts a multi-dimensional index into a flat row-major position.
     *
     * @param shape the shape being indexed
     * @param index the index, one entry per dimension
     * @return See above.
     */
    public static int flatIndex(int[] shape, int[] index) {
        int flat = 0;
        for (int i = 0; i < shape.length; i++) {
            flat = flat * shape[i] + index[i];
        }
        return flat;
    }

    @Override
    public String toString() {
        return "NdArray{shape=" + Arrays.toString(shape) + ", dtype=" + dtype + '}';
    }
}
