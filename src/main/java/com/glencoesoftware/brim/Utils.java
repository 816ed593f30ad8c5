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

package com.glencoesoftware.brim;

import java.util.List;
import java.util.Map;

/**
 * Helpers for reading untyped attribute maps.
 */
public class Utils {

    /**
     * Casts an {@link Object} to {@code Map<String, Object>} with basic
     * runtime type checks.
     *
     * @param value the value to cast
     * @return the value cast to {@code Map<String, Object>}
     * @throws IllegalArgumentException if {@code value} is {@code null} or not a
     *                                  {@link Map}
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> castToStringObjectMap(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Expected non-null Map value");
        }
        if (!(value instanceof Map)) {
            throw new IllegalArgumentException(
                "Expected Map but was " + value.getClass().getName());
        }
        return (Map<String, Object>) value;
    }

    /**
     * Converts a list of numbers, as decoded from JSON attributes, to a
     * {@code double[]}. The string {@code "NaN"} is accepted for missing
     * values.
     *
     * @param value the value to convert
     * @return See above.
     * @throws IllegalArgumentException if {@code value} is not a list of
     *                                  numbers
     */
    public static double[] castToDoubleArray(Object value) {
        if (!(value instanceof List)) {
            throw new IllegalArgumentException("Expected List but was "
                + (value == null ? "null" : value.getClass().getName()));
        }
        List<?> list = (List<?>) value;
        double[] result = new double[list.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = toDouble(list.get(i));
        }
        return result;
    }

    /**
     * Converts a number, as decoded from JSON attributes, to a double. The
     * strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"} are
     * accepted.
     *
     * @param value the value to convert
     * @return See above.
     * @throws IllegalArgumentException if {@code value} is not numeric
     */
    public static double toDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Expected number but was " + value, e);
            }
        }
        throw new IllegalArgumentException("Expected number but was "
            + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Returns a string attribute or a default if it is absent.
     *
     * @param attributes   attribute map
     * @param key          attribute name
     * @param defaultValue value returned when the attribute is absent
     * @return See above.
     */
    public static String getString(Map<String, Object> attributes, String key,
        String defaultValue) {
        Object value = attributes.get(key);
        return value == null ? defaultValue : value.toString();
    }

}
