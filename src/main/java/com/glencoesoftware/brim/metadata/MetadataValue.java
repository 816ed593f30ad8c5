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

import com.glencoesoftware.brim.Utils;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A typed metadata value. The {@link Type} tag travels with the value so
 * that it reads back with the type it was written with.
 */
public abstract class MetadataValue {

    /** Kinds of metadata values and their stored tags. */
    public enum Type {
        FLOAT("float"),
        INTEGER("int"),
        STRING("str"),
        BOOLEAN("bool"),
        DATETIME("datetime"),
        FLOAT_ARRAY("float_array");

        private final String tag;

        Type(String tag) {
            this.tag = tag;
        }

        public String getTag() {
            return tag;
        }

        public static Type fromTag(String tag) {
            for (Type type : values()) {
                if (type.tag.equals(tag)) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown metadata type: " + tag);
        }
    }

    private MetadataValue() {
    }

    public abstract Type getType();

    /** The value as a plain Java object. */
    public abstract Object getValue();

    /** The value as stored in JSON attributes. */
    abstract Object encode();

    public static MetadataValue of(double value) {
        return new FloatValue(value);
    }

    public static MetadataValue of(long value) {
        return new IntegerValue(value);
    }

    public static MetadataValue of(String value) {
        return new StringValue(Objects.requireNonNull(value, "value"));
    }

    public static MetadataValue of(boolean value) {
        return new BooleanValue(value);
    }

    public static MetadataValue of(OffsetDateTime value) {
        return new DateTimeValue(Objects.requireNonNull(value, "value"));
    }

    public static MetadataValue of(double[] value) {
        return new FloatArrayValue(value.clone());
    }

    /**
     * Wraps a plain Java value, inferring its type.
     *
     * @param value a number, string, boolean, date-time or double array
     * @return See above.
     * @throws IllegalArgumentException if the value has no metadata type
     */
    public static MetadataValue infer(Object value) {
        if (value instanceof MetadataValue) {
            return (MetadataValue) value;
        }
        if (value instanceof Double || value instanceof Float) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
            || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof String) {
            return of((String) value);
        }
        if (value instanceof Boolean) {
            return of(((Boolean) value).booleanValue());
        }
        if (value instanceof OffsetDateTime) {
            return of((OffsetDateTime) value);
        }
        if (value instanceof double[]) {
            return of((double[]) value);
        }
        throw new IllegalArgumentException("No metadata type for "
            + (value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Decodes a value read from JSON attributes.
     *
     * @param type    the stored type tag
     * @param encoded the stored value
     * @return See above.
     * @throws IllegalArgumentException if the stored value does not match
     *                                  its type
     */
    static MetadataValue decode(Type type, Object encoded) {
        switch (type) {
            case FLOAT:
                return of(Utils.toDouble(encoded));
            case INTEGER:
                if (!(encoded instanceof Number)) {
                    throw new IllegalArgumentException("Expected integer but was " + encoded);
                }
                return of(((Number) encoded).longValue());
            case STRING:
                return of(String.valueOf(encoded));
            case BOOLEAN:
                if (!(encoded instanceof Boolean)) {
                    throw new IllegalArgumentException("Expected boolean but was " + encoded);
                }
                return of(((Boolean) encoded).booleanValue());
            case DATETIME:
                try {
                    return of(OffsetDateTime.parse(String.valueOf(encoded)));
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Invalid date-time " + encoded, e);
                }
            case FLOAT_ARRAY:
                return of(Utils.castToDoubleArray(encoded));
            default:
                throw new IllegalStateException("Unhandled type " + type);
        }
    }

    /** JSON has no literal for non-finite numbers, those are written as strings. */
    private static Object encodeDouble(double value) {
        return Double.isFinite(value) ? (Object) value : Double.toString(value);
    }

    private UnsupportedOperationException wrongType(Type requested) {
        return new UnsupportedOperationException(
            "Metadata value of type " + getType() + " read as " + requested);
    }

    public double asDouble() {
        throw wrongType(Type.FLOAT);
    }

    public long asLong() {
        throw wrongType(Type.INTEGER);
    }

    public String asString() {
        throw wrongType(Type.STRING);
    }

    public boolean asBoolean() {
        throw wrongType(Type.BOOLEAN);
    }

    public OffsetDateTime asDateTime() {
        throw wrongType(Type.DATETIME);
    }

    public double[] asDoubleArray() {
        throw wrongType(Type.FLOAT_ARRAY);
    }

    @Override
    public String toString() {
        return getType().getTag() + ":" + getValue();
    }

    private static final class FloatValue extends MetadataValue {
        private final double value;

        FloatValue(double value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.FLOAT;
        }

        @Override
        public Object getValue() {
            return value;
        }

        @Override
        Object encode() {
            return encodeDouble(value);
        }

        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FloatValue
                && Double.compare(value, ((FloatValue) obj).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }
    }

    private static final class IntegerValue extends MetadataValue {
        private final long value;

        IntegerValue(long value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.INTEGER;
        }

        @Override
        public Object getValue() {
            return value;
        }

        @Override
        Object encode() {
            return value;
        }

        @Override
        public long asLong() {
            return value;
        }

        // integers are numbers too
        @Override
        public double asDouble() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof IntegerValue && value == ((IntegerValue) obj).value;
        }

        @Override
        public int hashCode() {
            return Long.hashCode(value);
        }
    }

    private static final class StringValue extends MetadataValue {
        private final String value;

        StringValue(String value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.STRING;
        }

        @Override
        public Object getValue() {
            return value;
        }

        @Override
        Object encode() {
            return value;
        }

        @Override
        public String asString() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof StringValue && value.equals(((StringValue) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    private static final class BooleanValue extends MetadataValue {
        private final boolean value;

        BooleanValue(boolean value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.BOOLEAN;
        }

        @Override
        public Object getValue() {
            return value;
        }

        @Override
        Object encode() {
            return value;
        }

        @Override
        public boolean asBoolean() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof BooleanValue && value == ((BooleanValue) obj).value;
        }

        @Override
        public int hashCode() {
            return Boolean.hashCode(value);
        }
    }

    private static final class DateTimeValue extends MetadataValue {
        private final OffsetDateTime value;

        DateTimeValue(OffsetDateTime value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.DATETIME;
        }

        @Override
        public Object getValue() {
            return value;
        }

        @Override
        Object encode() {
            return value.toString();
        }

        @Override
        public OffsetDateTime asDateTime() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof DateTimeValue && value.equals(((DateTimeValue) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    private static final class FloatArrayValue extends MetadataValue {
        private final double[] value;

        FloatArrayValue(double[] value) {
            this.value = value;
        }

        @Override
        public Type getType() {
            return Type.FLOAT_ARRAY;
        }

        @Override
        public Object getValue() {
            return value.clone();
        }

        @Override
        Object encode() {
            List<Object> list = new ArrayList<>(value.length);
            for (double v : value) {
                list.add(encodeDouble(v));
            }
            return list;
        }

        @Override
        public double[] asDoubleArray() {
            return value.clone();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FloatArrayValue
                && Arrays.equals(value, ((FloatArrayValue) obj).value);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(value);
        }

        @Override
        public String toString() {
            return getType().getTag() + ":" + Arrays.toString(value);
        }
    }
}
