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

import com.glencoesoftware.brim.store.S3Backend;
import java.util.Properties;

/**
 * Tunable parameters of a {@link BrimFile}. Instances are immutable; the
 * {@code with*} methods return modified copies.
 */
public final class BrimOptions {

    public static final String RELATIVE_TOLERANCE_KEY = "brim.grid.relativeTolerance";

    public static final String INTEGER_TOLERANCE_KEY = "brim.grid.integerTolerance";

    public static final String CACHE_SIZE_KEY = "brim.store.cacheSize";

    public static final String CHUNK_BYTES_KEY = "brim.store.chunkBytes";

    /** Default options. */
    public static final BrimOptions DEFAULT = new BrimOptions(1e-6, 1e-3, 64, 1 << 20, null);

    /**
     * Coordinates closer than this fraction of an axis range are considered
     * the same grid line.
     */
    private final double relativeTolerance;

    /**
     * Allowed deviation, in pixels, of a grid extent or a coordinate from an
     * integer grid position.
     */
    private final double integerTolerance;

    private final long cacheSize;

    private final int chunkBytes;

    /** Shared S3 connections, {@code null} for one per file. */
    private final S3Backend s3Backend;

    private BrimOptions(double relativeTolerance, double integerTolerance, long cacheSize,
        int chunkBytes, S3Backend s3Backend) {
        if (!(relativeTolerance >= 0) || !(relativeTolerance < 1)) {
            throw new IllegalArgumentException(
                "Relative tolerance must be in [0, 1): " + relativeTolerance);
        }
        if (!(integerTolerance >= 0) || !(integerTolerance < 0.5)) {
            throw new IllegalArgumentException(
                "Integer tolerance must be in [0, 0.5): " + integerTolerance);
        }
        if (cacheSize < 0) {
            throw new IllegalArgumentException("Negative cache size: " + cacheSize);
        }
        if (chunkBytes <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkBytes);
        }
        this.relativeTolerance = relativeTolerance;
        this.integerTolerance = integerTolerance;
        this.cacheSize = cacheSize;
        this.chunkBytes = chunkBytes;
        this.s3Backend = s3Backend;
    }

    /**
     * Reads options from properties, falling back to the defaults for keys
     * which are absent.
     *
     * @param properties source of option values
     * @return See above.
     */
    public static BrimOptions fromProperties(Properties properties) {
        try {
            return new BrimOptions(
                Double.parseDouble(properties.getProperty(RELATIVE_TOLERANCE_KEY,
                    Double.toString(DEFAULT.relativeTolerance))),
                Double.parseDouble(properties.getProperty(INTEGER_TOLERANCE_KEY,
                    Double.toString(DEFAULT.integerTolerance))),
                Long.parseLong(properties.getProperty(CACHE_SIZE_KEY,
                    Long.toString(DEFAULT.cacheSize))),
                Integer.parseInt(properties.getProperty(CHUNK_BYTES_KEY,
                    Integer.toString(DEFAULT.chunkBytes))),
                null);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid brim option: " + e.getMessage(), e);
        }
    }

    public BrimOptions withRelativeTolerance(double value) {
        return new BrimOptions(value, integerTolerance, cacheSize, chunkBytes, s3Backend);
    }

    public BrimOptions withIntegerTolerance(double value) {
        return new BrimOptions(relativeTolerance, value, cacheSize, chunkBytes, s3Backend);
    }

    public BrimOptions withCacheSize(long value) {
        return new BrimOptions(relativeTolerance, integerTolerance, value, chunkBytes, s3Backend);
    }

    public BrimOptions withChunkBytes(int value) {
        return new BrimOptions(relativeTolerance, integerTolerance, cacheSize, value, s3Backend);
    }

    /**
     * Shares S3 connections between the files opened with the returned
     * options. The caller keeps ownership of the backend and closes it once
     * those files are closed.
     *
     * @param value the backend, {@code null} for one connection per file
     * @return See above.
     */
    public BrimOptions withS3Backend(S3Backend value) {
        return new BrimOptions(relativeTolerance, integerTolerance, cacheSize, chunkBytes, value);
    }

    public double getRelativeTolerance() {
        return relativeTolerance;
    }

    public double getIntegerTolerance() {
        return integerTolerance;
    }

    public long getCacheSize() {
        return cacheSize;
    }

    public int getChunkBytes() {
        return chunkBytes;
    }

    public S3Backend getS3Backend() {
        return s3Backend;
    }

    @Override
    public String toString() {
        return "BrimOptions{relativeTolerance=" + relativeTolerance
            + ", integerTolerance=" + integerTolerance
            + ", cacheSize=" + cacheSize
            + ", chunkBytes=" + chunkBytes
            + ", s3Backend=" + (s3Backend == null ? "private" : "shared") + '}';
    }
}
