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

/**
 * Names of the groups, arrays and attributes making up a brim container.
 */
public final class BrimLayout {

    private BrimLayout() {
    }

    /** Root attribute holding the format version. */
    public static final String VERSION_ATTR = "brim_version";

    /** Version written by this implementation. */
    public static final String CURRENT_VERSION = "0.1";

    /** Oldest version this implementation can read. */
    public static final String MIN_SUPPORTED_VERSION = "0.1";

    /** Newest version this implementation can read. */
    public static final String MAX_SUPPORTED_VERSION = "0.1";

    /** Group holding all data groups. */
    public static final String BRILLOUIN_DATA = "Brillouin_data";

    public static final String DATA_GROUP_PREFIX = "Data_";

    public static final String ANALYSIS_PREFIX = "Analysis_";

    public static final String NAME_ATTR = "Name";

    public static final String SPARSE_ATTR = "Sparse";

    public static final String ELEMENT_SIZE_ATTR = "element_size";

    public static final String ELEMENT_SIZE_UNITS_ATTR = "element_size_units";

    public static final String METADATA_ATTR = "Metadata";

    public static final String UNITS_ATTR = "Units";

    public static final String FIT_MODEL_ATTR = "Fit_model";

    public static final String PSD = "PSD";

    public static final String FREQUENCY = "Frequency";

    /** Group of per-axis scan coordinates of sparse data. */
    public static final String SPATIAL_MAP = "Spatial_map";

    /** Optional index map of sparse data, -1 marking empty cells. */
    public static final String CARTESIAN_VISUALISATION = "Cartesian_visualisation";

    /**
     * Optional values of the parameters the spectra were acquired over; the
     * PSD holds one axis per parameter axis between its spatial and
     * frequency axes. Its {@link #NAME_ATTR} lists the parameter names.
     */
    public static final String PARAMETERS = "Parameters";

    /** Optional acquisition time of each spectrum. */
    public static final String TIMESTAMP = "Timestamp";

    public static final String DEFAULT_TIMESTAMP_UNITS = "ms";

    public static final String FIT_ERROR_PREFIX = "Fit_error";

    public static final String DEFAULT_PSD_UNITS = "a.u.";

    public static final String DEFAULT_FREQUENCY_UNITS = "GHz";

    public static final String DEFAULT_SPATIAL_UNITS = "um";
}
