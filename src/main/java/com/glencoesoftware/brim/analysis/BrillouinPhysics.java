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

package com.glencoesoftware.brim.analysis;

/**
 * Physical reference values used by computed quantities.
 */
public final class BrillouinPhysics {

    /** Refractive index of water, taken as constant over 20 to 40 °C. */
    public static final double WATER_REFRACTIVE_INDEX = 1.333;

    public static final double DEFAULT_TEMPERATURE_C = 22;

    public static final double DEFAULT_SCATTERING_ANGLE_DEG = 180;

    private BrillouinPhysics() {
    }

    /**
     * Speed of sound in water, a 4th order polynomial fit valid from 20 to
     * 40 °C.
     *
     * @param temperatureC temperature in °C
     * @return speed of sound in m/s
     */
    public static double waterSpeedOfSound(double temperatureC) {
        double t = temperatureC;
        return 1485.115245 - 6.273078 * t + 5.308978e-1 * t * t
            - 1.319485681e-2 * t * t * t + 1.12602896e-4 * t * t * t * t;
    }

    /**
     * Brillouin shift of water.
     *
     * @param wavelengthNm        laser wavelength in nm
     * @param temperatureC        temperature in °C
     * @param scatteringAngleDeg  scattering angle in degrees
     * @return shift in GHz
     */
    public static double waterShiftGHz(double wavelengthNm, double temperatureC,
        double scatteringAngleDeg) {
        return 2 * waterSpeedOfSound(temperatureC) * WATER_REFRACTIVE_INDEX
            * Math.sin(Math.toRadians(scatteringAngleDeg / 2)) / wavelengthNm;
    }

    /**
     * Converts a wavelength to nm.
     *
     * @param value wavelength
     * @param units one of {@code nm}, {@code um}, {@code µm} or {@code m};
     *              {@code null} is taken as nm
     * @return See above.
     */
    public static double toNanometers(double value, String units) {
        if (units == null) {
            return value;
        }
        switch (units) {
            case "nm":
                return value;
            case "um":
            case "µm":
                return value * 1e3;
            case "m":
                return value * 1e9;
            default:
                throw new IllegalArgumentException("Unsupported wavelength units: " + units);
        }
    }
}
