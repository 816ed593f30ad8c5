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

import com.glencoesoftware.brim.BrimFile;
import com.glencoesoftware.brim.DataGroup;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import java.io.IOException;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class MetadataTest {

    private static final OffsetDateTime ACQUIRED =
        OffsetDateTime.parse("2024-03-01T12:30:00+01:00");

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private String location;

    @Before
    public void setUp() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("metadata.brim.zarr");
        location = path.toString();
        try (BrimFile file = BrimFile.create(location)) {
            file.createDataGroup("first");
        }
    }

    /**
     * Test that every value type is read back with its units after reopening.
     */
    @Test
    public void testTypesRoundTrip() throws IOException {
        try (BrimFile file = BrimFile.open(location, BrimFile.Mode.READ_WRITE)) {
            Metadata md = file.getDataGroup(0).getMetadata();
            md.set(MetadataCategory.OPTICS, "Wavelength", MetadataValue.of(660.5), "nm");
            md.set(MetadataCategory.ACQUISITION, "Exposure_count", MetadataValue.of(12L));
            md.set(MetadataCategory.EXPERIMENT, "Sample", MetadataValue.of("agarose"));
            md.set(MetadataCategory.SPECTROMETER, "VIPA", MetadataValue.of(true));
            md.set(MetadataCategory.EXPERIMENT, "Datetime", MetadataValue.of(ACQUIRED));
            md.set(MetadataCategory.OPTICS, "Lens_NA",
                MetadataValue.of(new double[] {0.4, 0.8}), "");
            md.set(MetadataCategory.BRILLOUIN, "Missing", MetadataValue.of(Double.NaN), "GHz");
        }
        try (BrimFile file = BrimFile.open(location)) {
            Metadata md = file.getDataGroup(0).getMetadata();
            MetadataItem wavelength = md.get(MetadataCategory.OPTICS, "Wavelength");
            Assert.assertEquals(MetadataValue.Type.FLOAT, wavelength.getType());
            Assert.assertEquals(660.5, wavelength.getValue().asDouble(), 0);
            Assert.assertEquals("nm", wavelength.getUnits());
            Assert.assertFalse(wavelength.isUnitless());

            MetadataItem count = md.get(MetadataCategory.ACQUISITION, "Exposure_count");
            Assert.assertEquals(MetadataValue.Type.INTEGER, count.getType());
            Assert.assertEquals(12L, count.getValue().asLong());

            Assert.assertEquals("agarose",
                md.get(MetadataCategory.EXPERIMENT, "Sample").getValue().asString());
            Assert.assertTrue(
                md.get(MetadataCategory.SPECTROMETER, "VIPA").getValue().asBoolean());
            Assert.assertEquals(ACQUIRED,
                md.get(MetadataCategory.EXPERIMENT, "Datetime").getValue().asDateTime());

            MetadataItem na = md.get(MetadataCategory.OPTICS, "Lens_NA");
            Assert.assertArrayEquals(new double[] {0.4, 0.8},
                na.getValue().asDoubleArray(), 0);
            Assert.assertEquals("", na.getUnits());

            Assert.assertTrue(Double.isNaN(
                md.get(MetadataCategory.BRILLOUIN, "Missing").getValue().asDouble()));
        }
    }

    /**
     * Test that entries without units are flagged.
     */
    @Test
    public void testUnitless() throws IOException {
        try (BrimFile file = BrimFile.open(location, BrimFile.Mode.READ_WRITE)) {
            Metadata md = file.getMetadata();
            md.set(MetadataCategory.OPTICS, "Power", MetadataValue.of(3.5));
            MetadataItem item = md.get(MetadataCategory.OPTICS, "Power");
            Assert.assertTrue(item.isUnitless());
            Assert.assertNull(item.getUnits());
        }
    }

    /**
     * Test that setting an entry replaces its type and units.
     */
    @Test
    public void testOverwrite() throws IOException {
        try (BrimFile file = BrimFile.open(location, BrimFile.Mode.READ_WRITE)) {
            Metadata md = file.getMetadata();
            md.set(MetadataCategory.EXPERIMENT, "Temperature", MetadataValue.of(22.0), "C");
            md.set(MetadataCategory.EXPERIMENT, "Temperature", MetadataValue.of("room"));
        }
        try (BrimFile file = BrimFile.open(location)) {
            MetadataItem item =
                file.getMetadata().get(MetadataCategory.EXPERIMENT, "Temperature");
            Assert.assertEquals(MetadataValue.Type.STRING, item.getType());
            Assert.assertEquals("room", item.getValue().asString());
            Assert.assertNull(item.getUnits());
        }
    }

    /**
     * Test that group entries override those of the whole file and that
     * file entries are visible from every group.
     */
    @Test
    public void testFallback() throws IOException {
        try (BrimFile file = BrimFile.open(location, BrimFile.Mode.READ_WRITE)) {
            file.getMetadata().set(MetadataCategory.OPTICS, "Wavelength",
                MetadataValue.of(532.0), "nm");
            file.getMetadata().set(MetadataCategory.EXPERIMENT, "Temperature",
                MetadataValue.of(20.0), "C");
            DataGroup group = file.getDataGroup("first");
            group.getMetadata().set(MetadataCategory.EXPERIMENT, "Temperature",
                MetadataValue.of(37.0), "C");
        }
        try (BrimFile file = BrimFile.open(location)) {
            Metadata md = file.getDataGroup(0).getMetadata();
            Assert.assertTrue(md.contains(MetadataCategory.OPTICS, "Wavelength"));
            Assert.assertEquals(532.0,
                md.get(MetadataCategory.OPTICS, "Wavelength").getValue().asDouble(), 0);
            Assert.assertEquals(37.0,
                md.get(MetadataCategory.EXPERIMENT, "Temperature").getValue().asDouble(), 0);
            Assert.assertEquals(20.0, file.getMetadata()
                .get(MetadataCategory.EXPERIMENT, "Temperature").getValue().asDouble(), 0);
            Assert.assertEquals(2, md.getItems(MetadataCategory.EXPERIMENT).size()
                + md.getItems(MetadataCategory.OPTICS).size());
        }
    }

    /**
     * Test the nested mapping views and bulk updates.
     */
    @Test
    public void testDict() throws IOException {
        Map<String, Map<String, Object>> dict = new LinkedHashMap<>();
        Map<String, Object> optics = new LinkedHashMap<>();
        optics.put("Wavelength", 780.0);
        optics.put("Objective", "20x");
        dict.put("Optics", optics);
        dict.put("Acquisition", Collections.<String, Object>singletonMap("Frames", 4));
        try (BrimFile file = BrimFile.open(location, BrimFile.Mode.READ_WRITE)) {
            file.getDataGroup(0).getMetadata().putAll(dict);
        }
        try (BrimFile file = BrimFile.open(location)) {
            Metadata md = file.getDataGroup(0).getMetadata();
            Map<String, Map<String, Object>> all = md.allToDict();
            Assert.assertEquals(2, all.size());
            Assert.assertEquals(780.0, all.get("Optics").get("Wavelength"));
            Assert.assertEquals("20x", all.get("Optics").get("Objective"));
            Assert.assertEquals(4L, all.get("Acquisition").get("Frames"));
            Assert.assertEquals(optics, md.toDict(MetadataCategory.OPTICS));
            Assert.assertTrue(md.toDict(MetadataCategory.BRILLOUIN).isEmpty());
            Assert.assertEquals(MetadataValue.Type.INTEGER,
                md.get(MetadataCategory.ACQUISITION, "Frames").getType());
        }
    }

    /**
     * Test that missing entries are reported.
     */
    @Test(expected = NotFoundException.class)
    public void testNotFound() throws IOException {
        try (BrimFile file = BrimFile.open(location)) {
            Metadata md = file.getDataGroup(0).getMetadata();
            Assert.assertFalse(md.contains(MetadataCategory.OPTICS, "Wavelength"));
            md.get(MetadataCategory.OPTICS, "Wavelength");
        }
    }

    /**
     * Test category names and reading values as the wrong type.
     */
    @Test
    public void testValues() {
        Assert.assertEquals(MetadataCategory.SPECTROMETER,
            MetadataCategory.fromName("Spectrometer"));
        Assert.assertEquals(MetadataValue.of(2.0), MetadataValue.infer(2.0f));
        Assert.assertEquals(MetadataValue.of(3L), MetadataValue.infer(3));
        Assert.assertEquals(MetadataValue.Type.FLOAT_ARRAY,
            MetadataValue.infer(new double[] {1}).getType());
        try {
            MetadataValue.of("text").asDouble();
            Assert.fail("Read a string as a number");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        try {
            MetadataValue.infer(new Object());
            Assert.fail("Inferred a type for an arbitrary object");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
