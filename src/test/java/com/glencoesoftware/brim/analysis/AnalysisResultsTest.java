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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.glencoesoftware.brim.BrimFile;
import com.glencoesoftware.brim.DataGroup;
import com.glencoesoftware.brim.SpectrumAndQuantities;
import com.glencoesoftware.brim.TestBrim;
import com.glencoesoftware.brim.exceptions.DuplicateCoordinateException;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.grid.Axis;
import com.glencoesoftware.brim.grid.SpatialGrid;
import com.glencoesoftware.brim.spectra.Spectra;
import com.glencoesoftware.brim.spectra.Spectrum;
import com.glencoesoftware.brim.store.NdArray;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AnalysisResultsTest {

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private TestBrim test(String name) {
        return new TestBrim(tmpDir.getRoot().toPath().resolve(name));
    }

    private static double water() {
        return BrillouinPhysics.waterShiftGHz(660.0, 25.0, 180.0);
    }

    /**
     * Test the image of a stored quantity and the grid it is placed on.
     */
    @Test
    public void testImage() throws IOException {
        TestBrim test = test("image.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            SpatialGrid image = results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES);
            assertArrayEquals(new int[] {3, 3}, image.getShape());
            assertArrayEquals(new double[] {2.0, 1.5}, image.getPixelSize(), 0);
            assertEquals("um", image.getPixelUnits());
            assertEquals("GHz", image.getUnits());
            for (int y = 0; y < 3; y++) {
                for (int x = 0; x < 3; x++) {
                    assertEquals(TestBrim.shift(y, x), image.get(y, x), 0);
                }
            }
            SpatialGrid stokes = results.getImage(Quantity.WIDTH, PeakType.STOKES);
            assertEquals(TestBrim.width(2, 1) + 0.1, stokes.get(2, 1), 1e-12);
        }
    }

    /**
     * Test that the average peak is the mean of the absolute anti-Stokes and
     * Stokes values.
     */
    @Test
    public void testAverage() throws IOException {
        TestBrim test = test("average.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults("fit");
            assertEquals("fit", results.getName());
            SpatialGrid shift = results.getImage(Quantity.SHIFT);
            SpatialGrid width = results.getImage(Quantity.WIDTH, PeakType.AVERAGE);
            for (int y = 0; y < 3; y++) {
                for (int x = 0; x < 3; x++) {
                    assertEquals(TestBrim.shift(y, x) + 0.1, shift.get(y, x), 1e-12);
                    assertEquals(TestBrim.width(y, x) + 0.05, width.get(y, x), 1e-12);
                }
            }
            assertEquals("GHz", results.getUnits(Quantity.SHIFT));
            PixelValue pixel = results.getQuantityAtPixel(new int[] {1, 2}, Quantity.SHIFT);
            assertEquals(TestBrim.shift(1, 2) + 0.1, pixel.getValue(), 1e-12);
            assertEquals("GHz", pixel.getUnits());
        }
    }

    /**
     * Test that the average is undefined when only the Stokes peak is stored.
     */
    @Test
    public void testAverageSinglePeak() throws IOException {
        TestBrim test = test("stokes.brim.zarr").peaks(false, true).init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            assertEquals(Arrays.asList(PeakType.STOKES), results.listExistingPeakTypes());
            SpatialGrid average = results.getImage(Quantity.SHIFT);
            for (double v : average.getValues()) {
                assertTrue(Double.isNaN(v));
            }
            assertEquals("GHz", results.getUnits(Quantity.SHIFT, PeakType.AVERAGE, 0));
            assertTrue(results.getQuantityAtPixel(new int[] {0, 0}, Quantity.SHIFT).isMissing());
            assertEquals(-TestBrim.shift(0, 0) - 0.2, results.getQuantityAtPixel(
                new int[] {0, 0}, Quantity.SHIFT, PeakType.STOKES).getValue(), 1e-12);
            try {
                results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES);
                fail("Read a peak that was never stored");
            } catch (NotFoundException e) {
                // expected
            }
        }
    }

    /**
     * Test quantities that are not stored.
     */
    @Test
    public void testNotFound() throws IOException {
        TestBrim test = test("missing.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            try {
                results.getImage(Quantity.AMPLITUDE);
                fail("Averaged a quantity stored for neither peak");
            } catch (NotFoundException e) {
                // expected
            }
            try {
                results.getUnits(Quantity.R2, PeakType.STOKES, 0);
                fail("Found units of a quantity that was never stored");
            } catch (NotFoundException e) {
                // expected
            }
            try {
                results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES, 1);
                fail("Read a second peak from a single peak fit");
            } catch (NotFoundException e) {
                // expected
            }
            try {
                file.getDataGroup(0).getAnalysisResults(1);
                fail("Found a second result set");
            } catch (NotFoundException e) {
                // expected
            }
        }
    }

    /**
     * Test the fit model, recorded and unknown.
     */
    @Test
    public void testFitModel() throws IOException {
        TestBrim test = test("model.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            DataGroup group = file.getDataGroup(0);
            assertEquals(FitModel.LORENTZIAN, group.getAnalysisResults().getFitModel());
            AnalysisResults other = group.createAnalysisResults();
            assertEquals(FitModel.UNDEFINED, other.getFitModel());
            Map<String, Object> attributes = other.getPath().store.getAttributes(other.getPath());
            attributes.put("Fit_model", "Pseudo-Voigt");
            other.getPath().store.setAttributes(other.getPath(), attributes);
            assertEquals(FitModel.UNDEFINED, other.getFitModel());
            assertEquals(Arrays.asList("fit", "Analysis_1"), group.listAnalysisResults());
        }
    }

    /**
     * Test the listing of stored peaks and quantities.
     */
    @Test
    public void testListings() throws IOException {
        TestBrim test = test("listings.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            results.writeQuantity(Quantity.R2, PeakType.STOKES,
                test.perSpectrum((y, x) -> 0.99), "");
            assertEquals(Arrays.asList(PeakType.ANTI_STOKES, PeakType.STOKES),
                results.listExistingPeakTypes());
            assertTrue(results.listExistingPeakTypes(1).isEmpty());
            assertEquals(Arrays.asList(Quantity.SHIFT, Quantity.WIDTH, Quantity.ELASTIC_CONTRAST),
                results.listExistingQuantities(PeakType.ANTI_STOKES, 0));
            assertEquals(Arrays.asList(Quantity.SHIFT, Quantity.WIDTH, Quantity.R2,
                Quantity.ELASTIC_CONTRAST), results.listExistingQuantities(PeakType.STOKES, 0));
            assertEquals(Arrays.asList(Quantity.SHIFT, Quantity.WIDTH, Quantity.R2,
                Quantity.ELASTIC_CONTRAST), results.listExistingQuantities(PeakType.AVERAGE, 0));
            assertEquals("", results.getUnits(Quantity.R2, PeakType.STOKES, 0));
        }
    }

    /**
     * Test the elastic contrast derived from the shift and the metadata.
     */
    @Test
    public void testElasticContrast() throws IOException {
        TestBrim test = test("contrast.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            SpatialGrid contrast = results.getImage(Quantity.ELASTIC_CONTRAST,
                PeakType.ANTI_STOKES);
            assertEquals("", contrast.getUnits());
            assertEquals(TestBrim.shift(2, 2) / water() - 1, contrast.get(2, 2), 1e-12);

            SpatialGrid stokes = results.getImage(Quantity.ELASTIC_CONTRAST, PeakType.STOKES);
            // the water shift takes the sign of the Stokes shifts
            assertEquals((TestBrim.shift(0, 1) + 0.2) / water() - 1, stokes.get(0, 1), 1e-12);

            PixelValue pixel = results.getQuantityAtPixel(new int[] {1, 0},
                Quantity.ELASTIC_CONTRAST);
            assertEquals((TestBrim.shift(1, 0) + 0.1) / water() - 1, pixel.getValue(), 1e-12);
            assertEquals("", results.getUnits(Quantity.ELASTIC_CONTRAST));
        }
    }

    /**
     * Test that the elastic contrast needs the wavelength.
     */
    @Test(expected = NotFoundException.class)
    public void testElasticContrastWithoutWavelength() throws IOException {
        TestBrim test = test("nowavelength.brim.zarr");
        try (BrimFile file = BrimFile.create(test.location())) {
            DataGroup group = file.createDataGroup();
            group.writeSpectra(test.spectra());
            AnalysisResults results = group.createAnalysisResults();
            results.writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES,
                test.perSpectrum(TestBrim::shift), "GHz");
            results.getImage(Quantity.ELASTIC_CONTRAST, PeakType.ANTI_STOKES);
        }
    }

    /**
     * Test covariance matrices, which carry two extra dimensions.
     */
    @Test
    public void testCovarianceMatrix() throws IOException {
        TestBrim test = test("cov.brim.zarr").missing(0, 1).init();
        int n = test.storedCells().size();
        double[] cov = new double[n * 4];
        for (int i = 0; i < n; i++) {
            int[] cell = test.storedCells().get(i);
            cov[i * 4] = cell[0];
            cov[i * 4 + 1] = 0.5;
            cov[i * 4 + 2] = 0.5;
            cov[i * 4 + 3] = cell[1];
        }
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            results.writeQuantity(Quantity.COV_MATRIX, PeakType.ANTI_STOKES,
                NdArray.of(cov, n, 2, 2), "GHz^2");
        }
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            PixelValue pixel = results.getQuantityAtPixel(new int[] {2, 1},
                Quantity.COV_MATRIX, PeakType.ANTI_STOKES);
            assertArrayEquals(new int[] {2, 2}, pixel.getShape());
            assertArrayEquals(new double[] {2, 0.5, 0.5, 1}, pixel.getValues(), 0);
            assertEquals("GHz^2", pixel.getUnits());

            PixelValue missing = results.getQuantityAtPixel(new int[] {0, 1},
                Quantity.COV_MATRIX, PeakType.ANTI_STOKES);
            assertTrue(missing.isMissing());
            assertArrayEquals(new int[] {2, 2}, missing.getShape());

            SpatialGrid image = results.getImage(Quantity.COV_MATRIX, PeakType.ANTI_STOKES);
            assertArrayEquals(new int[] {3, 3, 2, 2}, image.getShape());
            assertEquals(2.0, image.get(2, 0, 0, 0), 0);
            assertTrue(Double.isNaN(image.get(0, 1, 1, 1)));
        }
    }

    /**
     * Test every quantity at one pixel.
     */
    @Test
    public void testAllQuantitiesAtPixel() throws IOException {
        TestBrim test = test("all.brim.zarr").sparse(true).init();
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            Map<Quantity, Map<PeakType, PixelValue>> all =
                results.getAllQuantitiesAtPixel(new int[] {2, 1}, 0);
            assertEquals(Arrays.asList(Quantity.SHIFT, Quantity.WIDTH, Quantity.ELASTIC_CONTRAST),
                Arrays.asList(all.keySet().toArray()));
            Map<PeakType, PixelValue> shift = all.get(Quantity.SHIFT);
            assertEquals(TestBrim.shift(2, 1), shift.get(PeakType.ANTI_STOKES).getValue(), 0);
            assertEquals(-TestBrim.shift(2, 1) - 0.2, shift.get(PeakType.STOKES).getValue(),
                1e-12);
            assertEquals(TestBrim.shift(2, 1) + 0.1, shift.get(PeakType.AVERAGE).getValue(),
                1e-12);
            assertEquals(TestBrim.width(2, 1) + 0.05,
                all.get(Quantity.WIDTH).get(PeakType.AVERAGE).getValue(), 1e-12);
            assertEquals(3, all.get(Quantity.ELASTIC_CONTRAST).size());
            assertEquals("", all.get(Quantity.ELASTIC_CONTRAST).get(PeakType.STOKES).getUnits());
        }
    }

    /**
     * Test that pixel lookups check the grid.
     */
    @Test(expected = IndexOutOfRangeException.class)
    public void testPixelOutOfRange() throws IOException {
        TestBrim test = test("pixel.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location())) {
            file.getDataGroup(0).getAnalysisResults()
                .getQuantityAtPixel(new int[] {0, 3}, Quantity.SHIFT, PeakType.ANTI_STOKES);
        }
    }

    /**
     * Test that quantities are checked against the spectra and never
     * overwritten.
     */
    @Test
    public void testWriteChecks() throws IOException {
        TestBrim test = test("checks.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            try {
                results.writeQuantity(Quantity.AMPLITUDE, PeakType.ANTI_STOKES,
                    NdArray.of(new double[6], 2, 3), "a.u.");
                fail("Wrote a quantity of the wrong shape");
            } catch (IllegalArgumentException e) {
                // expected
            }
            try {
                results.writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES,
                    test.perSpectrum((y, x) -> 0), "GHz");
                fail("Overwrote a quantity");
            } catch (NameCollisionException e) {
                // expected
            }
            try {
                results.writeQuantity(Quantity.SHIFT, PeakType.AVERAGE,
                    test.perSpectrum((y, x) -> 0), "GHz");
                fail("Stored the average peak");
            } catch (IllegalArgumentException e) {
                // expected
            }
            assertEquals(TestBrim.shift(0, 0),
                results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES).get(0, 0), 0);
        }
    }

    /**
     * Test custom peaks, custom quantities and peaks of a multi-peak fit.
     */
    @Test
    public void testCustom() throws IOException {
        TestBrim test = test("custom.brim.zarr").init();
        PeakType water = PeakType.custom("water");
        Quantity area = Quantity.custom("Peak_area");
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            results.writeQuantity(area, water, test.perSpectrum((y, x) -> y * 10 + x), "a.u.");
            results.writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES, 1,
                test.perSpectrum((y, x) -> 7.5), "GHz");
        }
        try (BrimFile file = BrimFile.open(test.location())) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            assertEquals(Arrays.asList(PeakType.ANTI_STOKES, PeakType.STOKES, water),
                results.listExistingPeakTypes());
            assertEquals(Arrays.asList(area), results.listExistingQuantities(water, 0));
            assertEquals(21, results.getImage(area, water).get(2, 1), 0);
            assertEquals(Arrays.asList(PeakType.ANTI_STOKES), results.listExistingPeakTypes(1));
            assertEquals(7.5,
                results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES, 1).get(1, 1), 0);
        }
        assertEquals(PeakType.STOKES, PeakType.fromId("S"));
        assertFalse(PeakType.fromId("water").isComputed());
        assertEquals(Quantity.WIDTH, Quantity.fromName("Width"));
        assertNull(FitModel.fromValue("Pseudo-Voigt"));
        try {
            PeakType.custom("bad_id");
            fail("Accepted a peak identifier with an underscore");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    /**
     * Writes sparse spectra where samples 0 and 1 share grid cell (0, 0) and
     * sample 2 sits alone on cell (1, 1), with the given anti-Stokes shifts.
     */
    private String coinciding(String name, double[] shifts) throws IOException {
        Map<Axis, double[]> coordinates = new EnumMap<>(Axis.class);
        coordinates.put(Axis.Y, new double[] {0, 0, 2});
        coordinates.put(Axis.X, new double[] {0, 0, 1.5});
        Spectra spectra = Spectra.sparse(NdArray.of(new double[] {1, 1, 1, 1, 2, 2}, 3, 2),
            NdArray.of(new double[] {4, 6}, 2), coordinates, "um");
        String location = tmpDir.getRoot().toPath().resolve(name).toString();
        try (BrimFile file = BrimFile.create(location)) {
            DataGroup group = file.createDataGroup();
            group.writeSpectra(spectra);
            group.createAnalysisResults().writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES,
                NdArray.of(shifts, 3), "GHz");
        }
        return location;
    }

    /**
     * Test that pixel lookups refuse a position where samples with different
     * values coincide, as images do.
     */
    @Test
    public void testConflictingDuplicatePixel() throws IOException {
        String location = coinciding("conflict.brim.zarr", new double[] {10, 20, 30});
        try (BrimFile file = BrimFile.open(location)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            try {
                results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES);
                fail("Imaged two different shifts at the same position");
            } catch (DuplicateCoordinateException e) {
                // expected
            }
            try {
                results.getQuantityAtPixel(new int[] {0, 0}, Quantity.SHIFT,
                    PeakType.ANTI_STOKES);
                fail("Read one of two different shifts at the same position");
            } catch (DuplicateCoordinateException e) {
                // expected
            }
            try {
                results.getAllQuantitiesAtPixel(new int[] {0, 0}, 0);
                fail("Read one of two different shifts at the same position");
            } catch (DuplicateCoordinateException e) {
                // expected
            }
            assertEquals(30, results.getQuantityAtPixel(new int[] {1, 1}, Quantity.SHIFT,
                PeakType.ANTI_STOKES).getValue(), 0);
        }
    }

    /**
     * Test that pixel lookups agree with images where identical samples
     * coincide.
     */
    @Test
    public void testEqualDuplicatePixel() throws IOException {
        String location = coinciding("equal.brim.zarr", new double[] {10, 10, 30});
        try (BrimFile file = BrimFile.open(location)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            SpatialGrid image = results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES);
            PixelValue pixel = results.getQuantityAtPixel(new int[] {0, 0}, Quantity.SHIFT,
                PeakType.ANTI_STOKES);
            assertEquals(image.get(0, 0), pixel.getValue(), 0);
            assertEquals(10, pixel.getValue(), 0);
            assertTrue(results.getQuantityAtPixel(new int[] {0, 1}, Quantity.SHIFT,
                PeakType.ANTI_STOKES).isMissing());
        }
    }

    /**
     * Test quantities fitted once per parameter value.
     */
    @Test
    public void testParameterAxis() throws IOException {
        Map<Axis, double[]> coordinates = new EnumMap<>(Axis.class);
        coordinates.put(Axis.X, new double[] {0, 1, 2});
        Spectra spectra = Spectra.sparse(NdArray.of(new double[3 * 2 * 2], 3, 2, 2),
                NdArray.of(new double[] {4, 6}, 2), coordinates, "um")
            .withParameters(NdArray.of(new double[] {0, 90}, 2),
                Collections.singletonList("Polarization"));
        String location = tmpDir.getRoot().toPath().resolve("angles.brim.zarr").toString();
        try (BrimFile file = BrimFile.create(location)) {
            DataGroup group = file.createDataGroup();
            group.writeSpectra(spectra);
            AnalysisResults results = group.createAnalysisResults();
            results.writeQuantity(Quantity.SHIFT, PeakType.ANTI_STOKES,
                NdArray.of(new double[] {5.0, 5.5, 6.0, 6.5, 7.0, 7.5}, 3, 2), "GHz");
            try {
                results.writeQuantity(Quantity.WIDTH, PeakType.ANTI_STOKES,
                    NdArray.of(new double[3], 3), "GHz");
                fail("Wrote a quantity without the parameter axis");
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
        try (BrimFile file = BrimFile.open(location)) {
            AnalysisResults results = file.getDataGroup(0).getAnalysisResults();
            SpatialGrid image = results.getImage(Quantity.SHIFT, PeakType.ANTI_STOKES);
            assertArrayEquals(new int[] {3, 2}, image.getShape());
            assertEquals(6.5, image.get(1, 1), 0);
            PixelValue pixel = results.getQuantityAtPixel(new int[] {2}, Quantity.SHIFT,
                PeakType.ANTI_STOKES);
            assertArrayEquals(new int[] {2}, pixel.getShape());
            assertArrayEquals(new double[] {7.0, 7.5}, pixel.getValues(), 0);
        }
    }

    /**
     * Test the spectrum and every quantity at one position, read together.
     */
    @Test
    public void testSpectrumAndAllQuantities() throws IOException {
        TestBrim test = test("combined.brim.zarr").missing(0, 0).init();
        try (BrimFile file = BrimFile.open(test.location())) {
            DataGroup group = file.getDataGroup(0);
            SpectrumAndQuantities both = group.getSpectrumAndAllQuantitiesInImage(
                group.getAnalysisResults(), new int[] {2, 1});
            Spectrum spectrum = both.getSpectrum();
            assertArrayEquals(test.spectrum(2, 1), spectrum.getPsd(), 0);
            assertArrayEquals(test.frequency(), spectrum.getFrequency(), 0);
            Map<Quantity, Map<PeakType, PixelValue>> quantities = both.getQuantities();
            assertEquals(TestBrim.shift(2, 1),
                quantities.get(Quantity.SHIFT).get(PeakType.ANTI_STOKES).getValue(), 0);
            assertEquals(TestBrim.width(2, 1) + 0.05,
                quantities.get(Quantity.WIDTH).get(PeakType.AVERAGE).getValue(), 1e-12);
            try {
                quantities.clear();
                fail("Modified the quantities read");
            } catch (UnsupportedOperationException e) {
                // expected
            }
            try {
                group.getSpectrumAndAllQuantitiesInImage(group.getAnalysisResults(),
                    new int[] {0, 0});
                fail("Read a position where no spectrum was acquired");
            } catch (IndexOutOfRangeException e) {
                // expected
            }
        }
    }

    /**
     * Test that the combined lookup refuses result sets of other groups.
     */
    @Test(expected = IllegalArgumentException.class)
    public void testSpectrumAndQuantitiesOfOtherGroup() throws IOException {
        TestBrim test = test("groups.brim.zarr").init();
        try (BrimFile file = BrimFile.open(test.location(), BrimFile.Mode.READ_WRITE)) {
            DataGroup other = file.createDataGroup();
            other.writeSpectra(test.spectra());
            other.getSpectrumAndAllQuantitiesInImage(
                file.getDataGroup(0).getAnalysisResults(), new int[] {0, 0});
        }
    }
}
