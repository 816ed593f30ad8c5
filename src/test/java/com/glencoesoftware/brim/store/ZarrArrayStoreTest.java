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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import com.glencoesoftware.brim.exceptions.BrimException;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.exceptions.ReadOnlyViolationException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/** Unit tests for ZarrArrayStore. */
public class ZarrArrayStoreTest {

    @Rule
    public TemporaryFolder tmpDir = new TemporaryFolder();

    private ZarrArrayStore create(Path path) throws IOException {
        return ZarrArrayStore.create(new StoreLocation(path.toString()),
            Collections.<String, Object>singletonMap("kind", "test"), 16, 1 << 20);
    }

    private ZarrArrayStore open(Path path, boolean readOnly) throws IOException {
        return ZarrArrayStore.open(new StoreLocation(path.toString()), readOnly, 16, 1 << 20);
    }

    private static double[] ramp(int n) {
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i * 0.5;
        }
        return values;
    }

    /**
     * Test that a written array reads back whole and in part after reopening.
     */
    @Test
    public void testWriteReadArray() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("store.zarr");
        try (ZarrArrayStore store = create(path)) {
            StorePath group = store.createGroup("a/b");
            store.writeArray(group.resolve("data"), NdArray.of(ramp(24), 2, 3, 4),
                Collections.<String, Object>singletonMap("Units", "GHz"));
        }
        try (ZarrArrayStore store = open(path, true)) {
            StorePath data = store.root().resolve("a/b/data");
            assertTrue(store.isArray(data));
            assertTrue(store.isGroup(store.root().resolve("a")));
            ArrayInfo info = store.getArrayInfo(data);
            assertArrayEquals(new int[] {2, 3, 4}, info.getShape());
            assertEquals(DType.FLOAT64, info.getDType());
            assertArrayEquals(ramp(24), store.readArray(data).asDoubles(), 0);

            NdArray region = store.readArray(data, new int[] {1, 1, 4}, new int[] {1, 2, 0});
            assertArrayEquals(new int[] {1, 1, 4}, region.getShape());
            // flat offset of (1, 2, 0) is 20
            assertArrayEquals(new double[] {10.0, 10.5, 11.0, 11.5}, region.asDoubles(), 0);
            assertEquals("GHz", store.getAttributes(data).get("Units"));
            assertEquals("test", store.getAttributes(store.root()).get("kind"));
        }
    }

    /**
     * Test that integer arrays keep their type.
     */
    @Test
    public void testIntegerArray() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("ints.zarr");
        try (ZarrArrayStore store = create(path)) {
            StorePath map = store.root().resolve("map");
            store.writeArray(map, NdArray.of(new int[] {-1, 0, 1, 2}, 2, 2),
                Collections.<String, Object>emptyMap());
            NdArray read = store.readArray(map);
            assertEquals(DType.INT32, read.getDType());
            assertArrayEquals(new int[] {-1, 0, 1, 2}, read.asInts());
        }
    }

    /**
     * Test that staged attributes are visible before they are flushed and
     * persisted when the store is closed.
     */
    @Test
    public void testStagedAttributes() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("attrs.zarr");
        try (ZarrArrayStore store = create(path)) {
            StorePath group = store.createGroup("g");
            Map<String, Object> attributes = new HashMap<>();
            attributes.put("Name", "first");
            attributes.put("element_size", Arrays.asList(1.0, 2.0));
            store.setAttributes(group, attributes);
            assertEquals("first", store.getAttributes(group).get("Name"));
            // the copy handed out is not the staged map
            store.getAttributes(group).put("Name", "changed");
            assertEquals("first", store.getAttributes(group).get("Name"));
        }
        try (ZarrArrayStore store = open(path, true)) {
            Map<String, Object> attributes = store.getAttributes(store.root().resolve("g"));
            assertEquals("first", attributes.get("Name"));
            assertEquals(Arrays.asList(1.0, 2.0), attributes.get("element_size"));
        }
    }

    /**
     * Test that children are listed by name, groups and arrays alike.
     */
    @Test
    public void testListChildren() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("list.zarr");
        try (ZarrArrayStore store = create(path)) {
            store.createGroup("b");
            store.createGroup("a");
            store.writeArray(store.root().resolve("c"), NdArray.of(ramp(2), 2),
                Collections.<String, Object>emptyMap());
            Files.createDirectories(path.resolve("not_a_node"));
            assertEquals(Arrays.asList("a", "b", "c"), store.listChildren(store.root()));
        }
    }

    /**
     * Test that existing nodes are never overwritten.
     */
    @Test
    public void testNameCollision() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("collide.zarr");
        try (ZarrArrayStore store = create(path)) {
            StorePath data = store.root().resolve("data");
            store.writeArray(data, NdArray.of(ramp(3), 3), Collections.<String, Object>emptyMap());
            try {
                store.writeArray(data, NdArray.of(ramp(4), 4),
                    Collections.<String, Object>emptyMap());
                fail("Overwrote an array");
            } catch (NameCollisionException e) {
                // expected
            }
            try {
                store.createGroup("data");
                fail("Created a group over an array");
            } catch (NameCollisionException e) {
                // expected
            }
            assertArrayEquals(ramp(3), store.readArray(data).asDoubles(), 0);
        }
    }

    /**
     * Test that regions outside an array and missing nodes are reported.
     */
    @Test
    public void testErrors() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("errors.zarr");
        try (ZarrArrayStore store = create(path)) {
            StorePath data = store.root().resolve("data");
            store.writeArray(data, NdArray.of(ramp(6), 2, 3),
                Collections.<String, Object>emptyMap());
            try {
                store.readArray(data, new int[] {1, 3}, new int[] {1, 1});
                fail("Read outside the array");
            } catch (IndexOutOfRangeException e) {
                // expected
            }
            try {
                store.readArray(store.root().resolve("missing"));
                fail("Read a missing array");
            } catch (NotFoundException e) {
                // expected
            }
            try {
                store.openGroup("missing");
                fail("Opened a missing group");
            } catch (NotFoundException e) {
                // expected
            }
        }
    }

    /**
     * Test that arrays of an element type brim does not handle are reported
     * as malformed content.
     */
    @Test
    public void testUnsupportedDataType() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("int64.zarr");
        create(path).close();
        Path array = Files.createDirectories(path.resolve("Timestamp"));
        Files.write(array.resolve(".zarray"), ("{\"zarr_format\": 2, \"shape\": [2],"
            + " \"chunks\": [2], \"dtype\": \"<i8\", \"compressor\": null,"
            + " \"fill_value\": 0, \"order\": \"C\", \"filters\": null}")
            .getBytes(StandardCharsets.UTF_8));
        try (ZarrArrayStore store = open(path, true)) {
            StorePath timestamp = store.root().resolve("Timestamp");
            assertTrue(store.isArray(timestamp));
            try {
                store.getArrayInfo(timestamp);
                fail("Described an int64 array");
            } catch (BrimException e) {
                // expected
            }
            try {
                store.readArray(timestamp);
                fail("Read an int64 array");
            } catch (BrimException e) {
                // expected
            }
        }
    }

    /**
     * Test that a read-only store refuses every change.
     */
    @Test
    public void testReadOnly() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("ro.zarr");
        create(path).close();
        try (ZarrArrayStore store = open(path, true)) {
            assertTrue(store.isReadOnly());
            try {
                store.createGroup("g");
                fail("Created a group");
            } catch (ReadOnlyViolationException e) {
                // expected
            }
            try {
                store.writeArray(store.root().resolve("a"), NdArray.of(ramp(1), 1),
                    Collections.<String, Object>emptyMap());
                fail("Wrote an array");
            } catch (ReadOnlyViolationException e) {
                // expected
            }
            try {
                store.setAttributes(store.root(), new HashMap<>());
                fail("Set attributes");
            } catch (ReadOnlyViolationException e) {
                // expected
            }
        }
        assertFalse(Files.exists(path.resolve("g")));
        assertFalse(Files.exists(path.resolve("a")));
    }

    /**
     * Test that close can be called twice and that a closed store is unusable.
     */
    @Test
    public void testClose() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("close.zarr");
        ZarrArrayStore store = create(path);
        store.close();
        store.close();
        try {
            store.isGroup(store.root());
            fail("Used a closed store");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    /**
     * Test a store held in a zip archive, which is written when closed.
     */
    @Test
    public void testZip() throws IOException {
        Path path = tmpDir.getRoot().toPath().resolve("store.zip");
        try (ZarrArrayStore store = create(path)) {
            StorePath group = store.createGroup("g");
            store.writeArray(group.resolve("data"), NdArray.of(ramp(8), 2, 4),
                Collections.<String, Object>emptyMap());
            Map<String, Object> attributes = store.getAttributes(group);
            attributes.put("Name", "zipped");
            store.setAttributes(group, attributes);
        }
        assertTrue(Files.isRegularFile(path));
        try (ZarrArrayStore store = open(path, true)) {
            StorePath group = store.openGroup("g");
            assertEquals(Arrays.asList("data"), store.listChildren(group));
            assertEquals("zipped", store.getAttributes(group).get("Name"));
            assertArrayEquals(new double[] {2.0, 2.5, 3.0, 3.5},
                store.readArray(group.resolve("data"), new int[] {1, 4}, new int[] {1, 0})
                    .asDoubles(), 0);
        }
    }

    /**
     * Test that chunks keep the last dimension whole and fit the target size.
     */
    @Test
    public void testGuessChunks() {
        assertArrayEquals(new int[] {100}, ZarrArrayStore.guessChunks(new int[] {100}, 8, 1024));
        assertArrayEquals(new int[] {63},
            ZarrArrayStore.guessChunks(new int[] {1000}, 8, 512));
        int[] chunks = ZarrArrayStore.guessChunks(new int[] {64, 64, 100}, 8, 1 << 16);
        assertEquals(100, chunks[2]);
        assertTrue(NdArray.length(chunks) * 8 <= 1 << 16);
        // a single spectrum larger than the target is kept whole
        assertArrayEquals(new int[] {1, 1, 4096},
            ZarrArrayStore.guessChunks(new int[] {2, 2, 4096}, 8, 1024));
    }
}
