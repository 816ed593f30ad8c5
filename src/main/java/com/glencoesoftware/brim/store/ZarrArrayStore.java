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

import com.bc.zarr.ArrayParams;
import com.bc.zarr.ZarrArray;
import com.bc.zarr.ZarrGroup;
import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.glencoesoftware.brim.exceptions.BackendIOException;
import com.glencoesoftware.brim.exceptions.IndexOutOfRangeException;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.exceptions.ReadOnlyViolationException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.LoggerFactory;
import ucar.ma2.InvalidRangeException;

/**
 * {@link ArrayStore} backed by jzarr (Zarr v2) on any NIO {@link Path}: a
 * local directory, the root of a zip file system or an S3 bucket prefix.
 *
 * <p>Opened arrays and attribute maps are cached; attribute changes are staged
 * and written on {@link #flush()}. Instances are not thread safe and a
 * read-write store must not be opened concurrently by another writer.</p>
 */
public class ZarrArrayStore implements ArrayStore {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(ZarrArrayStore.class);

    static final String ZGROUP = ".zgroup";

    static final String ZARRAY = ".zarray";

    static final String ZATTRS = ".zattrs";

    private final StoreLocation location;

    private final StoreLocation.Root root;

    private final boolean readOnly;

    /** Target uncompressed size of a chunk when writing. */
    private final int targetChunkBytes;

    /** Node vs. opened ZarrArray cache. */
    private final AsyncLoadingCache<StorePath, ZarrArray> arrayCache;

    /** Node vs. persisted attributes cache. */
    private final AsyncLoadingCache<StorePath, Map<String, Object>> attributeCache;

    /** Attribute maps set but not yet written, in order of first change. */
    private final Map<StorePath, Map<String, Object>> staged = new LinkedHashMap<>();

    private boolean closed = false;

    private ZarrArrayStore(StoreLocation location, StoreLocation.Root root, boolean readOnly,
        long cacheSize, int targetChunkBytes) {
        this.location = location;
        this.root = root;
        this.readOnly = readOnly;
        this.targetChunkBytes = targetChunkBytes;
        arrayCache = Caffeine.newBuilder().maximumSize(cacheSize)
            .buildAsync(key -> ZarrArray.open(toPath(key)));
        attributeCache = Caffeine.newBuilder().maximumSize(cacheSize)
            .buildAsync(this::loadAttributes);
    }

    /**
     * Opens an existing store. The root must be a Zarr group.
     *
     * @param location         where the store lives
     * @param readOnly         whether mutating calls are refused
     * @param cacheSize        size of the array and attribute caches
     * @param targetChunkBytes target chunk size for arrays written later
     * @return See above.
     * @throws IOException if the location cannot be opened
     */
    public static ZarrArrayStore open(StoreLocation location, boolean readOnly, long cacheSize,
        int targetChunkBytes) throws IOException {
        if (!location.exists()) {
            throw new NotFoundException("No such location: " + location.getLocation());
        }
        StoreLocation.Root root = location.resolve(false);
        boolean ro = readOnly || location.isRemote();
        if (ro != readOnly) {
            log.info("Remote location {} opened read-only", location.getLocation());
        }
        return new ZarrArrayStore(location, root, ro, cacheSize, targetChunkBytes);
    }

    /**
     * Creates a new store whose root is an empty Zarr group.
     *
     * @param location         where the store is created
     * @param rootAttributes   attributes of the root group
     * @param cacheSize        size of the array and attribute caches
     * @param targetChunkBytes target chunk size for arrays
     * @return See above.
     * @throws IOException if the store cannot be created
     */
    public static ZarrArrayStore create(StoreLocation location, Map<String, Object> rootAttributes,
        long cacheSize, int targetChunkBytes) throws IOException {
        StoreLocation.Root root = location.resolve(true);
        try {
            ZarrGroup.create(root.getPath(), new HashMap<>(rootAttributes));
        } catch (IOException | RuntimeException e) {
            root.close();
            throw new BackendIOException(
                "Failed to create root group at " + location.getLocation(), e);
        }
        return new ZarrArrayStore(location, root, false, cacheSize, targetChunkBytes);
    }

    private Path toPath(StorePath node) {
        return node.isRoot() ? root.getPath() : root.getPath().resolve(node.path);
    }

    private Map<String, Object> loadAttributes(StorePath node) throws IOException {
        Path path = toPath(node);
        if (!Files.exists(path.resolve(ZATTRS))) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> attributes;
        if (Files.exists(path.resolve(ZARRAY))) {
            attributes = ZarrArray.open(path).getAttributes();
        } else {
            attributes = ZarrGroup.open(path).getAttributes();
        }
        log.debug("Loaded attributes of {}", node);
        return attributes == null ? new LinkedHashMap<>() : attributes;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Store is closed: " + location.getLocation());
        }
    }

    private void checkWritable(String operation, StorePath node) throws ReadOnlyViolationException {
        checkOpen();
        if (readOnly) {
            throw new ReadOnlyViolationException(
                "Cannot " + operation + " " + node + ": " + location.getLocation()
                + " is opened read-only");
        }
    }

    @Override
    public StorePath root() {
        return new StorePath(this, "");
    }

    @Override
    public StorePath openGroup(String path) throws IOException {
        checkOpen();
        StorePath node = new StorePath(this, path);
        if (!isGroup(node)) {
            throw new NotFoundException("No group " + node + " in " + location.getLocation());
        }
        return node;
    }

    @Override
    public StorePath createGroup(String path) throws IOException {
        StorePath node = new StorePath(this, path);
        checkWritable("create group", node);
        if (isGroup(node)) {
            throw new NameCollisionException("Group " + node + " already exists");
        }
        if (isArray(node)) {
            throw new NameCollisionException("An array already exists at " + node);
        }
        try {
            // parents first, jzarr only writes the header of the requested group
            String[] parts = node.path.split("/");
            StorePath current = root();
            for (String part : parts) {
                current = current.resolve(part);
                if (!isGroup(current)) {
                    Path p = toPath(current);
                    Files.createDirectories(p);
                    ZarrGroup.create(p, new HashMap<>());
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new BackendIOException("Failed to create group " + node, e);
        }
        attributeCache.synchronous().invalidate(node);
        return node;
    }

    @Override
    public boolean isGroup(StorePath node) throws IOException {
        checkOpen();
        return Files.exists(toPath(node).resolve(ZGROUP));
    }

    @Override
    public boolean isArray(StorePath node) throws IOException {
        checkOpen();
        return Files.exists(toPath(node).resolve(ZARRAY));
    }

    @Override
    public List<String> listChildren(StorePath group) throws IOException {
        if (!isGroup(group)) {
            throw new NotFoundException("No group " + group + " in " + location.getLocation());
        }
        try (Stream<Path> children = Files.list(toPath(group))) {
            return children
                .filter(p -> Files.exists(p.resolve(ZGROUP)) || Files.exists(p.resolve(ZARRAY)))
                .map(p -> {
                    String name = p.getFileName().toString();
                    return name.endsWith("/") ? name.substring(0, name.length() - 1) : name;
                })
                .sorted()
                .collect(Collectors.toList());
        } catch (IOException e) {
            throw new BackendIOException("Failed to list " + group, e);
        }
    }

    private ZarrArray getZarrArray(StorePath array) throws IOException {
        if (!isArray(array)) {
            throw new NotFoundException("No array " + array + " in " + location.getLocation());
        }
        try {
            return arrayCache.get(array).get();
        } catch (ExecutionException | InterruptedException e) {
            throw new BackendIOException("Failed to open array " + array, e);
        }
    }

    @Override
    public ArrayInfo getArrayInfo(StorePath array) throws IOException {
        ZarrArray za = getZarrArray(array);
        return new ArrayInfo(za.getShape(), za.getChunks(),
            DType.fromZarr(za.getDataType(), array));
    }

    @Override
    public NdArray readArray(StorePath array) throws IOException {
        ZarrArray za = getZarrArray(array);
        return read(array, za, za.getShape(), new int[za.getShape().length]);
    }

    @Override
    public NdArray readArray(StorePath array, int[] shape, int[] offset) throws IOException {
        ZarrArray za = getZarrArray(array);
        int[] full = za.getShape();
        if (shape.length != full.length || offset.length != full.length) {
            throw new IllegalArgumentException(String.format(
                "Region of rank %d requested from %s of rank %d",
                shape.length, array, full.length));
        }
        for (int i = 0; i < full.length; i++) {
            if (offset[i] < 0 || shape[i] < 0 || offset[i] + shape[i] > full[i]) {
                throw new IndexOutOfRangeException(String.format(
                    "Region offset %s shape %s out of range for %s with shape %s",
                    Arrays.toString(offset), Arrays.toString(shape), array,
                    Arrays.toString(full)));
            }
        }
        return read(array, za, shape, offset);
    }

    private NdArray read(StorePath array, ZarrArray za, int[] shape, int[] offset)
        throws IOException {
        DType dtype = DType.fromZarr(za.getDataType(), array);
        try {
            Object data = za.read(shape, offset);
            return new NdArray(data, shape, dtype);
        } catch (IOException | InvalidRangeException | RuntimeException e) {
            log.error("Error reading Zarr data", e);
            throw new BackendIOException("Failed to read " + array, e);
        }
    }

    @Override
    public void writeArray(StorePath array, NdArray data, Map<String, Object> attributes)
        throws IOException {
        checkWritable("write array", array);
        if (isArray(array) || isGroup(array)) {
            throw new NameCollisionException("Node " + array + " already exists");
        }
        int[] shape = data.getShape();
        int[] chunks = guessChunks(shape, data.getDType().getByteWidth(), targetChunkBytes);
        try {
            Path path = toPath(array);
            Files.createDirectories(path);
            ZarrArray za = ZarrArray.create(path, new ArrayParams()
                .shape(shape)
                .chunks(chunks)
                .dataType(data.getDType().toZarr()));
            za.write(data.getData(), shape, new int[shape.length]);
            if (!attributes.isEmpty()) {
                za.writeAttributes(new LinkedHashMap<>(attributes));
            }
        } catch (IOException | InvalidRangeException | RuntimeException e) {
            throw new BackendIOException("Failed to write " + array, e);
        } finally {
            arrayCache.synchronous().invalidate(array);
            attributeCache.synchronous().invalidate(array);
        }
        log.debug("Wrote {} with shape {} in chunks {}", array, Arrays.toString(shape),
            Arrays.toString(chunks));
    }

    /**
     * Picks a chunk shape: the last dimension of a multi-dimensional array is
     * kept whole and the largest remaining dimension is halved until a chunk
     * fits in the target size.
     *
     * @param shape       the array shape
     * @param byteWidth   size of one element
     * @param targetBytes target chunk size
     * @return See above.
     */
    static int[] guessChunks(int[] shape, int byteWidth, int targetBytes) {
        int[] chunks = new int[shape.length];
        for (int i = 0; i < shape.length; i++) {
            chunks[i] = Math.max(1, shape[i]);
        }
        int splittable = shape.length > 1 ? shape.length - 1 : shape.length;
        while (NdArray.length(chunks) * byteWidth > targetBytes) {
            int largest = -1;
            for (int i = 0; i < splittable; i++) {
                if (chunks[i] > 1 && (largest < 0 || chunks[i] > chunks[largest])) {
                    largest = i;
                }
            }
            if (largest < 0) {
                break;
            }
            chunks[largest] = (chunks[largest] + 1) / 2;
        }
        return chunks;
    }

    @Override
    public Map<String, Object> getAttributes(StorePath node) throws IOException {
        checkOpen();
        Map<String, Object> pending = staged.get(node);
        if (pending != null) {
            return deepCopy(pending);
        }
        if (!isGroup(node) && !isArray(node)) {
            throw new NotFoundException("No node " + node + " in " + location.getLocation());
        }
        try {
            return deepCopy(attributeCache.get(node).get());
        } catch (ExecutionException | InterruptedException e) {
            throw new BackendIOException("Failed to read attributes of " + node, e);
        }
    }

    @Override
    public void setAttributes(StorePath node, Map<String, Object> attributes) throws IOException {
        checkWritable("set attributes of", node);
        if (!isGroup(node) && !isArray(node)) {
            throw new NotFoundException("No node " + node + " in " + location.getLocation());
        }
        staged.put(node, deepCopy(attributes));
    }

    @Override
    public boolean isReadOnly() {
        return readOnly;
    }

    @Override
    public void flush() throws IOException {
        checkOpen();
        IOException failure = null;
        for (Map.Entry<StorePath, Map<String, Object>> entry
            : new ArrayList<>(staged.entrySet())) {
            StorePath node = entry.getKey();
            try {
                Path path = toPath(node);
                if (Files.exists(path.resolve(ZARRAY))) {
                    ZarrArray.open(path).writeAttributes(entry.getValue());
                } else {
                    ZarrGroup.open(path).writeAttributes(entry.getValue());
                }
                staged.remove(node);
                attributeCache.synchronous().put(node, deepCopy(entry.getValue()));
            } catch (IOException | RuntimeException e) {
                BackendIOException wrapped =
                    new BackendIOException("Failed to write attributes of " + node, e);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        IOException failure = null;
        try {
            flush();
        } catch (IOException e) {
            failure = e;
        } finally {
            closed = true;
            staged.clear();
            arrayCache.synchronous().invalidateAll();
            attributeCache.synchronous().invalidateAll();
            try {
                root.close();
            } catch (IOException | RuntimeException e) {
                BackendIOException wrapped = new BackendIOException(
                    "Failed to release " + location.getLocation(), e);
                if (failure == null) {
                    failure = wrapped;
                } else {
                    failure.addSuppressed(wrapped);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        log.debug("Closed {}", location);
    }

    public StoreLocation getLocation() {
        return location;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : map.entrySet()) {
            copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, Object>) value);
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object element : (List<Object>) value) {
                copy.add(deepCopyValue(element));
            }
            return copy;
        }
        return value;
    }

    @Override
    public String toString() {
        return "ZarrArrayStore{" + "location=" + location + ", readOnly=" + readOnly + '}';
    }
}
