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

import com.glencoesoftware.brim.exceptions.AlreadyExistsException;
import com.glencoesoftware.brim.exceptions.NameCollisionException;
import com.glencoesoftware.brim.exceptions.NotAContainerException;
import com.glencoesoftware.brim.exceptions.NotFoundException;
import com.glencoesoftware.brim.exceptions.ReadOnlyViolationException;
import com.glencoesoftware.brim.exceptions.UnsupportedVersionException;
import com.glencoesoftware.brim.grid.SpatialMapping;
import com.glencoesoftware.brim.grid.SpatialReconstruction;
import com.glencoesoftware.brim.metadata.Metadata;
import com.glencoesoftware.brim.store.ArrayStore;
import com.glencoesoftware.brim.store.StoreLocation;
import com.glencoesoftware.brim.store.StorePath;
import com.glencoesoftware.brim.store.ZarrArrayStore;
import com.google.common.collect.Iterators;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.apache.maven.artifact.versioning.ComparableVersion;
import org.perf4j.StopWatch;
import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.LoggerFactory;

/**
 * A brim file: a Zarr container holding Brillouin microscopy data groups.
 *
 * <p>Instances own their storage handle and must be closed, preferably with
 * try-with-resources. A file opened {@link Mode#READ_WRITE} must not be
 * opened by another writer at the same time; readers of a file being
 * written only see changes once the writer has closed it.</p>
 */
public class BrimFile implements Closeable {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(BrimFile.class);

    public static final ComparableVersion MIN_VERSION =
        new ComparableVersion(BrimLayout.MIN_SUPPORTED_VERSION);

    public static final ComparableVersion MAX_VERSION =
        new ComparableVersion(BrimLayout.MAX_SUPPORTED_VERSION);

    /** How a file is opened. */
    public enum Mode { READ_ONLY, READ_WRITE }

    private final ArrayStore store;

    private final BrimOptions options;

    private final SpatialMapping mapping;

    private final StorePath brillouinData;

    private final String formatVersion;

    private final String location;

    private boolean closed = false;

    private BrimFile(String location, ArrayStore store, BrimOptions options,
        String formatVersion) {
        this.location = location;
        this.store = store;
        this.options = options;
        this.formatVersion = formatVersion;
        this.mapping = new SpatialMapping(new SpatialReconstruction(
            options.getRelativeTolerance(), options.getIntegerTolerance()));
        this.brillouinData = store.root().resolve(BrimLayout.BRILLOUIN_DATA);
    }

    /**
     * Opens a file read-only.
     *
     * @see #open(String, Mode, BrimOptions)
     */
    public static BrimFile open(String location) throws IOException {
        return open(location, Mode.READ_ONLY, BrimOptions.DEFAULT);
    }

    /**
     * Opens a file with default options.
     *
     * @see #open(String, Mode, BrimOptions)
     */
    public static BrimFile open(String location, Mode mode) throws IOException {
        return open(location, mode, BrimOptions.DEFAULT);
    }

    /**
     * Opens an existing file.
     *
     * @param location a directory, a {@code .zip} file or an
     *                 {@code s3://host/bucket/path} URI (read-only)
     * @param mode     how to open the file
     * @param options  tuning options
     * @return See above.
     * @throws NotFoundException           if nothing exists at the location
     * @throws NotAContainerException      if the location is not a brim file
     * @throws UnsupportedVersionException if the format version is not
     *                                     supported
     * @throws IOException                 if the storage cannot be opened
     */
    public static BrimFile open(String location, Mode mode, BrimOptions options)
        throws IOException {
        StopWatch t0 = new Slf4JStopWatch("BrimFile.open()");
        try {
            StoreLocation storeLocation = new StoreLocation(location, options.getS3Backend());
            ZarrArrayStore store = ZarrArrayStore.open(storeLocation, mode == Mode.READ_ONLY,
                options.getCacheSize(), options.getChunkBytes());
            try {
                String version = checkContainer(store, location);
                log.info("Opened {} version {}{}", location, version,
                    store.isReadOnly() ? " read-only" : "");
                return new BrimFile(location, store, options, version);
            } catch (IOException | RuntimeException e) {
                try {
                    store.close();
                } catch (IOException | RuntimeException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                throw e;
            }
        } finally {
            t0.stop();
        }
    }

    private static String checkContainer(ArrayStore store, String location) throws IOException {
        StorePath root = store.root();
        if (!store.isGroup(root)) {
            throw new NotAContainerException("No Zarr group at " + location);
        }
        Object version = store.getAttributes(root).get(BrimLayout.VERSION_ATTR);
        if (version == null) {
            throw new NotAContainerException(
                "No " + BrimLayout.VERSION_ATTR + " attribute at " + location);
        }
        ComparableVersion parsed = new ComparableVersion(version.toString());
        if (parsed.compareTo(MIN_VERSION) < 0 || parsed.compareTo(MAX_VERSION) > 0) {
            throw new UnsupportedVersionException(String.format(
                "%s has version %s, supported versions are %s to %s",
                location, version, MIN_VERSION, MAX_VERSION));
        }
        if (!store.isGroup(root.resolve(BrimLayout.BRILLOUIN_DATA))) {
            throw new NotAContainerException(
                "No " + BrimLayout.BRILLOUIN_DATA + " group at " + location);
        }
        return version.toString();
    }

    /**
     * Creates an empty file with default options.
     *
     * @see #create(String, BrimOptions)
     */
    public static BrimFile create(String location) throws IOException {
        return create(location, BrimOptions.DEFAULT);
    }

    /**
     * Creates an empty file, opened read-write.
     *
     * @param location a directory or a {@code .zip} file which does not exist
     * @param options  tuning options
     * @return See above.
     * @throws AlreadyExistsException if something exists at the location
     * @throws IOException            if the storage cannot be created
     */
    public static BrimFile create(String location, BrimOptions options) throws IOException {
        StoreLocation storeLocation = new StoreLocation(location, options.getS3Backend());
        if (storeLocation.exists()) {
            throw new AlreadyExistsException(location + " already exists");
        }
        Map<String, Object> rootAttributes =
            Collections.singletonMap(BrimLayout.VERSION_ATTR, BrimLayout.CURRENT_VERSION);
        ZarrArrayStore store = ZarrArrayStore.create(storeLocation, rootAttributes,
            options.getCacheSize(), options.getChunkBytes());
        try {
            store.createGroup(BrimLayout.BRILLOUIN_DATA);
        } catch (IOException | RuntimeException e) {
            try {
                store.close();
            } catch (IOException | RuntimeException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
        log.info("Created {} version {}", location, BrimLayout.CURRENT_VERSION);
        return new BrimFile(location, store, options, BrimLayout.CURRENT_VERSION);
    }

    /**
     * Children of a group named {@code <prefix><i>}, ordered by {@code i}.
     */
    static List<StorePath> indexedChildren(StorePath parent, String prefix) throws IOException {
        TreeMap<Integer, StorePath> nodes = new TreeMap<>();
        for (String child : parent.store.listChildren(parent)) {
            if (!child.startsWith(prefix)) {
                continue;
            }
            try {
                int index = Integer.parseInt(child.substring(prefix.length()));
                if (index >= 0 && parent.store.isGroup(parent.resolve(child))) {
                    nodes.put(index, parent.resolve(child));
                }
            } catch (NumberFormatException e) {
                log.debug("Ignoring {} in {}", child, parent);
            }
        }
        return new ArrayList<>(nodes.values());
    }

    /**
     * Creates a child group {@code <prefix><i>} with the next unused index and
     * records its name.
     *
     * @param parent parent group
     * @param prefix prefix of the child groups
     * @param name   requested name or {@code null} for {@code <prefix><i>}
     * @return the new group
     * @throws NameCollisionException if a sibling already has the name
     */
    static StorePath createIndexedChild(StorePath parent, String prefix, String name)
        throws IOException {
        ArrayStore store = parent.store;
        if (store.isReadOnly()) {
            throw new ReadOnlyViolationException(
                "Cannot create " + prefix + "* in " + parent + ": opened read-only");
        }
        if (name != null && name.isEmpty()) {
            throw new IllegalArgumentException("Name must not be empty");
        }
        List<StorePath> siblings = indexedChildren(parent, prefix);
        Set<String> names = new HashSet<>();
        for (StorePath sibling : siblings) {
            names.add(DataGroup.nameOf(sibling));
        }
        if (name != null && names.contains(name)) {
            throw new NameCollisionException(
                "A group named '" + name + "' already exists in " + parent);
        }
        int index = siblings.isEmpty() ? 0
            : Integer.parseInt(siblings.get(siblings.size() - 1).getName()
                .substring(prefix.length())) + 1;
        while (name == null && names.contains(prefix + index)) {
            index++;
        }
        String assigned = name == null ? prefix + index : name;
        StorePath node = store.createGroup(parent.resolve(prefix + index).path);
        Map<String, Object> attributes = store.getAttributes(node);
        attributes.put(BrimLayout.NAME_ATTR, assigned);
        store.setAttributes(node, attributes);
        log.info("Created {} named '{}'", node, assigned);
        return node;
    }

    /**
     * Lists the names of the data groups in creation order. The listing is
     * read from the store each time the returned sequence is iterated.
     *
     * @return See above.
     */
    public Iterable<String> listDataGroups() {
        return () -> {
            try {
                return Iterators.transform(
                    indexedChildren(brillouinData, BrimLayout.DATA_GROUP_PREFIX).iterator(),
                    node -> {
                        try {
                            return DataGroup.nameOf(node);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    });
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        };
    }

    /**
     * Gets a data group by position in creation order.
     *
     * @param index the position
     * @return See above.
     * @throws NotFoundException if there is no such data group
     * @throws IOException       if the store cannot be read
     */
    public DataGroup getDataGroup(int index) throws IOException {
        List<StorePath> nodes = indexedChildren(brillouinData, BrimLayout.DATA_GROUP_PREFIX);
        if (index < 0 || index >= nodes.size()) {
            throw new NotFoundException(String.format(
                "No data group %d in %s, %d available", index, location, nodes.size()));
        }
        return new DataGroup(nodes.get(index), brillouinData, mapping);
    }

    /**
     * Gets a data group by name.
     *
     * @param name the name
     * @return See above.
     * @throws NotFoundException if there is no such data group
     * @throws IOException       if the store cannot be read
     */
    public DataGroup getDataGroup(String name) throws IOException {
        for (StorePath node : indexedChildren(brillouinData, BrimLayout.DATA_GROUP_PREFIX)) {
            if (DataGroup.nameOf(node).equals(name)) {
                return new DataGroup(node, brillouinData, mapping);
            }
        }
        throw new NotFoundException("No data group named '" + name + "' in " + location);
    }

    /**
     * Creates a data group with the next default name.
     *
     * @see #createDataGroup(String)
     */
    public DataGroup createDataGroup() throws IOException {
        return createDataGroup(null);
    }

    /**
     * Creates a data group.
     *
     * @param name name of the data group, {@code null} for the next unused
     *             {@code Data_<i>}
     * @return See above.
     * @throws NameCollisionException     if a data group with this name exists
     * @throws ReadOnlyViolationException if the file is opened read-only
     * @throws IOException                if the store cannot be written
     */
    public DataGroup createDataGroup(String name) throws IOException {
        StorePath node = createIndexedChild(brillouinData, BrimLayout.DATA_GROUP_PREFIX, name);
        return new DataGroup(node, brillouinData, mapping);
    }

    /**
     * Metadata shared by all data groups of this file.
     *
     * @return See above.
     */
    public Metadata getMetadata() {
        return new Metadata(brillouinData, null);
    }

    public boolean isReadOnly() {
        return store.isReadOnly();
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public String getLocation() {
        return location;
    }

    public BrimOptions getOptions() {
        return options;
    }

    /**
     * Writes staged changes to storage.
     *
     * @throws IOException if a change cannot be written
     */
    public void flush() throws IOException {
        store.flush();
    }

    /**
     * Writes staged changes and releases the storage. Storage is released
     * even when writing fails, in which case the failure is thrown. Closing a
     * closed file does nothing.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            store.close();
        } finally {
            closed = true;
        }
        log.info("Closed {}", location);
    }

    /** Whether {@link #close()} was called, successfully or not. */
    public boolean isClosed() {
        return closed;
    }

    @Override
    public String toString() {
        return "BrimFile{location=" + location + ", version=" + formatVersion
            + ", readOnly=" + isReadOnly() + '}';
    }
}
