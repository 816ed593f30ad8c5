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

import java.io.Closeable;
import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Interface over a hierarchical, chunked array container: named groups,
 * N-dimensional arrays with a shape and element type, and attribute maps
 * attached to both. Every method may block on storage I/O.
 *
 * <p>Mutating methods fail with a
 * {@link com.glencoesoftware.brim.exceptions.ReadOnlyViolationException} on a
 * read-only store. Attribute changes may be staged in memory and only reach
 * the backend on {@link #flush()} or {@link #close()}; reads through the same
 * store always observe them.</p>
 */
public interface ArrayStore extends Closeable {

    /**
     * Gets the root group of the store.
     *
     * @return See above.
     */
    public StorePath root();

    /**
     * Opens an existing group.
     *
     * @param path the relative path of the group
     * @return a handle to the group
     * @throws IOException if the group does not exist or cannot be read
     */
    public StorePath openGroup(String path) throws IOException;

    /**
     * Creates a group, along with any missing parents.
     *
     * @param path the relative path of the group
     * @return a handle to the new group
     * @throws IOException if the group cannot be created
     */
    public StorePath createGroup(String path) throws IOException;

    /**
     * Whether a group exists at the given node.
     *
     * @param node the node to check
     * @return See above.
     * @throws IOException if the backend cannot be queried
     */
    public boolean isGroup(StorePath node) throws IOException;

    /**
     * Whether an array exists at the given node.
     *
     * @param node the node to check
     * @return See above.
     * @throws IOException if the backend cannot be queried
     */
    public boolean isArray(StorePath node) throws IOException;

    /**
     * Lists the names of the direct children (groups and arrays) of a group,
     * sorted by name.
     *
     * @param group the group
     * @return See above.
     * @throws IOException if the group does not exist or cannot be listed
     */
    public List<String> listChildren(StorePath group) throws IOException;

    /**
     * Reads the shape, chunking and element type of an array.
     *
     * @param array the array
     * @return See above.
     * @throws IOException if the array does not exist or cannot be read
     */
    public ArrayInfo getArrayInfo(StorePath array) throws IOException;

    /**
     * Reads a whole array.
     *
     * @param array the array
     * @return See above.
     * @throws IOException if the array does not exist or cannot be read
     */
    public NdArray readArray(StorePath array) throws IOException;

    /**
     * Reads a hyperslab of an array, touching only the chunks it overlaps.
     *
     * @param array  the array
     * @param shape  the shape of the region to read
     * @param offset the offset of the region
     * @return See above.
     * @throws IOException if the array does not exist, the region is out of
     *                     range or the data cannot be read
     */
    public NdArray readArray(StorePath array, int[] shape, int[] offset) throws IOException;

    /**
     * Creates an array and writes its full content.
     *
     * @param array      where to create the array
     * @param data       the content, defining shape and element type
     * @param attributes attributes to attach to the array, may be empty
     * @throws IOException if an array or group already exists at that node or
     *                     the data cannot be written
     */
    public void writeArray(StorePath array, NdArray data, Map<String, Object> attributes)
        throws IOException;

    /**
     * Gets the attributes of a group or array, including staged changes.
     *
     * @param node the node
     * @return a mutable copy of the attribute map
     * @throws IOException if the node does not exist or cannot be read
     */
    public Map<String, Object> getAttributes(StorePath node) throws IOException;

    /**
     * Replaces the attributes of a group or array.
     *
     * @param node       the node
     * @param attributes the new attribute map
     * @throws IOException if the node does not exist
     */
    public void setAttributes(StorePath node, Map<String, Object> attributes) throws IOException;

    /**
     * Whether the store refuses mutating calls.
     *
     * @return See above.
     */
    public boolean isReadOnly();

    /**
     * Persists every staged change.
     *
     * @throws IOException if any staged change cannot be written
     */
    public void flush() throws IOException;

    /**
     * Flushes staged changes and releases the backend. Calling it on a closed
     * store is a no-op.
     *
     * @throws IOException if flushing or releasing fails; the backend is
     *                     released regardless
     */
    @Override
    public void close() throws IOException;
}
