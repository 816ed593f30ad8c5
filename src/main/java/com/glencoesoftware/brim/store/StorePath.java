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

import java.util.Objects;

/**
 * This class represents a node (group or array) within a specific
 * {@link ArrayStore}. Paths are relative to the store root, use "/" as the
 * separator and the empty string denotes the root group.
 */
public final class StorePath {

    /** The store to which this path belongs. */
    public final ArrayStore store;

    /** The path within the store. */
    public final String path;

    /**
     * Constructs a StorePath from a store and a path string.
     *
     * @param store the store to which this path belongs
     * @param path  the path within the store
     */
    public StorePath(ArrayStore store, String path) {
        this.store = store;
        this.path = normalize(path);
    }

    private static String normalize(String path) {
        String p = path == null ? "" : path.trim();
        while (p.startsWith("/")) {
            p = p.substring(1);
        }
        while (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }

    /**
     * Resolves a child name against this path.
     *
     * @param name the child name, may itself contain "/"
     * @return See above.
     */
    public StorePath resolve(String name) {
        String child = normalize(name);
        if (path.isEmpty()) {
            return new StorePath(store, child);
        }
        return new StorePath(store, path + "/" + child);
    }

    /**
     * Gets the last element of the path, the empty string for the root.
     *
     * @return See above.
     */
    public String getName() {
        int sep = path.lastIndexOf('/');
        return sep < 0 ? path : path.substring(sep + 1);
    }

    public boolean isRoot() {
        return path.isEmpty();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof StorePath)) {
            return false;
        }
        StorePath other = (StorePath) obj;
        return store == other.store && Objects.equals(path, other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(store), path);
    }

    @Override
    public String toString() {
        return "/" + path;
    }
}
