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

import com.upplication.s3fs.S3FileSystemProvider;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.file.FileSystem;
import java.nio.file.FileSystemAlreadyExistsException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * S3 connections shared by the brim files opened with it. Each endpoint's
 * file system is created for its first user and closed once its last user
 * releases it. The handle belongs to the caller, who passes it to every
 * file through {@link com.glencoesoftware.brim.BrimOptions} and closes it
 * when done; files opened without one get a handle of their own.
 */
public class S3Backend implements Closeable {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(S3Backend.class);

    private final S3FileSystemProvider provider;

    /** Number of open stores per endpoint. */
    private final Map<URI, Integer> users = new HashMap<>();

    private final Map<URI, FileSystem> fileSystems = new HashMap<>();

    private boolean closed = false;

    public S3Backend() {
        this(new S3FileSystemProvider());
    }

    public S3Backend(S3FileSystemProvider provider) {
        this.provider = provider;
    }

    /**
     * Gets the file system of an endpoint, creating it for its first user.
     * Every call must be matched by {@link #release(URI)}.
     *
     * @param endpoint the endpoint, {@code s3://host[:port]/}
     * @param env      credentials and other provider settings
     * @return See above.
     * @throws IOException if the file system cannot be created
     */
    public synchronized FileSystem acquire(URI endpoint, Map<String, String> env)
        throws IOException {
        if (closed) {
            throw new IllegalStateException("S3 backend is closed");
        }
        FileSystem fs = fileSystems.get(endpoint);
        if (fs == null) {
            try {
                fs = provider.newFileSystem(endpoint, env);
            } catch (FileSystemAlreadyExistsException e) {
                log.debug("Reusing S3 file system for {}", endpoint);
                fs = provider.getFileSystem(endpoint);
            }
            fileSystems.put(endpoint, fs);
        }
        users.merge(endpoint, 1, Integer::sum);
        return fs;
    }

    /**
     * Gives back a file system obtained from {@link #acquire(URI, Map)},
     * closing it when this was its last user.
     *
     * @param endpoint the endpoint
     * @throws IOException if the file system cannot be closed
     */
    public synchronized void release(URI endpoint) throws IOException {
        Integer count = users.get(endpoint);
        if (count == null) {
            return;
        }
        if (count > 1) {
            users.put(endpoint, count - 1);
            return;
        }
        users.remove(endpoint);
        FileSystem fs = fileSystems.remove(endpoint);
        log.debug("Closing S3 file system for {}", endpoint);
        fs.close();
    }

    /**
     * Gets the number of stores using an endpoint.
     *
     * @param endpoint the endpoint
     * @return See above.
     */
    public synchronized int getUsers(URI endpoint) {
        return users.getOrDefault(endpoint, 0);
    }

    /**
     * Closes every file system still in use. Closing twice does nothing.
     */
    @Override
    public synchronized void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (!users.isEmpty()) {
            log.warn("Closing S3 backend still used by {}", users);
        }
        IOException failure = null;
        for (FileSystem fs : new ArrayList<>(fileSystems.values())) {
            try {
                fs.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        fileSystems.clear();
        users.clear();
        if (failure != null) {
            throw failure;
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
