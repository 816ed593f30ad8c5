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

import static com.upplication.s3fs.AmazonS3Factory.ACCESS_KEY;
import static com.upplication.s3fs.AmazonS3Factory.SECRET_KEY;

import com.glencoesoftware.brim.exceptions.NotAContainerException;
import com.glencoesoftware.brim.exceptions.ReadOnlyViolationException;
import com.google.common.base.Splitter;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.ProviderNotFoundException;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.zip.ZipException;
import org.slf4j.LoggerFactory;

/**
 * Determines where a brim file lives, local directory, local zip archive or
 * remote S3 bucket, and resolves it into an NIO {@link Path} that jzarr can
 * operate on.
 *
 * <p> Supported locations: </p>
 * <ul>
 * <li>file:// or no scheme - local directory tree</li>
 * <li>file:// or no scheme ending in .zip - local zip archive</li>
 * <li>s3://host/bucket/path - S3-compatible object storage (read-only), with
 * optional accessKey and secretKey URL parameters</li>
 * </ul>
 */
public class StoreLocation {

    private static final org.slf4j.Logger log = LoggerFactory.getLogger(StoreLocation.class);

    /**
     * Enum representing the storage backends of a brim file.
     */
    public enum StorageType {
        DIRECTORY,
        ZIP,
        S3
    }

    private final String location;

    private final StorageType storageType;

    /** Local file system path, <code>null</code> for S3. */
    private final Path localPath;

    /** Shared S3 connections, <code>null</code> for a private one. */
    private final S3Backend s3Backend;

    /**
     * Classifies a location string; S3 locations get a connection of their
     * own.
     *
     * @see #StoreLocation(String, S3Backend)
     */
    public StoreLocation(String location) throws IOException {
        this(location, null);
    }

    /**
     * Classifies a location string.
     *
     * @param location  a local path, a file:// URI or an s3:// URI
     * @param s3Backend S3 connections to use, <code>null</code> to open a
     *                  private one
     * @throws IOException if the scheme is not supported
     */
    public StoreLocation(String location, S3Backend s3Backend) throws IOException {
        this.s3Backend = s3Backend;
        String loc = location.trim();
        this.location = loc.endsWith("/") ? loc.substring(0, loc.length() - 1) : loc;
        URI uri = null;
        try {
            uri = new URI(this.location);
        } catch (URISyntaxException e) {
            log.debug("Not a URI, treating as local path: {}", this.location);
        }
        String scheme = uri == null || uri.getScheme() == null
            ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (scheme == null || scheme.length() == 1) {
            // no scheme or a Windows drive letter
            localPath = Path.of(this.location);
        } else if ("file".equals(scheme)) {
            localPath = Path.of(uri);
        } else if ("s3".equals(scheme)) {
            localPath = null;
        } else {
            throw new IOException("Unsupported scheme: " + scheme);
        }
        if (localPath == null) {
            storageType = StorageType.S3;
        } else if (localPath.getFileName() != null
            && localPath.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip")) {
            storageType = StorageType.ZIP;
        } else {
            storageType = StorageType.DIRECTORY;
        }
    }

    /**
     * Whether something already occupies the location. Remote locations are
     * always reported as existing.
     *
     * @return See above.
     */
    public boolean exists() {
        return localPath == null || Files.exists(localPath);
    }

    /**
     * Resolves the root of the store.
     *
     * @param create whether the root should be created
     * @return the root path and the file system to release with it
     * @throws IOException if the root cannot be resolved or created
     */
    public Root resolve(boolean create) throws IOException {
        switch (storageType) {
            case DIRECTORY:
                if (create) {
                    Files.createDirectories(localPath);
                }
                return new Root(localPath, null);
            case ZIP: {
                Map<String, String> env = new HashMap<>();
                if (create) {
                    Path parent = localPath.toAbsolutePath().getParent();
                    if (parent != null) {
                        Files.createDirectories(parent);
                    }
                    env.put("create", "true");
                }
                FileSystem fs;
                try {
                    fs = FileSystems.newFileSystem(localPath, env);
                } catch (ZipException | ProviderNotFoundException e) {
                    throw new NotAContainerException("Not a zip archive: " + location, e);
                }
                return new Root(fs.getPath("/"), fs::close);
            }
            case S3:
                if (create) {
                    throw new ReadOnlyViolationException(
                        "Remote stores cannot be created: " + location);
                }
                return resolveS3();
            default:
                throw new IllegalStateException("Unhandled storage type " + storageType);
        }
    }

    private Root resolveS3() throws IOException {
        URI uri;
        try {
            uri = new URI(location);
        } catch (URISyntaxException e) {
            throw new IOException("Invalid URI: " + location, e);
        }
        if (uri.getUserInfo() != null && !uri.getUserInfo().isEmpty()) {
            throw new IOException("Found unsupported user information in S3 URI."
                + " Pass credentials as accessKey and secretKey parameters.");
        }
        String query = Optional.ofNullable(uri.getQuery()).orElse("");
        Map<String, String> params = Splitter.on('&')
                .trimResults()
                .omitEmptyStrings()
                .withKeyValueSeparator('=')
                .split(query);
        Map<String, String> env = new HashMap<String, String>();
        if (params.containsKey("accessKey") && params.containsKey("secretKey")) {
            env.put(ACCESS_KEY, params.get("accessKey"));
            env.put(SECRET_KEY, params.get("secretKey"));
        }
        // drop initial "/"
        String uriPath = uri.getPath().substring(1);
        int first = uriPath.indexOf("/");
        if (first < 0) {
            throw new IOException("S3 location must contain a bucket and a path: " + location);
        }
        String bucket = "/" + uriPath.substring(0, first);
        String rest = uriPath.substring(first + 1);
        URI endpoint = URI.create("s3://" + uri.getAuthority() + "/");
        S3Backend backend = s3Backend == null ? new S3Backend() : s3Backend;
        FileSystem fs;
        try {
            fs = backend.acquire(endpoint, env);
        } catch (IOException | RuntimeException e) {
            if (backend != s3Backend) {
                backend.close();
            }
            throw e;
        }
        return new Root(fs.getPath(bucket, rest), () -> {
            try {
                backend.release(endpoint);
            } finally {
                if (backend != s3Backend) {
                    backend.close();
                }
            }
        });
    }

    public String getLocation() {
        return location;
    }

    public StorageType getStorageType() {
        return storageType;
    }

    /**
     * Whether the backend can only be read.
     *
     * @return See above.
     */
    public boolean isRemote() {
        return storageType == StorageType.S3;
    }

    @Override
    public String toString() {
        return "StoreLocation{" + "location='" + location + '\'' + ", storageType=" + storageType
            + '}';
    }

    /**
     * Resolved root of a store together with what has to be released with it
     * (<code>null</code> for the default file system).
     */
    public static final class Root implements Closeable {

        private final Path path;

        private Closeable release;

        Root(Path path, Closeable release) {
            this.path = path;
            this.release = release;
        }

        public Path getPath() {
            return path;
        }

        /**
         * Releases the file system of the root, once. For zip archives this
         * is when the archive is written out.
         */
        @Override
        public void close() throws IOException {
            Closeable r = release;
            release = null;
            if (r != null) {
                r.close();
            }
        }
    }
}
