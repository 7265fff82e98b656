package io.nosqlbench.rangeserver.testserver;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.nosqlbench.rangeserver.RangeFileServer;
import io.nosqlbench.rangeserver.RangeServerConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/// A test fixture that runs a [RangeFileServer] over a directory of test files.
///
/// The server binds `127.0.0.1` on an ephemeral port. The served directory is
/// treated as read-only test data: file timestamps are recorded when the fixture
/// is built, and [#close()] fails if any file outside the temp directory was
/// modified, deleted or added in the meantime.
///
/// Example usage:
/// ```java
/// try (RangeFileServerFixture server = new RangeFileServerFixture()) {
///     server.start();
///     URL baseUrl = server.getBaseUrl();
///     // Use baseUrl in your tests
/// }
/// ```
public class RangeFileServerFixture implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RangeFileServerFixture.class);

    private final Path resourcesRoot;
    private final Map<Path, FileTime> fileTimestamps = new HashMap<>();
    private Path tempDirectory = null;
    private RangeFileServer server;

    /// Creates a fixture over `src/test/resources/testserver`.
    public RangeFileServerFixture() {
        this(Paths.get("src/test/resources/testserver"));
    }

    /// @param resourcesRoot the directory to serve
    /// @throws UncheckedIOException if the directory does not exist
    public RangeFileServerFixture(Path resourcesRoot) {
        logger.debug("resourcesRoot: {}", resourcesRoot);
        if (!Files.isDirectory(resourcesRoot)) {
            throw new UncheckedIOException(new IOException("Resources directory does not exist: " + resourcesRoot));
        }
        this.resourcesRoot = resourcesRoot;
    }

    /// Marks a directory whose contents tests may change freely.
    ///
    /// Must be called before [#start()], since the snapshot skips this directory.
    ///
    /// @param tempDirectory a directory under the resources root
    public void setTempDirectory(Path tempDirectory) {
        this.tempDirectory = tempDirectory;
    }

    /// Snapshots the served files and starts the server.
    ///
    /// @throws IOException if the server cannot be started
    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Fixture already started at " + getBaseUrl());
        }
        snapshotTimestamps();
        RangeFileServer started = new RangeFileServer(
            RangeServerConfig.forRoot(resourcesRoot).withHost("127.0.0.1").withPort(0).withThreads(2, 32));
        started.start();
        server = started;
        logger.info("Range test server started on port {} serving files from {}", server.getPort(), resourcesRoot);
    }

    /// @return the base URL of the running server, ending with `/`
    /// @throws IllegalStateException if the fixture is not started
    public URL getBaseUrl() {
        if (server == null) {
            throw new IllegalStateException("Fixture is not started");
        }
        return server.getBaseUrl();
    }

    /// @return the directory being served
    public Path getRootDirectory() {
        return resourcesRoot;
    }

    /// Stops the server, then verifies that no read-only test file was changed.
    ///
    /// @throws IllegalStateException if a test modified, deleted or created a file outside the temp directory
    @Override
    public void close() {
        if (server != null) {
            server.close();
            server = null;
        }
        checkForModifiedFiles();
    }

    private void snapshotTimestamps() {
        fileTimestamps.clear();
        try {
            Files.walkFileTree(resourcesRoot, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return isInTempDirectory(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    fileTimestamps.put(file, attrs.lastModifiedTime());
                    return FileVisitResult.CONTINUE;
                }
            });
            logger.debug("Took timestamp snapshot of {} files in {} (excluding temp directory)",
                fileTimestamps.size(), resourcesRoot);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to snapshot test files under " + resourcesRoot, e);
        }
    }

    private void checkForModifiedFiles() {
        for (Map.Entry<Path, FileTime> entry : fileTimestamps.entrySet()) {
            Path file = entry.getKey();
            try {
                if (!Files.getLastModifiedTime(file).equals(entry.getValue())) {
                    throw new IllegalStateException(
                        "Unit tests are not allowed to modify files in the testserver directory. " +
                        "File was modified: " + file);
                }
            } catch (IOException e) {
                throw new IllegalStateException(
                    "Unit tests are not allowed to delete files in the testserver directory. " +
                    "File was deleted: " + file, e);
            }
        }

        Set<Path> currentFiles = new HashSet<>();
        try {
            Files.walkFileTree(resourcesRoot, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    return isInTempDirectory(dir) ? FileVisitResult.SKIP_SUBTREE : FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    currentFiles.add(file);
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            logger.warn("Failed to check for new files under {}: {}", resourcesRoot, e.getMessage());
            return;
        }
        for (Path currentFile : currentFiles) {
            if (!fileTimestamps.containsKey(currentFile)) {
                throw new IllegalStateException(
                    "Unit tests are not allowed to create new files in the testserver directory. " +
                    "New file was created: " + currentFile);
            }
        }
    }

    private boolean isInTempDirectory(Path file) {
        return tempDirectory != null && file.startsWith(tempDirectory);
    }
}
