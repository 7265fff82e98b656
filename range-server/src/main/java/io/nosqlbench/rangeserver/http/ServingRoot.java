package io.nosqlbench.rangeserver.http;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.Optional;

/// The directory a server instance serves files from.
///
/// A serving root is fixed when the server is built and is passed to every
/// request handler; the process working directory is never consulted or
/// changed. Request paths resolve strictly inside the root: `..` segments that
/// would climb out of it, and symbolic links whose targets lie outside it, are
/// rejected.
public final class ServingRoot {
    private static final Logger logger = LogManager.getLogger(ServingRoot.class);

    private final Path directory;

    private ServingRoot(Path directory) {
        this.directory = directory;
    }

    /// Creates a serving root from a directory path.
    ///
    /// @param directory an existing directory, relative paths resolve against the working directory
    /// @return the serving root, anchored at the directory's real path
    /// @throws NotDirectoryException if the path is not an existing directory
    /// @throws IOException if the real path cannot be determined
    public static ServingRoot of(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new NotDirectoryException(directory.toString());
        }
        return new ServingRoot(directory.toRealPath());
    }

    /// @return the absolute, real path of this root
    public Path directory() {
        return directory;
    }

    /// Resolves a request path to a filesystem path within this root.
    ///
    /// The result is not guaranteed to exist. It is empty when the request path
    /// is not a valid filesystem path, climbs out of the root, or runs through a
    /// link that leaves the root.
    ///
    /// @param requestPath a decoded URL path such as `/data/sample.h5ad`; null means the root itself
    /// @return the resolved path, or empty if the request must be refused
    public Optional<Path> resolve(String requestPath) {
        String relative = requestPath == null ? "" : stripLeadingSlashes(requestPath);
        if (relative.indexOf('\0') >= 0) {
            logger.debug("Refusing request path containing NUL: {}", requestPath);
            return Optional.empty();
        }

        Path resolved;
        try {
            resolved = directory.resolve(relative).normalize();
        } catch (InvalidPathException e) {
            logger.debug("Refusing invalid request path {}: {}", requestPath, e.getMessage());
            return Optional.empty();
        }

        if (!resolved.startsWith(directory)) {
            logger.debug("Refusing request path outside of serving root: {}", requestPath);
            return Optional.empty();
        }

        if (Files.exists(resolved, LinkOption.NOFOLLOW_LINKS)) {
            try {
                if (!resolved.toRealPath().startsWith(directory)) {
                    logger.debug("Refusing request path linked outside of serving root: {}", requestPath);
                    return Optional.empty();
                }
            } catch (IOException e) {
                // dangling link, or the target vanished; the caller reports it as not found
                logger.debug("Cannot resolve real path of {}: {}", resolved, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.of(resolved);
    }

    private static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && path.charAt(i) == '/') {
            i++;
        }
        return path.substring(i);
    }

    @Override
    public String toString() {
        return directory.toString();
    }
}
