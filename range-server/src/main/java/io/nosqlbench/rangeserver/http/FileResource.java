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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;
import java.util.Optional;

/// A regular file as seen by one request: its path, its size at the moment it
/// was stat'ed, and the content type guessed from its name.
///
/// Instances are never cached across requests, so every request observes the
/// file as it is on disk at that time.
///
/// @param path        the resolved filesystem path
/// @param size        the total file size in bytes
/// @param contentType the guessed content type
public record FileResource(Path path, long size, String contentType) {

    public FileResource {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(contentType, "contentType");
        if (size < 0) {
            throw new IllegalArgumentException("File size must be non-negative: " + size);
        }
    }

    /// Reads the attributes of a path.
    ///
    /// @param path the path to inspect
    /// @return the resource, or empty if the path does not exist or is not a regular file
    /// @throws IOException if the attributes exist but cannot be read
    public static Optional<FileResource> stat(Path path) throws IOException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
        if (!attributes.isRegularFile()) {
            return Optional.empty();
        }
        Path fileName = path.getFileName();
        String contentType = ContentTypes.guess(fileName == null ? path.toString() : fileName.toString());
        return Optional.of(new FileResource(path, attributes.size(), contentType));
    }
}
