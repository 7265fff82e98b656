package io.nosqlbench.rangeserver;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/// Immutable settings for a [RangeFileServer].
///
/// @param host        the interface to bind, or null for all interfaces
/// @param port        the port to bind, 0 picks an ephemeral port
/// @param root        the directory to serve
/// @param minThreads  minimum worker threads
/// @param maxThreads  maximum worker threads
/// @param idleTimeout how long an idle connection is kept open
public record RangeServerConfig(String host, int port, Path root, int minThreads, int maxThreads,
                                Duration idleTimeout) {

    /// The port used when none is given.
    public static final int DEFAULT_PORT = 8080;

    public RangeServerConfig {
        Objects.requireNonNull(root, "root");
        Objects.requireNonNull(idleTimeout, "idleTimeout");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port must be between 0 and 65535: " + port);
        }
        if (minThreads < 1 || maxThreads < minThreads) {
            throw new IllegalArgumentException(
                "Thread bounds must satisfy 1 <= min <= max, got min=" + minThreads + " max=" + maxThreads);
        }
        if (idleTimeout.isNegative() || idleTimeout.isZero()) {
            throw new IllegalArgumentException("Idle timeout must be positive: " + idleTimeout);
        }
    }

    /// Settings for serving a directory on all interfaces at [#DEFAULT_PORT].
    ///
    /// @param root the directory to serve
    /// @return the default settings
    public static RangeServerConfig forRoot(Path root) {
        return new RangeServerConfig(null, DEFAULT_PORT, root, 8, 200, Duration.ofSeconds(30));
    }

    public RangeServerConfig withHost(String host) {
        return new RangeServerConfig(host, port, root, minThreads, maxThreads, idleTimeout);
    }

    public RangeServerConfig withPort(int port) {
        return new RangeServerConfig(host, port, root, minThreads, maxThreads, idleTimeout);
    }

    public RangeServerConfig withThreads(int minThreads, int maxThreads) {
        return new RangeServerConfig(host, port, root, minThreads, maxThreads, idleTimeout);
    }

    public RangeServerConfig withIdleTimeout(Duration idleTimeout) {
        return new RangeServerConfig(host, port, root, minThreads, maxThreads, idleTimeout);
    }
}
