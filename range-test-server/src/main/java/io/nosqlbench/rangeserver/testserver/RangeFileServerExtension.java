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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.jupiter.api.extension.AfterAllCallback;
import org.junit.jupiter.api.extension.BeforeAllCallback;
import org.junit.jupiter.api.extension.ExtensionContext;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/// A JUnit Jupiter extension that shares one [RangeFileServerFixture] across a test JVM.
///
/// The fixture is started the first time any test class using the extension
/// runs, and stopped by a shutdown hook when the JVM exits, so every test class
/// in a module talks to the same server. Tests that need to write files put them
/// under [#TEMP_RESOURCES_ROOT]; everything else under the resources root is
/// read-only.
///
/// The served directory defaults to `src/test/resources/testserver` and can be
/// overridden with the `rangeserver.test.resources.root` system property.
///
/// Example usage:
///
/// ```java
/// @ExtendWith(RangeFileServerExtension.class)
/// public class MyTest {
///     // RangeFileServerExtension.getBaseUrl() in test methods
/// }
/// ```
public class RangeFileServerExtension implements BeforeAllCallback, AfterAllCallback {
    private static final Logger logger = LogManager.getLogger(RangeFileServerExtension.class);

    private static final String RESOURCES_ROOT_PROPERTY = "rangeserver.test.resources.root";
    private static final String DEFAULT_RESOURCES_PATH = "src/test/resources/testserver";

    public static final Path DEFAULT_RESOURCES_ROOT;
    public static final Path TEMP_RESOURCES_ROOT;

    private static final Object lock = new Object();
    private static RangeFileServerFixture server;
    private static URL baseUrl;

    static {
        String resourcesPath = System.getProperty(RESOURCES_ROOT_PROPERTY, DEFAULT_RESOURCES_PATH);
        DEFAULT_RESOURCES_ROOT = Paths.get(resourcesPath).toAbsolutePath();
        TEMP_RESOURCES_ROOT = DEFAULT_RESOURCES_ROOT.resolve("temp");
    }

    /// Starts the shared server if it is not running yet. Safe to call from any thread.
    ///
    /// @throws UncheckedIOException if the server cannot be started
    public static void initialize() {
        synchronized (lock) {
            if (server != null) {
                return;
            }
            try {
                Files.createDirectories(TEMP_RESOURCES_ROOT);

                logger.info("Starting range test server over {}", DEFAULT_RESOURCES_ROOT);
                RangeFileServerFixture fixture = new RangeFileServerFixture(DEFAULT_RESOURCES_ROOT);
                fixture.setTempDirectory(TEMP_RESOURCES_ROOT);
                fixture.start();
                server = fixture;
                baseUrl = fixture.getBaseUrl();
                logger.info("Range test server started at {}", baseUrl);

                Runtime.getRuntime().addShutdownHook(new Thread(RangeFileServerExtension::shutdown,
                    "rangeserver-test-shutdown"));
            } catch (IOException e) {
                logger.error("Failed to start range test server", e);
                throw new UncheckedIOException("Failed to start range test server", e);
            }
        }
    }

    /// @return the base URL of the shared server, starting it if needed
    public static URL getBaseUrl() {
        initialize();
        return baseUrl;
    }

    /// @return the shared fixture, starting it if needed
    public static RangeFileServerFixture getServer() {
        initialize();
        return server;
    }

    private static void shutdown() {
        synchronized (lock) {
            if (server == null) {
                return;
            }
            logger.info("Stopping range test server (shutdown hook)");
            try {
                server.close();
            } catch (IllegalStateException e) {
                // the JVM is exiting, so a read-only violation can only be reported
                logger.error("Range test server found modified test data: {}", e.getMessage());
            } finally {
                server = null;
                baseUrl = null;
            }
        }
    }

    @Override
    public void beforeAll(ExtensionContext context) {
        initialize();
        logger.debug("RangeFileServerExtension beforeAll called for {}", context.getDisplayName());
    }

    @Override
    public void afterAll(ExtensionContext context) {
        // stopped by the shutdown hook once every test class is done
        logger.debug("RangeFileServerExtension afterAll called for {}", context.getDisplayName());
    }
}
