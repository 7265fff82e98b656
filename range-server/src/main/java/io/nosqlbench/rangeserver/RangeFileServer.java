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

import io.nosqlbench.rangeserver.http.RangeFileServlet;
import io.nosqlbench.rangeserver.http.ScopedFileReader;
import io.nosqlbench.rangeserver.http.ServingRoot;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.HttpConfiguration;
import org.eclipse.jetty.server.HttpConnectionFactory;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;
import org.eclipse.jetty.util.thread.QueuedThreadPool;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;

/// An embedded Jetty server that serves one directory with byte-range support.
///
/// Example usage:
/// ```java
/// RangeServerConfig config = RangeServerConfig.forRoot(Path.of("test/data")).withPort(0);
/// try (RangeFileServer server = new RangeFileServer(config)) {
///     server.start();
///     URL baseUrl = server.getBaseUrl();
///     // GET baseUrl + "sample.h5ad" with a Range header
/// }
/// ```
public class RangeFileServer implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(RangeFileServer.class);

    private final RangeServerConfig config;
    private final ServingRoot servingRoot;
    private Server server;
    private ServerConnector connector;

    /// @param config the server settings
    /// @throws IOException if the configured root is not a readable directory
    public RangeFileServer(RangeServerConfig config) throws IOException {
        this.config = config;
        this.servingRoot = ServingRoot.of(config.root());
    }

    /// Binds the listener and starts accepting connections.
    ///
    /// @throws IOException if the port cannot be bound or the server fails to start
    /// @throws IllegalStateException if the server was already started
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started on port " + getPort());
        }

        QueuedThreadPool threadPool = new QueuedThreadPool(config.maxThreads(), config.minThreads());
        threadPool.setName("rangeserver");
        Server jetty = new Server(threadPool);

        HttpConfiguration httpConfig = new HttpConfiguration();
        httpConfig.setSendServerVersion(false);
        ServerConnector httpConnector = new ServerConnector(jetty, new HttpConnectionFactory(httpConfig));
        httpConnector.setHost(config.host());
        httpConnector.setPort(config.port());
        httpConnector.setIdleTimeout(config.idleTimeout().toMillis());
        jetty.addConnector(httpConnector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        RangeFileServlet servlet = new RangeFileServlet(servingRoot, new ScopedFileReader());
        context.addServlet(new ServletHolder("files", servlet), "/*");
        jetty.setHandler(context);

        try {
            jetty.start();
        } catch (Exception e) {
            stopQuietly(jetty, e);
            if (e instanceof IOException ioe) {
                throw ioe;
            }
            throw new IOException("Failed to start range file server", e);
        }

        this.server = jetty;
        this.connector = httpConnector;
        logger.info("Range file server started on port {} serving files from {}", getPort(), servingRoot);
    }

    /// @return the bound port, which differs from the configured port when that was 0
    /// @throws IllegalStateException if the server is not running
    public synchronized int getPort() {
        if (connector == null) {
            throw new IllegalStateException("Server is not started");
        }
        return connector.getLocalPort();
    }

    /// @return the URL of the serving root, using `localhost` when bound to all interfaces
    public URL getBaseUrl() {
        String host = config.host() == null || config.host().isEmpty() || "0.0.0.0".equals(config.host())
            ? "localhost" : config.host();
        try {
            return new URL("http", host, getPort(), "/");
        } catch (MalformedURLException e) {
            throw new IllegalStateException("Failed to create server URL for host " + host, e);
        }
    }

    /// @return the directory being served
    public ServingRoot getServingRoot() {
        return servingRoot;
    }

    /// @return true while the server is accepting requests
    public synchronized boolean isRunning() {
        return server != null && server.isRunning();
    }

    /// Blocks until the server stops.
    ///
    /// @throws InterruptedException if the waiting thread is interrupted
    public void join() throws InterruptedException {
        Server running;
        synchronized (this) {
            running = server;
        }
        if (running != null) {
            running.join();
        }
    }

    /// Stops the server. Calling this more than once has no further effect.
    @Override
    public synchronized void close() {
        if (server == null) {
            return;
        }
        try {
            server.stop();
            logger.info("Range file server stopped");
        } catch (Exception e) {
            logger.error("Error stopping range file server", e);
        } finally {
            server = null;
            connector = null;
        }
    }

    private static void stopQuietly(Server jetty, Exception cause) {
        try {
            jetty.stop();
        } catch (Exception stopFailure) {
            cause.addSuppressed(stopFailure);
        }
    }
}
