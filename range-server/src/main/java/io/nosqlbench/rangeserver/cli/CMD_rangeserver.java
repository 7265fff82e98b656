package io.nosqlbench.rangeserver.cli;

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
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Serve a directory over HTTP with byte-range support.
///
/// This is the stand-in for a remote object store when testing partial reads
/// of large HDF5 / AnnData files: clients can fetch any contiguous slice of a
/// file with a `Range: bytes=start-end` header.
///
/// ## Usage
///
/// ```bash
/// rangeserver
/// rangeserver --port 9000 --directory test/data
/// ```
///
/// The server runs until interrupted. On Ctrl+C it prints a shutdown message,
/// stops, and exits with status 0.
@CommandLine.Command(
    name = "rangeserver",
    mixinStandardHelpOptions = true,
    version = "rangeserver 0.1.0",
    header = "HTTP server with Range request support",
    description = "Serves files from a directory over HTTP, answering Range requests with 206 Partial Content.",
    exitCodeList = {
        "0: Stopped by interrupt",
        "1: Server could not start",
        "2: Directory to serve is missing or not a directory"
    }
)
public class CMD_rangeserver implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_rangeserver.class);

    /// Exit code when the listener cannot be started.
    public static final int EXIT_START_FAILED = 1;
    /// Exit code when the directory to serve is unusable.
    public static final int EXIT_BAD_DIRECTORY = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-p", "--port"},
        description = "Port to listen on (default: ${DEFAULT-VALUE})"
    )
    private int port = RangeServerConfig.DEFAULT_PORT;

    @CommandLine.Option(
        names = {"-d", "--directory"},
        description = "Directory to serve files from (default: ${DEFAULT-VALUE})"
    )
    private Path directory = Path.of(".");

    /// Run the range server
    ///
    /// @param args command line args
    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new CMD_rangeserver());
        int exitCode = commandLine.execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws InterruptedException {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isDirectory(directory)) {
            err.println("Error: Not a directory: " + directory);
            err.flush();
            return EXIT_BAD_DIRECTORY;
        }

        RangeFileServer server;
        try {
            server = new RangeFileServer(toConfig());
            server.start();
        } catch (IOException e) {
            logger.error("Failed to start range server on port {}", port, e);
            err.println("Error: Could not serve " + directory + " on port " + port + ": " + e.getMessage());
            err.flush();
            return EXIT_START_FAILED;
        }

        out.println("Serving at http://localhost:" + server.getPort());
        out.println("Directory: " + server.getServingRoot().directory());
        out.println("Press Ctrl+C to stop");
        out.flush();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(server, out), "rangeserver-shutdown"));
        server.join();
        return 0;
    }

    /// @return the server settings these options describe
    RangeServerConfig toConfig() {
        return RangeServerConfig.forRoot(directory).withPort(port);
    }

    /// Runs on interrupt. The JVM would otherwise report an interrupted exit
    /// status, so once the server and logging are down the process is halted
    /// with status 0; log4j2.xml disables Log4j's own shutdown hook for this.
    private static void shutdown(RangeFileServer server, PrintWriter out) {
        out.println();
        out.println("Shutting down...");
        out.flush();
        server.close();
        LogManager.shutdown();
        Runtime.getRuntime().halt(0);
    }
}
