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

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/// End-to-end tests of the range file server over real HTTP connections.
public class RangeFileServerTest {

    @TempDir
    static Path servedDir;

    private static RangeFileServer server;
    private static OkHttpClient client;
    private static String baseUrl;
    private static byte[] thousandBytes;

    @BeforeAll
    static void startServer() throws IOException {
        thousandBytes = new byte[1000];
        for (int i = 0; i < thousandBytes.length; i++) {
            thousandBytes[i] = (byte) (i * 31 + 7);
        }
        Files.write(servedDir.resolve("thousand.bin"), thousandBytes);
        Files.write(servedDir.resolve("sample.h5ad"), Arrays.copyOf(thousandBytes, 64));
        Files.writeString(servedDir.resolve("basic.txt"), "This is a basic test file\n");
        Files.write(servedDir.resolve("empty.bin"), new byte[0]);
        Files.createDirectories(servedDir.resolve("subdir"));

        server = new RangeFileServer(RangeServerConfig.forRoot(servedDir).withHost("127.0.0.1").withPort(0));
        server.start();
        baseUrl = server.getBaseUrl().toString();
        client = new OkHttpClient();
    }

    @AfterAll
    static void stopServer() {
        if (client != null) {
            client.dispatcher().executorService().shutdown();
            client.connectionPool().evictAll();
        }
        if (server != null) {
            server.close();
        }
    }

    @Test
    void testFullGet() throws IOException {
        try (Response response = get("thousand.bin", null)) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Length")).isEqualTo("1000");
            assertThat(response.header("Accept-Ranges")).isEqualTo("bytes");
            assertThat(response.header("Content-Range")).isNull();
            assertThat(response.body().bytes()).isEqualTo(thousandBytes);
        }
    }

    @ParameterizedTest(name = "bytes={0}-{1}")
    @CsvSource({"0, 0", "0, 99", "1, 1", "123, 456", "999, 999", "0, 999"})
    void testSatisfiableRanges(int start, int end) throws IOException {
        try (Response response = get("thousand.bin", "bytes=" + start + "-" + end)) {
            assertThat(response.code()).isEqualTo(206);
            assertThat(response.header("Content-Range")).isEqualTo("bytes " + start + "-" + end + "/1000");
            assertThat(response.header("Content-Length")).isEqualTo(String.valueOf(end - start + 1));
            assertThat(response.body().bytes()).isEqualTo(Arrays.copyOfRange(thousandBytes, start, end + 1));
        }
    }

    @Test
    void testEndIsClampedToFileSize() throws IOException {
        try (Response response = get("thousand.bin", "bytes=500-1499")) {
            assertThat(response.code()).isEqualTo(206);
            assertThat(response.header("Content-Range")).isEqualTo("bytes 500-999/1000");
            assertThat(response.header("Content-Length")).isEqualTo("500");
            assertThat(response.body().bytes()).isEqualTo(Arrays.copyOfRange(thousandBytes, 500, 1000));
        }
    }

    @Test
    void testOpenEndedRange() throws IOException {
        try (Response response = get("thousand.bin", "bytes=990-")) {
            assertThat(response.code()).isEqualTo(206);
            assertThat(response.header("Content-Range")).isEqualTo("bytes 990-999/1000");
            assertThat(response.body().bytes()).hasSize(10);
        }
    }

    @Test
    void testStartBeyondEndOfFile() throws IOException {
        try (Response response = get("thousand.bin", "bytes=2000-3000")) {
            assertThat(response.code()).isEqualTo(416);
            assertThat(response.header("Content-Range")).isNull();
            assertThat(response.header("Accept-Ranges")).isNull();
            assertThat(response.body().bytes()).isEmpty();
        }
        try (Response response = head("thousand.bin", "bytes=2000-3000")) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Length")).isEqualTo("1000");
            assertThat(response.header("Accept-Ranges")).isEqualTo("bytes");
            assertThat(response.header("Content-Range")).isNull();
            assertThat(response.body().bytes()).isEmpty();
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"bytes=", "bytes=abc-def", "bytes=10-xyz", "bytes=500"})
    void testMalformedRangeIsRefusedForGetButDescribedForHead(String range) throws IOException {
        try (Response response = get("thousand.bin", range)) {
            assertThat(response.code()).isEqualTo(416);
            assertThat(response.body().bytes()).isEmpty();
        }
        try (Response response = head("thousand.bin", range)) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Length")).isEqualTo("1000");
            assertThat(response.body().bytes()).isEmpty();
        }
    }

    @Test
    void testEmptyRangeHeaderServesTheWholeFile() throws IOException {
        String raw = rawExchange("GET /thousand.bin HTTP/1.1\r\nHost: localhost\r\nRange: \r\nConnection: close\r\n\r\n");

        int headerEnd = raw.indexOf("\r\n\r\n");
        assertThat(raw).startsWith("HTTP/1.1 200");
        assertThat(raw.substring(0, headerEnd)).containsIgnoringCase("Content-Length: 1000")
            .doesNotContainIgnoringCase("Content-Range");
        assertThat(raw.substring(headerEnd + 4).getBytes(StandardCharsets.ISO_8859_1)).isEqualTo(thousandBytes);
    }

    @Test
    void testHeadWithRangeDescribesThePartialResponse() throws IOException {
        try (Response response = head("thousand.bin", "bytes=100-199")) {
            assertThat(response.code()).isEqualTo(206);
            assertThat(response.header("Content-Range")).isEqualTo("bytes 100-199/1000");
            assertThat(response.header("Content-Length")).isEqualTo("100");
            assertThat(response.header("Accept-Ranges")).isEqualTo("bytes");
            assertThat(response.body().bytes()).isEmpty();
        }
    }

    @Test
    void testHeadSendsNoBodyOnTheWire() throws IOException {
        String raw = rawExchange("HEAD /thousand.bin HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n");

        int headerEnd = raw.indexOf("\r\n\r\n");
        assertThat(headerEnd).isPositive();
        assertThat(raw).startsWith("HTTP/1.1 200");
        assertThat(raw.substring(0, headerEnd)).containsIgnoringCase("Content-Length: 1000");
        assertThat(raw.substring(headerEnd + 4)).isEmpty();
    }

    @Test
    void testRangeErrorSendsNothingBeyondTheStatus() throws IOException {
        String raw = rawExchange(
            "GET /thousand.bin HTTP/1.1\r\nHost: localhost\r\nRange: bytes=5000-\r\nConnection: close\r\n\r\n");

        int headerEnd = raw.indexOf("\r\n\r\n");
        assertThat(raw).startsWith("HTTP/1.1 416");
        assertThat(raw.substring(0, headerEnd)).doesNotContainIgnoringCase("Content-Range")
            .doesNotContainIgnoringCase("Accept-Ranges");
        assertThat(raw.substring(headerEnd + 4)).isEmpty();
    }

    @Test
    void testContentTypes() throws IOException {
        try (Response response = head("sample.h5ad", null)) {
            assertThat(response.header("Content-Type")).isEqualTo("application/x-hdf5");
        }
        try (Response response = get("basic.txt", null)) {
            assertThat(response.header("Content-Type")).startsWith("text/plain");
            assertThat(response.body().string()).isEqualTo("This is a basic test file\n");
        }
    }

    @Test
    void testEmptyFile() throws IOException {
        try (Response response = get("empty.bin", null)) {
            assertThat(response.code()).isEqualTo(200);
            assertThat(response.header("Content-Length")).isEqualTo("0");
            assertThat(response.body().bytes()).isEmpty();
        }
        try (Response response = get("empty.bin", "bytes=0-")) {
            assertThat(response.code()).isEqualTo(416);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"missing.bin", "subdir", "subdir/", "", "subdir/missing.h5"})
    void testNotFound(String path) throws IOException {
        try (Response response = get(path, null)) {
            assertThat(response.code()).isEqualTo(404);
        }
        try (Response response = head(path, "bytes=0-10")) {
            assertThat(response.code()).isEqualTo(404);
        }
    }

    @Test
    void testTraversalOutsideRootIsRefused() throws IOException {
        Path outside = servedDir.getParent().resolve("outside-" + System.nanoTime() + ".txt");
        Files.writeString(outside, "not for you");
        try {
            String raw = rawExchange("GET /../" + outside.getFileName()
                + " HTTP/1.1\r\nHost: localhost\r\nConnection: close\r\n\r\n");
            assertThat(raw).matches("(?s)HTTP/1\\.1 (400|404).*");
            assertThat(raw).doesNotContain("not for you");
        } finally {
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void testOtherMethodsAreNotAllowed() throws IOException {
        Request request = new Request.Builder()
            .url(baseUrl + "thousand.bin")
            .post(RequestBody.create(new byte[0], MediaType.get("application/octet-stream")))
            .build();
        try (Response response = client.newCall(request).execute()) {
            assertThat(response.code()).isEqualTo(405);
            assertThat(response.header("Allow")).isEqualTo("GET, HEAD");
        }
    }

    @Test
    void testChangesOnDiskAreSeenByTheNextRequest() throws IOException {
        Path mutable = servedDir.resolve("mutable.bin");
        Files.write(mutable, new byte[10]);
        try {
            try (Response response = head("mutable.bin", null)) {
                assertThat(response.header("Content-Length")).isEqualTo("10");
            }
            Files.write(mutable, new byte[20]);
            try (Response response = head("mutable.bin", null)) {
                assertThat(response.header("Content-Length")).isEqualTo("20");
            }
        } finally {
            Files.deleteIfExists(mutable);
        }
    }

    @Test
    void testConcurrentRangeRequests() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                int start = (i * 37) % 900;
                int end = start + 99;
                Callable<Boolean> task = () -> {
                    try (Response response = get("thousand.bin", "bytes=" + start + "-" + end)) {
                        return response.code() == 206
                            && Arrays.equals(response.body().bytes(), Arrays.copyOfRange(thousandBytes, start, end + 1));
                    }
                };
                results.add(executor.submit(task));
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get(30, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            executor.shutdownNow();
        }
    }

    /// Sparse file larger than 2GB, so lengths and offsets exceed the int range
    @Test
    void testLargeFileOffsets() throws IOException {
        Path largeFile = servedDir.resolve("large_" + System.nanoTime() + ".bin");
        long fileSize = 2L * 1024 * 1024 * 1024 + 100 * 1024 * 1024;
        try {
            try (RandomAccessFile raf = new RandomAccessFile(largeFile.toFile(), "rw")) {
                raf.setLength(fileSize);
                raf.seek(0);
                raf.write("START_OF_LARGE_FILE".getBytes(StandardCharsets.US_ASCII));
                raf.seek(fileSize - 17);
                raf.write("END_OF_LARGE_FILE".getBytes(StandardCharsets.US_ASCII));
            }
            String name = largeFile.getFileName().toString();

            try (Response response = head(name, null)) {
                assertThat(response.code()).isEqualTo(200);
                assertThat(Long.parseLong(response.header("Content-Length"))).isEqualTo(fileSize);
            }
            try (Response response = get(name, "bytes=" + (fileSize - 17) + "-")) {
                assertThat(response.code()).isEqualTo(206);
                assertThat(response.header("Content-Range"))
                    .isEqualTo("bytes " + (fileSize - 17) + "-" + (fileSize - 1) + "/" + fileSize);
                assertThat(response.body().string()).isEqualTo("END_OF_LARGE_FILE");
            }
            try (Response response = head(name, "bytes=0-")) {
                assertThat(Long.parseLong(response.header("Content-Length"))).isEqualTo(fileSize);
            }
        } finally {
            Files.deleteIfExists(largeFile);
        }
    }

    @Test
    void testLifecycle() throws IOException {
        RangeServerConfig config = RangeServerConfig.forRoot(servedDir)
            .withHost("127.0.0.1")
            .withPort(0)
            .withThreads(2, 8)
            .withIdleTimeout(Duration.ofSeconds(5));
        assertThat(config.idleTimeout()).isEqualTo(Duration.ofSeconds(5));

        RangeFileServer second = new RangeFileServer(config);
        assertThat(second.isRunning()).isFalse();
        second.start();
        try {
            assertThat(second.isRunning()).isTrue();
            assertThat(second.getPort()).isNotEqualTo(server.getPort());
            try (Response response = client.newCall(
                new Request.Builder().url(second.getBaseUrl() + "basic.txt").build()).execute()) {
                assertThat(response.code()).isEqualTo(200);
            }
        } finally {
            second.close();
        }
        assertThat(second.isRunning()).isFalse();
        second.close();
        assertThatThrownBy(second::getPort).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testConfigRejectsNonPositiveIdleTimeout() {
        RangeServerConfig config = RangeServerConfig.forRoot(servedDir);
        assertThatThrownBy(() -> config.withIdleTimeout(Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> config.withIdleTimeout(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testStartTwiceIsRejected() {
        assertThatThrownBy(() -> server.start())
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
    }

    private static Response get(String path, String range) throws IOException {
        Request.Builder builder = new Request.Builder().url(baseUrl + path);
        if (range != null) {
            builder.header("Range", range);
        }
        return client.newCall(builder.build()).execute();
    }

    private static Response head(String path, String range) throws IOException {
        Request.Builder builder = new Request.Builder().url(baseUrl + path).head();
        if (range != null) {
            builder.header("Range", range);
        }
        return client.newCall(builder.build()).execute();
    }

    /// Sends a raw request and reads until the server closes the connection.
    private static String rawExchange(String request) throws IOException {
        try (Socket socket = new Socket("127.0.0.1", server.getPort())) {
            socket.setSoTimeout(10_000);
            OutputStream out = socket.getOutputStream();
            out.write(request.getBytes(StandardCharsets.US_ASCII));
            out.flush();
            InputStream in = socket.getInputStream();
            ByteArrayOutputStream received = new ByteArrayOutputStream();
            in.transferTo(received);
            return received.toString(StandardCharsets.ISO_8859_1);
        }
    }
}
