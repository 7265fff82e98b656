package io.nosqlbench.rangeserver.client;

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

import okhttp3.ConnectionPool;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/// Random access to a remote file over HTTP byte ranges.
///
/// Opening a reader issues one HEAD request to learn the file size and whether
/// the server advertises `Accept-Ranges: bytes`. Reads are then answered from a
/// single read-ahead chunk: a miss fetches at least [#DEFAULT_CHUNK_SIZE] bytes
/// (or the configured chunk size) starting at the requested offset, and that
/// chunk replaces whatever was cached before. This suits the access pattern of
/// HDF5-style readers, which issue many small reads that cluster together.
///
/// A server that ignores the `Range` header and answers 200 is tolerated: the
/// reader skips to the requested offset in the full body.
///
/// Instances are thread-safe. Reads are serialised on the cache.
///
/// Example usage:
/// ```java
/// try (HttpRangeReader reader = HttpRangeReader.open("http://localhost:8080/pbmc3k.h5ad")) {
///     byte[] superblock = reader.read(0, 512);
/// }
/// ```
public class HttpRangeReader implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(HttpRangeReader.class);

    /// Minimum number of bytes fetched on a cache miss: 1 MiB.
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    private final OkHttpClient httpClient;
    private final HttpUrl url;
    private final long size;
    private final boolean supportsRanges;
    private final int chunkSize;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong fetchCount = new AtomicLong();

    /// Cached bytes, starting at [#cacheOffset]; guarded by this
    private byte[] cache = new byte[0];
    private long cacheOffset = 0;

    private HttpRangeReader(OkHttpClient httpClient, HttpUrl url, long size, boolean supportsRanges, int chunkSize) {
        this.httpClient = httpClient;
        this.url = url;
        this.size = size;
        this.supportsRanges = supportsRanges;
        this.chunkSize = chunkSize;
    }

    /// Opens a reader with the default chunk size.
    ///
    /// @param url an HTTP or HTTPS URL
    /// @return the opened reader
    /// @throws IOException if the HEAD request fails or returns an error status
    public static HttpRangeReader open(String url) throws IOException {
        return open(url, DEFAULT_CHUNK_SIZE);
    }

    /// Opens a reader.
    ///
    /// @param url       an HTTP or HTTPS URL
    /// @param chunkSize minimum bytes fetched on a cache miss
    /// @return the opened reader
    /// @throws IllegalArgumentException if the URL is not HTTP or HTTPS, or chunkSize is not positive
    /// @throws IOException if the HEAD request fails, returns an error status, or has no Content-Length
    public static HttpRangeReader open(String url, int chunkSize) throws IOException {
        HttpUrl parsed = url == null ? null : HttpUrl.parse(url.trim());
        if (parsed == null) {
            throw new IllegalArgumentException("URL must be HTTP or HTTPS: " + url);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }

        OkHttpClient client = createHttpClient();
        Request headRequest = new Request.Builder().url(parsed).head().build();
        try (Response response = client.newCall(headRequest).execute()) {
            if (response.code() >= 400) {
                throw new IOException("HEAD " + parsed + " failed with status: " + response.code());
            }
            String contentLength = response.header("Content-Length");
            if (contentLength == null) {
                throw new IOException("Server did not provide Content-Length header for " + parsed);
            }
            long size;
            try {
                size = Long.parseLong(contentLength.trim());
            } catch (NumberFormatException e) {
                throw new IOException("Invalid Content-Length header: " + contentLength, e);
            }
            boolean ranges = "bytes".equalsIgnoreCase(response.header("Accept-Ranges"));
            logger.debug("Opened {} size={} acceptRanges={}", parsed, size, ranges);
            return new HttpRangeReader(client, parsed, size, ranges, chunkSize);
        } catch (IOException | RuntimeException e) {
            shutdown(client);
            throw e;
        }
    }

    private static OkHttpClient createHttpClient() {
        return new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(8, 5, TimeUnit.MINUTES))
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(30, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();
    }

    /// @return the remote file size in bytes, as reported by HEAD
    public long size() {
        return size;
    }

    /// @return true if the server advertised `Accept-Ranges: bytes`
    public boolean supportsRangeRequests() {
        return supportsRanges;
    }

    /// @return the remote file URL
    public String url() {
        return url.toString();
    }

    /// Reads bytes from the remote file.
    ///
    /// @param offset the first byte to read
    /// @param length the number of bytes to read
    /// @return exactly `length` bytes starting at `offset`
    /// @throws IllegalArgumentException if the requested bytes are not within the file
    /// @throws IOException if the reader is closed, or the server response is missing or malformed
    public synchronized byte[] read(long offset, int length) throws IOException {
        validateNotClosed();
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Offset and length must be non-negative: " + offset + ", " + length);
        }
        if (length == 0) {
            return new byte[0];
        }
        if (offset > size - length) {
            throw new IllegalArgumentException(
                "Read of " + length + " bytes at " + offset + " extends past end of file (" + size + " bytes)");
        }

        if (!cacheCovers(offset, length)) {
            int fetchLength = (int) Math.min(Math.max(length, chunkSize), size - offset);
            cache = fetch(offset, fetchLength);
            cacheOffset = offset;
        }
        byte[] result = new byte[length];
        System.arraycopy(cache, (int) (offset - cacheOffset), result, 0, length);
        return result;
    }

    /// Loads the start of the file into the cache, replacing its contents.
    ///
    /// @param bytes how many bytes to load; clipped to the file size, and ignored when not positive
    /// @throws IOException if the reader is closed or the fetch fails
    public synchronized void prefetch(long bytes) throws IOException {
        validateNotClosed();
        long wanted = Math.min(bytes, size);
        if (wanted <= 0) {
            return;
        }
        if (wanted > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Prefetch of " + wanted + " bytes exceeds the maximum cache size");
        }
        if (cacheCovers(0, wanted)) {
            return;
        }
        cache = fetch(0, (int) wanted);
        cacheOffset = 0;
    }

    /// @return the number of ranged GET requests issued so far
    long fetchCount() {
        return fetchCount.get();
    }

    private boolean cacheCovers(long offset, long length) {
        // no offset + length sums, which overflow near Long.MAX_VALUE
        return offset >= cacheOffset && offset - cacheOffset <= cache.length - length;
    }

    private byte[] fetch(long offset, int length) throws IOException {
        long endOffset = offset + length - 1;
        Request request = new Request.Builder()
            .url(url)
            .header("Range", "bytes=" + offset + "-" + endOffset)
            .build();
        fetchCount.incrementAndGet();
        logger.debug("GET {} bytes={}-{}", url, offset, endOffset);

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("Response body is null");
            }
            switch (response.code()) {
                case 206:
                    return readPartial(response, body, offset, length);
                case 200:
                    logger.debug("Server ignored the range for {}, skipping to offset {}", url, offset);
                    return readFromFullBody(body, offset, length);
                case 416:
                    throw new IOException("Requested range not satisfiable: bytes=" + offset + "-" + endOffset);
                default:
                    throw new IOException("HTTP request failed with status: " + response.code() + " " + response.message());
            }
        }
    }

    private byte[] readPartial(Response response, ResponseBody body, long offset, int length) throws IOException {
        ContentRange contentRange;
        try {
            contentRange = ContentRange.parse(response.header("Content-Range"));
        } catch (IllegalArgumentException e) {
            throw new IOException("Server returned 206 with unusable Content-Range: " + e.getMessage(), e);
        }
        if (!contentRange.matches(offset, length)) {
            throw new IOException("Server returned " + contentRange + " for requested bytes "
                + offset + "-" + (offset + length - 1));
        }
        byte[] data = body.bytes();
        if (data.length != length) {
            throw new IOException("Expected " + length + " bytes but received " + data.length);
        }
        return data;
    }

    private byte[] readFromFullBody(ResponseBody body, long offset, int length) throws IOException {
        try (InputStream in = body.byteStream()) {
            in.skipNBytes(offset);
            byte[] data = in.readNBytes(length);
            if (data.length != length) {
                throw new EOFException("Expected " + length + " bytes at offset " + offset
                    + " but the body ended after " + data.length);
            }
            return data;
        }
    }

    private void validateNotClosed() throws IOException {
        if (closed.get()) {
            throw new IOException("HttpRangeReader for " + url + " has been closed");
        }
    }

    /// Releases the HTTP connection pool. Further reads fail.
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            synchronized (this) {
                cache = new byte[0];
            }
            shutdown(httpClient);
        }
    }

    private static void shutdown(OkHttpClient client) {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
