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

import io.nosqlbench.rangeserver.range.ByteRange;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/// Streams a byte range of a file to an output stream.
///
/// The file is opened for the duration of a single [#transfer] call and is
/// closed on every exit path: normal completion, a write failure when the
/// client has gone away, or a read failure. Exactly `range.length()` bytes are
/// written, or an exception is thrown. A file that has shrunk below the end of
/// the range raises an [EOFException].
///
/// The output stream is never closed here; it belongs to the caller.
public final class ScopedFileReader {
    private static final Logger logger = LogManager.getLogger(ScopedFileReader.class);

    /// Default transfer buffer size in bytes.
    public static final int DEFAULT_BUFFER_SIZE = 64 * 1024;

    private final int bufferSize;

    public ScopedFileReader() {
        this(DEFAULT_BUFFER_SIZE);
    }

    /// @param bufferSize the size of the transfer buffer, must be positive
    public ScopedFileReader(int bufferSize) {
        if (bufferSize <= 0) {
            throw new IllegalArgumentException("Buffer size must be positive: " + bufferSize);
        }
        this.bufferSize = bufferSize;
    }

    /// Copies the bytes of a range from a file to an output stream.
    ///
    /// @param file  the file to read
    /// @param range the inclusive byte range to copy
    /// @param out   the destination
    /// @return the number of bytes written, always `range.length()`
    /// @throws java.nio.file.NoSuchFileException if the file disappeared before it could be opened
    /// @throws EOFException if the file ends before the range does
    /// @throws IOException on any other read or write failure
    public long transfer(Path file, ByteRange range, OutputStream out) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            channel.position(range.start());
            BoundedReadableByteChannel source = new BoundedReadableByteChannel(channel, range.length());
            WritableByteChannel sink = Channels.newChannel(out);
            ByteBuffer buffer = ByteBuffer.allocate((int) Math.min(bufferSize, range.length()));

            while (source.getBytesRemaining() > 0) {
                buffer.clear();
                int n = source.read(buffer);
                if (n < 0) {
                    throw new EOFException("File " + file + " ended at offset "
                        + (range.start() + source.getBytesRead()) + " before the end of range " + range);
                }
                buffer.flip();
                while (buffer.hasRemaining()) {
                    sink.write(buffer);
                }
            }
            logger.trace("Transferred {} bytes of {} from {}", source.getBytesRead(), range, file);
            return source.getBytesRead();
        }
    }
}
