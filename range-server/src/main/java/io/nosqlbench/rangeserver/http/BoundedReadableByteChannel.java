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
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ReadableByteChannel;

/// A view of another channel that ends after a fixed number of bytes.
///
/// Reads never return more than the remaining byte limit; once it is used up
/// the channel reports end-of-stream even if the delegate has more data. The
/// delegate is not owned: closing this view leaves the delegate open.
final class BoundedReadableByteChannel implements ReadableByteChannel {

    private final ReadableByteChannel delegate;
    private final long limit;
    private long bytesRead;
    private boolean open = true;

    /// @param delegate the channel to read from, already positioned at the first byte wanted
    /// @param limit    the maximum number of bytes to read through this view
    BoundedReadableByteChannel(ReadableByteChannel delegate, long limit) {
        if (delegate == null) {
            throw new IllegalArgumentException("Delegate channel cannot be null");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        this.delegate = delegate;
        this.limit = limit;
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (!open) {
            throw new ClosedChannelException();
        }
        long remaining = limit - bytesRead;
        if (remaining <= 0) {
            return -1;
        }

        int originalLimit = dst.limit();
        if (remaining < dst.remaining()) {
            // remaining < dst.remaining(), so the cast cannot overflow
            dst.limit(dst.position() + (int) remaining);
        }
        try {
            int n = delegate.read(dst);
            if (n > 0) {
                bytesRead += n;
            }
            return n;
        } finally {
            dst.limit(originalLimit);
        }
    }

    @Override
    public boolean isOpen() {
        return open && delegate.isOpen();
    }

    @Override
    public void close() {
        open = false;
    }

    long getBytesRead() {
        return bytesRead;
    }

    long getBytesRemaining() {
        return Math.max(0, limit - bytesRead);
    }
}
