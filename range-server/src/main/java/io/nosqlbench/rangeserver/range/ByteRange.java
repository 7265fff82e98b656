package io.nosqlbench.rangeserver.range;

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

/// An inclusive, zero-indexed byte interval `[start, end]` within a file.
///
/// Unlike a half-open element range, both ends are part of the interval, which
/// is how HTTP `Range` and `Content-Range` headers express offsets.
///
/// @param start the first byte offset (non-negative)
/// @param end   the last byte offset, inclusive (not less than start)
public record ByteRange(long start, long end) {

    /// Compact constructor with validation.
    public ByteRange {
        if (start < 0) {
            throw new IllegalArgumentException("Byte range start must be non-negative: " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException(
                "Byte range end must not be less than start: [" + start + ", " + end + "]"
            );
        }
    }

    /// The range covering every byte of a file of the given size.
    ///
    /// @param fileSize the total file size, which must be positive
    /// @return the range `[0, fileSize - 1]`
    public static ByteRange wholeFile(long fileSize) {
        if (fileSize <= 0) {
            throw new IllegalArgumentException("An empty file has no byte range, size=" + fileSize);
        }
        return new ByteRange(0, fileSize - 1);
    }

    /// @return the number of bytes in this range
    public long length() {
        return end - start + 1;
    }

    /// Formats this range as the value of a `Content-Range` header.
    ///
    /// @param fileSize the total size of the resource the range was taken from
    /// @return a value like `bytes 500-999/1000`
    public String toContentRange(long fileSize) {
        return "bytes " + start + "-" + end + "/" + fileSize;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
