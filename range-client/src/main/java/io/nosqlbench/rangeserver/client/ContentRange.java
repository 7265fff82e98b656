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

/// A parsed `Content-Range` response header of the form `bytes start-end/total`.
///
/// @param start first byte offset, inclusive
/// @param end   last byte offset, inclusive
/// @param total the complete length of the resource, or [#UNKNOWN_TOTAL] for `*`
public record ContentRange(long start, long end, long total) {

    /// Marks a `*` complete length.
    public static final long UNKNOWN_TOTAL = -1L;

    private static final String UNIT_PREFIX = "bytes ";

    public ContentRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range: " + start + "-" + end);
        }
        if (total != UNKNOWN_TOTAL && total <= end) {
            throw new IllegalArgumentException("Range " + start + "-" + end + " does not fit in length " + total);
        }
    }

    /// Parses a header value.
    ///
    /// @param header the `Content-Range` value
    /// @return the parsed range
    /// @throws IllegalArgumentException if the value is null or not a satisfied byte range
    public static ContentRange parse(String header) {
        if (header == null) {
            throw new IllegalArgumentException("Missing Content-Range header");
        }
        String value = header.trim();
        if (!value.regionMatches(true, 0, UNIT_PREFIX, 0, UNIT_PREFIX.length())) {
            throw new IllegalArgumentException("Invalid Content-Range header format: " + header);
        }
        String rangeInfo = value.substring(UNIT_PREFIX.length()).trim();

        int slash = rangeInfo.indexOf('/');
        int dash = rangeInfo.indexOf('-');
        if (slash < 0 || dash < 0 || dash > slash) {
            throw new IllegalArgumentException("Invalid Content-Range header format: " + header);
        }
        String totalText = rangeInfo.substring(slash + 1);
        try {
            long start = Long.parseLong(rangeInfo.substring(0, dash));
            long end = Long.parseLong(rangeInfo.substring(dash + 1, slash));
            long total = "*".equals(totalText) ? UNKNOWN_TOTAL : Long.parseLong(totalText);
            return new ContentRange(start, end, total);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid Content-Range header format: " + header, e);
        }
    }

    /// @return the number of bytes in the range
    public long length() {
        return end - start + 1;
    }

    /// @param offset the requested first byte
    /// @param length the requested byte count
    /// @return true if this range covers exactly the requested bytes
    public boolean matches(long offset, long length) {
        return start == offset && end == offset + length - 1;
    }

    @Override
    public String toString() {
        return UNIT_PREFIX + start + "-" + end + "/" + (total == UNKNOWN_TOTAL ? "*" : String.valueOf(total));
    }
}
