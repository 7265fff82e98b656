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

/// Interprets a single-range `Range` request header against a file size.
///
/// Supported forms, with or without the `bytes=` unit prefix:
///
/// - `start-end` : both offsets given, `end` is clamped to the last byte of the file
/// - `start-`    : from `start` to the end of the file
/// - `-n`        : an empty start is read as `0`, so this means `0-n` rather than
///                 "the last n bytes"
///
/// Anything else, including multi-range lists, resolves to
/// [RangeParseResult.Outcome#INVALID]. Parsing never throws for malformed header
/// text.
public final class RangeParser {

    /// The only range unit this server understands.
    public static final String BYTES_PREFIX = "bytes=";

    private RangeParser() {
    }

    /// Parses a `Range` header value.
    ///
    /// An empty header value is treated like an absent one. A value of only
    /// whitespace is [RangeParseResult.Outcome#INVALID].
    ///
    /// @param header   the raw header value, or null when the request carried none
    /// @param fileSize the total size of the target file in bytes
    /// @return the parse outcome; never null
    /// @throws IllegalArgumentException if fileSize is negative
    public static RangeParseResult parse(String header, long fileSize) {
        if (fileSize < 0) {
            throw new IllegalArgumentException("File size must be non-negative: " + fileSize);
        }
        if (header == null || header.isEmpty()) {
            return RangeParseResult.noRange();
        }

        String spec = header.trim();
        if (spec.regionMatches(true, 0, BYTES_PREFIX, 0, BYTES_PREFIX.length())) {
            spec = spec.substring(BYTES_PREFIX.length());
        }

        int dash = spec.indexOf('-');
        if (dash < 0) {
            return RangeParseResult.invalid("no '-' separator in '" + header + "'");
        }

        String startText = spec.substring(0, dash).trim();
        String endText = spec.substring(dash + 1).trim();

        long start = startText.isEmpty() ? 0 : parseOffset(startText);
        if (start < 0) {
            return RangeParseResult.invalid("start is not a non-negative integer: '" + startText + "'");
        }

        long end = endText.isEmpty() ? fileSize - 1 : parseOffset(endText);
        if (end < 0 && !endText.isEmpty()) {
            return RangeParseResult.invalid("end is not a non-negative integer: '" + endText + "'");
        }

        end = Math.min(end, fileSize - 1);
        if (start >= fileSize) {
            return RangeParseResult.invalid("start " + start + " is beyond the last byte of a " + fileSize + " byte file");
        }
        if (start > end) {
            return RangeParseResult.invalid("start " + start + " is after end " + end);
        }
        return RangeParseResult.satisfiable(new ByteRange(start, end));
    }

    /// Parses a non-negative decimal offset.
    ///
    /// @return the offset, or -1 if the text is not all digits or overflows a long
    private static long parseOffset(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return -1;
            }
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            // all digits, so only overflow lands here
            return -1;
        }
    }
}
