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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Everything needed to answer one file request: status, headers and which
/// bytes (if any) to stream afterwards.
///
/// @param kind          whether this is a full, partial or range-error response
/// @param status        the HTTP status code
/// @param contentLength the declared `Content-Length`, or -1 when none is declared
/// @param headers       headers other than `Content-Length`, in emission order
/// @param bodyRange     the file bytes to send as the body, or null for no body
public record ResponsePlan(Kind kind, int status, long contentLength, Map<String, String> headers,
                           ByteRange bodyRange) {

    /// The shape of a response.
    public enum Kind {
        /// The whole resource is described, status 200.
        FULL,
        /// A sub-range of the resource is described, status 206.
        PARTIAL,
        /// The requested range cannot be honoured, status 416.
        RANGE_ERROR
    }

    public ResponsePlan {
        Objects.requireNonNull(kind, "kind");
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        if (bodyRange != null && bodyRange.length() != contentLength) {
            throw new IllegalArgumentException(
                "Body range " + bodyRange + " does not match Content-Length " + contentLength);
        }
    }

    /// @return the body range, empty when nothing follows the headers
    public Optional<ByteRange> body() {
        return Optional.ofNullable(bodyRange);
    }

    /// @param name a header name
    /// @return the header value, or null when the plan does not set it
    public String header(String name) {
        return headers.get(name);
    }
}
