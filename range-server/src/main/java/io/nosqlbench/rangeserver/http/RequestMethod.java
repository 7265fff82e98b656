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

import java.util.Optional;

/// The request methods the file server answers. Everything else is refused with 405.
public enum RequestMethod {
    GET,
    HEAD;

    /// Value of the `Allow` header sent with a 405 response.
    public static final String ALLOW_HEADER_VALUE = "GET, HEAD";

    /// Looks up a method by its exact (case-sensitive) HTTP token.
    ///
    /// @param token the request method token, such as `GET`
    /// @return the matching method, or empty for any unsupported method
    public static Optional<RequestMethod> fromToken(String token) {
        if ("GET".equals(token)) {
            return Optional.of(GET);
        }
        if ("HEAD".equals(token)) {
            return Optional.of(HEAD);
        }
        return Optional.empty();
    }

    /// @return true if responses to this method carry a body
    public boolean sendsBody() {
        return this == GET;
    }
}
