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
import io.nosqlbench.rangeserver.range.RangeParseResult;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/// Chooses the response for a file request from the method, the `Range`
/// outcome and the file's attributes.
///
/// | Method | Range outcome | Status | Body          |
/// |--------|---------------|--------|---------------|
/// | any    | none          | 200    | whole file    |
/// | any    | satisfiable   | 206    | `start..end`  |
/// | GET    | invalid       | 416    | none          |
/// | HEAD   | invalid       | 200    | none          |
///
/// HEAD never gets a body but always gets the headers the equivalent GET
/// would get, except on an invalid range where it falls back to describing
/// the whole file instead of failing.
public final class ResponseComposer {

    /// Value of `Accept-Ranges` on every successful response.
    public static final String ACCEPT_RANGES_BYTES = "bytes";

    private ResponseComposer() {
    }

    /// @param method the request method
    /// @param range  the parsed `Range` header
    /// @param file   the target file, already stat'ed for this request
    /// @return the response plan
    public static ResponsePlan compose(RequestMethod method, RangeParseResult range, FileResource file) {
        switch (range.outcome()) {
            case SATISFIABLE:
                return partial(method, range.range(), file);
            case INVALID:
                switch (method) {
                    case GET:
                        return rangeError();
                    case HEAD:
                        return full(method, file);
                    default:
                        throw new IllegalStateException("Unhandled method " + method);
                }
            case NO_RANGE:
                return full(method, file);
            default:
                throw new IllegalStateException("Unhandled range outcome " + range.outcome());
        }
    }

    private static ResponsePlan full(RequestMethod method, FileResource file) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeader.ACCEPT_RANGES.asString(), ACCEPT_RANGES_BYTES);
        headers.put(HttpHeader.CONTENT_TYPE.asString(), file.contentType());
        ByteRange body = method.sendsBody() && file.size() > 0 ? ByteRange.wholeFile(file.size()) : null;
        return new ResponsePlan(ResponsePlan.Kind.FULL, HttpStatus.OK_200, file.size(), headers, body);
    }

    private static ResponsePlan partial(RequestMethod method, ByteRange range, FileResource file) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeader.CONTENT_RANGE.asString(), range.toContentRange(file.size()));
        headers.put(HttpHeader.ACCEPT_RANGES.asString(), ACCEPT_RANGES_BYTES);
        headers.put(HttpHeader.CONTENT_TYPE.asString(), file.contentType());
        ByteRange body = method.sendsBody() ? range : null;
        return new ResponsePlan(ResponsePlan.Kind.PARTIAL, HttpStatus.PARTIAL_CONTENT_206, range.length(), headers, body);
    }

    private static ResponsePlan rangeError() {
        return new ResponsePlan(ResponsePlan.Kind.RANGE_ERROR, HttpStatus.RANGE_NOT_SATISFIABLE_416, -1, Map.of(), null);
    }
}
