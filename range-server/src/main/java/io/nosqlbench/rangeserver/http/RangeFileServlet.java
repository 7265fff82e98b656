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
import io.nosqlbench.rangeserver.range.RangeParser;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/// Serves regular files under a [ServingRoot], honouring single byte-range requests.
///
/// All requests enter through [#service], which dispatches over the closed set
/// of [RequestMethod]s; any other method gets 405. The servlet holds no
/// mutable state, so one instance serves every connection concurrently.
public class RangeFileServlet extends HttpServlet {
    private static final Logger logger = LogManager.getLogger(RangeFileServlet.class);
    private static final long serialVersionUID = 1L;

    private final transient ServingRoot servingRoot;
    private final transient ScopedFileReader fileReader;

    /// @param servingRoot the directory to serve
    /// @param fileReader  the reader used to stream file bodies
    public RangeFileServlet(ServingRoot servingRoot, ScopedFileReader fileReader) {
        this.servingRoot = servingRoot;
        this.fileReader = fileReader;
    }

    @Override
    protected void service(HttpServletRequest request, HttpServletResponse response) throws IOException {
        Optional<RequestMethod> method = RequestMethod.fromToken(request.getMethod());
        if (method.isEmpty()) {
            logger.debug("Refusing method {} for {}", request.getMethod(), request.getRequestURI());
            response.setHeader(HttpHeader.ALLOW.asString(), RequestMethod.ALLOW_HEADER_VALUE);
            response.sendError(HttpStatus.METHOD_NOT_ALLOWED_405);
            return;
        }
        handle(method.get(), request, response);
    }

    private void handle(RequestMethod method, HttpServletRequest request, HttpServletResponse response)
        throws IOException {
        String requestPath = request.getPathInfo();

        Optional<Path> resolved = servingRoot.resolve(requestPath);
        Optional<FileResource> found = resolved.isPresent() ? FileResource.stat(resolved.get()) : Optional.empty();
        if (found.isEmpty()) {
            logger.debug("{} {} -> 404", method, requestPath);
            response.sendError(HttpStatus.NOT_FOUND_404, "File not found");
            return;
        }
        FileResource file = found.get();

        RangeParseResult range = RangeParser.parse(request.getHeader(HttpHeader.RANGE.asString()), file.size());
        ResponsePlan plan = ResponseComposer.compose(method, range, file);
        logger.debug("{} {} range={} size={} -> {}", method, requestPath, range, file.size(), plan.status());

        response.setStatus(plan.status());
        plan.headers().forEach(response::setHeader);
        if (plan.contentLength() >= 0) {
            response.setContentLengthLong(plan.contentLength());
        }

        Optional<ByteRange> body = plan.body();
        if (body.isEmpty()) {
            return;
        }

        try {
            fileReader.transfer(file.path(), body.get(), response.getOutputStream());
        } catch (IOException e) {
            if (response.isCommitted()) {
                // status and some bytes are already on the wire; only aborting the exchange is left
                logger.debug("{} {} aborted after the response was committed: {}", method, requestPath, e.toString());
                throw e;
            }
            response.reset();
            if (e instanceof NoSuchFileException) {
                logger.debug("{} {} vanished before it could be opened", method, requestPath);
                response.sendError(HttpStatus.NOT_FOUND_404, "File not found");
            } else {
                logger.warn("{} {} failed while reading {}", method, requestPath, file.path(), e);
                response.sendError(HttpStatus.INTERNAL_SERVER_ERROR_500);
            }
        }
    }
}
