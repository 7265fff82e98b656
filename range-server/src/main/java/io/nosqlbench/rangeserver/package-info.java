/// Embedded HTTP file server with byte-range support.
///
/// [io.nosqlbench.rangeserver.RangeFileServer] serves a single directory over
/// plain HTTP/1.1 and answers `Range: bytes=start-end` requests with
/// `206 Partial Content`, so remote readers of large HDF5 files can be tested
/// without an object store.
package io.nosqlbench.rangeserver;

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
