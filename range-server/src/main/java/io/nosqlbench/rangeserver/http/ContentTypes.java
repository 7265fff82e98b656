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

import org.eclipse.jetty.http.MimeTypes;

import java.util.Locale;
import java.util.Map;

/// Guesses a `Content-Type` from a file name.
///
/// HDF5-family extensions are mapped first, since general MIME tables do not
/// know them; everything else falls back to Jetty's [MimeTypes] table.
public final class ContentTypes {

    /// Content type for HDF5 containers, including AnnData `.h5ad` files.
    public static final String HDF5 = "application/x-hdf5";

    /// Content type for anything no table recognizes.
    public static final String DEFAULT = "application/octet-stream";

    private static final Map<String, String> FIXED = Map.of(
        "h5ad", HDF5,
        "hdf5", HDF5,
        "h5", HDF5
    );

    private static final MimeTypes MIME_TYPES = new MimeTypes();

    private ContentTypes() {
    }

    /// @param fileName a file name or path string
    /// @return the guessed content type, never null
    public static String guess(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot >= 0 && dot < fileName.length() - 1) {
            String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
            String fixed = FIXED.get(extension);
            if (fixed != null) {
                return fixed;
            }
        }
        String guessed = MIME_TYPES.getMimeByExtension(fileName);
        return guessed != null ? guessed : DEFAULT;
    }
}
