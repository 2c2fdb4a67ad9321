package io.tripdata.api;

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

import java.util.Arrays;
import java.util.Locale;

/// The kind of remote store a [Fragment] lives in.
///
/// The short name is what users type on the command line and what is recorded in the
/// `file_metadata_source` column of the metadata artifact.
public enum Backend {
    /// An object store listed by key prefix, such as an S3 bucket
    OBJECT_STORE("s3"),
    /// Plain HTTP(S) URLs, discovered by scraping a page or by templating
    WEB("web");

    private final String shortName;

    Backend(String shortName) {
        this.shortName = shortName;
    }

    /// @return the name used on the command line and in metadata rows
    public String shortName() {
        return shortName;
    }

    /// Resolve a backend from its short name, ignoring case.
    /// @param name `s3` or `web`
    /// @return the matching backend
    /// @throws IllegalArgumentException if the name is unknown
    public static Backend fromShortName(String name) {
        String wanted = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(b -> b.shortName.equals(wanted))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                "Unknown source '" + name + "', expected one of s3, web"));
    }

    @Override
    public String toString() {
        return shortName;
    }
}
