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

/// Raised when a file name does not follow the `{type}_tripdata_{year}-{month}.{ext}` grammar.
///
/// This is terminal for the one fragment carrying the name; callers record it as a failed
/// outcome and keep processing the rest of the run.
public class FragmentParseException extends IllegalArgumentException {

    private final String fileName;

    /// @param fileName the name that failed to parse
    /// @param reason what part of the grammar was violated
    public FragmentParseException(String fileName, String reason) {
        super("Cannot parse trip file name '" + fileName + "': " + reason);
        this.fileName = fileName;
    }

    /// @return the offending file name
    public String getFileName() {
        return fileName;
    }
}
