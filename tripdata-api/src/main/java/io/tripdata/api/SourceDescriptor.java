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

import java.util.Objects;
import java.util.Optional;

/// Where discovery should look.
///
/// For object stores the location is a key prefix (`bucket/prefix/`); for the web it is the
/// page that links to the published files. Web discovery also uses the criteria, when given,
/// to synthesize one candidate URL per requested month.
///
/// @param backend the backend to enumerate
/// @param location prefix or page URL
/// @param criteria optional selection used to template candidate URLs
public record SourceDescriptor(Backend backend, String location, SelectionCriteria criteria) {

    /// Validating constructor.
    public SourceDescriptor {
        Objects.requireNonNull(backend, "backend");
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("source location must not be empty");
        }
    }

    /// @param prefix `bucket/prefix/` to list
    /// @return an object-store descriptor
    public static SourceDescriptor objectStore(String prefix) {
        return new SourceDescriptor(Backend.OBJECT_STORE, prefix, null);
    }

    /// @param pageUrl page that links to the dataset files
    /// @param criteria months to template, or null to take every scraped link
    /// @return a web descriptor
    public static SourceDescriptor web(String pageUrl, SelectionCriteria criteria) {
        return new SourceDescriptor(Backend.WEB, pageUrl, criteria);
    }

    /// @return the templating criteria, if any
    public Optional<SelectionCriteria> selection() {
        return Optional.ofNullable(criteria);
    }
}
