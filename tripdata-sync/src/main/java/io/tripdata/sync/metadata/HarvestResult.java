package io.tripdata.sync.metadata;

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

import io.tripdata.api.Fragment;

import java.util.List;

/// Rows harvested from the fragments that could be read, and the fragments that could not.
///
/// @param rows metadata rows in fragment order
/// @param failures fragments whose metadata could not be read
public record HarvestResult(List<TripFileMetadata> rows, List<Failure> failures) {

    /// Copies both lists.
    public HarvestResult {
        rows = List.copyOf(rows);
        failures = List.copyOf(failures);
    }

    /// @return true if any fragment failed
    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /// A fragment whose metadata could not be read.
    ///
    /// @param fragment the fragment
    /// @param error why
    public record Failure(Fragment fragment, Exception error) {
    }
}
