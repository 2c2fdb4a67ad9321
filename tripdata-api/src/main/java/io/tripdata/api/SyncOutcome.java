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

import java.nio.file.Path;

/// Outcome of processing one fragment.
///
/// @param fragment the fragment that was processed
/// @param destination local destination, null if it could not be resolved
/// @param status what happened
/// @param bytes bytes written, 0 unless downloaded or updated
/// @param error the failure cause, null unless failed
public record SyncOutcome(Fragment fragment, Path destination, SyncStatus status, long bytes, Exception error) {

    /// @param fragment the fragment
    /// @param destination the up to date local file
    /// @return a skipped outcome
    public static SyncOutcome skipped(Fragment fragment, Path destination) {
        return new SyncOutcome(fragment, destination, SyncStatus.SKIPPED, 0, null);
    }

    /// @param fragment the fragment
    /// @param destination the created file
    /// @param bytes bytes written
    /// @return a downloaded outcome
    public static SyncOutcome downloaded(Fragment fragment, Path destination, long bytes) {
        return new SyncOutcome(fragment, destination, SyncStatus.DOWNLOADED, bytes, null);
    }

    /// @param fragment the fragment
    /// @param destination the replaced file
    /// @param bytes bytes written
    /// @return an updated outcome
    public static SyncOutcome updated(Fragment fragment, Path destination, long bytes) {
        return new SyncOutcome(fragment, destination, SyncStatus.UPDATED, bytes, null);
    }

    /// @param fragment the fragment
    /// @param destination the destination, may be null
    /// @param error what went wrong
    /// @return a failed outcome
    public static SyncOutcome failed(Fragment fragment, Path destination, Exception error) {
        return new SyncOutcome(fragment, destination, SyncStatus.FAILED, 0, error);
    }

    /// @return true unless the fragment failed
    public boolean isSuccess() {
        return status != SyncStatus.FAILED;
    }

    /// @return a short reason for failed outcomes, empty otherwise
    public String reason() {
        if (error == null) {
            return "";
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
