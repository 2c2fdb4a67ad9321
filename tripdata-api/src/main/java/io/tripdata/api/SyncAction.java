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

import java.time.Instant;

/// The decision taken for one fragment before any transfer.
public enum SyncAction {
    /// Local copy is present and not older than the remote one, or freshness is unknown
    SKIP,
    /// No local copy exists
    CREATE,
    /// Local copy exists and the remote one is strictly newer
    UPDATE;

    /// Decide what to do with a fragment.
    ///
    /// Missing timestamps never force a refetch: unknown freshness is not a reason to download
    /// again, only a missing file is.
    ///
    /// @param localExists whether the destination file exists
    /// @param localModified local modification time, null if unknown
    /// @param remoteModified remote modification time, null if unknown
    /// @return the action to take
    public static SyncAction decide(boolean localExists, Instant localModified, Instant remoteModified) {
        if (!localExists) {
            return CREATE;
        }
        if (localModified != null && remoteModified != null && remoteModified.isAfter(localModified)) {
            return UPDATE;
        }
        return SKIP;
    }
}
