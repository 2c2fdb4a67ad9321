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

/// The result of processing one fragment.
///
/// - SKIPPED: the local copy was kept
/// - DOWNLOADED: the file was missing and has been created
/// - UPDATED: a stale local copy has been replaced
/// - FAILED: probing, parsing or the transfer failed
public enum SyncStatus {
    /// Local copy kept
    SKIPPED,
    /// Missing file created
    DOWNLOADED,
    /// Stale file replaced
    UPDATED,
    /// Fragment failed
    FAILED
}
