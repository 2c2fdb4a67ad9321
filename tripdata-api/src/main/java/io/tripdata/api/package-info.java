/// Data model and backend interfaces for mirroring partitioned trip record datasets.
///
/// ## Key Components
///
/// - {@link io.tripdata.api.Fragment}: a remote file handle produced by discovery
/// - {@link io.tripdata.api.TripFileName}: the record type, year and month decoded from a name
/// - {@link io.tripdata.api.RemoteFileInfo}: size, type, timestamps and checksum hints
/// - {@link io.tripdata.api.RemoteFileSource}: per-backend metadata, copy and range access
/// - {@link io.tripdata.api.DatasetDiscovery}: enumeration of a dataset's fragments
/// - {@link io.tripdata.api.SyncReport}: per-fragment outcomes of a run
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
