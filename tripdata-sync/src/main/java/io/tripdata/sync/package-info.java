/// Discovery, selection and synchronisation of trip record files.
///
/// ## Key Components
///
/// - {@link io.tripdata.sync.SyncOrchestrator}: parallel per-fragment skip, create or update
/// - {@link io.tripdata.sync.TripSyncPipeline}: discover, filter, synchronise
/// - {@link io.tripdata.sync.DatasetLocations}: published locations of the dataset
///
/// Subpackages hold the discovery strategies, the fragment filter, metadata harvesting and the
/// zone file sync.
package io.tripdata.sync;

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
