/// HTTP backend for trip file mirroring.
///
/// {@link io.tripdata.transport.RemoteInfoProber} resolves metadata with a HEAD request and falls
/// back to GET when HEAD fails or gives no trustworthy size.
/// {@link io.tripdata.transport.HttpFileSource} copies files as parallel byte ranges or as a
/// single chunked stream, and serves ranged reads for footer inspection.
package io.tripdata.transport;

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
