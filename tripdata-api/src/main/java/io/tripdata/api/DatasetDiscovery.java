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

import java.util.List;

/// Enumerates the candidate fragments of a dataset.
///
/// The order of the returned list is not meaningful.
public interface DatasetDiscovery {

    /// @param source where to look
    /// @return the candidate fragments
    /// @throws DiscoveryException if the enumeration call itself fails
    List<Fragment> discover(SourceDescriptor source) throws DiscoveryException;
}
