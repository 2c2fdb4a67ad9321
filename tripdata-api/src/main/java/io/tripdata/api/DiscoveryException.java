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

import java.io.IOException;

/// The backend listing itself failed, so there is nothing to iterate.
///
/// Unlike per-fragment errors this stops the whole invocation before any transfer starts.
public class DiscoveryException extends IOException {

    private final String location;

    /// @param location the prefix or page URL that was being enumerated
    /// @param message what went wrong
    /// @param cause the underlying failure, may be null
    public DiscoveryException(String location, String message, Throwable cause) {
        super(message + " [" + location + "]", cause);
        this.location = location;
    }

    /// @return the prefix or page URL that was being enumerated
    public String getLocation() {
        return location;
    }
}
