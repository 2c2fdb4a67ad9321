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

import io.tripdata.api.RemoteFileInfo;

import java.io.IOException;
import java.util.Objects;

/// The outcome of one probe request: either the metadata it yielded or the error it raised.
///
/// @param policy the request that was made
/// @param info the metadata, null when the attempt failed
/// @param error the failure, null when the attempt succeeded
public record ProbeAttempt(ProbePolicy policy, RemoteFileInfo info, IOException error) {

    /// Validating constructor.
    public ProbeAttempt {
        Objects.requireNonNull(policy, "policy");
        if ((info == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of info and error must be given");
        }
    }

    /// @param policy the request made
    /// @param info the metadata obtained
    /// @return a successful attempt
    public static ProbeAttempt succeeded(ProbePolicy policy, RemoteFileInfo info) {
        return new ProbeAttempt(policy, info, null);
    }

    /// @param policy the request made
    /// @param error what went wrong
    /// @return a failed attempt
    public static ProbeAttempt failed(ProbePolicy policy, IOException error) {
        return new ProbeAttempt(policy, null, error);
    }

    /// @return true if the request completed with a 2xx status
    public boolean succeeded() {
        return info != null;
    }

    /// @return true if the attempt produced a usable size, so no further attempt is needed
    public boolean hasSize() {
        return info != null && info.getSize().isPresent();
    }
}
