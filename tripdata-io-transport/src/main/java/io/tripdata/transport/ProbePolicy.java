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

/// The request used for one metadata probe attempt.
public enum ProbePolicy {
    /// Metadata only, no body
    HEAD("HEAD"),
    /// Full request; the body is closed unread
    GET("GET");

    private final String method;

    ProbePolicy(String method) {
        this.method = method;
    }

    /// @return the HTTP method name
    public String method() {
        return method;
    }
}
