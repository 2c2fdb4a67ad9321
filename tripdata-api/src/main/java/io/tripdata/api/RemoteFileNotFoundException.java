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

/// Both the metadata-only and the body request failed for a URL.
public class RemoteFileNotFoundException extends IOException {

    private final String url;

    /// @param url the URL that could not be resolved
    /// @param cause the failure of the last attempt
    public RemoteFileNotFoundException(String url, Throwable cause) {
        super("Remote file not found: " + url, cause);
        this.url = url;
    }

    /// @return the URL that could not be resolved
    public String getUrl() {
        return url;
    }
}
