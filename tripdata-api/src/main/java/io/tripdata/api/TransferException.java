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
import java.nio.file.Path;

/// A chunked copy failed part way. Not retried; the fragment is reported as failed.
public class TransferException extends IOException {

    private final String source;
    private final Path destination;

    /// @param source the remote path or URL being copied
    /// @param destination the local file that was being written
    /// @param cause the I/O failure
    public TransferException(String source, Path destination, Throwable cause) {
        super("Transfer of " + source + " to " + destination + " failed: "
            + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.source = source;
        this.destination = destination;
    }

    /// @return the remote path or URL being copied
    public String getSource() {
        return source;
    }

    /// @return the local file that was being written
    public Path getDestination() {
        return destination;
    }
}
