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

import io.tripdata.api.TransferOptions;

import java.nio.file.Path;
import java.util.Objects;

/// Immutable settings of one synchronisation run.
public final class SyncSettings {

    private final Path localRoot;
    private final int workers;
    private final TransferOptions transferOptions;

    private SyncSettings(Builder builder) {
        this.localRoot = builder.localRoot;
        this.workers = builder.workers;
        this.transferOptions = builder.transferOptions;
    }

    /// @return a builder with one worker per available processor and default transfer options
    public static Builder builder() {
        return new Builder();
    }

    /// @return directory receiving the files
    public Path localRoot() {
        return localRoot;
    }

    /// @return maximum number of fragments processed at once
    public int workers() {
        return workers;
    }

    /// @return chunk size and per-file thread count
    public TransferOptions transferOptions() {
        return transferOptions;
    }

    @Override
    public String toString() {
        return "SyncSettings{localRoot=" + localRoot + ", workers=" + workers + ", transfer=" + transferOptions + "}";
    }

    /// Builder for [SyncSettings].
    public static final class Builder {
        private Path localRoot;
        private int workers = Runtime.getRuntime().availableProcessors();
        private TransferOptions transferOptions = TransferOptions.defaults();

        private Builder() {
        }

        /// @param localRoot destination directory, required
        /// @return this builder
        public Builder localRoot(Path localRoot) {
            this.localRoot = localRoot;
            return this;
        }

        /// @param workers maximum concurrent fragments, at least 1
        /// @return this builder
        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        /// @param transferOptions chunk size and per-file threads
        /// @return this builder
        public Builder transferOptions(TransferOptions transferOptions) {
            this.transferOptions = transferOptions;
            return this;
        }

        /// @return validated settings
        /// @throws IllegalArgumentException if the root is missing or the worker count is not positive
        public SyncSettings build() {
            if (localRoot == null) {
                throw new IllegalArgumentException("local root is required");
            }
            if (workers <= 0) {
                throw new IllegalArgumentException("worker count must be positive, got " + workers);
            }
            Objects.requireNonNull(transferOptions, "transferOptions");
            return new SyncSettings(this);
        }
    }
}
