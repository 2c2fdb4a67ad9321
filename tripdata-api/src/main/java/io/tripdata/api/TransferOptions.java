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

/// How a single file is copied.
///
/// @param chunkSize bytes per read/write chunk and per ranged request
/// @param threads transfer threads per file; 1 disables multi-threaded transfer
public record TransferOptions(int chunkSize, int threads) {

    /// 1 MiB
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    /// Threads per file when multi-threaded transfer is on
    public static final int DEFAULT_THREADS = 4;

    /// Validating constructor.
    public TransferOptions {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunk size must be positive, got " + chunkSize);
        }
        if (threads <= 0) {
            throw new IllegalArgumentException("transfer threads must be positive, got " + threads);
        }
    }

    /// @return 1 MiB chunks with multi-threaded transfer
    public static TransferOptions defaults() {
        return new TransferOptions(DEFAULT_CHUNK_SIZE, DEFAULT_THREADS);
    }

    /// @param useThreads whether the backend may use several threads per file
    /// @return 1 MiB chunks, threaded or not
    public static TransferOptions of(boolean useThreads) {
        return new TransferOptions(DEFAULT_CHUNK_SIZE, useThreads ? DEFAULT_THREADS : 1);
    }

    /// @return true when more than one thread may be used per file
    public boolean multiThreaded() {
        return threads > 1;
    }
}
