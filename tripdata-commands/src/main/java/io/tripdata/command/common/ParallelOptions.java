package io.tripdata.command.common;

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
import io.tripdata.command.TripDataDefaults;
import io.tripdata.sync.SyncSettings;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * Shared concurrency and transfer options.
 */
public class ParallelOptions {

    @CommandLine.Option(
        names = {"-w", "--workers"},
        description = "Files processed at once (default: number of processors)",
        converter = PositiveIntConverter.class
    )
    private Integer workers;

    @CommandLine.Option(
        names = {"--transfer-threads"},
        description = "Threads per file transfer, 1 disables parallel ranges (default: ${DEFAULT-VALUE})",
        defaultValue = "4",
        converter = PositiveIntConverter.class
    )
    private int transferThreads = TransferOptions.DEFAULT_THREADS;

    @CommandLine.Option(
        names = {"--chunk-size"},
        description = "Transfer chunk size in bytes (default: ${DEFAULT-VALUE})",
        defaultValue = "1048576",
        converter = PositiveIntConverter.class
    )
    private int chunkSize = TransferOptions.DEFAULT_CHUNK_SIZE;

    /**
     * @return the worker count, one per processor unless given
     */
    public int getWorkers() {
        return workers != null ? workers : TripDataDefaults.defaultWorkers();
    }

    /**
     * @return whether {@code --workers} was given
     */
    public boolean isWorkersSpecified() {
        return workers != null;
    }

    /**
     * @return chunk size and per-file threads
     */
    public TransferOptions transferOptions() {
        return new TransferOptions(chunkSize, transferThreads);
    }

    /**
     * @param localRoot destination directory
     * @return sync settings for it
     */
    public SyncSettings syncSettings(Path localRoot) {
        return SyncSettings.builder()
            .localRoot(localRoot)
            .workers(getWorkers())
            .transferOptions(transferOptions())
            .build();
    }

    /**
     * Rejects zero and negative counts.
     */
    public static final class PositiveIntConverter implements CommandLine.ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            int parsed = SelectionOptions.parseInt(value, "count");
            if (parsed <= 0) {
                throw new CommandLine.TypeConversionException("Expected a positive number but got " + parsed);
            }
            return parsed;
        }
    }
}
