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

import io.tripdata.command.TripDataDefaults;
import picocli.CommandLine;

import java.nio.file.Path;

/**
 * The local base directory holding the trips, metadata and zone sub-directories.
 */
public class LocalStoreOption {

    @CommandLine.Option(
        names = {"-d", "--data-dir"},
        description = "Local base directory (default: ${DEFAULT-VALUE})",
        defaultValue = "./data"
    )
    private Path baseDir = TripDataDefaults.LOCAL_BASE;

    /**
     * @return the base directory
     */
    public Path getBaseDir() {
        return baseDir;
    }

    /**
     * @param child sub-directory name
     * @return the sub-directory of the base
     */
    public Path resolve(String child) {
        return baseDir.resolve(child);
    }
}
