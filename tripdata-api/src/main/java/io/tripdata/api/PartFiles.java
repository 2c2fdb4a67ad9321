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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/// Write-to-temp-then-rename helpers shared by the backends.
///
/// A transfer writes `<destination>.part` and only moves it over the destination once every
/// byte has arrived, so an interrupted run never leaves a truncated file under the final name.
public final class PartFiles {
    private static final Logger logger = LogManager.getLogger(PartFiles.class);

    /// Suffix of in-flight transfer files
    public static final String PART_SUFFIX = ".part";

    private PartFiles() {
    }

    /// @param destination the final file
    /// @return the in-flight file next to it
    public static Path partFile(Path destination) {
        return destination.resolveSibling(destination.getFileName() + PART_SUFFIX);
    }

    /// Create the parent directories of a destination.
    ///
    /// @param destination the final file
    /// @throws IOException if a directory cannot be created
    public static void createParents(Path destination) throws IOException {
        Path parent = destination.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    /// Replace the destination with a completed part file, atomically where the file system allows.
    ///
    /// @param part the completed part file
    /// @param destination the final file
    /// @throws IOException if the move fails
    public static void moveIntoPlace(Path part, Path destination) throws IOException {
        try {
            Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /// Remove a part file left by a failed transfer. Failures to delete are logged.
    ///
    /// @param part the part file
    public static void deletePartial(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            logger.warn("Could not remove partial file {}: {}", part, e.getMessage());
        }
    }
}
