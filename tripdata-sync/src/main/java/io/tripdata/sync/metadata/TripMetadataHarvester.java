package io.tripdata.sync.metadata;

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

import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.TripFileName;
import io.tripdata.sync.DatasetLocations;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/// Collects one [TripFileMetadata] row per selected trip file without downloading the files.
///
/// Size and modification time come from the backend's metadata; row and column statistics come
/// from the Parquet footer, fetched with ranged reads. A fragment that cannot be read is reported
/// in the result and does not stop the others.
public class TripMetadataHarvester {
    private static final Logger classLogger = LogManager.getLogger(TripMetadataHarvester.class);

    private final Map<Backend, RemoteFileSource> sources;
    private final DatasetLocations locations;
    private final int workers;
    private final Logger logger;

    /// @param sources one source per backend that fragments may come from
    /// @param locations base URLs reported in each row
    /// @param workers maximum files read at once
    public TripMetadataHarvester(Map<Backend, RemoteFileSource> sources, DatasetLocations locations, int workers) {
        this(sources, locations, workers, classLogger);
    }

    /// @param sources one source per backend that fragments may come from
    /// @param locations base URLs reported in each row
    /// @param workers maximum files read at once
    /// @param logger where progress and failures are logged
    public TripMetadataHarvester(Map<Backend, RemoteFileSource> sources, DatasetLocations locations, int workers,
                                 Logger logger) {
        if (workers <= 0) {
            throw new IllegalArgumentException("worker count must be positive, got " + workers);
        }
        this.sources = new EnumMap<>(Backend.class);
        this.sources.putAll(sources);
        this.locations = locations;
        this.workers = workers;
        this.logger = logger;
    }

    /// @param fragments selected trip files
    /// @return rows in fragment order, plus failures
    public HarvestResult harvest(List<Fragment> fragments) {
        if (fragments.isEmpty()) {
            return new HarvestResult(List.of(), List.of());
        }
        logger.info("Extracting trips metadata ...");
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(workers, fragments.size()));
        List<CompletableFuture<Object>> tasks = new ArrayList<>();
        try {
            for (Fragment fragment : fragments) {
                tasks.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        return harvestOne(fragment);
                    } catch (Exception e) {
                        logger.error("Failed to read metadata of {}: {}", fragment.path(), e.toString());
                        logger.debug("Failure detail for {}", fragment.path(), e);
                        return new HarvestResult.Failure(fragment, e);
                    }
                }, executor));
            }
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }

        List<TripFileMetadata> rows = new ArrayList<>();
        List<HarvestResult.Failure> failures = new ArrayList<>();
        for (CompletableFuture<Object> task : tasks) {
            Object result = task.join();
            if (result instanceof TripFileMetadata row) {
                rows.add(row);
            } else {
                failures.add((HarvestResult.Failure) result);
            }
        }
        logger.info("Read metadata of {} files, {} failed", rows.size(), failures.size());
        return new HarvestResult(rows, failures);
    }

    /// Read one file's metadata on the calling thread.
    ///
    /// @param fragment a trip file
    /// @return its row
    /// @throws IOException if metadata or footer cannot be read, or the size is unknown
    public TripFileMetadata harvestOne(Fragment fragment) throws IOException {
        TripFileName identity = fragment.identity();
        RemoteFileSource source = sources.get(fragment.backend());
        if (source == null) {
            throw new IllegalStateException("No source configured for backend " + fragment.backend());
        }
        RemoteFileInfo info = source.info(fragment);
        long size = info.getSize()
            .orElseThrow(() -> new IOException("Size of " + fragment.path() + " is unknown"));
        ParquetFooterReader.FooterSummary footer = ParquetFooterReader.read(source, fragment, size);
        String name = fragment.fileName();
        return new TripFileMetadata(
            name,
            locations.s3Url(name),
            locations.cloudFrontUrl(name),
            identity.recordType(),
            identity.year(),
            identity.month(),
            info.getModifiedAt().map(Instant::toString).orElse(null),
            footer.numRows(),
            footer.numColumns(),
            String.join(",", footer.columnNames()),
            size,
            size / TripFileMetadata.MIB,
            size / TripFileMetadata.GIB,
            fragment.backend().shortName());
    }
}
