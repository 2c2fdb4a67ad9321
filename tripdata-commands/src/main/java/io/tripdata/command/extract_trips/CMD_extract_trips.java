package io.tripdata.command.extract_trips;

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

import io.tripdata.api.DiscoveryException;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SyncReport;
import io.tripdata.command.TripDataDefaults;
import io.tripdata.command.common.DatasetLocationOptions;
import io.tripdata.command.common.LocalStoreOption;
import io.tripdata.command.common.ParallelOptions;
import io.tripdata.command.common.RemoteSources;
import io.tripdata.command.common.S3Options;
import io.tripdata.command.common.SelectionOptions;
import io.tripdata.command.common.VerbosityOption;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.sync.SyncOrchestrator;
import io.tripdata.sync.TripSyncPipeline;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/// Mirror trip files into the local trips directory
@CommandLine.Command(name = "extract-trips",
    header = "Download missing or stale trip files",
    description = {
        "Discover trip files on the selected source, keep those matching the record type, year",
        "and months, and download each one that is missing locally or older than the remote copy.",
        "",
        "Examples:",
        "  tripdata extract-trips -s s3 -t yellow -y 2023 -m 1 -m 2",
        "  tripdata extract-trips -s web -t green -y 2022 -m 1,2,3"
    },
    exitCodeList = {"0: every file is up to date", "1: a file or the discovery failed",
        "2: invalid options"})
public class CMD_extract_trips implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_extract_trips.class);

    @CommandLine.Mixin
    private SelectionOptions selection = new SelectionOptions();

    @CommandLine.Mixin
    private DatasetLocationOptions locationOptions = new DatasetLocationOptions();

    @CommandLine.Mixin
    private S3Options s3Options = new S3Options();

    @CommandLine.Mixin
    private ParallelOptions parallel = new ParallelOptions();

    @CommandLine.Mixin
    private LocalStoreOption store = new LocalStoreOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        verbosity.apply(spec.commandLine());
        SelectionCriteria criteria = selection.criteria(List.of(TripDataDefaults.FIRST_MONTH));
        DatasetLocations locations = locationOptions.locations();
        Path localRoot = store.resolve(TripDataDefaults.TRIPS_DATA_DIR);
        logger.info("Start.");
        logger.debug("Selection {} from {} into {}", criteria, selection.getSource(), localRoot);

        try (RemoteSources sources = RemoteSources.open(selection.getSource(), s3Options.settings())) {
            SyncOrchestrator orchestrator =
                new SyncOrchestrator(sources.byBackend(), parallel.syncSettings(localRoot));
            TripSyncPipeline pipeline =
                new TripSyncPipeline(sources.discovery(selection.getSource(), locations), orchestrator);
            SyncReport report = pipeline.run(
                RemoteSources.descriptor(selection.getSource(), locations, criteria), criteria);
            logger.info("Finished: {}", report.summary());
            return report.hasFailures() ? 1 : 0;
        } catch (DiscoveryException e) {
            logger.error("Discovery failed: {}", e.getMessage());
            logger.debug("Discovery failure detail", e);
            return 1;
        }
    }
}
