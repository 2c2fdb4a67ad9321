package io.tripdata.command.extract_metadata;

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
import io.tripdata.api.DiscoveryException;
import io.tripdata.api.Fragment;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SyncOutcome;
import io.tripdata.command.TripDataDefaults;
import io.tripdata.command.common.DatasetLocationOptions;
import io.tripdata.command.common.LocalStoreOption;
import io.tripdata.command.common.ParallelOptions;
import io.tripdata.command.common.RemoteSources;
import io.tripdata.command.common.S3Options;
import io.tripdata.command.common.SelectionOptions;
import io.tripdata.command.common.VerbosityOption;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.sync.filter.FragmentFilter;
import io.tripdata.sync.metadata.HarvestResult;
import io.tripdata.sync.metadata.TripMetadataCsvWriter;
import io.tripdata.sync.metadata.TripMetadataHarvester;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/// Build a metadata table of the selected trip files from their Parquet footers
@CommandLine.Command(name = "extract-metadata",
    header = "Write a CSV table describing the selected trip files",
    description = {
        "Discover trip files on the selected source and, for each one matching the selection,",
        "read its size, modification time and Parquet footer without downloading the file.",
        "",
        "Example:",
        "  tripdata extract-metadata -s s3 -t yellow -y 2023"
    },
    exitCodeList = {"0: every selected file was described", "1: a file or the discovery failed",
        "2: invalid options"})
public class CMD_extract_metadata implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_extract_metadata.class);

    static final List<Integer> ALL_MONTHS = IntStream.rangeClosed(TripDataDefaults.FIRST_MONTH,
        TripDataDefaults.LAST_MONTH).boxed().collect(Collectors.toList());

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

    Clock clock = Clock.systemDefaultZone();

    @Override
    public Integer call() throws IOException {
        verbosity.apply(spec.commandLine());
        Backend source = selection.getSource();
        SelectionCriteria criteria = selection.criteria(ALL_MONTHS);
        DatasetLocations locations = locationOptions.locations();
        logger.info("Start.");

        try (RemoteSources sources = RemoteSources.open(source, s3Options.settings())) {
            logger.info("Discovering trips metadata ...");
            List<Fragment> discovered = sources.discovery(source, locations)
                .discover(RemoteSources.descriptor(source, locations, null));
            FragmentFilter.Selection selected = FragmentFilter.select(discovered, criteria);
            for (SyncOutcome unparseable : selected.unparseable()) {
                logger.error("Skipping {}: {}", unparseable.fragment().path(), unparseable.reason());
            }

            int workers = source == Backend.WEB && !parallel.isWorkersSpecified()
                ? TripDataDefaults.WEB_METADATA_WORKERS
                : parallel.getWorkers();
            TripMetadataHarvester harvester = new TripMetadataHarvester(sources.byBackend(), locations, workers);
            HarvestResult result = harvester.harvest(selected.selected());

            Path destination = store.resolve(TripDataDefaults.TRIPS_METADATA_DIR).resolve(
                TripMetadataCsvWriter.fileName(LocalDate.now(clock), source, criteria.recordType(), criteria.year()));
            new TripMetadataCsvWriter().write(result.rows(), destination);
            logger.info("Finished: {} rows, {} failed", result.rows().size(),
                result.failures().size() + selected.unparseable().size());
            return result.hasFailures() || !selected.unparseable().isEmpty() ? 1 : 0;
        } catch (DiscoveryException e) {
            logger.error("Discovery failed: {}", e.getMessage());
            logger.debug("Discovery failure detail", e);
            return 1;
        }
    }
}
