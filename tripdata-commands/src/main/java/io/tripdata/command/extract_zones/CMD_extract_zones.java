package io.tripdata.command.extract_zones;

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

import io.tripdata.api.SyncReport;
import io.tripdata.command.TripDataDefaults;
import io.tripdata.command.common.LocalStoreOption;
import io.tripdata.command.common.ParallelOptions;
import io.tripdata.command.common.RemoteSources;
import io.tripdata.command.common.VerbosityOption;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.sync.SyncOrchestrator;
import io.tripdata.sync.zones.ZoneFileSync;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Mirror the taxi zone lookup table and shapes
@CommandLine.Command(name = "extract-zones",
    header = "Download the taxi zone lookup table and shapes",
    description = "Download the taxi zone files when missing locally or older than the published copy.",
    exitCodeList = {"0: both files are up to date", "1: a file failed", "2: invalid options"})
public class CMD_extract_zones implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_extract_zones.class);

    @CommandLine.Option(names = {"--zone-lookup-url"},
        description = "Zone lookup table (default: ${DEFAULT-VALUE})",
        defaultValue = "https://d37ci6vzurychx.cloudfront.net/misc/taxi_zone_lookup.csv")
    private String zoneLookupUrl;

    @CommandLine.Option(names = {"--zones-url"},
        description = "Zone shapes archive (default: ${DEFAULT-VALUE})",
        defaultValue = "https://d37ci6vzurychx.cloudfront.net/misc/taxi_zones.zip")
    private String zonesUrl;

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
        Path localRoot = store.resolve(TripDataDefaults.ZONES_DATA_DIR);
        DatasetLocations locations = DatasetLocations.nycTlc().withZoneUrls(zoneLookupUrl, zonesUrl);
        logger.info("Start.");
        try (RemoteSources sources = RemoteSources.web()) {
            SyncOrchestrator orchestrator =
                new SyncOrchestrator(sources.byBackend(), parallel.syncSettings(localRoot));
            SyncReport report = new ZoneFileSync(orchestrator, locations).run();
            logger.info("Finished: {}", report.summary());
            return report.hasFailures() ? 1 : 0;
        }
    }
}
