package io.tripdata.sync.zones;

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

import io.tripdata.api.Fragment;
import io.tripdata.api.SyncReport;
import io.tripdata.sync.DatasetLocations;
import io.tripdata.sync.SyncOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Keeps the taxi zone lookup table and shapes archive current.
///
/// The zone files do not follow the trip naming grammar; they are synchronised by URL with the
/// same freshness rule as trip files.
public class ZoneFileSync {
    private static final Logger logger = LogManager.getLogger(ZoneFileSync.class);

    private final SyncOrchestrator orchestrator;
    private final DatasetLocations locations;

    /// @param orchestrator orchestrator whose local root is the zone data directory
    /// @param locations zone file URLs
    public ZoneFileSync(SyncOrchestrator orchestrator, DatasetLocations locations) {
        this.orchestrator = orchestrator;
        this.locations = locations;
    }

    /// @return the lookup table and shapes archive fragments
    public List<Fragment> zoneFragments() {
        return List.of(Fragment.web(locations.zoneLookupUrl()), Fragment.web(locations.zonesUrl()));
    }

    /// @return outcomes for both zone files
    public SyncReport run() {
        logger.info("Syncing zone files into {} ...", orchestrator.settings().localRoot());
        return orchestrator.sync(zoneFragments());
    }
}
