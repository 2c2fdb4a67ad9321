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

import io.tripdata.api.DatasetDiscovery;
import io.tripdata.api.DiscoveryException;
import io.tripdata.api.Fragment;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SourceDescriptor;
import io.tripdata.api.SyncReport;
import io.tripdata.sync.filter.FragmentFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/// Discover, filter, then synchronise.
///
/// A discovery failure propagates before anything is transferred. Fragments with unparseable
/// names are reported as failed outcomes alongside the synchronised ones.
public class TripSyncPipeline {
    private static final Logger logger = LogManager.getLogger(TripSyncPipeline.class);

    private final DatasetDiscovery discovery;
    private final SyncOrchestrator orchestrator;

    /// @param discovery enumerates the dataset
    /// @param orchestrator synchronises the selected fragments
    public TripSyncPipeline(DatasetDiscovery discovery, SyncOrchestrator orchestrator) {
        this.discovery = discovery;
        this.orchestrator = orchestrator;
    }

    /// @param source where to discover
    /// @param criteria what to keep
    /// @return every outcome of the run
    /// @throws DiscoveryException if the dataset cannot be enumerated
    public SyncReport run(SourceDescriptor source, SelectionCriteria criteria) throws DiscoveryException {
        logger.info("Discovering trip files at {} ...", source.location());
        List<Fragment> discovered = discovery.discover(source);
        FragmentFilter.Selection selection = FragmentFilter.select(discovered, criteria);
        logger.info("Discovered {} fragments, {} selected, {} unparseable",
            discovered.size(), selection.selected().size(), selection.unparseable().size());

        SyncReport report = orchestrator.sync(selection.selected());
        return report.merge(new SyncReport(selection.unparseable()));
    }
}
