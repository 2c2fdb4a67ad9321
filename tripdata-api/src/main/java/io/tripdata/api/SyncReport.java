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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/// Every per-fragment outcome of one run, in no particular order.
public final class SyncReport {

    private final List<SyncOutcome> outcomes;

    /// @param outcomes the outcomes; copied
    public SyncReport(List<SyncOutcome> outcomes) {
        this.outcomes = Collections.unmodifiableList(new ArrayList<>(outcomes));
    }

    /// @return a report with no outcomes
    public static SyncReport empty() {
        return new SyncReport(List.of());
    }

    /// @param other another report
    /// @return a report holding the outcomes of both
    public SyncReport merge(SyncReport other) {
        List<SyncOutcome> all = new ArrayList<>(outcomes);
        all.addAll(other.outcomes);
        return new SyncReport(all);
    }

    /// @return all outcomes
    public List<SyncOutcome> outcomes() {
        return outcomes;
    }

    /// @param status a status
    /// @return how many outcomes have it
    public long count(SyncStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    /// @return outcome counts for every status, zero counts included
    public Map<SyncStatus, Long> counts() {
        Map<SyncStatus, Long> counts = new EnumMap<>(SyncStatus.class);
        for (SyncStatus status : SyncStatus.values()) {
            counts.put(status, count(status));
        }
        return counts;
    }

    /// @return the failed outcomes
    public List<SyncOutcome> failures() {
        return outcomes.stream().filter(o -> o.status() == SyncStatus.FAILED).collect(Collectors.toList());
    }

    /// @return true if any fragment failed
    public boolean hasFailures() {
        return outcomes.stream().anyMatch(o -> o.status() == SyncStatus.FAILED);
    }

    /// @return e.g. `4 fragments: 1 skipped, 2 created, 0 updated, 1 failed`
    public String summary() {
        return String.format("%d fragments: %d skipped, %d created, %d updated, %d failed",
            outcomes.size(),
            count(SyncStatus.SKIPPED),
            count(SyncStatus.DOWNLOADED),
            count(SyncStatus.UPDATED),
            count(SyncStatus.FAILED));
    }

    @Override
    public String toString() {
        return "SyncReport{" + summary() + "}";
    }
}
