package io.tripdata.sync.filter;

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
import io.tripdata.api.FragmentParseException;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.api.SyncOutcome;
import io.tripdata.api.TripFileName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/// Selects fragments by record type, year and month.
///
/// The predicate is pure: it reads only its arguments and mutates nothing.
public final class FragmentFilter {

    private FragmentFilter() {
    }

    /// @param identity a decoded file name
    /// @param criteria the selection
    /// @return true if type and year match and the month is among the selected months
    public static boolean isAllowed(TripFileName identity, SelectionCriteria criteria) {
        return identity.recordType().equals(criteria.recordType().token())
            && identity.year() == criteria.year()
            && criteria.months().contains(identity.month());
    }

    /// @param fragment a fragment
    /// @param criteria the selection
    /// @return true if the fragment's identity is selected
    /// @throws FragmentParseException if the fragment's name does not follow the trip grammar
    public static boolean isAllowed(Fragment fragment, SelectionCriteria criteria) {
        return isAllowed(fragment.identity(), criteria);
    }

    /// Partition discovered fragments.
    ///
    /// @param fragments discovered fragments
    /// @param criteria the selection
    /// @return the selected fragments, in discovery order, and a failed outcome per unparseable name
    public static Selection select(List<Fragment> fragments, SelectionCriteria criteria) {
        List<Fragment> selected = new ArrayList<>();
        List<SyncOutcome> unparseable = new ArrayList<>();
        int rejected = 0;
        for (Fragment fragment : fragments) {
            try {
                if (isAllowed(fragment, criteria)) {
                    selected.add(fragment);
                } else {
                    rejected++;
                }
            } catch (FragmentParseException e) {
                unparseable.add(SyncOutcome.failed(fragment, null, e));
            }
        }
        return new Selection(selected, unparseable, rejected);
    }

    /// Result of [#select(List, SelectionCriteria)].
    ///
    /// @param selected fragments matching the criteria
    /// @param unparseable failed outcomes for fragments whose names could not be decoded
    /// @param rejected number of fragments that parsed but did not match
    public record Selection(List<Fragment> selected, List<SyncOutcome> unparseable, int rejected) {
        /// Copies both lists.
        public Selection {
            selected = Collections.unmodifiableList(new ArrayList<>(selected));
            unparseable = Collections.unmodifiableList(new ArrayList<>(unparseable));
        }
    }
}
