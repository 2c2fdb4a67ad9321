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

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/// Which record type, year and months a run is interested in.
///
/// @param recordType the record family to keep
/// @param year the year to keep
/// @param months the months to keep, each within 1..12; an empty set selects nothing
public record SelectionCriteria(RecordType recordType, int year, Set<Integer> months) {

    /// Validating constructor; the month set is copied into an unmodifiable sorted set.
    public SelectionCriteria {
        Objects.requireNonNull(recordType, "recordType");
        if (year < 1000 || year > 9999) {
            throw new IllegalArgumentException("year must have four digits, got " + year);
        }
        Objects.requireNonNull(months, "months");
        TreeSet<Integer> copy = new TreeSet<>();
        for (Integer month : months) {
            if (month == null || month < 1 || month > 12) {
                throw new IllegalArgumentException("month must be within 1..12, got " + month);
            }
            copy.add(month);
        }
        months = Collections.unmodifiableSortedSet(copy);
    }

    /// @param recordType the record family
    /// @param year the year
    /// @param months the months
    /// @return new criteria
    public static SelectionCriteria of(RecordType recordType, int year, Collection<Integer> months) {
        return new SelectionCriteria(recordType, year, new TreeSet<>(months));
    }

    /// @param recordType the record family
    /// @param year the year
    /// @return criteria selecting every month of the year
    public static SelectionCriteria wholeYear(RecordType recordType, int year) {
        TreeSet<Integer> all = new TreeSet<>();
        for (int m = 1; m <= 12; m++) {
            all.add(m);
        }
        return new SelectionCriteria(recordType, year, all);
    }
}
