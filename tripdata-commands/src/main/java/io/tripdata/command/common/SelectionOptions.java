package io.tripdata.command.common;

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
import io.tripdata.api.RecordType;
import io.tripdata.api.SelectionCriteria;
import io.tripdata.command.TripDataDefaults;
import picocli.CommandLine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Shared source and selection options: {@code --source}, {@code --record-type}, {@code --year}
 * and {@code --months}.
 *
 * <p>Values are range checked while parsing, so an invalid year or month is reported as a usage
 * error before any command logic runs.</p>
 */
public class SelectionOptions {

    @CommandLine.Option(
        names = {"-s", "--source"},
        description = "Trips remote source: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "s3",
        completionCandidates = SourceCandidates.class,
        converter = SourceConverter.class
    )
    private Backend source = TripDataDefaults.DEFAULT_SOURCE;

    @CommandLine.Option(
        names = {"-t", "--record-type"},
        description = "Trip record type: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "yellow",
        completionCandidates = RecordTypeCandidates.class,
        converter = RecordTypeConverter.class
    )
    private RecordType recordType = TripDataDefaults.DEFAULT_RECORD_TYPE;

    @CommandLine.Option(
        names = {"-y", "--year"},
        paramLabel = "YEAR",
        description = "Trip year, 2009 to the current year (default: current year)",
        converter = YearConverter.class
    )
    private Integer year;

    @CommandLine.Option(
        names = {"-m", "--months"},
        paramLabel = "MONTH",
        split = ",",
        description = "Trip months, 1 to 12; repeat the option or separate with commas",
        converter = MonthConverter.class
    )
    private List<Integer> months = new ArrayList<>();

    /**
     * @return the selected source backend
     */
    public Backend getSource() {
        return source;
    }

    /**
     * @return the selected record type
     */
    public RecordType getRecordType() {
        return recordType;
    }

    /**
     * @return the selected year, or the current year when none was given
     */
    public int getYear() {
        return year != null ? year : TripDataDefaults.currentYear();
    }

    /**
     * @return the months given on the command line, possibly empty
     */
    public List<Integer> getMonths() {
        return months;
    }

    /**
     * Builds the selection criteria.
     *
     * @param defaultMonths months to use when {@code --months} was not given
     * @return validated criteria
     */
    public SelectionCriteria criteria(Collection<Integer> defaultMonths) {
        Collection<Integer> selected = months.isEmpty() ? defaultMonths : months;
        return SelectionCriteria.of(recordType, getYear(), selected);
    }

    /**
     * Picocli converter for backend short names.
     */
    public static final class SourceConverter implements CommandLine.ITypeConverter<Backend> {
        @Override
        public Backend convert(String value) {
            try {
                return Backend.fromShortName(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }

    /**
     * Valid {@code --source} values.
     */
    public static final class SourceCandidates extends ArrayList<String> {
        SourceCandidates() {
            super(Arrays.stream(Backend.values()).map(Backend::shortName).toList());
        }
    }

    /**
     * Picocli converter for record type tokens.
     */
    public static final class RecordTypeConverter implements CommandLine.ITypeConverter<RecordType> {
        @Override
        public RecordType convert(String value) {
            return RecordType.fromToken(value).orElseThrow(() -> new CommandLine.TypeConversionException(
                "Unknown record type '" + value + "', expected one of " + new RecordTypeCandidates()));
        }
    }

    /**
     * Valid {@code --record-type} values.
     */
    public static final class RecordTypeCandidates extends ArrayList<String> {
        RecordTypeCandidates() {
            super(Arrays.stream(RecordType.values()).map(RecordType::token).toList());
        }
    }

    /**
     * Accepts years from the first published year to the current one.
     */
    public static final class YearConverter implements CommandLine.ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            int parsed = parseInt(value, "year");
            int last = TripDataDefaults.currentYear();
            if (parsed < TripDataDefaults.FIRST_YEAR || parsed > last) {
                throw new CommandLine.TypeConversionException(
                    "Year " + parsed + " is outside " + TripDataDefaults.FIRST_YEAR + ".." + last);
            }
            return parsed;
        }
    }

    /**
     * Accepts months 1 to 12.
     */
    public static final class MonthConverter implements CommandLine.ITypeConverter<Integer> {
        @Override
        public Integer convert(String value) {
            int parsed = parseInt(value, "month");
            if (parsed < TripDataDefaults.FIRST_MONTH || parsed > TripDataDefaults.LAST_MONTH) {
                throw new CommandLine.TypeConversionException(
                    "Month " + parsed + " is outside " + TripDataDefaults.FIRST_MONTH + ".."
                        + TripDataDefaults.LAST_MONTH);
            }
            return parsed;
        }
    }

    static int parseInt(String value, String what) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new CommandLine.TypeConversionException("Invalid " + what + " '" + value + "'");
        }
    }
}
