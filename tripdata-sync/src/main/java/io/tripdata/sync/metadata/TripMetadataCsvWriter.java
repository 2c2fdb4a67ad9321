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

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import io.tripdata.api.Backend;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RecordType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Writes metadata rows as a headed CSV table.
public class TripMetadataCsvWriter {
    private static final Logger logger = LogManager.getLogger(TripMetadataCsvWriter.class);

    // quote only values holding a separator, quote or line break
    private final CsvMapper mapper = CsvMapper.builder()
        .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
        .build();
    private final CsvSchema schema = mapper.schemaFor(TripFileMetadata.class).withHeader();

    /// @param today run date
    /// @param source backend the rows were read from
    /// @param recordType selected record type
    /// @param year selected year
    /// @return `{today}_{source}_{type}_tripmetadata_{year}.csv`
    public static String fileName(LocalDate today, Backend source, RecordType recordType, int year) {
        return String.format(Locale.ROOT, "%s_%s_%s_tripmetadata_%d.csv",
            today, source.shortName(), recordType.token(), year);
    }

    /// Write the rows, replacing any existing file at the same path.
    ///
    /// @param rows rows to write, in order
    /// @param destination target file
    /// @return the destination
    /// @throws IOException if the file cannot be written
    public Path write(List<TripFileMetadata> rows, Path destination) throws IOException {
        logger.info("Saving trips metadata at {} ...", destination);
        PartFiles.createParents(destination);
        Path part = PartFiles.partFile(destination);
        try (Writer writer = Files.newBufferedWriter(part, StandardCharsets.UTF_8)) {
            if (rows.isEmpty()) {
                writer.write(headerLine());
            } else {
                try (SequenceWriter sequence = mapper.writer(schema).writeValues(writer)) {
                    sequence.writeAll(rows);
                }
            }
        } catch (IOException | RuntimeException e) {
            PartFiles.deletePartial(part);
            throw e;
        }
        PartFiles.moveIntoPlace(part, destination);
        return destination;
    }

    // the generator only emits the header together with the first row
    private String headerLine() {
        List<String> names = new ArrayList<>();
        for (CsvSchema.Column column : schema) {
            names.add(column.getName());
        }
        return String.join(String.valueOf(schema.getColumnSeparator()), names) + "\n";
    }
}
