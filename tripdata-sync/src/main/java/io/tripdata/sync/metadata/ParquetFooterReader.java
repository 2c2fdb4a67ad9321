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

import io.tripdata.api.Fragment;
import io.tripdata.api.RemoteFileSource;
import org.apache.parquet.column.ColumnDescriptor;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/// Reads the statistics of a Parquet file from its footer only.
public final class ParquetFooterReader {

    private ParquetFooterReader() {
    }

    /// @param source backend serving the fragment
    /// @param fragment a Parquet file
    /// @param size its size in bytes
    /// @return row count and column layout
    /// @throws IOException if the footer cannot be fetched or decoded
    public static FooterSummary read(RemoteFileSource source, Fragment fragment, long size) throws IOException {
        return read(new RemoteInputFile(source, fragment, size));
    }

    /// @param file any Parquet input
    /// @return row count and column layout
    /// @throws IOException if the footer cannot be read or decoded
    public static FooterSummary read(InputFile file) throws IOException {
        try (ParquetFileReader reader = ParquetFileReader.open(file)) {
            return summarize(reader.getFooter());
        } catch (RuntimeException e) {
            throw new IOException("Invalid parquet footer in " + file, e);
        } catch (LinkageError e) {
            throw new IOException("Parquet reader is not usable for " + file + ": " + e, e);
        }
    }

    static FooterSummary summarize(ParquetMetadata footer) {
        long rows = 0;
        for (BlockMetaData block : footer.getBlocks()) {
            rows += block.getRowCount();
        }
        MessageType schema = footer.getFileMetaData().getSchema();
        List<String> columns = new ArrayList<>();
        for (ColumnDescriptor column : schema.getColumns()) {
            columns.add(String.join(".", column.getPath()));
        }
        return new FooterSummary(rows, columns);
    }

    /// Footer statistics of one file.
    ///
    /// @param numRows rows over all row groups
    /// @param columnNames leaf column paths, dot separated, in schema order
    public record FooterSummary(long numRows, List<String> columnNames) {
        /// Copies the column list.
        public FooterSummary {
            columnNames = List.copyOf(columnNames);
        }

        /// @return number of leaf columns
        public int numColumns() {
            return columnNames.size();
        }
    }
}
