package io.tripdata.s3;

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
import io.tripdata.api.Fragment;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileNotFoundException;
import io.tripdata.api.TransferException;
import io.tripdata.api.TransferOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("S3FileSource")
class S3FileSourceTest {

    private static final Instant MODIFIED = Instant.parse("2024-01-15T08:30:00Z");
    private static final byte[] PAYLOAD = "0123456789abcdef".getBytes(StandardCharsets.US_ASCII);

    @TempDir
    Path local;

    private InMemoryAmazonS3 s3;
    private S3FileSource source;

    @BeforeEach
    void setUp() {
        s3 = new InMemoryAmazonS3()
            .put("nyc-tlc", "trip data/yellow_tripdata_2023-01.parquet", PAYLOAD, MODIFIED)
            .put("nyc-tlc", "trip data/yellow_tripdata_2023-02.parquet", PAYLOAD, MODIFIED)
            .put("nyc-tlc", "trip data/", new byte[0], MODIFIED)
            .put("nyc-tlc", "trip data/year=2023/month=03/green_tripdata_2023-03.parquet", PAYLOAD, MODIFIED)
            .put("nyc-tlc", "misc/taxi_zone_lookup.csv", PAYLOAD, MODIFIED);
        source = new S3FileSource(s3);
    }

    @Nested
    @DisplayName("Listing")
    class Listing {

        @Test
        @DisplayName("lists leaf objects below partitions and skips directory markers")
        void listsLeaves() throws IOException {
            List<Fragment> fragments = source.list(S3Location.parse("nyc-tlc/trip data/"));

            assertThat(fragments).extracting(Fragment::path).containsExactlyInAnyOrder(
                "nyc-tlc/trip data/yellow_tripdata_2023-01.parquet",
                "nyc-tlc/trip data/yellow_tripdata_2023-02.parquet",
                "nyc-tlc/trip data/year=2023/month=03/green_tripdata_2023-03.parquet");
            assertThat(fragments).allSatisfy(f -> {
                assertThat(f.backend()).isEqualTo(Backend.OBJECT_STORE);
                assertThat(f.listedInfo()).hasValueSatisfying(info -> {
                    assertThat(info.getSize()).contains((long) PAYLOAD.length);
                    assertThat(info.getModifiedAt()).contains(MODIFIED);
                });
            });
        }

        @Test
        @DisplayName("follows continuation tokens across pages")
        void followsPages() throws IOException {
            s3.pageSize(1);

            assertThat(source.list(S3Location.parse("s3://nyc-tlc/trip data/"))).hasSize(3);
        }

        @Test
        @DisplayName("wraps client failures")
        void wrapsFailures() {
            s3.failListing(true);

            assertThatThrownBy(() -> source.list(S3Location.parse("nyc-tlc/trip data/")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("s3://nyc-tlc/trip data/");
        }
    }

    @Nested
    @DisplayName("Metadata")
    class Metadata {

        @Test
        @DisplayName("uses the listing without another request")
        void usesListing() throws IOException {
            RemoteFileInfo listed = RemoteFileInfo.builder("nyc-tlc/x").size(1L).build();

            assertThat(source.info(Fragment.objectStore("nyc-tlc/x", listed))).isSameAs(listed);
        }

        @Test
        @DisplayName("asks for object metadata when nothing was listed")
        void fetchesMetadata() throws IOException {
            RemoteFileInfo info = source.info(
                Fragment.objectStore("nyc-tlc/misc/taxi_zone_lookup.csv", null));

            assertThat(info.getSize()).contains((long) PAYLOAD.length);
            assertThat(info.getModifiedAt()).contains(MODIFIED);
            assertThat(info.getMimeType()).contains("application/octet-stream");
            assertThat(info.getResolvedUrl()).contains("s3://nyc-tlc/misc/taxi_zone_lookup.csv");
        }

        @Test
        @DisplayName("reports missing objects as not found")
        void missingObject() {
            assertThatThrownBy(() -> source.info(Fragment.objectStore("nyc-tlc/nothing.parquet", null)))
                .isInstanceOf(RemoteFileNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Transfer")
    class Transfer {

        @Test
        @DisplayName("streams objects in chunks")
        void streamsObject() throws IOException {
            Fragment fragment = source.list(S3Location.parse("nyc-tlc/trip data/yellow")).get(0);
            Path destination = local.resolve("trips").resolve(fragment.fileName());

            long bytes = source.copyTo(fragment, source.info(fragment), destination, new TransferOptions(4, 1));

            assertThat(bytes).isEqualTo(PAYLOAD.length);
            assertThat(Files.readAllBytes(destination)).isEqualTo(PAYLOAD);
            assertThat(PartFiles.partFile(destination)).doesNotExist();
        }

        @Test
        @DisplayName("removes partial output when the read fails")
        void cleansUpOnFailure() {
            s3.failKey("trip data/yellow_tripdata_2023-02.parquet");
            Fragment fragment = Fragment.objectStore("nyc-tlc/trip data/yellow_tripdata_2023-02.parquet", null);
            Path destination = local.resolve("yellow_tripdata_2023-02.parquet");
            RemoteFileInfo info = RemoteFileInfo.builder(fragment.path()).build();

            assertThatThrownBy(() -> source.copyTo(fragment, info, destination, TransferOptions.of(false)))
                .isInstanceOfSatisfying(TransferException.class,
                    e -> assertThat(e.getSource()).isEqualTo("s3://nyc-tlc/trip data/yellow_tripdata_2023-02.parquet"));
            assertThat(destination).doesNotExist();
            assertThat(PartFiles.partFile(destination)).doesNotExist();
        }

        @Test
        @DisplayName("reads byte ranges")
        void readsRange() throws IOException {
            Fragment fragment = Fragment.objectStore("nyc-tlc/misc/taxi_zone_lookup.csv", null);

            assertThat(source.readRange(fragment, 12, 4)).isEqualTo("cdef".getBytes(StandardCharsets.US_ASCII));
            assertThat(source.readRange(fragment, 14, 10)).isEqualTo("ef".getBytes(StandardCharsets.US_ASCII));
        }
    }
}
