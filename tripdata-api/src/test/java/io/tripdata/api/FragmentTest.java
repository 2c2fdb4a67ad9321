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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Fragment")
class FragmentTest {

    @Test
    @DisplayName("object-store fragments keep their listed metadata")
    void objectStoreKeepsListing() {
        RemoteFileInfo listed = RemoteFileInfo.builder("nyc-tlc/trip data/green_tripdata_2020-02.parquet")
            .size(42L)
            .modifiedAt(Instant.EPOCH)
            .build();
        Fragment fragment = Fragment.objectStore("nyc-tlc/trip data/green_tripdata_2020-02.parquet", listed);

        assertThat(fragment.backend()).isEqualTo(Backend.OBJECT_STORE);
        assertThat(fragment.fileName()).isEqualTo("green_tripdata_2020-02.parquet");
        assertThat(fragment.identity().month()).isEqualTo(2);
        assertThat(fragment.listedInfo()).contains(listed);
    }

    @Test
    @DisplayName("malformed names fail only when the identity is asked for")
    void identityIsLazy() {
        Fragment fragment = Fragment.web("https://example.test/misc/readme.txt");

        assertThat(fragment.fileName()).isEqualTo("readme.txt");
        assertThatThrownBy(fragment::identity).isInstanceOf(FragmentParseException.class);
    }

    @Test
    @DisplayName("should reject empty paths")
    void shouldRejectEmptyPath() {
        assertThatThrownBy(() -> Fragment.web(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("remote info should drop empty checksum values")
    void infoDropsEmptyChecksums() {
        RemoteFileInfo info = RemoteFileInfo.builder("x")
            .checksum(RemoteFileInfo.ETAG, "\"abc\"")
            .checksum(RemoteFileInfo.DIGEST, "")
            .build();

        assertThat(info.getChecksums()).containsOnlyKeys(RemoteFileInfo.ETAG);
        assertThat(info.getSize()).isEmpty();
        assertThat(info.toBuilder().size(3L).build().getSize()).contains(3L);
    }
}
