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

import io.tripdata.api.Backend;
import io.tripdata.api.Fragment;
import io.tripdata.api.PartFiles;
import io.tripdata.api.RemoteFileInfo;
import io.tripdata.api.RemoteFileNotFoundException;
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.TransferException;
import io.tripdata.api.TransferOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/// Web backend over an in-memory map of file name to content, for orchestration tests.
public class InMemoryFileSource implements RemoteFileSource {

    public static final String BASE = "https://files.example/trip-data/";

    private final Map<String, byte[]> contents = new ConcurrentHashMap<>();
    private final Map<String, Instant> modified = new ConcurrentHashMap<>();
    private final Map<String, Boolean> failingCopies = new ConcurrentHashMap<>();
    private final List<String> copied = new CopyOnWriteArrayList<>();

    public InMemoryFileSource put(String name, byte[] data, Instant modifiedAt) {
        contents.put(name, data);
        if (modifiedAt != null) {
            modified.put(name, modifiedAt);
        } else {
            modified.remove(name);
        }
        return this;
    }

    public InMemoryFileSource failCopy(String name) {
        failingCopies.put(name, Boolean.TRUE);
        return this;
    }

    public List<String> copied() {
        return copied;
    }

    public static Fragment fragment(String name) {
        return Fragment.web(BASE + name);
    }

    @Override
    public Backend backend() {
        return Backend.WEB;
    }

    @Override
    public RemoteFileInfo info(Fragment fragment) throws IOException {
        byte[] data = contents.get(fragment.fileName());
        if (data == null) {
            throw new RemoteFileNotFoundException(fragment.path(), null);
        }
        return RemoteFileInfo.builder(fragment.fileName())
            .size((long) data.length)
            .modifiedAt(modified.get(fragment.fileName()))
            .supportsRanges(true)
            .build();
    }

    @Override
    public long copyTo(Fragment fragment, RemoteFileInfo info, Path destination, TransferOptions options)
        throws TransferException {
        String name = fragment.fileName();
        Path part = PartFiles.partFile(destination);
        try {
            PartFiles.createParents(destination);
            byte[] data = contents.get(name);
            if (failingCopies.containsKey(name)) {
                Files.write(part, Arrays.copyOf(data, data.length / 2));
                throw new IOException("connection reset");
            }
            Files.write(part, data);
            PartFiles.moveIntoPlace(part, destination);
            copied.add(name);
            return data.length;
        } catch (IOException e) {
            PartFiles.deletePartial(part);
            throw new TransferException(fragment.path(), destination, e);
        }
    }

    @Override
    public byte[] readRange(Fragment fragment, long offset, int length) throws IOException {
        byte[] data = contents.get(fragment.fileName());
        if (data == null) {
            throw new RemoteFileNotFoundException(fragment.path(), null);
        }
        int from = (int) Math.min(offset, data.length);
        int to = (int) Math.min((long) from + length, data.length);
        return Arrays.copyOfRange(data, from, to);
    }
}
