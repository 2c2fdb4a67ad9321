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
import io.tripdata.api.RemoteFileSource;
import io.tripdata.api.SyncAction;
import io.tripdata.api.SyncOutcome;
import io.tripdata.api.SyncReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/// Brings a local directory up to date with a set of remote fragments.
///
/// Each fragment is handled by its own task on a bounded pool:
///
/// 1. the destination is `localRoot/<file name>`
/// 2. remote metadata comes from the fragment's backend
/// 3. [SyncAction#decide] picks skip, create or update from existence and modification times
/// 4. create and update copy the file through the backend
///
/// Any exception inside a task becomes a failed [SyncOutcome] for that fragment; sibling tasks
/// carry on. Fragments that would share a destination are failed up front, so no two tasks ever
/// write the same file.
public class SyncOrchestrator {
    private static final Logger classLogger = LogManager.getLogger(SyncOrchestrator.class);

    private final Map<Backend, RemoteFileSource> sources;
    private final SyncSettings settings;
    private final Logger logger;

    /// @param sources one source per backend that fragments may come from
    /// @param settings run settings
    public SyncOrchestrator(Map<Backend, RemoteFileSource> sources, SyncSettings settings) {
        this(sources, settings, classLogger);
    }

    /// @param sources one source per backend that fragments may come from
    /// @param settings run settings
    /// @param logger where per-fragment progress is logged
    public SyncOrchestrator(Map<Backend, RemoteFileSource> sources, SyncSettings settings, Logger logger) {
        this.sources = new EnumMap<>(Backend.class);
        this.sources.putAll(sources);
        this.settings = settings;
        this.logger = logger;
    }

    /// @return the run settings
    public SyncSettings settings() {
        return settings;
    }

    /// Synchronise fragments in parallel.
    ///
    /// @param fragments the fragments to bring up to date
    /// @return one outcome per fragment
    public SyncReport sync(List<Fragment> fragments) {
        if (fragments.isEmpty()) {
            return SyncReport.empty();
        }
        List<SyncOutcome> outcomes = new ArrayList<>();
        List<Fragment> runnable = new ArrayList<>();
        Set<String> claimed = new HashSet<>();
        for (Fragment fragment : fragments) {
            if (claimed.add(fragment.fileName())) {
                runnable.add(fragment);
            } else {
                logger.error("Skipping {}: another fragment already targets {}", fragment.path(), fragment.fileName());
                outcomes.add(SyncOutcome.failed(fragment, settings.localRoot().resolve(fragment.fileName()),
                    new IllegalStateException("duplicate destination " + fragment.fileName())));
            }
        }

        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(settings.workers(), runnable.size()), new SyncThreadFactory());
        try {
            List<CompletableFuture<SyncOutcome>> tasks = new ArrayList<>();
            for (Fragment fragment : runnable) {
                tasks.add(CompletableFuture.supplyAsync(() -> syncOne(fragment), executor));
            }
            CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0])).join();
            for (CompletableFuture<SyncOutcome> task : tasks) {
                outcomes.add(task.join());
            }
        } finally {
            executor.shutdown();
        }
        return new SyncReport(outcomes);
    }

    /// Synchronise a single fragment on the calling thread.
    ///
    /// @param fragment the fragment
    /// @return its outcome; never throws
    public SyncOutcome syncOne(Fragment fragment) {
        Path destination = null;
        try {
            String name = fragment.fileName();
            if (name.isEmpty()) {
                throw new IllegalArgumentException("fragment " + fragment.path() + " has no file name");
            }
            destination = settings.localRoot().resolve(name);
            PartFiles.createParents(destination);
            logger.info("Downloading {} ...", name);

            RemoteFileSource source = sourceFor(fragment);
            RemoteFileInfo info = source.info(fragment);
            boolean exists = Files.exists(destination);
            Instant localModified = exists ? Files.getLastModifiedTime(destination).toInstant() : null;
            SyncAction action = SyncAction.decide(exists, localModified, info.getModifiedAt().orElse(null));

            if (action == SyncAction.SKIP) {
                logger.info("{} is up to date.", name);
                return SyncOutcome.skipped(fragment, destination);
            }
            if (action == SyncAction.CREATE) {
                logger.info("{} does not exist. Try downloading ...", name);
            } else {
                logger.info("{} already exists. Try updating ...", name);
            }
            long bytes = source.copyTo(fragment, info, destination, settings.transferOptions());
            logger.info("Downloading {} finished.", name);
            return action == SyncAction.CREATE
                ? SyncOutcome.downloaded(fragment, destination, bytes)
                : SyncOutcome.updated(fragment, destination, bytes);
        } catch (Exception e) {
            logger.error("Failed to sync {} to {}: {}", fragment.path(), destination, e.toString());
            logger.debug("Failure detail for {}", fragment.path(), e);
            return SyncOutcome.failed(fragment, destination, e);
        }
    }

    private RemoteFileSource sourceFor(Fragment fragment) {
        RemoteFileSource source = sources.get(fragment.backend());
        if (source == null) {
            throw new IllegalStateException("No source configured for backend " + fragment.backend());
        }
        return source;
    }

    private static final class SyncThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "tripdata-sync-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
