/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Sensornet.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.sensornet.simulation;

import com.hellblazer.sensornet.protocol.ProtocolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs one configuration under several protocols in parallel. Runs share nothing but the immutable configuration, so
 * the comparison sees the same deployment and seed for every protocol.
 *
 * @author hal.hildebrand
 */
public final class ProtocolComparison implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProtocolComparison.class);

    private final ExecutorService executor;
    private final boolean         ownsExecutor;

    /**
     * Compare on a private pool with one thread per available processor.
     */
    public ProtocolComparison() {
        this(Executors.newFixedThreadPool(Math.max(1, Runtime.getRuntime().availableProcessors())), true);
    }

    /**
     * Compare on a caller supplied executor, which is not shut down by {@link #close()}.
     */
    public ProtocolComparison(ExecutorService executor) {
        this(executor, false);
    }

    private ProtocolComparison(ExecutorService executor, boolean ownsExecutor) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
    }

    /**
     * Run every protocol.
     *
     * @return results keyed by protocol, in protocol order
     */
    public Map<ProtocolKind, SimulationResult> compare(SimulationConfig config) {
        return compare(config, EnumSet.allOf(ProtocolKind.class));
    }

    /**
     * Run the given protocols over the same configuration.
     *
     * @return results keyed by protocol, in protocol order
     */
    public Map<ProtocolKind, SimulationResult> compare(SimulationConfig config, Collection<ProtocolKind> protocols) {
        Objects.requireNonNull(config, "config");
        var futures = new EnumMap<ProtocolKind, CompletableFuture<SimulationResult>>(ProtocolKind.class);
        for (var kind : protocols) {
            var variant = config.withProtocol(kind);
            futures.put(kind, CompletableFuture.supplyAsync(() -> new Simulation(variant).run(), executor));
        }
        try {
            CompletableFuture.allOf(futures.values().toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("Protocol comparison failed", e.getCause());
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw e;
        }
        var results = new EnumMap<ProtocolKind, SimulationResult>(ProtocolKind.class);
        futures.forEach((kind, future) -> results.put(kind, future.join()));
        log.debug("Compared {} protocols", results.size());
        return results;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for comparison pool shutdown", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
