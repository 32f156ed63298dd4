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

import com.hellblazer.sensornet.network.*;
import com.hellblazer.sensornet.protocol.ProtocolEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;

/**
 * Drives one run of a routing protocol over a sensor network.
 * <p>
 * The driver owns round pacing. Round {@code r} starts with a {@link RoundStart} event at {@code r * roundDuration}.
 * Every event earlier than the next boundary is dispatched to the engine in time order, then the engine closes the
 * round, the clock is moved to the boundary and a {@link Outcome.RoundCompleted} outcome is emitted together with a
 * {@link NetworkSnapshot}. Events scheduled at or past the boundary stay queued for later rounds. The run stops when
 * the engine reports the network dead or the round horizon is reached.
 * <p>
 * A simulation is single threaded and owns its topology, scheduler and random stream exclusively, so independent
 * instances can run concurrently without coordination.
 *
 * @author hal.hildebrand
 */
public final class Simulation {

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private final SimulationConfig                config;
    private final Topology                        topology;
    private final EventScheduler                  scheduler;
    private final SimulationContext               context;
    private final ProtocolEngine                  engine;
    private final OutcomeLog                      outcomes           = new OutcomeLog();
    private final MetricsCollector                metrics;
    private final List<OutcomeListener>           listeners          = new ArrayList<>();
    private final List<Consumer<NetworkSnapshot>> snapshotListeners = new ArrayList<>();
    private NetworkSnapshot                       lastSnapshot;
    private int                                   round;
    private boolean                               finished;
    private boolean                               networkDead;

    public Simulation(SimulationConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.topology = config.createTopology();
        this.scheduler = new EventScheduler();
        this.context = new SimulationContext(topology, config.createEnergyModel(), scheduler,
                                             new Random(config.getRandomSeed()), config.settings());
        this.engine = config.createEngine();
        this.metrics = MetricsCollector.of(config);
    }

    /**
     * Run to completion.
     *
     * @return the result, including partial results if the horizon ended the run
     */
    public SimulationResult run() {
        log.info("Starting {} with {} nodes, seed {}, horizon {}", engine.kind(), topology.size(),
                 config.getRandomSeed(), config.getRoundHorizon());
        boolean more = true;
        while (more) {
            more = step();
        }
        var result = result();
        log.info("{} finished after {} rounds: first death {}, delivered {}, dropped {}", engine.kind(),
                 result.roundsExecuted(), result.metrics().firstDeathRound(), result.metrics().packetsDelivered(),
                 result.metrics().packetsDropped());
        return result;
    }

    /**
     * Execute one round.
     *
     * @return true if another round remains
     */
    public boolean step() {
        if (finished) {
            return false;
        }
        double duration = config.getRoundDuration();
        double boundary = (round + 1) * duration;
        scheduler.schedule(round * duration, new RoundStart(round));
        while (true) {
            var next = scheduler.peekTime();
            if (next.isEmpty() || next.getAsDouble() >= boundary) {
                break;
            }
            var event = scheduler.popNext().orElseThrow();
            log.trace("t={} dispatch {}", event.time(), event.payload());
            if (event.payload() instanceof RoundStart start) {
                context.beginRound(start.round());
                emit(engine.onRoundStart(context));
            } else {
                emit(engine.onEvent(event, context));
            }
        }
        emit(engine.onRoundEnd(context));
        scheduler.advanceTo(boundary);
        emit(List.of(new Outcome.RoundCompleted(scheduler.now(), round, topology.aliveCount(),
                                                topology.residualEnergy())));
        lastSnapshot = NetworkSnapshot.of(round, scheduler.now(), topology);
        for (var listener : snapshotListeners) {
            listener.accept(lastSnapshot);
        }
        round++;
        networkDead = engine.isTerminal(topology);
        if (networkDead) {
            log.debug("Network dead after round {}", round - 1);
        }
        finished = networkDead || round >= config.getRoundHorizon();
        return !finished;
    }

    /**
     * @return the result of the rounds executed so far
     */
    public SimulationResult result() {
        return new SimulationResult(config, metrics.metrics(), outcomes.outcomes(), lastSnapshot, networkDead);
    }

    public Simulation addListener(OutcomeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public Simulation addSnapshotListener(Consumer<NetworkSnapshot> listener) {
        snapshotListeners.add(Objects.requireNonNull(listener, "listener"));
        return this;
    }

    public SimulationConfig config() {
        return config;
    }

    public OutcomeLog outcomes() {
        return outcomes;
    }

    public ProtocolEngine engine() {
        return engine;
    }

    /**
     * @return the network state at the last completed round, null before the first round
     */
    public NetworkSnapshot lastSnapshot() {
        return lastSnapshot;
    }

    public int roundsExecuted() {
        return round;
    }

    public boolean isFinished() {
        return finished;
    }

    Topology topology() {
        return topology;
    }

    private void emit(List<Outcome> emitted) {
        for (var outcome : emitted) {
            outcomes.append(outcome);
            metrics.onOutcome(outcome);
            for (var listener : listeners) {
                listener.onOutcome(outcome);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("Simulation{%s, round=%d, %s}", engine.kind(), round, scheduler);
    }
}
