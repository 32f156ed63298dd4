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

import com.hellblazer.sensornet.common.DeterministicMath;
import com.hellblazer.sensornet.network.DropReason;
import com.hellblazer.sensornet.network.Outcome;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Derives {@link SimulationMetrics} from a stream of outcomes. It can be attached to a running simulation or fed a
 * recorded {@link OutcomeLog} afterwards, with identical results.
 *
 * @author hal.hildebrand
 */
public final class MetricsCollector implements OutcomeListener {

    private final int                    nodeCount;
    private final double                 initialEnergy;
    private final List<Integer>          aliveHistory    = new ArrayList<>();
    private final List<Double>           residualHistory = new ArrayList<>();
    private final Map<DropReason, Long>  drops           = new EnumMap<>(DropReason.class);
    private final List<Double>           latencies       = new ArrayList<>();
    private int                          deaths;
    private int                          firstDeath      = -1;
    private int                          halfDeath       = -1;
    private int                          lastDeath       = -1;
    private long                         delivered;
    private long                         dropped;
    private long                         hops;
    private double                       residual;

    /**
     * @param nodeCount     nodes in the network
     * @param initialEnergy total energy of all nodes at deployment
     */
    public MetricsCollector(int nodeCount, double initialEnergy) {
        this.nodeCount = nodeCount;
        this.initialEnergy = initialEnergy;
        this.residual = initialEnergy;
    }

    public static MetricsCollector of(SimulationConfig config) {
        return new MetricsCollector(config.getNodeCount(), config.getNodeCount() * config.getInitialEnergy());
    }

    @Override
    public void onOutcome(Outcome outcome) {
        if (outcome instanceof Outcome.NodeDied died) {
            deaths++;
            if (firstDeath < 0) {
                firstDeath = died.round();
            }
            if (halfDeath < 0 && 2 * deaths >= nodeCount) {
                halfDeath = died.round();
            }
            lastDeath = died.round();
        } else if (outcome instanceof Outcome.PacketDelivered packet) {
            delivered++;
            hops += packet.hops();
            latencies.add(packet.latency());
        } else if (outcome instanceof Outcome.PacketDropped packet) {
            dropped++;
            drops.merge(packet.reason(), 1L, Long::sum);
        } else if (outcome instanceof Outcome.RoundCompleted round) {
            aliveHistory.add(round.aliveNodes());
            residualHistory.add(round.residualEnergy());
            residual = round.residualEnergy();
        }
    }

    public int deaths() {
        return deaths;
    }

    /**
     * @return metrics of everything observed so far
     */
    public SimulationMetrics metrics() {
        int rounds = aliveHistory.size();
        int lifetime = deaths >= nodeCount && lastDeath >= 0 ? lastDeath : rounds;
        double meanHops = delivered == 0 ? 0.0 : (double) hops / delivered;
        double meanLatency = 0.0;
        if (!latencies.isEmpty()) {
            var values = new double[latencies.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = latencies.get(i);
            }
            meanLatency = DeterministicMath.stableSum(values) / values.length;
        }
        return new SimulationMetrics(rounds, optional(firstDeath), optional(halfDeath), lifetime, delivered, dropped,
                                     Math.max(0.0, initialEnergy - residual), meanHops, meanLatency, aliveHistory,
                                     residualHistory, drops);
    }

    private static OptionalInt optional(int round) {
        return round < 0 ? OptionalInt.empty() : OptionalInt.of(round);
    }
}
