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

import com.hellblazer.sensornet.network.DropReason;

import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Statistics of one run.
 *
 * @param roundsExecuted        rounds completed
 * @param firstDeathRound       round of the first node death
 * @param halfDeathRound        round by which half the nodes had died
 * @param lifetime              round of the last death if every node died, otherwise the rounds executed
 * @param packetsDelivered      packets that reached their destination
 * @param packetsDropped        packets lost on the way
 * @param totalEnergyConsumed   joules spent by all nodes
 * @param meanHops              mean hop count of delivered packets
 * @param meanLatency           mean simulation time from origination to delivery
 * @param aliveHistory          live nodes at the end of each round
 * @param residualEnergyHistory remaining energy at the end of each round
 * @param dropsByReason         dropped packets per reason
 * @author hal.hildebrand
 */
public record SimulationMetrics(int roundsExecuted, OptionalInt firstDeathRound, OptionalInt halfDeathRound,
                                int lifetime, long packetsDelivered, long packetsDropped, double totalEnergyConsumed,
                                double meanHops, double meanLatency, List<Integer> aliveHistory,
                                List<Double> residualEnergyHistory, Map<DropReason, Long> dropsByReason) {

    public SimulationMetrics {
        aliveHistory = List.copyOf(aliveHistory);
        residualEnergyHistory = List.copyOf(residualEnergyHistory);
        dropsByReason = Map.copyOf(dropsByReason);
    }

    /**
     * @return delivered packets over all packets that reached an end, zero if none did
     */
    public double deliveryRate() {
        long total = packetsDelivered + packetsDropped;
        return total == 0 ? 0.0 : (double) packetsDelivered / total;
    }

    /**
     * @return delivered packets per joule consumed, zero if nothing was consumed
     */
    public double energyEfficiency() {
        return totalEnergyConsumed <= 0.0 ? 0.0 : packetsDelivered / totalEnergyConsumed;
    }

    public long drops(DropReason reason) {
        return dropsByReason.getOrDefault(reason, 0L);
    }

    @Override
    public String toString() {
        return String.format("SimulationMetrics[rounds=%d, firstDeath=%s, halfDeath=%s, lifetime=%d, delivered=%d, "
                             + "dropped=%d, rate=%.3f, consumed=%.4fJ, efficiency=%.1f/J, meanHops=%.2f]",
                             roundsExecuted, firstDeathRound, halfDeathRound, lifetime, packetsDelivered,
                             packetsDropped, deliveryRate(), totalEnergyConsumed, energyEfficiency(), meanHops);
    }
}
