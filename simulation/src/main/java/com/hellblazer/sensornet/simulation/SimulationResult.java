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

import com.hellblazer.sensornet.network.Outcome;

import java.util.List;

/**
 * Everything a finished, or stopped, run produced. Partial runs are reported the same way.
 *
 * @param config        configuration of the run
 * @param metrics       derived statistics
 * @param outcomes      every outcome in emission order
 * @param finalSnapshot network state at the last completed round, null if no round completed
 * @param networkDead   true if the run ended because every node had died
 * @author hal.hildebrand
 */
public record SimulationResult(SimulationConfig config, SimulationMetrics metrics, List<Outcome> outcomes,
                               NetworkSnapshot finalSnapshot, boolean networkDead) {

    public SimulationResult {
        outcomes = List.copyOf(outcomes);
    }

    public int roundsExecuted() {
        return metrics.roundsExecuted();
    }

    @Override
    public String toString() {
        return String.format("SimulationResult[%s, %s, outcomes=%d, networkDead=%s]", config.getProtocol(), metrics,
                             outcomes.size(), networkDead);
    }
}
