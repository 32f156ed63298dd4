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

/**
 * Receives the outcomes of a run as they are emitted.
 * <p>
 * Outcomes arrive synchronously on the simulation thread, in the order they were produced. Exceptions thrown by a
 * listener propagate out of the simulation.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface OutcomeListener {

    /**
     * Only forward outcomes of one kind.
     */
    static OutcomeListener filtered(Outcome.Kind kind, OutcomeListener listener) {
        return outcome -> {
            if (outcome.kind() == kind) {
                listener.onOutcome(outcome);
            }
        };
    }

    void onOutcome(Outcome outcome);
}
