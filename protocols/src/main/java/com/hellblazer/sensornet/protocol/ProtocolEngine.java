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
package com.hellblazer.sensornet.protocol;

import com.hellblazer.sensornet.network.Event;
import com.hellblazer.sensornet.network.Outcome;
import com.hellblazer.sensornet.network.SimulationContext;
import com.hellblazer.sensornet.network.Topology;

import java.util.List;

/**
 * Operation contract shared by every routing protocol state machine.
 * <p>
 * The protocol set is fixed, so the contract is sealed over the four engines. The driver calls
 * {@link #onRoundStart} when a round begins, {@link #onEvent} for every event the engine scheduled, and
 * {@link #onRoundEnd} once the round's events up to the boundary have been dispatched. Each call runs to completion
 * and returns the outcomes it produced in the order they happened.
 * <p>
 * An engine instance belongs to exactly one run. All per-node protocol state is kept in arrays indexed by node id.
 *
 * @author hal.hildebrand
 */
public sealed interface ProtocolEngine permits LeachEngine, DirectedDiffusionEngine, GearEngine, PegasisEngine {

    ProtocolKind kind();

    /**
     * Begin a round: assign roles and schedule the round's protocol events.
     *
     * @param context run state, with the round number already set
     * @return outcomes produced while starting the round
     */
    List<Outcome> onRoundStart(SimulationContext context);

    /**
     * Handle one event previously scheduled by this engine.
     *
     * @param event   the event
     * @param context run state
     * @return outcomes produced by the event
     */
    List<Outcome> onEvent(Event event, SimulationContext context);

    /**
     * Finish a round. Roles that only last one round are released here.
     *
     * @param context run state
     * @return outcomes produced while closing the round
     */
    default List<Outcome> onRoundEnd(SimulationContext context) {
        return List.of();
    }

    /**
     * @return true once the protocol can make no further progress
     */
    default boolean isTerminal(Topology topology) {
        return topology.aliveCount() == 0;
    }
}
