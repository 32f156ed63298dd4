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
package com.hellblazer.sensornet.network;

/**
 * Protocol specific role a sensor node plays during a round.
 *
 * @author hal.hildebrand
 */
public enum NodeRole {
    /**
     * No protocol specific responsibility
     */
    NORMAL,

    /**
     * LEACH: aggregates member data and relays it to the base station
     */
    CLUSTER_HEAD,

    /**
     * LEACH: sends sensed data to its cluster head
     */
    CLUSTER_MEMBER,

    /**
     * PEGASIS: relays aggregated data along the chain
     */
    CHAIN_MEMBER,

    /**
     * PEGASIS: performs the single long range transmission of the round
     */
    CHAIN_LEADER,

    /**
     * Directed Diffusion: originates data matching the current interest
     */
    SOURCE
}
