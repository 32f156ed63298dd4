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
 * Why a packet failed to reach its destination.
 *
 * @author hal.hildebrand
 */
public enum DropReason {
    /**
     * The sender could not pay for the transmission and died on it
     */
    SENDER_DEPLETED,

    /**
     * The receiver could not pay for the reception and died on it
     */
    RECEIVER_DEPLETED,

    /**
     * The next hop died after the packet was addressed to it
     */
    NEXT_HOP_DEAD,

    /**
     * No live neighbor leads toward the destination (isolated node or partition)
     */
    NO_ROUTE,

    /**
     * The packet took more hops than the network has nodes
     */
    HOP_LIMIT
}
