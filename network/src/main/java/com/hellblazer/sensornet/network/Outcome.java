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
 * Record emitted by a protocol engine for the metrics collector.
 * <p>
 * Outcomes are immutable and compare by value, so the outcome sequences of two runs can be checked for equality
 * directly.
 *
 * @author hal.hildebrand
 */
public sealed interface Outcome permits Outcome.NodeDied, Outcome.PacketDelivered, Outcome.PacketDropped,
                                        Outcome.RoundCompleted {

    enum Kind {
        NODE_DIED, PACKET_DELIVERED, PACKET_DROPPED, ROUND_COMPLETED
    }

    /**
     * @return simulation time at which the outcome happened
     */
    double time();

    /**
     * @return round during which the outcome happened
     */
    int round();

    Kind kind();

    /**
     * A node exhausted its energy.
     *
     * @param time   simulation time
     * @param round  round number
     * @param nodeId the node that died
     */
    record NodeDied(double time, int round, int nodeId) implements Outcome {
        @Override
        public Kind kind() {
            return Kind.NODE_DIED;
        }
    }

    /**
     * A packet reached its destination.
     *
     * @param time       simulation time
     * @param round      round number
     * @param packetId   packet id
     * @param packetKind traffic class
     * @param source     originating node
     * @param hops       transmissions taken
     * @param bits       payload size
     * @param latency    time from origination to delivery
     */
    record PacketDelivered(double time, int round, long packetId, PacketKind packetKind, int source, int hops,
                           int bits, double latency) implements Outcome {
        @Override
        public Kind kind() {
            return Kind.PACKET_DELIVERED;
        }
    }

    /**
     * A packet was lost.
     *
     * @param time       simulation time
     * @param round      round number
     * @param packetId   packet id
     * @param packetKind traffic class
     * @param source     originating node
     * @param atNode     node holding the packet when it was lost
     * @param reason     cause
     */
    record PacketDropped(double time, int round, long packetId, PacketKind packetKind, int source, int atNode,
                         DropReason reason) implements Outcome {
        @Override
        public Kind kind() {
            return Kind.PACKET_DROPPED;
        }
    }

    /**
     * A round boundary was reached.
     *
     * @param time           simulation time of the boundary
     * @param round          the completed round
     * @param aliveNodes     live nodes at the boundary
     * @param residualEnergy total remaining energy at the boundary
     */
    record RoundCompleted(double time, int round, int aliveNodes, double residualEnergy) implements Outcome {
        @Override
        public Kind kind() {
            return Kind.ROUND_COMPLETED;
        }
    }
}
