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
 * A packet in flight.
 * <p>
 * {@code hops} counts the transmissions performed so far, including the one to {@code nextHop}. The next hop may equal
 * the destination, which is usually {@link Topology#BASE_STATION}.
 *
 * @param id          unique id within a run
 * @param kind        traffic class
 * @param source      node that originated the packet
 * @param sender      node currently transmitting the packet
 * @param nextHop     node the packet is addressed to on this hop
 * @param destination final destination
 * @param bits        payload size in bits
 * @param hops        transmissions so far
 * @param createdAt   simulation time of origination
 * @author hal.hildebrand
 */
public record Packet(long id, PacketKind kind, int source, int sender, int nextHop, int destination, int bits,
                     int hops, double createdAt) {

    public Packet {
        if (bits <= 0) {
            throw new IllegalArgumentException("Packet size must be positive: " + bits);
        }
        if (hops < 1) {
            throw new IllegalArgumentException("A packet in flight has at least one hop: " + hops);
        }
    }

    /**
     * Hand the packet on: the current next hop becomes the sender.
     *
     * @param to the new next hop
     * @return packet with one more hop
     */
    public Packet relay(int to) {
        return new Packet(id, kind, source, nextHop, to, destination, bits, hops + 1, createdAt);
    }

    /**
     * Re-address the current hop without counting a transmission, for fallback paths chosen before sending.
     */
    public Packet redirect(int to) {
        return new Packet(id, kind, source, sender, to, destination, bits, hops, createdAt);
    }

    /**
     * @return true if this hop reaches the final destination
     */
    public boolean isFinalHop() {
        return nextHop == destination;
    }
}
