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

import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;

import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Per-run simulation state handed explicitly to every protocol engine call.
 * <p>
 * A context owns exactly one topology, energy model, scheduler and random stream. Nothing here is static or shared
 * between runs, so independent runs can execute on separate threads without synchronization. Within a run all
 * mutation happens on the single dispatching thread.
 * <p>
 * The radio helpers charge energy through the {@link EnergyModel}, mark exhausted nodes dead in the
 * {@link Topology} and append the resulting {@link Outcome}s to the caller's list.
 *
 * @author hal.hildebrand
 */
public final class SimulationContext {

    /**
     * Result of moving a packet across one hop.
     */
    public enum HopResult {
        /**
         * The next hop received the packet and now holds it
         */
        ARRIVED,

        /**
         * The hop reached the final destination
         */
        DELIVERED,

        /**
         * The packet was lost on this hop; a drop outcome was emitted
         */
        DROPPED
    }

    /**
     * Radio and pacing settings shared by all protocols of a run.
     *
     * @param radioRange    maximum single hop distance between sensor nodes, meters
     * @param dataBits      size of a sensed data packet
     * @param controlBits   size of advertisements, joins and reinforcements
     * @param floodBits     size of interest and query floods
     * @param roundDuration simulation time between round starts
     */
    public record Settings(double radioRange, int dataBits, int controlBits, int floodBits, double roundDuration) {
        public Settings {
            if (!(radioRange > 0)) {
                throw new ConfigurationException("radioRange", "must be positive: " + radioRange);
            }
            if (dataBits <= 0 || controlBits <= 0 || floodBits <= 0) {
                throw new ConfigurationException("packetBits", "packet sizes must be positive");
            }
            if (!(roundDuration > 0)) {
                throw new ConfigurationException("roundDuration", "must be positive: " + roundDuration);
            }
        }
    }

    private final Topology       topology;
    private final EnergyModel    energyModel;
    private final EventScheduler scheduler;
    private final Random         random;
    private final Settings       settings;
    private int                  round;
    private double               roundStartTime;
    private long                 nextPacketId;

    public SimulationContext(Topology topology, EnergyModel energyModel, EventScheduler scheduler, Random random,
                             Settings settings) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.energyModel = Objects.requireNonNull(energyModel, "energyModel");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.random = Objects.requireNonNull(random, "random");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Topology topology() {
        return topology;
    }

    public EnergyModel energyModel() {
        return energyModel;
    }

    public EventScheduler scheduler() {
        return scheduler;
    }

    /**
     * @return the random stream of this run
     */
    public Random random() {
        return random;
    }

    public Settings settings() {
        return settings;
    }

    public int round() {
        return round;
    }

    public double roundStartTime() {
        return roundStartTime;
    }

    /**
     * @return simulation time at which the current round ends
     */
    public double roundEndTime() {
        return roundStartTime + settings.roundDuration();
    }

    public double now() {
        return scheduler.now();
    }

    /**
     * Called by the driver when a round starts.
     */
    public void beginRound(int round) {
        this.round = round;
        this.roundStartTime = scheduler.now();
    }

    /**
     * Schedule a payload relative to the current clock.
     */
    public EventHandle schedule(double delay, EventPayload payload) {
        return scheduler.schedule(scheduler.now() + delay, payload);
    }

    /**
     * Create a packet for its first hop. The caller pays for sensing separately.
     */
    public Packet originate(PacketKind kind, int source, int nextHop, int destination, int bits) {
        return new Packet(nextPacketId++, kind, source, source, nextHop, destination, bits, 1, scheduler.now());
    }

    /**
     * Charge an arbitrary cost to a node.
     */
    public EnergyDraw charge(int nodeId, double cost, List<Outcome> out) {
        if (nodeId == Topology.BASE_STATION) {
            return EnergyDraw.unlimited();
        }
        var draw = energyModel.apply(topology.node(nodeId), cost);
        if (draw.died()) {
            topology.markDead(nodeId);
            out.add(new Outcome.NodeDied(scheduler.now(), round, nodeId));
        }
        return draw;
    }

    /**
     * Charge a point to point transmission.
     */
    public EnergyDraw transmit(int from, int to, int bits, List<Outcome> out) {
        if (from == Topology.BASE_STATION) {
            return EnergyDraw.unlimited();
        }
        return charge(from, energyModel.transmitCost(topology.distance(from, to), bits), out);
    }

    /**
     * Charge a broadcast reaching every node within the given radius.
     */
    public EnergyDraw broadcast(int from, double radius, int bits, List<Outcome> out) {
        if (from == Topology.BASE_STATION) {
            return EnergyDraw.unlimited();
        }
        return charge(from, energyModel.transmitCost(radius, bits), out);
    }

    public EnergyDraw receive(int nodeId, int bits, List<Outcome> out) {
        return charge(nodeId, energyModel.receiveCost(bits), out);
    }

    public EnergyDraw sense(int nodeId, int bits, List<Outcome> out) {
        return charge(nodeId, energyModel.sensingCost(bits), out);
    }

    public EnergyDraw aggregate(int nodeId, int bits, List<Outcome> out) {
        return charge(nodeId, energyModel.aggregationCost(bits), out);
    }

    /**
     * Move a packet from its sender to its next hop.
     * <p>
     * The sender pays for the transmission first. If it cannot, it dies and the packet is dropped. A next hop that
     * is already dead loses the packet. Otherwise the receiver pays for reception, and a receiver that cannot pay dies
     * with the packet. Reaching the destination emits a delivery outcome.
     */
    public HopResult hop(Packet packet, List<Outcome> out) {
        var sent = transmit(packet.sender(), packet.nextHop(), packet.bits(), out);
        if (!sent.sufficient()) {
            dropped(packet, packet.sender(), DropReason.SENDER_DEPLETED, out);
            return HopResult.DROPPED;
        }
        if (!topology.isAlive(packet.nextHop())) {
            dropped(packet, packet.nextHop(), DropReason.NEXT_HOP_DEAD, out);
            return HopResult.DROPPED;
        }
        var received = receive(packet.nextHop(), packet.bits(), out);
        if (!received.sufficient()) {
            dropped(packet, packet.nextHop(), DropReason.RECEIVER_DEPLETED, out);
            return HopResult.DROPPED;
        }
        if (packet.isFinalHop()) {
            delivered(packet, out);
            return HopResult.DELIVERED;
        }
        return HopResult.ARRIVED;
    }

    public void delivered(Packet packet, List<Outcome> out) {
        var now = scheduler.now();
        out.add(new Outcome.PacketDelivered(now, round, packet.id(), packet.kind(), packet.source(), packet.hops(),
                                            packet.bits(), now - packet.createdAt()));
    }

    public void dropped(Packet packet, int atNode, DropReason reason, List<Outcome> out) {
        out.add(new Outcome.PacketDropped(scheduler.now(), round, packet.id(), packet.kind(), packet.source(), atNode,
                                          reason));
    }

    @Override
    public String toString() {
        return String.format("SimulationContext{round=%d, %s, %s}", round, scheduler, topology);
    }
}
