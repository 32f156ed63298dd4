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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SimulationContextTest {

    private Topology          topology;
    private EnergyModel       model;
    private SimulationContext context;

    @BeforeEach
    void setUp() {
        topology = new Topology(List.of(new Point2d(0, 0), new Point2d(10, 0), new Point2d(20, 0)),
                                new Point2d(30, 0), 0.5);
        model = EnergyModel.defaultModel();
        context = new SimulationContext(topology, model, new EventScheduler(), new Random(1),
                                        new SimulationContext.Settings(30.0, 4000, 50, 100, 100.0));
        context.beginRound(0);
    }

    @Test
    void testHopChargesSenderAndReceiver() {
        var out = new ArrayList<Outcome>();
        var packet = context.originate(PacketKind.DATA, 0, 1, Topology.BASE_STATION, 4000);
        assertEquals(SimulationContext.HopResult.ARRIVED, context.hop(packet, out));
        assertTrue(out.isEmpty());
        assertEquals(0.5 - model.transmitCost(10.0, 4000), topology.node(0).energy(), 1e-15);
        assertEquals(0.5 - model.receiveCost(4000), topology.node(1).energy(), 1e-15);
    }

    @Test
    void testFinalHopDelivers() {
        var out = new ArrayList<Outcome>();
        var packet = context.originate(PacketKind.DATA, 2, Topology.BASE_STATION, Topology.BASE_STATION, 4000);
        assertEquals(SimulationContext.HopResult.DELIVERED, context.hop(packet, out));
        assertEquals(1, out.size());
        var delivered = assertInstanceOf(Outcome.PacketDelivered.class, out.get(0));
        assertEquals(2, delivered.source());
        assertEquals(1, delivered.hops());
    }

    @Test
    void testInsufficientEnergyKillsSenderAndDropsPacket() {
        // leave the sender less than one transmission
        model.apply(topology.node(0), 0.5 - model.transmitCost(10.0, 4000) / 2);
        var out = new ArrayList<Outcome>();
        var packet = context.originate(PacketKind.DATA, 0, 1, Topology.BASE_STATION, 4000);

        assertEquals(SimulationContext.HopResult.DROPPED, context.hop(packet, out));
        assertEquals(2, out.size());
        var died = assertInstanceOf(Outcome.NodeDied.class, out.get(0));
        assertEquals(0, died.nodeId());
        var dropped = assertInstanceOf(Outcome.PacketDropped.class, out.get(1));
        assertEquals(DropReason.SENDER_DEPLETED, dropped.reason());
        assertEquals(packet.id(), dropped.packetId());
        assertTrue(out.stream().noneMatch(o -> o instanceof Outcome.PacketDelivered));
        assertFalse(topology.isAlive(0));
        assertEquals(0.5, topology.node(1).energy(), "the receiver pays nothing for a packet never sent");
    }

    @Test
    void testDeadNextHopDropsPacket() {
        topology.markDead(1);
        var out = new ArrayList<Outcome>();
        var packet = context.originate(PacketKind.DATA, 0, 1, Topology.BASE_STATION, 4000);
        assertEquals(SimulationContext.HopResult.DROPPED, context.hop(packet, out));
        var dropped = assertInstanceOf(Outcome.PacketDropped.class, out.get(0));
        assertEquals(DropReason.NEXT_HOP_DEAD, dropped.reason());
        assertEquals(1, dropped.atNode());
    }

    @Test
    void testReceiverDepletion() {
        model.apply(topology.node(1), 0.5 - model.receiveCost(4000) / 2);
        var out = new ArrayList<Outcome>();
        var packet = context.originate(PacketKind.DATA, 0, 1, Topology.BASE_STATION, 4000);
        assertEquals(SimulationContext.HopResult.DROPPED, context.hop(packet, out));
        assertInstanceOf(Outcome.NodeDied.class, out.get(0));
        assertEquals(DropReason.RECEIVER_DEPLETED, ((Outcome.PacketDropped) out.get(1)).reason());
    }

    @Test
    void testBaseStationIsNeverCharged() {
        var out = new ArrayList<Outcome>();
        assertTrue(context.transmit(Topology.BASE_STATION, 0, 4000, out).sufficient());
        assertTrue(context.receive(Topology.BASE_STATION, 4000, out).sufficient());
        assertTrue(out.isEmpty());
    }

    @Test
    void testDeathIsEmittedOnce() {
        var out = new ArrayList<Outcome>();
        context.charge(0, 1.0, out);
        context.charge(0, 1.0, out);
        assertEquals(1, out.stream().filter(o -> o instanceof Outcome.NodeDied).count());
    }

    @Test
    void testPacketRelayCountsHops() {
        var packet = context.originate(PacketKind.DATA, 0, 1, Topology.BASE_STATION, 4000);
        var relayed = packet.relay(2);
        assertEquals(1, relayed.sender());
        assertEquals(2, relayed.nextHop());
        assertEquals(2, relayed.hops());
        assertEquals(packet.id(), relayed.id());
        assertFalse(relayed.isFinalHop());
        assertTrue(relayed.relay(Topology.BASE_STATION).isFinalHop());
    }

    @Test
    void testRoundTiming() {
        context.scheduler().advanceTo(200.0);
        context.beginRound(2);
        assertEquals(2, context.round());
        assertEquals(200.0, context.roundStartTime());
        assertEquals(300.0, context.roundEndTime());
        var handle = context.schedule(5.0, new RoundStart(3));
        assertEquals(205.0, handle.time());
    }
}
