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

import com.hellblazer.sensornet.network.DropReason;
import com.hellblazer.sensornet.network.Outcome;
import com.hellblazer.sensornet.network.PacketKind;
import com.hellblazer.sensornet.network.Topology;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class GearEngineTest {

    // A blocks direct progress toward F; the way around runs through B, C, D and E
    private static final List<Point2d> HOLE = List.of(new Point2d(10, 0), new Point2d(10, 12), new Point2d(22, 18),
                                                      new Point2d(34, 12), new Point2d(46, 4), new Point2d(50, 0));

    private static GearEngine engine(TargetRegion region, int nodeCount) {
        return new GearEngine(GearParameters.builder().withRegion(region).build(), nodeCount);
    }

    private static List<Outcome.PacketDelivered> delivered(EngineHarness harness, PacketKind kind) {
        return harness.outcomes(Outcome.PacketDelivered.class)
                      .stream()
                      .filter(d -> d.packetKind() == kind)
                      .toList();
    }

    @Test
    void testGreedyForwardingOnGrid() {
        var engine = engine(TargetRegion.of(55, 55, 8), 49);
        var harness = new EngineHarness(engine, EngineHarness.grid(7, 7, 10.0), new Point2d(-5, -5), 1.0, 1,
                                        EngineHarness.settings(15.0));
        harness.runRound();

        assertEquals(0, engine.recoveryCount());
        var queryHops = engine.hopRecords().stream().filter(h -> h.kind() == PacketKind.QUERY).toList();
        assertEquals(List.of(0, 8, 16, 24, 32), queryHops.stream().map(GearEngine.HopRecord::from).toList(),
                     "the query follows the diagonal");
        assertEquals(40, queryHops.get(queryHops.size() - 1).to());
        for (var hop : engine.hopRecords()) {
            assertFalse(hop.recovery());
            assertTrue(hop.toDistance() < hop.fromDistance(), "every greedy hop makes progress: " + hop);
        }

        var queries = delivered(harness, PacketKind.QUERY);
        assertEquals(1, queries.size());
        assertEquals(6, queries.get(0).hops());
        // the first in-region node and its three in-region neighbors all reply
        assertEquals(4, delivered(harness, PacketKind.DATA).size());
        assertTrue(harness.outcomes(Outcome.PacketDropped.class).isEmpty());
    }

    @Test
    void testRecoveryAroundHole() {
        var engine = engine(TargetRegion.of(50, 0, 5), HOLE.size());
        var harness = new EngineHarness(engine, HOLE, new Point2d(0, 0), 1.0, 1, EngineHarness.settings(15.0));
        assertTrue(Double.isNaN(engine.learnedCost(0, 0)));
        harness.runRound();

        assertEquals(1, engine.recoveryCount());
        var recovery = engine.hopRecords().stream().filter(GearEngine.HopRecord::recovery).toList();
        assertEquals(1, recovery.size());
        assertEquals(0, recovery.get(0).from());
        assertEquals(1, recovery.get(0).to());
        assertFalse(Double.isNaN(engine.learnedCost(0, 0)), "the node at the hole learns a cost");
        assertTrue(Double.isNaN(engine.learnedCost(2, 0)), "greedy hops learn nothing");

        var queryPath = engine.hopRecords()
                              .stream()
                              .filter(h -> h.kind() == PacketKind.QUERY)
                              .map(GearEngine.HopRecord::to)
                              .toList();
        assertEquals(List.of(1, 2, 3, 4, 5), queryPath);

        var queries = delivered(harness, PacketKind.QUERY);
        assertEquals(1, queries.size());
        assertEquals(6, queries.get(0).hops());
        var replies = delivered(harness, PacketKind.DATA);
        assertEquals(1, replies.size());
        assertEquals(5, replies.get(0).source());
        assertEquals(6, replies.get(0).hops());
    }

    @Test
    void testQueryDroppedWhenNoNeighborRemains() {
        var engine = engine(TargetRegion.of(50, 0, 5), HOLE.size());
        var harness = new EngineHarness(engine, HOLE, new Point2d(0, 0), 1.0, 1, EngineHarness.settings(15.0));
        for (int id = 1; id < HOLE.size(); id++) {
            harness.topology.markDead(id);
        }
        harness.runRound();

        var drops = harness.outcomes(Outcome.PacketDropped.class);
        assertEquals(1, drops.size());
        assertEquals(PacketKind.QUERY, drops.get(0).packetKind());
        assertEquals(0, drops.get(0).atNode());
        assertEquals(DropReason.NO_ROUTE, drops.get(0).reason());
        assertTrue(harness.outcomes(Outcome.PacketDelivered.class).isEmpty());
    }

    @Test
    void testBaseStationReachesNearestNodeBeyondRange() {
        var engine = engine(TargetRegion.of(40, 0, 5), 2);
        var harness = new EngineHarness(engine, List.of(new Point2d(30, 0), new Point2d(40, 0)), new Point2d(0, 0),
                                        1.0, 1, EngineHarness.settings(15.0));
        harness.runRound();

        var queries = delivered(harness, PacketKind.QUERY);
        assertEquals(1, queries.size());
        assertEquals(Topology.BASE_STATION, queries.get(0).source());
        assertEquals(2, queries.get(0).hops());

        // the reply cannot cover the last thirty meters at radio range
        var drops = harness.outcomes(Outcome.PacketDropped.class);
        assertEquals(1, drops.size());
        assertEquals(PacketKind.DATA, drops.get(0).packetKind());
        assertEquals(0, drops.get(0).atNode());
        assertEquals(DropReason.NO_ROUTE, drops.get(0).reason());
    }

    @Test
    void testOneQueryPerRegionEachRound() {
        var parameters = GearParameters.defaults(100, 100);
        var engine = new GearEngine(parameters, 100);
        var harness = new EngineHarness(engine, EngineHarness.grid(10, 10, 10.0), new Point2d(50, 50), 1.0, 7,
                                        EngineHarness.settings(20.0));
        harness.runRounds(2);

        assertEquals(2, engine.regions().size());
        var queries = harness.outcomes(Outcome.PacketDelivered.class)
                             .stream()
                             .filter(d -> d.packetKind() == PacketKind.QUERY)
                             .count();
        var queryDrops = harness.outcomes(Outcome.PacketDropped.class)
                                .stream()
                                .filter(d -> d.packetKind() == PacketKind.QUERY)
                                .count();
        assertEquals(4, queries + queryDrops, "two regions over two rounds");
    }
}
