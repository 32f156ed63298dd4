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

import com.hellblazer.sensornet.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point2d;
import java.util.*;

/**
 * GEAR: Geographical and Energy Aware Routing.
 * <p>
 * Every round the base station issues one query per target region. A node forwards a query to the live neighbor
 * that makes strictly positive progress toward the region center and has the lowest cost
 * {@code alpha * distanceToRegion + (1 - alpha) / remainingEnergy}, using the learned cost in place of the estimate
 * where one exists. When no neighbor makes progress the node is at a hole and enters recovery: it picks the unvisited
 * live neighbor with the lowest learned cost and updates its own learned cost to that neighbor's cost plus the
 * weighted hop length, so later queries route around the hole.
 * <p>
 * The first node inside the region delivers the query and starts a flood restricted to in-region nodes, suppressed
 * by a per query cache at each node. Every in-region node that receives the query replies with a data packet routed
 * the same way back to the base station, directly once within radio range of it.
 *
 * @author hal.hildebrand
 */
public final class GearEngine implements ProtocolEngine {

    /**
     * One forwarding decision, kept for inspection.
     *
     * @param packetId     forwarded packet
     * @param kind         query or reply
     * @param from         forwarding node
     * @param to           chosen next hop
     * @param fromDistance distance from {@code from} to the target
     * @param toDistance   distance from {@code to} to the target
     * @param recovery     true if no neighbor offered progress
     */
    public record HopRecord(long packetId, PacketKind kind, int from, int to, double fromDistance, double toDistance,
                            boolean recovery) {
    }

    public record QueryIssue(int region, int round) implements EventPayload {
        @Override
        public int origin() {
            return Topology.BASE_STATION;
        }
    }

    public record QueryHop(Packet packet, int region) implements EventPayload {
        @Override
        public int origin() {
            return packet.sender();
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(packet.nextHop());
        }
    }

    public record RegionFlood(int node, long queryId, int region) implements EventPayload {
        @Override
        public int origin() {
            return node;
        }
    }

    public record ReplyHop(Packet packet) implements EventPayload {
        @Override
        public int origin() {
            return packet.sender();
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(packet.nextHop());
        }
    }

    /**
     * Destination of a query packet: a region rather than a node.
     */
    static final int REGION = -2;

    private static final int    NONE = -3;
    private static final Logger log  = LoggerFactory.getLogger(GearEngine.class);

    private final GearParameters          parameters;
    private final List<TargetRegion>      regions;
    private final int                     nodeCount;
    // learned[target][node], NaN until learned; the last target is the base station
    private final double[][]              learned;
    private final Map<Long, Set<Integer>> visited    = new HashMap<>();
    private final Map<Long, Set<Integer>> floodSeen  = new HashMap<>();
    private final List<HopRecord>         hops       = new ArrayList<>();
    private int                           recoveries;

    public GearEngine(GearParameters parameters, int nodeCount) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.regions = parameters.getRegions();
        this.nodeCount = nodeCount;
        this.learned = new double[regions.size() + 1][nodeCount];
        for (var row : learned) {
            Arrays.fill(row, Double.NaN);
        }
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.GEAR;
    }

    @Override
    public List<Outcome> onRoundStart(SimulationContext context) {
        visited.clear();
        floodSeen.clear();
        hops.clear();
        for (int i = 0; i < regions.size(); i++) {
            context.schedule(0.0, new QueryIssue(i, context.round()));
        }
        return List.of();
    }

    @Override
    public List<Outcome> onEvent(Event event, SimulationContext context) {
        var out = new ArrayList<Outcome>();
        var payload = event.payload();
        if (payload instanceof QueryIssue issue) {
            issue(issue.region(), context, out);
        } else if (payload instanceof QueryHop hop) {
            queryArrived(hop.packet(), hop.region(), context, out);
        } else if (payload instanceof RegionFlood flood) {
            flood(flood, context, out);
        } else if (payload instanceof ReplyHop reply) {
            replyArrived(reply.packet(), context, out);
        } else {
            throw new IllegalArgumentException("GEAR cannot handle " + payload);
        }
        return out;
    }

    /**
     * @return forwarding decisions made since the current round started
     */
    public List<HopRecord> hopRecords() {
        return Collections.unmodifiableList(hops);
    }

    /**
     * @return number of hops taken in recovery mode so far
     */
    public int recoveryCount() {
        return recoveries;
    }

    /**
     * @return learned cost of a node toward a region, or NaN if the node has not learned one
     */
    public double learnedCost(int nodeId, int region) {
        return learned[region][nodeId];
    }

    public List<TargetRegion> regions() {
        return regions;
    }

    private void issue(int region, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        if (topology.aliveCount() == 0) {
            return;
        }
        var target = regions.get(region);
        int first = NONE;
        double best = Double.POSITIVE_INFINITY;
        for (int candidate : topology.neighborsWithin(Topology.BASE_STATION, context.settings().radioRange())) {
            double cost = cost(candidate, region, target.center(), topology);
            if (cost < best) {
                best = cost;
                first = candidate;
            }
        }
        if (first == NONE) {
            // nobody hears the base station at radio range; it reaches the closest node over its long range link
            double nearest = Double.POSITIVE_INFINITY;
            for (var node : topology.aliveNodes()) {
                double d = topology.distanceToBase(node.id());
                if (d < nearest) {
                    nearest = d;
                    first = node.id();
                }
            }
        }
        var query = context.originate(PacketKind.QUERY, Topology.BASE_STATION, first, REGION,
                                      context.settings().floodBits());
        if (context.hop(query, out) == SimulationContext.HopResult.ARRIVED) {
            context.schedule(hopDelay(context), new QueryHop(query, region));
        }
    }

    private void queryArrived(Packet query, int region, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int holder = query.nextHop();
        if (!topology.isAlive(holder)) {
            context.dropped(query, holder, DropReason.SENDER_DEPLETED, out);
            return;
        }
        var target = regions.get(region);
        var node = topology.node(holder);
        if (target.contains(node.x(), node.y())) {
            context.delivered(query, out);
            floodSeen.computeIfAbsent(query.id(), k -> new HashSet<>()).add(holder);
            context.schedule(hopDelay(context), new RegionFlood(holder, query.id(), region));
            reply(holder, context, out);
            return;
        }
        if (query.hops() > nodeCount) {
            context.dropped(query, holder, DropReason.HOP_LIMIT, out);
            return;
        }
        int next = nextHop(query, holder, region, target.center(), context);
        if (next == NONE) {
            context.dropped(query, holder, DropReason.NO_ROUTE, out);
            return;
        }
        var relayed = query.relay(next);
        if (context.hop(relayed, out) == SimulationContext.HopResult.ARRIVED) {
            context.schedule(hopDelay(context), new QueryHop(relayed, region));
        }
    }

    private void flood(RegionFlood flood, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int node = flood.node();
        if (!topology.isAlive(node)) {
            return;
        }
        var target = regions.get(flood.region());
        double range = context.settings().radioRange();
        var listeners = new ArrayList<Integer>();
        for (int neighbor : topology.neighborsWithin(node, range)) {
            var n = topology.node(neighbor);
            if (target.contains(n.x(), n.y())) {
                listeners.add(neighbor);
            }
        }
        if (listeners.isEmpty()) {
            return;
        }
        int bits = context.settings().floodBits();
        if (!context.broadcast(node, range, bits, out).sufficient()) {
            return;
        }
        var seen = floodSeen.computeIfAbsent(flood.queryId(), k -> new HashSet<>());
        for (int listener : listeners) {
            if (!context.receive(listener, bits, out).sufficient()) {
                continue;
            }
            if (seen.add(listener)) {
                context.schedule(hopDelay(context), new RegionFlood(listener, flood.queryId(), flood.region()));
                reply(listener, context, out);
            }
        }
        log.trace("GEAR: node {} flooded query {} to {} in-region neighbors", node, flood.queryId(),
                  listeners.size());
    }

    private void reply(int node, SimulationContext context, List<Outcome> out) {
        int bits = context.settings().dataBits();
        if (!context.sense(node, bits, out).sufficient()) {
            return;
        }
        var packet = context.originate(PacketKind.DATA, node, node, Topology.BASE_STATION, bits);
        int next = nextHop(packet, node, regions.size(), context.topology().baseStation(), context);
        if (next == NONE) {
            context.dropped(packet, node, DropReason.NO_ROUTE, out);
            return;
        }
        sendReply(packet.redirect(next), context, out);
    }

    private void replyArrived(Packet packet, SimulationContext context, List<Outcome> out) {
        int holder = packet.nextHop();
        if (!context.topology().isAlive(holder)) {
            context.dropped(packet, holder, DropReason.SENDER_DEPLETED, out);
            return;
        }
        if (packet.hops() > nodeCount) {
            context.dropped(packet, holder, DropReason.HOP_LIMIT, out);
            return;
        }
        int next = nextHop(packet, holder, regions.size(), context.topology().baseStation(), context);
        if (next == NONE) {
            context.dropped(packet, holder, DropReason.NO_ROUTE, out);
            return;
        }
        sendReply(packet.relay(next), context, out);
    }

    private void sendReply(Packet packet, SimulationContext context, List<Outcome> out) {
        if (context.hop(packet, out) == SimulationContext.HopResult.ARRIVED) {
            context.schedule(hopDelay(context), new ReplyHop(packet));
        }
    }

    /**
     * Choose the next hop of a packet at a node toward a target point.
     *
     * @param target index into the learned cost table; {@code regions.size()} for the base station
     */
    private int nextHop(Packet packet, int node, int target, Point2d center, SimulationContext context) {
        var topology = context.topology();
        double range = context.settings().radioRange();
        boolean toBase = target == regions.size();
        if (toBase && topology.distanceToBase(node) <= range) {
            return Topology.BASE_STATION;
        }
        var seen = visited.computeIfAbsent(packet.id(), k -> new HashSet<>());
        seen.add(node);
        double here = topology.distance(node, center);

        int best = NONE;
        double bestCost = Double.POSITIVE_INFINITY;
        for (int neighbor : topology.neighborsWithin(node, range)) {
            if (topology.distance(neighbor, center) < here) {
                double cost = cost(neighbor, target, center, topology);
                if (cost < bestCost) {
                    bestCost = cost;
                    best = neighbor;
                }
            }
        }
        if (best != NONE) {
            hops.add(new HopRecord(packet.id(), packet.kind(), node, best, here, topology.distance(best, center),
                                   false));
            return best;
        }

        for (int neighbor : topology.neighborsWithin(node, range)) {
            if (!seen.contains(neighbor)) {
                double cost = cost(neighbor, target, center, topology);
                if (cost < bestCost) {
                    bestCost = cost;
                    best = neighbor;
                }
            }
        }
        if (best == NONE) {
            return NONE;
        }
        learned[target][node] = bestCost + parameters.getAlpha() * topology.distance(node, best);
        recoveries++;
        log.debug("GEAR: node {} at a hole toward {}, recovering via {} (learned cost {})", node, center, best,
                  learned[target][node]);
        hops.add(new HopRecord(packet.id(), packet.kind(), node, best, here, topology.distance(best, center), true));
        return best;
    }

    /**
     * Learned cost of a node toward a target, or the estimate if nothing has been learned.
     */
    private double cost(int node, int target, Point2d center, Topology topology) {
        double known = learned[target][node];
        if (!Double.isNaN(known)) {
            return known;
        }
        double alpha = parameters.getAlpha();
        return alpha * topology.distance(node, center) + (1.0 - alpha) / topology.node(node).energy();
    }

    private double hopDelay(SimulationContext context) {
        return context.settings().roundDuration() / (4.0 * (nodeCount + 2));
    }

    @Override
    public String toString() {
        return String.format("GearEngine{%s, recoveries=%d}", parameters, recoveries);
    }
}
