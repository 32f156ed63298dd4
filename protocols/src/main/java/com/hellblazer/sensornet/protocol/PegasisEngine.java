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

import java.util.*;

/**
 * PEGASIS: Power-Efficient Gathering in Sensor Information Systems.
 * <p>
 * All live nodes form one chain, built greedily: start at the node farthest from the base station and repeatedly
 * append the nearest live node not yet on the chain. The result approximates a shortest tour and is not optimal.
 * Each round one chain member leads. Data moves from both chain ends toward the leader; every node on the way senses
 * its own reading, fuses it with what it carries and passes a single data sized packet on. The leader fuses both
 * halves with its own reading and makes the only long range transmission of the round.
 * <p>
 * The chain is rebuilt from scratch at the start of any round following the death of a member, so a dead neighbor is
 * never handed a packet from a stale chain. A chain of one node sends straight to the base station.
 *
 * @author hal.hildebrand
 */
public final class PegasisEngine implements ProtocolEngine {

    /**
     * Token passed along the chain toward the leader.
     *
     * @param node      the chain member that now holds the token
     * @param position  chain index of {@code node}
     * @param direction +1 when moving from the head of the chain, -1 from its tail
     * @param carried   packets fused into the token so far, each addressed to {@code node}
     */
    public record ChainRelay(int node, int position, int direction, List<Packet> carried) implements EventPayload {
        public ChainRelay {
            carried = List.copyOf(carried);
        }

        @Override
        public int origin() {
            return node;
        }
    }

    public record LeaderUplink(int leader, int round) implements EventPayload {
        @Override
        public int origin() {
            return leader;
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(Topology.BASE_STATION);
        }
    }

    private static final Logger log = LoggerFactory.getLogger(PegasisEngine.class);

    private final PegasisParameters parameters;
    private final List<Packet>      atLeader = new ArrayList<>();
    private List<Integer>           chain    = List.of();
    private int                     leaderPosition = -1;
    private int                     builtAt        = -1;
    private int                     rebuilds;

    public PegasisEngine(PegasisParameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * Greedy chain over the live nodes of a topology.
     *
     * @return node ids in chain order; ties go to the lowest id
     */
    public static List<Integer> buildChain(Topology topology) {
        var alive = topology.aliveNodes();
        var result = new ArrayList<Integer>(alive.size());
        if (alive.isEmpty()) {
            return result;
        }
        var remaining = new ArrayList<Integer>(alive.size());
        int start = -1;
        double farthest = -1.0;
        for (var node : alive) {
            remaining.add(node.id());
            double d = topology.distanceToBase(node.id());
            if (d > farthest) {
                farthest = d;
                start = node.id();
            }
        }
        remaining.remove(Integer.valueOf(start));
        result.add(start);
        int end = start;
        while (!remaining.isEmpty()) {
            int nearestIndex = 0;
            double nearest = Double.POSITIVE_INFINITY;
            for (int i = 0; i < remaining.size(); i++) {
                double d = topology.distance(end, remaining.get(i));
                if (d < nearest) {
                    nearest = d;
                    nearestIndex = i;
                }
            }
            end = remaining.remove(nearestIndex);
            result.add(end);
        }
        return result;
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.PEGASIS;
    }

    @Override
    public List<Outcome> onRoundStart(SimulationContext context) {
        var topology = context.topology();
        int round = context.round();
        atLeader.clear();
        leaderPosition = -1;
        if (topology.aliveCount() == 0) {
            chain = List.of();
            return List.of();
        }
        if (needsRebuild(topology, round)) {
            chain = List.copyOf(buildChain(topology));
            builtAt = round;
            rebuilds++;
            log.debug("PEGASIS round {}: rebuilt chain of {} nodes", round, chain.size());
        }
        leaderPosition = chooseLeader(topology, round);
        for (int i = 0; i < chain.size(); i++) {
            topology.node(chain.get(i)).setRole(i == leaderPosition ? NodeRole.CHAIN_LEADER : NodeRole.CHAIN_MEMBER);
        }

        int n = chain.size();
        double hopDelay = hopDelay(context);
        if (leaderPosition > 0) {
            context.schedule(hopDelay, new ChainRelay(chain.get(0), 0, +1, List.of()));
        }
        if (leaderPosition < n - 1) {
            context.schedule(hopDelay, new ChainRelay(chain.get(n - 1), n - 1, -1, List.of()));
        }
        context.schedule(hopDelay * (n + 1), new LeaderUplink(chain.get(leaderPosition), round));
        return List.of();
    }

    @Override
    public List<Outcome> onEvent(Event event, SimulationContext context) {
        var out = new ArrayList<Outcome>();
        var payload = event.payload();
        if (payload instanceof ChainRelay relay) {
            relay(relay, context, out);
        } else if (payload instanceof LeaderUplink uplink) {
            uplink(uplink, context, out);
        } else {
            throw new IllegalArgumentException("PEGASIS cannot handle " + payload);
        }
        return out;
    }

    /**
     * @return the chain used in the current round
     */
    public List<Integer> chain() {
        return chain;
    }

    /**
     * @return the current leader, or empty if no chain exists
     */
    public OptionalInt leader() {
        return leaderPosition < 0 ? OptionalInt.empty() : OptionalInt.of(chain.get(leaderPosition));
    }

    /**
     * @return number of chain constructions so far
     */
    public int rebuildCount() {
        return rebuilds;
    }

    private boolean needsRebuild(Topology topology, int round) {
        if (chain.isEmpty()) {
            return true;
        }
        for (int id : chain) {
            if (!topology.isAlive(id)) {
                return true;
            }
        }
        int interval = parameters.getRebuildInterval();
        return interval > 0 && round - builtAt >= interval;
    }

    private int chooseLeader(Topology topology, int round) {
        if (parameters.getLeaderPolicy() == PegasisParameters.LeaderPolicy.ROUND_ROBIN) {
            return round % chain.size();
        }
        int best = 0;
        for (int i = 1; i < chain.size(); i++) {
            if (topology.node(chain.get(i)).energy() > topology.node(chain.get(best)).energy()) {
                best = i;
            }
        }
        return best;
    }

    private double hopDelay(SimulationContext context) {
        return context.settings().roundDuration() / (2.0 * (chain.size() + 2));
    }

    private void relay(ChainRelay relay, SimulationContext context, List<Outcome> out) {
        int node = relay.node();
        if (!context.topology().isAlive(node)) {
            dropAll(relay.carried(), node, DropReason.SENDER_DEPLETED, context, out);
            return;
        }
        int nextPosition = relay.position() + relay.direction();
        int next = chain.get(nextPosition);
        var outgoing = fuse(node, next, relay.carried(), context, out);
        if (outgoing.isEmpty() || !forward(node, next, outgoing, context, out)) {
            return;
        }
        if (nextPosition == leaderPosition) {
            atLeader.addAll(outgoing);
        } else {
            context.schedule(hopDelay(context), new ChainRelay(next, nextPosition, relay.direction(), outgoing));
        }
    }

    private void uplink(LeaderUplink uplink, SimulationContext context, List<Outcome> out) {
        int leader = uplink.leader();
        var collected = new ArrayList<>(atLeader);
        atLeader.clear();
        if (!context.topology().isAlive(leader)) {
            dropAll(collected, leader, DropReason.SENDER_DEPLETED, context, out);
            return;
        }
        var outgoing = fuse(leader, Topology.BASE_STATION, collected, context, out);
        if (outgoing.isEmpty()) {
            return;
        }
        if (context.transmit(leader, Topology.BASE_STATION, context.settings().dataBits(), out).sufficient()) {
            for (var packet : outgoing) {
                context.delivered(packet, out);
            }
        } else {
            dropAll(outgoing, leader, DropReason.SENDER_DEPLETED, context, out);
        }
    }

    /**
     * Sense a reading at a node and fuse it with the packets the node holds.
     *
     * @return packets carried by the node's single outgoing transmission, addressed to {@code to}; empty if the node
     *         died while sensing or fusing
     */
    private List<Packet> fuse(int node, int to, List<Packet> carried, SimulationContext context,
                              List<Outcome> out) {
        int bits = context.settings().dataBits();
        var outgoing = new ArrayList<Packet>(carried.size() + 1);
        for (var packet : carried) {
            outgoing.add(packet.relay(to));
        }
        if (context.sense(node, bits, out).sufficient()) {
            outgoing.add(context.originate(PacketKind.DATA, node, to, Topology.BASE_STATION, bits));
        } else {
            dropAll(outgoing, node, DropReason.SENDER_DEPLETED, context, out);
            return List.of();
        }
        if (!carried.isEmpty() && !context.aggregate(node, bits * outgoing.size(), out).sufficient()) {
            dropAll(outgoing, node, DropReason.SENDER_DEPLETED, context, out);
            return List.of();
        }
        return outgoing;
    }

    /**
     * Move a fused packet one chain hop.
     *
     * @return true if the neighbor received it
     */
    private boolean forward(int from, int to, List<Packet> packets, SimulationContext context, List<Outcome> out) {
        int bits = context.settings().dataBits();
        if (!context.transmit(from, to, bits, out).sufficient()) {
            dropAll(packets, from, DropReason.SENDER_DEPLETED, context, out);
            return false;
        }
        if (!context.topology().isAlive(to)) {
            dropAll(packets, to, DropReason.NEXT_HOP_DEAD, context, out);
            return false;
        }
        if (!context.receive(to, bits, out).sufficient()) {
            dropAll(packets, to, DropReason.RECEIVER_DEPLETED, context, out);
            return false;
        }
        return true;
    }

    private static void dropAll(List<Packet> packets, int atNode, DropReason reason, SimulationContext context,
                                List<Outcome> out) {
        for (var packet : packets) {
            context.dropped(packet, atNode, reason, out);
        }
    }

    @Override
    public String toString() {
        return String.format("PegasisEngine{%s, chain=%d, rebuilds=%d}", parameters, chain.size(), rebuilds);
    }
}
