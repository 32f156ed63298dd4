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

import com.hellblazer.sensornet.common.DeterministicMath;
import com.hellblazer.sensornet.network.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * LEACH: Low-Energy Adaptive Clustering Hierarchy.
 * <p>
 * Round structure, one phase slot apart:
 * <ol>
 *   <li>Election: every live node that has not served as cluster head in the last {@code 1/P} rounds draws a uniform
 *   value and becomes head if it is below {@code T(n) = P / (1 - P * (r mod 1/P))}. In the last round of a cycle the
 *   threshold is one, so every eligible node serves then.</li>
 *   <li>Advertise: heads broadcast over the cluster radius. Listeners pay reception and remember the nearest head.</li>
 *   <li>Join: non-heads send a join message to their nearest head. Nodes that heard no head stay unclustered.</li>
 *   <li>Data: members sense and send one packet to their head; unclustered nodes, and members whose head has died,
 *   send straight to the base station for this round.</li>
 *   <li>Aggregate: heads fuse member data with their own at a fixed per-bit cost into a single packet and send it to
 *   the base station over the long range link.</li>
 * </ol>
 * If nobody is elected, the eligible node with the least remaining energy is forced to serve, so a forced head never
 * serves twice within {@code 1/P} rounds. Only when no live node is eligible, which takes fewer live nodes than
 * {@code 1/P}, is the least charged live node forced regardless. Head roles are released at round end regardless of
 * energy.
 *
 * @author hal.hildebrand
 */
public final class LeachEngine implements ProtocolEngine {

    /**
     * A cluster head election.
     *
     * @param round  round of the election
     * @param nodeId elected node
     * @param forced true if the node was forced to serve because nobody was elected
     */
    public record Election(int round, int nodeId, boolean forced) {
    }

    public record Advertise(int head, int round) implements EventPayload {
        @Override
        public int origin() {
            return head;
        }
    }

    public record JoinRequest(int member, int round) implements EventPayload {
        @Override
        public int origin() {
            return member;
        }
    }

    public record DataSend(int member, int head, int round) implements EventPayload {
        @Override
        public int origin() {
            return member;
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(head);
        }
    }

    public record Aggregate(int head, int round) implements EventPayload {
        @Override
        public int origin() {
            return head;
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(Topology.BASE_STATION);
        }
    }

    static final int UNASSIGNED = -2;
    private static final int NEVER = Integer.MIN_VALUE;

    private static final Logger log = LoggerFactory.getLogger(LeachEngine.class);

    private final LeachParameters       parameters;
    private final int                   cycle;
    private final int[]                 clusterHead;
    private final int[]                 nearestHead;
    private final double[]              nearestHeadDistance;
    // round of each node's last election, NEVER if it has not served
    private final int[]                 lastElected;
    private final List<List<Packet>>    buffered;
    private final SortedSet<Integer>    heads   = new TreeSet<>();
    private final List<Election>        history = new ArrayList<>();

    public LeachEngine(LeachParameters parameters, int nodeCount) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.cycle = parameters.cycleLength();
        this.clusterHead = new int[nodeCount];
        this.nearestHead = new int[nodeCount];
        this.nearestHeadDistance = new double[nodeCount];
        this.lastElected = new int[nodeCount];
        this.buffered = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            buffered.add(new ArrayList<>());
        }
        Arrays.fill(clusterHead, UNASSIGNED);
        Arrays.fill(lastElected, NEVER);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.LEACH;
    }

    /**
     * Election threshold T(n) for a round.
     */
    public double threshold(int round) {
        int position = round % cycle;
        if (position == cycle - 1) {
            return 1.0;
        }
        double p = parameters.getClusterHeadFraction();
        double denominator = 1.0 - p * position;
        return denominator <= 0.0 ? 1.0 : DeterministicMath.clamp(p / denominator, 0.0, 1.0);
    }

    @Override
    public List<Outcome> onRoundStart(SimulationContext context) {
        var out = new ArrayList<Outcome>();
        var topology = context.topology();
        int round = context.round();
        resetRound(topology);

        var alive = topology.aliveNodes();
        if (alive.isEmpty()) {
            return out;
        }
        double threshold = threshold(round);
        for (var node : alive) {
            if (eligible(node.id(), round) && context.random().nextDouble() < threshold) {
                elect(node, round, false);
            }
        }
        if (heads.isEmpty()) {
            var forced = forcedHead(alive, round);
            log.debug("LEACH round {}: no head elected, forcing node {} (energy {})", round, forced.id(),
                      forced.energy());
            elect(forced, round, true);
        }

        double slot = context.settings().roundDuration() / 10.0;
        for (var head : heads) {
            context.schedule(slot, new Advertise(head, round));
        }
        for (var node : alive) {
            if (!heads.contains(node.id())) {
                context.schedule(2 * slot, new JoinRequest(node.id(), round));
            }
        }
        for (var head : heads) {
            context.schedule(4 * slot, new Aggregate(head, round));
        }
        log.trace("LEACH round {}: {} heads of {} live nodes", round, heads.size(), alive.size());
        return out;
    }

    @Override
    public List<Outcome> onEvent(Event event, SimulationContext context) {
        var out = new ArrayList<Outcome>();
        var payload = event.payload();
        if (payload instanceof Advertise advertise) {
            advertise(advertise, context, out);
        } else if (payload instanceof JoinRequest join) {
            join(join, context, out);
        } else if (payload instanceof DataSend data) {
            send(data, context, out);
        } else if (payload instanceof Aggregate aggregate) {
            aggregate(aggregate, context, out);
        } else {
            throw new IllegalArgumentException("LEACH cannot handle " + payload);
        }
        return out;
    }

    @Override
    public List<Outcome> onRoundEnd(SimulationContext context) {
        var topology = context.topology();
        for (var node : topology.nodes()) {
            if (node.role() == NodeRole.CLUSTER_HEAD || node.role() == NodeRole.CLUSTER_MEMBER) {
                node.setRole(NodeRole.NORMAL);
            }
        }
        heads.clear();
        return List.of();
    }

    /**
     * @return heads of the current round, ascending
     */
    public SortedSet<Integer> clusterHeads() {
        return Collections.unmodifiableSortedSet(heads);
    }

    /**
     * @return the head a node joined this round, or empty if it is a head or unclustered
     */
    public OptionalInt clusterHeadOf(int nodeId) {
        int head = clusterHead[nodeId];
        return head == UNASSIGNED ? OptionalInt.empty() : OptionalInt.of(head);
    }

    /**
     * @return every election so far, in order
     */
    public List<Election> electionHistory() {
        return Collections.unmodifiableList(history);
    }

    public int cycleLength() {
        return cycle;
    }

    private void resetRound(Topology topology) {
        heads.clear();
        Arrays.fill(clusterHead, UNASSIGNED);
        Arrays.fill(nearestHead, UNASSIGNED);
        Arrays.fill(nearestHeadDistance, Double.POSITIVE_INFINITY);
        for (var list : buffered) {
            list.clear();
        }
        for (var node : topology.aliveNodes()) {
            node.setRole(NodeRole.NORMAL);
        }
    }

    private void elect(SensorNode node, int round, boolean forced) {
        heads.add(node.id());
        lastElected[node.id()] = round;
        node.setRole(NodeRole.CLUSTER_HEAD);
        history.add(new Election(round, node.id(), forced));
    }

    /**
     * @return true if the node has not been cluster head in the last {@code 1/P} rounds
     */
    public boolean eligible(int nodeId, int round) {
        return lastElected[nodeId] == NEVER || round - lastElected[nodeId] >= cycle;
    }

    private SensorNode forcedHead(List<SensorNode> alive, int round) {
        SensorNode best = null;
        for (var node : alive) {
            if (eligible(node.id(), round) && (best == null || node.energy() < best.energy())) {
                best = node;
            }
        }
        if (best != null) {
            return best;
        }
        for (var node : alive) {
            if (best == null || node.energy() < best.energy()) {
                best = node;
            }
        }
        return best;
    }

    private void advertise(Advertise advertise, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int head = advertise.head();
        if (!topology.isAlive(head)) {
            return;
        }
        var listeners = new ArrayList<Integer>();
        double radius;
        if (parameters.hasAdvertisementRadius()) {
            radius = parameters.getAdvertisementRadius();
            for (int id : topology.nodesWithin(topology.node(head).position(), radius)) {
                if (!heads.contains(id)) {
                    listeners.add(id);
                }
            }
        } else {
            radius = 0.0;
            for (var node : topology.aliveNodes()) {
                if (!heads.contains(node.id())) {
                    listeners.add(node.id());
                    radius = Math.max(radius, topology.distance(head, node.id()));
                }
            }
        }
        int bits = context.settings().controlBits();
        if (!context.broadcast(head, radius, bits, out).sufficient()) {
            return;
        }
        for (int listener : listeners) {
            if (!context.receive(listener, bits, out).sufficient()) {
                continue;
            }
            double distance = topology.distance(head, listener);
            if (distance < nearestHeadDistance[listener]) {
                nearestHeadDistance[listener] = distance;
                nearestHead[listener] = head;
            }
        }
    }

    private void join(JoinRequest join, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int member = join.member();
        if (!topology.isAlive(member)) {
            return;
        }
        double slot = context.settings().roundDuration() / 10.0;
        int head = nearestHead[member];
        if (head != UNASSIGNED && topology.isAlive(head)) {
            int bits = context.settings().controlBits();
            if (!context.transmit(member, head, bits, out).sufficient()) {
                return;
            }
            if (topology.isAlive(head) && context.receive(head, bits, out).sufficient()) {
                clusterHead[member] = head;
                topology.node(member).setRole(NodeRole.CLUSTER_MEMBER);
                context.schedule(slot, new DataSend(member, head, join.round()));
                return;
            }
        }
        context.schedule(slot, new DataSend(member, Topology.BASE_STATION, join.round()));
    }

    private void send(DataSend data, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int member = data.member();
        if (!topology.isAlive(member)) {
            return;
        }
        int bits = context.settings().dataBits();
        if (!context.sense(member, bits, out).sufficient()) {
            return;
        }
        int via = data.head();
        if (via != Topology.BASE_STATION && !topology.isAlive(via)) {
            log.trace("LEACH round {}: head {} of node {} died, sending direct", data.round(), via, member);
            via = Topology.BASE_STATION;
        }
        var packet = context.originate(PacketKind.DATA, member, via, Topology.BASE_STATION, bits);
        if (context.hop(packet, out) == SimulationContext.HopResult.ARRIVED) {
            buffered.get(via).add(packet);
        }
    }

    private void aggregate(Aggregate aggregate, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int head = aggregate.head();
        var collected = new ArrayList<>(buffered.get(head));
        buffered.get(head).clear();
        if (!topology.isAlive(head)) {
            for (var packet : collected) {
                context.dropped(packet, head, DropReason.SENDER_DEPLETED, out);
            }
            return;
        }
        int bits = context.settings().dataBits();
        var relayed = new ArrayList<Packet>(collected.size() + 1);
        for (var packet : collected) {
            relayed.add(packet.relay(Topology.BASE_STATION));
        }
        if (context.sense(head, bits, out).sufficient()) {
            relayed.add(context.originate(PacketKind.DATA, head, Topology.BASE_STATION, Topology.BASE_STATION, bits));
        }
        if (relayed.isEmpty()) {
            return;
        }
        boolean sent = context.aggregate(head, bits * relayed.size(), out).sufficient()
                       && context.transmit(head, Topology.BASE_STATION, bits, out).sufficient();
        for (var packet : relayed) {
            if (sent) {
                context.delivered(packet, out);
            } else {
                context.dropped(packet, head, DropReason.SENDER_DEPLETED, out);
            }
        }
    }

    @Override
    public String toString() {
        return String.format("LeachEngine{P=%.3f, cycle=%d, heads=%s}", parameters.getClusterHeadFraction(), cycle,
                             heads);
    }
}
