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
 * Directed Diffusion with the base station as the single sink.
 * <p>
 * Each round is split into four phases:
 * <ol>
 *   <li>Interest: on interest rounds the sink floods an interest with a new sequence number and a fresh set of
 *   sources is drawn. Every node rebroadcasts an interest once per sequence number. A node records a gradient toward
 *   each sender that is fewer flood hops from the sink than itself, so gradients never form a cycle. Gradients start
 *   at the interest's exploratory rate; a reinforced gradient runs at twice that rate. A newer sequence
 *   number discards the gradients of the old one.</li>
 *   <li>Exploration: on exploration rounds every source sends exploratory data along all of its gradients. Nodes
 *   forward the first copy of each source's exploratory data along all of their own gradients and remember the
 *   order in which copies arrived from each neighbor. The sink records the latency observed through each of its
 *   neighbors.</li>
 *   <li>Reinforcement: for each source the sink reinforces the live neighbor with the lowest observed latency.
 *   Reinforcement travels upstream, each node picking the neighbor whose exploratory copy reached it first, falling
 *   back to the next copy when that neighbor has died. A reinforcement whose next hop dies in flight detours at the
 *   node holding it through that node's next live copy, or at the sink through its next best neighbor. Links of the previous path that are not on the new one are
 *   negatively reinforced and pruned.</li>
 *   <li>Data: every live source sends one data packet along its reinforced path. A node whose reinforced link is
 *   missing or dead repairs the route through its live gradient closest to the sink; with no gradient left the
 *   packet is dropped.</li>
 * </ol>
 * Gradients that are not refreshed within the gradient timeout expire through cancellable scheduled events.
 *
 * @author hal.hildebrand
 */
public final class DirectedDiffusionEngine implements ProtocolEngine {

    /**
     * @param rate     requested data rate in readings per round
     * @param duration lifetime of the gradients the interest sets up
     */
    public record InterestBroadcast(int sender, int sequence, int hops, double rate, double duration)
    implements EventPayload {
        @Override
        public int origin() {
            return sender;
        }
    }

    public record ExplorationPhase(int round) implements EventPayload {
        @Override
        public int origin() {
            return Topology.BASE_STATION;
        }
    }

    public record ExploratoryArrival(int receiver, int sender, int source, double createdAt) implements EventPayload {
        @Override
        public int origin() {
            return sender;
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(receiver);
        }
    }

    public record ReinforcementPhase(int round) implements EventPayload {
        @Override
        public int origin() {
            return Topology.BASE_STATION;
        }
    }

    /**
     * Positive reinforcement of the link from {@code receiver} to {@code downstream}.
     *
     * @param remaining the rest of the path toward the source
     */
    public record Reinforce(int receiver, int downstream, int source, List<Integer> remaining)
    implements EventPayload {
        public Reinforce {
            remaining = List.copyOf(remaining);
        }

        @Override
        public int origin() {
            return downstream;
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(receiver);
        }
    }

    public record DataPhase(int round) implements EventPayload {
        @Override
        public int origin() {
            return Topology.BASE_STATION;
        }
    }

    public record DataForward(Packet packet) implements EventPayload {
        @Override
        public int origin() {
            return packet.sender();
        }

        @Override
        public OptionalInt target() {
            return OptionalInt.of(packet.nextHop());
        }
    }

    public record GradientExpiry(int node, int neighbor, int sequence) implements EventPayload {
        @Override
        public int origin() {
            return node;
        }
    }

    private static final class Gradient {
        private final int   sequence;
        private double      rate;
        private EventHandle expiry;

        private Gradient(int sequence, double rate) {
            this.sequence = sequence;
            this.rate = rate;
        }
    }

    /**
     * Rate increase of a positively reinforced gradient over the exploratory rate.
     */
    static final double REINFORCEMENT_GAIN = 2.0;

    static final int NONE = -2;

    private static final Logger log = LoggerFactory.getLogger(DirectedDiffusionEngine.class);

    private final DiffusionParameters                                   parameters;
    private final int                                                   nodeCount;
    private final int[]                                                 seenSequence;
    private final int[]                                                 floodHops;
    private final List<TreeMap<Integer, Gradient>>                      gradients;
    private final SortedSet<Integer>                                    sources       = new TreeSet<>();
    private final Map<Integer, int[]>                                   reinforced    = new TreeMap<>();
    private final Map<Integer, Map<Integer, List<Integer>>>             arrivals      = new TreeMap<>();
    private final Map<Integer, TreeMap<Integer, Double>>                sinkLatencies = new TreeMap<>();
    private final Map<Integer, List<Integer>>                           paths         = new TreeMap<>();
    private int                                                         sequence      = -1;
    private int                                                         interests;

    public DirectedDiffusionEngine(DiffusionParameters parameters, int nodeCount) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
        this.nodeCount = nodeCount;
        this.seenSequence = new int[nodeCount];
        this.floodHops = new int[nodeCount];
        this.gradients = new ArrayList<>(nodeCount);
        for (int i = 0; i < nodeCount; i++) {
            gradients.add(new TreeMap<>());
        }
        Arrays.fill(seenSequence, -1);
        Arrays.fill(floodHops, Integer.MAX_VALUE);
    }

    @Override
    public ProtocolKind kind() {
        return ProtocolKind.DIRECTED_DIFFUSION;
    }

    @Override
    public List<Outcome> onRoundStart(SimulationContext context) {
        int round = context.round();
        double phase = context.settings().roundDuration() / 4.0;
        boolean newInterest = sequence < 0 || round % parameters.getInterestInterval() == 0;
        int exploration = parameters.getExplorationInterval();
        boolean explore = newInterest || (exploration > 0 && round % exploration == 0);
        if (newInterest) {
            sequence++;
            interests++;
            chooseSources(context);
            context.schedule(0.0, new InterestBroadcast(Topology.BASE_STATION, sequence, 0,
                                                        parameters.getExploratoryRate(),
                                                        parameters.gradientTimeout(
                                                        context.settings().roundDuration())));
        }
        if (explore) {
            context.schedule(phase, new ExplorationPhase(round));
            context.schedule(2 * phase, new ReinforcementPhase(round));
        }
        context.schedule(3 * phase, new DataPhase(round));
        return List.of();
    }

    @Override
    public List<Outcome> onEvent(Event event, SimulationContext context) {
        var out = new ArrayList<Outcome>();
        var payload = event.payload();
        if (payload instanceof InterestBroadcast interest) {
            interest(interest, context, out);
        } else if (payload instanceof ExplorationPhase) {
            explore(context, out);
        } else if (payload instanceof ExploratoryArrival arrival) {
            exploratoryArrival(arrival, context, out);
        } else if (payload instanceof ReinforcementPhase) {
            reinforce(context, out);
        } else if (payload instanceof Reinforce reinforce) {
            reinforceHop(reinforce, context, out);
        } else if (payload instanceof DataPhase) {
            sendData(context, out);
        } else if (payload instanceof DataForward forward) {
            forward(forward.packet(), context, out);
        } else if (payload instanceof GradientExpiry expiry) {
            expire(expiry);
        } else {
            throw new IllegalArgumentException("Directed Diffusion cannot handle " + payload);
        }
        return out;
    }

    /**
     * @return the current data sources
     */
    public SortedSet<Integer> sources() {
        return Collections.unmodifiableSortedSet(sources);
    }

    /**
     * @return number of interests flooded so far
     */
    public int interestCount() {
        return interests;
    }

    /**
     * @return neighbors a node holds gradients toward, ascending; the sink is {@link Topology#BASE_STATION}
     */
    public SortedSet<Integer> gradientsOf(int nodeId) {
        return Collections.unmodifiableSortedSet(new TreeSet<>(gradients.get(nodeId).keySet()));
    }

    /**
     * @return the neighbor a node forwards a source's data to, or empty if it holds no reinforced gradient for it
     */
    public OptionalInt reinforcedNext(int source, int nodeId) {
        var next = reinforced.get(source);
        return next == null || next[nodeId] == NONE ? OptionalInt.empty() : OptionalInt.of(next[nodeId]);
    }

    /**
     * @return the sink's reinforced neighbor for a source
     */
    public OptionalInt sinkReinforcedNeighbor(int source) {
        var path = paths.get(source);
        return path == null || path.isEmpty() ? OptionalInt.empty() : OptionalInt.of(path.get(0));
    }

    /**
     * @return lowest exploratory latency the sink observed through each neighbor for a source
     */
    public SortedMap<Integer, Double> observedLatencies(int source) {
        var latencies = sinkLatencies.get(source);
        return latencies == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(latencies);
    }

    /**
     * @return data rate of a node's gradient toward a neighbor, or empty if it holds none
     */
    public OptionalDouble gradientRate(int nodeId, int neighbor) {
        var gradient = gradients.get(nodeId).get(neighbor);
        return gradient == null ? OptionalDouble.empty() : OptionalDouble.of(gradient.rate);
    }

    /**
     * @return the reinforced path of a source, from the sink's neighbor to the source
     */
    public List<Integer> reinforcedPath(int source) {
        return paths.getOrDefault(source, List.of());
    }

    private void chooseSources(SimulationContext context) {
        var topology = context.topology();
        for (int source : sources) {
            if (topology.isAlive(source)) {
                topology.node(source).setRole(NodeRole.NORMAL);
            }
        }
        sources.clear();
        reinforced.clear();
        paths.clear();
        var candidates = new ArrayList<Integer>();
        for (var node : topology.aliveNodes()) {
            candidates.add(node.id());
        }
        int count = Math.min(parameters.getSourceCount(), candidates.size());
        var random = context.random();
        for (int i = 0; i < count; i++) {
            int j = i + random.nextInt(candidates.size() - i);
            Collections.swap(candidates, i, j);
            sources.add(candidates.get(i));
        }
        for (int source : sources) {
            topology.node(source).setRole(NodeRole.SOURCE);
        }
        log.debug("Diffusion interest {} in round {}: sources {}", sequence, context.round(), sources);
    }

    private void interest(InterestBroadcast interest, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int sender = interest.sender();
        if (!topology.isAlive(sender)) {
            return;
        }
        double range = context.settings().radioRange();
        int bits = context.settings().floodBits();
        if (!context.broadcast(sender, range, bits, out).sufficient()) {
            return;
        }
        int hops = interest.hops() + 1;
        for (int receiver : topology.neighborsWithin(sender, range)) {
            if (!context.receive(receiver, bits, out).sufficient()) {
                continue;
            }
            if (interest.sequence() > seenSequence[receiver]) {
                clearGradients(receiver, context);
                seenSequence[receiver] = interest.sequence();
                floodHops[receiver] = hops;
                addGradient(receiver, sender, interest, context);
                context.schedule(hopDelay(context),
                                 new InterestBroadcast(receiver, interest.sequence(), hops, interest.rate(),
                                                       interest.duration()));
            } else if (interest.sequence() == seenSequence[receiver] && interest.hops() < floodHops[receiver]) {
                addGradient(receiver, sender, interest, context);
            }
        }
    }

    private void explore(SimulationContext context, List<Outcome> out) {
        arrivals.clear();
        sinkLatencies.clear();
        int bits = context.settings().dataBits();
        for (int source : sources) {
            if (!context.topology().isAlive(source) || !context.sense(source, bits, out).sufficient()) {
                continue;
            }
            arrivals.put(source, new TreeMap<>());
            sinkLatencies.put(source, new TreeMap<>());
            emitExploratory(source, source, context.now(), context, out);
        }
    }

    private void emitExploratory(int node, int source, double createdAt, SimulationContext context,
                                 List<Outcome> out) {
        var topology = context.topology();
        var targets = new ArrayList<Integer>();
        double radius = 0.0;
        for (int neighbor : gradients.get(node).keySet()) {
            if (topology.isAlive(neighbor)) {
                targets.add(neighbor);
                radius = Math.max(radius, topology.distance(node, neighbor));
            }
        }
        if (targets.isEmpty()) {
            return;
        }
        if (!context.broadcast(node, radius, context.settings().dataBits(), out).sufficient()) {
            return;
        }
        for (int target : targets) {
            context.schedule(linkDelay(node, target, context), new ExploratoryArrival(target, node, source, createdAt));
        }
    }

    private void exploratoryArrival(ExploratoryArrival arrival, SimulationContext context, List<Outcome> out) {
        var received = arrivals.get(arrival.source());
        int receiver = arrival.receiver();
        if (received == null || !context.topology().isAlive(receiver)) {
            return;
        }
        if (!context.receive(receiver, context.settings().dataBits(), out).sufficient()) {
            return;
        }
        if (receiver == Topology.BASE_STATION) {
            sinkLatencies.get(arrival.source()).merge(arrival.sender(), context.now() - arrival.createdAt(), Math::min);
            return;
        }
        var from = received.computeIfAbsent(receiver, k -> new ArrayList<>());
        boolean first = from.isEmpty();
        if (!from.contains(arrival.sender())) {
            from.add(arrival.sender());
        }
        if (first) {
            emitExploratory(receiver, arrival.source(), arrival.createdAt(), context, out);
        }
    }

    private void reinforce(SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        for (int source : sources) {
            var latencies = sinkLatencies.get(source);
            if (latencies == null || latencies.isEmpty()) {
                continue;
            }
            int chosen = bestSinkNeighbor(source, topology);
            if (chosen == NONE) {
                continue;
            }
            var path = tracePath(source, chosen, topology, new HashSet<>());
            var previous = paths.put(source, path);
            if (previous != null && !previous.equals(path)) {
                log.debug("Diffusion round {}: source {} path {} replaces {}", context.round(), source, path,
                          previous);
                negativeReinforce(source, previous, path, context, out);
            }
            var next = reinforced.computeIfAbsent(source, k -> {
                var array = new int[nodeCount];
                Arrays.fill(array, NONE);
                return array;
            });
            Arrays.fill(next, NONE);
            context.schedule(linkDelay(Topology.BASE_STATION, chosen, context),
                             new Reinforce(chosen, Topology.BASE_STATION, source, path.subList(1, path.size())));
        }
    }

    /**
     * @return the live sink neighbor with the lowest observed latency for a source, ties to the lower id
     */
    private int bestSinkNeighbor(int source, Topology topology) {
        var latencies = sinkLatencies.get(source);
        if (latencies == null) {
            return NONE;
        }
        var candidates = new ArrayList<>(latencies.entrySet());
        candidates.sort(Map.Entry.<Integer, Double>comparingByValue().thenComparing(Map.Entry.<Integer, Double>comparingByKey()));
        for (var candidate : candidates) {
            if (topology.isAlive(candidate.getKey())) {
                return candidate.getKey();
            }
        }
        return NONE;
    }

    /**
     * Walk upstream from {@code first}, following the earliest live exploratory copy at each node and skipping
     * nodes already in {@code visited}.
     */
    private List<Integer> tracePath(int source, int first, Topology topology, Set<Integer> visited) {
        var path = new ArrayList<Integer>();
        var received = arrivals.getOrDefault(source, Map.of());
        int node = first;
        while (visited.add(node)) {
            path.add(node);
            if (node == source) {
                break;
            }
            int upstream = NONE;
            for (int candidate : received.getOrDefault(node, List.of())) {
                if (topology.isAlive(candidate) && !visited.contains(candidate)) {
                    upstream = candidate;
                    break;
                }
            }
            if (upstream == NONE) {
                break;
            }
            node = upstream;
        }
        return path;
    }

    private void negativeReinforce(int source, List<Integer> previous, List<Integer> current,
                                   SimulationContext context, List<Outcome> out) {
        var links = new HashSet<List<Integer>>();
        int downstream = Topology.BASE_STATION;
        for (int node : current) {
            links.add(List.of(node, downstream));
            downstream = node;
        }
        int bits = context.settings().controlBits();
        downstream = Topology.BASE_STATION;
        for (int node : previous) {
            if (!links.contains(List.of(node, downstream)) && context.topology().isAlive(node)) {
                if (!context.transmit(downstream, node, bits, out).sufficient()) {
                    return;
                }
                if (context.topology().isAlive(node) && context.receive(node, bits, out).sufficient()) {
                    removeGradient(node, downstream, context);
                }
            }
            downstream = node;
        }
    }

    private void reinforceHop(Reinforce reinforce, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        int node = reinforce.receiver();
        if (!topology.isAlive(node)) {
            detour(reinforce.source(), reinforce.downstream(), context, out);
            return;
        }
        int bits = context.settings().controlBits();
        if (!context.receive(node, bits, out).sufficient()) {
            return;
        }
        var next = reinforced.get(reinforce.source());
        if (next == null) {
            return;
        }
        next[node] = reinforce.downstream();
        var gradient = gradients.get(node).get(reinforce.downstream());
        if (gradient != null) {
            gradient.rate = REINFORCEMENT_GAIN * parameters.getExploratoryRate();
        }
        if (reinforce.remaining().isEmpty()) {
            return;
        }
        int upstream = reinforce.remaining().get(0);
        if (!topology.isAlive(upstream)) {
            detour(reinforce.source(), node, context, out);
            return;
        }
        if (!context.transmit(node, upstream, bits, out).sufficient()) {
            return;
        }
        var rest = reinforce.remaining().subList(1, reinforce.remaining().size());
        context.schedule(linkDelay(node, upstream, context), new Reinforce(upstream, node, reinforce.source(), rest));
    }

    /**
     * Reroute a reinforcement whose next hop died in flight. The holder keeps the path up to itself and reinforces
     * its next live exploratory neighbor instead; the sink falls back to its next best neighbor.
     */
    private void detour(int source, int holder, SimulationContext context, List<Outcome> out) {
        var topology = context.topology();
        boolean sink = holder == Topology.BASE_STATION;
        if (!sink && !topology.isAlive(holder)) {
            return;
        }
        var current = paths.getOrDefault(source, List.of());
        int index = current.indexOf(holder);
        if (!sink && index < 0) {
            return;
        }
        var prefix = sink ? List.<Integer>of() : current.subList(0, index + 1);
        int upstream = NONE;
        if (sink) {
            upstream = bestSinkNeighbor(source, topology);
        } else {
            for (int candidate : arrivals.getOrDefault(source, Map.of()).getOrDefault(holder, List.of())) {
                if (topology.isAlive(candidate) && !prefix.contains(candidate)) {
                    upstream = candidate;
                    break;
                }
            }
        }
        if (upstream == NONE) {
            log.debug("Diffusion round {}: reinforcement of source {} stalls at {}", context.round(), source, holder);
            if (sink) {
                paths.remove(source);
            } else {
                paths.put(source, List.copyOf(prefix));
            }
            return;
        }
        var path = new ArrayList<>(prefix);
        path.addAll(tracePath(source, upstream, topology, new HashSet<>(prefix)));
        paths.put(source, path);
        log.debug("Diffusion round {}: source {} detours at {} onto {}", context.round(), source, holder, path);
        if (!sink && !context.transmit(holder, upstream, context.settings().controlBits(), out).sufficient()) {
            return;
        }
        context.schedule(linkDelay(holder, upstream, context),
                         new Reinforce(upstream, holder, source, path.subList(prefix.size() + 1, path.size())));
    }

    private void sendData(SimulationContext context, List<Outcome> out) {
        int bits = context.settings().dataBits();
        for (int source : sources) {
            if (!context.topology().isAlive(source) || !context.sense(source, bits, out).sufficient()) {
                continue;
            }
            int next = route(source, source, context.topology());
            var packet = context.originate(PacketKind.DATA, source, next == NONE ? source : next,
                                           Topology.BASE_STATION, bits);
            if (next == NONE) {
                context.dropped(packet, source, DropReason.NO_ROUTE, out);
                continue;
            }
            hop(packet, context, out);
        }
    }

    private void forward(Packet arrived, SimulationContext context, List<Outcome> out) {
        int holder = arrived.nextHop();
        if (!context.topology().isAlive(holder)) {
            context.dropped(arrived, holder, DropReason.SENDER_DEPLETED, out);
            return;
        }
        if (arrived.hops() > nodeCount) {
            context.dropped(arrived, holder, DropReason.HOP_LIMIT, out);
            return;
        }
        int next = route(holder, arrived.source(), context.topology());
        if (next == NONE) {
            context.dropped(arrived, holder, DropReason.NO_ROUTE, out);
            return;
        }
        hop(arrived.relay(next), context, out);
    }

    private void hop(Packet packet, SimulationContext context, List<Outcome> out) {
        if (context.hop(packet, out) == SimulationContext.HopResult.ARRIVED) {
            context.schedule(linkDelay(packet.sender(), packet.nextHop(), context), new DataForward(packet));
        }
    }

    /**
     * Next hop of a source's data at a node: the reinforced link when it is alive, otherwise the live gradient
     * closest to the sink, lowest id on ties.
     */
    private int route(int node, int source, Topology topology) {
        var next = reinforced.get(source);
        if (next != null && next[node] != NONE && topology.isAlive(next[node])
        && gradients.get(node).containsKey(next[node])) {
            return next[node];
        }
        int best = NONE;
        int bestHops = Integer.MAX_VALUE;
        for (int neighbor : gradients.get(node).keySet()) {
            if (!topology.isAlive(neighbor)) {
                continue;
            }
            int hops = neighbor == Topology.BASE_STATION ? 0 : floodHops[neighbor];
            if (hops < bestHops) {
                best = neighbor;
                bestHops = hops;
            }
        }
        if (best != NONE && next != null && next[node] != NONE) {
            log.trace("Diffusion: node {} repairs route of source {} via {}", node, source, best);
        }
        return best;
    }

    private void addGradient(int node, int neighbor, InterestBroadcast interest, SimulationContext context) {
        int sequence = interest.sequence();
        var gradient = new Gradient(sequence, interest.rate());
        var old = gradients.get(node).put(neighbor, gradient);
        if (old != null && old.expiry != null) {
            context.scheduler().cancel(old.expiry);
        }
        gradient.expiry = context.schedule(interest.duration(), new GradientExpiry(node, neighbor, sequence));
    }

    private void removeGradient(int node, int neighbor, SimulationContext context) {
        var removed = gradients.get(node).remove(neighbor);
        if (removed != null && removed.expiry != null) {
            context.scheduler().cancel(removed.expiry);
        }
        clearReinforcement(node, neighbor);
    }

    private void clearGradients(int node, SimulationContext context) {
        for (var gradient : gradients.get(node).values()) {
            if (gradient.expiry != null) {
                context.scheduler().cancel(gradient.expiry);
            }
        }
        gradients.get(node).clear();
    }

    private void clearReinforcement(int node, int neighbor) {
        for (var next : reinforced.values()) {
            if (next[node] == neighbor) {
                next[node] = NONE;
            }
        }
    }

    private void expire(GradientExpiry expiry) {
        var gradient = gradients.get(expiry.node()).get(expiry.neighbor());
        if (gradient != null && gradient.sequence == expiry.sequence()) {
            gradients.get(expiry.node()).remove(expiry.neighbor());
            clearReinforcement(expiry.node(), expiry.neighbor());
            log.trace("Diffusion: gradient {} -> {} expired", expiry.node(), expiry.neighbor());
        }
    }

    private double hopDelay(SimulationContext context) {
        return context.settings().roundDuration() / (4.0 * (nodeCount + 2));
    }

    /**
     * Per link delay, between half and one hop delay depending on link length.
     */
    private double linkDelay(int from, int to, SimulationContext context) {
        double range = context.settings().radioRange();
        double fraction = Math.min(1.0, context.topology().distance(from, to) / range);
        return hopDelay(context) * (0.5 + 0.5 * fraction);
    }

    @Override
    public String toString() {
        return String.format("DirectedDiffusionEngine{%s, interest=%d, sources=%s}", parameters, sequence, sources);
    }
}
