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

import com.hellblazer.sensornet.common.DeterministicMath;

import javax.vecmath.Point2d;
import java.util.*;

/**
 * Fixed placement of sensor nodes and the base station.
 * <p>
 * The topology exclusively owns its nodes. Node ids are dense, {@code 0 .. size()-1}, so protocol engines refer to
 * other nodes by index rather than by reference. The base station is not a node; it has the id
 * {@link #BASE_STATION}, unlimited energy, and is never reported in neighbor sets.
 * <p>
 * Adjacency within a radio range is computed lazily and cached per range. Every {@link #markDead(int)} invalidates
 * the cache; the next {@link #neighborsWithin(int, double)} call recomputes adjacency over the live nodes only.
 *
 * @author hal.hildebrand
 */
public final class Topology {

    /**
     * Id used for the base station (sink) in packets, events and gradients.
     */
    public static final int BASE_STATION = -1;

    private final List<SensorNode>               nodes;
    private final Point2d                        baseStation;
    private final Map<Double, SortedSet<Integer>[]> adjacency = new HashMap<>();
    private int                                  adjacencyAlive = -1;
    private long                                 adjacencyPasses;

    /**
     * Build a topology with identical initial energy for every node. Node ids follow the order of the positions.
     *
     * @param positions     node positions, one per node
     * @param baseStation   base station position
     * @param initialEnergy starting energy of each node in joules
     */
    public Topology(List<Point2d> positions, Point2d baseStation, double initialEnergy) {
        Objects.requireNonNull(positions, "positions");
        Objects.requireNonNull(baseStation, "baseStation");
        var built = new ArrayList<SensorNode>(positions.size());
        for (int i = 0; i < positions.size(); i++) {
            built.add(new SensorNode(i, Objects.requireNonNull(positions.get(i), "position"), initialEnergy));
        }
        this.nodes = Collections.unmodifiableList(built);
        this.baseStation = new Point2d(baseStation);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * @param id node id
     * @return the node
     * @throws IndexOutOfBoundsException if the id is not a node of this topology
     */
    public SensorNode node(int id) {
        return nodes.get(id);
    }

    /**
     * @return all nodes in ascending id order, live or dead
     */
    public List<SensorNode> nodes() {
        return nodes;
    }

    /**
     * @return a copy of the base station position
     */
    public Point2d baseStation() {
        return new Point2d(baseStation);
    }

    /**
     * @return live nodes in ascending id order
     */
    public List<SensorNode> aliveNodes() {
        var alive = new ArrayList<SensorNode>(nodes.size());
        for (var node : nodes) {
            if (node.isAlive()) {
                alive.add(node);
            }
        }
        return alive;
    }

    public int aliveCount() {
        int count = 0;
        for (var node : nodes) {
            if (node.isAlive()) {
                count++;
            }
        }
        return count;
    }

    public boolean isAlive(int id) {
        return id == BASE_STATION || nodes.get(id).isAlive();
    }

    /**
     * Distance between two endpoints, either of which may be the base station.
     */
    public double distance(int a, int b) {
        return DeterministicMath.distance(x(a), y(a), x(b), y(b));
    }

    public double distanceToBase(int id) {
        return distance(id, BASE_STATION);
    }

    /**
     * Distance from an endpoint to an arbitrary point.
     */
    public double distance(int id, Point2d point) {
        return DeterministicMath.distance(x(id), y(id), point.x, point.y);
    }

    /**
     * Live nodes within range of a node, excluding the node itself. Dead nodes have no neighbors.
     *
     * @param id    node id, or {@link #BASE_STATION}
     * @param range radio range in meters
     * @return ascending, unmodifiable set of node ids
     */
    public SortedSet<Integer> neighborsWithin(int id, double range) {
        if (id == BASE_STATION) {
            return nodesWithin(baseStation, range);
        }
        if (!nodes.get(id).isAlive()) {
            return Collections.emptySortedSet();
        }
        int alive = aliveCount();
        if (alive != adjacencyAlive) {
            // a node was drained without going through markDead
            adjacency.clear();
            adjacencyAlive = alive;
        }
        return adjacency.computeIfAbsent(range, this::computeAdjacency)[id];
    }

    /**
     * Live nodes within a radius of a point.
     *
     * @return ascending, unmodifiable set of node ids
     */
    public SortedSet<Integer> nodesWithin(Point2d center, double radius) {
        var result = new TreeSet<Integer>();
        for (var node : nodes) {
            if (node.isAlive() && DeterministicMath.distance(node.x(), node.y(), center.x, center.y) <= radius) {
                result.add(node.id());
            }
        }
        return Collections.unmodifiableSortedSet(result);
    }

    /**
     * Record the death of a node. Its energy is forced to zero if it was not already exhausted, and cached adjacency
     * is invalidated.
     *
     * @return true if the node was still alive before this call
     */
    public boolean markDead(int id) {
        var node = nodes.get(id);
        boolean wasAlive = node.isAlive();
        if (wasAlive) {
            node.drainTo(0.0);
        }
        adjacency.clear();
        adjacencyAlive = -1;
        return wasAlive;
    }

    /**
     * @return sum of remaining energy over all nodes
     */
    public double residualEnergy() {
        var energies = new double[nodes.size()];
        for (int i = 0; i < energies.length; i++) {
            energies[i] = nodes.get(i).energy();
        }
        return DeterministicMath.stableSum(energies);
    }

    /**
     * @return number of full adjacency recomputations performed so far
     */
    public long adjacencyPasses() {
        return adjacencyPasses;
    }

    @SuppressWarnings("unchecked")
    private SortedSet<Integer>[] computeAdjacency(double range) {
        adjacencyPasses++;
        var sets = new TreeSet[nodes.size()];
        for (int i = 0; i < sets.length; i++) {
            sets[i] = new TreeSet<Integer>();
        }
        for (int i = 0; i < nodes.size(); i++) {
            var a = nodes.get(i);
            if (!a.isAlive()) {
                continue;
            }
            for (int j = i + 1; j < nodes.size(); j++) {
                var b = nodes.get(j);
                if (b.isAlive() && DeterministicMath.distance(a.x(), a.y(), b.x(), b.y()) <= range) {
                    sets[i].add(j);
                    sets[j].add(i);
                }
            }
        }
        var result = new SortedSet[sets.length];
        for (int i = 0; i < sets.length; i++) {
            result[i] = Collections.unmodifiableSortedSet(sets[i]);
        }
        return result;
    }

    private double x(int id) {
        return id == BASE_STATION ? baseStation.x : nodes.get(id).x();
    }

    private double y(int id) {
        return id == BASE_STATION ? baseStation.y : nodes.get(id).y();
    }

    @Override
    public String toString() {
        return String.format("Topology{nodes=%d, alive=%d, base=(%.2f, %.2f)}", nodes.size(), aliveCount(),
                             baseStation.x, baseStation.y);
    }
}
