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
package com.hellblazer.sensornet.simulation;

import com.hellblazer.sensornet.network.NodeRole;
import com.hellblazer.sensornet.network.Topology;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only picture of the network at a completed round boundary.
 *
 * @param round round that just completed
 * @param time  simulation time of the boundary
 * @param nodes node states in id order
 * @author hal.hildebrand
 */
public record NetworkSnapshot(int round, double time, List<NodeView> nodes) {

    /**
     * State of one node.
     */
    public record NodeView(int id, double x, double y, NodeRole role, double energy, boolean alive) {
    }

    public NetworkSnapshot {
        nodes = List.copyOf(nodes);
    }

    public static NetworkSnapshot of(int round, double time, Topology topology) {
        var views = new ArrayList<NodeView>(topology.size());
        for (var node : topology.nodes()) {
            views.add(new NodeView(node.id(), node.x(), node.y(), node.role(), node.energy(), node.isAlive()));
        }
        return new NetworkSnapshot(round, time, views);
    }

    public NodeView node(int id) {
        return nodes.get(id);
    }

    public int aliveCount() {
        int count = 0;
        for (var node : nodes) {
            if (node.alive()) {
                count++;
            }
        }
        return count;
    }
}
