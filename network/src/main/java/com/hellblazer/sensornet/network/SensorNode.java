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

import javax.vecmath.Point2d;

/**
 * A wireless sensor node.
 * <p>
 * Identity and position are fixed when the topology is built. Remaining energy is non-negative and never increases;
 * it is only mutated through {@link EnergyModel#apply(SensorNode, double)} and {@link Topology#markDead(int)}. A node
 * is alive while its remaining energy is strictly positive.
 * <p>
 * Protocol transient state (cluster membership, gradients, chain neighbors) is not held here. Engines keep it in
 * arrays indexed by node id.
 *
 * @author hal.hildebrand
 */
public final class SensorNode {

    private final int     id;
    private final Point2d position;
    private final double  initialEnergy;
    private double        energy;
    private boolean       deathReported;
    private NodeRole      role = NodeRole.NORMAL;

    SensorNode(int id, Point2d position, double initialEnergy) {
        if (id < 0) {
            throw new IllegalArgumentException("Node id must be non-negative: " + id);
        }
        if (!(initialEnergy > 0)) {
            throw new IllegalArgumentException("Initial energy must be positive: " + initialEnergy);
        }
        this.id = id;
        this.position = new Point2d(position);
        this.initialEnergy = initialEnergy;
        this.energy = initialEnergy;
    }

    public int id() {
        return id;
    }

    /**
     * @return a copy of the node position
     */
    public Point2d position() {
        return new Point2d(position);
    }

    public double x() {
        return position.x;
    }

    public double y() {
        return position.y;
    }

    public double energy() {
        return energy;
    }

    public double initialEnergy() {
        return initialEnergy;
    }

    /**
     * @return energy spent since the start of the simulation
     */
    public double consumed() {
        return initialEnergy - energy;
    }

    public boolean isAlive() {
        return energy > 0.0;
    }

    public NodeRole role() {
        return role;
    }

    /**
     * Assign the protocol role for the current round. Dead nodes keep {@link NodeRole#NORMAL}.
     *
     * @param role the new role
     */
    public void setRole(NodeRole role) {
        this.role = isAlive() ? role : NodeRole.NORMAL;
    }

    /**
     * Set the remaining energy, clamped at zero.
     *
     * @return true if this call is the first to observe the node dead
     */
    boolean drainTo(double balance) {
        energy = Math.max(0.0, Math.min(energy, balance));
        if (energy <= 0.0) {
            energy = 0.0;
            role = NodeRole.NORMAL;
            if (!deathReported) {
                deathReported = true;
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("SensorNode{id=%d, pos=(%.2f, %.2f), energy=%.6f, role=%s}", id, position.x, position.y,
                             energy, role);
    }
}
