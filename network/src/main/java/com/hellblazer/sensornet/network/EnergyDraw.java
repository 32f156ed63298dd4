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

/**
 * Result of charging an energy cost to a node.
 *
 * @param balance    remaining energy after the charge, never negative
 * @param died       true only on the charge that killed the node
 * @param sufficient true if the node held enough energy to complete the action
 * @author hal.hildebrand
 */
public record EnergyDraw(double balance, boolean died, boolean sufficient) {

    /**
     * Charge against a node that was already dead: nothing changes and the action does not happen.
     */
    public static EnergyDraw deadNode() {
        return new EnergyDraw(0.0, false, false);
    }

    /**
     * Charge against the base station, which never runs out of energy.
     */
    public static EnergyDraw unlimited() {
        return new EnergyDraw(Double.POSITIVE_INFINITY, false, true);
    }

    /**
     * @return true if the action completed, even if it exhausted the node
     */
    public boolean completed() {
        return sufficient;
    }
}
