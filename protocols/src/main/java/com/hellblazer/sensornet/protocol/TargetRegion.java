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
import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;

import javax.vecmath.Point2d;

/**
 * Circular region a GEAR query is addressed to.
 *
 * @param center region center
 * @param radius region radius in meters
 * @author hal.hildebrand
 */
public record TargetRegion(Point2d center, double radius) {

    public TargetRegion {
        if (center == null || !DeterministicMath.isFinite(center.x) || !DeterministicMath.isFinite(center.y)) {
            throw new ConfigurationException("gear.regions", "region center must be finite: " + center);
        }
        if (!DeterministicMath.isFinite(radius) || radius <= 0.0) {
            throw new ConfigurationException("gear.regions", "region radius must be positive: " + radius);
        }
        center = new Point2d(center);
    }

    public static TargetRegion of(double x, double y, double radius) {
        return new TargetRegion(new Point2d(x, y), radius);
    }

    @Override
    public Point2d center() {
        return new Point2d(center);
    }

    public boolean contains(double x, double y) {
        return distanceToCenter(x, y) <= radius;
    }

    public double distanceToCenter(double x, double y) {
        return DeterministicMath.distance(x, y, center.x, center.y);
    }

    @Override
    public String toString() {
        return String.format("TargetRegion[(%.2f, %.2f) r=%.2f]", center.x, center.y, radius);
    }
}
