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
package com.hellblazer.sensornet.common;

/**
 * Cross-platform deterministic math for the sensor network simulation.
 * <p>
 * Two runs with the same configuration and seed must produce identical outcome sequences, so every distance and
 * energy computation goes through StrictMath (IEEE 754 compliance) rather than Math, and residual energy totals are
 * summed pairwise over a fixed binary reduction tree. The grouping depends only on the array length, so the same
 * values in the same order always give the same total. It is not compensated summation, and reordering the values
 * may change the last bits.
 * <p>
 * Usage:
 * <pre>
 * double d = DeterministicMath.distance(ax, ay, bx, by);
 * double amp = bits * coefficient * DeterministicMath.pow4(d);
 * double residual = DeterministicMath.stableSum(energies);
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class DeterministicMath {

    private DeterministicMath() {
    }

    /**
     * Deterministic square root.
     *
     * @param x Input value
     * @return Square root of x
     */
    public static double sqrt(double x) {
        return StrictMath.sqrt(x);
    }

    /**
     * Euclidean distance between two points in the plane.
     *
     * @param ax X coordinate of the first point
     * @param ay Y coordinate of the first point
     * @param bx X coordinate of the second point
     * @param by Y coordinate of the second point
     * @return distance between (ax, ay) and (bx, by)
     */
    public static double distance(double ax, double ay, double bx, double by) {
        double dx = ax - bx;
        double dy = ay - by;
        return StrictMath.sqrt(dx * dx + dy * dy);
    }

    /**
     * @return x squared
     */
    public static double square(double x) {
        return x * x;
    }

    /**
     * @return x to the fourth power
     */
    public static double pow4(double x) {
        double sq = x * x;
        return sq * sq;
    }

    /**
     * Clamp value between min and max.
     *
     * @param value Value to clamp
     * @param min   Minimum value
     * @param max   Maximum value
     * @return Clamped value
     */
    public static double clamp(double value, double min, double max) {
        return StrictMath.max(min, StrictMath.min(max, value));
    }

    /**
     * Pairwise summation: each half of the range is summed recursively and the two halves are added.
     * <p>
     * Complexity: O(n) additions, O(log n) recursion depth
     *
     * @param values Array of values to sum
     * @return Sum of all values
     */
    public static double stableSum(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return stableSumRecursive(values, 0, values.length);
    }

    private static double stableSumRecursive(double[] values, int start, int end) {
        int length = end - start;

        if (length == 0) {
            return 0.0;
        } else if (length == 1) {
            return values[start];
        } else {
            int mid = start + length / 2;
            return stableSumRecursive(values, start, mid) + stableSumRecursive(values, mid, end);
        }
    }

    /**
     * @return true if the value is neither NaN nor infinite
     */
    public static boolean isFinite(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }
}
