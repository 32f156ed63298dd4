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

import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;
import com.hellblazer.sensornet.common.SimulationException.LogicException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class DeterministicMathTest {

    @Test
    void testDistance() {
        assertEquals(5.0, DeterministicMath.distance(0, 0, 3, 4), 1e-12);
        assertEquals(0.0, DeterministicMath.distance(7, 7, 7, 7));
        assertEquals(DeterministicMath.distance(1, 2, 3, 4), DeterministicMath.distance(3, 4, 1, 2),
                     "distance must be symmetric");
    }

    @Test
    void testPowers() {
        assertEquals(9.0, DeterministicMath.square(3.0));
        assertEquals(16.0, DeterministicMath.pow4(2.0));
    }

    @Test
    void testStableSumOfManySmallValues() {
        var values = new double[1000];
        for (int i = 0; i < values.length; i++) {
            values[i] = 0.1;
        }
        assertEquals(100.0, DeterministicMath.stableSum(values), 1e-9);
        assertEquals(0.0, DeterministicMath.stableSum(new double[0]));
    }

    @Test
    void testStableSumGroupsPairwise() {
        var values = new double[] { 1e16, 1.0, -1e16, 1.0 };
        assertEquals((values[0] + values[1]) + (values[2] + values[3]), DeterministicMath.stableSum(values));
        assertEquals(0.0, DeterministicMath.stableSum(values), "pairwise grouping, not compensated");
        assertEquals(1.0, ((values[0] + values[1]) + values[2]) + values[3], "left to right gives a different total");
    }

    @Test
    void testIsFinite() {
        assertTrue(DeterministicMath.isFinite(1.0));
        assertFalse(DeterministicMath.isFinite(Double.NaN));
        assertFalse(DeterministicMath.isFinite(Double.POSITIVE_INFINITY));
    }

    @Test
    void testExceptionHierarchy() {
        SimulationException config = new ConfigurationException("nodeCount", "must be at least 1: 0");
        assertTrue(config.getMessage().contains("nodeCount"));
        assertEquals("nodeCount", ((ConfigurationException) config).getOption());

        var logic = new LogicException("Cannot schedule into the past", 10.0, 5.0);
        assertEquals(10.0, logic.getClock());
        assertEquals(5.0, logic.getRequested());
        assertInstanceOf(SimulationException.class, logic);
    }
}
