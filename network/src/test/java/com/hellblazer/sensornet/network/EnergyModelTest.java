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

import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import javax.vecmath.Point2d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class EnergyModelTest {

    private EnergyModel model;

    @BeforeEach
    void setUp() {
        model = EnergyModel.defaultModel();
    }

    @Test
    void testDefaultCrossoverDistance() {
        assertEquals(87.7058, model.parameters().getCrossoverDistance(), 1e-4);
    }

    @Test
    void testFreeSpaceTransmitCost() {
        // electronics 4000 * 50nJ plus amplifier 4000 * 10pJ * 10^2
        assertEquals(2.04e-4, model.transmitCost(10.0, 4000), 1e-12);
    }

    @Test
    void testMultipathTransmitCost() {
        // electronics 4000 * 50nJ plus amplifier 4000 * 0.0013pJ * 100^4
        assertEquals(7.2e-4, model.transmitCost(100.0, 4000), 1e-12);
    }

    @Test
    void testLongRangeIsDisproportionatelyExpensive() {
        double near = model.transmitCost(20.0, 4000) - model.receiveCost(4000);
        double far = model.transmitCost(160.0, 4000) - model.receiveCost(4000);
        assertTrue(far > 64 * near, "amplifier cost past the crossover must grow faster than quadratically");
    }

    @Test
    void testReceiveSensingAndAggregationCosts() {
        assertEquals(2e-4, model.receiveCost(4000), 1e-15);
        assertEquals(2e-5, model.sensingCost(4000), 1e-15);
        assertEquals(2e-5, model.aggregationCost(4000), 1e-15);
    }

    @Test
    void testApplyDecrements() {
        var node = new SensorNode(0, new Point2d(0, 0), 1.0);
        var draw = model.apply(node, 0.25);
        assertEquals(0.75, draw.balance(), 1e-15);
        assertFalse(draw.died());
        assertTrue(draw.sufficient());
        assertTrue(draw.completed());
        assertEquals(0.25, node.consumed(), 1e-15);
    }

    @Test
    void testInsufficientEnergyKillsAndClampsAtZero() {
        var node = new SensorNode(0, new Point2d(0, 0), 0.1);
        var draw = model.apply(node, 0.5);
        assertEquals(0.0, draw.balance());
        assertTrue(draw.died());
        assertFalse(draw.sufficient());
        assertFalse(node.isAlive());
        assertEquals(0.0, node.energy(), "energy must never go negative");
    }

    @Test
    void testDeathIsReportedOnce() {
        var node = new SensorNode(0, new Point2d(0, 0), 0.1);
        assertTrue(model.apply(node, 0.1).died(), "exact balance completes the action and kills the node");
        var again = model.apply(node, 0.1);
        assertFalse(again.died());
        assertFalse(again.sufficient());
        assertEquals(0.0, node.energy());
    }

    @Test
    void testDeadNodeLosesRole() {
        var node = new SensorNode(0, new Point2d(0, 0), 0.1);
        node.setRole(NodeRole.CLUSTER_HEAD);
        model.apply(node, 1.0);
        assertEquals(NodeRole.NORMAL, node.role());
        node.setRole(NodeRole.CLUSTER_HEAD);
        assertEquals(NodeRole.NORMAL, node.role(), "a dead node cannot take a role");
    }

    @Test
    void testNegativeCostIsRejected() {
        var node = new SensorNode(0, new Point2d(0, 0), 0.1);
        assertThrows(IllegalArgumentException.class, () -> model.apply(node, -1.0));
    }

    @ParameterizedTest
    @ValueSource(doubles = { -1.0, Double.NaN, Double.POSITIVE_INFINITY })
    void testInvalidParameters(double value) {
        assertThrows(ConfigurationException.class,
                     () -> EnergyModel.Parameters.builder().withElectronicsPerBit(value));
        assertThrows(ConfigurationException.class,
                     () -> EnergyModel.Parameters.builder().withCrossoverDistance(value));
    }

    @Test
    void testExplicitCrossover() {
        var custom = new EnergyModel(EnergyModel.Parameters.builder().withCrossoverDistance(50.0).build());
        // 60m is multipath under a 50m crossover
        double expected = 4000 * 50e-9 + 4000 * 0.0013e-12 * Math.pow(60.0, 4);
        assertEquals(expected, custom.transmitCost(60.0, 4000), 1e-12);
    }
}
