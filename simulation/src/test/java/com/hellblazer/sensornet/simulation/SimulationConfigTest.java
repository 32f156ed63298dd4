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

import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;
import com.hellblazer.sensornet.network.EnergyModel;
import com.hellblazer.sensornet.protocol.*;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point2d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class SimulationConfigTest {

    @Test
    void testDefaults() {
        var config = SimulationConfig.defaultConfig();
        assertEquals(100, config.getNodeCount());
        assertEquals(100.0, config.getWidth());
        assertEquals(100.0, config.getHeight());
        assertEquals(0.5, config.getInitialEnergy());
        assertEquals(new Point2d(50, 50), config.getBaseStation(), "the sink defaults to the area center");
        assertEquals(ProtocolKind.LEACH, config.getProtocol());
        assertEquals(42L, config.getRandomSeed());
        assertEquals(1000, config.getRoundHorizon());
        assertEquals(30.0, config.getRadioRange());
        assertEquals(4000, config.getDataBits());
        assertEquals(50, config.getControlBits());
        assertEquals(100, config.getFloodBits());
        assertEquals(100.0, config.getRoundDuration());
        assertEquals(0.05, config.getLeachParameters().getClusterHeadFraction());
        assertEquals(Math.sqrt(2) * 50.0, config.getLeachParameters().getAdvertisementRadius(), 1e-9);
        assertEquals(2, config.getGearParameters().getRegions().size());
        assertEquals(100, config.getNodePositions().size());
    }

    @Test
    void testDrawnPositionsDependOnlyOnSeed() {
        var a = SimulationConfig.builder().withRandomSeed(7).build();
        var b = SimulationConfig.builder().withRandomSeed(7).build();
        var c = SimulationConfig.builder().withRandomSeed(8).build();
        assertEquals(a.getNodePositions(), b.getNodePositions());
        assertNotEquals(a.getNodePositions(), c.getNodePositions());
        for (var p : a.getNodePositions()) {
            assertTrue(p.x >= 0 && p.x <= 100 && p.y >= 0 && p.y <= 100, "inside the area: " + p);
        }
        assertEquals(a.getNodePositions(), a.withProtocol(ProtocolKind.GEAR).getNodePositions(),
                     "another protocol sees the same deployment");
        assertNotEquals(a.getNodePositions(), a.withRandomSeed(8).getNodePositions());
    }

    @Test
    void testExplicitPositionsSetNodeCount() {
        var positions = List.of(new Point2d(1, 1), new Point2d(2, 2), new Point2d(3, 3));
        var config = SimulationConfig.builder().withNodePositions(positions).build();
        assertEquals(3, config.getNodeCount());
        assertEquals(positions, config.getNodePositions());
        config.getNodePositions().get(0).x = 99;
        assertEquals(1.0, config.getNodePositions().get(0).x, "positions are copied out");
        assertEquals(positions, config.withRandomSeed(99).getNodePositions(), "explicit positions survive a reseed");
    }

    @Test
    void testPositionCountMismatch() {
        var builder = SimulationConfig.builder()
                                      .withNodePositions(List.of(new Point2d(1, 1), new Point2d(2, 2)))
                                      .withNodeCount(5);
        var e = assertThrows(ConfigurationException.class, builder::build);
        assertEquals("nodePositions", e.getOption());
    }

    @Test
    void testPositionOutsideArea() {
        var builder = SimulationConfig.builder().withNodePositions(List.of(new Point2d(150, 10)));
        var e = assertThrows(ConfigurationException.class, builder::build);
        assertEquals("nodePositions", e.getOption());
    }

    @Test
    void testBaseStationBound() {
        var outside = SimulationConfig.builder().withBaseStation(0, -200).build();
        assertEquals(new Point2d(0, -200), outside.getBaseStation(), "a sink outside the field is allowed");
        var e = assertThrows(ConfigurationException.class,
                             () -> SimulationConfig.builder().withBaseStation(5000, 0).build());
        assertEquals("baseStation", e.getOption());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().withBaseStation(Double.NaN, 0));
    }

    @Test
    void testInvalidOptions() {
        var builder = SimulationConfig.builder();
        assertEquals("nodeCount", assertThrows(ConfigurationException.class, () -> builder.withNodeCount(0)).getOption());
        assertEquals("initialEnergy",
                     assertThrows(ConfigurationException.class, () -> builder.withInitialEnergy(-1.0)).getOption());
        assertEquals("area", assertThrows(ConfigurationException.class, () -> builder.withArea(0, 10)).getOption());
        assertEquals("radioRange",
                     assertThrows(ConfigurationException.class, () -> builder.withRadioRange(Double.NaN)).getOption());
        assertEquals("roundHorizon",
                     assertThrows(ConfigurationException.class, () -> builder.withRoundHorizon(0)).getOption());
        assertEquals("protocol",
                     assertThrows(ConfigurationException.class, () -> builder.withProtocol("SPIN")).getOption());
        assertEquals(ProtocolKind.PEGASIS, builder.withProtocol("pegasis").build().getProtocol());
    }

    @Test
    void testAreaDerivedDefaultsFollowArea() {
        var config = SimulationConfig.builder().withArea(200, 100).build();
        assertEquals(new Point2d(100, 50), config.getBaseStation());
        assertEquals(150.0, config.getGearParameters().getRegions().get(0).center().x);
        var resized = config.toBuilder().withArea(400, 100).withBaseStation(200, 50).build();
        assertEquals(300.0, resized.getGearParameters().getRegions().get(0).center().x,
                     "derived regions are not frozen by toBuilder");
    }

    @Test
    void testCreateEngineMatchesProtocol() {
        var config = SimulationConfig.builder().withNodeCount(10).build();
        assertInstanceOf(LeachEngine.class, config.createEngine());
        assertInstanceOf(DirectedDiffusionEngine.class,
                         config.withProtocol(ProtocolKind.DIRECTED_DIFFUSION).createEngine());
        assertInstanceOf(GearEngine.class, config.withProtocol(ProtocolKind.GEAR).createEngine());
        assertInstanceOf(PegasisEngine.class, config.withProtocol(ProtocolKind.PEGASIS).createEngine());
        assertEquals(10, config.createTopology().size());
    }

    @Test
    void testCustomOptionsFlowThrough() {
        var energy = EnergyModel.Parameters.builder()
                                           .withFreeSpaceAmplifier(20e-12)
                                           .withMultipathAmplifier(0.002e-12)
                                           .withAggregationPerBit(4e-9)
                                           .withSensingPerBit(1e-9)
                                           .build();
        var diffusion = DiffusionParameters.builder().withSourceCount(2).withGradientTimeout(250.0).build();
        var pegasis = PegasisParameters.builder().withLeaderPolicy(PegasisParameters.LeaderPolicy.ENERGY_RANK).build();
        var gear = GearParameters.builder().withRegions(List.of(TargetRegion.of(10, 10, 5))).build();
        var config = SimulationConfig.builder()
                                     .withNodeCount(10)
                                     .withPacketBits(2000)
                                     .withControlBits(40)
                                     .withFloodBits(80)
                                     .withRoundDuration(50.0)
                                     .withEnergyParameters(energy)
                                     .withDiffusionParameters(diffusion)
                                     .withPegasisParameters(pegasis)
                                     .withGearParameters(gear)
                                     .build();

        var settings = config.settings();
        assertEquals(2000, settings.dataBits());
        assertEquals(40, settings.controlBits());
        assertEquals(80, settings.floodBits());
        assertEquals(50.0, settings.roundDuration());
        assertEquals(100.0, config.getEnergyParameters().getCrossoverDistance(), 1e-9);
        assertEquals(4e-9 * 100, config.createEnergyModel().aggregationCost(100), 1e-18);
        assertEquals(250.0, config.getDiffusionParameters().getGradientTimeout());
        assertSame(pegasis, config.getPegasisParameters());
        assertEquals(1, config.getGearParameters().getRegions().size());

        var copy = config.withProtocol(ProtocolKind.GEAR);
        assertSame(gear, copy.getGearParameters(), "configured parameters survive toBuilder");
        assertSame(diffusion, copy.getDiffusionParameters());
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().withPacketBits(0));
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().withRoundDuration(-1.0));
        assertThrows(ConfigurationException.class, () -> SimulationConfig.builder().withEnergyParameters(null));
    }
}
