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

import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation of the per protocol parameter builders.
 *
 * @author hal.hildebrand
 */
class ProtocolParametersTest {

    @Test
    void testLeachDefaults() {
        var leach = LeachParameters.defaults();
        assertEquals(0.05, leach.getClusterHeadFraction());
        assertEquals(20, leach.cycleLength());
        assertFalse(leach.hasAdvertisementRadius());
        assertEquals(3, LeachParameters.builder().withClusterHeadFraction(0.3).build().cycleLength());
    }

    @Test
    void testLeachRejectsInvalidFraction() {
        var builder = LeachParameters.builder();
        assertThrows(ConfigurationException.class, () -> builder.withClusterHeadFraction(0.0));
        assertThrows(ConfigurationException.class, () -> builder.withClusterHeadFraction(1.5));
        assertThrows(ConfigurationException.class, () -> builder.withClusterHeadFraction(Double.NaN));
        assertThrows(ConfigurationException.class, () -> builder.withAdvertisementRadius(-1.0));
        assertEquals(1, builder.withClusterHeadFraction(1.0).build().cycleLength());
    }

    @Test
    void testGearRequiresRegions() {
        var e = assertThrows(ConfigurationException.class, () -> GearParameters.builder().build());
        assertEquals("gear.regions", e.getOption());
        assertThrows(ConfigurationException.class, () -> GearParameters.builder().withAlpha(1.5));
        assertThrows(ConfigurationException.class, () -> TargetRegion.of(10, 10, 0.0));
    }

    @Test
    void testGearDefaultRegions() {
        var gear = GearParameters.defaults(200, 100);
        assertEquals(0.5, gear.getAlpha());
        var regions = gear.getRegions();
        assertEquals(2, regions.size());
        assertEquals(150.0, regions.get(0).center().x);
        assertEquals(75.0, regions.get(0).center().y);
        assertEquals(50.0, regions.get(1).center().x);
        assertEquals(15.0, regions.get(1).radius());
        assertThrows(UnsupportedOperationException.class, () -> regions.add(TargetRegion.of(1, 1, 1)));
    }

    @Test
    void testTargetRegionContainment() {
        var region = TargetRegion.of(50, 50, 10);
        assertTrue(region.contains(50, 60));
        assertFalse(region.contains(50, 60.5));
        assertEquals(5.0, region.distanceToCenter(53, 54), 1e-12);
        region.center().x = 0;
        assertEquals(50.0, region.center().x, "center is copied out");
    }

    @Test
    void testPegasisParameters() {
        var pegasis = PegasisParameters.defaults();
        assertEquals(PegasisParameters.LeaderPolicy.ROUND_ROBIN, pegasis.getLeaderPolicy());
        assertEquals(0, pegasis.getRebuildInterval());
        assertThrows(ConfigurationException.class, () -> PegasisParameters.builder().withRebuildInterval(-1));
        assertThrows(ConfigurationException.class, () -> PegasisParameters.builder().withLeaderPolicy(null));
    }

    @Test
    void testDiffusionGradientTimeoutDerivesFromInterestInterval() {
        var diffusion = DiffusionParameters.defaults();
        assertEquals(400.0, diffusion.gradientTimeout(100.0), 1e-12);
        var custom = DiffusionParameters.builder().withGradientTimeout(75.0).build();
        assertEquals(75.0, custom.gradientTimeout(100.0));
        assertThrows(ConfigurationException.class, () -> DiffusionParameters.builder().withInterestInterval(0));
        assertThrows(ConfigurationException.class, () -> DiffusionParameters.builder().withSourceCount(0));
        assertEquals(List.of(), List.copyOf(new DirectedDiffusionEngine(diffusion, 4).sources()));
    }

    @Test
    void testDiffusionExploratoryRate() {
        assertEquals(DiffusionParameters.DEFAULT_EXPLORATORY_RATE, DiffusionParameters.defaults().getExploratoryRate());
        assertEquals(0.25, DiffusionParameters.builder().withExploratoryRate(0.25).build().getExploratoryRate());
        assertThrows(ConfigurationException.class, () -> DiffusionParameters.builder().withExploratoryRate(0.0));
        assertThrows(ConfigurationException.class,
                     () -> DiffusionParameters.builder().withExploratoryRate(Double.POSITIVE_INFINITY));
    }
}
