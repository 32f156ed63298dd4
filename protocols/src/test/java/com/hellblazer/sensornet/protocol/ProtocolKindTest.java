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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class ProtocolKindTest {

    @Test
    void testFromNameAcceptsDisplayAndConstantNames() {
        assertEquals(ProtocolKind.LEACH, ProtocolKind.fromName("LEACH"));
        assertEquals(ProtocolKind.LEACH, ProtocolKind.fromName("leach"));
        assertEquals(ProtocolKind.DIRECTED_DIFFUSION, ProtocolKind.fromName("DirectedDiffusion"));
        assertEquals(ProtocolKind.DIRECTED_DIFFUSION, ProtocolKind.fromName("directed_diffusion"));
        assertEquals(ProtocolKind.DIRECTED_DIFFUSION, ProtocolKind.fromName("Directed Diffusion"));
        assertEquals(ProtocolKind.GEAR, ProtocolKind.fromName("gear"));
        assertEquals(ProtocolKind.PEGASIS, ProtocolKind.fromName("Pegasis"));
    }

    @Test
    void testUnknownNameIsConfigurationError() {
        var e = assertThrows(ConfigurationException.class, () -> ProtocolKind.fromName("SPIN"));
        assertEquals("protocol", e.getOption());
        assertThrows(ConfigurationException.class, () -> ProtocolKind.fromName(null));
    }

    @ParameterizedTest
    @EnumSource(ProtocolKind.class)
    void testDisplayNameRoundTrips(ProtocolKind kind) {
        assertEquals(kind, ProtocolKind.fromName(kind.toString()));
        assertEquals(kind, ProtocolKind.fromName(kind.name()));
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "  ", "LEACH2", "diffusion" })
    void testNearMissesAreRejected(String name) {
        assertThrows(ConfigurationException.class, () -> ProtocolKind.fromName(name));
    }
}
