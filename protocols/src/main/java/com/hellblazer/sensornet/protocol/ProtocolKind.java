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

import java.util.Locale;

/**
 * The closed set of routing protocols the simulator can evaluate.
 *
 * @author hal.hildebrand
 */
public enum ProtocolKind {
    LEACH("LEACH"),
    DIRECTED_DIFFUSION("DirectedDiffusion"),
    GEAR("GEAR"),
    PEGASIS("PEGASIS");

    private final String displayName;

    ProtocolKind(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Resolve a protocol from its display name or enum constant name, ignoring case, spaces, dashes and underscores.
     *
     * @param name protocol name such as "LEACH", "DirectedDiffusion" or "directed_diffusion"
     * @return the protocol
     * @throws ConfigurationException if the name matches no protocol
     */
    public static ProtocolKind fromName(String name) {
        if (name == null) {
            throw new ConfigurationException("protocol", "protocol name is required");
        }
        var normalized = normalize(name);
        for (var kind : values()) {
            if (normalize(kind.displayName).equals(normalized) || normalize(kind.name()).equals(normalized)) {
                return kind;
            }
        }
        throw new ConfigurationException("protocol", "unknown protocol: " + name);
    }

    private static String normalize(String name) {
        return name.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
