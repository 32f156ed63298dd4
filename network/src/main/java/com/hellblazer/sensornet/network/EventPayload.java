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

import java.util.OptionalInt;

/**
 * Discriminated payload of a scheduled event.
 * <p>
 * The scheduler carries payloads without interpreting them. Each protocol engine defines its own payload records
 * (advertisements, interest floods, chain relays, ...) and recognizes them with {@code instanceof} patterns.
 *
 * @author hal.hildebrand
 */
public interface EventPayload {

    /**
     * @return id of the node that originated the event, or {@link Topology#BASE_STATION}
     */
    int origin();

    /**
     * @return id of the node the event is addressed to, if any
     */
    default OptionalInt target() {
        return OptionalInt.empty();
    }
}
