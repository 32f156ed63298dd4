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

/**
 * Parameters of the PEGASIS chain protocol.
 *
 * @author hal.hildebrand
 */
public final class PegasisParameters {

    /**
     * How the chain leader is chosen each round.
     */
    public enum LeaderPolicy {
        /**
         * Chain position {@code round mod chainLength}
         */
        ROUND_ROBIN,

        /**
         * The chain member with the most remaining energy, lowest chain position on ties
         */
        ENERGY_RANK
    }

    private final LeaderPolicy leaderPolicy;
    private final int          rebuildInterval;

    private PegasisParameters(Builder builder) {
        this.leaderPolicy = builder.leaderPolicy;
        this.rebuildInterval = builder.rebuildInterval;
    }

    public static PegasisParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public LeaderPolicy getLeaderPolicy() {
        return leaderPolicy;
    }

    /**
     * @return rounds between unconditional chain rebuilds, zero to rebuild only when a member dies
     */
    public int getRebuildInterval() {
        return rebuildInterval;
    }

    @Override
    public String toString() {
        return String.format("PegasisParameters[leader=%s, rebuildInterval=%d]", leaderPolicy, rebuildInterval);
    }

    public static class Builder {
        private LeaderPolicy leaderPolicy    = LeaderPolicy.ROUND_ROBIN;
        private int          rebuildInterval = 0;

        private Builder() {
        }

        public Builder withLeaderPolicy(LeaderPolicy policy) {
            if (policy == null) {
                throw new ConfigurationException("pegasis.leaderPolicy", "must not be null");
            }
            this.leaderPolicy = policy;
            return this;
        }

        public Builder withRebuildInterval(int rounds) {
            if (rounds < 0) {
                throw new ConfigurationException("pegasis.rebuildInterval", "must not be negative: " + rounds);
            }
            this.rebuildInterval = rounds;
            return this;
        }

        public PegasisParameters build() {
            return new PegasisParameters(this);
        }
    }
}
