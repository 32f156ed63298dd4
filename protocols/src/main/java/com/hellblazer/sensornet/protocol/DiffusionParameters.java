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

/**
 * Parameters of the Directed Diffusion protocol.
 *
 * @author hal.hildebrand
 */
public final class DiffusionParameters {

    public static final int    DEFAULT_INTEREST_INTERVAL    = 2;
    public static final int    DEFAULT_EXPLORATION_INTERVAL = 2;
    public static final int    DEFAULT_SOURCE_COUNT         = 5;
    public static final double DEFAULT_EXPLORATORY_RATE     = 1.0;

    private final int    interestInterval;
    private final int    explorationInterval;
    private final int    sourceCount;
    private final double gradientTimeout;
    private final double exploratoryRate;

    private DiffusionParameters(Builder builder) {
        this.interestInterval = builder.interestInterval;
        this.explorationInterval = builder.explorationInterval;
        this.sourceCount = builder.sourceCount;
        this.gradientTimeout = builder.gradientTimeout;
        this.exploratoryRate = builder.exploratoryRate;
    }

    public static DiffusionParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return rounds between interest floods; each flood carries a new sequence number and picks new sources
     */
    public int getInterestInterval() {
        return interestInterval;
    }

    /**
     * @return rounds between exploratory rediscovery of paths, zero to explore only after a new interest
     */
    public int getExplorationInterval() {
        return explorationInterval;
    }

    public int getSourceCount() {
        return sourceCount;
    }

    /**
     * @return time a gradient survives without refresh, or NaN for twice the interest period
     */
    public double getGradientTimeout() {
        return gradientTimeout;
    }

    /**
     * Gradient lifetime for a given round duration.
     */
    public double gradientTimeout(double roundDuration) {
        return Double.isNaN(gradientTimeout) ? 2.0 * interestInterval * roundDuration : gradientTimeout;
    }

    /**
     * @return data rate an interest asks for, in readings per round; reinforced gradients run at twice this rate
     */
    public double getExploratoryRate() {
        return exploratoryRate;
    }

    @Override
    public String toString() {
        return String.format("DiffusionParameters[interest=%d, exploration=%d, sources=%d, timeout=%.1f, rate=%.2f]",
                             interestInterval, explorationInterval, sourceCount, gradientTimeout, exploratoryRate);
    }

    public static class Builder {
        private int    interestInterval    = DEFAULT_INTEREST_INTERVAL;
        private int    explorationInterval = DEFAULT_EXPLORATION_INTERVAL;
        private int    sourceCount         = DEFAULT_SOURCE_COUNT;
        private double gradientTimeout     = Double.NaN;
        private double exploratoryRate     = DEFAULT_EXPLORATORY_RATE;

        private Builder() {
        }

        public Builder withInterestInterval(int rounds) {
            if (rounds < 1) {
                throw new ConfigurationException("diffusion.interestInterval", "must be at least 1: " + rounds);
            }
            this.interestInterval = rounds;
            return this;
        }

        public Builder withExplorationInterval(int rounds) {
            if (rounds < 0) {
                throw new ConfigurationException("diffusion.explorationInterval", "must not be negative: " + rounds);
            }
            this.explorationInterval = rounds;
            return this;
        }

        public Builder withSourceCount(int count) {
            if (count < 1) {
                throw new ConfigurationException("diffusion.sourceCount", "must be at least 1: " + count);
            }
            this.sourceCount = count;
            return this;
        }

        public Builder withGradientTimeout(double timeout) {
            if (!DeterministicMath.isFinite(timeout) || timeout <= 0.0) {
                throw new ConfigurationException("diffusion.gradientTimeout", "must be positive: " + timeout);
            }
            this.gradientTimeout = timeout;
            return this;
        }

        public Builder withExploratoryRate(double readingsPerRound) {
            if (!DeterministicMath.isFinite(readingsPerRound) || readingsPerRound <= 0.0) {
                throw new ConfigurationException("diffusion.exploratoryRate", "must be positive: " + readingsPerRound);
            }
            this.exploratoryRate = readingsPerRound;
            return this;
        }

        public DiffusionParameters build() {
            return new DiffusionParameters(this);
        }
    }
}
