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
 * Parameters of the LEACH clustering protocol.
 *
 * @author hal.hildebrand
 */
public final class LeachParameters {

    public static final double DEFAULT_CLUSTER_HEAD_FRACTION = 0.05;

    private final double clusterHeadFraction;
    private final double advertisementRadius;

    private LeachParameters(Builder builder) {
        this.clusterHeadFraction = builder.clusterHeadFraction;
        this.advertisementRadius = builder.advertisementRadius;
    }

    public static LeachParameters defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return P, the target fraction of nodes acting as cluster head in a round
     */
    public double getClusterHeadFraction() {
        return clusterHeadFraction;
    }

    /**
     * @return radius covered by an advertisement, or NaN to reach the farthest live node
     */
    public double getAdvertisementRadius() {
        return advertisementRadius;
    }

    public boolean hasAdvertisementRadius() {
        return !Double.isNaN(advertisementRadius);
    }

    /**
     * @return rounds per rotation cycle, {@code round(1 / P)}, at least one
     */
    public int cycleLength() {
        return Math.max(1, (int) Math.round(1.0 / clusterHeadFraction));
    }

    @Override
    public String toString() {
        return String.format("LeachParameters[P=%.3f, advertisementRadius=%.2f]", clusterHeadFraction,
                             advertisementRadius);
    }

    public static class Builder {
        private double clusterHeadFraction = DEFAULT_CLUSTER_HEAD_FRACTION;
        private double advertisementRadius = Double.NaN;

        private Builder() {
        }

        /**
         * @param p fraction in (0, 1]
         */
        public Builder withClusterHeadFraction(double p) {
            if (!DeterministicMath.isFinite(p) || p <= 0.0 || p > 1.0) {
                throw new ConfigurationException("leach.p", "cluster head fraction must be in (0, 1]: " + p);
            }
            this.clusterHeadFraction = p;
            return this;
        }

        /**
         * @param radius advertisement radius in meters
         */
        public Builder withAdvertisementRadius(double radius) {
            if (!DeterministicMath.isFinite(radius) || radius <= 0.0) {
                throw new ConfigurationException("leach.advertisementRadius", "must be positive: " + radius);
            }
            this.advertisementRadius = radius;
            return this;
        }

        public LeachParameters build() {
            return new LeachParameters(this);
        }
    }
}
