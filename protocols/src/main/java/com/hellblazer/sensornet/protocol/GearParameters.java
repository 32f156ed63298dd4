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

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of GEAR, Geographical and Energy Aware Routing.
 *
 * @author hal.hildebrand
 */
public final class GearParameters {

    public static final double DEFAULT_ALPHA         = 0.5;
    public static final double DEFAULT_REGION_RADIUS = 15.0;

    private final double             alpha;
    private final List<TargetRegion> regions;

    private GearParameters(Builder builder) {
        this.alpha = builder.alpha;
        this.regions = List.copyOf(builder.regions);
    }

    /**
     * Default parameters for a deployment area: one region around (0.75w, 0.75h) and one around (0.25w, 0.25h).
     */
    public static GearParameters defaults(double width, double height) {
        return builder().withRegion(TargetRegion.of(0.75 * width, 0.75 * height, DEFAULT_REGION_RADIUS))
                        .withRegion(TargetRegion.of(0.25 * width, 0.25 * height, DEFAULT_REGION_RADIUS))
                        .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return weight of distance against inverse energy in the forwarding cost
     */
    public double getAlpha() {
        return alpha;
    }

    /**
     * @return regions queried every round, in query order
     */
    public List<TargetRegion> getRegions() {
        return regions;
    }

    @Override
    public String toString() {
        return String.format("GearParameters[alpha=%.2f, regions=%s]", alpha, regions);
    }

    public static class Builder {
        private final List<TargetRegion> regions = new ArrayList<>();
        private double                   alpha   = DEFAULT_ALPHA;

        private Builder() {
        }

        /**
         * @param alpha weight in [0, 1]
         */
        public Builder withAlpha(double alpha) {
            if (!DeterministicMath.isFinite(alpha) || alpha < 0.0 || alpha > 1.0) {
                throw new ConfigurationException("gear.alpha", "must be in [0, 1]: " + alpha);
            }
            this.alpha = alpha;
            return this;
        }

        public Builder withRegion(TargetRegion region) {
            if (region == null) {
                throw new ConfigurationException("gear.regions", "region must not be null");
            }
            regions.add(region);
            return this;
        }

        public Builder withRegions(List<TargetRegion> regions) {
            this.regions.clear();
            if (regions != null) {
                regions.forEach(this::withRegion);
            }
            return this;
        }

        public GearParameters build() {
            if (regions.isEmpty()) {
                throw new ConfigurationException("gear.regions", "at least one target region is required");
            }
            return new GearParameters(this);
        }
    }
}
