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

import com.hellblazer.sensornet.common.DeterministicMath;
import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;
import com.hellblazer.sensornet.network.EnergyModel;
import com.hellblazer.sensornet.network.SimulationContext;
import com.hellblazer.sensornet.network.Topology;
import com.hellblazer.sensornet.protocol.*;

import javax.vecmath.Point2d;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Immutable configuration of one simulation run.
 * <p>
 * Every option is validated when it is set, and cross option rules are checked by {@link Builder#build()}, so an
 * invalid setup fails with a {@link ConfigurationException} before any event is scheduled. Node positions that are
 * not given explicitly are drawn uniformly over the area from the run's seed, so two configurations with the same
 * seed describe the same deployment.
 *
 * @author hal.hildebrand
 */
public final class SimulationConfig {

    public static final int    DEFAULT_NODE_COUNT     = 100;
    public static final double DEFAULT_AREA           = 100.0;
    public static final double DEFAULT_INITIAL_ENERGY = 0.5;
    public static final double DEFAULT_RADIO_RANGE    = 30.0;
    public static final int    DEFAULT_DATA_BITS      = 4000;
    public static final int    DEFAULT_CONTROL_BITS   = 50;
    public static final int    DEFAULT_FLOOD_BITS     = 100;
    public static final double DEFAULT_ROUND_DURATION = 100.0;
    public static final long   DEFAULT_SEED           = 42L;
    public static final int    DEFAULT_ROUND_HORIZON  = 1000;

    /**
     * How far outside the area, in area diagonals, the base station may sit
     */
    public static final double MAX_BASE_STATION_DIAGONALS = 10.0;

    private final int                    nodeCount;
    private final double                 width;
    private final double                 height;
    private final double                 initialEnergy;
    private final Point2d                baseStation;
    private final ProtocolKind           protocol;
    private final long                   randomSeed;
    private final int                    roundHorizon;
    private final double                 radioRange;
    private final int                    dataBits;
    private final int                    controlBits;
    private final int                    floodBits;
    private final double                 roundDuration;
    private final EnergyModel.Parameters energyParameters;
    private final List<Point2d>          nodePositions;
    private final boolean                explicitPositions;
    // as configured, null when derived from the area
    private final LeachParameters        configuredLeach;
    private final GearParameters         configuredGear;
    private final LeachParameters        leachParameters;
    private final DiffusionParameters    diffusionParameters;
    private final GearParameters         gearParameters;
    private final PegasisParameters      pegasisParameters;

    private SimulationConfig(Builder builder, Point2d baseStation, List<Point2d> positions) {
        this.nodeCount = builder.nodeCount;
        this.width = builder.width;
        this.height = builder.height;
        this.initialEnergy = builder.initialEnergy;
        this.baseStation = baseStation;
        this.protocol = builder.protocol;
        this.randomSeed = builder.randomSeed;
        this.roundHorizon = builder.roundHorizon;
        this.radioRange = builder.radioRange;
        this.dataBits = builder.dataBits;
        this.controlBits = builder.controlBits;
        this.floodBits = builder.floodBits;
        this.roundDuration = builder.roundDuration;
        this.energyParameters = builder.energyParameters;
        this.nodePositions = positions;
        this.explicitPositions = builder.explicitPositions;
        this.configuredLeach = builder.leachParameters;
        this.configuredGear = builder.gearParameters;
        this.leachParameters = builder.leachParameters != null ? builder.leachParameters
                                                               : LeachParameters.builder()
                                                                                .withAdvertisementRadius(
                                                                                halfDiagonal())
                                                                                .build();
        this.diffusionParameters = builder.diffusionParameters != null ? builder.diffusionParameters
                                                                       : DiffusionParameters.defaults();
        this.gearParameters = builder.gearParameters != null ? builder.gearParameters
                                                             : GearParameters.defaults(width, height);
        this.pegasisParameters = builder.pegasisParameters != null ? builder.pegasisParameters
                                                                   : PegasisParameters.defaults();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaultConfig() {
        return builder().build();
    }

    public int getNodeCount() {
        return nodeCount;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getInitialEnergy() {
        return initialEnergy;
    }

    public Point2d getBaseStation() {
        return new Point2d(baseStation);
    }

    public ProtocolKind getProtocol() {
        return protocol;
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    /**
     * @return maximum number of rounds a run executes
     */
    public int getRoundHorizon() {
        return roundHorizon;
    }

    public double getRadioRange() {
        return radioRange;
    }

    public int getDataBits() {
        return dataBits;
    }

    public int getControlBits() {
        return controlBits;
    }

    public int getFloodBits() {
        return floodBits;
    }

    public double getRoundDuration() {
        return roundDuration;
    }

    public EnergyModel.Parameters getEnergyParameters() {
        return energyParameters;
    }

    /**
     * @return node positions in id order, either given explicitly or drawn from the seed
     */
    public List<Point2d> getNodePositions() {
        var copy = new ArrayList<Point2d>(nodePositions.size());
        for (var p : nodePositions) {
            copy.add(new Point2d(p));
        }
        return copy;
    }

    public LeachParameters getLeachParameters() {
        return leachParameters;
    }

    public DiffusionParameters getDiffusionParameters() {
        return diffusionParameters;
    }

    public GearParameters getGearParameters() {
        return gearParameters;
    }

    public PegasisParameters getPegasisParameters() {
        return pegasisParameters;
    }

    /**
     * The same configuration with another protocol.
     */
    public SimulationConfig withProtocol(ProtocolKind kind) {
        return toBuilder().withProtocol(kind).build();
    }

    /**
     * The same configuration with another seed. Drawn node positions are drawn again.
     */
    public SimulationConfig withRandomSeed(long seed) {
        return toBuilder().withRandomSeed(seed).build();
    }

    public Builder toBuilder() {
        var builder = new Builder();
        builder.nodeCount = nodeCount;
        builder.width = width;
        builder.height = height;
        builder.initialEnergy = initialEnergy;
        builder.baseStation = new Point2d(baseStation);
        builder.protocol = protocol;
        builder.randomSeed = randomSeed;
        builder.roundHorizon = roundHorizon;
        builder.radioRange = radioRange;
        builder.dataBits = dataBits;
        builder.controlBits = controlBits;
        builder.floodBits = floodBits;
        builder.roundDuration = roundDuration;
        builder.energyParameters = energyParameters;
        if (explicitPositions) {
            builder.nodePositions = getNodePositions();
            builder.explicitPositions = true;
        }
        builder.leachParameters = configuredLeach;
        builder.diffusionParameters = diffusionParameters;
        builder.gearParameters = configuredGear;
        builder.pegasisParameters = pegasisParameters;
        return builder;
    }

    Topology createTopology() {
        return new Topology(getNodePositions(), getBaseStation(), initialEnergy);
    }

    EnergyModel createEnergyModel() {
        return new EnergyModel(energyParameters);
    }

    SimulationContext.Settings settings() {
        return new SimulationContext.Settings(radioRange, dataBits, controlBits, floodBits, roundDuration);
    }

    ProtocolEngine createEngine() {
        return switch (protocol) {
            case LEACH -> new LeachEngine(leachParameters, nodeCount);
            case DIRECTED_DIFFUSION -> new DirectedDiffusionEngine(diffusionParameters, nodeCount);
            case GEAR -> new GearEngine(gearParameters, nodeCount);
            case PEGASIS -> new PegasisEngine(pegasisParameters);
        };
    }

    private double halfDiagonal() {
        return 0.5 * DeterministicMath.distance(0.0, 0.0, width, height);
    }

    @Override
    public String toString() {
        return String.format("SimulationConfig[protocol=%s, nodes=%d, area=%.1fx%.1f, energy=%.3f, base=(%.1f, %.1f), "
                             + "seed=%d, horizon=%d]", protocol, nodeCount, width, height, initialEnergy,
                             baseStation.x, baseStation.y, randomSeed, roundHorizon);
    }

    public static class Builder {
        private int                    nodeCount           = DEFAULT_NODE_COUNT;
        private double                 width               = DEFAULT_AREA;
        private double                 height              = DEFAULT_AREA;
        private double                 initialEnergy       = DEFAULT_INITIAL_ENERGY;
        private Point2d                baseStation         = null;
        private ProtocolKind           protocol            = ProtocolKind.LEACH;
        private long                   randomSeed          = DEFAULT_SEED;
        private int                    roundHorizon        = DEFAULT_ROUND_HORIZON;
        private double                 radioRange          = DEFAULT_RADIO_RANGE;
        private int                    dataBits            = DEFAULT_DATA_BITS;
        private int                    controlBits         = DEFAULT_CONTROL_BITS;
        private int                    floodBits           = DEFAULT_FLOOD_BITS;
        private double                 roundDuration       = DEFAULT_ROUND_DURATION;
        private EnergyModel.Parameters energyParameters    = EnergyModel.Parameters.defaults();
        private List<Point2d>          nodePositions       = null;
        private boolean                explicitPositions   = false;
        private LeachParameters        leachParameters     = null;
        private DiffusionParameters    diffusionParameters = null;
        private GearParameters         gearParameters      = null;
        private PegasisParameters      pegasisParameters   = null;

        private Builder() {
        }

        public Builder withNodeCount(int count) {
            if (count < 1) {
                throw new ConfigurationException("nodeCount", "must be at least 1: " + count);
            }
            this.nodeCount = count;
            return this;
        }

        /**
         * @param width  area width in meters
         * @param height area height in meters
         */
        public Builder withArea(double width, double height) {
            if (!positiveFinite(width) || !positiveFinite(height)) {
                throw new ConfigurationException("area", String.format("must be positive: %s x %s", width, height));
            }
            this.width = width;
            this.height = height;
            return this;
        }

        /**
         * @param joules energy of every node at deployment
         */
        public Builder withInitialEnergy(double joules) {
            if (!positiveFinite(joules)) {
                throw new ConfigurationException("initialEnergy", "must be positive: " + joules);
            }
            this.initialEnergy = joules;
            return this;
        }

        /**
         * Place the base station. Defaults to the center of the area.
         */
        public Builder withBaseStation(double x, double y) {
            if (!DeterministicMath.isFinite(x) || !DeterministicMath.isFinite(y)) {
                throw new ConfigurationException("baseStation", String.format("must be finite: (%s, %s)", x, y));
            }
            this.baseStation = new Point2d(x, y);
            return this;
        }

        public Builder withProtocol(ProtocolKind kind) {
            if (kind == null) {
                throw new ConfigurationException("protocol", "must not be null");
            }
            this.protocol = kind;
            return this;
        }

        /**
         * @param name protocol name such as "LEACH" or "DirectedDiffusion"
         */
        public Builder withProtocol(String name) {
            return withProtocol(ProtocolKind.fromName(name));
        }

        public Builder withRandomSeed(long seed) {
            this.randomSeed = seed;
            return this;
        }

        public Builder withRoundHorizon(int rounds) {
            if (rounds < 1) {
                throw new ConfigurationException("roundHorizon", "must be at least 1: " + rounds);
            }
            this.roundHorizon = rounds;
            return this;
        }

        public Builder withRadioRange(double meters) {
            if (!positiveFinite(meters)) {
                throw new ConfigurationException("radioRange", "must be positive: " + meters);
            }
            this.radioRange = meters;
            return this;
        }

        /**
         * @param bits size of a sensed data packet
         */
        public Builder withPacketBits(int bits) {
            if (bits < 1) {
                throw new ConfigurationException("packetBits", "must be positive: " + bits);
            }
            this.dataBits = bits;
            return this;
        }

        /**
         * @param bits size of advertisements, joins and reinforcements
         */
        public Builder withControlBits(int bits) {
            if (bits < 1) {
                throw new ConfigurationException("controlBits", "must be positive: " + bits);
            }
            this.controlBits = bits;
            return this;
        }

        /**
         * @param bits size of interest and query floods
         */
        public Builder withFloodBits(int bits) {
            if (bits < 1) {
                throw new ConfigurationException("floodBits", "must be positive: " + bits);
            }
            this.floodBits = bits;
            return this;
        }

        public Builder withRoundDuration(double duration) {
            if (!positiveFinite(duration)) {
                throw new ConfigurationException("roundDuration", "must be positive: " + duration);
            }
            this.roundDuration = duration;
            return this;
        }

        public Builder withEnergyParameters(EnergyModel.Parameters parameters) {
            if (parameters == null) {
                throw new ConfigurationException("energyParameters", "must not be null");
            }
            this.energyParameters = parameters;
            return this;
        }

        /**
         * Fix node positions instead of drawing them. The list must match the node count when the configuration is
         * built; the node count is taken from it if not set otherwise.
         */
        public Builder withNodePositions(List<Point2d> positions) {
            if (positions == null || positions.isEmpty()) {
                throw new ConfigurationException("nodePositions", "must not be empty");
            }
            var copy = new ArrayList<Point2d>(positions.size());
            for (var p : positions) {
                if (p == null || !DeterministicMath.isFinite(p.x) || !DeterministicMath.isFinite(p.y)) {
                    throw new ConfigurationException("nodePositions", "positions must be finite: " + p);
                }
                copy.add(new Point2d(p));
            }
            this.nodePositions = copy;
            this.explicitPositions = true;
            this.nodeCount = copy.size();
            return this;
        }

        public Builder withLeachParameters(LeachParameters parameters) {
            this.leachParameters = requireParameters("leach", parameters);
            return this;
        }

        public Builder withDiffusionParameters(DiffusionParameters parameters) {
            this.diffusionParameters = requireParameters("diffusion", parameters);
            return this;
        }

        public Builder withGearParameters(GearParameters parameters) {
            this.gearParameters = requireParameters("gear", parameters);
            return this;
        }

        public Builder withPegasisParameters(PegasisParameters parameters) {
            this.pegasisParameters = requireParameters("pegasis", parameters);
            return this;
        }

        /**
         * Check cross option rules and build the configuration.
         *
         * @throws ConfigurationException if the options are inconsistent
         */
        public SimulationConfig build() {
            var base = baseStation != null ? new Point2d(baseStation) : new Point2d(width / 2.0, height / 2.0);
            double diagonal = DeterministicMath.distance(0.0, 0.0, width, height);
            double limit = MAX_BASE_STATION_DIAGONALS * diagonal;
            if (base.x < -limit || base.x > width + limit || base.y < -limit || base.y > height + limit) {
                throw new ConfigurationException("baseStation",
                                                 String.format("(%.2f, %.2f) is more than %.0f area diagonals away",
                                                               base.x, base.y, MAX_BASE_STATION_DIAGONALS));
            }
            List<Point2d> positions;
            if (nodePositions != null) {
                if (nodePositions.size() != nodeCount) {
                    throw new ConfigurationException("nodePositions",
                                                     String.format("%d positions for %d nodes", nodePositions.size(),
                                                                   nodeCount));
                }
                for (var p : nodePositions) {
                    if (p.x < 0.0 || p.x > width || p.y < 0.0 || p.y > height) {
                        throw new ConfigurationException("nodePositions",
                                                         String.format("(%.2f, %.2f) lies outside the area", p.x,
                                                                       p.y));
                    }
                }
                positions = List.copyOf(nodePositions);
            } else {
                var random = new Random(randomSeed);
                var drawn = new ArrayList<Point2d>(nodeCount);
                for (int i = 0; i < nodeCount; i++) {
                    drawn.add(new Point2d(random.nextDouble() * width, random.nextDouble() * height));
                }
                positions = List.copyOf(drawn);
            }
            return new SimulationConfig(this, base, positions);
        }

        private static boolean positiveFinite(double value) {
            return DeterministicMath.isFinite(value) && value > 0.0;
        }

        private static <T> T requireParameters(String option, T parameters) {
            if (parameters == null) {
                throw new ConfigurationException(option, "parameters must not be null");
            }
            return parameters;
        }
    }
}
