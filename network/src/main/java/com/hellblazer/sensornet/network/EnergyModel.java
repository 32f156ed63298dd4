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

import com.hellblazer.sensornet.common.DeterministicMath;
import com.hellblazer.sensornet.common.SimulationException.ConfigurationException;

import java.util.Objects;

/**
 * First order radio energy model.
 * <p>
 * Transmitting k bits over distance d costs {@code k * E_elec + k * E_fs * d^2} below the crossover distance and
 * {@code k * E_elec + k * E_mp * d^4} at or above it. Receiving k bits costs {@code k * E_elec}. The quartic term is
 * what makes single hop long range transmission disproportionately expensive.
 * <p>
 * The model is stateless apart from its parameters. {@link #apply(SensorNode, double)} is the only path through which
 * a node's energy balance changes.
 *
 * @author hal.hildebrand
 */
public final class EnergyModel {

    private final Parameters parameters;

    public EnergyModel(Parameters parameters) {
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    /**
     * @return a model using the default first order radio constants
     */
    public static EnergyModel defaultModel() {
        return new EnergyModel(Parameters.defaults());
    }

    public Parameters parameters() {
        return parameters;
    }

    /**
     * Energy to transmit a payload over a distance.
     *
     * @param distance distance to the receiver in meters
     * @param bits     payload size in bits
     * @return energy in joules
     */
    public double transmitCost(double distance, int bits) {
        checkBits(bits);
        if (distance < 0 || Double.isNaN(distance)) {
            throw new IllegalArgumentException("Distance must be non-negative: " + distance);
        }
        return electronicsCost(bits) + amplifierCost(distance, bits);
    }

    /**
     * Energy to receive a payload.
     *
     * @param bits payload size in bits
     * @return energy in joules
     */
    public double receiveCost(int bits) {
        checkBits(bits);
        return electronicsCost(bits);
    }

    /**
     * Energy to fuse a payload into an aggregate.
     *
     * @param bits bits entering the aggregation
     * @return energy in joules
     */
    public double aggregationCost(int bits) {
        checkBits(bits);
        return bits * parameters.getAggregationPerBit();
    }

    /**
     * Energy to sense a payload.
     *
     * @param bits bits sensed
     * @return energy in joules
     */
    public double sensingCost(int bits) {
        checkBits(bits);
        return bits * parameters.getSensingPerBit();
    }

    /**
     * Charge an energy cost to a node.
     * <p>
     * A cost larger than the remaining balance kills the node and clamps the balance at zero; the action is reported
     * as insufficient. A cost exactly equal to the balance completes the action and kills the node. Death is reported
     * once: later charges against a dead node change nothing and report {@code died == false}.
     *
     * @param node   the node to charge
     * @param energy cost in joules, non-negative
     * @return resulting balance, death flag and whether the action could be paid for
     */
    public EnergyDraw apply(SensorNode node, double energy) {
        Objects.requireNonNull(node, "node");
        if (energy < 0 || Double.isNaN(energy)) {
            throw new IllegalArgumentException("Energy cost must be non-negative: " + energy);
        }
        if (!node.isAlive()) {
            return EnergyDraw.deadNode();
        }
        double before = node.energy();
        boolean sufficient = energy <= before;
        boolean died = node.drainTo(before - energy);
        return new EnergyDraw(node.energy(), died, sufficient);
    }

    private double electronicsCost(int bits) {
        return bits * parameters.getElectronicsPerBit();
    }

    private double amplifierCost(double distance, int bits) {
        if (distance < parameters.getCrossoverDistance()) {
            return bits * parameters.getFreeSpaceAmplifier() * DeterministicMath.square(distance);
        }
        return bits * parameters.getMultipathAmplifier() * DeterministicMath.pow4(distance);
    }

    private static void checkBits(int bits) {
        if (bits < 0) {
            throw new IllegalArgumentException("Payload size must be non-negative: " + bits);
        }
    }

    @Override
    public String toString() {
        return "EnergyModel" + parameters;
    }

    /**
     * Radio constants of the energy model.
     */
    public static final class Parameters {
        public static final double DEFAULT_ELECTRONICS_PER_BIT = 50e-9;
        public static final double DEFAULT_FREE_SPACE_AMPLIFIER = 10e-12;
        public static final double DEFAULT_MULTIPATH_AMPLIFIER = 0.0013e-12;
        public static final double DEFAULT_AGGREGATION_PER_BIT = 5e-9;
        public static final double DEFAULT_SENSING_PER_BIT = 5e-9;

        private final double electronicsPerBit;
        private final double freeSpaceAmplifier;
        private final double multipathAmplifier;
        private final double aggregationPerBit;
        private final double sensingPerBit;
        private final double crossoverDistance;

        private Parameters(Builder builder) {
            this.electronicsPerBit = builder.electronicsPerBit;
            this.freeSpaceAmplifier = builder.freeSpaceAmplifier;
            this.multipathAmplifier = builder.multipathAmplifier;
            this.aggregationPerBit = builder.aggregationPerBit;
            this.sensingPerBit = builder.sensingPerBit;
            this.crossoverDistance = Double.isNaN(builder.crossoverDistance)
                                     ? DeterministicMath.sqrt(builder.freeSpaceAmplifier / builder.multipathAmplifier)
                                     : builder.crossoverDistance;
        }

        public static Parameters defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public double getElectronicsPerBit() {
            return electronicsPerBit;
        }

        public double getFreeSpaceAmplifier() {
            return freeSpaceAmplifier;
        }

        public double getMultipathAmplifier() {
            return multipathAmplifier;
        }

        public double getAggregationPerBit() {
            return aggregationPerBit;
        }

        public double getSensingPerBit() {
            return sensingPerBit;
        }

        /**
         * @return distance at which the amplifier switches from d^2 to d^4 scaling
         */
        public double getCrossoverDistance() {
            return crossoverDistance;
        }

        @Override
        public String toString() {
            return String.format("[elec=%.3e, fs=%.3e, mp=%.3e, da=%.3e, sense=%.3e, d0=%.2f]", electronicsPerBit,
                                 freeSpaceAmplifier, multipathAmplifier, aggregationPerBit, sensingPerBit,
                                 crossoverDistance);
        }

        public static class Builder {
            private double electronicsPerBit = DEFAULT_ELECTRONICS_PER_BIT;
            private double freeSpaceAmplifier = DEFAULT_FREE_SPACE_AMPLIFIER;
            private double multipathAmplifier = DEFAULT_MULTIPATH_AMPLIFIER;
            private double aggregationPerBit = DEFAULT_AGGREGATION_PER_BIT;
            private double sensingPerBit = DEFAULT_SENSING_PER_BIT;
            private double crossoverDistance = Double.NaN;

            private Builder() {
            }

            public Builder withElectronicsPerBit(double joules) {
                this.electronicsPerBit = requireCoefficient("electronicsPerBit", joules);
                return this;
            }

            public Builder withFreeSpaceAmplifier(double joules) {
                this.freeSpaceAmplifier = requirePositive("freeSpaceAmplifier", joules);
                return this;
            }

            public Builder withMultipathAmplifier(double joules) {
                this.multipathAmplifier = requirePositive("multipathAmplifier", joules);
                return this;
            }

            public Builder withAggregationPerBit(double joules) {
                this.aggregationPerBit = requireCoefficient("aggregationPerBit", joules);
                return this;
            }

            public Builder withSensingPerBit(double joules) {
                this.sensingPerBit = requireCoefficient("sensingPerBit", joules);
                return this;
            }

            /**
             * Override the derived crossover distance {@code sqrt(E_fs / E_mp)}.
             */
            public Builder withCrossoverDistance(double meters) {
                this.crossoverDistance = requirePositive("crossoverDistance", meters);
                return this;
            }

            public Parameters build() {
                return new Parameters(this);
            }

            private static double requireCoefficient(String option, double value) {
                if (!DeterministicMath.isFinite(value) || value < 0) {
                    throw new ConfigurationException(option, "must be a finite, non-negative value: " + value);
                }
                return value;
            }

            private static double requirePositive(String option, double value) {
                if (!DeterministicMath.isFinite(value) || value <= 0) {
                    throw new ConfigurationException(option, "must be a finite, positive value: " + value);
                }
                return value;
            }
        }
    }
}
