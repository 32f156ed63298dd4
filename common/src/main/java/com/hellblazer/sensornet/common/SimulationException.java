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
package com.hellblazer.sensornet.common;

/**
 * Sealed exception hierarchy for simulation failures that terminate a run.
 * <p>
 * Only two failure kinds abort a simulation:
 * <ul>
 * <li>{@link ConfigurationException} - invalid setup, raised before any event is scheduled</li>
 * <li>{@link LogicException} - scheduler misuse such as scheduling into the past; indicates an engine bug</li>
 * </ul>
 * Protocol level problems (unreachable destinations, partitions, missing gradients) are never thrown. They surface
 * as dropped packet outcomes.
 *
 * @author hal.hildebrand
 */
public sealed class SimulationException extends RuntimeException
    permits SimulationException.ConfigurationException, SimulationException.LogicException {

    /**
     * Constructs a new simulation exception with the specified detail message.
     *
     * @param message the detail message
     */
    public SimulationException(String message) {
        super(message);
    }

    /**
     * Constructs a new simulation exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Invalid simulation setup.
     * <p>
     * Thrown when node count, energy, area, base station placement or protocol parameters are out of range.
     */
    public static final class ConfigurationException extends SimulationException {
        private final String option;

        /**
         * @param option  the offending configuration option
         * @param message the detail message
         */
        public ConfigurationException(String option, String message) {
            super(String.format("Invalid configuration '%s': %s", option, message));
            this.option = option;
        }

        /**
         * Gets the name of the rejected option.
         *
         * @return option name
         */
        public String getOption() {
            return option;
        }
    }

    /**
     * Scheduler misuse.
     * <p>
     * Thrown when an event is scheduled before the current simulation clock, or when the clock would be moved
     * backwards or past pending events.
     */
    public static final class LogicException extends SimulationException {
        private final double clock;
        private final double requested;

        /**
         * @param message   the detail message
         * @param clock     simulation clock at the time of the violation
         * @param requested the offending time
         */
        public LogicException(String message, double clock, double requested) {
            super(String.format("%s (clock=%.6f, requested=%.6f)", message, clock, requested));
            this.clock = clock;
            this.requested = requested;
        }

        /**
         * @return simulation clock when the violation happened
         */
        public double getClock() {
            return clock;
        }

        /**
         * @return the rejected time
         */
        public double getRequested() {
            return requested;
        }
    }
}
