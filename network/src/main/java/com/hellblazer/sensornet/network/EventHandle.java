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

/**
 * Handle to a scheduled event, used to cancel it before it fires.
 *
 * @author hal.hildebrand
 */
public final class EventHandle {

    private final double time;
    private final long   sequence;
    private boolean      cancelled;
    private boolean      fired;

    EventHandle(double time, long sequence) {
        this.time = time;
        this.sequence = sequence;
    }

    public double time() {
        return time;
    }

    public long sequence() {
        return sequence;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isFired() {
        return fired;
    }

    /**
     * @return true while the event is queued and neither fired nor cancelled
     */
    public boolean isPending() {
        return !cancelled && !fired;
    }

    void cancel() {
        cancelled = true;
    }

    void fire() {
        fired = true;
    }

    @Override
    public String toString() {
        return String.format("EventHandle{t=%.4f, seq=%d, %s}", time, sequence,
                             fired ? "fired" : cancelled ? "cancelled" : "pending");
    }
}
