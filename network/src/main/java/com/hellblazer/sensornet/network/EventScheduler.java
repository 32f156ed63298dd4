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

import com.hellblazer.sensornet.common.SimulationException.LogicException;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.PriorityQueue;

/**
 * Time ordered queue of scheduled events that drives the simulation clock.
 * <p>
 * Ordering is strictly ascending fire time, with ties broken by insertion sequence so that events scheduled for the
 * same instant fire in FIFO order. Given a fixed random seed the dispatch order is therefore fully replayable.
 * <p>
 * The scheduler holds no protocol state. It is owned by a single simulation run and is not thread-safe.
 * <p>
 * Usage:
 * <pre>
 * var scheduler = new EventScheduler();
 * var handle = scheduler.schedule(10.0, new RoundStart(0));
 * scheduler.cancel(handle);
 * while (scheduler.popNext().isPresent()) { ... }
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class EventScheduler {

    private record Entry(EventHandle handle, EventPayload payload) {
    }

    private static final Comparator<Entry> ORDER = Comparator.<Entry>comparingDouble(e -> e.handle().time())
                                                             .thenComparingLong(e -> e.handle().sequence());

    private final PriorityQueue<Entry> queue = new PriorityQueue<>(ORDER);
    private double                     now;
    private long                       nextSequence;
    private int                        pending;

    /**
     * @return current simulation clock
     */
    public double now() {
        return now;
    }

    /**
     * Schedule a payload to fire at an absolute time.
     *
     * @param time    fire time, not earlier than {@link #now()}
     * @param payload event payload
     * @return handle for cancellation
     * @throws LogicException if the time is in the past or not a number
     */
    public EventHandle schedule(double time, EventPayload payload) {
        Objects.requireNonNull(payload, "payload");
        if (Double.isNaN(time) || Double.isInfinite(time)) {
            throw new LogicException("Event time must be finite", now, time);
        }
        if (time < now) {
            throw new LogicException("Cannot schedule an event in the past", now, time);
        }
        var handle = new EventHandle(time, nextSequence++);
        queue.add(new Entry(handle, payload));
        pending++;
        return handle;
    }

    /**
     * Cancel a scheduled event. No-op if it already fired or was already cancelled.
     *
     * @param handle handle returned by {@link #schedule(double, EventPayload)}
     */
    public void cancel(EventHandle handle) {
        if (handle != null && handle.isPending()) {
            handle.cancel();
            pending--;
        }
    }

    /**
     * Remove the earliest pending event and advance the clock to its fire time.
     *
     * @return the event, or empty if nothing is pending
     */
    public Optional<Event> popNext() {
        discardCancelled();
        var entry = queue.poll();
        if (entry == null) {
            return Optional.empty();
        }
        var handle = entry.handle();
        handle.fire();
        pending--;
        now = handle.time();
        return Optional.of(new Event(handle.time(), handle.sequence(), entry.payload()));
    }

    /**
     * @return fire time of the earliest pending event, if any
     */
    public OptionalDouble peekTime() {
        discardCancelled();
        var head = queue.peek();
        return head == null ? OptionalDouble.empty() : OptionalDouble.of(head.handle().time());
    }

    /**
     * Move the clock forward without dispatching anything, used to skip idle time between rounds.
     *
     * @param time new clock value
     * @throws LogicException if the time is before the current clock, or a pending event would be skipped
     */
    public void advanceTo(double time) {
        if (Double.isNaN(time) || time < now) {
            throw new LogicException("Cannot move the clock backwards", now, time);
        }
        var next = peekTime();
        if (next.isPresent() && next.getAsDouble() < time) {
            throw new LogicException("Advancing would skip a pending event at " + next.getAsDouble(), now, time);
        }
        now = time;
    }

    /**
     * @return number of events that are queued and not cancelled
     */
    public int pendingCount() {
        return pending;
    }

    public boolean isEmpty() {
        return pending == 0;
    }

    private void discardCancelled() {
        while (!queue.isEmpty() && queue.peek().handle().isCancelled()) {
            queue.poll();
        }
    }

    @Override
    public String toString() {
        return String.format("EventScheduler{now=%.4f, pending=%d}", now, pending);
    }
}
