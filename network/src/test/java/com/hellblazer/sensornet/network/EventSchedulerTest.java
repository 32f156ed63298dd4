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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
class EventSchedulerTest {

    private record Marker(String name) implements EventPayload {
        @Override
        public int origin() {
            return Topology.BASE_STATION;
        }
    }

    private EventScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new EventScheduler();
    }

    @Test
    void testAscendingTimeOrder() {
        scheduler.schedule(3.0, new Marker("c"));
        scheduler.schedule(1.0, new Marker("a"));
        scheduler.schedule(2.0, new Marker("b"));

        assertEquals(List.of("a", "b", "c"), drain());
        assertEquals(3.0, scheduler.now());
    }

    @Test
    void testSameTimeEventsFireInInsertionOrder() {
        for (int i = 0; i < 10; i++) {
            scheduler.schedule(5.0, new Marker("m" + i));
        }
        var expected = new ArrayList<String>();
        for (int i = 0; i < 10; i++) {
            expected.add("m" + i);
        }
        assertEquals(expected, drain(), "ties must be broken by insertion sequence");
    }

    @Test
    void testSequenceNumbersIncrease() {
        var first = scheduler.schedule(1.0, new Marker("a"));
        var second = scheduler.schedule(1.0, new Marker("b"));
        assertTrue(second.sequence() > first.sequence());
    }

    @Test
    void testCancel() {
        var keep = scheduler.schedule(1.0, new Marker("keep"));
        var drop = scheduler.schedule(2.0, new Marker("drop"));
        scheduler.cancel(drop);

        assertTrue(drop.isCancelled());
        assertFalse(drop.isPending());
        assertEquals(1, scheduler.pendingCount());
        assertEquals(List.of("keep"), drain());
        assertTrue(keep.isFired());
    }

    @Test
    void testCancelAfterFireIsNoOp() {
        var handle = scheduler.schedule(1.0, new Marker("a"));
        scheduler.popNext();
        scheduler.cancel(handle);
        assertTrue(handle.isFired());
        assertFalse(handle.isCancelled());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void testSchedulingIntoThePastIsRejected() {
        scheduler.schedule(10.0, new Marker("a"));
        scheduler.popNext();
        var e = assertThrows(LogicException.class, () -> scheduler.schedule(9.0, new Marker("late")));
        assertEquals(10.0, e.getClock());
        assertEquals(9.0, e.getRequested());

        // the current instant is still allowed
        assertDoesNotThrow(() -> scheduler.schedule(10.0, new Marker("now")));
    }

    @Test
    void testNonFiniteTimesAreRejected() {
        assertThrows(LogicException.class, () -> scheduler.schedule(Double.NaN, new Marker("nan")));
        assertThrows(LogicException.class, () -> scheduler.schedule(Double.POSITIVE_INFINITY, new Marker("inf")));
    }

    @Test
    void testAdvanceTo() {
        scheduler.advanceTo(50.0);
        assertEquals(50.0, scheduler.now());

        scheduler.schedule(60.0, new Marker("a"));
        assertThrows(LogicException.class, () -> scheduler.advanceTo(70.0), "must not skip a pending event");
        assertThrows(LogicException.class, () -> scheduler.advanceTo(40.0), "must not move backwards");

        scheduler.advanceTo(60.0);
        assertEquals(60.0, scheduler.now());
        assertEquals(List.of("a"), drain());
    }

    @Test
    void testEmptyQueue() {
        assertTrue(scheduler.isEmpty());
        assertTrue(scheduler.popNext().isEmpty());
        assertTrue(scheduler.peekTime().isEmpty());
    }

    private List<String> drain() {
        var names = new ArrayList<String>();
        while (true) {
            var event = scheduler.popNext();
            if (event.isEmpty()) {
                return names;
            }
            names.add(((Marker) event.get().payload()).name());
        }
    }
}
