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

import com.hellblazer.sensornet.network.Outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of every outcome of a run, in emission order.
 * <p>
 * Consumers may read it at any cadence: streamed through a cursor while the run progresses, or replayed in one batch
 * at the end.
 *
 * @author hal.hildebrand
 */
public final class OutcomeLog {

    private final List<Outcome> outcomes = new ArrayList<>();

    void append(Outcome outcome) {
        outcomes.add(outcome);
    }

    public int size() {
        return outcomes.size();
    }

    public Outcome get(int index) {
        return outcomes.get(index);
    }

    /**
     * @return read-only view of all outcomes so far
     */
    public List<Outcome> outcomes() {
        return Collections.unmodifiableList(outcomes);
    }

    /**
     * Feed every outcome to a listener.
     */
    public void replay(OutcomeListener listener) {
        replay(0, listener);
    }

    /**
     * Feed the outcomes from a position onward to a listener.
     *
     * @return the position after the last outcome replayed, for the next call
     */
    public int replay(int from, OutcomeListener listener) {
        int end = outcomes.size();
        for (int i = from; i < end; i++) {
            listener.onOutcome(outcomes.get(i));
        }
        return end;
    }

    public long count(Outcome.Kind kind) {
        return outcomes.stream().filter(o -> o.kind() == kind).count();
    }

    @Override
    public String toString() {
        return "OutcomeLog{size=" + outcomes.size() + "}";
    }
}
