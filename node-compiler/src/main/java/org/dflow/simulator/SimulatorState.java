/*
 * Copyright 2022 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dflow.simulator;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Values of the memory cells of a node and of its nested sub-states. */
public class SimulatorState {
    public final String component;
    final Map<String, Object> cells;
    final Map<String, SimulatorState> subStates;

    public SimulatorState(String component) {
        this.component = component;
        this.cells = new LinkedHashMap<>();
        this.subStates = new LinkedHashMap<>();
    }

    void addCell(String cell, Object value) {
        this.cells.put(cell, value);
    }

    void addSubState(String instance, SimulatorState state) {
        this.subStates.put(instance, state);
    }

    public Object get(String cell) {
        Object result = this.cells.get(cell);
        if (result == null)
            throw new SimulationError("State of " + this.component + " has no cell " + cell);
        return result;
    }

    public void set(String cell, Object value) {
        if (!this.cells.containsKey(cell))
            throw new SimulationError("State of " + this.component + " has no cell " + cell);
        this.cells.put(cell, value);
    }

    public Map<String, Object> getCells() {
        return this.cells;
    }

    public Map<String, SimulatorState> getSubStates() {
        return this.subStates;
    }

    public SimulatorState getSubState(List<String> path) {
        SimulatorState current = this;
        for (String instance: path) {
            SimulatorState next = current.subStates.get(instance);
            if (next == null)
                throw new SimulationError("State of " + current.component + " has no sub-state " + instance);
            current = next;
        }
        return current;
    }

    /** Replace the sub-state at the specified non-empty path. */
    public void setSubState(List<String> path, SimulatorState state) {
        SimulatorState parent = this.getSubState(path.subList(0, path.size() - 1));
        String instance = path.get(path.size() - 1);
        if (!parent.subStates.containsKey(instance))
            throw new SimulationError("State of " + parent.component + " has no sub-state " + instance);
        parent.subStates.put(instance, state);
    }

    /** Value of a cell given by a dotted path, e.g. 'counter_0.mem_o'. */
    public Object read(String path) {
        List<String> parts = Arrays.asList(path.split("\\."));
        return this.getSubState(parts.subList(0, parts.size() - 1)).get(parts.get(parts.size() - 1));
    }

    /** A deep copy; cell values are immutable. */
    public SimulatorState copy() {
        SimulatorState result = new SimulatorState(this.component);
        result.cells.putAll(this.cells);
        for (Map.Entry<String, SimulatorState> e: this.subStates.entrySet())
            result.subStates.put(e.getKey(), e.getValue().copy());
        return result;
    }

    /** Overwrite this state with the contents of another state of the same node. */
    public void assign(SimulatorState other) {
        this.cells.clear();
        this.cells.putAll(other.cells);
        this.subStates.clear();
        this.subStates.putAll(other.subStates);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || this.getClass() != o.getClass())
            return false;
        SimulatorState that = (SimulatorState) o;
        return this.component.equals(that.component) &&
                this.cells.equals(that.cells) &&
                this.subStates.equals(that.subStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.component, this.cells, this.subStates);
    }

    @Override
    public String toString() {
        return this.component + this.cells + (this.subStates.isEmpty() ? "" : this.subStates.toString());
    }
}
