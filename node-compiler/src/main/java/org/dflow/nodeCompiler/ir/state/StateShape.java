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

package org.dflow.nodeCompiler.ir.state;

import org.dflow.util.IIndentStream;
import org.dflow.util.ToIndentableString;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The persistent state of a node: memory cells, and one nested sub-state per call site. */
public class StateShape implements ToIndentableString {
    /** Node whose state this is. */
    public final String component;
    final List<MemoryCell> cells;
    final Map<String, StateShape> subStates;
    /** True if the sub-state belongs to a call which was not inlined,
     * and is updated by calling the transition of the callee. */
    public final boolean opaque;

    public StateShape(String component, boolean opaque) {
        this.component = component;
        this.opaque = opaque;
        this.cells = new ArrayList<>();
        this.subStates = new LinkedHashMap<>();
    }

    /** The same shape, used as the sub-state of a call which is not inlined. */
    public StateShape asCalled() {
        StateShape result = new StateShape(this.component, true);
        result.cells.addAll(this.cells);
        result.subStates.putAll(this.subStates);
        return result;
    }

    public void addCell(MemoryCell cell) {
        this.cells.add(cell);
    }

    public void addSubState(String instance, StateShape shape) {
        Utilities.putNew(this.subStates, instance, shape);
    }

    public List<MemoryCell> getCells() {
        return Collections.unmodifiableList(this.cells);
    }

    public Map<String, StateShape> getSubStates() {
        return Collections.unmodifiableMap(this.subStates);
    }

    @Nullable
    public StateShape getSubState(String instance) {
        return this.subStates.get(instance);
    }

    /** The sub-state at the specified path from this state. */
    public StateShape getSubState(List<String> path) {
        StateShape current = this;
        for (String instance: path)
            current = Utilities.getExists(current.subStates, instance);
        return current;
    }

    /** Number of cells, including the cells of all sub-states. */
    public int totalCells() {
        int result = this.cells.size();
        for (StateShape sub: this.subStates.values())
            result += sub.totalCells();
        return result;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("state ")
                .append(this.component)
                .append(this.opaque ? " (called)" : "")
                .append(" {")
                .increase();
        for (MemoryCell cell: this.cells)
            builder.append(cell).newline();
        for (Map.Entry<String, StateShape> e: this.subStates.entrySet())
            builder.append(e.getKey())
                    .append(": ")
                    .append(e.getValue())
                    .newline();
        return builder.decrease().append("}");
    }
}
