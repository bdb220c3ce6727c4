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

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.util.IIndentStream;
import org.dflow.util.ToIndentableString;

import java.util.List;

/** A value stored from one instant to the next.
 * The cell holds the value of 'source' at the previous instant; 'path' names the
 * nested sub-state which owns the cell. */
public final class MemoryCell implements ToIndentableString {
    public final String name;
    public final ImmutableList<String> path;
    public final Symbol source;
    public final DFType type;
    /** Constant value at the first instant */
    public final DFExpression initial;

    public MemoryCell(String name, List<String> path, Symbol source, DFExpression initial) {
        this.name = name;
        this.path = ImmutableList.copyOf(path);
        this.source = source;
        this.type = source.type;
        this.initial = initial;
    }

    /** Dotted path from the root state, e.g. 'counter_0.mem_o'. */
    public String getPath() {
        if (this.path.isEmpty())
            return this.name;
        return String.join(".", this.path) + "." + this.name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name)
                .append(": ")
                .append(this.type)
                .append(" = ")
                .append(this.initial)
                .append(" (")
                .append(this.source.name)
                .append(")");
    }

    @Override
    public String toString() {
        return this.getPath();
    }
}
