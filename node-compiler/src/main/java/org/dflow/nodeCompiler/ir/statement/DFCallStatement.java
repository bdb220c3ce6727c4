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

package org.dflow.nodeCompiler.ir.statement;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.util.IIndentStream;
import org.dflow.util.Linq;

import java.util.List;

/** Runs the transition of a node which was not inlined on its own sub-state.
 * The sub-state of the current state is the input; the resulting sub-state
 * becomes part of the next state. */
public class DFCallStatement extends DFStatement {
    /** Path of the sub-state from the root state */
    public final ImmutableList<String> path;
    public final String callee;
    public final ImmutableList<DFExpression> arguments;
    public final ImmutableList<Symbol> targets;

    public DFCallStatement(SourceRange range, List<String> path, String callee,
                           List<DFExpression> arguments, List<Symbol> targets) {
        super(range);
        this.path = ImmutableList.copyOf(path);
        this.callee = callee;
        this.arguments = ImmutableList.copyOf(arguments);
        this.targets = ImmutableList.copyOf(targets);
    }

    public String getInstancePath() {
        return String.join(".", this.path);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .join(", ", Linq.map(this.targets, t -> t.name))
                .append(") = ")
                .append(this.callee)
                .append("::transition(state.")
                .append(this.getInstancePath())
                .append(", ")
                .joinI(", ", this.arguments)
                .append(");");
    }
}
