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

package org.dflow.nodeCompiler.ir;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.util.IIndentStream;
import org.dflow.util.Utilities;

import java.util.List;

/** Binds one identifier, or several for a call to a node with several outputs, to an expression. */
public class DFEquation extends DFNode {
    public final ImmutableList<Integer> targets;
    public final DFExpression expression;

    public DFEquation(SourceRange range, List<Integer> targets, DFExpression expression) {
        super(range);
        Utilities.enforce(!targets.isEmpty(), "Equation without targets");
        this.targets = ImmutableList.copyOf(targets);
        this.expression = expression;
    }

    public DFEquation(SourceRange range, int target, DFExpression expression) {
        this(range, List.of(target), expression);
    }

    public DFEquation withExpression(DFExpression expression) {
        return new DFEquation(this.range, this.targets, expression);
    }

    public boolean isTuple() {
        return this.targets.size() > 1;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        if (this.isTuple())
            builder.append("(");
        builder.join(", ", this.targets, t -> "#" + t);
        if (this.isTuple())
            builder.append(")");
        return builder.append(" = ")
                .append(this.expression)
                .append(";");
    }
}
