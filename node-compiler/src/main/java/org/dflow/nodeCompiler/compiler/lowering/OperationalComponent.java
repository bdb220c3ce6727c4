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

package org.dflow.nodeCompiler.compiler.lowering;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.util.IIndentStream;
import org.dflow.util.ToIndentableString;

import java.util.List;

/** A component whose delays are explicit memory reads and writes, and whose
 * remaining node calls are explicit transitions of nested sub-states. */
public class OperationalComponent implements ToIndentableString {
    public final DFComponent component;
    public final StateShape state;
    public final ImmutableList<DFStatement> statements;

    public OperationalComponent(DFComponent component, StateShape state, List<DFStatement> statements) {
        this.component = component;
        this.state = state;
        this.statements = ImmutableList.copyOf(statements);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.state)
                .newline()
                .append("transition ")
                .append(this.component.name)
                .append(" {")
                .increase();
        for (DFStatement statement: this.statements)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }
}
