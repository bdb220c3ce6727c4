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
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.util.IIndentStream;
import org.dflow.util.Linq;
import org.dflow.util.ToIndentableString;

import java.util.List;

/**
 * The compiled form of a node, consumed by code emitters and by the simulator.
 *
 * <p>'initialize' builds a state of shape {@link #state} holding the initial value of each cell;
 * 'transition' evaluates {@link #body} in order on a state and the inputs, reading the memory
 * of the current state and writing the memory of the next state.  Identifiers in the same
 * group of {@link #partition} do not depend on each other in the same instant.
 */
public class StateMachineArtifact implements ToIndentableString {
    public final String name;
    public final ImmutableList<Symbol> inputs;
    public final ImmutableList<Symbol> outputs;
    public final StateShape state;
    public final ImmutableList<DFStatement> body;
    public final ImmutableList<ImmutableList<String>> partition;
    public final ImmutableList<DFContractTerm> contract;
    public final ImmutableList<PropagatedContract> propagatedContracts;

    public StateMachineArtifact(String name, List<Symbol> inputs, List<Symbol> outputs, StateShape state,
                                List<DFStatement> body, List<List<String>> partition,
                                List<DFContractTerm> contract, List<PropagatedContract> propagatedContracts) {
        this.name = name;
        this.inputs = ImmutableList.copyOf(inputs);
        this.outputs = ImmutableList.copyOf(outputs);
        this.state = state;
        this.body = ImmutableList.copyOf(body);
        this.partition = ImmutableList.copyOf(Linq.map(partition, g -> ImmutableList.copyOf(g)));
        this.contract = ImmutableList.copyOf(contract);
        this.propagatedContracts = ImmutableList.copyOf(propagatedContracts);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("artifact ")
                .append(this.name)
                .append("(")
                .join(", ", this.inputs, s -> s.name + ": " + s.type)
                .append(") returns (")
                .join(", ", this.outputs, s -> s.name + ": " + s.type)
                .append(") {")
                .increase()
                .append(this.state)
                .newline()
                .append("transition {")
                .increase();
        for (DFStatement statement: this.body)
            builder.append(statement).newline();
        builder.decrease().append("}").newline();
        for (ImmutableList<String> group: this.partition)
            builder.append("independent: ").join(", ", group).newline();
        for (DFContractTerm term: this.contract)
            builder.append(term).newline();
        for (PropagatedContract term: this.propagatedContracts)
            builder.append(term).newline();
        return builder.decrease().append("}");
    }
}
