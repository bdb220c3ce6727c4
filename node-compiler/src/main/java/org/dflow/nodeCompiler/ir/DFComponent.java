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

import org.dflow.nodeCompiler.compiler.analysis.DependencyGraph;
import org.dflow.nodeCompiler.compiler.analysis.Schedule;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.util.IIndentStream;
import org.dflow.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A node: a reactive unit with inputs, outputs, locals and the equations defining them.
 *
 * <p>The passes of the compiler mutate a component in place: normalization and inlining
 * replace the equations and add locals, and the analyses attach the dependency graphs
 * and the schedule.  Lowering does not mutate the component. */
public class DFComponent extends DFNode {
    public final String name;
    public final List<Integer> inputs;
    public final List<Integer> outputs;
    /** Locals in declaration order; normalization and inlining append to this list. */
    public final List<Integer> locals;
    /** Identifiers only visible in contracts. */
    public final List<Integer> contractLocals;
    public final List<DFEquation> equations;
    public final List<DFContractTerm> contract;
    /** Contract terms of inlined callees. */
    public final List<PropagatedContract> propagatedContracts;
    /** The node called at each call-site instance path, including the instances
     * nested in inlined callees.  A path is always inserted after its parent. */
    public final Map<List<String>, String> instances;

    @Nullable
    DependencyGraph graph;
    @Nullable
    DependencyGraph contractGraph;
    @Nullable
    Schedule schedule;

    public DFComponent(SourceRange range, String name) {
        super(range);
        this.name = name;
        this.inputs = new ArrayList<>();
        this.outputs = new ArrayList<>();
        this.locals = new ArrayList<>();
        this.contractLocals = new ArrayList<>();
        this.equations = new ArrayList<>();
        this.contract = new ArrayList<>();
        this.propagatedContracts = new ArrayList<>();
        this.instances = new LinkedHashMap<>();
    }

    /** A copy which shares the expressions but not the lists.
     * Analysis results are not copied. */
    public DFComponent copy() {
        DFComponent result = new DFComponent(this.range, this.name);
        result.inputs.addAll(this.inputs);
        result.outputs.addAll(this.outputs);
        result.locals.addAll(this.locals);
        result.contractLocals.addAll(this.contractLocals);
        result.equations.addAll(this.equations);
        result.contract.addAll(this.contract);
        result.propagatedContracts.addAll(this.propagatedContracts);
        result.instances.putAll(this.instances);
        return result;
    }

    /** All identifiers which are visible in the equations. */
    public List<Integer> getDeclaredIds() {
        List<Integer> result = new ArrayList<>(this.inputs);
        result.addAll(this.outputs);
        result.addAll(this.locals);
        return result;
    }

    /** The identifiers defined by equations, in the order of the equations. */
    public List<Integer> getDefinitionOrder() {
        List<Integer> result = new ArrayList<>();
        for (DFEquation equation: this.equations)
            result.addAll(equation.targets);
        return result;
    }

    /** Identifiers in the order used to break ties when scheduling:
     * inputs first, then the targets of the equations in equation order. */
    public List<Integer> getDeclarationOrder() {
        List<Integer> result = new ArrayList<>(this.inputs);
        result.addAll(this.getDefinitionOrder());
        return result;
    }

    @Nullable
    public DFEquation getDefinition(int id) {
        for (DFEquation equation: this.equations)
            if (equation.targets.contains(id))
                return equation;
        return null;
    }

    public void setGraphs(DependencyGraph graph, DependencyGraph contractGraph) {
        this.graph = graph;
        this.contractGraph = contractGraph;
    }

    public DependencyGraph getGraph() {
        return this.checkNull(this.graph);
    }

    public DependencyGraph getContractGraph() {
        return this.checkNull(this.contractGraph);
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Schedule getSchedule() {
        return this.checkNull(this.schedule);
    }

    public boolean isScheduled() {
        return this.schedule != null;
    }

    /** Drop analysis results which are invalidated by rewriting the equations. */
    public void invalidateAnalyses() {
        this.graph = null;
        this.contractGraph = null;
        this.schedule = null;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("node ")
                .append(this.name)
                .append("(")
                .join(", ", Linq.map(this.inputs, i -> "#" + i))
                .append(") returns (")
                .join(", ", Linq.map(this.outputs, i -> "#" + i))
                .append(") {")
                .increase();
        for (DFEquation equation: this.equations)
            builder.append(equation).newline();
        for (DFContractTerm term: this.contract)
            builder.append(term).newline();
        return builder.decrease()
                .append("}");
    }
}
