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

package org.dflow.nodeCompiler.compiler.analysis;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.PropagatedContract;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.util.IIndentStream;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds the dependency graphs of a component.
 * The data graph has one edge from each equation target to each identifier the
 * defining expression reads, labeled with the number of delays in between.
 * Contract terms produce a separate graph with contract edges only, so that a
 * contract edge can never replace a weight 0 edge used for scheduling. */
public class DependencyGraphBuilder implements IWritesLogs {
    final SymbolTable symbols;

    public DependencyGraphBuilder(SymbolTable symbols) {
        this.symbols = symbols;
    }

    /** Dependencies of an expression, with labels merged per identifier. */
    public static Map<Integer, Label> dependencies(DFExpression expression) {
        Map<Integer, Label> result = new LinkedHashMap<>();
        addDependencies(expression, 0, result);
        return result;
    }

    static void add(Map<Integer, Label> result, int id, Label label) {
        Label previous = result.get(id);
        result.put(id, previous == null ? label : previous.merge(label));
    }

    static void addDependencies(DFExpression expression, int delays, Map<Integer, Label> result) {
        switch (expression.getKind()) {
            case LITERAL, ENUM, PERIOD, MEMORY_READ -> {}
            case IDENTIFIER -> {
                DFIdentifierExpression id = expression.to(DFIdentifierExpression.class);
                if (id.isResolved())
                    add(result, id.symbolId, Label.weight(delays));
            }
            case LAST -> {
                DFLastExpression last = expression.to(DFLastExpression.class);
                add(result, last.symbolId, Label.weight(delays + 1));
                if (last.initial != null)
                    addDependencies(last.initial, delays, result);
            }
            case FOLLOWED_BY -> {
                DFFollowedByExpression fby = expression.to(DFFollowedByExpression.class);
                addDependencies(fby.initial, delays, result);
                addDependencies(fby.next, delays + 1, result);
            }
            // Function and node calls depend on their arguments only.
            case UNARY, BINARY, STRUCT, FIELD, IF, FUNCTION_CALL, NODE_CALL,
                    WHEN, MERGE, SAMPLE -> {
                for (DFExpression child: expression.getChildren())
                    addDependencies(child, delays, result);
            }
        }
    }

    public DependencyGraph build(DFComponent component) {
        DependencyGraph graph = new DependencyGraph();
        for (int id: component.getDeclaredIds())
            graph.addNode(id);
        IIndentStream log = Logger.INSTANCE.belowLevel(this, 2);
        log.append("Dependency graph of ")
                .append(component.name)
                .increase();
        for (DFEquation equation: component.equations) {
            Map<Integer, Label> deps = dependencies(equation.expression);
            for (int target: equation.targets) {
                for (Map.Entry<Integer, Label> e: deps.entrySet()) {
                    graph.addEdge(target, e.getKey(), e.getValue());
                    log.append(this.symbols.getName(target))
                            .append(" -> ")
                            .append(this.symbols.getName(e.getKey()))
                            .append(" ")
                            .append(e.getValue().toString())
                            .newline();
                }
            }
            DFNodeCallExpression call = equation.expression.as(DFNodeCallExpression.class);
            if (call != null) {
                graph.addObligation(new InliningObligation(
                        equation.targets, call.callee, call.getInstancePath(), equation.range));
            }
        }
        log.decrease();
        return graph;
    }

    /** Graph with a contract edge in both directions between any two
     * distinct identifiers which appear in the same term. */
    public DependencyGraph buildContractGraph(DFComponent component) {
        DependencyGraph graph = new DependencyGraph();
        List<DFContractTerm> terms = new ArrayList<>(component.contract);
        for (PropagatedContract propagated: component.propagatedContracts)
            terms.add(propagated.term());
        for (DFContractTerm term: terms)
            addTermDependencies(term.term, graph);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Contract graph of ")
                .append(component.name)
                .append(" has ")
                .append(graph.edgeCount())
                .append(" edges")
                .newline();
        return graph;
    }

    public static void addTermDependencies(DFExpression term, DependencyGraph graph) {
        List<Integer> ids = ImmutableList.copyOf(dependencies(term).keySet());
        for (int id1: ids) {
            graph.addNode(id1);
            for (int id2: ids) {
                if (id1 != id2) {
                    graph.addEdge(id1, id2, Label.CONTRACT);
                    graph.addEdge(id2, id1, Label.CONTRACT);
                }
            }
        }
    }
}
