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

package org.dflow.nodeCompiler.compiler.inlining;

import org.dflow.nodeCompiler.compiler.IComponentPass;
import org.dflow.nodeCompiler.compiler.analysis.CausalityAnalyzer;
import org.dflow.nodeCompiler.compiler.analysis.DependencyGraph;
import org.dflow.nodeCompiler.compiler.analysis.DependencyGraphBuilder;
import org.dflow.nodeCompiler.compiler.errors.CompilationError;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.RecursiveInlineError;
import org.dflow.nodeCompiler.compiler.visitors.ExpressionRewriter;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.PropagatedContract;
import org.dflow.nodeCompiler.ir.Scope;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.util.FreshName;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Replaces node calls with the equations of the callee.
 *
 * <p>The identifiers of the callee are renamed to fresh identifiers of the caller,
 * which remember the call-site instance they come from, so the memory of an inlined
 * call still forms a separate sub-state of the caller state.  The inputs of the callee
 * become equations bound to the call arguments, and the call targets are bound to the
 * renamed outputs.  Contract terms of the callee are carried as {@link PropagatedContract}s.
 *
 * <p>The inlined form of each callee is computed once.  Components must be in normal form.
 */
public class Inliner implements IComponentPass, IWritesLogs {
    final DFProgram program;
    final SymbolTable symbols;
    final InlinePolicy policy;
    final DependencyGraphBuilder graphBuilder;
    /** Inlined form of each node, keyed by node name. */
    final Map<String, DFComponent> inlined;
    /** Nodes whose inlining is in progress, outermost first. */
    final List<String> inProgress;
    /** Nodes whose call graph has been fully explored without reaching a cycle. */
    final Set<String> recursionFree;

    public Inliner(DFProgram program, InlinePolicy policy) {
        this.program = program;
        this.symbols = program.symbols;
        this.policy = policy;
        this.graphBuilder = new DependencyGraphBuilder(program.symbols);
        this.inlined = new HashMap<>();
        this.inProgress = new ArrayList<>();
        this.recursionFree = new HashSet<>();
    }

    /** Inline the calls of a component in place.
     * @throws RecursiveInlineError if the component calls itself, directly or not. */
    @Override
    public void apply(DFComponent component) {
        this.checkRecursion(component, new ArrayList<>());
        this.inProgress.add(component.name);
        try {
            this.inlineCalls(component);
        } finally {
            this.inProgress.remove(this.inProgress.size() - 1);
        }
        this.inlined.put(component.name, component);
    }

    /** Reject call chains which reach a node already on the chain.
     * Each node is explored at most once per program. */
    void checkRecursion(DFComponent component, List<String> chain) {
        if (this.recursionFree.contains(component.name))
            return;
        chain.add(component.name);
        for (DFEquation equation: component.equations) {
            DFNodeCallExpression call = equation.expression.as(DFNodeCallExpression.class);
            if (call == null || this.recursionFree.contains(call.callee))
                continue;
            if (chain.contains(call.callee)) {
                List<String> cycle = new ArrayList<>(chain.subList(chain.indexOf(call.callee), chain.size()));
                cycle.add(call.callee);
                throw new RecursiveInlineError(cycle, call.range);
            }
            this.checkRecursion(this.getCallee(call), chain);
        }
        chain.remove(chain.size() - 1);
        this.recursionFree.add(component.name);
    }

    DFComponent getCallee(DFNodeCallExpression call) {
        DFComponent callee = this.program.getComponent(call.callee);
        if (callee == null)
            throw new CompilationError("Unknown node " + Utilities.singleQuote(call.callee),
                    ErrorKind.UNKNOWN_ELEMENT, call.range);
        return callee;
    }

    /** The callee with its own calls inlined; not the component stored in the program. */
    DFComponent inlinedForm(DFNodeCallExpression call) {
        DFComponent result = this.inlined.get(call.callee);
        if (result != null)
            return result;
        if (this.inProgress.contains(call.callee)) {
            List<String> chain = new ArrayList<>(this.inProgress);
            chain.add(call.callee);
            throw new RecursiveInlineError(chain, call.range);
        }
        result = this.getCallee(call).copy();
        this.inProgress.add(call.callee);
        try {
            this.inlineCalls(result);
        } finally {
            this.inProgress.remove(this.inProgress.size() - 1);
        }
        this.inlined.put(call.callee, result);
        return result;
    }

    void inlineCalls(DFComponent component) {
        switch (this.policy) {
            case ALL -> {
                List<DFEquation> result = new ArrayList<>();
                for (DFEquation equation: component.equations) {
                    DFNodeCallExpression call = equation.expression.as(DFNodeCallExpression.class);
                    if (call == null)
                        result.add(equation);
                    else
                        result.addAll(this.inlineCall(component, equation, call));
                }
                component.equations.clear();
                component.equations.addAll(result);
            }
            case NEEDED -> {
                while (true) {
                    DFEquation equation = this.callOnCycle(component);
                    if (equation == null)
                        break;
                    int index = component.equations.indexOf(equation);
                    List<DFEquation> replacement = this.inlineCall(component, equation,
                            equation.expression.to(DFNodeCallExpression.class));
                    component.equations.remove(index);
                    component.equations.addAll(index, replacement);
                }
            }
        }
        component.invalidateAnalyses();
    }

    /** An equation calling a node which is on a zero-delay cycle of the component, if any. */
    @Nullable
    DFEquation callOnCycle(DFComponent component) {
        DependencyGraph graph = this.graphBuilder.build(component);
        List<Integer> cycle = CausalityAnalyzer.findCycle(graph, component.getDeclarationOrder());
        if (cycle == null)
            return null;
        for (DFEquation equation: component.equations) {
            if (!equation.expression.is(DFNodeCallExpression.class))
                continue;
            for (int target: equation.targets)
                if (cycle.contains(target))
                    return equation;
        }
        // The cycle is reported by the causality analysis.
        return null;
    }

    /** Renames the identifiers of an inlined callee and prefixes the instance paths of its calls. */
    static class Renamer extends ExpressionRewriter {
        final Map<Integer, Symbol> renaming;
        final List<String> instance;

        Renamer(Map<Integer, Symbol> renaming, List<String> instance) {
            this.renaming = renaming;
            this.instance = instance;
        }

        Symbol rename(int id) {
            return Utilities.getExists(this.renaming, id);
        }

        @Override
        protected DFExpression identifier(DFIdentifierExpression expression) {
            Symbol symbol = this.rename(expression.symbolId);
            return new DFIdentifierExpression(expression.range, symbol.id, symbol.name);
        }

        @Override
        protected DFExpression last(DFLastExpression expression) {
            Symbol symbol = this.rename(expression.symbolId);
            return new DFLastExpression(expression.range, symbol.id, symbol.name,
                    this.applyOptional(expression.initial));
        }

        @Override
        protected DFExpression nodeCall(DFNodeCallExpression expression) {
            return new DFNodeCallExpression(expression.range, expression.callee,
                    this.applyAll(expression.arguments),
                    Linq.concat(this.instance, expression.getInstancePath()));
        }
    }

    /** The equations which replace an equation calling a node. */
    List<DFEquation> inlineCall(DFComponent caller, DFEquation equation, DFNodeCallExpression call) {
        DFComponent callee = this.inlinedForm(call);
        List<String> instance = call.getInstancePath();
        String prefix = String.join("_", instance);

        FreshName names = new FreshName(new HashSet<>());
        for (int id: caller.getDeclaredIds())
            names.reserve(this.symbols.getName(id));
        for (int id: caller.contractLocals)
            names.reserve(this.symbols.getName(id));

        Map<Integer, Symbol> renaming = new LinkedHashMap<>();
        for (int id: Linq.concat(callee.getDeclaredIds(), callee.contractLocals)) {
            Symbol symbol = this.symbols.get(id);
            boolean contract = symbol.scope == Scope.CONTRACT;
            Symbol renamed = this.symbols.add(caller.name, names.freshName(prefix + "_" + symbol.name),
                    symbol.localName, symbol.type, contract ? Scope.CONTRACT : Scope.LOCAL,
                    Linq.concat(instance, symbol.path), symbol.range);
            if (contract)
                caller.contractLocals.add(renamed.id);
            else
                caller.locals.add(renamed.id);
            renaming.put(id, renamed);
        }
        Renamer renamer = new Renamer(renaming, instance);

        List<DFEquation> result = new ArrayList<>();
        for (int i = 0; i < callee.inputs.size(); i++) {
            Symbol input = renaming.get(callee.inputs.get(i));
            result.add(new DFEquation(call.range, input.id, call.arguments.get(i)));
        }
        for (DFEquation calleeEquation: callee.equations) {
            List<Integer> targets = Linq.map(calleeEquation.targets, t -> renamer.rename(t).id);
            result.add(new DFEquation(calleeEquation.range, targets, renamer.apply(calleeEquation.expression)));
        }
        for (int i = 0; i < equation.targets.size(); i++) {
            Symbol output = renaming.get(callee.outputs.get(i));
            DFIdentifierExpression value = new DFIdentifierExpression(call.range, output.id, output.name);
            value.setType(output.type);
            result.add(new DFEquation(equation.range, equation.targets.get(i), value));
        }

        for (Map.Entry<List<String>, String> e: callee.instances.entrySet())
            caller.instances.put(Linq.concat(instance, e.getKey()), e.getValue());
        this.propagateContracts(caller, callee, instance, renamer);

        Logger.INSTANCE.belowLevel(this, 1)
                .append("Inlined ")
                .append(call.callee)
                .append(" as ")
                .append(prefix)
                .append(" in ")
                .append(caller.name)
                .append(": ")
                .append(result.size())
                .append(" equations")
                .newline();
        return result;
    }

    void propagateContracts(DFComponent caller, DFComponent callee, List<String> instance, Renamer renamer) {
        Map<Integer, Integer> original = new HashMap<>();
        for (Map.Entry<Integer, Symbol> e: renamer.renaming.entrySet())
            original.put(e.getValue().id, e.getKey());
        for (DFContractTerm term: callee.contract) {
            DFContractTerm renamed = term.withTerm(renamer.apply(term.term));
            caller.propagatedContracts.add(new PropagatedContract(
                    instance, callee.name, renamed, this.restrict(original, renamed.term)));
        }
        for (PropagatedContract propagated: callee.propagatedContracts) {
            // Compose: caller id -> callee id -> id in the node which declared the term
            Map<Integer, Integer> composed = new LinkedHashMap<>();
            for (Map.Entry<Integer, Integer> e: propagated.originalIds().entrySet())
                composed.put(renamer.rename(e.getKey()).id, e.getValue());
            DFContractTerm renamed = propagated.term().withTerm(renamer.apply(propagated.term().term));
            caller.propagatedContracts.add(new PropagatedContract(
                    Linq.concat(instance, propagated.path()), propagated.callee(), renamed, composed));
        }
    }

    /** The entries of 'ids' for the identifiers referenced in 'term'. */
    Map<Integer, Integer> restrict(Map<Integer, Integer> ids, DFExpression term) {
        Map<Integer, Integer> result = new LinkedHashMap<>();
        for (int id: DependencyGraphBuilder.dependencies(term).keySet())
            result.put(id, Utilities.getExists(ids, id));
        return result;
    }
}
