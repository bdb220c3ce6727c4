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
import org.dflow.nodeCompiler.compiler.analysis.Schedule;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.visitors.ExpressionRewriter;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFMemoryReadExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.nodeCompiler.ir.state.MemoryCell;
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFCallStatement;
import org.dflow.nodeCompiler.ir.statement.DFLetStatement;
import org.dflow.nodeCompiler.ir.statement.DFMemoryWriteStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.util.FreshName;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers an analyzed component to a {@link StateMachineArtifact} in three stages:
 * <ol>
 *     <li>{@link #schedule}: equations in the order of the schedule;</li>
 *     <li>{@link #operational}: delays become reads of memory cells of the current state,
 *     written in the next state after the value they store is computed; calls which were
 *     not inlined become transitions of nested sub-states;</li>
 *     <li>{@link #artifact}: the descriptor of the state machine.</li>
 * </ol>
 * The component must be scheduled and without type errors.  The artifacts of the
 * nodes it still calls must be available.
 */
public class Lowering implements IWritesLogs {
    final SymbolTable symbols;
    /** Artifacts of the nodes already lowered, used for calls which are not inlined. */
    final Map<String, StateMachineArtifact> artifacts;

    public Lowering(SymbolTable symbols, Map<String, StateMachineArtifact> artifacts) {
        this.symbols = symbols;
        this.artifacts = artifacts;
    }

    public StateMachineArtifact lower(DFComponent component) {
        ScheduledComponent scheduled = this.schedule(component);
        Logger.INSTANCE.belowLevel(this, 2)
                .append(scheduled)
                .newline();
        OperationalComponent operational = this.operational(scheduled);
        Logger.INSTANCE.belowLevel(this, 2)
                .append(operational)
                .newline();
        StateMachineArtifact result = this.artifact(operational);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Lowered ")
                .append(component.name)
                .append(": ")
                .append(result.body.size())
                .append(" statements, ")
                .append(result.state.totalCells())
                .append(" memory cells")
                .newline();
        return result;
    }

    public ScheduledComponent schedule(DFComponent component) {
        Schedule schedule = component.getSchedule();
        List<DFEquation> equations = new ArrayList<>(component.equations);
        // List.sort is stable
        equations.sort(Comparator.comparingInt(e -> this.position(schedule, e)));
        return new ScheduledComponent(component, equations);
    }

    int position(Schedule schedule, DFEquation equation) {
        int result = Integer.MAX_VALUE;
        for (int target: equation.targets)
            result = Math.min(result, schedule.getPosition(target));
        return result;
    }

    /** Builds the state shape and replaces delays with memory reads. */
    class MemoryAllocator extends ExpressionRewriter {
        final StateShape state;
        /** Cells keyed by source identifier and initial value. */
        final Map<String, MemoryCell> cells;
        final Map<List<String>, FreshName> names;

        MemoryAllocator(StateShape state) {
            this.state = state;
            this.cells = new LinkedHashMap<>();
            this.names = new HashMap<>();
        }

        MemoryCell getCell(Symbol source, DFExpression initial) {
            String key = source.id + ":" + initial;
            MemoryCell cell = this.cells.get(key);
            if (cell != null)
                return cell;
            FreshName names = this.names.computeIfAbsent(source.path, p -> new FreshName(new HashSet<>()));
            cell = new MemoryCell(names.freshName("mem_" + source.localName), source.path, source, initial);
            this.state.getSubState(source.path).addCell(cell);
            this.cells.put(key, cell);
            return cell;
        }

        DFExpression read(DFExpression delay, MemoryCell cell) {
            DFMemoryReadExpression result = new DFMemoryReadExpression(delay.range, cell);
            result.setType(cell.type);
            return result;
        }

        @Override
        protected DFExpression last(DFLastExpression expression) {
            Symbol source = Lowering.this.symbols.get(expression.symbolId);
            DFExpression initial = expression.initial != null ? expression.initial : source.type.defaultValue();
            return this.read(expression, this.getCell(source, initial));
        }

        @Override
        protected DFExpression followedBy(DFFollowedByExpression expression) {
            DFIdentifierExpression next = expression.next.to(DFIdentifierExpression.class);
            Symbol source = Lowering.this.symbols.get(next.symbolId);
            return this.read(expression, this.getCell(source, expression.initial));
        }

        @Override
        protected DFExpression nodeCall(DFNodeCallExpression expression) {
            throw new InternalCompilerError("Node call not in normal form", expression);
        }

        /** Rewrites the arguments of a call that is the whole right-hand side of an equation. */
        DFNodeCallExpression rewriteCall(DFNodeCallExpression call) {
            return new DFNodeCallExpression(call.range, call.callee,
                    this.applyAll(call.arguments), call.instancePath);
        }
    }

    StateShape stateShape(DFComponent component) {
        StateShape result = new StateShape(component.name, false);
        Map<List<String>, String> called = new HashMap<>();
        for (DFEquation equation: component.equations) {
            DFNodeCallExpression call = equation.expression.as(DFNodeCallExpression.class);
            if (call != null)
                called.put(call.getInstancePath(), call.callee);
        }
        for (Map.Entry<List<String>, String> e: component.instances.entrySet()) {
            List<String> path = e.getKey();
            StateShape parent = result.getSubState(path.subList(0, path.size() - 1));
            String instance = Utilities.last(path);
            StateShape sub;
            if (called.containsKey(path)) {
                StateMachineArtifact callee = this.artifacts.get(e.getValue());
                if (callee == null)
                    throw new InternalCompilerError("Node " + e.getValue() + " called by " +
                            component.name + " has not been compiled");
                sub = callee.state.asCalled();
            } else {
                sub = new StateShape(e.getValue(), false);
            }
            parent.addSubState(instance, sub);
        }
        return result;
    }

    public OperationalComponent operational(ScheduledComponent scheduled) {
        DFComponent component = scheduled.component;
        StateShape state = this.stateShape(component);
        MemoryAllocator allocator = new MemoryAllocator(state);

        // First allocate the cells, in evaluation order
        List<DFExpression> rewritten = new ArrayList<>();
        for (DFEquation equation: scheduled.equations) {
            DFNodeCallExpression call = equation.expression.as(DFNodeCallExpression.class);
            if (call != null)
                rewritten.add(allocator.rewriteCall(call));
            else
                rewritten.add(allocator.apply(equation.expression));
        }

        Map<Integer, List<MemoryCell>> writes = new HashMap<>();
        for (MemoryCell cell: allocator.cells.values())
            writes.computeIfAbsent(cell.source.id, k -> new ArrayList<>()).add(cell);

        List<DFStatement> statements = new ArrayList<>();
        for (int input: component.inputs)
            this.addWrites(statements, writes, input);
        for (int i = 0; i < scheduled.equations.size(); i++) {
            DFEquation equation = scheduled.equations.get(i);
            DFExpression expression = rewritten.get(i);
            DFNodeCallExpression call = expression.as(DFNodeCallExpression.class);
            if (call != null) {
                statements.add(new DFCallStatement(equation.range, call.instancePath, call.callee,
                        call.arguments, Linq.map(equation.targets, this.symbols::get)));
            } else {
                Utilities.enforce(!equation.isTuple(), "Tuple equation without a node call");
                statements.add(new DFLetStatement(equation.range,
                        this.symbols.get(equation.targets.get(0)), expression));
            }
            for (int target: equation.targets)
                this.addWrites(statements, writes, target);
        }
        return new OperationalComponent(component, state, statements);
    }

    void addWrites(List<DFStatement> statements, Map<Integer, List<MemoryCell>> writes, int source) {
        for (MemoryCell cell: writes.getOrDefault(source, List.of()))
            statements.add(new DFMemoryWriteStatement(cell.source.range, cell, cell.source));
    }

    public StateMachineArtifact artifact(OperationalComponent operational) {
        DFComponent component = operational.component;
        List<List<String>> partition = new ArrayList<>();
        for (ImmutableList<Integer> group: component.getSchedule().partition) {
            List<String> names = new ArrayList<>();
            for (int id: group)
                if (!component.inputs.contains(id))
                    names.add(this.symbols.getName(id));
            if (!names.isEmpty())
                partition.add(names);
        }
        return new StateMachineArtifact(component.name,
                Linq.map(component.inputs, this.symbols::get),
                Linq.map(component.outputs, this.symbols::get),
                operational.state, operational.statements, partition,
                component.contract, component.propagatedContracts);
    }
}
