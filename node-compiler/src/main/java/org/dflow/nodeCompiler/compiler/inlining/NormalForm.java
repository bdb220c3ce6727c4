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
import org.dflow.nodeCompiler.compiler.visitors.ExpressionRewriter;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.Scope;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpressionKind;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFIfExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.expression.DFPeriodExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.nodeCompiler.ir.expression.literal.DFBoolLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFIntegerLiteral;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeBool;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeInteger;
import org.dflow.nodeCompiler.ir.type.DFTypeTuple;
import org.dflow.util.FreshName;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Puts the equations of a component in normal form:
 * <ul>
 *     <li>a node call only appears as the whole right-hand side of an equation,
 *     and its arguments contain no node calls;</li>
 *     <li>every node call has an instance name, unique in the component;</li>
 *     <li>the delayed branch of a 'fby' is an identifier;</li>
 *     <li>there are no 'period' expressions.</li>
 * </ul>
 * The expressions must be typed; new locals get the types of the expressions they name.
 */
public class NormalForm implements IComponentPass, IWritesLogs {
    final DFProgram program;
    final SymbolTable symbols;

    public NormalForm(DFProgram program) {
        this.program = program;
        this.symbols = program.symbols;
    }

    /** State used while normalizing one component. */
    class Normalizer extends ExpressionRewriter {
        final DFComponent component;
        final FreshName names;
        /** Number of call sites for each callee. */
        final Map<String, Integer> callSites;
        /** Equations created for hoisted expressions; they precede the equation being normalized. */
        final List<DFEquation> hoisted;

        Normalizer(DFComponent component) {
            this.component = component;
            this.names = new FreshName(new HashSet<>());
            for (int id: component.getDeclaredIds())
                this.names.reserve(NormalForm.this.symbols.getName(id));
            for (int id: component.contractLocals)
                this.names.reserve(NormalForm.this.symbols.getName(id));
            this.callSites = new HashMap<>();
            this.hoisted = new ArrayList<>();
        }

        DFIdentifierExpression newLocal(String prefix, DFType type, DFExpression definition) {
            Symbol symbol = this.newSymbol(prefix, type, definition);
            this.hoisted.add(new DFEquation(definition.range, symbol.id, definition));
            return this.reference(symbol, definition);
        }

        Symbol newSymbol(String prefix, DFType type, DFExpression definition) {
            String name = this.names.freshName(prefix);
            Symbol symbol = NormalForm.this.symbols.add(
                    this.component.name, name, type, Scope.LOCAL, definition.range);
            this.component.locals.add(symbol.id);
            Logger.INSTANCE.belowLevel(NormalForm.this, 2)
                    .append("New local ")
                    .append(name)
                    .append(" = ")
                    .append(definition)
                    .newline();
            return symbol;
        }

        DFIdentifierExpression reference(Symbol symbol, DFExpression expression) {
            DFIdentifierExpression result = new DFIdentifierExpression(expression.range, symbol.id, symbol.name);
            result.setType(symbol.type);
            return result;
        }

        /** A call with normalized arguments and an instance name. */
        DFNodeCallExpression instantiate(DFNodeCallExpression call) {
            int site = this.callSites.getOrDefault(call.callee, 0);
            String instance = call.callee + "_" + site;
            while (this.component.instances.containsKey(List.of(instance))) {
                site++;
                instance = call.callee + "_" + site;
            }
            this.callSites.put(call.callee, site + 1);
            Utilities.putNew(this.component.instances, List.of(instance), call.callee);
            DFNodeCallExpression result = new DFNodeCallExpression(
                    call.range, call.callee, this.applyAll(call.arguments), List.of(instance));
            if (call.hasType())
                result.setType(call.getType());
            return result;
        }

        DFExpression topLevel(DFExpression expression) {
            DFNodeCallExpression call = expression.as(DFNodeCallExpression.class);
            if (call != null)
                return this.instantiate(call);
            return this.apply(expression);
        }

        @Override
        protected DFExpression nodeCall(DFNodeCallExpression expression) {
            DFNodeCallExpression call = this.instantiate(expression);
            DFType type = call.getType();
            DFTypeTuple tuple = type.as(DFTypeTuple.class);
            if (tuple == null)
                return this.newLocal(call.callee + "_out", type, call);
            // Only legal as a whole equation; the type checker has reported the misuse.
            List<Symbol> targets = new ArrayList<>();
            for (DFType field: tuple.fields)
                targets.add(this.newSymbol(call.callee + "_out", field, call));
            this.hoisted.add(new DFEquation(call.range, Linq.map(targets, s -> s.id), call));
            return this.reference(targets.get(0), call);
        }

        @Override
        protected DFExpression followedBy(DFFollowedByExpression expression) {
            DFExpression next = this.apply(expression.next);
            if (next.getKind() != DFExpressionKind.IDENTIFIER)
                next = this.newLocal("fby_next", next.getType(), next);
            return new DFFollowedByExpression(expression.range, expression.initial, next);
        }

        @Override
        protected DFExpression period(DFPeriodExpression expression) {
            // c = if (last c init 0) + 1 >= n then 0 else (last c init 0) + 1
            DFTypeInteger integer = DFTypeInteger.INSTANCE;
            String name = this.names.freshName("period_counter");
            Symbol counter = NormalForm.this.symbols.add(
                    this.component.name, name, integer, Scope.LOCAL, expression.range);
            this.component.locals.add(counter.id);
            DFExpression next = this.successor(counter, expression);
            DFExpression limit = new DFIntegerLiteral(expression.range, expression.period);
            limit.setType(integer);
            DFExpression wrap = this.typed(next.binary(DFOpcode.GTE, limit), DFTypeBool.INSTANCE);
            DFExpression zero = this.typed(new DFIntegerLiteral(expression.range, 0), integer);
            DFExpression definition = this.typed(new DFIfExpression(expression.range, wrap, zero,
                    this.successor(counter, expression)), integer);
            this.hoisted.add(new DFEquation(expression.range, counter.id, definition));

            DFExpression tick = this.typed(this.reference(counter, expression).binary(DFOpcode.EQ,
                    this.typed(new DFIntegerLiteral(expression.range, 0), integer)), DFTypeBool.INSTANCE);
            DFExpression present = this.typed(new DFBoolLiteral(expression.range, true), DFTypeBool.INSTANCE);
            return this.typed(new DFWhenExpression(expression.range, present, tick),
                    new DFTypeEvent(DFTypeBool.INSTANCE));
        }

        /** (last counter init 0) + 1 */
        DFExpression successor(Symbol counter, DFExpression source) {
            DFTypeInteger integer = DFTypeInteger.INSTANCE;
            DFExpression init = this.typed(new DFIntegerLiteral(source.range, 0), integer);
            DFExpression last = this.typed(new DFLastExpression(source.range, counter.id, counter.name, init), integer);
            DFExpression one = this.typed(new DFIntegerLiteral(source.range, 1), integer);
            return this.typed(last.binary(DFOpcode.ADD, one), integer);
        }

        DFExpression typed(DFExpression expression, DFType type) {
            expression.setType(type);
            return expression;
        }
    }

    @Override
    public void apply(DFComponent component) {
        Normalizer normalizer = new Normalizer(component);
        List<DFEquation> result = new ArrayList<>();
        for (DFEquation equation: component.equations) {
            DFExpression expression = normalizer.topLevel(equation.expression);
            result.addAll(normalizer.hoisted);
            normalizer.hoisted.clear();
            result.add(equation.withExpression(expression));
        }
        component.equations.clear();
        component.equations.addAll(result);
        component.invalidateAnalyses();
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Normal form of ")
                .append(component.name)
                .append(": ")
                .append(component.equations.size())
                .append(" equations")
                .newline();
    }
}
