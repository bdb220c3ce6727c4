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

package org.dflow.nodeCompiler.compiler.frontend;

import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.errors.CompilationError;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.Scope;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFBinaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFEnumExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFFunctionCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFIfExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFMergeExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.expression.DFPeriodExpression;
import org.dflow.nodeCompiler.ir.expression.DFSampleExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.nodeCompiler.ir.expression.DFUnaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.nodeCompiler.ir.expression.literal.DFBoolLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFFloatLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFIntegerLiteral;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.util.IValidate;
import org.dflow.util.Linq;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builds one component: declares its symbols and collects its equations and contract.
 * Expressions built by the helper methods have no source range. */
public class ComponentBuilder implements IValidate {
    final SymbolTable symbols;
    final DFComponent component;
    final Map<String, Symbol> byName;

    ComponentBuilder(SymbolTable symbols, String name, SourceRange range) {
        this.symbols = symbols;
        this.component = new DFComponent(range, name);
        this.byName = new HashMap<>();
    }

    public String getName() {
        return this.component.name;
    }

    Symbol declare(String name, DFType type, Scope scope, SourceRange range) {
        if (this.byName.containsKey(name))
            throw new CompilationError("Identifier " + name + " declared twice in node " + this.getName(),
                    ErrorKind.MALFORMED_PROGRAM, range);
        Symbol symbol = this.symbols.add(this.getName(), name, type, scope, range);
        this.byName.put(name, symbol);
        switch (scope) {
            case INPUT -> this.component.inputs.add(symbol.id);
            case OUTPUT -> this.component.outputs.add(symbol.id);
            case LOCAL -> this.component.locals.add(symbol.id);
            case CONTRACT -> this.component.contractLocals.add(symbol.id);
        }
        return symbol;
    }

    public Symbol input(String name, DFType type, SourceRange range) {
        return this.declare(name, type, Scope.INPUT, range);
    }

    public Symbol input(String name, DFType type) {
        return this.input(name, type, SourceRange.INVALID);
    }

    public Symbol output(String name, DFType type, SourceRange range) {
        return this.declare(name, type, Scope.OUTPUT, range);
    }

    public Symbol output(String name, DFType type) {
        return this.output(name, type, SourceRange.INVALID);
    }

    public Symbol local(String name, DFType type, SourceRange range) {
        return this.declare(name, type, Scope.LOCAL, range);
    }

    public Symbol local(String name, DFType type) {
        return this.local(name, type, SourceRange.INVALID);
    }

    /** Declare an identifier which may only be used by the contract. */
    public Symbol contractLocal(String name, DFType type) {
        return this.declare(name, type, Scope.CONTRACT, SourceRange.INVALID);
    }

    @Nullable
    public Symbol lookup(String name) {
        return this.byName.get(name);
    }

    public void equation(List<Symbol> targets, DFExpression expression, SourceRange range) {
        this.component.equations.add(new DFEquation(range, Linq.map(targets, s -> s.id), expression));
    }

    public void equation(Symbol target, DFExpression expression) {
        this.equation(List.of(target), expression, SourceRange.INVALID);
    }

    public void equation(List<Symbol> targets, DFExpression expression) {
        this.equation(targets, expression, SourceRange.INVALID);
    }

    public void contract(DFContractTerm.Kind kind, DFExpression term, SourceRange range) {
        this.component.contract.add(new DFContractTerm(range, kind, term));
    }

    public void contract(DFContractTerm.Kind kind, DFExpression term) {
        this.contract(kind, term, SourceRange.INVALID);
    }

    // Expressions

    public DFIdentifierExpression ref(Symbol symbol) {
        return new DFIdentifierExpression(SourceRange.INVALID, symbol.id, symbol.name);
    }

    /** Reference by name; a name which is not declared produces an unresolved identifier. */
    public DFIdentifierExpression ref(String name, SourceRange range) {
        Symbol symbol = this.lookup(name);
        if (symbol == null)
            return new DFIdentifierExpression(range, DFIdentifierExpression.UNRESOLVED, name);
        return new DFIdentifierExpression(range, symbol.id, symbol.name);
    }

    public DFIdentifierExpression ref(String name) {
        return this.ref(name, SourceRange.INVALID);
    }

    public DFIntegerLiteral literal(long value) {
        return new DFIntegerLiteral(value);
    }

    public DFBoolLiteral literal(boolean value) {
        return new DFBoolLiteral(value);
    }

    public DFFloatLiteral literal(double value) {
        return new DFFloatLiteral(SourceRange.INVALID, value);
    }

    public DFExpression unary(DFOpcode opcode, DFExpression source) {
        return new DFUnaryExpression(SourceRange.INVALID, opcode, source);
    }

    public DFExpression binary(DFOpcode opcode, DFExpression left, DFExpression right) {
        return new DFBinaryExpression(SourceRange.INVALID, opcode, left, right);
    }

    public DFExpression add(DFExpression left, DFExpression right) {
        return this.binary(DFOpcode.ADD, left, right);
    }

    public DFExpression ite(DFExpression condition, DFExpression positive, DFExpression negative) {
        return new DFIfExpression(SourceRange.INVALID, condition, positive, negative);
    }

    public DFExpression enumValue(String enumName, String variant) {
        return new DFEnumExpression(SourceRange.INVALID, enumName, variant);
    }

    public DFExpression struct(String structName, LinkedHashMap<String, DFExpression> fields) {
        return new DFStructExpression(SourceRange.INVALID, structName, fields);
    }

    public DFExpression call(String function, DFExpression... arguments) {
        return new DFFunctionCallExpression(SourceRange.INVALID, function, Linq.list(arguments));
    }

    public DFExpression node(String callee, DFExpression... arguments) {
        return new DFNodeCallExpression(SourceRange.INVALID, callee, Linq.list(arguments));
    }

    public DFExpression last(Symbol symbol) {
        return new DFLastExpression(SourceRange.INVALID, symbol.id, symbol.name, null);
    }

    public DFExpression last(Symbol symbol, DFExpression initial) {
        return new DFLastExpression(SourceRange.INVALID, symbol.id, symbol.name, initial);
    }

    public DFExpression fby(DFExpression initial, DFExpression next) {
        return new DFFollowedByExpression(SourceRange.INVALID, initial, next);
    }

    public DFExpression when(DFExpression expression, DFExpression condition) {
        return new DFWhenExpression(SourceRange.INVALID, expression, condition);
    }

    public DFExpression merge(DFExpression left, DFExpression right) {
        return new DFMergeExpression(SourceRange.INVALID, left, right);
    }

    public DFExpression period(long period) {
        return new DFPeriodExpression(SourceRange.INVALID, period);
    }

    public DFExpression sample(DFExpression event, DFExpression defaultValue) {
        return new DFSampleExpression(SourceRange.INVALID, event, defaultValue);
    }

    /** Check that every output and local is defined by exactly one equation,
     * and that inputs are never defined. */
    @Override
    public boolean validate(IErrorReporter reporter) {
        boolean valid = true;
        Map<Integer, Integer> definitions = new HashMap<>();
        for (DFEquation equation: this.component.equations) {
            for (int target: equation.targets) {
                Symbol symbol = this.symbols.get(target);
                if (!symbol.component.equals(this.getName()) || !symbol.scope.isDefinedByEquation()) {
                    reporter.reportError(equation.range, ErrorKind.MALFORMED_PROGRAM,
                            "Equation cannot define " + symbol.scope.name().toLowerCase() + " " + symbol.name);
                    valid = false;
                }
                definitions.merge(target, 1, Integer::sum);
            }
        }
        List<Integer> defined = new ArrayList<>(this.component.outputs);
        defined.addAll(this.component.locals);
        for (int id: defined) {
            Symbol symbol = this.symbols.get(id);
            int count = definitions.getOrDefault(id, 0);
            if (count != 1) {
                reporter.reportError(symbol.range, ErrorKind.MALFORMED_PROGRAM,
                        "Identifier " + symbol.name + " of node " + this.getName() + " is defined by " +
                                count + " equations instead of exactly one");
                valid = false;
            }
        }
        return valid;
    }

    DFComponent getComponent() {
        return this.component;
    }
}
