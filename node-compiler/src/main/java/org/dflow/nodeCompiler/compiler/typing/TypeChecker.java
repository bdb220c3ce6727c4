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

package org.dflow.nodeCompiler.compiler.typing;

import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.DFFunctionSignature;
import org.dflow.nodeCompiler.ir.DFNode;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.Scope;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFBinaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFEnumExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFieldExpression;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFFunctionCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFIfExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFMemoryReadExpression;
import org.dflow.nodeCompiler.ir.expression.DFMergeExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFPeriodExpression;
import org.dflow.nodeCompiler.ir.expression.DFSampleExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.nodeCompiler.ir.expression.DFUnaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.nodeCompiler.ir.expression.literal.DFLiteral;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeAny;
import org.dflow.nodeCompiler.ir.type.DFTypeBool;
import org.dflow.nodeCompiler.ir.type.DFTypeCode;
import org.dflow.nodeCompiler.ir.type.DFTypeEnum;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.nodeCompiler.ir.type.DFTypeTuple;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** Attaches a type to every expression of a component and reports type errors.
 *
 * <p>A type mismatch is reported and the offending expression gets the placeholder
 * type, which matches anything, so that unrelated expressions are still checked.
 * An identifier which does not resolve to a symbol of the component is fatal for
 * the component.  Malformed contract terms are reported and removed from the component.
 *
 * <p>Without an error reporter the checker only attaches types; this is used after
 * the passes which rewrite expressions, since errors were reported the first time. */
public class TypeChecker implements IWritesLogs {
    final DFProgram program;
    final SymbolTable symbols;
    @Nullable
    final IErrorReporter reporter;

    @Nullable
    DFComponent component;
    boolean fatal;
    boolean inContract;
    int errors;

    public TypeChecker(DFProgram program, @Nullable IErrorReporter reporter) {
        this.program = program;
        this.symbols = program.symbols;
        this.reporter = reporter;
    }

    /** Type all the expressions of a component.
     * @return false if the component has an error which prevents further analysis. */
    public boolean check(DFComponent component) {
        this.component = component;
        this.fatal = false;
        this.errors = 0;
        this.inContract = false;
        for (DFEquation equation: component.equations)
            this.checkEquation(equation);
        List<DFContractTerm> valid = new ArrayList<>();
        for (DFContractTerm term: component.contract) {
            if (this.checkTerm(term))
                valid.add(term);
        }
        component.contract.clear();
        component.contract.addAll(valid);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Typed ")
                .append(component.name)
                .append(": ")
                .append(this.errors)
                .append(" errors")
                .newline();
        return !this.fatal;
    }

    /** Number of problems found by the last call of {@link #check}. */
    public int getErrorCount() {
        return this.errors;
    }

    DFComponent getComponent() {
        if (this.component == null)
            throw new InternalCompilerError("No component is being checked");
        return this.component;
    }

    void error(ErrorKind kind, DFNode node, String message) {
        this.errors++;
        if (this.reporter == null)
            return;
        SourceRange range = node.range.isValid() ? node.range : this.getComponent().range;
        this.reporter.reportError(range, kind, message);
    }

    DFType mismatch(DFNode node, String message) {
        this.error(ErrorKind.TYPE_MISMATCH, node, message);
        return DFTypeAny.INSTANCE;
    }

    DFType unknown(DFNode node, String message, boolean fatal) {
        if (this.inContract) {
            this.error(ErrorKind.MALFORMED_CONTRACT, node, message);
        } else {
            this.error(ErrorKind.UNKNOWN_ELEMENT, node, message);
            this.fatal |= fatal;
        }
        return DFTypeAny.INSTANCE;
    }

    static String expected(DFType expected, DFType found) {
        return "expected " + expected + ", found " + found;
    }

    void checkEquation(DFEquation equation) {
        DFType type = this.type(equation.expression);
        if (!equation.isTuple()) {
            int target = equation.targets.get(0);
            DFType declared = this.symbols.getType(target);
            if (!type.isCompatible(declared))
                this.mismatch(equation, "Equation of " + this.symbols.getName(target) + ": " +
                        expected(declared, type));
            return;
        }
        if (type.isAny())
            return;
        DFTypeTuple tuple = type.as(DFTypeTuple.class);
        if (tuple == null || tuple.size() != equation.targets.size()) {
            this.mismatch(equation, "Equation defines " + equation.targets.size() +
                    " identifiers, but the expression has type " + type);
            this.fatal |= equation.expression.is(DFNodeCallExpression.class);
            return;
        }
        for (int i = 0; i < tuple.size(); i++) {
            int target = equation.targets.get(i);
            DFType declared = this.symbols.getType(target);
            if (!tuple.fields.get(i).isCompatible(declared))
                this.mismatch(equation, "Equation of " + this.symbols.getName(target) + ": " +
                        expected(declared, tuple.fields.get(i)));
        }
    }

    /** Check a contract term; returns false if it is malformed. */
    boolean checkTerm(DFContractTerm term) {
        int before = this.errors;
        this.inContract = true;
        DFType type = this.type(term.term);
        this.inContract = false;
        if (!type.isAny() && type.code != DFTypeCode.BOOL)
            this.error(ErrorKind.MALFORMED_CONTRACT, term,
                    "Contract term must be boolean, found " + type);
        return this.errors == before;
    }

    /** The type of a symbol referenced from the current component. */
    DFType symbolType(int id, String name, DFNode node) {
        if (id == DFIdentifierExpression.UNRESOLVED || !this.symbols.contains(id))
            return this.unknown(node, "Unknown identifier " + Utilities.singleQuote(name), true);
        Symbol symbol = this.symbols.get(id);
        if (!symbol.component.equals(this.getComponent().name))
            return this.unknown(node, "Identifier " + Utilities.singleQuote(name) +
                    " belongs to node " + symbol.component, true);
        if (symbol.scope == Scope.CONTRACT && !this.inContract)
            return this.unknown(node, "Identifier " + Utilities.singleQuote(name) +
                    " can only be used in contracts", true);
        return symbol.type;
    }

    void checkConstant(DFExpression initial, DFType expected) {
        DFType type = this.type(initial);
        if (!initial.isConstant())
            this.mismatch(initial, "Initial value must be a constant: " + initial);
        else if (!type.isCompatible(expected))
            this.mismatch(initial, "Initial value: " + expected(expected, type));
    }

    DFType type(DFExpression expression) {
        DFType result = this.compute(expression);
        expression.setType(result);
        return result;
    }

    DFType compute(DFExpression expression) {
        return switch (expression.getKind()) {
            case LITERAL -> expression.to(DFLiteral.class).getLiteralType();
            case IDENTIFIER -> {
                DFIdentifierExpression id = expression.to(DFIdentifierExpression.class);
                yield this.symbolType(id.symbolId, id.name, id);
            }
            case UNARY -> {
                DFUnaryExpression unary = expression.to(DFUnaryExpression.class);
                DFType source = this.type(unary.source);
                DFType result = OperatorSignatures.unary(unary.opcode, source);
                if (result == null)
                    yield this.mismatch(unary, "Operator " + unary.opcode + " cannot be applied to " + source);
                yield result;
            }
            case BINARY -> {
                DFBinaryExpression binary = expression.to(DFBinaryExpression.class);
                DFType left = this.type(binary.left);
                DFType right = this.type(binary.right);
                DFType result = OperatorSignatures.binary(binary.opcode, left, right);
                if (result == null)
                    yield this.mismatch(binary, "Operator " + binary.opcode + " cannot be applied to " +
                            left + " and " + right);
                yield result;
            }
            case ENUM -> {
                DFEnumExpression e = expression.to(DFEnumExpression.class);
                DFTypeEnum type = this.program.getEnum(e.enumName);
                if (type == null)
                    yield this.unknown(e, "Unknown enumeration " + Utilities.singleQuote(e.enumName), false);
                if (!type.hasVariant(e.variant))
                    yield this.unknown(e, "Enumeration " + e.enumName + " has no variant " +
                            Utilities.singleQuote(e.variant), false);
                yield type;
            }
            case STRUCT -> {
                DFStructExpression s = expression.to(DFStructExpression.class);
                DFTypeStruct type = this.program.getStruct(s.structName);
                for (DFExpression field: s.fields.values())
                    this.type(field);
                if (type == null)
                    yield this.unknown(s, "Unknown structure " + Utilities.singleQuote(s.structName), false);
                if (!type.fields.keySet().equals(s.fields.keySet()))
                    yield this.mismatch(s, "Structure " + s.structName + " has fields " + type.fields.keySet() +
                            ", found " + s.fields.keySet());
                for (Map.Entry<String, DFExpression> e: s.fields.entrySet()) {
                    DFType declared = Utilities.getExists(type.fields, e.getKey());
                    if (!e.getValue().getType().isCompatible(declared))
                        this.mismatch(e.getValue(), "Field " + e.getKey() + ": " +
                                expected(declared, e.getValue().getType()));
                }
                yield type;
            }
            case FIELD -> {
                DFFieldExpression f = expression.to(DFFieldExpression.class);
                DFType base = this.type(f.expression);
                if (base.isAny())
                    yield base;
                DFTypeStruct struct = base.as(DFTypeStruct.class);
                if (struct == null)
                    yield this.mismatch(f, "Field access on a value of type " + base);
                DFType type = struct.getFieldType(f.fieldName);
                if (type == null)
                    yield this.unknown(f, "Structure " + struct.name + " has no field " +
                            Utilities.singleQuote(f.fieldName), false);
                yield type;
            }
            case IF -> {
                DFIfExpression i = expression.to(DFIfExpression.class);
                DFType condition = this.type(i.condition);
                DFType positive = this.type(i.positive);
                DFType negative = this.type(i.negative);
                if (!condition.isCompatible(DFTypeBool.INSTANCE))
                    this.mismatch(i.condition, "Condition: " + expected(DFTypeBool.INSTANCE, condition));
                if (!positive.isCompatible(negative))
                    yield this.mismatch(i, "Branches have different types " + positive + " and " + negative);
                yield positive.isAny() ? negative : positive;
            }
            case FUNCTION_CALL -> {
                DFFunctionCallExpression call = expression.to(DFFunctionCallExpression.class);
                List<DFType> arguments = Linq.map(call.arguments, this::type);
                DFFunctionSignature signature = this.program.getFunction(call.function);
                if (signature == null)
                    yield this.unknown(call, "Unknown function " + Utilities.singleQuote(call.function), false);
                this.checkArguments(call, call.function, signature.parameters(), arguments);
                yield signature.result();
            }
            case NODE_CALL -> {
                DFNodeCallExpression call = expression.to(DFNodeCallExpression.class);
                List<DFType> arguments = Linq.map(call.arguments, this::type);
                DFComponent callee = this.program.getComponent(call.callee);
                if (callee == null)
                    yield this.unknown(call, "Unknown node " + Utilities.singleQuote(call.callee), true);
                if (this.inContract) {
                    this.error(ErrorKind.MALFORMED_CONTRACT, call, "Contracts cannot call nodes");
                    yield DFTypeAny.INSTANCE;
                }
                this.checkArguments(call, call.callee, Linq.map(callee.inputs, this.symbols::getType), arguments);
                List<DFType> outputs = Linq.map(callee.outputs, this.symbols::getType);
                if (outputs.size() == 1)
                    yield outputs.get(0);
                yield new DFTypeTuple(outputs);
            }
            case LAST -> {
                DFLastExpression last = expression.to(DFLastExpression.class);
                if (this.inContract)
                    this.error(ErrorKind.MALFORMED_CONTRACT, last, "Contracts cannot use delays");
                DFType type = this.symbolType(last.symbolId, last.name, last);
                if (last.initial != null)
                    this.checkConstant(last.initial, type);
                if (type.isEvent())
                    yield this.mismatch(last, "Delay of an event " + last.name);
                yield type;
            }
            case FOLLOWED_BY -> {
                DFFollowedByExpression fby = expression.to(DFFollowedByExpression.class);
                if (this.inContract)
                    this.error(ErrorKind.MALFORMED_CONTRACT, fby, "Contracts cannot use delays");
                DFType next = this.type(fby.next);
                this.checkConstant(fby.initial, next);
                if (next.isEvent())
                    yield this.mismatch(fby, "Delay of an event " + fby.next);
                yield next.isAny() ? fby.initial.getType() : next;
            }
            case WHEN -> {
                DFWhenExpression when = expression.to(DFWhenExpression.class);
                DFType value = this.type(when.expression);
                DFType condition = this.type(when.condition);
                if (!condition.isCompatible(DFTypeBool.INSTANCE))
                    this.mismatch(when.condition, "Clock: " + expected(DFTypeBool.INSTANCE, condition));
                if (value.isAny() || value.isEvent())
                    yield value;
                yield new DFTypeEvent(value);
            }
            case MERGE -> {
                DFMergeExpression merge = expression.to(DFMergeExpression.class);
                DFType left = this.type(merge.left);
                DFType right = this.type(merge.right);
                if ((!left.isAny() && !left.isEvent()) || (!right.isAny() && !right.isEvent()))
                    yield this.mismatch(merge, "Merge of values which are not events: " + left + " and " + right);
                if (!left.isCompatible(right))
                    yield this.mismatch(merge, "Merge of different events " + left + " and " + right);
                yield left.isAny() ? right : left;
            }
            case PERIOD -> {
                DFPeriodExpression period = expression.to(DFPeriodExpression.class);
                if (this.inContract)
                    this.error(ErrorKind.MALFORMED_CONTRACT, period, "Contracts cannot use clocks");
                if (period.period <= 0)
                    this.mismatch(period, "Period must be positive, found " + period.period);
                yield new DFTypeEvent(DFTypeBool.INSTANCE);
            }
            case SAMPLE -> {
                DFSampleExpression sample = expression.to(DFSampleExpression.class);
                DFType event = this.type(sample.event);
                DFType defaultValue = this.type(sample.defaultValue);
                if (event.isAny())
                    yield defaultValue;
                DFTypeEvent e = event.as(DFTypeEvent.class);
                if (e == null)
                    yield this.mismatch(sample, "Sampling a value which is not an event: " + event);
                if (!e.element.isCompatible(defaultValue))
                    yield this.mismatch(sample.defaultValue, "Default value: " + expected(e.element, defaultValue));
                yield e.element;
            }
            case MEMORY_READ -> expression.to(DFMemoryReadExpression.class).cell.type;
        };
    }

    void checkArguments(DFExpression call, String name, List<DFType> parameters, List<DFType> arguments) {
        if (parameters.size() != arguments.size()) {
            this.mismatch(call, name + " expects " + parameters.size() + " arguments, found " + arguments.size());
            // A node call with the wrong arity cannot be inlined
            this.fatal |= call.is(DFNodeCallExpression.class);
            return;
        }
        for (int i = 0; i < parameters.size(); i++) {
            if (!arguments.get(i).isCompatible(parameters.get(i)))
                this.mismatch(call, "Argument " + i + " of " + name + ": " +
                        expected(parameters.get(i), arguments.get(i)));
        }
    }
}
