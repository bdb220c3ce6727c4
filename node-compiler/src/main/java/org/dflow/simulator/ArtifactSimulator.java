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

package org.dflow.simulator;

import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFBinaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFEnumExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFieldExpression;
import org.dflow.nodeCompiler.ir.expression.DFFunctionCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFIfExpression;
import org.dflow.nodeCompiler.ir.expression.DFMemoryReadExpression;
import org.dflow.nodeCompiler.ir.expression.DFMergeExpression;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.expression.DFSampleExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.nodeCompiler.ir.expression.DFUnaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.nodeCompiler.ir.expression.literal.Absent;
import org.dflow.nodeCompiler.ir.expression.literal.DFLiteral;
import org.dflow.nodeCompiler.ir.state.MemoryCell;
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFCallStatement;
import org.dflow.nodeCompiler.ir.statement.DFLetStatement;
import org.dflow.nodeCompiler.ir.statement.DFMemoryWriteStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes state machine artifacts.
 *
 * <p>Values are represented as Boolean, Long, Double, {@link EnumValue}, {@link StructValue},
 * and {@link Absent} for events which are not present.  {@link #transition} is a pure function
 * of the state and the inputs; {@link #step} updates the state in place and has the same result.
 */
public class ArtifactSimulator implements IWritesLogs {
    final Map<String, StateMachineArtifact> artifacts;
    final Map<String, RuntimeFunction> functions;

    public ArtifactSimulator(Collection<StateMachineArtifact> artifacts) {
        this.artifacts = new HashMap<>();
        for (StateMachineArtifact artifact: artifacts)
            this.artifacts.put(artifact.name, artifact);
        this.functions = new HashMap<>();
    }

    public void registerFunction(String name, RuntimeFunction function) {
        this.functions.put(name, function);
    }

    StateMachineArtifact getArtifact(String node) {
        StateMachineArtifact result = this.artifacts.get(node);
        if (result == null)
            throw new SimulationError("No artifact for node " + node);
        return result;
    }

    /** The initial state of a node. */
    public SimulatorState initialize(String node) {
        return this.initialize(this.getArtifact(node).state);
    }

    SimulatorState initialize(StateShape shape) {
        SimulatorState result = new SimulatorState(shape.component);
        Map<Integer, Object> empty = new HashMap<>();
        for (MemoryCell cell: shape.getCells())
            result.addCell(cell.name, this.evaluate(cell.initial, empty, result));
        for (Map.Entry<String, StateShape> e: shape.getSubStates().entrySet())
            result.addSubState(e.getKey(), this.initialize(e.getValue()));
        return result;
    }

    /** Compute the outputs and the next state; 'state' is not modified. */
    public StepResult transition(String node, SimulatorState state, Map<String, Object> inputs) {
        return this.transition(this.getArtifact(node), state, inputs);
    }

    /** Compute the outputs and replace 'state' with the next state. */
    public Map<String, Object> step(String node, SimulatorState state, Map<String, Object> inputs) {
        StepResult result = this.transition(node, state, inputs);
        state.assign(result.state());
        return result.outputs();
    }

    StepResult transition(StateMachineArtifact artifact, SimulatorState state, Map<String, Object> inputs) {
        SimulatorState next = state.copy();
        Map<Integer, Object> values = new HashMap<>();
        for (Symbol input: artifact.inputs) {
            Object value = inputs.get(input.name);
            if (value == null)
                throw new SimulationError("Missing value for input " + input.name + " of " + artifact.name);
            values.put(input.id, value);
        }
        for (DFStatement statement: artifact.body)
            this.execute(statement, values, state, next);
        Map<String, Object> outputs = new LinkedHashMap<>();
        for (Symbol output: artifact.outputs)
            outputs.put(output.name, this.value(values, output));
        Logger.INSTANCE.belowLevel(this, 2)
                .append(artifact.name)
                .append(inputs.toString())
                .append(" -> ")
                .append(outputs.toString())
                .newline();
        return new StepResult(next, outputs);
    }

    Object value(Map<Integer, Object> values, Symbol symbol) {
        Object result = values.get(symbol.id);
        if (result == null)
            throw new SimulationError("Value of " + symbol.name + " used before it is computed");
        return result;
    }

    void execute(DFStatement statement, Map<Integer, Object> values,
                 SimulatorState current, SimulatorState next) {
        if (statement.is(DFLetStatement.class)) {
            DFLetStatement let = statement.to(DFLetStatement.class);
            values.put(let.target.id, this.evaluate(let.expression, values, current));
        } else if (statement.is(DFMemoryWriteStatement.class)) {
            DFMemoryWriteStatement write = statement.to(DFMemoryWriteStatement.class);
            next.getSubState(write.cell.path).set(write.cell.name, this.value(values, write.source));
        } else if (statement.is(DFCallStatement.class)) {
            DFCallStatement call = statement.to(DFCallStatement.class);
            StateMachineArtifact callee = this.getArtifact(call.callee);
            Map<String, Object> arguments = new HashMap<>();
            for (int i = 0; i < callee.inputs.size(); i++)
                arguments.put(callee.inputs.get(i).name, this.evaluate(call.arguments.get(i), values, current));
            StepResult result = this.transition(callee, current.getSubState(call.path), arguments);
            next.setSubState(call.path, result.state());
            for (int i = 0; i < call.targets.size(); i++)
                values.put(call.targets.get(i).id, result.outputs().get(callee.outputs.get(i).name));
        } else {
            throw new SimulationError("Unexpected statement " + statement);
        }
    }

    static boolean bool(Object value) {
        if (value instanceof Boolean b)
            return b;
        throw new SimulationError("Expected a boolean, found " + value);
    }

    Object evaluate(DFExpression expression, Map<Integer, Object> values, SimulatorState current) {
        return switch (expression.getKind()) {
            case LITERAL -> expression.to(DFLiteral.class).getValue();
            case IDENTIFIER -> {
                DFIdentifierExpression id = expression.to(DFIdentifierExpression.class);
                Object result = values.get(id.symbolId);
                if (result == null)
                    throw new SimulationError("Value of " + id.name + " used before it is computed");
                yield result;
            }
            case UNARY -> {
                DFUnaryExpression unary = expression.to(DFUnaryExpression.class);
                Object source = this.evaluate(unary.source, values, current);
                if (unary.opcode == DFOpcode.NOT)
                    yield !bool(source);
                if (source instanceof Long l)
                    yield -l;
                if (source instanceof Double d)
                    yield -d;
                throw new SimulationError("Cannot negate " + source);
            }
            case BINARY -> {
                DFBinaryExpression binary = expression.to(DFBinaryExpression.class);
                Object left = this.evaluate(binary.left, values, current);
                Object right = this.evaluate(binary.right, values, current);
                yield Operators.binary(binary.opcode, left, right);
            }
            case ENUM -> {
                DFEnumExpression e = expression.to(DFEnumExpression.class);
                yield new EnumValue(e.enumName, e.variant);
            }
            case STRUCT -> {
                DFStructExpression s = expression.to(DFStructExpression.class);
                Map<String, Object> fields = new LinkedHashMap<>();
                for (Map.Entry<String, DFExpression> e: s.fields.entrySet())
                    fields.put(e.getKey(), this.evaluate(e.getValue(), values, current));
                yield new StructValue(s.structName, fields);
            }
            case FIELD -> {
                DFFieldExpression f = expression.to(DFFieldExpression.class);
                Object base = this.evaluate(f.expression, values, current);
                if (!(base instanceof StructValue struct))
                    throw new SimulationError("Field access on " + base);
                yield struct.getField(f.fieldName);
            }
            case IF -> {
                DFIfExpression i = expression.to(DFIfExpression.class);
                if (bool(this.evaluate(i.condition, values, current)))
                    yield this.evaluate(i.positive, values, current);
                yield this.evaluate(i.negative, values, current);
            }
            case FUNCTION_CALL -> {
                DFFunctionCallExpression call = expression.to(DFFunctionCallExpression.class);
                RuntimeFunction function = this.functions.get(call.function);
                if (function == null)
                    throw new SimulationError("No implementation for function " + call.function);
                List<Object> arguments = new ArrayList<>();
                for (DFExpression arg: call.arguments)
                    arguments.add(this.evaluate(arg, values, current));
                yield function.apply(arguments);
            }
            case WHEN -> {
                DFWhenExpression when = expression.to(DFWhenExpression.class);
                Object value = this.evaluate(when.expression, values, current);
                if (bool(this.evaluate(when.condition, values, current)))
                    yield value;
                yield Absent.INSTANCE;
            }
            case MERGE -> {
                DFMergeExpression merge = expression.to(DFMergeExpression.class);
                Object left = this.evaluate(merge.left, values, current);
                Object right = this.evaluate(merge.right, values, current);
                yield left != Absent.INSTANCE ? left : right;
            }
            case SAMPLE -> {
                DFSampleExpression sample = expression.to(DFSampleExpression.class);
                Object event = this.evaluate(sample.event, values, current);
                Object defaultValue = this.evaluate(sample.defaultValue, values, current);
                yield event != Absent.INSTANCE ? event : defaultValue;
            }
            case MEMORY_READ -> {
                MemoryCell cell = expression.to(DFMemoryReadExpression.class).cell;
                yield current.getSubState(cell.path).get(cell.name);
            }
            case NODE_CALL, LAST, FOLLOWED_BY, PERIOD ->
                    throw new SimulationError("Expression was not lowered: " + expression);
        };
    }
}
