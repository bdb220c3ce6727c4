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

package org.dflow.nodeCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.PropagatedContract;
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
import org.dflow.nodeCompiler.ir.expression.DFSampleExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.nodeCompiler.ir.expression.DFUnaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.nodeCompiler.ir.expression.literal.DFAbsentLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFBoolLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFFloatLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFIntegerLiteral;
import org.dflow.nodeCompiler.ir.expression.literal.DFLiteral;
import org.dflow.nodeCompiler.ir.state.MemoryCell;
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFCallStatement;
import org.dflow.nodeCompiler.ir.statement.DFLetStatement;
import org.dflow.nodeCompiler.ir.statement.DFMemoryWriteStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeEnum;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.nodeCompiler.ir.type.DFTypeTuple;
import org.dflow.util.Utilities;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Serializes artifacts for external code emitters.
 * Expressions and types use the same encoding as the programs read by
 * {@link org.dflow.nodeCompiler.compiler.frontend.ProgramJsonReader}, plus
 * {"kind": "mem", "cell": path} for memory reads and {"kind": "absent"}.
 */
public class ArtifactJsonWriter {
    final ObjectMapper mapper;

    public ArtifactJsonWriter() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public String toJsonString(Collection<StateMachineArtifact> artifacts) {
        ArrayNode result = this.mapper.createArrayNode();
        for (StateMachineArtifact artifact: artifacts)
            result.add(this.toJson(artifact));
        try {
            return this.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new InternalCompilerError("Could not serialize artifacts: " + e.getMessage());
        }
    }

    public ObjectNode toJson(StateMachineArtifact artifact) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("name", artifact.name);
        result.set("inputs", this.symbols(artifact.inputs));
        result.set("outputs", this.symbols(artifact.outputs));
        result.set("state", this.state(artifact.state));
        ArrayNode body = result.putArray("body");
        for (DFStatement statement: artifact.body)
            body.add(this.statement(statement));
        ArrayNode partition = result.putArray("partition");
        for (List<String> group: artifact.partition) {
            ArrayNode names = partition.addArray();
            group.forEach(names::add);
        }
        ArrayNode contract = result.putArray("contract");
        for (DFContractTerm term: artifact.contract)
            contract.add(this.term(term));
        ArrayNode propagated = result.putArray("propagated_contracts");
        for (PropagatedContract term: artifact.propagatedContracts) {
            ObjectNode node = this.term(term.term());
            ArrayNode path = node.putArray("path");
            term.path().forEach(path::add);
            node.put("node", term.callee());
            ObjectNode ids = node.putObject("original_ids");
            for (Map.Entry<Integer, Integer> e: term.originalIds().entrySet())
                ids.put(Integer.toString(e.getKey()), e.getValue());
            propagated.add(node);
        }
        return result;
    }

    ArrayNode symbols(List<Symbol> symbols) {
        ArrayNode result = this.mapper.createArrayNode();
        for (Symbol symbol: symbols) {
            ObjectNode node = result.addObject();
            node.put("name", symbol.name);
            node.put("id", symbol.id);
            node.set("type", this.type(symbol.type));
        }
        return result;
    }

    ObjectNode state(StateShape state) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("node", state.component);
        result.put("called", state.opaque);
        ArrayNode cells = result.putArray("cells");
        for (MemoryCell cell: state.getCells()) {
            ObjectNode node = cells.addObject();
            node.put("name", cell.name);
            node.put("source", cell.source.name);
            node.set("type", this.type(cell.type));
            node.set("init", this.expression(cell.initial));
        }
        ObjectNode subStates = result.putObject("substates");
        for (Map.Entry<String, StateShape> e: state.getSubStates().entrySet())
            subStates.set(e.getKey(), this.state(e.getValue()));
        return result;
    }

    ObjectNode term(DFContractTerm term) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("kind", term.kind.toString());
        result.set("term", this.expression(term.term));
        return result;
    }

    ObjectNode statement(DFStatement statement) {
        ObjectNode result = this.mapper.createObjectNode();
        if (statement.is(DFLetStatement.class)) {
            DFLetStatement let = statement.to(DFLetStatement.class);
            result.put("kind", "let");
            result.put("target", let.target.name);
            result.set("expr", this.expression(let.expression));
        } else if (statement.is(DFMemoryWriteStatement.class)) {
            DFMemoryWriteStatement write = statement.to(DFMemoryWriteStatement.class);
            result.put("kind", "write");
            result.put("cell", write.cell.getPath());
            result.put("source", write.source.name);
        } else if (statement.is(DFCallStatement.class)) {
            DFCallStatement call = statement.to(DFCallStatement.class);
            result.put("kind", "call");
            result.put("node", call.callee);
            result.put("instance", call.getInstancePath());
            ArrayNode args = result.putArray("args");
            for (DFExpression arg: call.arguments)
                args.add(this.expression(arg));
            ArrayNode targets = result.putArray("targets");
            for (Symbol target: call.targets)
                targets.add(target.name);
        } else {
            throw new InternalCompilerError("Unexpected statement " + statement, statement);
        }
        return result;
    }

    JsonNode type(DFType type) {
        return switch (type.code) {
            case BOOL -> TextNode.valueOf("bool");
            case INTEGER -> TextNode.valueOf("int");
            case FLOAT -> TextNode.valueOf("float");
            case ANY -> TextNode.valueOf("any");
            case ENUM -> TextNode.valueOf(type.to(DFTypeEnum.class).name);
            case STRUCT -> TextNode.valueOf(type.to(DFTypeStruct.class).name);
            case EVENT -> {
                ObjectNode result = this.mapper.createObjectNode();
                result.set("event", this.type(type.to(DFTypeEvent.class).element));
                yield result;
            }
            case TUPLE -> {
                ObjectNode result = this.mapper.createObjectNode();
                ArrayNode fields = result.putArray("tuple");
                for (DFType field: type.to(DFTypeTuple.class).fields)
                    fields.add(this.type(field));
                yield result;
            }
        };
    }

    ObjectNode expression(DFExpression expression) {
        ObjectNode result = this.mapper.createObjectNode();
        switch (expression.getKind()) {
            case LITERAL -> {
                DFLiteral literal = expression.to(DFLiteral.class);
                if (literal.is(DFAbsentLiteral.class)) {
                    result.put("kind", "absent");
                } else {
                    result.put("kind", "literal");
                    if (literal.is(DFBoolLiteral.class))
                        result.put("value", literal.to(DFBoolLiteral.class).value);
                    else if (literal.is(DFIntegerLiteral.class))
                        result.put("value", literal.to(DFIntegerLiteral.class).value);
                    else
                        result.put("value", literal.to(DFFloatLiteral.class).value);
                }
            }
            case IDENTIFIER -> {
                result.put("kind", "id");
                result.put("name", expression.to(DFIdentifierExpression.class).name);
            }
            case UNARY -> {
                DFUnaryExpression unary = expression.to(DFUnaryExpression.class);
                result.put("kind", "unary");
                result.put("op", unary.opcode.toString());
                result.set("arg", this.expression(unary.source));
            }
            case BINARY -> {
                DFBinaryExpression binary = expression.to(DFBinaryExpression.class);
                result.put("kind", "binary");
                result.put("op", binary.opcode.toString());
                result.set("left", this.expression(binary.left));
                result.set("right", this.expression(binary.right));
            }
            case ENUM -> {
                DFEnumExpression e = expression.to(DFEnumExpression.class);
                result.put("kind", "enum");
                result.put("enum", e.enumName);
                result.put("variant", e.variant);
            }
            case STRUCT -> {
                DFStructExpression s = expression.to(DFStructExpression.class);
                result.put("kind", "struct");
                result.put("struct", s.structName);
                ObjectNode fields = result.putObject("fields");
                for (Map.Entry<String, DFExpression> e: s.fields.entrySet())
                    fields.set(e.getKey(), this.expression(e.getValue()));
            }
            case FIELD -> {
                DFFieldExpression f = expression.to(DFFieldExpression.class);
                result.put("kind", "field");
                result.set("base", this.expression(f.expression));
                result.put("field", f.fieldName);
            }
            case IF -> {
                DFIfExpression i = expression.to(DFIfExpression.class);
                result.put("kind", "if");
                result.set("cond", this.expression(i.condition));
                result.set("then", this.expression(i.positive));
                result.set("else", this.expression(i.negative));
            }
            case FUNCTION_CALL -> {
                DFFunctionCallExpression call = expression.to(DFFunctionCallExpression.class);
                result.put("kind", "call");
                result.put("function", call.function);
                ArrayNode args = result.putArray("args");
                for (DFExpression arg: call.arguments)
                    args.add(this.expression(arg));
            }
            case WHEN -> {
                DFWhenExpression when = expression.to(DFWhenExpression.class);
                result.put("kind", "when");
                result.set("expr", this.expression(when.expression));
                result.set("cond", this.expression(when.condition));
            }
            case MERGE -> {
                DFMergeExpression merge = expression.to(DFMergeExpression.class);
                result.put("kind", "merge");
                result.set("left", this.expression(merge.left));
                result.set("right", this.expression(merge.right));
            }
            case SAMPLE -> {
                DFSampleExpression sample = expression.to(DFSampleExpression.class);
                result.put("kind", "sample");
                result.set("event", this.expression(sample.event));
                result.set("default", this.expression(sample.defaultValue));
            }
            case MEMORY_READ -> {
                result.put("kind", "mem");
                result.put("cell", expression.to(DFMemoryReadExpression.class).cell.getPath());
            }
            case NODE_CALL, LAST, FOLLOWED_BY, PERIOD ->
                    throw new InternalCompilerError("Expression was not lowered: " + expression, expression);
        }
        return result;
    }
}
