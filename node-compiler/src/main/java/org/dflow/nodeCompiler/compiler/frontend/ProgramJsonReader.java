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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.errors.CompilationError;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.SourceFiles;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFBinaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFEnumExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFieldExpression;
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
import org.dflow.nodeCompiler.ir.type.DFTypeBool;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeFloat;
import org.dflow.nodeCompiler.ir.type.DFTypeInteger;
import org.dflow.nodeCompiler.ir.type.DFTypeEnum;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads a typed program from its JSON representation.
 *
 * <p>The document is an object with the optional arrays "enums", "structs",
 * "functions", and the array "nodes".  Any object may carry a "range" property,
 * a pair [start, end] of byte offsets in the source file.  A node which cannot be
 * decoded is reported and left out; the other nodes are still read. */
public class ProgramJsonReader implements IWritesLogs {
    final IErrorReporter reporter;
    final SourceFiles sources;
    final ObjectMapper mapper;
    int fileId;
    final Map<String, DFTypeEnum> enums;
    final Map<String, DFTypeStruct> structs;

    public ProgramJsonReader(IErrorReporter reporter, SourceFiles sources) {
        this.reporter = reporter;
        this.sources = sources;
        this.mapper = Utilities.deterministicObjectMapper();
        this.fileId = -1;
        this.enums = new HashMap<>();
        this.structs = new HashMap<>();
    }

    /** Decode a program; returns null if the document is not a program. */
    @Nullable
    public DFProgram read(String fileName, String contents) {
        this.fileId = this.sources.addFile(fileName, contents);
        JsonNode root;
        try {
            root = this.mapper.readTree(contents);
        } catch (JsonProcessingException ex) {
            this.reporter.reportError(new SourceRange(this.fileId, 0, 0), ErrorKind.MALFORMED_PROGRAM,
                    "Invalid JSON: " + ex.getOriginalMessage());
            return null;
        }
        try {
            return this.read(root);
        } catch (CompilationError ex) {
            this.reporter.reportError(ex.range, ex.kind, ex.getMessage());
            return null;
        }
    }

    CompilationError malformed(JsonNode node, String message) {
        return new CompilationError(message, ErrorKind.MALFORMED_PROGRAM, this.range(node));
    }

    SourceRange range(JsonNode node) {
        JsonNode range = node.get("range");
        if (range == null || !range.isArray() || range.size() != 2)
            return SourceRange.INVALID;
        return new SourceRange(this.fileId, range.get(0).asInt(), range.get(1).asInt());
    }

    JsonNode property(JsonNode node, String name) {
        JsonNode result = node.get(name);
        if (result == null)
            throw this.malformed(node, "Missing property " + Utilities.singleQuote(name));
        return result;
    }

    String string(JsonNode node, String name) {
        JsonNode value = this.property(node, name);
        if (!value.isTextual())
            throw this.malformed(node, "Property " + Utilities.singleQuote(name) + " must be a string");
        return value.asText();
    }

    Iterable<JsonNode> array(JsonNode node, String name, boolean required) {
        JsonNode value = node.get(name);
        if (value == null) {
            if (required)
                throw this.malformed(node, "Missing property " + Utilities.singleQuote(name));
            return List.of();
        }
        if (!value.isArray())
            throw this.malformed(node, "Property " + Utilities.singleQuote(name) + " must be an array");
        return value;
    }

    DFProgram read(JsonNode root) {
        ProgramBuilder builder = new ProgramBuilder();
        for (JsonNode decl: this.array(root, "enums", false)) {
            List<String> variants = new ArrayList<>();
            for (JsonNode v: this.array(decl, "variants", true))
                variants.add(v.asText());
            if (variants.isEmpty())
                throw this.malformed(decl, "Enumeration without variants");
            DFTypeEnum type = builder.declareEnum(this.string(decl, "name"), variants);
            this.enums.put(type.name, type);
        }
        for (JsonNode decl: this.array(root, "structs", false)) {
            LinkedHashMap<String, DFType> fields = new LinkedHashMap<>();
            for (JsonNode f: this.array(decl, "fields", true))
                fields.put(this.string(f, "name"), this.type(f, this.property(f, "type")));
            DFTypeStruct type = builder.declareStruct(this.string(decl, "name"), fields);
            this.structs.put(type.name, type);
        }
        for (JsonNode decl: this.array(root, "functions", false)) {
            List<DFType> parameters = new ArrayList<>();
            for (JsonNode p: this.array(decl, "parameters", true))
                parameters.add(this.type(decl, p));
            builder.declareFunction(this.string(decl, "name"), parameters,
                    this.type(decl, this.property(decl, "result")));
        }
        for (JsonNode node: this.array(root, "nodes", true)) {
            try {
                this.component(builder, node);
            } catch (CompilationError ex) {
                this.reporter.reportError(ex.range, ex.kind, ex.getMessage());
            }
        }
        return builder.build(this.reporter);
    }

    /** Types are written as "bool", "int", "float", the name of a declared
     * enumeration or structure, or {"event": type}. */
    DFType type(JsonNode context, JsonNode type) {
        if (type.isObject()) {
            return new DFTypeEvent(this.type(context, this.property(type, "event")));
        }
        String name = type.asText();
        if (name.equals("bool"))
            return DFTypeBool.INSTANCE;
        if (name.equals("int"))
            return DFTypeInteger.INSTANCE;
        if (name.equals("float"))
            return DFTypeFloat.INSTANCE;
        if (this.enums.containsKey(name))
            return this.enums.get(name);
        if (this.structs.containsKey(name))
            return this.structs.get(name);
        throw new CompilationError("Unknown type " + Utilities.singleQuote(name),
                ErrorKind.UNKNOWN_ELEMENT, this.range(context));
    }

    void component(ProgramBuilder program, JsonNode node) {
        String name = this.string(node, "name");
        // Added to the program only if the whole node is decoded
        ComponentBuilder builder = program.newComponent(name, this.range(node));
        for (JsonNode in: this.array(node, "inputs", false))
            builder.input(this.string(in, "name"), this.type(in, this.property(in, "type")), this.range(in));
        for (JsonNode out: this.array(node, "outputs", true))
            builder.output(this.string(out, "name"), this.type(out, this.property(out, "type")), this.range(out));
        for (JsonNode local: this.array(node, "locals", false))
            builder.local(this.string(local, "name"), this.type(local, this.property(local, "type")), this.range(local));
        for (JsonNode local: this.array(node, "contract_locals", false))
            builder.contractLocal(this.string(local, "name"), this.type(local, this.property(local, "type")));
        for (JsonNode eq: this.array(node, "equations", true)) {
            List<Symbol> targets = new ArrayList<>();
            for (JsonNode t: this.array(eq, "targets", true)) {
                Symbol symbol = builder.lookup(t.asText());
                if (symbol == null)
                    throw new CompilationError("Unknown identifier " + Utilities.singleQuote(t.asText()),
                            ErrorKind.UNKNOWN_ELEMENT, this.range(eq));
                targets.add(symbol);
            }
            if (targets.isEmpty())
                throw this.malformed(eq, "Equation without targets");
            builder.equation(targets, this.expression(builder, this.property(eq, "expr")), this.range(eq));
        }
        for (JsonNode term: this.array(node, "contract", false)) {
            String kind = this.string(term, "kind");
            DFContractTerm.Kind k;
            try {
                k = DFContractTerm.Kind.valueOf(kind.toUpperCase());
            } catch (IllegalArgumentException ex) {
                throw new CompilationError("Unknown contract kind " + Utilities.singleQuote(kind),
                        ErrorKind.MALFORMED_CONTRACT, this.range(term));
            }
            builder.contract(k, this.expression(builder, this.property(term, "term")), this.range(term));
        }
        program.add(builder);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Read node ")
                .append(name)
                .newline();
    }

    List<DFExpression> expressions(ComponentBuilder builder, JsonNode node, String name) {
        List<DFExpression> result = new ArrayList<>();
        for (JsonNode arg: this.array(node, name, true))
            result.add(this.expression(builder, arg));
        return result;
    }

    DFExpression literal(JsonNode node) {
        SourceRange range = this.range(node);
        JsonNode value = this.property(node, "value");
        if (value.isBoolean())
            return new DFBoolLiteral(range, value.asBoolean());
        if (value.isIntegralNumber())
            return new DFIntegerLiteral(range, value.asLong());
        if (value.isNumber())
            return new DFFloatLiteral(range, value.asDouble());
        throw this.malformed(node, "Unsupported literal " + value);
    }

    DFOpcode opcode(JsonNode node, boolean unary) {
        String op = this.string(node, "op");
        DFOpcode result = DFOpcode.fromString(op, unary);
        if (result == null)
            throw this.malformed(node, "Unknown operator " + Utilities.singleQuote(op));
        return result;
    }

    @Nullable
    DFExpression optional(ComponentBuilder builder, JsonNode node, String name) {
        JsonNode value = node.get(name);
        if (value == null || value.isNull())
            return null;
        return this.expression(builder, value);
    }

    DFExpression expression(ComponentBuilder builder, JsonNode node) {
        SourceRange range = this.range(node);
        String kind = this.string(node, "kind");
        return switch (kind) {
            case "literal" -> this.literal(node);
            case "id" -> builder.ref(this.string(node, "name"), range);
            case "unary" -> new DFUnaryExpression(range, this.opcode(node, true),
                    this.expression(builder, this.property(node, "arg")));
            case "binary" -> new DFBinaryExpression(range, this.opcode(node, false),
                    this.expression(builder, this.property(node, "left")),
                    this.expression(builder, this.property(node, "right")));
            case "enum" -> new DFEnumExpression(range, this.string(node, "enum"), this.string(node, "variant"));
            case "struct" -> {
                LinkedHashMap<String, DFExpression> fields = new LinkedHashMap<>();
                JsonNode values = this.property(node, "fields");
                Iterator<Map.Entry<String, JsonNode>> it = values.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> e = it.next();
                    fields.put(e.getKey(), this.expression(builder, e.getValue()));
                }
                yield new DFStructExpression(range, this.string(node, "struct"), fields);
            }
            case "field" -> new DFFieldExpression(range,
                    this.expression(builder, this.property(node, "base")), this.string(node, "field"));
            case "if" -> new DFIfExpression(range,
                    this.expression(builder, this.property(node, "cond")),
                    this.expression(builder, this.property(node, "then")),
                    this.expression(builder, this.property(node, "else")));
            case "call" -> new DFFunctionCallExpression(range, this.string(node, "function"),
                    this.expressions(builder, node, "args"));
            case "node" -> new DFNodeCallExpression(range, this.string(node, "node"),
                    this.expressions(builder, node, "args"));
            case "last" -> {
                String name = this.string(node, "name");
                DFIdentifierExpression id = builder.ref(name, range);
                yield new DFLastExpression(range, id.symbolId, name, this.optional(builder, node, "init"));
            }
            case "fby" -> new DFFollowedByExpression(range,
                    this.expression(builder, this.property(node, "init")),
                    this.expression(builder, this.property(node, "next")));
            case "when" -> new DFWhenExpression(range,
                    this.expression(builder, this.property(node, "expr")),
                    this.expression(builder, this.property(node, "cond")));
            case "merge" -> new DFMergeExpression(range,
                    this.expression(builder, this.property(node, "left")),
                    this.expression(builder, this.property(node, "right")));
            case "period" -> new DFPeriodExpression(range, this.property(node, "period").asLong());
            case "sample" -> new DFSampleExpression(range,
                    this.expression(builder, this.property(node, "event")),
                    this.expression(builder, this.property(node, "default")));
            default -> throw this.malformed(node, "Unknown expression kind " + Utilities.singleQuote(kind));
        };
    }
}
