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

package org.dflow.nodeCompiler.compiler.visitors;

import org.dflow.nodeCompiler.ir.expression.DFBinaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFieldExpression;
import org.dflow.nodeCompiler.ir.expression.DFFollowedByExpression;
import org.dflow.nodeCompiler.ir.expression.DFFunctionCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFIdentifierExpression;
import org.dflow.nodeCompiler.ir.expression.DFIfExpression;
import org.dflow.nodeCompiler.ir.expression.DFLastExpression;
import org.dflow.nodeCompiler.ir.expression.DFMergeExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.nodeCompiler.ir.expression.DFPeriodExpression;
import org.dflow.nodeCompiler.ir.expression.DFSampleExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.nodeCompiler.ir.expression.DFUnaryExpression;
import org.dflow.nodeCompiler.ir.expression.DFWhenExpression;
import org.dflow.util.Linq;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Rebuilds an expression bottom-up.  By default every expression is rebuilt
 * from its rewritten children; subclasses override the methods for the kinds
 * they transform.  Rewritten expressions keep the type of the original. */
public abstract class ExpressionRewriter {
    public DFExpression apply(DFExpression expression) {
        DFExpression result = switch (expression.getKind()) {
            case LITERAL, ENUM, MEMORY_READ -> expression;
            case IDENTIFIER -> this.identifier(expression.to(DFIdentifierExpression.class));
            case UNARY -> this.unary(expression.to(DFUnaryExpression.class));
            case BINARY -> this.binary(expression.to(DFBinaryExpression.class));
            case STRUCT -> this.struct(expression.to(DFStructExpression.class));
            case FIELD -> this.field(expression.to(DFFieldExpression.class));
            case IF -> this.ifExpression(expression.to(DFIfExpression.class));
            case FUNCTION_CALL -> this.functionCall(expression.to(DFFunctionCallExpression.class));
            case NODE_CALL -> this.nodeCall(expression.to(DFNodeCallExpression.class));
            case LAST -> this.last(expression.to(DFLastExpression.class));
            case FOLLOWED_BY -> this.followedBy(expression.to(DFFollowedByExpression.class));
            case WHEN -> this.when(expression.to(DFWhenExpression.class));
            case MERGE -> this.merge(expression.to(DFMergeExpression.class));
            case PERIOD -> this.period(expression.to(DFPeriodExpression.class));
            case SAMPLE -> this.sample(expression.to(DFSampleExpression.class));
        };
        if (result != expression && !result.hasType() && expression.hasType())
            result.setType(expression.getType());
        return result;
    }

    @Nullable
    protected DFExpression applyOptional(@Nullable DFExpression expression) {
        if (expression == null)
            return null;
        return this.apply(expression);
    }

    protected List<DFExpression> applyAll(List<DFExpression> expressions) {
        return Linq.map(expressions, e -> this.apply(e));
    }

    protected DFExpression identifier(DFIdentifierExpression expression) {
        return expression;
    }

    protected DFExpression unary(DFUnaryExpression expression) {
        return new DFUnaryExpression(expression.range, expression.opcode, this.apply(expression.source));
    }

    protected DFExpression binary(DFBinaryExpression expression) {
        return new DFBinaryExpression(expression.range, expression.opcode,
                this.apply(expression.left), this.apply(expression.right));
    }

    protected DFExpression struct(DFStructExpression expression) {
        LinkedHashMap<String, DFExpression> fields = new LinkedHashMap<>();
        for (Map.Entry<String, DFExpression> e: expression.fields.entrySet())
            fields.put(e.getKey(), this.apply(e.getValue()));
        return new DFStructExpression(expression.range, expression.structName, fields);
    }

    protected DFExpression field(DFFieldExpression expression) {
        return new DFFieldExpression(expression.range, this.apply(expression.expression), expression.fieldName);
    }

    protected DFExpression ifExpression(DFIfExpression expression) {
        return new DFIfExpression(expression.range, this.apply(expression.condition),
                this.apply(expression.positive), this.apply(expression.negative));
    }

    protected DFExpression functionCall(DFFunctionCallExpression expression) {
        return new DFFunctionCallExpression(expression.range, expression.function, this.applyAll(expression.arguments));
    }

    protected DFExpression nodeCall(DFNodeCallExpression expression) {
        return new DFNodeCallExpression(expression.range, expression.callee,
                this.applyAll(expression.arguments), expression.instancePath);
    }

    protected DFExpression last(DFLastExpression expression) {
        return new DFLastExpression(expression.range, expression.symbolId, expression.name,
                this.applyOptional(expression.initial));
    }

    protected DFExpression followedBy(DFFollowedByExpression expression) {
        return new DFFollowedByExpression(expression.range,
                this.apply(expression.initial), this.apply(expression.next));
    }

    protected DFExpression when(DFWhenExpression expression) {
        return new DFWhenExpression(expression.range,
                this.apply(expression.expression), this.apply(expression.condition));
    }

    protected DFExpression merge(DFMergeExpression expression) {
        return new DFMergeExpression(expression.range,
                this.apply(expression.left), this.apply(expression.right));
    }

    protected DFExpression period(DFPeriodExpression expression) {
        return expression;
    }

    protected DFExpression sample(DFSampleExpression expression) {
        return new DFSampleExpression(expression.range,
                this.apply(expression.event), this.apply(expression.defaultValue));
    }
}
