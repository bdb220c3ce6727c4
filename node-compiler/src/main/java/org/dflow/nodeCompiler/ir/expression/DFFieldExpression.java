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

package org.dflow.nodeCompiler.ir.expression;

import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.util.IIndentStream;

import java.util.List;

/** Access to a field of a structure. */
public class DFFieldExpression extends DFExpression {
    public final DFExpression expression;
    public final String fieldName;

    public DFFieldExpression(SourceRange range, DFExpression expression, String fieldName) {
        super(range);
        this.expression = expression;
        this.fieldName = fieldName;
    }

    @Override
    public DFExpressionKind getKind() {
        return DFExpressionKind.FIELD;
    }

    @Override
    public List<DFExpression> getChildren() {
        return List.of(this.expression);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.expression)
                .append(".")
                .append(this.fieldName);
    }
}
