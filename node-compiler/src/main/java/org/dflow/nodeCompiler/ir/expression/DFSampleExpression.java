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

/** The value of an event when present, otherwise a default value. */
public class DFSampleExpression extends DFExpression {
    public final DFExpression event;
    public final DFExpression defaultValue;

    public DFSampleExpression(SourceRange range, DFExpression event, DFExpression defaultValue) {
        super(range);
        this.event = event;
        this.defaultValue = defaultValue;
    }

    @Override
    public DFExpressionKind getKind() {
        return DFExpressionKind.SAMPLE;
    }

    @Override
    public List<DFExpression> getChildren() {
        return List.of(this.event, this.defaultValue);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("sample(")
                .append(this.event)
                .append(", ")
                .append(this.defaultValue)
                .append(")");
    }
}
