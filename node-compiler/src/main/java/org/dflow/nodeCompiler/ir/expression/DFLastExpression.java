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

import javax.annotation.Nullable;
import java.util.List;

/** The value of an identifier at the previous instant.
 * At the first instant the value is the initial value, or the default value of the type. */
public class DFLastExpression extends DFExpression {
    public final int symbolId;
    public final String name;
    @Nullable
    public final DFExpression initial;

    public DFLastExpression(SourceRange range, int symbolId, String name, @Nullable DFExpression initial) {
        super(range);
        this.symbolId = symbolId;
        this.name = name;
        this.initial = initial;
    }

    @Override
    public DFExpressionKind getKind() {
        return DFExpressionKind.LAST;
    }

    @Override
    public List<DFExpression> getChildren() {
        if (this.initial == null)
            return List.of();
        return List.of(this.initial);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(last ").append(this.name);
        if (this.initial != null)
            builder.append(" init ").append(this.initial);
        return builder.append(")");
    }
}
