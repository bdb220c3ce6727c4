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
import org.dflow.util.Linq;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Construction of a value of a declared structure. */
public class DFStructExpression extends DFExpression {
    public final String structName;
    /** Field values, in the order they were written */
    public final Map<String, DFExpression> fields;

    public DFStructExpression(SourceRange range, String structName, LinkedHashMap<String, DFExpression> fields) {
        super(range);
        this.structName = structName;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Override
    public DFExpressionKind getKind() {
        return DFExpressionKind.STRUCT;
    }

    @Override
    public List<DFExpression> getChildren() {
        return new ArrayList<>(this.fields.values());
    }

    @Override
    public boolean isConstant() {
        return Linq.all(this.fields.values(), DFExpression::isConstant);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.structName).append(" { ");
        boolean first = true;
        for (Map.Entry<String, DFExpression> e: this.fields.entrySet()) {
            if (!first)
                builder.append(", ");
            first = false;
            builder.append(e.getKey()).append(": ").append(e.getValue());
        }
        return builder.append(" }");
    }
}
