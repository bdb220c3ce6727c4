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

package org.dflow.nodeCompiler.ir.type;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.util.IIndentStream;

import java.util.List;

/** The result type of a call to a node with several outputs.
 * Tuples only appear on the right-hand side of equations with several targets. */
public class DFTypeTuple extends DFType {
    public final ImmutableList<DFType> fields;

    public DFTypeTuple(List<DFType> fields) {
        super(DFTypeCode.TUPLE);
        this.fields = ImmutableList.copyOf(fields);
    }

    public int size() {
        return this.fields.size();
    }

    @Override
    public boolean sameType(DFType other) {
        DFTypeTuple t = other.as(DFTypeTuple.class);
        if (t == null || t.size() != this.size())
            return false;
        for (int i = 0; i < this.size(); i++)
            if (!this.fields.get(i).sameType(t.fields.get(i)))
                return false;
        return true;
    }

    @Override
    public DFExpression defaultValue() {
        throw new InternalCompilerError("Tuples are not stored in memory", this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .join(", ", this.fields, t -> t.toString())
                .append(")");
    }
}
