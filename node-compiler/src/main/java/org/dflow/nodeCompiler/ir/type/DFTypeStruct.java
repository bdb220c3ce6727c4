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

import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFStructExpression;
import org.dflow.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A structure declared by the program; structures are compared by name. */
public class DFTypeStruct extends DFType {
    public final String name;
    /** Fields in declaration order */
    public final Map<String, DFType> fields;

    public DFTypeStruct(String name, LinkedHashMap<String, DFType> fields) {
        super(DFTypeCode.STRUCT);
        this.name = name;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    @Nullable
    public DFType getFieldType(String field) {
        return this.fields.get(field);
    }

    @Override
    public boolean sameType(DFType other) {
        DFTypeStruct s = other.as(DFTypeStruct.class);
        return s != null && s.name.equals(this.name);
    }

    @Override
    public DFExpression defaultValue() {
        LinkedHashMap<String, DFExpression> values = new LinkedHashMap<>();
        for (Map.Entry<String, DFType> e: this.fields.entrySet())
            values.put(e.getKey(), e.getValue().defaultValue());
        return new DFStructExpression(SourceRange.INVALID, this.name, values);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
