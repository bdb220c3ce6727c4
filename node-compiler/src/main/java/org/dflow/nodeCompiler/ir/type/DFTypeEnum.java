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
import org.dflow.nodeCompiler.ir.expression.DFEnumExpression;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.util.IIndentStream;
import org.dflow.util.Utilities;

import java.util.List;

/** An enumeration declared by the program; enumerations are compared by name. */
public class DFTypeEnum extends DFType {
    public final String name;
    public final ImmutableList<String> variants;

    public DFTypeEnum(String name, List<String> variants) {
        super(DFTypeCode.ENUM);
        Utilities.enforce(!variants.isEmpty(), "Enumeration " + name + " has no variants");
        this.name = name;
        this.variants = ImmutableList.copyOf(variants);
    }

    public boolean hasVariant(String variant) {
        return this.variants.contains(variant);
    }

    @Override
    public boolean sameType(DFType other) {
        DFTypeEnum e = other.as(DFTypeEnum.class);
        return e != null && e.name.equals(this.name);
    }

    /** The first variant. */
    @Override
    public DFExpression defaultValue() {
        return new DFEnumExpression(SourceRange.INVALID, this.name, this.variants.get(0));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
