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
import org.dflow.nodeCompiler.ir.DFNode;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.util.IIndentStream;

/** Base class for all types. */
public abstract class DFType extends DFNode {
    public final DFTypeCode code;

    protected DFType(DFTypeCode code) {
        super(SourceRange.INVALID);
        this.code = code;
    }

    /** True if the two types are the same type. */
    public abstract boolean sameType(DFType other);

    /** True if a value of this type can be used where 'other' is expected.
     * The placeholder type is compatible with every type. */
    public boolean isCompatible(DFType other) {
        if (this.code == DFTypeCode.ANY || other.code == DFTypeCode.ANY)
            return true;
        return this.sameType(other);
    }

    /** The value used to initialize memory cells which have no explicit initial value. */
    public abstract DFExpression defaultValue();

    public boolean isEvent() {
        return this.code == DFTypeCode.EVENT;
    }

    public boolean isAny() {
        return this.code == DFTypeCode.ANY;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.code.name);
    }
}
