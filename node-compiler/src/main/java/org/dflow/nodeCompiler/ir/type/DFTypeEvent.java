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
import org.dflow.nodeCompiler.ir.expression.literal.DFAbsentLiteral;
import org.dflow.util.IIndentStream;

/** A signal which carries a value of the element type only at some instants. */
public class DFTypeEvent extends DFType {
    public final DFType element;

    public DFTypeEvent(DFType element) {
        super(DFTypeCode.EVENT);
        this.element = element;
    }

    @Override
    public boolean sameType(DFType other) {
        DFTypeEvent e = other.as(DFTypeEvent.class);
        return e != null && e.element.sameType(this.element);
    }

    @Override
    public boolean isCompatible(DFType other) {
        if (other.isAny())
            return true;
        DFTypeEvent e = other.as(DFTypeEvent.class);
        return e != null && e.element.isCompatible(this.element);
    }

    /** An absent event. */
    @Override
    public DFExpression defaultValue() {
        return new DFAbsentLiteral(SourceRange.INVALID, this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("event<")
                .append(this.element)
                .append(">");
    }
}
