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

import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.DFNode;
import org.dflow.nodeCompiler.ir.type.DFType;

import javax.annotation.Nullable;
import java.util.List;

/** Base class for all expressions.
 * Expressions own their sub-expressions; a sub-expression is never shared.
 * The type is attached by the type checker, and is recomputed after each
 * pass which rewrites expressions. */
public abstract class DFExpression extends DFNode {
    @Nullable
    private DFType type;

    protected DFExpression(SourceRange range) {
        super(range);
        this.type = null;
    }

    public abstract DFExpressionKind getKind();

    /** The sub-expressions, in evaluation order. */
    public abstract List<DFExpression> getChildren();

    public boolean hasType() {
        return this.type != null;
    }

    public DFType getType() {
        if (this.type == null)
            throw new InternalCompilerError("Expression " + this + " has not been typed", this);
        return this.type;
    }

    public void setType(DFType type) {
        this.type = type;
    }

    /** True for expressions that can be evaluated at compile time:
     * literals, enumeration values, and structures of constants. */
    public boolean isConstant() {
        return false;
    }

    public DFBinaryExpression binary(DFOpcode opcode, DFExpression right) {
        return new DFBinaryExpression(this.range.merge(right.range), opcode, this, right);
    }

    public DFFieldExpression field(String name) {
        return new DFFieldExpression(this.range, this, name);
    }
}
