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

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.util.IIndentStream;

import java.util.List;

/** Call of another node.  Each call site owns a separate instance of the callee state.
 * The instance path is assigned by the normal form; it is empty before that.
 * Inlining a node prefixes the paths of the calls it contains with the instance
 * of the inlined call. */
public class DFNodeCallExpression extends DFExpression {
    public final String callee;
    public final ImmutableList<DFExpression> arguments;
    public final ImmutableList<String> instancePath;

    public DFNodeCallExpression(SourceRange range, String callee, List<DFExpression> arguments,
                                List<String> instancePath) {
        super(range);
        this.callee = callee;
        this.arguments = ImmutableList.copyOf(arguments);
        this.instancePath = ImmutableList.copyOf(instancePath);
    }

    public DFNodeCallExpression(SourceRange range, String callee, List<DFExpression> arguments) {
        this(range, callee, arguments, List.of());
    }

    public boolean hasInstance() {
        return !this.instancePath.isEmpty();
    }

    /** The path of the callee state from the caller state. */
    public ImmutableList<String> getInstancePath() {
        if (!this.hasInstance())
            this.error("Call of " + this.callee + " has no instance");
        return this.instancePath;
    }

    @Override
    public DFExpressionKind getKind() {
        return DFExpressionKind.NODE_CALL;
    }

    @Override
    public List<DFExpression> getChildren() {
        return this.arguments;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.callee);
        if (this.hasInstance())
            builder.append("[").append(String.join(".", this.instancePath)).append("]");
        return builder.append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }
}
