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

package org.dflow.nodeCompiler.ir;

import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.type.DFType;

import java.util.List;

/** An entry of the symbol table.
 *
 * <p>Symbols created by inlining belong to the caller; they keep the name they had
 * in the callee as 'localName', and 'path' holds the call-site instances that
 * lead from the caller to the node which declared them. */
public final class Symbol {
    public final int id;
    /** Name, unique within the component */
    public final String name;
    public final String localName;
    public final DFType type;
    public final Scope scope;
    /** Name of the component that owns the symbol */
    public final String component;
    public final ImmutableList<String> path;
    public final SourceRange range;

    Symbol(int id, String name, String localName, DFType type, Scope scope,
           String component, List<String> path, SourceRange range) {
        this.id = id;
        this.name = name;
        this.localName = localName;
        this.type = type;
        this.scope = scope;
        this.component = component;
        this.path = ImmutableList.copyOf(path);
        this.range = range;
    }

    public boolean isInlined() {
        return !this.path.isEmpty();
    }

    @Override
    public String toString() {
        return this.name + "#" + this.id;
    }
}
