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

package org.dflow.nodeCompiler.compiler;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;

import java.util.List;

/** Applies a sequence of passes to a component, logging the time taken by each. */
public class Passes implements IWritesLogs, IComponentPass, ICompilerComponent {
    final NodeCompiler compiler;
    public final List<IComponentPass> passes;
    final String name;

    public Passes(String name, NodeCompiler compiler, IComponentPass... passes) {
        this(name, compiler, Linq.list(passes));
    }

    public Passes(String name, NodeCompiler compiler, List<IComponentPass> passes) {
        this.compiler = compiler;
        this.passes = passes;
        this.name = name;
    }

    @Override
    public NodeCompiler compiler() {
        return this.compiler;
    }

    public void add(IComponentPass pass) {
        this.passes.add(pass);
    }

    @Override
    public void apply(DFComponent component) {
        long begin = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 2)
                .append(this.toString())
                .append(" starting ")
                .append(this.passes.size())
                .append(" passes on ")
                .append(component.name)
                .increase();
        for (IComponentPass pass: this.passes) {
            long start = System.currentTimeMillis();
            pass.apply(component);
            long end = System.currentTimeMillis();
            Logger.INSTANCE.belowLevel(this, 1)
                    .append(pass.getName())
                    .append(" took ")
                    .append(end - start)
                    .append("ms")
                    .newline();
        }
        long finish = System.currentTimeMillis();
        Logger.INSTANCE.belowLevel(this, 1)
                .decrease()
                .append(this.toString())
                .append(" took ")
                .append(finish - begin)
                .append("ms.")
                .newline();
    }

    @Override
    public String toString() {
        return this.name + this.passes.size();
    }

    @Override
    public String getName() {
        return this.name;
    }
}
