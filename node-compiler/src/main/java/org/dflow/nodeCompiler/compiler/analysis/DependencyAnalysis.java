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

package org.dflow.nodeCompiler.compiler.analysis;

import org.dflow.nodeCompiler.compiler.IComponentPass;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Logger;

/** Attaches the dependency graphs and the schedule to a component.
 * @throws org.dflow.nodeCompiler.compiler.errors.CausalityViolationError
 *         if the component has a zero-delay cycle. */
public class DependencyAnalysis implements IComponentPass, IWritesLogs {
    final DependencyGraphBuilder builder;
    final CausalityAnalyzer causality;
    final Scheduler scheduler;

    public DependencyAnalysis(SymbolTable symbols) {
        this.builder = new DependencyGraphBuilder(symbols);
        this.causality = new CausalityAnalyzer(symbols);
        this.scheduler = new Scheduler(symbols);
    }

    @Override
    public void apply(DFComponent component) {
        component.invalidateAnalyses();
        DependencyGraph graph = this.builder.build(component);
        DependencyGraph contractGraph = this.builder.buildContractGraph(component);
        component.setGraphs(graph, contractGraph);
        Logger.INSTANCE.belowLevel(this, 3)
                .append("Dependencies of ")
                .append(component.name)
                .newline()
                .appendSupplier(graph::asString);
        this.causality.check(component);
        component.setSchedule(this.scheduler.schedule(graph, component.getDeclarationOrder()));
    }
}
