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

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.SourceFiles;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class DependencyGraphTests extends NodeTestBase {
    @Test
    public void labelsTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        Symbol x = node.local("x", INT);
        Symbol y = node.local("y", INT);
        // x = i + last o
        node.equation(x, node.add(node.ref(i), node.last(o)));
        // o = (0 fby x) + x
        node.equation(o, node.add(node.fby(node.literal(0), node.ref(x)), node.ref(x)));
        // y = 0 fby (last i)
        node.equation(y, node.fby(node.literal(0), node.last(i)));

        CompilerMessages messages = new CompilerMessages(new SourceFiles());
        DFProgram program = builder.build(messages);
        Assert.assertTrue(messages.isEmpty());
        DFComponent component = program.getComponent("n");
        Assert.assertNotNull(component);
        DependencyGraph graph = new DependencyGraphBuilder(program.symbols).build(component);

        Assert.assertEquals(Label.ZERO, graph.getLabel(x.id, i.id));
        Assert.assertEquals(Label.weight(1), graph.getLabel(x.id, o.id));
        // The delayed and the immediate use of x are merged
        Assert.assertEquals(Label.ZERO, graph.getLabel(o.id, x.id));
        Assert.assertEquals(Label.weight(2), graph.getLabel(y.id, i.id));
        Assert.assertNull(graph.getLabel(i.id, x.id));
        Assert.assertEquals(List.of(i.id), graph.getZeroSuccessors(x.id));
        Assert.assertEquals(List.of(i.id, o.id), graph.getSuccessors(x.id));
        Assert.assertTrue(graph.getZeroSuccessors(y.id).isEmpty());
    }

    @Test
    public void contractEdgesTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.ref(i), node.literal(1)));
        node.contract(DFContractTerm.Kind.ENSURES, node.binary(DFOpcode.GT, node.ref(o), node.ref(i)));

        NodeCompiler compiler = this.compile(builder);
        Assert.assertEquals(0, compiler.messages.errorCount());
        DFComponent component = compiler.getProgram().getComponent("n");
        Assert.assertNotNull(component);

        DependencyGraph data = component.getGraph();
        Assert.assertEquals(Label.ZERO, data.getLabel(o.id, i.id));
        Assert.assertNull(data.getLabel(i.id, o.id));

        DependencyGraph contract = component.getContractGraph();
        Label forward = contract.getLabel(o.id, i.id);
        Label backward = contract.getLabel(i.id, o.id);
        Assert.assertNotNull(forward);
        Assert.assertNotNull(backward);
        Assert.assertTrue(forward.isContract());
        Assert.assertTrue(backward.isContract());
        Assert.assertTrue(contract.getZeroSuccessors(i.id).isEmpty());

        // The contract edge does not change the schedule
        Assert.assertEquals(List.of(i.id, o.id), component.getSchedule().order);
    }
}
