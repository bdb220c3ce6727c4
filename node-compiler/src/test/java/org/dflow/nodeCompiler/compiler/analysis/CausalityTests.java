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
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.dflow.simulator.ArtifactSimulator;
import org.dflow.simulator.SimulatorState;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class CausalityTests extends NodeTestBase {
    @Test
    public void delayedCycleTest() {
        // o = (0 fby o) + inc
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("acc");
        Symbol inc = node.input("inc", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.fby(node.literal(0), node.ref(o)), node.ref(inc)));
        NodeCompiler compiler = this.compileClean(builder);
        Assert.assertNotNull(compiler.getArtifact("acc"));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("acc");
        Assert.assertEquals(2L, simulator.step("acc", state, inputs("inc", 2L)).get("o"));
        Assert.assertEquals(5L, simulator.step("acc", state, inputs("inc", 3L)).get("o"));
    }

    @Test
    public void selfCycleTest() {
        // o = o + 1
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("bad");
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.ref(o), node.literal(1)));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.CAUSALITY_VIOLATION, 1);
        CompilerMessages.Message message = compiler.messages.getErrors(ErrorKind.CAUSALITY_VIOLATION).get(0);
        Assert.assertTrue(message.details.contains("o"));
        Assert.assertTrue(message.message.contains("bad"));
        Assert.assertNull(compiler.getArtifact("bad"));
    }

    @Test
    public void longCycleTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("bad");
        Symbol o = node.output("o", INT);
        Symbol a = node.local("a", INT);
        Symbol b = node.local("b", INT);
        node.equation(a, node.add(node.ref(b), node.literal(1)));
        node.equation(b, node.add(node.ref(a), node.literal(1)));
        node.equation(o, node.ref(a));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.CAUSALITY_VIOLATION, 1);
        CompilerMessages.Message message = compiler.messages.getErrors(ErrorKind.CAUSALITY_VIOLATION).get(0);
        Assert.assertEquals(List.of("a", "b", "a"), message.details);
    }

    @Test
    public void otherNodesCompileTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder bad = builder.component("bad");
        Symbol o = bad.output("o", INT);
        bad.equation(o, bad.ref(o));
        counter(builder, "counter");
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.CAUSALITY_VIOLATION, 1);
        Assert.assertNull(compiler.getArtifact("bad"));
        Assert.assertNotNull(compiler.getArtifact("counter"));
    }

    @Test
    public void findCycleTest() {
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(1, 2, Label.ZERO);
        graph.addEdge(2, 3, Label.ZERO);
        graph.addEdge(3, 1, Label.weight(1));
        Assert.assertNull(CausalityAnalyzer.findCycle(graph, List.of(1, 2, 3)));

        graph.addEdge(3, 2, Label.ZERO);
        Assert.assertEquals(List.of(2, 3, 2), CausalityAnalyzer.findCycle(graph, List.of(1, 2, 3)));

        // A contract edge does not close a cycle
        DependencyGraph contract = new DependencyGraph();
        contract.addEdge(1, 2, Label.CONTRACT);
        contract.addEdge(2, 1, Label.CONTRACT);
        Assert.assertNull(CausalityAnalyzer.findCycle(contract, List.of(1, 2)));
    }

    @Test
    public void deepChainTest() {
        // Must not overflow the stack
        DependencyGraph graph = new DependencyGraph();
        int size = 100_000;
        for (int i = 0; i < size; i++)
            graph.addEdge(i, i + 1, Label.ZERO);
        Assert.assertNull(CausalityAnalyzer.findCycle(graph, new ArrayList<>()));
        graph.addEdge(size, 0, Label.ZERO);
        List<Integer> cycle = CausalityAnalyzer.findCycle(graph, List.of(0));
        Assert.assertNotNull(cycle);
        Assert.assertEquals(size + 2, cycle.size());
        Assert.assertEquals(cycle.get(0), cycle.get(cycle.size() - 1));
    }
}
