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

package org.dflow.nodeCompiler.compiler.lowering;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.state.MemoryCell;
import org.dflow.nodeCompiler.ir.statement.DFLetStatement;
import org.dflow.nodeCompiler.ir.statement.DFMemoryWriteStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.dflow.simulator.ArtifactSimulator;
import org.dflow.simulator.SimulatorState;
import org.dflow.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class LoweringTests extends NodeTestBase {
    static List<String> describe(StateMachineArtifact artifact) {
        List<String> result = new ArrayList<>();
        for (DFStatement statement: artifact.body) {
            if (statement.is(DFLetStatement.class))
                result.add(statement.to(DFLetStatement.class).target.name);
            else if (statement.is(DFMemoryWriteStatement.class))
                result.add("write " + statement.to(DFMemoryWriteStatement.class).cell.getPath());
            else
                result.add(statement.toString());
        }
        return result;
    }

    @Test
    public void counterTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("counter");
        Assert.assertNotNull(artifact);

        Assert.assertEquals(List.of("res", "tick"), Linq.map(artifact.inputs, s -> s.name));
        Assert.assertEquals(List.of("o"), Linq.map(artifact.outputs, s -> s.name));
        Assert.assertEquals(1, artifact.state.getCells().size());
        MemoryCell cell = artifact.state.getCells().get(0);
        Assert.assertEquals("mem_o", cell.name);
        Assert.assertEquals("0", cell.initial.toString());
        Assert.assertEquals(List.of("inc", "o", "write mem_o"), describe(artifact));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("counter");
        for (long i = 1; i <= 5; i++) {
            Map<String, Object> outputs = simulator.step("counter", state, inputs("res", false, "tick", true));
            Assert.assertEquals(i, outputs.get("o"));
        }
        Assert.assertEquals(5L, simulator.step("counter", state, inputs("res", false, "tick", false)).get("o"));
        Assert.assertEquals(0L, simulator.step("counter", state, inputs("res", true, "tick", true)).get("o"));
        Assert.assertEquals(1L, simulator.step("counter", state, inputs("res", false, "tick", true)).get("o"));
    }

    @Test
    public void sharedCellsTest() {
        // o = last o + last o + (last o init 10) + 1
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.add(node.add(node.last(o), node.last(o)),
                node.last(o, node.literal(10))), node.literal(1)));
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("n");
        Assert.assertNotNull(artifact);
        Assert.assertEquals(List.of("mem_o", "mem_o_0"), Linq.map(artifact.state.getCells(), c -> c.name));
        Assert.assertEquals(List.of("o", "write mem_o", "write mem_o_0"), describe(artifact));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("n");
        Assert.assertEquals(11L, simulator.step("n", state, inputs()).get("o"));
        Assert.assertEquals(34L, simulator.step("n", state, inputs()).get("o"));
    }

    @Test
    public void inputDelayTest() {
        // o = last i init 7
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.last(i, node.literal(7)));
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("n");
        Assert.assertNotNull(artifact);
        // The input is known before any equation is evaluated
        Assert.assertEquals(List.of("write mem_i", "o"), describe(artifact));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("n");
        Assert.assertEquals(7L, simulator.step("n", state, inputs("i", 1L)).get("o"));
        Assert.assertEquals(1L, simulator.step("n", state, inputs("i", 2L)).get("o"));
        Assert.assertEquals(2L, simulator.step("n", state, inputs("i", 3L)).get("o"));
    }

    @Test
    public void followedByExpressionTest() {
        // o = 100 fby (i * 2)
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.fby(node.literal(100), node.binary(DFOpcode.MUL, node.ref(i), node.literal(2))));
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("n");
        Assert.assertNotNull(artifact);
        Assert.assertEquals(List.of("fby_next", "write mem_fby_next", "o"), describe(artifact));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("n");
        Assert.assertEquals(100L, simulator.step("n", state, inputs("i", 1L)).get("o"));
        Assert.assertEquals(2L, simulator.step("n", state, inputs("i", 5L)).get("o"));
        Assert.assertEquals(10L, simulator.step("n", state, inputs("i", 0L)).get("o"));
    }

    @Test
    public void periodTest() {
        // o = sample(period(3), false)
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol o = node.output("o", BOOL);
        Symbol e = node.output("e", new DFTypeEvent(BOOL));
        node.equation(e, node.period(3));
        node.equation(o, node.sample(node.ref(e), node.literal(false)));
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("n");
        Assert.assertNotNull(artifact);
        Assert.assertEquals(List.of("mem_period_counter"), Linq.map(artifact.state.getCells(), c -> c.name));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("n");
        List<Object> ticks = new ArrayList<>();
        for (int i = 0; i < 6; i++)
            ticks.add(simulator.step("n", state, inputs()).get("o"));
        Assert.assertEquals(List.of(false, false, true, false, false, true), ticks);
    }

    @Test
    public void partitionTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("counter");
        Assert.assertNotNull(artifact);
        // Inputs are not part of the partition
        Assert.assertEquals(List.of(List.of("inc"), List.of("o")), artifact.partition);
    }
}
