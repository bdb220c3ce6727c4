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

package org.dflow.nodeCompiler.compiler.inlining;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.CompilerOptions;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.PropagatedContract;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.state.StateShape;
import org.dflow.nodeCompiler.ir.statement.DFCallStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.dflow.simulator.ArtifactSimulator;
import org.dflow.simulator.SimulatorState;
import org.dflow.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;
import java.util.Map;

public class InlinerTests extends NodeTestBase {
    NodeCompiler neededCompiler() {
        CompilerOptions options = this.testOptions();
        options.languageOptions.inline = "needed";
        return new NodeCompiler(options);
    }

    /** node main(res: bool, tick: bool) returns (a: int, b: int)
     *   a = counter(res, tick);  b = counter(false, tick) */
    ProgramBuilder twoCounters() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder main = builder.component("main");
        Symbol res = main.input("res", BOOL);
        Symbol tick = main.input("tick", BOOL);
        Symbol a = main.output("a", INT);
        Symbol b = main.output("b", INT);
        main.equation(a, main.node("counter", main.ref(res), main.ref(tick)));
        main.equation(b, main.node("counter", main.literal(false), main.ref(tick)));
        return builder;
    }

    void checkTwoCounters(NodeCompiler compiler) {
        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("main");
        Assert.assertEquals(0L, state.read("counter_0.mem_o"));
        Assert.assertEquals(0L, state.read("counter_1.mem_o"));

        Map<String, Object> outputs = simulator.step("main", state, inputs("res", false, "tick", true));
        Assert.assertEquals(1L, outputs.get("a"));
        Assert.assertEquals(1L, outputs.get("b"));
        outputs = simulator.step("main", state, inputs("res", true, "tick", true));
        Assert.assertEquals(0L, outputs.get("a"));
        Assert.assertEquals(2L, outputs.get("b"));
        Assert.assertEquals(0L, state.read("counter_0.mem_o"));
        Assert.assertEquals(2L, state.read("counter_1.mem_o"));
    }

    @Test
    public void twoCallSitesTest() {
        NodeCompiler compiler = this.compileClean(this.twoCounters());
        StateMachineArtifact main = compiler.getArtifact("main");
        Assert.assertNotNull(main);
        Assert.assertEquals(List.of("counter_0", "counter_1"), List.copyOf(main.state.getSubStates().keySet()));
        for (StateShape sub: main.state.getSubStates().values()) {
            Assert.assertFalse(sub.opaque);
            Assert.assertEquals("counter", sub.component);
            Assert.assertEquals(1, sub.getCells().size());
        }
        Assert.assertTrue(Linq.all(main.body, s -> !s.is(DFCallStatement.class)));
        this.checkTwoCounters(compiler);
    }

    @Test
    public void neededKeepsCallsTest() {
        NodeCompiler compiler = this.compile(this.neededCompiler(), this.twoCounters());
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        StateMachineArtifact main = compiler.getArtifact("main");
        Assert.assertNotNull(main);
        List<DFStatement> calls = Linq.where(main.body, s -> s.is(DFCallStatement.class));
        Assert.assertEquals(2, calls.size());
        Assert.assertEquals("counter_0", calls.get(0).to(DFCallStatement.class).getInstancePath());
        StateShape sub = main.state.getSubState("counter_0");
        Assert.assertTrue(sub.opaque);
        DFComponent component = compiler.getProgram().getComponent("main");
        Assert.assertNotNull(component);
        Assert.assertEquals(2, component.getGraph().getObligations().size());
        // Same behavior as the inlined version
        this.checkTwoCounters(compiler);
    }

    @Test
    public void neededDelayedArgumentTest() {
        // a = counter(false, last tick)
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder main = builder.component("main");
        Symbol tick = main.input("tick", BOOL);
        Symbol a = main.output("a", INT);
        main.equation(a, main.node("counter", main.literal(false), main.last(tick)));
        NodeCompiler compiler = this.compile(this.neededCompiler(), builder);
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        StateMachineArtifact artifact = compiler.getArtifact("main");
        Assert.assertNotNull(artifact);
        Assert.assertEquals(1, Linq.where(artifact.body, s -> s.is(DFCallStatement.class)).size());
        Assert.assertEquals(List.of("mem_tick"), Linq.map(artifact.state.getCells(), c -> c.name));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("main");
        Assert.assertEquals(0L, simulator.step("main", state, inputs("tick", true)).get("a"));
        Assert.assertEquals(1L, simulator.step("main", state, inputs("tick", true)).get("a"));
        Assert.assertEquals(2L, simulator.step("main", state, inputs("tick", false)).get("a"));
        Assert.assertEquals(2L, simulator.step("main", state, inputs("tick", false)).get("a"));
    }

    /** node delay(x: int) returns (y: int)  y = 0 fby x
     *  node loop() returns (o: int)  o = delay(o + 1) */
    ProgramBuilder delayLoop() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder delay = builder.component("delay");
        Symbol x = delay.input("x", INT);
        Symbol y = delay.output("y", INT);
        delay.equation(y, delay.fby(delay.literal(0), delay.ref(x)));
        ComponentBuilder loop = builder.component("loop");
        Symbol o = loop.output("o", INT);
        loop.equation(o, loop.node("delay", loop.add(loop.ref(o), loop.literal(1))));
        return builder;
    }

    void checkDelayLoop(NodeCompiler compiler) {
        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("loop");
        for (long i = 0; i < 4; i++)
            Assert.assertEquals(i, simulator.step("loop", state, inputs()).get("o"));
    }

    @Test
    public void neededInlinesCycleTest() {
        NodeCompiler compiler = this.compile(this.neededCompiler(), this.delayLoop());
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        StateMachineArtifact loop = compiler.getArtifact("loop");
        Assert.assertNotNull(loop);
        Assert.assertTrue(Linq.all(loop.body, s -> !s.is(DFCallStatement.class)));
        Assert.assertFalse(loop.state.getSubState("delay_0").opaque);
        this.checkDelayLoop(compiler);
    }

    @Test
    public void allInlinesCycleTest() {
        NodeCompiler compiler = this.compileClean(this.delayLoop());
        this.checkDelayLoop(compiler);
    }

    @Test
    public void cycleThroughCallTest() {
        // The callee does not break the cycle
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder pass = builder.component("pass");
        Symbol x = pass.input("x", INT);
        Symbol y = pass.output("y", INT);
        pass.equation(y, pass.ref(x));
        ComponentBuilder loop = builder.component("loop");
        Symbol o = loop.output("o", INT);
        loop.equation(o, loop.node("pass", loop.ref(o)));
        NodeCompiler compiler = this.compile(this.neededCompiler(), builder);
        assertErrors(compiler.messages, ErrorKind.CAUSALITY_VIOLATION, 1);
        Assert.assertNotNull(compiler.getArtifact("pass"));
        Assert.assertNull(compiler.getArtifact("loop"));
    }

    @Test
    public void nestedCallsTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder twice = builder.component("twice");
        Symbol res = twice.input("res", BOOL);
        Symbol tick = twice.input("tick", BOOL);
        Symbol o = twice.output("o", INT);
        twice.equation(o, twice.add(
                twice.node("counter", twice.ref(res), twice.ref(tick)),
                twice.node("counter", twice.literal(false), twice.ref(tick))));
        ComponentBuilder main = builder.component("main");
        Symbol r = main.input("r", BOOL);
        Symbol t = main.input("t", BOOL);
        Symbol out = main.output("out", INT);
        main.equation(out, main.node("twice", main.ref(r), main.ref(t)));

        NodeCompiler compiler = this.compileClean(builder);
        StateMachineArtifact artifact = compiler.getArtifact("main");
        Assert.assertNotNull(artifact);
        StateShape inner = artifact.state.getSubState(List.of("twice_0", "counter_1"));
        Assert.assertEquals("counter", inner.component);

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("main");
        Assert.assertEquals(2L, simulator.step("main", state, inputs("r", false, "t", true)).get("out"));
        Assert.assertEquals(4L, simulator.step("main", state, inputs("r", false, "t", true)).get("out"));
        Assert.assertEquals(3L, simulator.step("main", state, inputs("r", true, "t", true)).get("out"));
        Assert.assertEquals(0L, state.read("twice_0.counter_0.mem_o"));
        Assert.assertEquals(3L, state.read("twice_0.counter_1.mem_o"));
    }

    @Test
    public void recursionTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder f = builder.component("f");
        Symbol i = f.input("i", INT);
        Symbol o = f.output("o", INT);
        f.equation(o, f.node("f", f.ref(i)));
        counter(builder, "counter");
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.RECURSIVE_INLINE, 1);
        CompilerMessages.Message message = compiler.messages.getErrors(ErrorKind.RECURSIVE_INLINE).get(0);
        Assert.assertEquals(List.of("f", "f"), message.details);
        Assert.assertNull(compiler.getArtifact("f"));
        Assert.assertNotNull(compiler.getArtifact("counter"));
    }

    @Test
    public void mutualRecursionTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder f = builder.component("f");
        Symbol fi = f.input("i", INT);
        Symbol fo = f.output("o", INT);
        f.equation(fo, f.node("g", f.ref(fi)));
        ComponentBuilder g = builder.component("g");
        Symbol gi = g.input("i", INT);
        Symbol go = g.output("o", INT);
        g.equation(go, g.node("f", g.ref(gi)));
        // NEEDED does not inline these calls, but still rejects them
        NodeCompiler compiler = this.compile(this.neededCompiler(), builder);

        assertErrors(compiler.messages, ErrorKind.RECURSIVE_INLINE, 1);
        List<String> chain = compiler.messages.getErrors(ErrorKind.RECURSIVE_INLINE).get(0).details;
        Assert.assertEquals(3, chain.size());
        Assert.assertEquals(chain.get(0), chain.get(2));
        Assert.assertTrue(compiler.getArtifacts().isEmpty());
    }

    /** node n_k(x: int) returns (o: int)  a = n_k+1(x); b = n_k+1(x); o = a + b */
    @Test(timeout = 20000)
    public void doublingCallChainTest() {
        final int depth = 40;
        ProgramBuilder builder = new ProgramBuilder();
        for (int k = 0; k < depth; k++) {
            ComponentBuilder node = builder.component("n_" + k);
            Symbol x = node.input("x", INT);
            Symbol o = node.output("o", INT);
            Symbol a = node.local("a", INT);
            Symbol b = node.local("b", INT);
            node.equation(a, node.node("n_" + (k + 1), node.ref(x)));
            node.equation(b, node.node("n_" + (k + 1), node.ref(x)));
            node.equation(o, node.add(node.ref(a), node.ref(b)));
        }
        ComponentBuilder last = builder.component("n_" + depth);
        Symbol x = last.input("x", INT);
        Symbol o = last.output("o", INT);
        last.equation(o, last.add(last.ref(x), last.literal(1)));

        NodeCompiler compiler = this.compile(this.neededCompiler(), builder);
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        Assert.assertEquals(depth + 1, compiler.getArtifacts().size());
        StateMachineArtifact first = compiler.getArtifact("n_0");
        Assert.assertNotNull(first);
        Assert.assertEquals(2, Linq.where(first.body, s -> s.is(DFCallStatement.class)).size());
    }

    /** node square(i: int) returns (o: int)  o = i * i;  ensures o >= i */
    static void square(ProgramBuilder builder) {
        ComponentBuilder square = builder.component("square");
        Symbol i = square.input("i", INT);
        Symbol o = square.output("o", INT);
        square.equation(o, square.binary(DFOpcode.MUL, square.ref(i), square.ref(i)));
        square.contract(DFContractTerm.Kind.ENSURES, square.binary(DFOpcode.GTE, square.ref(o), square.ref(i)));
    }

    @Test
    public void contractPropagationTest() {
        ProgramBuilder builder = new ProgramBuilder();
        square(builder);
        ComponentBuilder user = builder.component("user");
        Symbol a = user.input("a", INT);
        Symbol b = user.output("b", INT);
        user.equation(b, user.node("square", user.ref(a)));
        ComponentBuilder outer = builder.component("outer");
        Symbol x = outer.input("x", INT);
        Symbol y = outer.output("y", INT);
        outer.equation(y, outer.node("user", outer.ref(x)));
        NodeCompiler compiler = this.compileClean(builder);

        DFComponent square = compiler.getProgram().getComponent("square");
        Assert.assertNotNull(square);
        List<Integer> originals = List.of(square.outputs.get(0), square.inputs.get(0));

        StateMachineArtifact squareArtifact = compiler.getArtifact("square");
        Assert.assertNotNull(squareArtifact);
        Assert.assertEquals(1, squareArtifact.contract.size());
        Assert.assertTrue(squareArtifact.propagatedContracts.isEmpty());

        StateMachineArtifact userArtifact = compiler.getArtifact("user");
        Assert.assertNotNull(userArtifact);
        Assert.assertTrue(userArtifact.contract.isEmpty());
        Assert.assertEquals(1, userArtifact.propagatedContracts.size());
        PropagatedContract propagated = userArtifact.propagatedContracts.get(0);
        Assert.assertEquals(List.of("square_0"), propagated.path());
        Assert.assertEquals("square", propagated.callee());
        Assert.assertEquals(DFContractTerm.Kind.ENSURES, propagated.term().kind);
        Assert.assertEquals(originals, List.copyOf(propagated.originalIds().values()));

        StateMachineArtifact outerArtifact = compiler.getArtifact("outer");
        Assert.assertNotNull(outerArtifact);
        Assert.assertEquals(1, outerArtifact.propagatedContracts.size());
        PropagatedContract nested = outerArtifact.propagatedContracts.get(0);
        Assert.assertEquals(List.of("user_0", "square_0"), nested.path());
        Assert.assertEquals(originals, List.copyOf(nested.originalIds().values()));

        // The contract graph relates the two identifiers of the term
        DFComponent outerComponent = compiler.getProgram().getComponent("outer");
        Assert.assertNotNull(outerComponent);
        Assert.assertEquals(2, outerComponent.getContractGraph().edgeCount());
    }
}
