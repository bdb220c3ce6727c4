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

package org.dflow.simulator;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFFieldExpression;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.expression.literal.Absent;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeFloat;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class SimulatorTests extends NodeTestBase {
    /** node clocks(i: int, c: bool, d: bool) returns (m: event int, s: int)
     *   m = merge(i when c, (i * 10) when d);  s = sample(m, -1) */
    NodeCompiler clocks() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("clocks");
        Symbol i = node.input("i", INT);
        Symbol c = node.input("c", BOOL);
        Symbol d = node.input("d", BOOL);
        Symbol m = node.output("m", new DFTypeEvent(INT));
        Symbol s = node.output("s", INT);
        node.equation(m, node.merge(
                node.when(node.ref(i), node.ref(c)),
                node.when(node.binary(DFOpcode.MUL, node.ref(i), node.literal(10)), node.ref(d))));
        node.equation(s, node.sample(node.ref(m), node.unary(DFOpcode.NEG, node.literal(1))));
        return this.compileClean(builder);
    }

    @Test
    public void clocksTest() {
        ArtifactSimulator simulator = this.simulator(this.clocks());
        SimulatorState state = simulator.initialize("clocks");
        Map<String, Object> outputs = simulator.step("clocks", state, inputs("i", 3L, "c", true, "d", true));
        Assert.assertEquals(3L, outputs.get("m"));
        Assert.assertEquals(3L, outputs.get("s"));
        outputs = simulator.step("clocks", state, inputs("i", 3L, "c", false, "d", true));
        Assert.assertEquals(30L, outputs.get("s"));
        outputs = simulator.step("clocks", state, inputs("i", 3L, "c", false, "d", false));
        Assert.assertSame(Absent.INSTANCE, outputs.get("m"));
        Assert.assertEquals(-1L, outputs.get("s"));
    }

    @Test
    public void transitionIsPureTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder main = builder.component("main");
        Symbol tick = main.input("tick", BOOL);
        Symbol a = main.output("a", INT);
        main.equation(a, main.node("counter", main.literal(false), main.ref(tick)));
        ArtifactSimulator simulator = this.simulator(this.compileClean(builder));

        SimulatorState state = simulator.initialize("main");
        simulator.step("main", state, inputs("tick", true));
        SimulatorState before = state.copy();

        StepResult result = simulator.transition("main", state, inputs("tick", true));
        Assert.assertEquals(before, state);
        Assert.assertEquals(2L, result.outputs().get("a"));
        Assert.assertEquals(2L, result.state().read("counter_0.mem_o"));
        Assert.assertEquals(1L, state.read("counter_0.mem_o"));

        // The same transition again gives the same result
        StepResult again = simulator.transition("main", state, inputs("tick", true));
        Assert.assertEquals(result, again);

        Map<String, Object> outputs = simulator.step("main", state, inputs("tick", true));
        Assert.assertEquals(result.outputs(), outputs);
        Assert.assertEquals(result.state(), state);
    }

    @Test
    public void functionTest() {
        ProgramBuilder builder = new ProgramBuilder();
        builder.declareFunction("max", List.of(INT, INT), INT);
        builder.declareFunction("half", List.of(DFTypeFloat.INSTANCE), DFTypeFloat.INSTANCE);
        ComponentBuilder node = builder.component("n");
        Symbol x = node.input("x", INT);
        Symbol y = node.input("y", INT);
        Symbol f = node.input("f", DFTypeFloat.INSTANCE);
        Symbol o = node.output("o", INT);
        Symbol h = node.output("h", DFTypeFloat.INSTANCE);
        node.equation(o, node.call("max", node.ref(x), node.ref(y)));
        node.equation(h, node.binary(DFOpcode.ADD, node.call("half", node.ref(f)), node.literal(0.25)));
        ArtifactSimulator simulator = this.simulator(this.compileClean(builder));
        simulator.registerFunction("max", args -> Math.max((Long) args.get(0), (Long) args.get(1)));

        SimulatorState state = simulator.initialize("n");
        Map<String, Object> in = inputs("x", 4L, "y", 9L, "f", 3.0);
        Assert.assertThrows(SimulationError.class, () -> simulator.step("n", state, in));
        simulator.registerFunction("half", args -> (Double) args.get(0) / 2);
        Map<String, Object> outputs = simulator.step("n", state, in);
        Assert.assertEquals(9L, outputs.get("o"));
        Assert.assertEquals(1.75, (Double) outputs.get("h"), 0.0);
    }

    @Test
    public void enumAndStructTest() {
        ProgramBuilder builder = new ProgramBuilder();
        DFType mode = builder.declareEnum("Mode", "Off", "On");
        LinkedHashMap<String, DFType> fields = new LinkedHashMap<>();
        fields.put("count", INT);
        fields.put("mode", mode);
        DFTypeStruct status = builder.declareStruct("Status", fields);
        ComponentBuilder node = builder.component("n");
        Symbol on = node.input("on", BOOL);
        Symbol m = node.output("m", mode);
        Symbol s = node.output("s", status);
        Symbol changed = node.output("changed", BOOL);
        node.equation(m, node.ite(node.ref(on), node.enumValue("Mode", "On"), node.enumValue("Mode", "Off")));
        LinkedHashMap<String, DFExpression> values = new LinkedHashMap<>();
        values.put("count", node.add(
                new DFFieldExpression(SourceRange.INVALID, node.last(s), "count"), node.literal(1)));
        values.put("mode", node.ref(m));
        node.equation(s, node.struct("Status", values));
        // The first value of 'last m' is the first variant
        node.equation(changed, node.binary(DFOpcode.NEQ, node.ref(m), node.last(m)));
        ArtifactSimulator simulator = this.simulator(this.compileClean(builder));

        SimulatorState state = simulator.initialize("n");
        Map<String, Object> outputs = simulator.step("n", state, inputs("on", false));
        Assert.assertEquals(new EnumValue("Mode", "Off"), outputs.get("m"));
        Assert.assertEquals(false, outputs.get("changed"));
        outputs = simulator.step("n", state, inputs("on", true));
        Assert.assertEquals(true, outputs.get("changed"));
        StructValue value = (StructValue) outputs.get("s");
        Assert.assertEquals(2L, value.getField("count"));
        Assert.assertEquals(new StructValue("Status", Map.of("count", 2L, "mode", new EnumValue("Mode", "On"))), value);
    }

    @Test
    public void errorsTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol x = node.input("x", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.binary(DFOpcode.DIV, node.literal(10), node.ref(x)));
        ArtifactSimulator simulator = this.simulator(this.compileClean(builder));

        SimulatorState state = simulator.initialize("n");
        Assert.assertEquals(5L, simulator.step("n", state, inputs("x", 2L)).get("o"));
        Assert.assertThrows(SimulationError.class, () -> simulator.step("n", state, inputs("x", 0L)));
        Assert.assertThrows(SimulationError.class, () -> simulator.step("n", state, inputs()));
        Assert.assertThrows(SimulationError.class, () -> simulator.initialize("nowhere"));
        Assert.assertThrows(SimulationError.class, () -> state.read("mem_o"));
    }
}
