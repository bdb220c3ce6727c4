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
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.Scope;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.statement.DFLetStatement;
import org.dflow.nodeCompiler.ir.statement.DFStatement;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class SchedulerTests extends NodeTestBase {
    /** node n(a: int, b: int) returns (o: int)
     *   o = x + y;  x = b * 2;  y = a + 1 */
    ProgramBuilder program() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol a = node.input("a", INT);
        Symbol b = node.input("b", INT);
        Symbol o = node.output("o", INT);
        Symbol x = node.local("x", INT);
        Symbol y = node.local("y", INT);
        node.equation(o, node.add(node.ref(x), node.ref(y)));
        node.equation(x, node.binary(DFOpcode.MUL, node.ref(b), node.literal(2)));
        node.equation(y, node.add(node.ref(a), node.literal(1)));
        return builder;
    }

    @Test
    public void orderTest() {
        NodeCompiler compiler = this.compileClean(this.program());
        DFComponent component = compiler.getProgram().getComponent("n");
        Assert.assertNotNull(component);
        Schedule schedule = component.getSchedule();
        SymbolTable symbols = compiler.getProgram().symbols;
        List<String> names = new ArrayList<>();
        for (int id: schedule.order)
            names.add(symbols.getName(id));
        // b is ready before y, and x comes before y in declaration order
        Assert.assertEquals(List.of("a", "b", "x", "y", "o"), names);

        List<List<String>> levels = new ArrayList<>();
        for (List<Integer> group: schedule.partition) {
            List<String> level = new ArrayList<>();
            for (int id: group)
                level.add(symbols.getName(id));
            levels.add(level);
        }
        Assert.assertEquals(List.of(List.of("a", "b"), List.of("x", "y"), List.of("o")), levels);

        StateMachineArtifact artifact = compiler.getArtifact("n");
        Assert.assertNotNull(artifact);
        Assert.assertEquals(List.of(List.of("x", "y"), List.of("o")), artifact.partition);
        List<String> lets = new ArrayList<>();
        for (DFStatement statement: artifact.body)
            lets.add(statement.to(DFLetStatement.class).target.name);
        Assert.assertEquals(List.of("x", "y", "o"), lets);
    }

    @Test
    public void independenceTest() {
        NodeCompiler compiler = this.compileClean(this.program());
        DFComponent component = compiler.getProgram().getComponent("n");
        Assert.assertNotNull(component);
        Schedule schedule = component.getSchedule();
        int o = component.outputs.get(0);
        int x = component.locals.get(0);
        int y = component.locals.get(1);
        Assert.assertEquals(Set.of(x, y), schedule.getDependencies(o));
        Assert.assertTrue(schedule.areIndependent(x, y));
        Assert.assertFalse(schedule.areIndependent(o, y));
        Assert.assertTrue(schedule.reaches(o, component.inputs.get(0)));
        Assert.assertFalse(schedule.reaches(x, o));
    }

    @Test
    public void deterministicTest() {
        NodeCompiler compiler = this.compileClean(this.program());
        DFComponent component = compiler.getProgram().getComponent("n");
        Assert.assertNotNull(component);
        Scheduler scheduler = new Scheduler(compiler.getProgram().symbols);
        Schedule first = scheduler.schedule(component.getGraph(), component.getDeclarationOrder());
        Schedule second = scheduler.schedule(component.getGraph(), component.getDeclarationOrder());
        Assert.assertEquals(first.order, second.order);
        Assert.assertEquals(first.partition, second.partition);
        Assert.assertEquals(component.getSchedule().order, first.order);

        // A second compilation of the same program produces the same artifact
        NodeCompiler other = this.compileClean(this.program());
        StateMachineArtifact artifact = compiler.getArtifact("n");
        StateMachineArtifact again = other.getArtifact("n");
        Assert.assertNotNull(artifact);
        Assert.assertNotNull(again);
        Assert.assertEquals(artifact.toIndentedString(), again.toIndentedString());
    }

    @Test(expected = InternalCompilerError.class)
    public void cyclicGraphTest() {
        SymbolTable symbols = new SymbolTable();
        Symbol a = symbols.add("n", "a", INT, Scope.LOCAL, SourceRange.INVALID);
        Symbol b = symbols.add("n", "b", INT, Scope.LOCAL, SourceRange.INVALID);
        DependencyGraph graph = new DependencyGraph();
        graph.addEdge(a.id, b.id, Label.ZERO);
        graph.addEdge(b.id, a.id, Label.ZERO);
        new Scheduler(symbols).schedule(graph, List.of(a.id, b.id));
    }
}
