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

package org.dflow.nodeCompiler.compiler.typing;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.ir.type.DFTypeFloat;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.util.LinkedHashMap;
import java.util.List;

public class TypeCheckerTests extends NodeTestBase {
    static DFComponent component(NodeCompiler compiler, String name) {
        DFComponent result = compiler.getProgram().getComponent(name);
        Assert.assertNotNull(result);
        return result;
    }

    @Test
    public void mismatchInTwoNodesTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder a = builder.component("a");
        Symbol ao = a.output("o", INT);
        a.equation(ao, a.literal(true));
        ComponentBuilder b = builder.component("b");
        Symbol bi = b.input("i", INT);
        Symbol bo = b.output("o", BOOL);
        b.equation(bo, b.add(b.ref(bi), b.literal(1)));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 2);
        Assert.assertEquals(2, compiler.messages.errorCount());
        // Both nodes are still analyzed, but not lowered
        Assert.assertTrue(component(compiler, "a").isScheduled());
        Assert.assertTrue(component(compiler, "b").isScheduled());
        Assert.assertTrue(compiler.getArtifacts().isEmpty());
    }

    @Test
    public void operatorTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol f = node.input("f", DFTypeFloat.INSTANCE);
        Symbol c = node.output("c", BOOL);
        Symbol d = node.output("d", INT);
        Symbol e = node.output("e", INT);
        node.equation(c, node.binary(DFOpcode.LT, node.ref(i), node.literal(3)));
        // Mixed arithmetic
        node.equation(d, node.add(node.ref(i), node.ref(f)));
        // Branches of different types
        node.equation(e, node.ite(node.ref(c), node.ref(i), node.literal(false)));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 2);
    }

    @Test
    public void unknownIdentifierTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.ref("missing"), node.literal(1)));
        counter(builder, "counter");
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
        Assert.assertTrue(compiler.messages.getErrors(ErrorKind.UNKNOWN_ELEMENT).get(0).message.contains("missing"));
        Assert.assertFalse(component(compiler, "n").isScheduled());
        Assert.assertNotNull(compiler.getArtifact("counter"));
    }

    @Test
    public void unknownNodeTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol o = node.output("o", INT);
        node.equation(o, node.node("nowhere", node.literal(1)));
        // A caller of a node with errors is not compiled, and not reported
        ComponentBuilder user = builder.component("user");
        Symbol u = user.output("u", INT);
        user.equation(u, user.node("n"));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
        Assert.assertEquals(1, compiler.messages.errorCount());
        Assert.assertTrue(compiler.getArtifacts().isEmpty());
    }

    @Test
    public void callerOfNodeWithTypeErrorTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder bad = builder.component("bad");
        Symbol o = bad.output("o", INT);
        bad.equation(o, bad.literal(2.5));
        ComponentBuilder user = builder.component("user");
        Symbol u = user.output("u", INT);
        user.equation(u, user.add(user.node("bad"), user.literal(1)));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 1);
        Assert.assertTrue(component(compiler, "user").isScheduled());
        Assert.assertNull(compiler.getArtifact("user"));
    }

    @Test
    public void callArgumentsTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder user = builder.component("user");
        Symbol u = user.output("u", INT);
        // Wrong argument count, then wrong argument type
        Symbol v = user.output("v", INT);
        user.equation(u, user.node("counter", user.literal(true)));
        user.equation(v, user.node("counter", user.literal(true), user.literal(3)));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 2);
        assertErrors(compiler.messages, ErrorKind.INTERNAL_ERROR, 0);
        Assert.assertNull(compiler.getArtifact("user"));
    }

    @Test
    public void tupleTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder pair = builder.component("pair");
        Symbol i = pair.input("i", INT);
        Symbol a = pair.output("a", INT);
        Symbol b = pair.output("b", BOOL);
        pair.equation(a, pair.ref(i));
        pair.equation(b, pair.binary(DFOpcode.GT, pair.ref(i), pair.literal(0)));
        ComponentBuilder user = builder.component("user");
        Symbol x = user.output("x", INT);
        Symbol y = user.output("y", BOOL);
        Symbol z = user.output("z", BOOL);
        Symbol w = user.output("w", INT);
        user.equation(List.of(x, y), user.node("pair", user.literal(4)));
        // Targets in the wrong order
        user.equation(List.of(z, w), user.node("pair", user.literal(5)));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 2);
        assertErrors(compiler.messages, ErrorKind.INTERNAL_ERROR, 0);
        Assert.assertNotNull(compiler.getArtifact("pair"));
        Assert.assertNull(compiler.getArtifact("user"));
    }

    @Test
    public void tupleArityTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder user = builder.component("user");
        Symbol x = user.output("x", INT);
        Symbol y = user.output("y", INT);
        user.equation(List.of(x, y), user.node("counter", user.literal(false), user.literal(true)));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 1);
        assertErrors(compiler.messages, ErrorKind.INTERNAL_ERROR, 0);
        Assert.assertFalse(component(compiler, "user").isScheduled());
    }

    @Test
    public void functionTest() {
        ProgramBuilder builder = new ProgramBuilder();
        builder.declareFunction("scale", List.of(INT, DFTypeFloat.INSTANCE), DFTypeFloat.INSTANCE);
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", DFTypeFloat.INSTANCE);
        Symbol p = node.output("p", DFTypeFloat.INSTANCE);
        Symbol q = node.output("q", INT);
        node.equation(o, node.call("scale", node.ref(i), node.literal(0.5)));
        node.equation(p, node.call("scale", node.literal(0.5), node.literal(0.5)));
        node.equation(q, node.call("unknown", node.ref(i)));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 1);
        assertErrors(compiler.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
    }

    @Test
    public void enumAndStructTest() {
        ProgramBuilder builder = new ProgramBuilder();
        DFType color = builder.declareEnum("Color", "Red", "Green");
        LinkedHashMap<String, DFType> fields = new LinkedHashMap<>();
        fields.put("x", INT);
        fields.put("ok", BOOL);
        DFTypeStruct point = builder.declareStruct("Point", fields);
        ComponentBuilder node = builder.component("n");
        Symbol c = node.output("c", color);
        Symbol d = node.output("d", color);
        Symbol p = node.output("p", point);
        LinkedHashMap<String, org.dflow.nodeCompiler.ir.expression.DFExpression> values = new LinkedHashMap<>();
        values.put("x", node.literal(1));
        values.put("ok", node.literal(2));
        node.equation(c, node.enumValue("Color", "Red"));
        node.equation(d, node.enumValue("Color", "Blue"));
        node.equation(p, node.struct("Point", values));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 1);
        Assert.assertTrue(compiler.messages.getErrors(ErrorKind.UNKNOWN_ELEMENT).get(0).message.contains("Blue"));
    }

    @Test
    public void clockTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol e = node.output("e", new DFTypeEvent(INT));
        Symbol s = node.output("s", INT);
        Symbol m = node.output("m", new DFTypeEvent(INT));
        Symbol p = node.output("p", new DFTypeEvent(BOOL));
        node.equation(e, node.when(node.ref(i), node.literal(true)));
        node.equation(s, node.sample(node.ref(e), node.literal(0)));
        // Merge of values which are not events
        node.equation(m, node.merge(node.ref(i), node.ref(e)));
        node.equation(p, node.period(0));
        NodeCompiler compiler = this.compile(builder);
        assertErrors(compiler.messages, ErrorKind.TYPE_MISMATCH, 2);
    }

    @Test
    public void malformedContractTest() {
        ProgramBuilder builder = new ProgramBuilder();
        counter(builder, "counter");
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        node.equation(o, node.add(node.ref(i), node.literal(1)));
        node.contract(DFContractTerm.Kind.ENSURES, node.binary(DFOpcode.GT, node.ref(o), node.ref(i)));
        node.contract(DFContractTerm.Kind.ENSURES, node.binary(DFOpcode.GT, node.ref(o),
                node.node("counter", node.literal(false), node.literal(true))));
        node.contract(DFContractTerm.Kind.INVARIANT, node.binary(DFOpcode.GTE, node.ref(o), node.last(o)));
        node.contract(DFContractTerm.Kind.ASSERT, node.ref(o));
        NodeCompiler compiler = this.compile(builder);

        assertErrors(compiler.messages, ErrorKind.MALFORMED_CONTRACT, 3);
        DFComponent component = component(compiler, "n");
        // Only the well-formed term is kept
        Assert.assertEquals(1, component.contract.size());
        Assert.assertTrue(component.isScheduled());
        Assert.assertNull(compiler.getArtifact("n"));
        Assert.assertNotNull(compiler.getArtifact("counter"));
    }

    @Test
    public void contractLocalTest() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol i = node.input("i", INT);
        Symbol o = node.output("o", INT);
        Symbol k = node.contractLocal("k", INT);
        node.equation(o, node.ref(i));
        node.contract(DFContractTerm.Kind.REQUIRES, node.binary(DFOpcode.EQ, node.ref(i), node.ref(k)));
        NodeCompiler compiler = this.compileClean(builder);
        Assert.assertNotNull(compiler.getArtifact("n"));

        // A contract identifier cannot be used by the equations
        ProgramBuilder other = new ProgramBuilder();
        ComponentBuilder bad = other.component("n");
        Symbol bo = bad.output("o", INT);
        Symbol bk = bad.contractLocal("k", INT);
        bad.equation(bo, bad.ref(bk));
        NodeCompiler failed = this.compile(other);
        assertErrors(failed.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
    }
}
