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

package org.dflow.nodeCompiler.tools;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.CompilerOptions;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.type.DFTypeBool;
import org.dflow.nodeCompiler.ir.type.DFTypeInteger;
import org.dflow.simulator.ArtifactSimulator;
import org.junit.Assert;

import java.util.LinkedHashMap;
import java.util.Map;

/** Helpers for tests which build, compile and run small programs. */
public abstract class NodeTestBase {
    public static final DFTypeInteger INT = DFTypeInteger.INSTANCE;
    public static final DFTypeBool BOOL = DFTypeBool.INSTANCE;

    public CompilerOptions testOptions() {
        CompilerOptions options = new CompilerOptions();
        options.ioOptions.quiet = true;
        return options;
    }

    public NodeCompiler testCompiler() {
        return new NodeCompiler(this.testOptions());
    }

    /** Build the program and compile it with the specified compiler. */
    public NodeCompiler compile(NodeCompiler compiler, ProgramBuilder builder) {
        DFProgram program = builder.build(compiler);
        compiler.compile(program);
        return compiler;
    }

    public NodeCompiler compile(ProgramBuilder builder) {
        return this.compile(this.testCompiler(), builder);
    }

    /** Compile a program which must not have any errors. */
    public NodeCompiler compileClean(ProgramBuilder builder) {
        NodeCompiler compiler = this.compile(builder);
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        return compiler;
    }

    public ArtifactSimulator simulator(NodeCompiler compiler) {
        return new ArtifactSimulator(compiler.getArtifacts());
    }

    /** A map from input names to values, given as alternating names and values. */
    public static Map<String, Object> inputs(Object... namesAndValues) {
        Assert.assertEquals(0, namesAndValues.length % 2);
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2)
            result.put((String) namesAndValues[i], namesAndValues[i + 1]);
        return result;
    }

    public static void assertErrors(CompilerMessages messages, ErrorKind kind, int count) {
        Assert.assertEquals(messages.toString(), count, messages.getErrors(kind).size());
    }

    /** Adds the node
     * <pre>
     * node counter(res: bool, tick: bool) returns (o: int)
     *   inc = if tick then 1 else 0
     *   o = if res then 0 else last o + inc
     * </pre> */
    public static ComponentBuilder counter(ProgramBuilder program, String name) {
        ComponentBuilder node = program.component(name);
        Symbol res = node.input("res", BOOL);
        Symbol tick = node.input("tick", BOOL);
        Symbol o = node.output("o", INT);
        Symbol inc = node.local("inc", INT);
        node.equation(inc, node.ite(node.ref(tick), node.literal(1), node.literal(0)));
        node.equation(o, node.ite(node.ref(res), node.literal(0),
                node.add(node.last(o), node.ref(inc))));
        return node;
    }
}
