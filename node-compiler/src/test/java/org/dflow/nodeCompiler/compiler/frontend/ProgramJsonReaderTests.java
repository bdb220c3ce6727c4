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

package org.dflow.nodeCompiler.compiler.frontend;

import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.ir.PropagatedContract;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.dflow.simulator.ArtifactSimulator;
import org.dflow.simulator.EnumValue;
import org.dflow.simulator.SimulatorState;
import org.dflow.simulator.StructValue;
import org.dflow.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

public class ProgramJsonReaderTests extends NodeTestBase {
    NodeCompiler compileJson(String json) {
        NodeCompiler compiler = this.testCompiler();
        compiler.setInput("test.json", json);
        compiler.compileInput();
        return compiler;
    }

    @Test
    public void counterFileTest() throws IOException {
        NodeCompiler compiler = this.testCompiler();
        try (InputStream stream = this.getClass().getResourceAsStream("/counter.json")) {
            Assert.assertNotNull(stream);
            compiler.setEntireInput("counter.json", stream);
        }
        compiler.compileInput();
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());

        StateMachineArtifact counter = compiler.getArtifact("counter");
        Assert.assertNotNull(counter);
        Assert.assertEquals(1, counter.contract.size());
        StateMachineArtifact main = compiler.getArtifact("main");
        Assert.assertNotNull(main);
        Assert.assertEquals(List.of("tick"), Linq.map(main.inputs, s -> s.name));
        Assert.assertEquals(List.of("a", "b"), Linq.map(main.outputs, s -> s.name));
        // Each instance of counter carries its own copy of the contract
        Assert.assertEquals(List.of(List.of("counter_0"), List.of("counter_1")),
                Linq.map(main.propagatedContracts, PropagatedContract::path));

        ArtifactSimulator simulator = this.simulator(compiler);
        SimulatorState state = simulator.initialize("main");
        Map<String, Object> outputs = simulator.step("main", state, inputs("tick", true));
        Assert.assertEquals(1L, outputs.get("a"));
        Assert.assertEquals(2L, outputs.get("b"));
        outputs = simulator.step("main", state, inputs("tick", false));
        Assert.assertEquals(1L, outputs.get("a"));
        Assert.assertEquals(4L, outputs.get("b"));
        Assert.assertEquals(1L, state.read("counter_0.mem_o"));
        Assert.assertEquals(2L, state.read("counter_1.mem_o"));
    }

    @Test
    public void declarationsTest() {
        String json = """
                {
                  "enums": [ { "name": "Mode", "variants": ["Off", "On"] } ],
                  "structs": [ { "name": "Pair", "fields": [
                      { "name": "left", "type": "int" },
                      { "name": "mode", "type": "Mode" } ] } ],
                  "functions": [ { "name": "twice", "parameters": ["int"], "result": "int" } ],
                  "nodes": [ {
                    "name": "n",
                    "inputs": [ { "name": "x", "type": "int" } ],
                    "outputs": [ { "name": "p", "type": "Pair" },
                                 { "name": "e", "type": { "event": "int" } } ],
                    "equations": [
                      { "targets": ["p"], "expr": { "kind": "struct", "struct": "Pair", "fields": {
                          "left": { "kind": "call", "function": "twice",
                                    "args": [ { "kind": "id", "name": "x" } ] },
                          "mode": { "kind": "enum", "enum": "Mode", "variant": "On" } } } },
                      { "targets": ["e"], "expr": { "kind": "when",
                          "expr": { "kind": "field", "base": { "kind": "id", "name": "p" }, "field": "left" },
                          "cond": { "kind": "binary", "op": ">",
                                    "left": { "kind": "id", "name": "x" },
                                    "right": { "kind": "literal", "value": 0 } } } }
                    ]
                  } ]
                }
                """;
        NodeCompiler compiler = this.compileJson(json);
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        ArtifactSimulator simulator = this.simulator(compiler);
        simulator.registerFunction("twice", args -> 2 * (Long) args.get(0));
        SimulatorState state = simulator.initialize("n");
        Map<String, Object> outputs = simulator.step("n", state, inputs("x", 3L));
        Assert.assertEquals(new StructValue("Pair", Map.of("left", 6L, "mode", new EnumValue("Mode", "On"))),
                outputs.get("p"));
        Assert.assertEquals(6L, outputs.get("e"));
    }

    @Test
    public void invalidJsonTest() {
        NodeCompiler compiler = this.compileJson("{ \"nodes\": [ ");
        assertErrors(compiler.messages, ErrorKind.MALFORMED_PROGRAM, 1);
        Assert.assertTrue(compiler.getArtifacts().isEmpty());
    }

    @Test
    public void missingNodesTest() {
        NodeCompiler compiler = this.compileJson("{ \"enums\": [] }");
        assertErrors(compiler.messages, ErrorKind.MALFORMED_PROGRAM, 1);
        Assert.assertTrue(compiler.getArtifacts().isEmpty());
    }

    @Test
    public void badNodeIsSkippedTest() {
        String json = """
                { "nodes": [
                  { "name": "bad",
                    "inputs": [ { "name": "s", "type": "string" } ],
                    "outputs": [ { "name": "o", "type": "int" } ],
                    "equations": [ { "targets": ["o"], "expr": { "kind": "literal", "value": 1 } } ] },
                  { "name": "weird",
                    "outputs": [ { "name": "o", "type": "int" } ],
                    "equations": [ { "targets": ["o"], "expr": { "kind": "pre", "name": "o" } } ] },
                  { "name": "good",
                    "inputs": [ { "name": "i", "type": "int" } ],
                    "outputs": [ { "name": "o", "type": "int" } ],
                    "equations": [ { "targets": ["o"], "expr": { "kind": "unary", "op": "-",
                                                               "arg": { "kind": "id", "name": "i" } } } ] }
                ] }
                """;
        NodeCompiler compiler = this.compileJson(json);
        assertErrors(compiler.messages, ErrorKind.UNKNOWN_ELEMENT, 1);
        assertErrors(compiler.messages, ErrorKind.MALFORMED_PROGRAM, 1);
        Assert.assertNull(compiler.getArtifact("bad"));
        Assert.assertNull(compiler.getArtifact("weird"));
        Assert.assertNotNull(compiler.getArtifact("good"));
        Assert.assertNull(compiler.getProgram().getComponent("bad"));
    }

    @Test
    public void undefinedOutputTest() {
        String json = """
                { "nodes": [
                  { "name": "n",
                    "outputs": [ { "name": "o", "type": "int" }, { "name": "p", "type": "int" } ],
                    "equations": [ { "targets": ["o"], "expr": { "kind": "literal", "value": 1 } } ] }
                ] }
                """;
        NodeCompiler compiler = this.compileJson(json);
        assertErrors(compiler.messages, ErrorKind.MALFORMED_PROGRAM, 1);
        Assert.assertNull(compiler.getArtifact("n"));
    }

    @Test
    public void unknownContractKindTest() {
        String json = """
                { "nodes": [
                  { "name": "n",
                    "outputs": [ { "name": "o", "type": "int" } ],
                    "equations": [ { "targets": ["o"], "expr": { "kind": "literal", "value": 1 } } ],
                    "contract": [ { "kind": "assumes", "term": { "kind": "literal", "value": true } } ] }
                ] }
                """;
        NodeCompiler compiler = this.compileJson(json);
        assertErrors(compiler.messages, ErrorKind.MALFORMED_CONTRACT, 1);
        Assert.assertNull(compiler.getArtifact("n"));
    }
}
