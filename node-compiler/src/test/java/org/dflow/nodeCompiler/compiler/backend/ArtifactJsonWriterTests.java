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

package org.dflow.nodeCompiler.compiler.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dflow.nodeCompiler.NodeCompiler;
import org.dflow.nodeCompiler.compiler.CompilerOptions;
import org.dflow.nodeCompiler.compiler.frontend.ComponentBuilder;
import org.dflow.nodeCompiler.compiler.frontend.ProgramBuilder;
import org.dflow.nodeCompiler.ir.DFContractTerm;
import org.dflow.nodeCompiler.ir.Symbol;
import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.type.DFTypeEvent;
import org.dflow.nodeCompiler.tools.NodeTestBase;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

public class ArtifactJsonWriterTests extends NodeTestBase {
    /** node main(tick: bool) returns (a: int, b: int)
     *   a = counter(false, tick);  b = counter(tick, true) */
    ProgramBuilder program() {
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder counter = counter(builder, "counter");
        counter.contract(DFContractTerm.Kind.ENSURES,
                counter.binary(DFOpcode.GTE, counter.ref("o"), counter.literal(0)));
        ComponentBuilder main = builder.component("main");
        Symbol tick = main.input("tick", BOOL);
        Symbol a = main.output("a", INT);
        Symbol b = main.output("b", INT);
        main.equation(a, main.node("counter", main.literal(false), main.ref(tick)));
        main.equation(b, main.node("counter", main.ref(tick), main.literal(true)));
        return builder;
    }

    static JsonNode write(NodeCompiler compiler) throws Exception {
        String text = new ArtifactJsonWriter().toJsonString(compiler.getArtifacts());
        return new ObjectMapper().readTree(text);
    }

    static JsonNode find(JsonNode artifacts, String name) {
        for (JsonNode artifact: artifacts)
            if (artifact.get("name").asText().equals(name))
                return artifact;
        Assert.fail("No artifact for " + name);
        return null;
    }

    static List<String> kinds(JsonNode body) {
        List<String> result = new ArrayList<>();
        for (JsonNode statement: body)
            result.add(statement.get("kind").asText());
        return result;
    }

    @Test
    public void counterTest() throws Exception {
        NodeCompiler compiler = this.compileClean(this.program());
        JsonNode artifacts = write(compiler);
        Assert.assertTrue(artifacts.isArray());
        Assert.assertEquals(2, artifacts.size());

        JsonNode counter = find(artifacts, "counter");
        Assert.assertEquals("res", counter.get("inputs").get(0).get("name").asText());
        Assert.assertEquals("bool", counter.get("inputs").get(0).get("type").asText());
        Assert.assertEquals("int", counter.get("outputs").get(0).get("type").asText());

        JsonNode state = counter.get("state");
        Assert.assertEquals("counter", state.get("node").asText());
        Assert.assertFalse(state.get("called").asBoolean());
        JsonNode cell = state.get("cells").get(0);
        Assert.assertEquals("mem_o", cell.get("name").asText());
        Assert.assertEquals("o", cell.get("source").asText());
        Assert.assertEquals("literal", cell.get("init").get("kind").asText());
        Assert.assertEquals(0, cell.get("init").get("value").asLong());
        Assert.assertEquals(0, state.get("substates").size());

        JsonNode body = counter.get("body");
        Assert.assertEquals(List.of("let", "let", "write"), kinds(body));
        Assert.assertEquals("o", body.get(1).get("target").asText());
        JsonNode sum = body.get(1).get("expr").get("else");
        Assert.assertEquals("mem", sum.get("left").get("kind").asText());
        Assert.assertEquals("mem_o", sum.get("left").get("cell").asText());
        Assert.assertEquals("mem_o", body.get(2).get("cell").asText());
        Assert.assertEquals("o", body.get(2).get("source").asText());

        Assert.assertEquals("[[\"inc\"],[\"o\"]]", counter.get("partition").toString());
        Assert.assertEquals(1, counter.get("contract").size());
        Assert.assertEquals(0, counter.get("propagated_contracts").size());
    }

    @Test
    public void inlinedTest() throws Exception {
        NodeCompiler compiler = this.compileClean(this.program());
        JsonNode main = find(write(compiler), "main");
        JsonNode substates = main.get("state").get("substates");
        Assert.assertEquals(2, substates.size());
        Assert.assertEquals("counter", substates.get("counter_0").get("node").asText());
        Assert.assertFalse(substates.get("counter_1").get("called").asBoolean());
        Assert.assertEquals("mem_o", substates.get("counter_1").get("cells").get(0).get("name").asText());

        List<String> cells = new ArrayList<>();
        for (JsonNode statement: main.get("body")) {
            Assert.assertNotEquals("call", statement.get("kind").asText());
            if (statement.get("kind").asText().equals("write"))
                cells.add(statement.get("cell").asText());
        }
        Assert.assertEquals(List.of("counter_0.mem_o", "counter_1.mem_o"), cells);

        JsonNode propagated = main.get("propagated_contracts");
        Assert.assertEquals(2, propagated.size());
        JsonNode first = propagated.get(0);
        Assert.assertEquals("counter", first.get("node").asText());
        Assert.assertEquals("counter_0", first.get("path").get(0).asText());
        Assert.assertEquals(1, first.get("original_ids").size());
        Assert.assertEquals("binary", first.get("term").get("kind").asText());
    }

    @Test
    public void neededTest() throws Exception {
        CompilerOptions options = this.testOptions();
        options.languageOptions.inline = "needed";
        NodeCompiler compiler = this.compile(new NodeCompiler(options), this.program());
        Assert.assertEquals(compiler.messages.toString(), 0, compiler.messages.errorCount());
        JsonNode main = find(write(compiler), "main");
        Assert.assertEquals(List.of("call", "call"), kinds(main.get("body")));
        JsonNode call = main.get("body").get(1);
        Assert.assertEquals("counter", call.get("node").asText());
        Assert.assertEquals("counter_1", call.get("instance").asText());
        Assert.assertEquals(2, call.get("args").size());
        Assert.assertEquals("id", call.get("args").get(0).get("kind").asText());
        Assert.assertEquals("b", call.get("targets").get(0).asText());
        Assert.assertTrue(main.get("state").get("substates").get("counter_1").get("called").asBoolean());
    }

    @Test
    public void eventTest() throws Exception {
        // e = (x when x > 0);  s = sample(e, 0)
        ProgramBuilder builder = new ProgramBuilder();
        ComponentBuilder node = builder.component("n");
        Symbol x = node.input("x", INT);
        Symbol e = node.output("e", new DFTypeEvent(INT));
        Symbol s = node.output("s", INT);
        node.equation(e, node.when(node.ref(x), node.binary(DFOpcode.GT, node.ref(x), node.literal(0))));
        node.equation(s, node.sample(node.ref(e), node.literal(0)));
        JsonNode artifact = find(write(this.compileClean(builder)), "n");
        Assert.assertEquals("int", artifact.get("outputs").get(0).get("type").get("event").asText());
        JsonNode body = artifact.get("body");
        Assert.assertEquals("when", body.get(0).get("expr").get("kind").asText());
        Assert.assertEquals("sample", body.get(1).get("expr").get("kind").asText());
        Assert.assertEquals("e", body.get(1).get("expr").get("event").get("name").asText());
    }
}
