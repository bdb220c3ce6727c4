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

package org.dflow.nodeCompiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.junit.Assert;
import org.junit.Test;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

public class CompilerMainTests {
    static final String TYPE_ERROR = """
            { "nodes": [ {
                "name": "n",
                "inputs": [ { "name": "b", "type": "bool" } ],
                "outputs": [ { "name": "o", "type": "int" } ],
                "equations": [ { "targets": ["o"], "expr": { "kind": "id", "name": "b" } } ]
            } ] }
            """;

    static File createInputFile(String contents) throws IOException {
        File file = File.createTempFile("program", ".json");
        file.deleteOnExit();
        Files.writeString(file.toPath(), contents);
        return file;
    }

    static File counterFile() throws IOException {
        try (InputStream stream = CompilerMainTests.class.getResourceAsStream("/counter.json")) {
            Assert.assertNotNull(stream);
            return createInputFile(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
        }
    }

    static File outputFile() throws IOException {
        File file = File.createTempFile("out", ".json");
        file.deleteOnExit();
        return file;
    }

    @Test
    public void compileFileTest() throws IOException {
        File input = counterFile();
        File output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        Assert.assertEquals(0, messages.errorCount());

        JsonNode artifacts = new ObjectMapper().readTree(output);
        Assert.assertTrue(artifacts.isArray());
        Assert.assertEquals(2, artifacts.size());
        Assert.assertEquals("counter", artifacts.get(0).get("name").asText());
        Assert.assertEquals("main", artifacts.get(1).get("name").asText());
    }

    @Test
    public void neededInliningTest() throws IOException {
        File input = counterFile();
        File output = outputFile();
        CompilerMessages messages = CompilerMain.execute(
                "--inline", "needed", "-o", output.getPath(), input.getPath());
        Assert.assertEquals(messages.toString(), 0, messages.exitCode);
        JsonNode main = new ObjectMapper().readTree(output).get(1);
        int calls = 0;
        for (JsonNode statement: main.get("body"))
            if (statement.get("kind").asText().equals("call"))
                calls++;
        Assert.assertEquals(2, calls);
    }

    @Test
    public void errorTest() throws IOException {
        File input = createInputFile(TYPE_ERROR);
        File output = outputFile();
        CompilerMessages messages = CompilerMain.execute("-o", output.getPath(), input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.getErrors(ErrorKind.TYPE_MISMATCH).size());
        // Nothing is written when compilation fails
        Assert.assertEquals(0, output.length());
    }

    @Test
    public void errorFileTest() throws IOException {
        File input = createInputFile(TYPE_ERROR);
        File errors = outputFile();
        CompilerMain main = new CompilerMain();
        Assert.assertEquals(0, main.parseOptions(new String[] {
                "--json", "--errors", errors.getPath(), input.getPath() }));
        CompilerMessages messages = main.run();
        Assert.assertEquals(1, messages.exitCode);
        main.showMessages(messages);
        JsonNode json = new ObjectMapper().readTree(errors);
        Assert.assertTrue(json.isArray());
        Assert.assertEquals(1, json.size());
    }

    @Test
    public void missingFileTest() {
        CompilerMessages messages = CompilerMain.execute("/no/such/file.json");
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.getErrors(ErrorKind.IO_ERROR).size());
    }

    @Test
    public void badOptionsTest() throws IOException {
        File input = counterFile();
        Assert.assertEquals(1, CompilerMain.execute("--nosuchoption", input.getPath()).exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-T", "NodeCompiler=high", input.getPath()).exitCode);
        Assert.assertEquals(1, CompilerMain.execute("-h").exitCode);
        CompilerMessages messages = CompilerMain.execute("--inline", "some", input.getPath());
        Assert.assertEquals(1, messages.exitCode);
        Assert.assertEquals(1, messages.getErrors(ErrorKind.IO_ERROR).size());
    }
}
