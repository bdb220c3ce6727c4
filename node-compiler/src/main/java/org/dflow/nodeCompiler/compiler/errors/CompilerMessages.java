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

package org.dflow.nodeCompiler.compiler.errors;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.IHasSourceRange;
import org.dflow.util.Linq;
import org.dflow.util.Utilities;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/** Collects the diagnostics of a compilation. */
public class CompilerMessages implements IErrorReporter {
    public static class Message implements IHasSourceRange {
        public final SourceRange range;
        public final boolean warning;
        public final ErrorKind kind;
        public final String message;
        public final ImmutableList<String> details;

        Message(SourceRange range, boolean warning, ErrorKind kind, String message, List<String> details) {
            this.range = range;
            this.warning = warning;
            this.kind = kind;
            this.message = message;
            this.details = ImmutableList.copyOf(details);
        }

        Message(BaseCompilerException e) {
            this(e.getSourceRange(), false, e.getErrorKind(), e.getMessage(), e.getDetails());
        }

        Message(Throwable e) {
            this(SourceRange.INVALID, false, ErrorKind.INTERNAL_ERROR,
                    e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(),
                    List.of());
        }

        public void format(SourceFiles sources, StringBuilder output) {
            if (this.range.isValid()) {
                output.append(sources.getSourceFileName(this.range))
                        .append(":")
                        .append(this.range.start)
                        .append("-")
                        .append(this.range.end)
                        .append(": ");
            }
            output.append(this.warning ? "warning:" : "error:")
                    .append(" ")
                    .append(this.kind)
                    .append(": ")
                    .append(this.message)
                    .append(System.lineSeparator());
            String fragment = sources.getFragment(this.range);
            if (!fragment.isEmpty())
                output.append("    ").append(fragment).append(System.lineSeparator());
        }

        public JsonNode toJson(SourceFiles sources, ObjectMapper mapper) {
            ObjectNode result = mapper.createObjectNode();
            this.range.appendAsJson(result);
            result.put("file_name", sources.getSourceFileName(this.range));
            result.put("warning", this.warning);
            result.put("error_type", this.kind.name());
            result.put("message", this.message);
            ArrayNode details = result.putArray("details");
            for (String d: this.details)
                details.add(d);
            result.put("snippet", sources.getFragment(this.range));
            return result;
        }

        @Override
        public SourceRange getSourceRange() {
            return this.range;
        }

        @Override
        public String toString() {
            StringBuilder builder = new StringBuilder();
            this.format(new SourceFiles(), builder);
            return builder.toString();
        }
    }

    public final SourceFiles sources;
    public final List<Message> messages;
    public int exitCode = 0;
    /** Emit messages as JSON */
    public boolean json = false;
    /** Do not show warnings */
    public boolean quiet = false;

    public CompilerMessages(SourceFiles sources) {
        this.sources = sources;
        this.messages = new ArrayList<>();
    }

    public void clear() {
        this.messages.clear();
        this.exitCode = 0;
    }

    void report(Message message) {
        this.messages.add(message);
        if (!message.warning)
            this.exitCode = 1;
    }

    @Override
    public void reportProblem(SourceRange range, boolean warning, ErrorKind kind,
                              String message, List<String> details) {
        this.report(new Message(range, warning, kind, message, details));
    }

    public void reportError(BaseCompilerException e) {
        this.report(new Message(e));
    }

    public void reportError(Throwable e) {
        this.report(new Message(e));
    }

    @Override
    public boolean hasErrors() {
        return this.errorCount() > 0;
    }

    public int errorCount() {
        return (int)this.messages.stream().filter(m -> !m.warning).count();
    }

    public int warningCount() {
        return (int)this.messages.stream().filter(m -> m.warning).count();
    }

    public Message getMessage(int index) {
        return this.messages.get(index);
    }

    /** All the errors of the specified kind. */
    public List<Message> getErrors(ErrorKind kind) {
        return Linq.where(this.messages, m -> !m.warning && m.kind == kind);
    }

    public boolean isEmpty() {
        return this.messages.isEmpty();
    }

    public void show(PrintStream stream) {
        if (this.errorCount() + (this.quiet ? 0 : this.warningCount()) > 0)
            stream.println(this);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        if (this.json) {
            builder.append(this.toJson().toPrettyString());
        } else {
            for (Message message: this.messages) {
                if (this.quiet && message.warning)
                    continue;
                message.format(this.sources, builder);
            }
        }
        return builder.toString();
    }

    public JsonNode toJson() {
        ObjectMapper mapper = Utilities.deterministicObjectMapper();
        ArrayNode result = mapper.createArrayNode();
        for (Message message: this.messages) {
            if (this.quiet && message.warning)
                continue;
            result.add(message.toJson(this.sources, mapper));
        }
        return result;
    }
}
