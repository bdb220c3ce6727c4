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

import org.dflow.nodeCompiler.compiler.CompilerOptions;
import org.dflow.nodeCompiler.compiler.ICompilerComponent;
import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.Passes;
import org.dflow.nodeCompiler.compiler.analysis.CallGraph;
import org.dflow.nodeCompiler.compiler.analysis.DependencyAnalysis;
import org.dflow.nodeCompiler.compiler.errors.BaseCompilerException;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.errors.SourceFiles;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.compiler.frontend.ProgramJsonReader;
import org.dflow.nodeCompiler.compiler.inlining.Inliner;
import org.dflow.nodeCompiler.compiler.inlining.NormalForm;
import org.dflow.nodeCompiler.compiler.lowering.Lowering;
import org.dflow.nodeCompiler.compiler.typing.TypeAnnotator;
import org.dflow.nodeCompiler.compiler.typing.TypeChecker;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.StateMachineArtifact;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles the nodes of a typed program to state machine artifacts.
 *
 * <p>Problems are reported to {@link #messages}.  A node with a fatal problem is not
 * compiled further, and neither are the nodes which call it, but the other nodes are.
 * Nodes with type errors are still analyzed and scheduled, but not lowered.
 */
public class NodeCompiler implements IWritesLogs, ICompilerComponent, IErrorReporter {
    public final CompilerOptions options;
    public final SourceFiles sources;
    public final CompilerMessages messages;
    @Nullable
    DFProgram program;
    /** Artifacts in the order in which the nodes were compiled. */
    final Map<String, StateMachineArtifact> artifacts;

    public NodeCompiler(CompilerOptions options) {
        this.options = options;
        this.sources = new SourceFiles();
        this.messages = new CompilerMessages(this.sources);
        this.messages.json = options.ioOptions.emitJsonErrors;
        this.messages.quiet = options.ioOptions.quiet;
        this.artifacts = new LinkedHashMap<>();
    }

    @Override
    public NodeCompiler compiler() {
        return this;
    }

    @Override
    public void reportProblem(SourceRange range, boolean warning, ErrorKind kind,
                              String message, List<String> details) {
        this.messages.reportProblem(range, warning, kind, message, details);
    }

    @Override
    public boolean hasErrors() {
        return this.messages.hasErrors();
    }

    void rethrow(RuntimeException e) {
        if (this.options.languageOptions.throwOnError) {
            System.err.println(this.messages);
            throw e;
        }
    }

    /** Decode the program to compile from its JSON representation. */
    public void setInput(String fileName, String contents) {
        ProgramJsonReader reader = new ProgramJsonReader(this, this.sources);
        this.program = reader.read(fileName, contents);
    }

    public void setEntireInput(@Nullable String fileName, InputStream contents) throws IOException {
        String text = new String(contents.readAllBytes(), StandardCharsets.UTF_8);
        this.setInput(fileName != null ? fileName : "<stdin>", text);
    }

    public void setProgram(DFProgram program) {
        this.program = program;
    }

    public DFProgram getProgram() {
        if (this.program == null)
            throw new IllegalStateException("No program to compile");
        return this.program;
    }

    /** Compile the program given by {@link #setInput} or {@link #setProgram}. */
    public void compileInput() {
        if (this.program == null)
            // The input could not be decoded; the problem has been reported.
            return;
        this.compile(this.program);
    }

    public Collection<StateMachineArtifact> getArtifacts() {
        return this.artifacts.values();
    }

    @Nullable
    public StateMachineArtifact getArtifact(String node) {
        return this.artifacts.get(node);
    }

    public void compile(DFProgram program) {
        this.program = program;
        // Nodes which are not compiled further
        Set<String> failed = new HashSet<>();
        // Nodes which are analyzed, but not lowered
        Set<String> notLowered = new HashSet<>();

        TypeChecker checker = new TypeChecker(program, this);
        for (DFComponent component: program.getComponents()) {
            if (!checker.check(component))
                failed.add(component.name);
            else if (checker.getErrorCount() > 0)
                notLowered.add(component.name);
        }

        Passes normalize = new Passes("Normalize", this,
                new NormalForm(program), new TypeAnnotator(program));
        for (DFComponent component: program.getComponents()) {
            if (!failed.contains(component.name))
                normalize.apply(component);
        }

        CallGraph calls = new CallGraph(program);
        Passes analyze = new Passes("Analyze", this,
                new Inliner(program, this.options.languageOptions.getInlinePolicy()),
                new TypeAnnotator(program),
                new DependencyAnalysis(program.symbols));
        Lowering lowering = new Lowering(program.symbols, this.artifacts);
        for (String name: calls.calleesFirst()) {
            if (failed.contains(name))
                continue;
            List<String> callees = calls.getSuccessors(name);
            if (Linq.any(callees, failed::contains)) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Skipping ")
                        .append(name)
                        .append(": it calls a node with errors")
                        .newline();
                failed.add(name);
                continue;
            }
            if (Linq.any(callees, notLowered::contains))
                notLowered.add(name);
            DFComponent component = program.getComponent(name);
            if (component == null)
                throw new InternalCompilerError("No node named " + name);
            try {
                analyze.apply(component);
                if (!notLowered.contains(name))
                    this.artifacts.put(name, lowering.lower(component));
            } catch (BaseCompilerException e) {
                this.messages.reportError(e);
                failed.add(name);
                this.rethrow(e);
            } catch (RuntimeException e) {
                this.messages.reportError(e);
                failed.add(name);
                this.rethrow(e);
            }
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compiled ")
                .append(this.artifacts.size())
                .append(" of ")
                .append(program.getComponents().size())
                .append(" nodes")
                .newline();
    }
}
