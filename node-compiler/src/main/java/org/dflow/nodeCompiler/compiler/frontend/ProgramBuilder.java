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

import org.dflow.nodeCompiler.compiler.IErrorReporter;
import org.dflow.nodeCompiler.compiler.errors.CompilationError;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.DFFunctionSignature;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeEnum;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;
import org.dflow.util.Linq;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/** Programmatic front door of the compiler: an external parser, or a test,
 * declares the types, functions and nodes of a program through this class. */
public class ProgramBuilder {
    final SymbolTable symbols;
    final DFProgram program;
    final List<ComponentBuilder> components;
    final Set<String> typeNames;

    public ProgramBuilder() {
        this.symbols = new SymbolTable();
        this.program = new DFProgram(this.symbols);
        this.components = new ArrayList<>();
        this.typeNames = new HashSet<>();
    }

    void checkNewType(String name) {
        if (!this.typeNames.add(name))
            throw new CompilationError("Type " + name + " declared twice",
                    ErrorKind.MALFORMED_PROGRAM, SourceRange.INVALID);
    }

    public DFTypeEnum declareEnum(String name, String... variants) {
        return this.declareEnum(name, Linq.list(variants));
    }

    public DFTypeEnum declareEnum(String name, List<String> variants) {
        this.checkNewType(name);
        DFTypeEnum result = new DFTypeEnum(name, variants);
        this.program.addEnum(result);
        return result;
    }

    public DFTypeStruct declareStruct(String name, LinkedHashMap<String, DFType> fields) {
        this.checkNewType(name);
        DFTypeStruct result = new DFTypeStruct(name, fields);
        this.program.addStruct(result);
        return result;
    }

    public DFFunctionSignature declareFunction(String name, List<DFType> parameters, DFType result) {
        if (this.program.getFunction(name) != null)
            throw new CompilationError("Function " + name + " declared twice",
                    ErrorKind.MALFORMED_PROGRAM, SourceRange.INVALID);
        DFFunctionSignature signature = new DFFunctionSignature(name, parameters, result);
        this.program.addFunction(signature);
        return signature;
    }

    /** A builder which is not part of the program until it is added. */
    ComponentBuilder newComponent(String name, SourceRange range) {
        return new ComponentBuilder(this.symbols, name, range);
    }

    void add(ComponentBuilder component) {
        for (ComponentBuilder builder: this.components)
            if (builder.getName().equals(component.getName()))
                throw new CompilationError("Node " + component.getName() + " declared twice",
                        ErrorKind.MALFORMED_PROGRAM, component.getComponent().range);
        this.components.add(component);
    }

    public ComponentBuilder component(String name, SourceRange range) {
        ComponentBuilder result = this.newComponent(name, range);
        this.add(result);
        return result;
    }

    public ComponentBuilder component(String name) {
        return this.component(name, SourceRange.INVALID);
    }

    /** Build the program.  Components which are not well-formed are reported and left out. */
    public DFProgram build(IErrorReporter reporter) {
        for (ComponentBuilder builder: this.components) {
            if (builder.validate(reporter))
                this.program.addComponent(builder.getComponent());
        }
        return this.program;
    }
}
