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

package org.dflow.nodeCompiler.ir;

import org.dflow.nodeCompiler.ir.type.DFTypeEnum;
import org.dflow.nodeCompiler.ir.type.DFTypeStruct;

import javax.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** A whole program: declarations and components, in declaration order. */
public class DFProgram {
    public final SymbolTable symbols;
    final Map<String, DFComponent> components;
    final Map<String, DFTypeEnum> enums;
    final Map<String, DFTypeStruct> structs;
    final Map<String, DFFunctionSignature> functions;

    public DFProgram(SymbolTable symbols) {
        this.symbols = symbols;
        this.components = new LinkedHashMap<>();
        this.enums = new LinkedHashMap<>();
        this.structs = new LinkedHashMap<>();
        this.functions = new LinkedHashMap<>();
    }

    public void addComponent(DFComponent component) {
        this.components.put(component.name, component);
    }

    public void addEnum(DFTypeEnum type) {
        this.enums.put(type.name, type);
    }

    public void addStruct(DFTypeStruct type) {
        this.structs.put(type.name, type);
    }

    public void addFunction(DFFunctionSignature function) {
        this.functions.put(function.name(), function);
    }

    @Nullable
    public DFComponent getComponent(String name) {
        return this.components.get(name);
    }

    public Collection<DFComponent> getComponents() {
        return this.components.values();
    }

    @Nullable
    public DFTypeEnum getEnum(String name) {
        return this.enums.get(name);
    }

    @Nullable
    public DFTypeStruct getStruct(String name) {
        return this.structs.get(name);
    }

    @Nullable
    public DFFunctionSignature getFunction(String name) {
        return this.functions.get(name);
    }
}
