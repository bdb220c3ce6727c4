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

import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.ir.type.DFType;

import java.util.ArrayList;
import java.util.List;

/** Maps integer ids to symbols.  Ids are dense and unique in the whole program.
 * Symbols are never removed or changed. */
public class SymbolTable {
    final List<Symbol> symbols;

    public SymbolTable() {
        this.symbols = new ArrayList<>();
    }

    public Symbol add(String component, String name, DFType type, Scope scope, SourceRange range) {
        return this.add(component, name, name, type, scope, List.of(), range);
    }

    /** Add a symbol created by inlining or normalization. */
    public Symbol add(String component, String name, String localName, DFType type, Scope scope,
                      List<String> path, SourceRange range) {
        Symbol symbol = new Symbol(this.symbols.size(), name, localName, type, scope, component, path, range);
        this.symbols.add(symbol);
        return symbol;
    }

    public boolean contains(int id) {
        return id >= 0 && id < this.symbols.size();
    }

    public Symbol get(int id) {
        if (!this.contains(id))
            throw new InternalCompilerError("No symbol with id " + id);
        return this.symbols.get(id);
    }

    public String getName(int id) {
        return this.get(id).name;
    }

    public DFType getType(int id) {
        return this.get(id).type;
    }

    public int size() {
        return this.symbols.size();
    }
}
