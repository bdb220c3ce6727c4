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

/** The kinds of problems reported by the compiler. */
public enum ErrorKind {
    /** A name that does not resolve to a declared symbol, node, function or type. */
    UNKNOWN_ELEMENT("Unknown element"),
    TYPE_MISMATCH("Type mismatch"),
    /** A cycle of identifiers that depend on each other in the same instant. */
    CAUSALITY_VIOLATION("Causality violation"),
    /** A node that calls itself, directly or through other nodes. */
    RECURSIVE_INLINE("Recursive node call"),
    MALFORMED_CONTRACT("Malformed contract"),
    /** A program which does not respect the rules checked when it is built,
     * e.g. an identifier without a defining equation. */
    MALFORMED_PROGRAM("Malformed program"),
    /** The input program could not be read. */
    IO_ERROR("Input/output error"),
    /** A bug in the compiler. */
    INTERNAL_ERROR("Compiler error");

    public final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    @Override
    public String toString() {
        return this.description;
    }
}
