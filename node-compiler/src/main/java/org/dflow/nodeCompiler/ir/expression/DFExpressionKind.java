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

package org.dflow.nodeCompiler.ir.expression;

/** The closed set of expression kinds.
 * Every analysis switches over this enumeration, so adding a kind
 * is flagged by the compiler in every pass that has to handle it. */
public enum DFExpressionKind {
    LITERAL,
    IDENTIFIER,
    UNARY,
    BINARY,
    ENUM,
    STRUCT,
    FIELD,
    IF,
    FUNCTION_CALL,
    NODE_CALL,
    /** Previous value of an identifier. */
    LAST,
    /** Initial value followed by the previous value of an expression. */
    FOLLOWED_BY,
    WHEN,
    MERGE,
    PERIOD,
    SAMPLE,
    /** Read of a memory cell; only produced by lowering. */
    MEMORY_READ
}
