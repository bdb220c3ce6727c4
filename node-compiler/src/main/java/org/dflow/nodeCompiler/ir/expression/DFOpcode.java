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

import javax.annotation.Nullable;

/** Unary and binary operators. */
public enum DFOpcode {
    // unary
    NEG("-", true),
    NOT("!", true),
    // binary
    ADD("+", false),
    SUB("-", false),
    MUL("*", false),
    DIV("/", false),
    MOD("%", false),
    EQ("==", false),
    NEQ("!=", false),
    LT("<", false),
    GT(">", false),
    LTE("<=", false),
    GTE(">=", false),
    AND("&&", false),
    OR("||", false);

    private final String text;
    public final boolean isUnary;

    DFOpcode(String text, boolean isUnary) {
        this.text = text;
        this.isUnary = isUnary;
    }

    @Override
    public String toString() {
        return this.text;
    }

    public boolean isArithmetic() {
        return switch (this) {
            case ADD, SUB, MUL, DIV, MOD, NEG -> true;
            default -> false;
        };
    }

    public boolean isComparison() {
        return switch (this) {
            case LT, GT, LTE, GTE -> true;
            default -> false;
        };
    }

    public boolean isEquality() {
        return this == EQ || this == NEQ;
    }

    public boolean isBoolean() {
        return this == AND || this == OR || this == NOT;
    }

    /** Find the operator with the specified text. */
    @Nullable
    public static DFOpcode fromString(String text, boolean unary) {
        for (DFOpcode op: values())
            if (op.text.equals(text) && op.isUnary == unary)
                return op;
        return null;
    }
}
