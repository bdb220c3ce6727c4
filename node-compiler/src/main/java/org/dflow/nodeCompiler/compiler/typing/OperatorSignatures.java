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

package org.dflow.nodeCompiler.compiler.typing;

import org.dflow.nodeCompiler.ir.expression.DFOpcode;
import org.dflow.nodeCompiler.ir.type.DFType;
import org.dflow.nodeCompiler.ir.type.DFTypeAny;
import org.dflow.nodeCompiler.ir.type.DFTypeBool;
import org.dflow.nodeCompiler.ir.type.DFTypeCode;

import javax.annotation.Nullable;

/** Result types of the operators.
 * Arithmetic needs two numbers of the same type, comparisons two numbers of
 * the same type, equality two values of the same type that are not events,
 * and the boolean operators two booleans.  An operand of the placeholder type
 * matches anything. */
public final class OperatorSignatures {
    private OperatorSignatures() {}

    /** The result type, or null if the operands do not match the operator. */
    @Nullable
    public static DFType unary(DFOpcode opcode, DFType operand) {
        if (operand.isAny())
            return opcode == DFOpcode.NOT ? DFTypeBool.INSTANCE : DFTypeAny.INSTANCE;
        return switch (opcode) {
            case NEG -> operand.code.isNumeric() ? operand : null;
            case NOT -> operand.code == DFTypeCode.BOOL ? operand : null;
            default -> null;
        };
    }

    @Nullable
    public static DFType binary(DFOpcode opcode, DFType left, DFType right) {
        if (opcode.isArithmetic()) {
            if (left.isAny())
                return right.isAny() || right.code.isNumeric() ? right : null;
            if (!left.code.isNumeric() || !left.isCompatible(right))
                return null;
            if (opcode == DFOpcode.MOD && left.code != DFTypeCode.INTEGER)
                return null;
            return left;
        }
        if (opcode.isComparison()) {
            if ((left.isAny() || left.code.isNumeric()) && left.isCompatible(right) &&
                    (right.isAny() || right.code.isNumeric()))
                return DFTypeBool.INSTANCE;
            return null;
        }
        if (opcode.isEquality()) {
            if (left.isEvent() || right.isEvent() ||
                    left.code == DFTypeCode.TUPLE || right.code == DFTypeCode.TUPLE)
                return null;
            return left.isCompatible(right) ? DFTypeBool.INSTANCE : null;
        }
        if (opcode.isBoolean()) {
            boolean leftOk = left.isAny() || left.code == DFTypeCode.BOOL;
            boolean rightOk = right.isAny() || right.code == DFTypeCode.BOOL;
            return leftOk && rightOk ? DFTypeBool.INSTANCE : null;
        }
        return null;
    }
}
