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

package org.dflow.simulator;

import org.dflow.nodeCompiler.ir.expression.DFOpcode;

import java.util.Objects;

/** Binary operators on simulator values.  Integer arithmetic wraps around. */
final class Operators {
    private Operators() {}

    static Object binary(DFOpcode opcode, Object left, Object right) {
        return switch (opcode) {
            case AND -> ArtifactSimulator.bool(left) && ArtifactSimulator.bool(right);
            case OR -> ArtifactSimulator.bool(left) || ArtifactSimulator.bool(right);
            case EQ -> equal(left, right);
            case NEQ -> !equal(left, right);
            case LT -> compare(left, right) < 0;
            case GT -> compare(left, right) > 0;
            case LTE -> compare(left, right) <= 0;
            case GTE -> compare(left, right) >= 0;
            case ADD, SUB, MUL, DIV, MOD -> arithmetic(opcode, left, right);
            case NEG, NOT -> throw new SimulationError("Not a binary operator: " + opcode);
        };
    }

    static boolean equal(Object left, Object right) {
        if (left instanceof Number && right instanceof Number)
            return compare(left, right) == 0;
        return Objects.equals(left, right);
    }

    static int compare(Object left, Object right) {
        if (left instanceof Long l && right instanceof Long r)
            return Long.compare(l, r);
        return Double.compare(toDouble(left), toDouble(right));
    }

    static double toDouble(Object value) {
        if (value instanceof Number n)
            return n.doubleValue();
        throw new SimulationError("Expected a number, found " + value);
    }

    static Object arithmetic(DFOpcode opcode, Object left, Object right) {
        if (left instanceof Long l && right instanceof Long r) {
            return switch (opcode) {
                case ADD -> l + r;
                case SUB -> l - r;
                case MUL -> l * r;
                case DIV -> {
                    if (r == 0)
                        throw new SimulationError("Division by zero");
                    yield l / r;
                }
                case MOD -> {
                    if (r == 0)
                        throw new SimulationError("Division by zero");
                    yield l % r;
                }
                default -> throw new SimulationError("Not an arithmetic operator: " + opcode);
            };
        }
        double x = toDouble(left);
        double y = toDouble(right);
        return switch (opcode) {
            case ADD -> x + y;
            case SUB -> x - y;
            case MUL -> x * y;
            case DIV -> x / y;
            case MOD -> x % y;
            default -> throw new SimulationError("Not an arithmetic operator: " + opcode);
        };
    }
}
