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

package org.dflow.nodeCompiler.compiler.analysis;

import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.util.Utilities;

/** Label of a dependency edge.
 * A weight is the number of delays between the dependent and the dependency:
 * weight 0 means that the dependency must be computed first in the same instant.
 * A contract label marks a proof obligation between identifiers of a contract term. */
public final class Label {
    private static final int CONTRACT_WEIGHT = -1;
    public static final Label CONTRACT = new Label(CONTRACT_WEIGHT);
    public static final Label ZERO = new Label(0);

    private final int weight;

    private Label(int weight) {
        this.weight = weight;
    }

    public static Label weight(int weight) {
        Utilities.enforce(weight >= 0, "Negative weight " + weight);
        if (weight == 0)
            return ZERO;
        return new Label(weight);
    }

    public boolean isContract() {
        return this.weight == CONTRACT_WEIGHT;
    }

    /** True for a weight 0 edge, the only kind of edge which constrains the evaluation order. */
    public boolean isZero() {
        return this.weight == 0;
    }

    public int getWeight() {
        if (this.isContract())
            throw new InternalCompilerError("Contract label has no weight");
        return this.weight;
    }

    /** The label of a dependency seen through one more delay. */
    public Label increment() {
        if (this.isContract())
            return this;
        return Label.weight(this.weight + 1);
    }

    /** Combine the labels of two edges between the same identifiers.
     * A contract label always wins; otherwise the smallest weight wins. */
    public Label merge(Label other) {
        if (this.isContract() || other.isContract())
            return CONTRACT;
        return this.weight <= other.weight ? this : other;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return this.weight == ((Label) o).weight;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(this.weight);
    }

    @Override
    public String toString() {
        if (this.isContract())
            return "contract";
        return "w" + this.weight;
    }
}
