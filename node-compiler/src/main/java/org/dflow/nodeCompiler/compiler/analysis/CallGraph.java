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

import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.DFProgram;
import org.dflow.nodeCompiler.ir.expression.DFExpression;
import org.dflow.nodeCompiler.ir.expression.DFNodeCallExpression;
import org.dflow.util.graph.DFSOrder;
import org.dflow.util.graph.DiGraph;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Graph with an edge from each node to the nodes it calls.
 * Only calls of declared nodes are represented. */
public class CallGraph implements DiGraph<String> {
    final Map<String, List<String>> callees;

    public CallGraph(DFProgram program) {
        this.callees = new LinkedHashMap<>();
        for (DFComponent component: program.getComponents()) {
            Set<String> called = new LinkedHashSet<>();
            for (DFEquation equation: component.equations)
                collect(equation.expression, called);
            called.removeIf(c -> program.getComponent(c) == null);
            this.callees.put(component.name, new ArrayList<>(called));
        }
    }

    static void collect(DFExpression expression, Set<String> called) {
        Deque<DFExpression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            DFExpression current = stack.pop();
            DFNodeCallExpression call = current.as(DFNodeCallExpression.class);
            if (call != null)
                called.add(call.callee);
            for (DFExpression child: current.getChildren())
                stack.push(child);
        }
    }

    @Override
    public Iterable<String> getNodes() {
        return this.callees.keySet();
    }

    @Override
    public List<String> getSuccessors(String node) {
        return this.callees.getOrDefault(node, List.of());
    }

    /** Node names with the callees before their callers,
     * except for recursive calls. */
    public List<String> calleesFirst() {
        return new DFSOrder<>(this).postorder();
    }
}
