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

import org.dflow.nodeCompiler.compiler.errors.CausalityViolationError;
import org.dflow.nodeCompiler.ir.DFComponent;
import org.dflow.nodeCompiler.ir.DFEquation;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Checks that the equations of a component can be evaluated in some order:
 * every cycle of dependencies must go through at least one delay.
 * Only weight 0 edges are followed. */
public class CausalityAnalyzer implements IWritesLogs {
    final SymbolTable symbols;

    public CausalityAnalyzer(SymbolTable symbols) {
        this.symbols = symbols;
    }

    /** An identifier on the traversal stack with the dependencies still to visit. */
    static final class Frame {
        final int id;
        final Iterator<Integer> dependencies;

        Frame(int id, List<Integer> dependencies) {
            this.id = id;
            this.dependencies = dependencies.iterator();
        }
    }

    /** Find a zero-delay cycle.
     * @param graph  Graph to analyze.
     * @param roots  Identifiers where the traversal starts, in order;
     *               graph nodes not in this list are visited afterwards.
     * @return The identifiers on the first cycle found, starting and ending
     *         with the same identifier, or null if there is no cycle. */
    @Nullable
    public static List<Integer> findCycle(DependencyGraph graph, List<Integer> roots) {
        Map<Integer, Color> colors = new HashMap<>();
        Set<Integer> order = new LinkedHashSet<>(roots);
        for (int id: graph.getNodes())
            order.add(id);

        for (int root: order) {
            if (colors.getOrDefault(root, Color.WHITE) != Color.WHITE)
                continue;
            Deque<Frame> stack = new ArrayDeque<>();
            colors.put(root, Color.GREY);
            stack.push(new Frame(root, graph.getZeroSuccessors(root)));
            while (!stack.isEmpty()) {
                Frame top = stack.peek();
                if (!top.dependencies.hasNext()) {
                    colors.put(top.id, Color.BLACK);
                    stack.pop();
                    continue;
                }
                int next = top.dependencies.next();
                Color color = colors.getOrDefault(next, Color.WHITE);
                switch (color) {
                    case WHITE -> {
                        colors.put(next, Color.GREY);
                        stack.push(new Frame(next, graph.getZeroSuccessors(next)));
                    }
                    case GREY -> {
                        // The stack holds the path from the root; the top is pushed last.
                        List<Integer> path = new ArrayList<>();
                        Iterator<Frame> fromRoot = stack.descendingIterator();
                        boolean onCycle = false;
                        while (fromRoot.hasNext()) {
                            Frame frame = fromRoot.next();
                            if (frame.id == next)
                                onCycle = true;
                            if (onCycle)
                                path.add(frame.id);
                        }
                        path.add(next);
                        return path;
                    }
                    case BLACK -> {}
                }
            }
        }
        return null;
    }

    /** Check the data graph of a component.
     * @throws CausalityViolationError if the component has a zero-delay cycle. */
    public void check(DFComponent component) {
        DependencyGraph graph = component.getGraph();
        List<Integer> cycle = findCycle(graph, component.getDeclarationOrder());
        if (cycle != null) {
            List<String> names = Linq.map(cycle, this.symbols::getName);
            DFEquation definition = component.getDefinition(cycle.get(0));
            throw new CausalityViolationError(component.name, cycle, names,
                    definition != null ? definition.range : component.range);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append(component.name)
                .append(" is causal")
                .newline();
    }
}
