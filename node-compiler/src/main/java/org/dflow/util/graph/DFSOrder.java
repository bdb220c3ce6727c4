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

package org.dflow.util.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/** Computes the depth-first postorder of a graph.
 * The traversal uses an explicit stack, so long chains do not exhaust the call stack.
 * Cycles are allowed; a node is visited only once. */
public class DFSOrder<Node> {
    final Set<Node> marked;
    final List<Node> postorder;

    public DFSOrder(DiGraph<Node> graph) {
        this.postorder = new ArrayList<>();
        this.marked = new HashSet<>();
        for (Node v: graph.getNodes())
            if (!this.marked.contains(v))
                this.dfs(graph, v);
    }

    /** A node on the traversal stack, with the successors still to visit. */
    private final class Frame {
        final Node node;
        final Iterator<Node> successors;

        Frame(DiGraph<Node> graph, Node node) {
            this.node = node;
            this.successors = graph.getSuccessors(node).iterator();
        }
    }

    private void dfs(DiGraph<Node> graph, Node start) {
        Deque<Frame> stack = new ArrayDeque<>();
        this.marked.add(start);
        stack.push(new Frame(graph, start));
        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.successors.hasNext()) {
                Node w = top.successors.next();
                if (this.marked.add(w))
                    stack.push(new Frame(graph, w));
            } else {
                stack.pop();
                this.postorder.add(top.node);
            }
        }
    }

    /** Every node appears after all the nodes reachable from it, except on cycles. */
    public List<Node> postorder() {
        return Collections.unmodifiableList(this.postorder);
    }
}
