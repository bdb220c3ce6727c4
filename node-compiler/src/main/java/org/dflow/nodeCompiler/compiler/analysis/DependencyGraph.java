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

import org.dflow.util.graph.DiGraph;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** A directed graph over identifier ids.
 * An edge 'a -> b' means that 'a' depends on 'b'.
 * There is at most one edge between two identifiers; inserting a second
 * edge merges the labels as described by {@link Label#merge}.
 * Iteration order is insertion order, so analyses over the graph are deterministic. */
public class DependencyGraph implements DiGraph<Integer> {
    final Set<Integer> nodes;
    final Map<Integer, Map<Integer, Label>> edges;
    /** Node calls which have not been inlined */
    final List<InliningObligation> obligations;

    public DependencyGraph() {
        this.nodes = new LinkedHashSet<>();
        this.edges = new LinkedHashMap<>();
        this.obligations = new ArrayList<>();
    }

    public void addNode(int id) {
        this.nodes.add(id);
    }

    /** Add an edge stating that 'source' depends on 'dependency'. */
    public void addEdge(int source, int dependency, Label label) {
        this.addNode(source);
        this.addNode(dependency);
        Map<Integer, Label> out = this.edges.computeIfAbsent(source, k -> new LinkedHashMap<>());
        Label previous = out.get(dependency);
        out.put(dependency, previous == null ? label : previous.merge(label));
    }

    @Nullable
    public Label getLabel(int source, int dependency) {
        Map<Integer, Label> out = this.edges.get(source);
        if (out == null)
            return null;
        return out.get(dependency);
    }

    public boolean hasNode(int id) {
        return this.nodes.contains(id);
    }

    @Override
    public Iterable<Integer> getNodes() {
        return Collections.unmodifiableSet(this.nodes);
    }

    /** All dependencies of a node, whatever the label. */
    @Override
    public List<Integer> getSuccessors(Integer node) {
        Map<Integer, Label> out = this.edges.get(node);
        if (out == null)
            return List.of();
        return new ArrayList<>(out.keySet());
    }

    /** The dependencies which must be computed before the node in the same instant. */
    public List<Integer> getZeroSuccessors(int node) {
        Map<Integer, Label> out = this.edges.get(node);
        if (out == null)
            return List.of();
        List<Integer> result = new ArrayList<>();
        for (Map.Entry<Integer, Label> e: out.entrySet())
            if (e.getValue().isZero())
                result.add(e.getKey());
        return result;
    }

    /** The dependencies of a node with their labels. */
    public Map<Integer, Label> getEdges(int node) {
        Map<Integer, Label> out = this.edges.get(node);
        if (out == null)
            return Map.of();
        return Collections.unmodifiableMap(out);
    }

    public int edgeCount() {
        int result = 0;
        for (Map<Integer, Label> out: this.edges.values())
            result += out.size();
        return result;
    }

    public void addObligation(InliningObligation obligation) {
        this.obligations.add(obligation);
    }

    public List<InliningObligation> getObligations() {
        return Collections.unmodifiableList(this.obligations);
    }

    @Override
    public String asString() {
        StringBuilder builder = new StringBuilder();
        for (Map.Entry<Integer, Map<Integer, Label>> e: this.edges.entrySet()) {
            for (Map.Entry<Integer, Label> d: e.getValue().entrySet()) {
                builder.append(e.getKey())
                        .append(" -> ")
                        .append(d.getKey())
                        .append(" [")
                        .append(d.getValue())
                        .append("]")
                        .append(System.lineSeparator());
            }
        }
        return builder.toString();
    }
}
