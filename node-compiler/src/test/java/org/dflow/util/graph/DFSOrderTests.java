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

import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class DFSOrderTests {
    static class MapGraph implements DiGraph<String> {
        final Map<String, List<String>> edges = new LinkedHashMap<>();

        MapGraph edge(String from, String to) {
            this.edges.computeIfAbsent(from, k -> new ArrayList<>()).add(to);
            this.edges.computeIfAbsent(to, k -> new ArrayList<>());
            return this;
        }

        @Override
        public Iterable<String> getNodes() {
            return this.edges.keySet();
        }

        @Override
        public List<String> getSuccessors(String node) {
            return this.edges.getOrDefault(node, List.of());
        }
    }

    @Test
    public void orderTest() {
        MapGraph graph = new MapGraph()
                .edge("a", "b")
                .edge("b", "c")
                .edge("a", "c");
        DFSOrder<String> order = new DFSOrder<>(graph);
        Assert.assertEquals(List.of("c", "b", "a"), order.postorder());
        String nl = System.lineSeparator();
        Assert.assertEquals("a -> b" + nl + "a -> c" + nl + "b -> c" + nl, graph.asString());
    }

    @Test
    public void cycleTest() {
        MapGraph graph = new MapGraph()
                .edge("a", "b")
                .edge("b", "a")
                .edge("c", "a");
        DFSOrder<String> order = new DFSOrder<>(graph);
        Assert.assertEquals(List.of("b", "a", "c"), order.postorder());
    }

    @Test
    public void deepGraphTest() {
        // Must not overflow the stack
        MapGraph graph = new MapGraph();
        int size = 100_000;
        for (int i = 0; i < size; i++)
            graph.edge("n" + i, "n" + (i + 1));
        DFSOrder<String> order = new DFSOrder<>(graph);
        Assert.assertEquals(size + 1, order.postorder().size());
        Assert.assertEquals("n" + size, order.postorder().get(0));
        Assert.assertEquals("n0", order.postorder().get(size));
    }
}
