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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSetMultimap;
import org.dflow.nodeCompiler.compiler.errors.InternalCompilerError;
import org.dflow.nodeCompiler.ir.SymbolTable;
import org.dflow.util.IIndentStream;
import org.dflow.util.IWritesLogs;
import org.dflow.util.Linq;
import org.dflow.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/** Computes a topological order of the identifiers using the weight 0 edges only.
 * Among the identifiers that are ready, the one that comes first in the
 * declaration order is scheduled first, so the result depends only on the
 * graph and on the declaration order.  Contract edges are never consulted. */
public class Scheduler implements IWritesLogs {
    final SymbolTable symbols;

    public Scheduler(SymbolTable symbols) {
        this.symbols = symbols;
    }

    /** Schedule the identifiers in 'declarationOrder'; edges to other identifiers are ignored.
     * @throws InternalCompilerError if the weight 0 edges form a cycle. */
    public Schedule schedule(DependencyGraph graph, List<Integer> declarationOrder) {
        List<Integer> ids = new ArrayList<>(new LinkedHashSet<>(declarationOrder));
        Map<Integer, Integer> index = new HashMap<>();
        for (int i = 0; i < ids.size(); i++)
            index.put(ids.get(i), i);

        ImmutableSetMultimap.Builder<Integer, Integer> depBuilder = ImmutableSetMultimap.builder();
        Map<Integer, List<Integer>> dependents = new HashMap<>();
        Map<Integer, Integer> waiting = new HashMap<>();
        for (int id: ids) {
            int count = 0;
            for (int dep: graph.getZeroSuccessors(id)) {
                if (!index.containsKey(dep))
                    continue;
                if (dep == id)
                    throw new InternalCompilerError("Scheduling a cyclic graph: " + this.symbols.getName(id));
                depBuilder.put(id, dep);
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(id);
                count++;
            }
            waiting.put(id, count);
        }
        ImmutableSetMultimap<Integer, Integer> dependencies = depBuilder.build();

        PriorityQueue<Integer> ready = new PriorityQueue<>(
                (left, right) -> Integer.compare(index.get(left), index.get(right)));
        for (int id: ids)
            if (waiting.get(id) == 0)
                ready.add(id);
        List<Integer> order = new ArrayList<>();
        Map<Integer, Integer> level = new HashMap<>();
        int maxLevel = -1;
        while (!ready.isEmpty()) {
            int id = ready.poll();
            order.add(id);
            int myLevel = 0;
            for (int dep: dependencies.get(id))
                myLevel = Math.max(myLevel, level.get(dep) + 1);
            level.put(id, myLevel);
            maxLevel = Math.max(maxLevel, myLevel);
            for (int dependent: dependents.getOrDefault(id, List.of())) {
                int left = waiting.get(dependent) - 1;
                waiting.put(dependent, left);
                if (left == 0)
                    ready.add(dependent);
            }
        }
        if (order.size() != ids.size()) {
            List<Integer> stuck = Linq.where(ids, id -> !level.containsKey(id));
            throw new InternalCompilerError("Scheduling a cyclic graph: " +
                    Linq.map(stuck, this.symbols::getName));
        }

        List<List<Integer>> groups = new ArrayList<>();
        for (int i = 0; i <= maxLevel; i++)
            groups.add(new ArrayList<>());
        for (int id: order)
            groups.get(level.get(id)).add(id);
        List<ImmutableList<Integer>> partition = new ArrayList<>();
        for (List<Integer> group: groups)
            partition.add(ImmutableList.copyOf(group));

        Schedule result = new Schedule(order, partition, dependencies);
        IIndentStream log = Logger.INSTANCE.belowLevel(this, 1);
        log.append("Schedule: ")
                .join(", ", Linq.map(order, this.symbols::getName))
                .newline();
        for (ImmutableList<Integer> group: partition)
            log.append("Independent: ")
                    .join(", ", Linq.map(group, this.symbols::getName))
                    .newline();
        return result;
    }
}
