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
import org.dflow.util.Utilities;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** The evaluation order of the identifiers of a component.
 * For every weight 0 edge 'a -> b' between scheduled identifiers, 'b' comes before 'a'.
 * The schedule also describes which identifiers can be evaluated concurrently. */
public class Schedule {
    public final ImmutableList<Integer> order;
    /** Identifiers grouped by level: the dependencies of an identifier are all on lower levels,
     * so the identifiers of one level are independent of each other. */
    public final ImmutableList<ImmutableList<Integer>> partition;
    /** Weight 0 dependencies between scheduled identifiers */
    final ImmutableSetMultimap<Integer, Integer> dependencies;
    final Map<Integer, Integer> position;

    Schedule(List<Integer> order, List<ImmutableList<Integer>> partition,
             ImmutableSetMultimap<Integer, Integer> dependencies) {
        this.order = ImmutableList.copyOf(order);
        this.partition = ImmutableList.copyOf(partition);
        this.dependencies = dependencies;
        this.position = new HashMap<>();
        for (int i = 0; i < order.size(); i++)
            this.position.put(order.get(i), i);
    }

    public int size() {
        return this.order.size();
    }

    public boolean contains(int id) {
        return this.position.containsKey(id);
    }

    public int getPosition(int id) {
        return Utilities.getExists(this.position, id);
    }

    public Set<Integer> getDependencies(int id) {
        return this.dependencies.get(id);
    }

    /** True if 'from' depends on 'to' through weight 0 edges. */
    public boolean reaches(int from, int to) {
        Set<Integer> visited = new HashSet<>();
        Deque<Integer> work = new ArrayDeque<>();
        work.push(from);
        while (!work.isEmpty()) {
            int current = work.pop();
            for (int dep: this.dependencies.get(current)) {
                if (dep == to)
                    return true;
                if (visited.add(dep))
                    work.push(dep);
            }
        }
        return false;
    }

    /** True if the two identifiers can be evaluated in any order, or concurrently. */
    public boolean areIndependent(int left, int right) {
        if (left == right)
            return false;
        return !this.reaches(left, right) && !this.reaches(right, left);
    }

    @Override
    public String toString() {
        return this.order + " " + this.partition;
    }
}
