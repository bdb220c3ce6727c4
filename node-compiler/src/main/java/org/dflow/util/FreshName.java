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

package org.dflow.util;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/** Generates names that do not collide with a set of names already in use.
 * Generated names have the shape prefix, prefix_0, prefix_1, ... */
public class FreshName {
    final Set<String> used;
    /** Next suffix to try for each prefix, so repeated requests do not rescan. */
    final Map<String, Integer> nextSuffix;

    /** @param used Names already in use; generated names are added to this set. */
    public FreshName(Set<String> used) {
        this.used = used;
        this.nextSuffix = new HashMap<>();
    }

    /** Reserve a name that is known to be in use. */
    public void reserve(String name) {
        this.used.add(name);
    }

    /** Generate a fresh name starting with the specified prefix and remember it. */
    public String freshName(String prefix) {
        String name = prefix;
        int counter = this.nextSuffix.getOrDefault(prefix, 0);
        while (this.used.contains(name)) {
            name = prefix + "_" + counter;
            counter++;
        }
        this.nextSuffix.put(prefix, counter);
        this.used.add(name);
        return name;
    }
}
