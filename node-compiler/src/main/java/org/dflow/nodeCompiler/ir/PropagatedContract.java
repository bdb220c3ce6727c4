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

package org.dflow.nodeCompiler.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.dflow.util.IIndentStream;
import org.dflow.util.ToIndentableString;

import java.util.List;
import java.util.Map;

/** A contract term of an inlined callee, rewritten to use the caller identifiers.
 *
 * @param path       Call-site instances from the caller to the node which declared the term.
 * @param callee     Node which declared the term.
 * @param term       Term over the caller identifiers.
 * @param originalIds Maps each caller identifier in the term to the callee identifier it replaces.
 */
public record PropagatedContract(ImmutableList<String> path, String callee, DFContractTerm term,
                                 ImmutableMap<Integer, Integer> originalIds)
        implements ToIndentableString {
    public PropagatedContract(List<String> path, String callee, DFContractTerm term,
                              Map<Integer, Integer> originalIds) {
        this(ImmutableList.copyOf(path), callee, term, ImmutableMap.copyOf(originalIds));
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(String.join(".", this.path))
                .append(": ")
                .append(this.term);
    }
}
