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

package org.dflow.nodeCompiler.compiler.errors;

import org.dflow.nodeCompiler.compiler.IHasSourceRange;

import javax.annotation.Nullable;
import java.util.List;

/** Base class for exceptions which are thrown by the compiler. */
public abstract class BaseCompilerException
        extends RuntimeException
        implements IHasSourceRange {
    public final SourceRange range;

    protected BaseCompilerException(String message, SourceRange range, @Nullable Throwable throwable) {
        super(message, throwable);
        this.range = range;
    }

    protected BaseCompilerException(String message, SourceRange range) {
        this(message, range, null);
    }

    @Override
    public SourceRange getSourceRange() {
        return this.range;
    }

    public abstract ErrorKind getErrorKind();

    /** Additional structured information, e.g. the identifiers on a cycle. */
    public List<String> getDetails() {
        return List.of();
    }
}
