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

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.dflow.nodeCompiler.compiler.IHasSourceRange;

/** A range of bytes inside one source file.
 * Files are identified by the small integer that {@link SourceFiles} assigns them;
 * the range is half-open: [start, end). */
public class SourceRange implements IHasSourceRange {
    public final int fileId;
    public final int start;
    public final int end;

    public static final SourceRange INVALID = new SourceRange(-1, 0, 0);

    public SourceRange(int fileId, int start, int end) {
        this.fileId = fileId;
        this.start = start;
        this.end = end;
    }

    public boolean isValid() {
        return this.fileId >= 0 && this.start <= this.end;
    }

    @Override
    public SourceRange getSourceRange() {
        return this;
    }

    /** Merge two ranges of the same file by creating a range that spans both. */
    public SourceRange merge(SourceRange other) {
        if (!this.isValid())
            return other;
        if (!other.isValid() || other.fileId != this.fileId)
            return this;
        return new SourceRange(this.fileId, Math.min(this.start, other.start), Math.max(this.end, other.end));
    }

    /** Append the position information to a JSON node */
    public void appendAsJson(ObjectNode parent) {
        parent.put("file", this.fileId);
        parent.put("start", this.start);
        parent.put("end", this.end);
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        SourceRange that = (SourceRange) o;
        return this.fileId == that.fileId && this.start == that.start && this.end == that.end;
    }

    @Override
    public int hashCode() {
        int result = this.fileId;
        result = 31 * result + this.start;
        result = 31 * result + this.end;
        return result;
    }

    @Override
    public String toString() {
        if (!this.isValid())
            return "?";
        return this.fileId + ":" + this.start + "-" + this.end;
    }
}
