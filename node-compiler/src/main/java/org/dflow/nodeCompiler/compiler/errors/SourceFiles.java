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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** The source files of a program, indexed by the file ids used in {@link SourceRange}.
 * Contents are optional; when present they are used to show the text of a range. */
public class SourceFiles {
    static class File {
        final String name;
        final byte[] contents;

        File(String name, byte[] contents) {
            this.name = name;
            this.contents = contents;
        }
    }

    final List<File> files;

    public SourceFiles() {
        this.files = new ArrayList<>();
    }

    /** Register a file and return its id. */
    public int addFile(String name, String contents) {
        this.files.add(new File(name, contents.getBytes(StandardCharsets.UTF_8)));
        return this.files.size() - 1;
    }

    public int addFile(String name) {
        return this.addFile(name, "");
    }

    public int size() {
        return this.files.size();
    }

    public String getSourceFileName(SourceRange range) {
        if (range.fileId < 0 || range.fileId >= this.files.size())
            return "<unknown>";
        return this.files.get(range.fileId).name;
    }

    /** The source text of a range, or an empty string if unknown. */
    public String getFragment(SourceRange range) {
        if (!range.isValid() || range.fileId >= this.files.size())
            return "";
        byte[] contents = this.files.get(range.fileId).contents;
        if (range.end > contents.length)
            return "";
        return new String(contents, range.start, range.end - range.start, StandardCharsets.UTF_8);
    }
}
