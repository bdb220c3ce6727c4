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

package org.dflow.nodeCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.nodeCompiler.compiler.inlining.InlinePolicy;
import org.dflow.util.IValidate;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/** Command-line options for the node compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions implements IValidate {
    /** Options related to the language compiled. */
    @SuppressWarnings("CanBeFinal")
    public static class Language implements IValidate {
        @Parameter(names = "--inline",
                description = "Which node calls are inlined: 'all', or only the calls 'needed' to break a cycle")
        public String inline = "all";
        /** Useful for development */
        public boolean throwOnError = false;

        public InlinePolicy getInlinePolicy() {
            return InlinePolicy.fromString(this.inline);
        }

        @Override
        public boolean validate(IErrorReporter reporter) {
            if (!this.inline.equals("all") && !this.inline.equals("needed")) {
                reporter.reportError(SourceRange.INVALID, ErrorKind.IO_ERROR,
                        "Option --inline must be 'all' or 'needed', not " + Utilities.singleQuote(this.inline));
                return false;
            }
            return true;
        }

        @Override
        public String toString() {
            return "Language{" +
                    "\n\tinline=" + this.inline +
                    ",\n\tthrowOnError=" + this.throwOnError +
                    '}';
        }
    }

    /** Options related to input and output. */
    @SuppressWarnings("CanBeFinal")
    public static class IO implements IValidate {
        @DynamicParameter(names = "-T",
                description = "Specify logging level for a class (can be repeated)")
        public Map<String, String> loggingLevel = new HashMap<>();
        @Parameter(names = "-o", description = "Artifact output file; stdout if not specified")
        public String outputFile = "";
        @Parameter(names = "--errors", description = "Error output file; stderr if not specified")
        public String errorFile = "";
        @Parameter(names = "--json", description = "Emit error messages as a JSON array to the error output")
        public boolean emitJsonErrors = false;
        @Parameter(names = "-q", description = "Quiet: do not print warnings")
        public boolean quiet = false;
        @Parameter(description = "Typed program to compile, in JSON; stdin if not specified")
        @Nullable
        public String inputFile = null;

        @Override
        public boolean validate(IErrorReporter reporter) {
            return true;
        }

        @Override
        public String toString() {
            return "IO{" +
                    "\n\toutputFile=" + Utilities.singleQuote(this.outputFile) +
                    ",\n\terrorFile=" + Utilities.singleQuote(this.errorFile) +
                    ",\n\temitJsonErrors=" + this.emitJsonErrors +
                    ",\n\tquiet=" + this.quiet +
                    ",\n\tinputFile=" + Utilities.singleQuote(this.inputFile) +
                    ",\n\tloggingLevel=" + this.loggingLevel +
                    '}';
        }
    }

    @Parameter(names = {"-h", "--help", "-?"}, help = true, description = "Show this message and exit")
    public boolean help;

    @ParametersDelegate
    public IO ioOptions = new IO();

    @ParametersDelegate
    public Language languageOptions = new Language();

    @Override
    public boolean validate(IErrorReporter reporter) {
        return this.ioOptions.validate(reporter) && this.languageOptions.validate(reporter);
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "help=" + this.help +
                ", ioOptions=" + this.ioOptions +
                ", languageOptions=" + this.languageOptions +
                '}';
    }
}
