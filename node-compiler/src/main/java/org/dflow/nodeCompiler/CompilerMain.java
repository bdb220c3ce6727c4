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

package org.dflow.nodeCompiler;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import org.dflow.nodeCompiler.compiler.CompilerOptions;
import org.dflow.nodeCompiler.compiler.backend.ArtifactJsonWriter;
import org.dflow.nodeCompiler.compiler.errors.CompilationError;
import org.dflow.nodeCompiler.compiler.errors.CompilerMessages;
import org.dflow.nodeCompiler.compiler.errors.ErrorKind;
import org.dflow.nodeCompiler.compiler.errors.SourceFiles;
import org.dflow.nodeCompiler.compiler.errors.SourceRange;
import org.dflow.util.Logger;
import org.dflow.util.Utilities;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/** Main entry point of the node compiler. */
public class CompilerMain {
    final CompilerOptions options;

    CompilerMain() {
        this.options = new CompilerOptions();
    }

    void usage(JCommander commander) {
        commander.usage();
    }

    int parseOptions(String[] argv) {
        JCommander commander = JCommander.newBuilder()
                .addObject(this.options)
                .build();
        commander.setProgramName("dflow-compiler");
        try {
            commander.parse(argv);
        } catch (ParameterException ex) {
            System.err.println(ex.getMessage());
            return 1;
        }
        if (this.options.help) {
            this.usage(commander);
            return 1;
        }

        for (Map.Entry<String, String> entry: this.options.ioOptions.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                System.err.println("-T option must be followed by 'class=number'; could not parse " + entry);
                return 1;
            } catch (CompilationError ex) {
                System.err.println(ex.getMessage());
                return 1;
            }
        }
        return 0;
    }

    PrintStream getOutputStream() throws IOException {
        String outputFile = this.options.ioOptions.outputFile;
        if (outputFile.isEmpty())
            return System.out;
        return new PrintStream(Files.newOutputStream(Paths.get(outputFile)));
    }

    InputStream getInputFile(@Nullable String inputFile) throws IOException {
        if (inputFile == null)
            return System.in;
        return Files.newInputStream(Paths.get(inputFile));
    }

    /** Run compiler, return the messages produced. */
    CompilerMessages run() {
        NodeCompiler compiler = new NodeCompiler(this.options);
        if (!this.options.validate(compiler))
            return compiler.messages;
        try {
            InputStream input = this.getInputFile(this.options.ioOptions.inputFile);
            compiler.setEntireInput(this.options.ioOptions.inputFile, input);
        } catch (IOException e) {
            compiler.reportError(SourceRange.INVALID, ErrorKind.IO_ERROR,
                    "Error reading file " + Utilities.singleQuote(this.options.ioOptions.inputFile) +
                            " " + e.getMessage());
            return compiler.messages;
        }

        compiler.compileInput();
        if (compiler.hasErrors())
            return compiler.messages;
        try {
            PrintStream stream = this.getOutputStream();
            stream.println(new ArtifactJsonWriter().toJsonString(compiler.getArtifacts()));
            if (stream != System.out)
                stream.close();
        } catch (IOException e) {
            compiler.reportError(SourceRange.INVALID, ErrorKind.IO_ERROR,
                    "Error writing to output file: " + e.getMessage());
        }
        return compiler.messages;
    }

    /** Print the messages to the error file, or to stderr. */
    void showMessages(CompilerMessages messages) {
        String errorFile = this.options.ioOptions.errorFile;
        if (errorFile.isEmpty()) {
            messages.show(System.err);
            return;
        }
        try (PrintStream stream = new PrintStream(Files.newOutputStream(Paths.get(errorFile)))) {
            messages.show(stream);
        } catch (IOException e) {
            System.err.println("Error writing to " + Utilities.singleQuote(errorFile) + ": " + e.getMessage());
            messages.show(System.err);
        }
    }

    public static CompilerMessages execute(String... argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0) {
            // return empty messages
            CompilerMessages result = new CompilerMessages(new SourceFiles());
            result.exitCode = exitCode;
            return result;
        }
        return main.run();
    }

    public static void main(String[] argv) {
        CompilerMain main = new CompilerMain();
        int exitCode = main.parseOptions(argv);
        if (exitCode != 0)
            System.exit(exitCode);
        CompilerMessages messages = main.run();
        main.showMessages(messages);
        System.exit(messages.exitCode);
    }
}
