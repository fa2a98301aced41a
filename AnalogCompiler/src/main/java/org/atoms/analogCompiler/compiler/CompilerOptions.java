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

package org.atoms.analogCompiler.compiler;

import com.beust.jcommander.DynamicParameter;
import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import org.atoms.analogCompiler.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;

/** Options for the analog compiler */
@SuppressWarnings("CanBeFinal")
// These fields cannot be final, since JCommander writes them through reflection.
public class CompilerOptions {
    @DynamicParameter(names = "-T",
            description = "Specify logging level for a class (can be repeated)")
    public Map<String, String> loggingLevel = new HashMap<>();
    @Parameter(names = "--foldConstants",
            description = "Replace programs which are constant in time by their constant form")
    public boolean foldConstants = false;
    @Parameter(names = "--noThrow",
            description = "Report errors instead of throwing them")
    public boolean noThrow = false;
    @Parameter(names = "--quiet", description = "Do not show warnings")
    public boolean quiet = false;

    public CompilerOptions() {}

    public static CompilerOptions getDefault() {
        return new CompilerOptions();
    }

    /** Parse options from a command line. */
    public static CompilerOptions fromArgs(String... args) {
        CompilerOptions options = new CompilerOptions();
        JCommander commander = JCommander.newBuilder()
                .addObject(options)
                .build();
        commander.setProgramName("analog-compiler");
        try {
            commander.parse(args);
        } catch (ParameterException ex) {
            throw new CompilationError("Invalid options: " + ex.getMessage());
        }
        return options;
    }

    public boolean throwOnError() {
        return !this.noThrow;
    }

    @Override
    public String toString() {
        return "CompilerOptions{" +
                "\n\tloggingLevel=" + this.loggingLevel +
                ",\n\tfoldConstants=" + this.foldConstants +
                ",\n\tnoThrow=" + this.noThrow +
                ",\n\tquiet=" + this.quiet +
                '}';
    }
}
