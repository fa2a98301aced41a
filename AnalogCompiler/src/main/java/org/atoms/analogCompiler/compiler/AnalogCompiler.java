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

import org.atoms.analogCompiler.compiler.errors.BaseCompilerException;
import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.atoms.analogCompiler.compiler.errors.CompilerMessages;
import org.atoms.analogCompiler.compiler.frontend.Parser;
import org.atoms.analogCompiler.compiler.frontend.builder.Builder;
import org.atoms.analogCompiler.compiler.backend.ToJsonInnerVisitor;
import org.atoms.analogCompiler.compiler.backend.ToJsonOuterVisitor;
import org.atoms.analogCompiler.compiler.visitors.inner.CollectVariables;
import org.atoms.analogCompiler.compiler.visitors.inner.IsConstantWaveform;
import org.atoms.analogCompiler.compiler.visitors.inner.WaveformVisitor;
import org.atoms.analogCompiler.compiler.visitors.outer.AnalogCircuitVisitor;
import org.atoms.analogCompiler.compiler.visitors.outer.IsConstantAnalogCircuit;
import org.atoms.analogCompiler.compiler.visitors.outer.ScanVariables;
import org.atoms.analogCompiler.ir.routine.Parameters;
import org.atoms.util.IWritesLogs;
import org.atoms.util.Logger;

import javax.annotation.Nullable;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/** Compiles builder chains into programs, according to the options. */
public class AnalogCompiler implements IWritesLogs {
    public final CompilerOptions options;
    public final CompilerMessages messages;
    final Parser parser;

    static {
        // Classes which can be named by -T options
        Logger.INSTANCE.instrument(
                AnalogCompiler.class, Parser.class,
                WaveformVisitor.class, CollectVariables.class, IsConstantWaveform.class,
                AnalogCircuitVisitor.class, ScanVariables.class, IsConstantAnalogCircuit.class,
                ToJsonInnerVisitor.class, ToJsonOuterVisitor.class);
    }

    public AnalogCompiler(CompilerOptions options) {
        this.options = options;
        this.messages = new CompilerMessages();
        this.parser = new Parser();
        this.setLoggingLevels();
    }

    void setLoggingLevels() {
        for (Map.Entry<String, String> entry: this.options.loggingLevel.entrySet()) {
            try {
                int level = Integer.parseInt(entry.getValue());
                Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
            } catch (NumberFormatException ex) {
                this.messages.reportError(new CompilationError(
                        "-T option must be followed by 'class=number'; could not parse " + entry));
            } catch (CompilationError ex) {
                this.messages.reportError(ex);
            }
        }
    }

    /** Compile a builder chain.
     * @return The program, or null if it has errors and errors are not thrown. */
    @Nullable
    public CompiledProgram compile(Builder builder) {
        try {
            CompiledProgram program = this.parser.parse(builder);
            if (this.options.foldConstants)
                program = this.foldConstants(program);
            return program;
        } catch (BaseCompilerException ex) {
            this.messages.reportError(ex);
            if (this.options.throwOnError())
                throw ex;
            return null;
        }
    }

    /** Fold a program whose variables are all bound at compile time. */
    CompiledProgram foldConstants(CompiledProgram program) {
        Parameters parameters = program.parameters;
        if (parameters.batchSize() != 1 || !parameters.argsList.isEmpty()) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Not folding a program with batch or run-time arguments")
                    .newline();
            return program;
        }
        Map<String, BigDecimal> assignment = Parameters.scalarAssignment(parameters.batchAssignments().get(0));
        Set<String> missing = new HashSet<>(new ScanVariables().scan(program.circuit).scalarVariables());
        missing.removeAll(assignment.keySet());
        if (!missing.isEmpty()) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Not folding: unbound variables ")
                    .append(missing.toString())
                    .newline();
            return program;
        }
        return program.foldConstants(assignment);
    }

    public boolean hasErrors() {
        return this.messages.hasErrors();
    }

    public void showMessages(PrintStream stream) {
        this.messages.show(stream, this.options.quiet);
    }
}
