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

package org.atoms.util;

import org.atoms.analogCompiler.compiler.errors.CompilationError;

import java.util.LinkedHashMap;
import java.util.Map;

/** Logging class which can output nicely indented strings.
 *
 * <p>Levels are set by the simple name of a class which writes logs.  A level
 * set on a class also applies to its subclasses, unless they have their own:
 * setting it on a visitor base class turns on logging in every visitor.
 * Only classes which were registered with {@link #instrument} can be named
 * on the command line. */
public class Logger {
    /** Level of each class, by simple name. */
    private final Map<String, Integer> loggingLevel = new LinkedHashMap<>();
    /** Classes which can be named when setting levels, by simple name. */
    private final Map<String, Class<? extends IWritesLogs>> instrumented = new LinkedHashMap<>();
    private final IndentStream debugStream;
    private final IIndentStream noStream;

    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    private Logger() {
        this.debugStream = new IndentStream(System.err);
        this.noStream = new NullIndentStream();
    }

    /** Make these classes addressable by name in {@link #setLoggingLevel(String, int)}. */
    @SafeVarargs
    public final void instrument(Class<? extends IWritesLogs>... classes) {
        for (Class<? extends IWritesLogs> clazz: classes)
            this.instrumented.put(clazz.getSimpleName(), clazz);
    }

    /** Get the logging stream for messages below this logging level.
     * @param module  Module which does the logging.
     * @param level   Level of message that is being logged.
     * @return        A stream where the message can be appended. */
    public IIndentStream belowLevel(IWritesLogs module, int level) {
        if (this.getLoggingLevel(module.getClass()) >= level)
            return this.debugStream;
        return this.noStream;
    }

    /** The level of the closest class in the superclass chain which has one. */
    public int getLoggingLevel(Class<?> clazz) {
        if (this.loggingLevel.isEmpty())
            return 0;
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.loggingLevel.get(c.getSimpleName());
            if (level != null)
                return level;
        }
        return 0;
    }

    /** Debug level is controlled per class and can be changed dynamically.
     * @return Previous logging level for this class. */
    public int setLoggingLevel(Class<? extends IWritesLogs> clazz, int level) {
        Integer previous = this.loggingLevel.put(clazz.getSimpleName(), level);
        return previous == null ? 0 : previous;
    }

    /** Set the level of an instrumented class given by its simple name.
     * @return Previous logging level for this class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<? extends IWritesLogs> clazz = this.instrumented.get(className);
        if (clazz == null)
            throw new CompilationError("Class " + className + " not found for setting up logging; known classes are "
                    + this.instrumented.keySet());
        return this.setLoggingLevel(clazz, level);
    }

    /** Where logging should be redirected.
     * Notice that the indentation is *not* reset when the stream is changed. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
