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

package org.p4c.util;

import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;

import java.util.HashMap;
import java.util.Map;

/** Per-class debug logging for the compiler passes.
 * A message is written only when the level of the logging class is at least
 * the level of the message.  A level set for a class also applies to its subclasses. */
public class Logger {
    /** Packages searched when a level is set by simple class name. */
    static final String[] PACKAGES = {
            "org.p4c.p4Compiler.compiler",
            "org.p4c.p4Compiler.compiler.visitors.inner",
            "org.p4c.p4Compiler.compiler.visitors.simplify",
    };

    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    private final Map<Class<?>, Integer> levels;
    private final IndentStream debugStream;
    private final IIndentStream discard;

    private Logger() {
        this.levels = new HashMap<>();
        this.debugStream = new IndentStream(System.err);
        this.discard = new NullIndentStream();
    }

    /** The stream for a message of the given level written by a class.
     * Messages above the level of the class go nowhere. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        return this.getLoggingLevel(clazz) >= level ? this.debugStream : this.discard;
    }

    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** @return Previous logging level of the class. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        Integer previous = this.levels.put(clazz, level);
        return previous == null ? 0 : previous;
    }

    /** Set the logging level of a class given by its simple name, as in '-T DismantleExpression=2'.
     * @return Previous logging level of the class. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        return this.setLoggingLevel(this.locateClass(className), level);
    }

    Class<?> locateClass(String className) {
        for (String pack: PACKAGES) {
            try {
                return Class.forName(pack + "." + className);
            } catch (ClassNotFoundException ex) {
                // not in this package
            }
        }
        throw new InternalCompilerError("Class " + className + " not found for setting up logging");
    }

    /** The level of the class, or of its closest superclass with a level. */
    public int getLoggingLevel(Class<?> clazz) {
        for (Class<?> c = clazz; c != null; c = c.getSuperclass()) {
            Integer level = this.levels.get(c);
            if (level != null)
                return level;
        }
        return 0;
    }

    /** Turn off logging for all classes. */
    public void reset() {
        this.levels.clear();
    }

    /** Where logging should be redirected.
     * Notice that the indentation is *not* reset when the stream is changed.
     * @return The previous stream. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
