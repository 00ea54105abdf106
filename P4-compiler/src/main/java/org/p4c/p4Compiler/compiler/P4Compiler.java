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

package org.p4c.p4Compiler.compiler;

import org.p4c.p4Compiler.compiler.visitors.inner.ReferenceMap;
import org.p4c.p4Compiler.compiler.visitors.inner.TypeMap;
import org.p4c.p4Compiler.compiler.visitors.simplify.SimplifyExpressions;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.util.IWritesLogs;
import org.p4c.util.Logger;

import java.util.Map;

/** Holds the state shared by all passes that process one program:
 * the options, the reference map, and the type map. */
public class P4Compiler implements IWritesLogs {
    public final CompilerOptions options;
    final ReferenceMap refMap;
    final TypeMap typeMap;

    public P4Compiler(CompilerOptions options) {
        this.options = options;
        this.refMap = new ReferenceMap();
        this.typeMap = new TypeMap();
        if (options.ioOptions.verbosity > 0)
            Logger.INSTANCE.setLoggingLevel(P4Compiler.class, options.ioOptions.verbosity);
        for (Map.Entry<String, String> entry: options.ioOptions.loggingLevel.entrySet()) {
            int level = Integer.parseInt(entry.getValue());
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), level);
        }
    }

    public P4Compiler() {
        this(CompilerOptions.getDefault());
    }

    public ReferenceMap getReferenceMap() {
        return this.refMap;
    }

    public TypeMap getTypeMap() {
        return this.typeMap;
    }

    /** Rewrite all expressions in a program into sequences of simple statements. */
    public P4Program simplifyExpressions(P4Program program) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Simplifying expressions in program ")
                .append(program.id)
                .newline();
        SimplifyExpressions simplify = new SimplifyExpressions(this);
        IP4Node result = simplify.apply(program);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Simplified program")
                .newline()
                .appendSupplier(result::toString)
                .newline();
        return result.to(P4Program.class);
    }
}
