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

package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.util.IWritesLogs;
import org.p4c.util.Linq;
import org.p4c.util.Logger;

import java.util.List;

/** Applies multiple other inner visitors in sequence. */
public class InnerPasses implements IWritesLogs, IRTransform {
    public final List<IRTransform> passes;

    public InnerPasses(IRTransform... passes) {
        this(Linq.list(passes));
    }

    public InnerPasses(List<IRTransform> passes) {
        this.passes = passes;
    }

    public void add(IRTransform pass) {
        this.passes.add(pass);
    }

    @Override
    public IP4Node apply(IP4Node node) {
        for (IRTransform pass: this.passes) {
            Logger.INSTANCE.belowLevel(this, 1)
                    .append("Executing ")
                    .appendSupplier(pass::toString)
                    .newline();
            node = pass.apply(node);
            IP4Node result = node;
            Logger.INSTANCE.belowLevel(this, 3)
                    .append("After ")
                    .appendSupplier(pass::toString)
                    .newline()
                    .appendSupplier(result::toString)
                    .newline();
        }
        return node;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + this.passes;
    }
}
