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

package org.p4c.p4Compiler.ir;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IndentStream;
import org.p4c.util.IndentStreamBuilder;

/** Base class for all P4 IR nodes. */
public abstract class P4Node implements IP4Node {
    static long crtId = 0;
    public final long id;
    /** Position of the source code that produced this node. */
    public final SourcePositionRange position;

    protected P4Node(SourcePositionRange position) {
        this.position = position;
        this.id = crtId++;
    }

    /** Do not call this method!
     * It is only used for testing. */
    public static void reset() {
        crtId = 0;
    }

    @Override
    public long getId() {
        return this.id;
    }

    @Override
    public SourcePositionRange getPositionRange() {
        return this.position;
    }

    @Override
    public String toString() {
        IndentStream stream = new IndentStreamBuilder();
        this.toString(stream);
        return stream.toString();
    }
}
