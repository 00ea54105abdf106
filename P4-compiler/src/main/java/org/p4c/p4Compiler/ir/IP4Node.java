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

import org.p4c.p4Compiler.compiler.IHasSourcePositionRange;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.util.ICastable;
import org.p4c.util.IHasId;
import org.p4c.util.ToIndentableString;

import javax.annotation.Nullable;

/** A node of the P4 IR.  Nodes are immutable; rewriting passes build new nodes. */
public interface IP4Node extends ICastable, IHasId, ToIndentableString, IHasSourcePositionRange {
    void accept(InnerVisitor visitor);

    /** True if the other node has the same class and its fields are the same objects. */
    boolean sameFields(IP4Node other);

    default <T> T checkNull(@Nullable T value) {
        if (value == null)
            throw new InternalCompilerError("Did not expect a null value", this);
        return value;
    }

    default void error(String message) {
        throw new InternalCompilerError(message, this);
    }
}
