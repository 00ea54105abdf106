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

import org.p4c.p4Compiler.compiler.IHasSourcePositionRange;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;

import javax.annotation.Nullable;

/** Checked casts for the IR and compiler components.
 * A failed {@link #to} is a compiler bug; it is reported at the position of the
 * object, when the object has one. */
public interface ICastable {
    @Nullable
    default <T> T as(Class<T> clazz) {
        return ICastable.as(this, clazz);
    }

    @Nullable
    static <T> T as(@Nullable Object obj, Class<T> clazz) {
        return clazz.isInstance(obj) ? clazz.cast(obj) : null;
    }

    default <T> T to(Class<T> clazz) {
        if (!this.is(clazz)) {
            SourcePositionRange position = this instanceof IHasSourcePositionRange located ?
                    located.getPositionRange() : SourcePositionRange.INVALID;
            throw new InternalCompilerError("Expected a " + clazz.getSimpleName() +
                    ", got " + this.getClass().getSimpleName() + " " + this, position);
        }
        return clazz.cast(this);
    }

    default boolean is(Class<?> clazz) {
        return clazz.isInstance(this);
    }
}
