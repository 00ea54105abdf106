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

package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.P4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

/** Base class for all expressions.  Every expression carries its static type;
 * left-value and constant flags are kept by the TypeMap. */
public abstract class P4Expression extends P4Node {
    public final P4Type type;

    protected P4Expression(SourcePositionRange position, P4Type type) {
        super(position);
        this.type = type;
    }

    public P4Type getType() {
        return this.type;
    }

    /** Dispatch to the function case handling this kind of expression. */
    public abstract <T> T accept(IExpressionFunction<T> function);

    /** True for expressions that print as infix operators. */
    public boolean isInfix() {
        return false;
    }

    /** True for expressions that never need parentheses. */
    public boolean isAtomic() {
        return true;
    }

    /** Print an operand of an infix operator. */
    protected static IIndentStream infixOperand(IIndentStream builder, P4Expression operand) {
        if (operand.isInfix())
            return builder.append("(").append(operand).append(")");
        return builder.append(operand);
    }

    /** Print an operand of a prefix operator or of a member access. */
    protected static IIndentStream prefixOperand(IIndentStream builder, P4Expression operand) {
        if (!operand.isAtomic())
            return builder.append("(").append(operand).append(")");
        return builder.append(operand);
    }
}
