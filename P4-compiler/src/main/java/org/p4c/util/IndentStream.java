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

import java.io.IOException;
import java.io.UncheckedIOException;

/** An {@link IIndentStream} writing to an {@link Appendable}.
 * The indentation of a line is written before its first non-space character,
 * so empty lines carry no trailing spaces. */
public class IndentStream implements IIndentStream {
    static final int SPACES_PER_LEVEL = 4;

    private Appendable stream;
    int depth = 0;
    String indent = "";
    boolean atLineStart = false;

    public IndentStream(Appendable appendable) {
        this.stream = appendable;
    }

    /** Set the output stream.
     * @return The previous output stream. */
    public Appendable setOutputStream(Appendable appendable) {
        Appendable result = this.stream;
        this.stream = appendable;
        return result;
    }

    void setDepth(int depth) {
        Utilities.enforce(depth >= 0, "Negative indent");
        this.depth = depth;
        this.indent = " ".repeat(depth * SPACES_PER_LEVEL);
    }

    void write(CharSequence data) {
        try {
            this.stream.append(data);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    void startLine() {
        if (this.atLineStart) {
            this.atLineStart = false;
            this.write(this.indent);
        }
    }

    @Override
    public IIndentStream appendChar(char c) {
        if (c == '\n') {
            this.write("\n");
            this.atLineStart = true;
        } else {
            if (!Character.isSpaceChar(c))
                this.startLine();
            this.write(String.valueOf(c));
        }
        return this;
    }

    @Override
    public IIndentStream appendFast(String string) {
        if (!string.isEmpty()) {
            this.startLine();
            this.write(string);
        }
        return this;
    }

    @Override
    public IIndentStream increase() {
        this.setDepth(this.depth + 1);
        return this.newline();
    }

    @Override
    public IIndentStream decrease() {
        this.setDepth(this.depth - 1);
        return this;
    }

    @Override
    public String toString() {
        return this.stream.toString();
    }
}
