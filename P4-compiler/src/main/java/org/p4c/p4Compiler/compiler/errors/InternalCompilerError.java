package org.p4c.p4Compiler.compiler.errors;

import org.p4c.p4Compiler.ir.IP4Node;

import javax.annotation.Nullable;

/** Signals a bug in the compiler -- some expected invariant doesn't hold. */
public final class InternalCompilerError extends BaseCompilerException {
    @Nullable
    public final IP4Node p4Node;

    public InternalCompilerError(String message) {
        super(message, SourcePositionRange.INVALID);
        this.p4Node = null;
    }

    public InternalCompilerError(String message, IP4Node node) {
        super(message + " " + node, node.getPositionRange());
        this.p4Node = node;
    }

    public InternalCompilerError(String message, SourcePositionRange position) {
        super(message, position);
        this.p4Node = null;
    }

    @Override
    public String getErrorKind() {
        return "Compiler error";
    }
}
