package org.p4c.p4Compiler.compiler.errors;

import org.p4c.p4Compiler.ir.IP4Node;

import javax.annotation.Nullable;

/** Exception thrown when the compiler encounters a code
 * construct that is not yet fully implemented.  This is a legal construct,
 * and the compiler should eventually support it. */
public class UnimplementedException extends BaseCompilerException {
    @Nullable
    public final IP4Node p4Node;

    public static final String KIND = "Not yet implemented";

    public UnimplementedException() {
        this(KIND);
    }

    public UnimplementedException(String message) {
        super(message, SourcePositionRange.INVALID);
        this.p4Node = null;
    }

    public UnimplementedException(String message, IP4Node node) {
        super(message + " " + node.getClass().getSimpleName() + ":" + node,
                node.getPositionRange());
        this.p4Node = node;
    }

    @Override
    public String getErrorKind() {
        return KIND;
    }
}
