package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

/** A type parameter of a generic method. */
public class P4TypeVar extends P4Type {
    public final String name;

    public P4TypeVar(SourcePositionRange position, String name) {
        super(position);
        this.name = name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }
}
