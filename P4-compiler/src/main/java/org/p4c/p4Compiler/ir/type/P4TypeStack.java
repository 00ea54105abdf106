package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

/** A header stack H[size]. */
public class P4TypeStack extends P4Type {
    public final P4Type elementType;
    public final int size;

    public P4TypeStack(SourcePositionRange position, P4Type elementType, int size) {
        super(position);
        this.elementType = elementType;
        this.size = size;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.elementType)
                .append("[")
                .append(this.size)
                .append("]");
    }
}
