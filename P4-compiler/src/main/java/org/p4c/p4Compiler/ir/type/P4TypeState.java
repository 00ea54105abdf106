package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

/** Type of a parser transition. */
public class P4TypeState extends P4Type {
    public static final P4TypeState INSTANCE = new P4TypeState();

    private P4TypeState() {
        super(SourcePositionRange.INVALID);
    }

    @Override
    public boolean isDeclarable() {
        return false;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("state");
    }
}
