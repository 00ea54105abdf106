package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

public class P4TypeVoid extends P4Type {
    public static final P4TypeVoid INSTANCE = new P4TypeVoid();

    private P4TypeVoid() {
        super(SourcePositionRange.INVALID);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("void");
    }
}
