package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

public class P4TypeBool extends P4Type {
    public static final P4TypeBool INSTANCE = new P4TypeBool();

    private P4TypeBool() {
        super(SourcePositionRange.INVALID);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("bool");
    }
}
