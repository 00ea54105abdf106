package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

public class P4TypeInfInt extends P4Type {
    public static final P4TypeInfInt INSTANCE = new P4TypeInfInt();

    private P4TypeInfInt() {
        super(SourcePositionRange.INVALID);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("int");
    }
}
