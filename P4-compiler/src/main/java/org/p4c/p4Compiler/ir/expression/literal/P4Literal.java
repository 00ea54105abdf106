package org.p4c.p4Compiler.ir.expression.literal;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.type.P4Type;

public abstract class P4Literal extends P4Expression {
    protected P4Literal(SourcePositionRange position, P4Type type) {
        super(position, type);
    }
}
