package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

/** Logical and/or: the right operand is evaluated only when
 * the left operand does not determine the result. */
public abstract class P4ShortCircuitExpression extends P4Expression {
    public final P4Expression left;
    public final P4Expression right;

    protected P4ShortCircuitExpression(SourcePositionRange position, P4Type type,
                                       P4Expression left, P4Expression right) {
        super(position, type);
        this.left = left;
        this.right = right;
    }

    public abstract P4Opcode getOpcode();

    @Override
    public boolean isInfix() {
        return true;
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public boolean sameFields(IP4Node other) {
        if (other.getClass() != this.getClass())
            return false;
        P4ShortCircuitExpression o = other.to(P4ShortCircuitExpression.class);
        return this.left == o.left &&
                this.right == o.right &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        infixOperand(builder, this.left)
                .append(" ")
                .append(this.getOpcode().toString())
                .append(" ");
        return infixOperand(builder, this.right);
    }
}
