package org.p4c.p4Compiler.ir.expression.literal;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.IExpressionFunction;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.p4Compiler.ir.type.P4TypeBits;
import org.p4c.p4Compiler.ir.type.P4TypeInfInt;
import org.p4c.util.IIndentStream;

import java.math.BigInteger;

/** An integer constant.  The type is either fixed-width or the infinite-precision int. */
public class P4IntLiteral extends P4Literal {
    public final BigInteger value;

    public P4IntLiteral(SourcePositionRange position, P4Type type, BigInteger value) {
        super(position, type);
        this.value = value;
        if (!type.is(P4TypeBits.class) && !type.is(P4TypeInfInt.class))
            this.error("Unexpected type for integer literal " + type);
    }

    public P4IntLiteral(P4Type type, long value) {
        this(SourcePositionRange.INVALID, type, BigInteger.valueOf(value));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4IntLiteral o = other.as(P4IntLiteral.class);
        if (o == null)
            return false;
        return this.value.equals(o.value) && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        P4TypeBits bits = this.type.as(P4TypeBits.class);
        if (bits != null)
            builder.append(bits.width)
                    .append(bits.signed ? "s" : "w");
        return builder.append(this.value.toString());
    }
}
