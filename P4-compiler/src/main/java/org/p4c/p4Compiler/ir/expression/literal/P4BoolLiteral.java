package org.p4c.p4Compiler.ir.expression.literal;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.IExpressionFunction;
import org.p4c.p4Compiler.ir.type.P4TypeBool;
import org.p4c.util.IIndentStream;

public class P4BoolLiteral extends P4Literal {
    public final boolean value;

    public P4BoolLiteral(SourcePositionRange position, boolean value) {
        super(position, P4TypeBool.INSTANCE);
        this.value = value;
    }

    public P4BoolLiteral(boolean value) {
        this(SourcePositionRange.INVALID, value);
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
        P4BoolLiteral o = other.as(P4BoolLiteral.class);
        if (o == null)
            return false;
        return this.value == o.value;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.value);
    }
}
