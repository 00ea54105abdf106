package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.type.P4Type;

public class P4LOr extends P4ShortCircuitExpression {
    public P4LOr(SourcePositionRange position, P4Type type, P4Expression left, P4Expression right) {
        super(position, type, left, right);
    }

    @Override
    public P4Opcode getOpcode() {
        return P4Opcode.LOR;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.left.accept(visitor);
        this.right.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }
}
