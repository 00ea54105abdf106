package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

/** Conditional expression: condition ? ifTrue : ifFalse */
public class P4MuxExpression extends P4Expression {
    public final P4Expression condition;
    public final P4Expression ifTrue;
    public final P4Expression ifFalse;

    public P4MuxExpression(SourcePositionRange position, P4Type type, P4Expression condition,
                           P4Expression ifTrue, P4Expression ifFalse) {
        super(position, type);
        this.condition = condition;
        this.ifTrue = ifTrue;
        this.ifFalse = ifFalse;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.condition.accept(visitor);
        this.ifTrue.accept(visitor);
        this.ifFalse.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

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
        P4MuxExpression o = other.as(P4MuxExpression.class);
        if (o == null)
            return false;
        return this.condition == o.condition &&
                this.ifTrue == o.ifTrue &&
                this.ifFalse == o.ifFalse &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        infixOperand(builder, this.condition).append(" ? ");
        infixOperand(builder, this.ifTrue).append(" : ");
        return infixOperand(builder, this.ifFalse);
    }
}
