package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;

/** Field or method access: expr.member */
public class P4Member extends P4Expression {
    public final P4Expression expr;
    public final String member;

    public P4Member(SourcePositionRange position, P4Type type, P4Expression expr, String member) {
        super(position, type);
        this.expr = expr;
        this.member = member;
    }

    @CheckReturnValue
    public P4Member replaceSource(P4Expression expr) {
        if (expr == this.expr)
            return this;
        return new P4Member(this.position, this.type, expr, this.member);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expr.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Member o = other.as(P4Member.class);
        if (o == null)
            return false;
        return this.expr == o.expr &&
                this.member.equals(o.member) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return prefixOperand(builder, this.expr)
                .append(".")
                .append(this.member);
    }
}
