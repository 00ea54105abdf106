package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;

/** Conversion of the source to the type of the expression. */
public class P4CastExpression extends P4Expression {
    public final P4Expression source;

    public P4CastExpression(SourcePositionRange position, P4Type type, P4Expression source) {
        super(position, type);
        this.source = source;
    }

    @CheckReturnValue
    public P4CastExpression replaceSource(P4Expression source) {
        if (source == this.source)
            return this;
        return new P4CastExpression(this.position, this.type, source);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.source.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4CastExpression o = other.as(P4CastExpression.class);
        if (o == null)
            return false;
        return this.source == o.source && this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(")
                .append(this.type)
                .append(")");
        return prefixOperand(builder, this.source);
    }
}
