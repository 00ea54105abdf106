package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;

public class P4UnaryExpression extends P4Expression {
    public final P4Expression source;
    public final P4Opcode opcode;

    public P4UnaryExpression(SourcePositionRange position, P4Type type, P4Opcode opcode, P4Expression source) {
        super(position, type);
        this.opcode = opcode;
        this.source = source;
        if (!opcode.isUnary())
            this.error("Not a unary operation " + opcode.name());
    }

    @CheckReturnValue
    public P4UnaryExpression replaceSource(P4Expression source) {
        if (source == this.source)
            return this;
        return new P4UnaryExpression(this.position, this.type, this.opcode, source);
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
        P4UnaryExpression o = other.as(P4UnaryExpression.class);
        if (o == null)
            return false;
        return this.source == o.source &&
                this.opcode == o.opcode &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.opcode.toString());
        return prefixOperand(builder, this.source);
    }
}
