package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;

/** A binary operation that evaluates both operands. */
public class P4BinaryExpression extends P4Expression {
    public final P4Expression left;
    public final P4Expression right;
    public final P4Opcode opcode;

    public P4BinaryExpression(SourcePositionRange position, P4Type type, P4Opcode opcode,
                              P4Expression left, P4Expression right) {
        super(position, type);
        this.opcode = opcode;
        this.left = left;
        this.right = right;
        if (opcode.isUnary() || opcode == P4Opcode.LAND || opcode == P4Opcode.LOR)
            this.error("Not a binary operation " + opcode.name());
    }

    @CheckReturnValue
    public P4BinaryExpression replaceSources(P4Expression left, P4Expression right) {
        if (left == this.left && right == this.right)
            return this;
        return new P4BinaryExpression(this.position, this.type, this.opcode, left, right);
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
        P4BinaryExpression o = other.as(P4BinaryExpression.class);
        if (o == null)
            return false;
        return this.left == o.left &&
                this.right == o.right &&
                this.opcode == o.opcode &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        infixOperand(builder, this.left)
                .append(" ")
                .append(this.opcode.toString())
                .append(" ");
        return infixOperand(builder, this.right);
    }
}
