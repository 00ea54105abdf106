package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;

import javax.annotation.CheckReturnValue;

/** Header stack element: array[index] */
public class P4ArrayIndex extends P4Expression {
    public final P4Expression array;
    public final P4Expression index;

    public P4ArrayIndex(SourcePositionRange position, P4Type type, P4Expression array, P4Expression index) {
        super(position, type);
        this.array = array;
        this.index = index;
    }

    @CheckReturnValue
    public P4ArrayIndex replaceSources(P4Expression array, P4Expression index) {
        if (array == this.array && index == this.index)
            return this;
        return new P4ArrayIndex(this.position, this.type, array, index);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.array.accept(visitor);
        this.index.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4ArrayIndex o = other.as(P4ArrayIndex.class);
        if (o == null)
            return false;
        return this.array == o.array &&
                this.index == o.index &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return prefixOperand(builder, this.array)
                .append("[")
                .append(this.index)
                .append("]");
    }
}
