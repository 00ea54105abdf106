package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4TypeState;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

import javax.annotation.CheckReturnValue;

/** select(e0, e1, ...) { keyset: state; ... } in a parser transition. */
public class P4SelectExpression extends P4Expression {
    public final List<P4Expression> select;
    public final List<P4SelectCase> cases;

    public P4SelectExpression(SourcePositionRange position, List<P4Expression> select, List<P4SelectCase> cases) {
        super(position, P4TypeState.INSTANCE);
        this.select = select;
        this.cases = cases;
    }

    @CheckReturnValue
    public P4SelectExpression replaceSelect(List<P4Expression> select) {
        if (Linq.same(select, this.select))
            return this;
        return new P4SelectExpression(this.position, select, this.cases);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (P4Expression expression: this.select)
            expression.accept(visitor);
        for (P4SelectCase selectCase: this.cases)
            selectCase.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4SelectExpression o = other.as(P4SelectExpression.class);
        if (o == null)
            return false;
        return Linq.same(this.select, o.select) &&
                Linq.same(this.cases, o.cases);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("select(")
                .joinI(", ", this.select)
                .append(") {")
                .increase();
        for (P4SelectCase selectCase: this.cases)
            builder.append(selectCase).newline();
        return builder.decrease().append("}");
    }
}
