package org.p4c.p4Compiler.ir.statement;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

public class P4SwitchStatement extends P4Statement {
    public final P4Expression expression;
    public final List<P4SwitchCase> cases;

    public P4SwitchStatement(SourcePositionRange position, P4Expression expression, List<P4SwitchCase> cases) {
        super(position);
        this.expression = expression;
        this.cases = cases;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.expression.accept(visitor);
        for (P4SwitchCase switchCase: this.cases)
            switchCase.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4SwitchStatement o = other.as(P4SwitchStatement.class);
        if (o == null)
            return false;
        return this.expression == o.expression &&
                Linq.same(this.cases, o.cases);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("switch (")
                .append(this.expression)
                .append(") {")
                .increase();
        for (P4SwitchCase switchCase: this.cases)
            builder.append(switchCase).newline();
        return builder.decrease().append("}");
    }
}
