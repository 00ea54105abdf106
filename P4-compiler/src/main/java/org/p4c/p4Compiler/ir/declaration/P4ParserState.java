package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/** A parser state.  The transition is either a select expression or the name of the next state;
 * a state with neither (accept, reject) has no transition. */
public class P4ParserState extends P4Declaration {
    public static final String START = "start";

    public final List<IP4StatOrDecl> components;
    @Nullable
    public final P4SelectExpression selectExpression;
    @Nullable
    public final String nextState;

    public P4ParserState(SourcePositionRange position, String name, List<IP4StatOrDecl> components,
                         @Nullable P4SelectExpression selectExpression, @Nullable String nextState) {
        super(position, name);
        this.components = components;
        this.selectExpression = selectExpression;
        this.nextState = nextState;
        if (selectExpression != null && nextState != null)
            this.error("State has both a select expression and a next state");
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (IP4StatOrDecl component: this.components)
            component.accept(visitor);
        if (this.selectExpression != null)
            this.selectExpression.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4ParserState o = other.as(P4ParserState.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                Linq.same(this.components, o.components) &&
                this.selectExpression == o.selectExpression &&
                Objects.equals(this.nextState, o.nextState);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("state ")
                .append(this.name)
                .append(" {")
                .increase();
        for (IP4StatOrDecl component: this.components)
            builder.append(component).newline();
        if (this.selectExpression != null)
            builder.append("transition ")
                    .append(this.selectExpression)
                    .newline();
        else if (this.nextState != null)
            builder.append("transition ")
                    .append(this.nextState)
                    .append(";")
                    .newline();
        return builder.decrease().append("}");
    }
}
