package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

/** A control block: local declarations (variables, constants, actions, tables, instances)
 * followed by the apply body. */
public class P4Control extends P4Declaration {
    public final List<P4Parameter> applyParameters;
    public final List<P4Declaration> controlLocals;
    public final P4BlockStatement body;

    public P4Control(SourcePositionRange position, String name, List<P4Parameter> applyParameters,
                     List<P4Declaration> controlLocals, P4BlockStatement body) {
        super(position, name);
        this.applyParameters = applyParameters;
        this.controlLocals = controlLocals;
        this.body = body;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (P4Parameter parameter: this.applyParameters)
            parameter.accept(visitor);
        for (P4Declaration local: this.controlLocals)
            local.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Control o = other.as(P4Control.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                Linq.same(this.applyParameters, o.applyParameters) &&
                Linq.same(this.controlLocals, o.controlLocals) &&
                this.body == o.body;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("control ")
                .append(this.name)
                .append("(")
                .joinI(", ", this.applyParameters)
                .append(") {")
                .increase();
        for (P4Declaration local: this.controlLocals)
            builder.append(local).newline();
        return builder.append("apply ")
                .append(this.body)
                .newline()
                .decrease()
                .append("}");
    }
}
