package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeVoid;
import org.p4c.util.IIndentStream;

import java.util.List;

import javax.annotation.CheckReturnValue;

/** An action.  Directionless parameters are supplied by the control plane. */
public class P4Action extends P4Declaration {
    public final P4TypeMethod type;
    public final P4BlockStatement body;

    public P4Action(SourcePositionRange position, P4TypeMethod type, String name, P4BlockStatement body) {
        super(position, name);
        this.type = type;
        this.body = body;
    }

    public P4Action(SourcePositionRange position, String name, List<P4Parameter> parameters, P4BlockStatement body) {
        this(position, new P4TypeMethod(parameters, P4TypeVoid.INSTANCE), name, body);
    }

    public List<P4Parameter> getParameters() {
        return this.type.parameters;
    }

    @CheckReturnValue
    public P4Action withBody(P4BlockStatement body) {
        if (body == this.body)
            return this;
        return new P4Action(this.position, this.type, this.name, body);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (P4Parameter parameter: this.type.parameters)
            parameter.accept(visitor);
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Action o = other.as(P4Action.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.body == o.body;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("action ")
                .append(this.name)
                .append("(")
                .joinI(", ", this.type.parameters)
                .append(") ")
                .append(this.body);
    }
}
