package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.util.IIndentStream;

import java.util.List;

import javax.annotation.CheckReturnValue;

public class P4Function extends P4Declaration {
    public final P4TypeMethod type;
    public final P4BlockStatement body;

    public P4Function(SourcePositionRange position, P4TypeMethod type, String name, P4BlockStatement body) {
        super(position, name);
        this.type = type;
        this.body = body;
    }

    public P4Function(SourcePositionRange position, P4Type returnType, String name,
                      List<P4Parameter> parameters, P4BlockStatement body) {
        this(position, new P4TypeMethod(parameters, returnType), name, body);
    }

    public List<P4Parameter> getParameters() {
        return this.type.parameters;
    }

    @CheckReturnValue
    public P4Function withBody(P4BlockStatement body) {
        if (body == this.body)
            return this;
        return new P4Function(this.position, this.type, this.name, body);
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
        P4Function o = other.as(P4Function.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.body == o.body;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append(this.type.returnType)
                .append(" ")
                .append(this.name);
        return this.type.typeParameters(builder)
                .append("(")
                .joinI(", ", this.type.parameters)
                .append(") ")
                .append(this.body);
    }
}
