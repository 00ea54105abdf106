package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

public class P4Parser extends P4Declaration {
    public final List<P4Parameter> applyParameters;
    public final List<P4Declaration> parserLocals;
    public final List<P4ParserState> states;

    public P4Parser(SourcePositionRange position, String name, List<P4Parameter> applyParameters,
                    List<P4Declaration> parserLocals, List<P4ParserState> states) {
        super(position, name);
        this.applyParameters = applyParameters;
        this.parserLocals = parserLocals;
        this.states = states;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (P4Parameter parameter: this.applyParameters)
            parameter.accept(visitor);
        for (P4Declaration local: this.parserLocals)
            local.accept(visitor);
        for (P4ParserState state: this.states)
            state.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Parser o = other.as(P4Parser.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                Linq.same(this.applyParameters, o.applyParameters) &&
                Linq.same(this.parserLocals, o.parserLocals) &&
                Linq.same(this.states, o.states);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("parser ")
                .append(this.name)
                .append("(")
                .joinI(", ", this.applyParameters)
                .append(") {")
                .increase();
        for (P4Declaration local: this.parserLocals)
            builder.append(local).newline();
        for (P4ParserState state: this.states)
            builder.append(state).newline();
        return builder.decrease().append("}");
    }
}
