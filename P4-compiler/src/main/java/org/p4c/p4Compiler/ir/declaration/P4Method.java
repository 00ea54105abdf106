package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

/** Declaration of an extern function or of a method of an extern type.
 * There is no body; annotations describe its behavior. */
public class P4Method extends P4Declaration {
    public static final String PURE = "pure";
    public static final String NO_SIDE_EFFECTS = "noSideEffects";

    public final P4TypeMethod type;
    public final List<String> annotations;

    public P4Method(SourcePositionRange position, String name, P4TypeMethod type, List<String> annotations) {
        super(position, name);
        this.type = type;
        this.annotations = annotations;
    }

    public boolean hasAnnotation(String annotation) {
        return this.annotations.contains(annotation);
    }

    /** True if calling this method does not modify any state. */
    public boolean isPure() {
        if (!this.hasAnnotation(PURE) && !this.hasAnnotation(NO_SIDE_EFFECTS))
            return false;
        return !Linq.any(this.type.parameters, p -> p.direction.isOut());
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        for (P4Parameter parameter: this.type.parameters)
            parameter.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4Method o = other.as(P4Method.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.annotations.equals(o.annotations);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        for (String annotation: this.annotations)
            builder.append("@").append(annotation).append(" ");
        builder.append(this.type.returnType)
                .append(" ")
                .append(this.name);
        return this.type.typeParameters(builder)
                .append("(")
                .joinI(", ", this.type.parameters)
                .append(");");
    }
}
