package org.p4c.p4Compiler.ir.expression;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import java.util.List;

import javax.annotation.CheckReturnValue;

/** Invocation of a function, action, extern, table apply or built-in method.
 * The type of the expression is the return type of the callee. */
public class P4MethodCallExpression extends P4Expression {
    public final P4Expression method;
    public final List<P4Type> typeArguments;
    public final List<P4Argument> arguments;

    public P4MethodCallExpression(SourcePositionRange position, P4Type type, P4Expression method,
                                  List<P4Type> typeArguments, List<P4Argument> arguments) {
        super(position, type);
        this.method = method;
        this.typeArguments = typeArguments;
        this.arguments = arguments;
    }

    @CheckReturnValue
    public P4MethodCallExpression replaceSources(P4Expression method, List<P4Argument> arguments) {
        if (method == this.method && Linq.same(arguments, this.arguments))
            return this;
        return new P4MethodCallExpression(this.position, this.type, method, this.typeArguments, arguments);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        this.method.accept(visitor);
        for (P4Argument argument: this.arguments)
            argument.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public <T> T accept(IExpressionFunction<T> function) {
        return function.apply(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4MethodCallExpression o = other.as(P4MethodCallExpression.class);
        if (o == null)
            return false;
        return this.method == o.method &&
                Linq.same(this.typeArguments, o.typeArguments) &&
                Linq.same(this.arguments, o.arguments) &&
                this.type == o.type;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        prefixOperand(builder, this.method);
        if (!this.typeArguments.isEmpty())
            builder.append("<")
                    .joinI(", ", this.typeArguments)
                    .append(">");
        return builder.append("(")
                .joinI(", ", this.arguments)
                .append(")");
    }
}
