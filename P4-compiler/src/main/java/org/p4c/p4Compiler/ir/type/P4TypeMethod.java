package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.util.IIndentStream;

import java.util.List;

/** Signature of a function, action, extern function or method. */
public class P4TypeMethod extends P4Type {
    public final List<P4TypeVar> typeParameters;
    public final List<P4Parameter> parameters;
    public final P4Type returnType;

    public P4TypeMethod(SourcePositionRange position, List<P4TypeVar> typeParameters,
                        List<P4Parameter> parameters, P4Type returnType) {
        super(position);
        this.typeParameters = typeParameters;
        this.parameters = parameters;
        this.returnType = returnType;
    }

    public P4TypeMethod(List<P4Parameter> parameters, P4Type returnType) {
        this(SourcePositionRange.INVALID, List.of(), parameters, returnType);
    }

    @Override
    public boolean isDeclarable() {
        return false;
    }

    public IIndentStream typeParameters(IIndentStream builder) {
        if (this.typeParameters.isEmpty())
            return builder;
        return builder.append("<")
                .joinI(", ", this.typeParameters)
                .append(">");
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return this.typeParameters(builder)
                .append("(")
                .joinI(", ", this.parameters)
                .append(") -> ")
                .append(this.returnType);
    }
}
