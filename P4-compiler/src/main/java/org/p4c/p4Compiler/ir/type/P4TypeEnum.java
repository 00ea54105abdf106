package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

import java.util.List;

public class P4TypeEnum extends P4Type implements IP4TypeDeclaration {
    public final String name;
    public final List<String> members;

    public P4TypeEnum(SourcePositionRange position, String name, List<String> members) {
        super(position);
        this.name = name;
        this.members = members;
    }

    @Override
    public String getName() {
        return this.name;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.name);
    }

    @Override
    public IIndentStream declare(IIndentStream builder) {
        return builder.append("enum ")
                .append(this.name)
                .append(" { ")
                .join(", ", this.members)
                .append(" }");
    }
}
