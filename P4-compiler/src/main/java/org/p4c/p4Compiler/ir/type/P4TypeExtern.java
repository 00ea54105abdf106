package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.util.IIndentStream;
import org.p4c.util.Linq;

import javax.annotation.Nullable;
import java.util.List;

/** An extern object type, with its methods. */
public class P4TypeExtern extends P4Type implements IP4TypeDeclaration {
    public final String name;
    public final List<P4Method> methods;

    public P4TypeExtern(SourcePositionRange position, String name, List<P4Method> methods) {
        super(position);
        this.name = name;
        this.methods = methods;
    }

    @Nullable
    public P4Method getMethod(String name) {
        return Linq.first(this.methods, m -> m.name.equals(name));
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
        builder.append("extern ")
                .append(this.name)
                .append(" {")
                .increase();
        for (P4Method method: this.methods)
            builder.append(method).newline();
        return builder.decrease().append("}");
    }
}
