package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.util.IIndentStream;

/** Fixed-width integers: bit&lt;W&gt; or int&lt;W&gt;. */
public class P4TypeBits extends P4Type {
    public final int width;
    public final boolean signed;

    public P4TypeBits(SourcePositionRange position, int width, boolean signed) {
        super(position);
        this.width = width;
        this.signed = signed;
        if (width <= 0)
            this.error("Illegal width " + width);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        P4TypeBits o = other.as(P4TypeBits.class);
        if (o == null)
            return false;
        return this.width == o.width && this.signed == o.signed;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append(this.signed ? "int<" : "bit<")
                .append(this.width)
                .append(">");
    }
}
