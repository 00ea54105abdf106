package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

/** Type of a table; its only method is apply. */
public class P4TypeTable extends P4Type {
    public final String tableName;

    public P4TypeTable(SourcePositionRange position, String tableName) {
        super(position);
        this.tableName = tableName;
    }

    @Override
    public boolean isDeclarable() {
        return false;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("table ").append(this.tableName);
    }
}
