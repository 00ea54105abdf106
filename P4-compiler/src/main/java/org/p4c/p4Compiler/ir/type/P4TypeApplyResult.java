package org.p4c.p4Compiler.ir.type;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.util.IIndentStream;

/** Result of table.apply(), with the fields hit, miss and action_run.
 * Values of this type cannot be stored in variables. */
public class P4TypeApplyResult extends P4Type {
    public final String tableName;

    public P4TypeApplyResult(SourcePositionRange position, String tableName) {
        super(position);
        this.tableName = tableName;
    }

    @Override
    public boolean isDeclarable() {
        return false;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("apply_result(").append(this.tableName).append(")");
    }
}
