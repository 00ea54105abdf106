package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.type.P4TypeTable;

/** Recognizes the queries on the result of a table application:
 * table.apply().hit, table.apply().miss, and table.apply().action_run. */
public class TableApplySolver {
    public static final String HIT = "hit";
    public static final String MISS = "miss";
    public static final String ACTION_RUN = "action_run";

    private TableApplySolver() {}

    /** True if the expression is table.apply() */
    public static boolean isApply(P4Expression expression) {
        P4MethodCallExpression call = expression.as(P4MethodCallExpression.class);
        if (call == null)
            return false;
        P4Member method = call.method.as(P4Member.class);
        if (method == null)
            return false;
        return method.expr.type.is(P4TypeTable.class) && method.member.equals(P4Table.APPLY);
    }

    /** True for table.apply().hit and table.apply().miss */
    public static boolean isHit(P4Member member) {
        if (!member.member.equals(HIT) && !member.member.equals(MISS))
            return false;
        return isApply(member.expr);
    }

    /** True for table.apply().action_run */
    public static boolean isActionRun(P4Member member) {
        if (!member.member.equals(ACTION_RUN))
            return false;
        return isApply(member.expr);
    }
}
