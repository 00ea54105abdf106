package org.p4c.p4Compiler.ir.declaration;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.VisitDecision;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerVisitor;
import org.p4c.p4Compiler.ir.IP4Node;
import org.p4c.p4Compiler.ir.type.P4TypeApplyResult;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeTable;
import org.p4c.util.IIndentStream;

import java.util.List;

/** A match-action table.  Only the action list is represented. */
public class P4Table extends P4Declaration {
    public static final String APPLY = "apply";

    public final P4TypeTable type;
    /** Signature of the apply method. */
    public final P4TypeMethod applyType;
    public final List<String> actions;

    public P4Table(SourcePositionRange position, String name, List<String> actions) {
        super(position, name);
        this.actions = actions;
        this.type = new P4TypeTable(position, name);
        this.applyType = new P4TypeMethod(List.of(), new P4TypeApplyResult(position, name));
    }

    public P4TypeApplyResult getApplyResultType() {
        return this.applyType.returnType.to(P4TypeApplyResult.class);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IP4Node other) {
        return this == other;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("table ")
                .append(this.name)
                .append(" {")
                .increase()
                .append("actions = {");
        for (String action: this.actions)
            builder.append(" ").append(action).append(";");
        return builder.append(" }")
                .newline()
                .decrease()
                .append("}");
    }
}
