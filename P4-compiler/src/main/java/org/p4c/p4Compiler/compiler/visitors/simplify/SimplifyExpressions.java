package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.visitors.inner.CheckSimplified;
import org.p4c.p4Compiler.compiler.visitors.inner.ComputeExpressionFlags;
import org.p4c.p4Compiler.compiler.visitors.inner.InnerPasses;
import org.p4c.p4Compiler.compiler.visitors.inner.ResolveReferences;

/** Converts expressions so that each expression has at most one side effect,
 * which is either a call statement or an assignment whose right-hand side is a call.
 * Short-circuit operators and conditional expressions are converted into 'if' statements. */
public class SimplifyExpressions extends InnerPasses {
    public SimplifyExpressions(P4Compiler compiler) {
        super(new ResolveReferences(compiler),
                new ComputeExpressionFlags(compiler),
                new DoSimplifyExpressions(compiler),
                // The rewritten program has new nodes
                new ResolveReferences(compiler),
                new ComputeExpressionFlags(compiler));
        if (compiler.options.languageOptions.validate)
            this.add(new CheckSimplified(compiler));
    }
}
