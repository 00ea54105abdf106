package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.ICompilerComponent;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.statement.P4Statement;
import org.p4c.p4Compiler.ir.type.P4Type;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Makes explicit the order of evaluation of the sub-expressions of an expression.
 * An expression is represented as a sequence of temporary declarations,
 * followed by a sequence of statements (mostly assignments to the temporaries,
 * but also conditionals for short-circuit evaluation),
 * followed by a final expression involving the temporaries.
 */
public class EvaluationOrder implements ICompilerComponent {
    final P4Compiler compiler;
    /** Shared with all branches created from this order. */
    final List<P4DeclarationVariable> temporaries;
    final List<IP4StatOrDecl> statements;
    /** Null when the value of the expression is not used. */
    @Nullable
    P4Expression result;

    public EvaluationOrder(P4Compiler compiler) {
        this(compiler, new ArrayList<>());
    }

    EvaluationOrder(P4Compiler compiler, List<P4DeclarationVariable> temporaries) {
        this.compiler = compiler;
        this.temporaries = temporaries;
        this.statements = new ArrayList<>();
        this.result = null;
    }

    @Override
    public P4Compiler compiler() {
        return this.compiler;
    }

    /** True if the expression did not need any rewriting. */
    public boolean simple() {
        return this.temporaries.isEmpty() && this.statements.isEmpty();
    }

    /** Declare a new temporary variable with a fresh name; it has no initializer. */
    public P4DeclarationVariable createTemporary(P4Type type) {
        String name = this.compiler.getReferenceMap().newName(
                this.compiler.options.languageOptions.tempPrefix);
        P4DeclarationVariable declaration = new P4DeclarationVariable(
                SourcePositionRange.INVALID, type, name, null);
        this.temporaries.add(declaration);
        return declaration;
    }

    /** A new expression referring to a temporary. */
    public P4PathExpression reference(P4DeclarationVariable declaration) {
        P4PathExpression path = new P4PathExpression(declaration.position, declaration.type, declaration.name);
        this.compiler.getReferenceMap().declare(path, declaration);
        this.compiler.getTypeMap().setLeftValue(path);
        return path;
    }

    /** Append 'declaration = expression' to the statements.
     * @return A reference to the assigned temporary. */
    public P4PathExpression addAssignment(P4DeclarationVariable declaration, P4Expression expression) {
        P4PathExpression left = this.reference(declaration);
        this.statements.add(new P4AssignmentStatement(expression.position, left, expression));
        return this.reference(declaration);
    }

    public void addStatement(P4Statement statement) {
        this.statements.add(statement);
    }

    /** An evaluation order for a conditionally executed branch.
     * It has its own statements, but shares the temporaries with this one. */
    public EvaluationOrder branch() {
        return new EvaluationOrder(this.compiler, this.temporaries);
    }

    public P4BlockStatement toBlock(SourcePositionRange position) {
        return new P4BlockStatement(position, new ArrayList<>(this.statements));
    }

    public List<P4DeclarationVariable> getTemporaries() {
        return Collections.unmodifiableList(this.temporaries);
    }

    public List<IP4StatOrDecl> getStatements() {
        return Collections.unmodifiableList(this.statements);
    }

    @Nullable
    public P4Expression getFinal() {
        return this.result;
    }

    void setFinal(@Nullable P4Expression result) {
        this.result = result;
    }

    @Override
    public String toString() {
        return "EvaluationOrder{temporaries=" + this.temporaries +
                ", statements=" + this.statements +
                ", final=" + this.result + "}";
    }
}
