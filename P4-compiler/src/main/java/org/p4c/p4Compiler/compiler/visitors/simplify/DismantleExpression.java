package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.ICompilerComponent;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.visitors.inner.SideEffects;
import org.p4c.p4Compiler.compiler.visitors.inner.TypeMap;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.expression.IExpressionFunction;
import org.p4c.p4Compiler.ir.expression.P4ArrayIndex;
import org.p4c.p4Compiler.ir.expression.P4BinaryExpression;
import org.p4c.p4Compiler.ir.expression.P4CastExpression;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4LAnd;
import org.p4c.p4Compiler.ir.expression.P4LOr;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4MuxExpression;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.p4Compiler.ir.expression.P4ShortCircuitExpression;
import org.p4c.p4Compiler.ir.expression.P4TypeNameExpression;
import org.p4c.p4Compiler.ir.expression.P4UnaryExpression;
import org.p4c.p4Compiler.ir.expression.literal.P4BoolLiteral;
import org.p4c.p4Compiler.ir.expression.literal.P4IntLiteral;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.statement.P4Statement;
import org.p4c.p4Compiler.ir.type.P4TypeBool;
import org.p4c.p4Compiler.ir.type.P4TypeVoid;
import org.p4c.util.IWritesLogs;
import org.p4c.util.Linq;
import org.p4c.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts an expression into an {@link EvaluationOrder}: a list of temporaries,
 * a list of statements that evaluate the side effects of the expression
 * in the order required by the language, and a final side-effect free expression.
 *
 * <p>Binary operations are always evaluated into temporaries.
 * Short-circuit operators and conditional expressions become 'if' statements.
 * Calls with side effects are evaluated into temporaries (or into call statements,
 * when their result is not used), and their out and inout arguments are copied
 * through temporaries when any argument could alias another one.
 */
public class DismantleExpression implements IWritesLogs, ICompilerComponent {
    final P4Compiler compiler;

    public DismantleExpression(P4Compiler compiler) {
        this.compiler = compiler;
    }

    @Override
    public P4Compiler compiler() {
        return this.compiler;
    }

    TypeMap typeMap() {
        return this.compiler.getTypeMap();
    }

    /**
     * Dismantle an expression.
     * @param expression      Expression to dismantle.
     * @param leftValue       True if the expression is the target of an assignment
     *                        or an out argument.
     * @param resultNotUsed   True if the expression is a call whose result is discarded.
     * @return The evaluation order for the expression.  The final expression
     * is null only if resultNotUsed is true and the call was turned into a statement. */
    public EvaluationOrder dismantle(P4Expression expression, boolean leftValue, boolean resultNotUsed) {
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Dismantling ")
                .append(expression)
                .append(leftValue ? " on the left" : " on the right")
                .newline();
        EvaluationOrder order = new EvaluationOrder(this.compiler);
        this.dismantle(order, expression, leftValue, resultNotUsed);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Result is ")
                .appendSupplier(order::toString)
                .newline();
        return order;
    }

    public EvaluationOrder dismantle(P4Expression expression, boolean leftValue) {
        return this.dismantle(expression, leftValue, false);
    }

    /** Dismantle an expression appending the results to an existing order.
     * Sets the final expression of the order and returns it. */
    @Nullable
    public P4Expression dismantle(EvaluationOrder order, P4Expression expression,
                                  boolean leftValue, boolean resultNotUsed) {
        Dismantler dismantler = new Dismantler(order, leftValue, resultNotUsed, false);
        P4Expression result = expression.accept(dismantler);
        order.setFinal(result);
        return result;
    }

    /** Dismantles one expression into an evaluation order.
     * Returns the side-effect free expression that replaces the visited one. */
    class Dismantler implements IExpressionFunction<P4Expression> {
        final EvaluationOrder order;
        final boolean leftValue;
        final boolean resultNotUsed;
        /** True if the visited expression is the table application
         * in table.apply().hit or table.apply().action_run.
         * Such calls are left in place. */
        final boolean tableSink;

        Dismantler(EvaluationOrder order, boolean leftValue, boolean resultNotUsed, boolean tableSink) {
            this.order = order;
            this.leftValue = leftValue;
            this.resultNotUsed = resultNotUsed;
            this.tableSink = tableSink;
        }

        void visiting(P4Expression expression) {
            Logger.INSTANCE.belowLevel(DismantleExpression.this, 1)
                    .append("Visiting ")
                    .append(expression)
                    .newline();
        }

        P4Expression sub(EvaluationOrder order, P4Expression expression, boolean leftValue, boolean tableSink) {
            Dismantler dismantler = new Dismantler(order, leftValue, false, tableSink);
            P4Expression result = expression.accept(dismantler);
            if (result == null)
                throw new InternalCompilerError("Expression does not produce a value", expression);
            return result;
        }

        P4Expression sub(P4Expression expression, boolean leftValue) {
            return this.sub(this.order, expression, leftValue, false);
        }

        /** The rebuilt expression inherits the flags of the original. */
        P4Expression rebuilt(P4Expression original, P4Expression result) {
            if (original != result)
                DismantleExpression.this.typeMap().cloneFlags(original, result);
            return result;
        }

        @Override
        public P4Expression apply(P4BoolLiteral expression) {
            return expression;
        }

        @Override
        public P4Expression apply(P4IntLiteral expression) {
            return expression;
        }

        @Override
        public P4Expression apply(P4PathExpression expression) {
            return expression;
        }

        @Override
        public P4Expression apply(P4TypeNameExpression expression) {
            return expression;
        }

        @Override
        public P4Expression apply(P4Member expression) {
            this.visiting(expression);
            boolean sink = TableApplySolver.isHit(expression) || TableApplySolver.isActionRun(expression);
            P4Expression base = this.sub(this.order, expression.expr, this.leftValue, sink);
            return this.rebuilt(expression, expression.replaceSource(base));
        }

        @Override
        public P4Expression apply(P4ArrayIndex expression) {
            this.visiting(expression);
            P4Expression array = this.sub(expression.array, this.leftValue);
            P4Expression index = this.sub(expression.index, false);
            return this.rebuilt(expression, expression.replaceSources(array, index));
        }

        @Override
        public P4Expression apply(P4UnaryExpression expression) {
            this.visiting(expression);
            P4Expression source = this.sub(expression.source, false);
            return this.rebuilt(expression, expression.replaceSource(source));
        }

        @Override
        public P4Expression apply(P4CastExpression expression) {
            this.visiting(expression);
            P4Expression source = this.sub(expression.source, false);
            return this.rebuilt(expression, expression.replaceSource(source));
        }

        @Override
        public P4Expression apply(P4BinaryExpression expression) {
            this.visiting(expression);
            P4Expression left = this.sub(expression.left, false);
            P4Expression right = this.sub(expression.right, false);
            P4Expression value = this.rebuilt(expression, expression.replaceSources(left, right));
            P4DeclarationVariable temporary = this.order.createTemporary(expression.type);
            return this.order.addAssignment(temporary, value);
        }

        /** a && b becomes
         * <pre>
         * if (!a) { tmp = false; } else { tmp = b; }
         * </pre>
         * a || b becomes
         * <pre>
         * if (a) { tmp = true; } else { tmp = b; }
         * </pre> */
        P4Expression shortCircuit(P4ShortCircuitExpression expression, boolean land) {
            this.visiting(expression);
            P4Expression condition = this.sub(expression.left, false);
            P4DeclarationVariable temporary = this.order.createTemporary(expression.type);

            P4BoolLiteral constant = new P4BoolLiteral(expression.position, !land);
            DismantleExpression.this.typeMap().setCompileTimeConstant(constant);
            P4Statement ifTrue = new P4AssignmentStatement(
                    expression.position, this.order.reference(temporary), constant);

            EvaluationOrder ifFalse = this.order.branch();
            P4Expression right = this.sub(ifFalse, expression.right, false, false);
            ifFalse.addAssignment(temporary, right);

            if (land) {
                boolean constantCondition = DismantleExpression.this.typeMap().isCompileTimeConstant(condition);
                condition = new P4UnaryExpression(condition.position, P4TypeBool.INSTANCE, P4Opcode.LNOT, condition);
                if (constantCondition)
                    DismantleExpression.this.typeMap().setCompileTimeConstant(condition);
            }
            this.order.addStatement(new P4IfStatement(
                    expression.position, condition, ifTrue, ifFalse.toBlock(expression.position)));
            return this.order.reference(temporary);
        }

        @Override
        public P4Expression apply(P4LAnd expression) {
            return this.shortCircuit(expression, true);
        }

        @Override
        public P4Expression apply(P4LOr expression) {
            return this.shortCircuit(expression, false);
        }

        @Override
        public P4Expression apply(P4MuxExpression expression) {
            this.visiting(expression);
            P4Expression condition = this.sub(expression.condition, false);
            P4DeclarationVariable temporary = this.order.createTemporary(expression.type);

            EvaluationOrder ifTrue = this.order.branch();
            P4Expression trueValue = this.sub(ifTrue, expression.ifTrue, false, false);
            ifTrue.addAssignment(temporary, trueValue);

            EvaluationOrder ifFalse = this.order.branch();
            P4Expression falseValue = this.sub(ifFalse, expression.ifFalse, false, false);
            ifFalse.addAssignment(temporary, falseValue);

            this.order.addStatement(new P4IfStatement(expression.position, condition,
                    ifTrue.toBlock(expression.ifTrue.position), ifFalse.toBlock(expression.ifFalse.position)));
            return this.order.reference(temporary);
        }

        @Override
        public P4Expression apply(P4SelectExpression expression) {
            this.visiting(expression);
            List<P4Expression> select = Linq.map(expression.select, e -> this.sub(e, false));
            return this.rebuilt(expression, expression.replaceSelect(select));
        }

        /** Returns null when the call is turned into a call statement. */
        @Override
        @Nullable
        public P4Expression apply(P4MethodCallExpression expression) {
            this.visiting(expression);
            if (this.leftValue)
                throw new InternalCompilerError("Method call used as a left value", expression);
            P4Compiler compiler = DismantleExpression.this.compiler;
            TypeMap typeMap = DismantleExpression.this.typeMap();
            if (!SideEffects.check(compiler, expression))
                return expression;

            MethodCallDescription description = MethodCallDescription.resolve(compiler, expression);
            List<P4Parameter> parameters = description.substitution.getParameters();
            // Arguments are evaluated into temporaries if an argument may
            // modify state, or if out arguments could alias other arguments.
            boolean useTemporaries = Linq.any(expression.arguments, a -> SideEffects.check(compiler, a)) ||
                    Linq.any(parameters, p -> p.direction.isOut());

            P4Expression method = this.sub(expression.method, false);
            List<P4Argument> arguments = new ArrayList<>();
            List<P4Statement> copyBack = new ArrayList<>();
            for (P4Parameter parameter: parameters) {
                P4Argument argument = description.substitution.lookup(parameter);
                if (parameter.direction == P4Direction.NONE) {
                    arguments.add(argument);
                    continue;
                }

                Logger.INSTANCE.belowLevel(DismantleExpression.this, 2)
                        .append("Argument for ")
                        .append(parameter)
                        .append(" is ")
                        .append(argument)
                        .newline();
                boolean outArgument = parameter.direction.isOut();
                P4Expression value = this.sub(argument.expression, outArgument);
                P4Expression argumentValue = value;
                if (useTemporaries && !typeMap.isCompileTimeConstant(value)) {
                    P4DeclarationVariable temporary = this.order.createTemporary(
                            description.substitution.parameterType(parameter));
                    if (parameter.direction == P4Direction.OUT)
                        argumentValue = this.order.reference(temporary);
                    else
                        argumentValue = this.order.addAssignment(temporary, value);
                    if (outArgument)
                        // Nodes are immutable, so 'value' can appear in both assignments
                        copyBack.add(new P4AssignmentStatement(
                                argument.position, value, this.order.reference(temporary)));
                }
                arguments.add(argument.withExpression(argumentValue));
            }

            P4MethodCallExpression simplified = expression.replaceSources(method, arguments);
            P4Expression result;
            if (this.tableSink) {
                result = simplified;
            } else if (!expression.type.is(P4TypeVoid.class) && !this.resultNotUsed) {
                P4DeclarationVariable temporary = this.order.createTemporary(expression.type);
                result = this.order.addAssignment(temporary, simplified);
            } else {
                this.order.addStatement(new P4MethodCallStatement(expression.position, simplified));
                result = null;
            }
            for (P4Statement statement: copyBack)
                this.order.addStatement(statement);
            return result;
        }
    }
}
