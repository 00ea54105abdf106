package org.p4c.p4Compiler.compiler;

import org.p4c.p4Compiler.compiler.errors.SourcePositionRange;
import org.p4c.p4Compiler.compiler.visitors.inner.ComputeExpressionFlags;
import org.p4c.p4Compiler.compiler.visitors.inner.ResolveReferences;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Instance;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4BinaryExpression;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4LAnd;
import org.p4c.p4Compiler.ir.expression.P4LOr;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4MuxExpression;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.expression.P4TypeNameExpression;
import org.p4c.p4Compiler.ir.expression.literal.P4IntLiteral;
import org.p4c.p4Compiler.ir.statement.P4AssignmentStatement;
import org.p4c.p4Compiler.ir.statement.P4BlockStatement;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.p4Compiler.ir.type.P4TypeBits;
import org.p4c.p4Compiler.ir.type.P4TypeBool;
import org.p4c.p4Compiler.ir.type.P4TypeEnum;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeStruct;
import org.p4c.p4Compiler.ir.type.P4TypeVoid;
import org.p4c.util.Linq;

import java.util.List;

/** Helpers that build small typed programs for tests. */
public class IrBuilder {
    public static final SourcePositionRange NONE = SourcePositionRange.INVALID;
    public static final P4TypeBits BIT8 = new P4TypeBits(NONE, 8, false);
    public static final P4TypeBool BOOL = P4TypeBool.INSTANCE;
    public static final P4TypeVoid VOID = P4TypeVoid.INSTANCE;
    public static final P4TypeStruct HEADER = new P4TypeStruct(NONE, "H", true, Linq.list(
            new P4TypeStruct.Field("a", BIT8),
            new P4TypeStruct.Field("b", BIT8),
            new P4TypeStruct.Field("c", BIT8)));
    public static final P4TypeEnum ENUM = new P4TypeEnum(NONE, "E", Linq.list("First", "Second"));

    // Externs with side effects
    public static final P4Method F = extern("f", BIT8, List.of());
    public static final P4Method G = extern("g", BIT8, List.of());
    public static final P4Method F2 = extern("f2", BOOL, List.of());
    public static final P4Method UPDATE = extern("update", VOID, List.of(),
            parameter(P4Direction.INOUT, BIT8, "v"));
    public static final P4Method READ = extern("read", VOID, List.of(),
            parameter(P4Direction.OUT, BIT8, "r"));
    public static final P4Method COMBINE = extern("combine", VOID, List.of(),
            parameter(P4Direction.IN, BIT8, "a"),
            parameter(P4Direction.IN, BIT8, "b"));
    public static final P4Method LOG = extern("log_value", VOID, List.of(),
            parameter(P4Direction.IN, BIT8, "v"));
    // Extern without side effects
    public static final P4Method HASH = extern("hash", BIT8, List.of(P4Method.PURE),
            parameter(P4Direction.IN, BIT8, "v"));

    private IrBuilder() {}

    /** The declarations that most test programs share. */
    public static List<IP4Declaration> library() {
        return Linq.list(HEADER, ENUM, F, G, F2, UPDATE, READ, COMBINE, LOG, HASH);
    }

    public static P4Program program(IP4Declaration... declarations) {
        List<IP4Declaration> list = library();
        list.addAll(Linq.list(declarations));
        return new P4Program(list);
    }

    /** Resolve references and compute the expression flags, as the front end would. */
    public static P4Compiler prepare(P4Program program) {
        P4Compiler compiler = new P4Compiler();
        new ResolveReferences(compiler).apply(program);
        new ComputeExpressionFlags(compiler).apply(program);
        return compiler;
    }

    public static P4Method extern(String name, P4Type returnType, List<String> annotations,
                                  P4Parameter... parameters) {
        return new P4Method(NONE, name, new P4TypeMethod(Linq.list(parameters), returnType), annotations);
    }

    public static P4Parameter parameter(P4Direction direction, P4Type type, String name) {
        return new P4Parameter(NONE, direction, type, name);
    }

    public static P4DeclarationVariable variable(P4Type type, String name) {
        return new P4DeclarationVariable(NONE, type, name, null);
    }

    public static P4Function function(String name, List<P4Parameter> parameters, IP4StatOrDecl... body) {
        return new P4Function(NONE, VOID, name, parameters, block(body));
    }

    public static P4Action action(String name, List<P4Parameter> parameters, IP4StatOrDecl... body) {
        return new P4Action(NONE, name, parameters, block(body));
    }

    public static P4BlockStatement block(IP4StatOrDecl... components) {
        return new P4BlockStatement(NONE, Linq.list(components));
    }

    public static P4IntLiteral constant(long value) {
        return new P4IntLiteral(BIT8, value);
    }

    public static P4PathExpression path(P4DeclarationVariable variable) {
        return new P4PathExpression(NONE, variable.type, variable.name);
    }

    public static P4PathExpression path(P4Parameter parameter) {
        return new P4PathExpression(NONE, parameter.type, parameter.name);
    }

    public static P4PathExpression path(P4Method method) {
        return new P4PathExpression(NONE, method.type, method.name);
    }

    public static P4PathExpression path(P4Function function) {
        return new P4PathExpression(NONE, function.type, function.name);
    }

    public static P4PathExpression path(P4Action action) {
        return new P4PathExpression(NONE, action.type, action.name);
    }

    public static P4PathExpression path(P4Instance instance) {
        return new P4PathExpression(NONE, instance.type, instance.name);
    }

    public static P4PathExpression path(P4Table table) {
        return new P4PathExpression(NONE, table.type, table.name);
    }

    /** A field of a header or struct. */
    public static P4Member field(P4Expression expression, String name) {
        P4TypeStruct struct = expression.type.to(P4TypeStruct.class);
        P4TypeStruct.Field field = Linq.first(struct.fields, f -> f.name().equals(name));
        return new P4Member(NONE, field.type(), expression, name);
    }

    public static P4Member enumMember(P4TypeEnum type, String name) {
        return new P4Member(NONE, type, new P4TypeNameExpression(NONE, type), name);
    }

    public static P4BinaryExpression binary(P4Opcode opcode, P4Expression left, P4Expression right) {
        P4Type type = switch (opcode) {
            case EQ, NEQ, LT, LTE, GT, GTE -> BOOL;
            default -> left.type;
        };
        return new P4BinaryExpression(NONE, type, opcode, left, right);
    }

    public static P4LAnd and(P4Expression left, P4Expression right) {
        return new P4LAnd(NONE, BOOL, left, right);
    }

    public static P4LOr or(P4Expression left, P4Expression right) {
        return new P4LOr(NONE, BOOL, left, right);
    }

    public static P4MuxExpression mux(P4Expression condition, P4Expression ifTrue, P4Expression ifFalse) {
        return new P4MuxExpression(NONE, ifTrue.type, condition, ifTrue, ifFalse);
    }

    /** A call with positional arguments. */
    public static P4MethodCallExpression call(P4Expression method, P4Expression... arguments) {
        return call(method, Linq.map(Linq.list(arguments), P4Argument::new));
    }

    public static P4MethodCallExpression call(P4Expression method, List<P4Argument> arguments) {
        P4TypeMethod type = method.type.to(P4TypeMethod.class);
        return new P4MethodCallExpression(NONE, type.returnType, method, List.of(), arguments);
    }

    public static P4Argument named(String name, P4Expression expression) {
        return new P4Argument(NONE, name, expression);
    }

    /** table.apply() */
    public static P4MethodCallExpression apply(P4Table table) {
        return call(new P4Member(NONE, table.applyType, path(table), P4Table.APPLY));
    }

    /** Member of the result of a table application: hit, miss, or action_run. */
    public static P4Member applyResult(P4Table table, String member) {
        P4Type type = member.equals("action_run") ? table.getApplyResultType() : BOOL;
        return new P4Member(NONE, type, apply(table), member);
    }

    public static P4AssignmentStatement assign(P4Expression left, P4Expression right) {
        return new P4AssignmentStatement(left, right);
    }

    public static P4MethodCallStatement statement(P4MethodCallExpression call) {
        return new P4MethodCallStatement(call);
    }
}
