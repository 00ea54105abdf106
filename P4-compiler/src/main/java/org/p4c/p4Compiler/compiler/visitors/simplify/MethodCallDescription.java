package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.compiler.errors.UnimplementedException;
import org.p4c.p4Compiler.ir.IP4Declaration;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.p4c.p4Compiler.ir.type.P4Type;
import org.p4c.p4Compiler.ir.type.P4TypeExtern;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeStack;
import org.p4c.p4Compiler.ir.type.P4TypeStruct;
import org.p4c.p4Compiler.ir.type.P4TypeTable;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/** Describes the callee of a method call expression. */
public class MethodCallDescription {
    public enum Kind {
        FUNCTION,
        ACTION,
        EXTERN_FUNCTION,
        EXTERN_METHOD,
        TABLE_APPLY,
        BUILT_IN
    }

    public static final String IS_VALID = "isValid";
    static final Set<String> HEADER_BUILT_INS = Set.of(IS_VALID, "setValid", "setInvalid");
    static final Set<String> STACK_BUILT_INS = Set.of("push_front", "pop_front");

    public final P4MethodCallExpression call;
    public final Kind kind;
    /** Name of the called method. */
    public final String name;
    public final P4TypeMethod methodType;
    /** Null for built-in methods. */
    @Nullable
    public final IP4Declaration declaration;
    public final ParameterSubstitution substitution;

    MethodCallDescription(P4MethodCallExpression call, Kind kind, String name,
                          P4TypeMethod methodType, @Nullable IP4Declaration declaration) {
        this.call = call;
        this.kind = kind;
        this.name = name;
        this.methodType = methodType;
        this.declaration = declaration;
        this.substitution = new ParameterSubstitution(call, methodType, kind == Kind.ACTION);
    }

    /** Find the callee of a call.  Paths in the call must be resolved. */
    public static MethodCallDescription resolve(P4Compiler compiler, P4MethodCallExpression call) {
        P4TypeMethod methodType = call.method.type.as(P4TypeMethod.class);
        if (methodType == null)
            throw new InternalCompilerError("Callee does not have a method type", call);

        P4PathExpression path = call.method.as(P4PathExpression.class);
        if (path != null) {
            IP4Declaration declaration = compiler.getReferenceMap().getDeclaration(path);
            Kind kind;
            if (declaration.is(P4Function.class))
                kind = Kind.FUNCTION;
            else if (declaration.is(P4Action.class))
                kind = Kind.ACTION;
            else if (declaration.is(P4Method.class))
                kind = Kind.EXTERN_FUNCTION;
            else
                throw new InternalCompilerError("Cannot call " + declaration.getName(), call);
            return new MethodCallDescription(call, kind, path.name, methodType, declaration);
        }

        P4Member member = call.method.as(P4Member.class);
        if (member == null)
            throw new UnimplementedException("Call of a computed method", call);
        P4Type baseType = member.expr.type;
        String name = member.member;
        if (baseType.is(P4TypeExtern.class)) {
            P4Method method = baseType.to(P4TypeExtern.class).getMethod(name);
            if (method == null)
                throw new InternalCompilerError("Extern " + baseType + " has no method " + name, call);
            return new MethodCallDescription(call, Kind.EXTERN_METHOD, name, methodType, method);
        }
        if (baseType.is(P4TypeTable.class) && name.equals(P4Table.APPLY)) {
            IP4Declaration table = null;
            P4PathExpression tablePath = member.expr.as(P4PathExpression.class);
            if (tablePath != null)
                table = compiler.getReferenceMap().get(tablePath);
            return new MethodCallDescription(call, Kind.TABLE_APPLY, name, methodType, table);
        }
        P4TypeStruct struct = baseType.as(P4TypeStruct.class);
        if (struct != null && struct.header && HEADER_BUILT_INS.contains(name))
            return new MethodCallDescription(call, Kind.BUILT_IN, name, methodType, null);
        if (baseType.is(P4TypeStack.class) && STACK_BUILT_INS.contains(name))
            return new MethodCallDescription(call, Kind.BUILT_IN, name, methodType, null);
        throw new InternalCompilerError("Cannot resolve method " + name, call);
    }

    public List<P4Parameter> getParameters() {
        return this.methodType.parameters;
    }

    /** True if the call cannot modify any state. */
    public boolean isPure() {
        return switch (this.kind) {
            case BUILT_IN -> this.name.equals(IS_VALID);
            case EXTERN_FUNCTION, EXTERN_METHOD -> this.declaration != null &&
                    this.declaration.to(P4Method.class).isPure();
            default -> false;
        };
    }

    @Override
    public String toString() {
        return this.kind + " " + this.name + this.methodType;
    }
}
