package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.IrBuilder;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.P4Argument;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Instance;
import org.p4c.p4Compiler.ir.declaration.P4Method;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4MethodCallExpression;
import org.p4c.p4Compiler.ir.statement.P4MethodCallStatement;
import org.p4c.p4Compiler.ir.type.P4TypeExtern;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeVar;
import org.p4c.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

public class MethodCallDescriptionTests {
    static final P4Parameter H = parameter(P4Direction.INOUT, HEADER, "h");
    static final P4Method COUNT = extern("count", VOID, List.of(), parameter(P4Direction.IN, BIT8, "index"));
    static final P4Method READ_COUNT = extern("readCount", BIT8, List.of(P4Method.NO_SIDE_EFFECTS),
            parameter(P4Direction.IN, BIT8, "index"));
    static final P4TypeExtern COUNTER = new P4TypeExtern(NONE, "Counter", List.of(COUNT, READ_COUNT));
    static final P4Instance COUNTER_INSTANCE = new P4Instance(NONE, "counter", COUNTER);
    static final P4Table T = new P4Table(NONE, "t", List.of("set"));
    static final P4Action SET = action("set", List.of(
            parameter(P4Direction.IN, BIT8, "value"),
            parameter(P4Direction.NONE, BIT8, "data")));

    /** Resolve the call inside a function and describe it. */
    static MethodCallDescription describe(P4MethodCallExpression call) {
        P4Compiler compiler = IrBuilder.prepare(program(COUNTER, COUNTER_INSTANCE, T, SET,
                function("run", List.of(H), new P4MethodCallStatement(call))));
        return MethodCallDescription.resolve(compiler, call);
    }

    static P4Member method(P4Instance instance, String name) {
        P4Method method = instance.type.getMethod(name);
        return new P4Member(NONE, method.type, path(instance), name);
    }

    @Test
    public void testExternFunction() {
        MethodCallDescription description = describe(call(path(F)));
        Assert.assertEquals(MethodCallDescription.Kind.EXTERN_FUNCTION, description.kind);
        Assert.assertSame(F, description.declaration);
        Assert.assertFalse(description.isPure());
        Assert.assertTrue(describe(call(path(HASH), constant(1))).isPure());
    }

    @Test
    public void testExternMethod() {
        MethodCallDescription count = describe(call(method(COUNTER_INSTANCE, "count"), constant(1)));
        Assert.assertEquals(MethodCallDescription.Kind.EXTERN_METHOD, count.kind);
        Assert.assertSame(COUNT, count.declaration);
        Assert.assertFalse(count.isPure());
        MethodCallDescription read = describe(call(method(COUNTER_INSTANCE, "readCount"), constant(1)));
        Assert.assertTrue(read.isPure());
    }

    @Test
    public void testAnnotatedMethodWithOutParameterIsNotPure() {
        P4Method method = extern("swap", VOID, List.of(P4Method.PURE), parameter(P4Direction.INOUT, BIT8, "v"));
        Assert.assertFalse(method.isPure());
    }

    @Test
    public void testTableApply() {
        MethodCallDescription description = describe(apply(T));
        Assert.assertEquals(MethodCallDescription.Kind.TABLE_APPLY, description.kind);
        Assert.assertSame(T, description.declaration);
        Assert.assertFalse(description.isPure());
        Assert.assertTrue(description.getParameters().isEmpty());
    }

    @Test
    public void testBuiltIns() {
        P4Member isValid = new P4Member(NONE, new P4TypeMethod(List.of(), BOOL), path(H), MethodCallDescription.IS_VALID);
        MethodCallDescription valid = describe(call(isValid));
        Assert.assertEquals(MethodCallDescription.Kind.BUILT_IN, valid.kind);
        Assert.assertTrue(valid.isPure());
        P4Member setValid = new P4Member(NONE, new P4TypeMethod(List.of(), VOID), path(H), "setValid");
        Assert.assertFalse(describe(call(setValid)).isPure());
    }

    @Test
    public void testActionWithControlPlaneParameter() {
        MethodCallDescription description = describe(call(path(SET), constant(2)));
        Assert.assertEquals(MethodCallDescription.Kind.ACTION, description.kind);
        // The directionless parameter is bound by the control plane
        Assert.assertEquals(List.of("value"), Linq.map(description.substitution.getParameters(), p -> p.name));
    }

    @Test(expected = InternalCompilerError.class)
    public void testUnknownMethod() {
        P4Member bad = new P4Member(NONE, new P4TypeMethod(List.of(), VOID), path(H), "reset");
        describe(call(bad));
    }

    @Test
    public void testNamedArguments() {
        P4MethodCallExpression call = call(path(COMBINE), List.of(named("b", constant(2)), named("a", constant(1))));
        ParameterSubstitution substitution = describe(call).substitution;
        List<P4Parameter> parameters = substitution.getParameters();
        Assert.assertEquals(List.of("a", "b"), Linq.map(parameters, p -> p.name));
        Assert.assertEquals("8w1", substitution.lookup(parameters.get(0)).expression.toString());
    }

    @Test(expected = InternalCompilerError.class)
    public void testMissingArgument() {
        describe(call(path(COMBINE), constant(1)));
    }

    @Test(expected = InternalCompilerError.class)
    public void testTooManyArguments() {
        describe(call(path(LOG), constant(1), constant(2)));
    }

    @Test(expected = InternalCompilerError.class)
    public void testDuplicateArgument() {
        describe(call(path(COMBINE), List.of(named("a", constant(2)), named("a", constant(1)))));
    }

    @Test(expected = InternalCompilerError.class)
    public void testPositionalAfterNamed() {
        describe(call(path(COMBINE), List.of(named("b", constant(2)), new P4Argument(constant(1)))));
    }

    @Test
    public void testTypeVariable() {
        P4TypeVar var = new P4TypeVar(NONE, "T");
        P4Parameter value = parameter(P4Direction.INOUT, var, "value");
        P4TypeMethod type = new P4TypeMethod(NONE, List.of(var), List.of(value), VOID);
        P4Method generic = new P4Method(NONE, "clear", type, List.of());
        P4Expression argument = field(path(H), "a");
        P4MethodCallExpression call = call(path(generic), argument);
        P4Compiler compiler = IrBuilder.prepare(program(generic, function("run", List.of(H), new P4MethodCallStatement(call))));
        ParameterSubstitution substitution = MethodCallDescription.resolve(compiler, call).substitution;
        Assert.assertSame(BIT8, substitution.parameterType(value));

        P4MethodCallExpression explicit = new P4MethodCallExpression(
                NONE, VOID, path(generic), List.of(BOOL), List.of(new P4Argument(argument)));
        Assert.assertSame(BOOL, new ParameterSubstitution(explicit, type, false).parameterType(value));
    }
}
