package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.IrBuilder;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4ArrayIndex;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4Member;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.expression.P4UnaryExpression;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.p4c.p4Compiler.ir.type.P4TypeMethod;
import org.p4c.p4Compiler.ir.type.P4TypeStack;
import org.p4c.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

/** Tests that dismantle individual expressions. */
public class DismantleExpressionTests {
    static final P4Parameter C = parameter(P4Direction.IN, BOOL, "c");
    static final P4Parameter H = parameter(P4Direction.INOUT, HEADER, "h");
    static final P4Parameter HS = parameter(P4Direction.INOUT, new P4TypeStack(NONE, HEADER, 4), "hs");
    static final P4DeclarationVariable X = variable(BIT8, "x");
    static final P4Table T = new P4Table(NONE, "t", List.of("NoAction"));

    /** Resolve the references in the expression and compute its flags. */
    static P4Compiler prepare(P4Expression expression) {
        P4Function run = function("run", List.of(C, H, HS), X, new P4ReturnStatement(NONE, expression));
        return IrBuilder.prepare(program(T, run));
    }

    static String statements(EvaluationOrder order) {
        return String.join("\n", Linq.map(order.getStatements(), Object::toString));
    }

    static List<String> temporaries(EvaluationOrder order) {
        return Linq.map(order.getTemporaries(), t -> t.name);
    }

    @Test
    public void testSimpleExpression() {
        P4Member isValid = new P4Member(NONE, new P4TypeMethod(List.of(), BOOL), path(H), MethodCallDescription.IS_VALID);
        P4Expression expression = new P4UnaryExpression(NONE, BOOL, P4Opcode.LNOT, call(isValid));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertTrue(order.simple());
        Assert.assertSame(expression, order.getFinal());
    }

    @Test
    public void testLeftValueField() {
        P4Expression expression = field(path(H), "a");
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, true);
        Assert.assertTrue(order.simple());
        Assert.assertSame(expression, order.getFinal());
    }

    @Test
    public void testCallOrder() {
        P4Expression expression = binary(P4Opcode.ADD, call(path(F)), call(path(G)));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals(List.of("tmp", "tmp_0", "tmp_1"), temporaries(order));
        Assert.assertEquals("""
                tmp = f();
                tmp_0 = g();
                tmp_1 = tmp + tmp_0;""", statements(order));
        Assert.assertEquals("tmp_1", order.getFinal().toString());
        Assert.assertTrue(compiler.getTypeMap().isLeftValue(order.getFinal()));
    }

    @Test
    public void testShortCircuitOr() {
        P4Expression expression = or(path(C), call(path(F2)));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals(List.of("tmp", "tmp_0"), temporaries(order));
        Assert.assertEquals("""
                if (c) tmp = true; else {
                    tmp_0 = f2();
                    tmp = tmp_0;
                }""", statements(order));
        Assert.assertEquals("tmp", order.getFinal().toString());
    }

    @Test
    public void testShortCircuitWithoutSideEffects() {
        P4Expression expression = and(path(C), path(C));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals("""
                if (!c) tmp = false; else {
                    tmp = c;
                }""", statements(order));
    }

    @Test
    public void testConditional() {
        P4Expression expression = mux(path(C), call(path(F)), constant(0));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals(List.of("tmp", "tmp_0"), temporaries(order));
        Assert.assertEquals("""
                if (c) {
                    tmp_0 = f();
                    tmp = tmp_0;
                } else {
                    tmp = 8w0;
                }""", statements(order));
        Assert.assertEquals("tmp", order.getFinal().toString());
    }

    @Test
    public void testConstantArgumentIsNotCopied() {
        P4Expression expression = call(path(COMBINE), constant(1), call(path(F)));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals("""
                tmp = f();
                tmp_0 = tmp;
                combine(8w1, tmp_0);""", statements(order));
        Assert.assertNull(order.getFinal());
    }

    @Test
    public void testOutArgument() {
        P4Expression expression = call(path(READ), path(X));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false, true);
        // No copy into the temporary before the call
        Assert.assertEquals("""
                read(tmp);
                x = tmp;""", statements(order));
        Assert.assertNull(order.getFinal());
    }

    @Test
    public void testIndexIsEvaluatedOnce() {
        P4ArrayIndex element = new P4ArrayIndex(NONE, HEADER, path(HS), call(path(F)));
        P4Expression expression = call(path(UPDATE), field(element, "a"));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false, true);
        Assert.assertEquals("""
                tmp = f();
                tmp_0 = hs[tmp].a;
                update(tmp_0);
                hs[tmp].a = tmp_0;""", statements(order));
    }

    @Test
    public void testArgumentsInParameterOrder() {
        P4Expression expression = call(path(COMBINE), List.of(
                named("b", call(path(F))),
                named("a", path(X))));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false, true);
        Assert.assertEquals("""
                tmp = x;
                tmp_0 = f();
                tmp_1 = tmp_0;
                combine(a = tmp, b = tmp_1);""", statements(order));
    }

    @Test
    public void testPureCallWithImpureArgument() {
        P4Expression expression = call(path(HASH), call(path(F)));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertEquals("""
                tmp = f();
                tmp_0 = tmp;
                tmp_1 = hash(tmp_0);""", statements(order));
        Assert.assertEquals("tmp_1", order.getFinal().toString());
    }

    @Test
    public void testPureCallIsUnchanged() {
        P4Expression expression = call(path(HASH), path(X));
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertTrue(order.simple());
        Assert.assertSame(expression, order.getFinal());
    }

    @Test
    public void testTableHit() {
        P4Expression expression = applyResult(T, TableApplySolver.HIT);
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false);
        Assert.assertTrue(order.simple());
        Assert.assertSame(expression, order.getFinal());
    }

    @Test
    public void testTableApplyResultUnused() {
        P4Expression expression = apply(T);
        P4Compiler compiler = prepare(expression);
        EvaluationOrder order = new DismantleExpression(compiler).dismantle(expression, false, true);
        Assert.assertTrue(order.getTemporaries().isEmpty());
        Assert.assertEquals("t.apply();", statements(order));
    }

    @Test(expected = InternalCompilerError.class)
    public void testCallAsLeftValue() {
        P4Expression expression = call(path(F));
        P4Compiler compiler = prepare(expression);
        new DismantleExpression(compiler).dismantle(expression, true);
    }
}
