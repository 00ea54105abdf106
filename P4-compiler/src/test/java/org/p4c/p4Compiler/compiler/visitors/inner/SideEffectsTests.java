package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.IrBuilder;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.expression.P4Expression;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

public class SideEffectsTests {
    static final P4Parameter X = parameter(P4Direction.IN, BIT8, "x");

    static boolean check(P4Expression expression) {
        P4Compiler compiler = IrBuilder.prepare(program(
                function("run", List.of(X), new P4ReturnStatement(NONE, expression))));
        return SideEffects.check(compiler, expression);
    }

    @Test
    public void testNoCalls() {
        Assert.assertFalse(check(binary(P4Opcode.ADD, path(X), constant(1))));
    }

    @Test
    public void testImpureCall() {
        Assert.assertTrue(check(call(path(F))));
        Assert.assertTrue(check(binary(P4Opcode.ADD, path(X), call(path(G)))));
    }

    @Test
    public void testPureCall() {
        Assert.assertFalse(check(call(path(HASH), path(X))));
    }

    @Test
    public void testArgumentsOfPureCall() {
        Assert.assertTrue(check(call(path(HASH), call(path(F)))));
    }

    @Test
    public void testVisitorIsReusable() {
        P4Expression impure = call(path(F));
        P4Compiler compiler = IrBuilder.prepare(program(
                function("run", List.of(X), new P4ReturnStatement(NONE, impure))));
        SideEffects visitor = new SideEffects(compiler);
        visitor.apply(impure);
        Assert.assertTrue(visitor.hasSideEffects());
        visitor.apply(constant(2));
        Assert.assertFalse(visitor.hasSideEffects());
    }
}
