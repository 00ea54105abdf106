package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.CompilerOptions;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4Action;
import org.p4c.p4Compiler.ir.declaration.P4Control;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Function;
import org.p4c.p4Compiler.ir.declaration.P4Parser;
import org.p4c.p4Compiler.ir.declaration.P4ParserState;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4CastExpression;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.expression.P4SelectCase;
import org.p4c.p4Compiler.ir.expression.P4SelectExpression;
import org.p4c.p4Compiler.ir.expression.P4UnaryExpression;
import org.p4c.p4Compiler.ir.statement.P4ExitStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.p4c.p4Compiler.ir.statement.P4ReturnStatement;
import org.p4c.p4Compiler.ir.statement.P4SwitchCase;
import org.p4c.p4Compiler.ir.statement.P4SwitchStatement;
import org.p4c.p4Compiler.ir.type.P4TypeBits;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

/** Tests for the whole expression simplification pass. */
public class SimplifyExpressionsTests {
    static String simplify(P4Program program, String declaration) {
        P4Compiler compiler = new P4Compiler();
        P4Program result = compiler.simplifyExpressions(program);
        return result.getDeclaration(declaration).toString();
    }

    @Test
    public void testCallsAreEvaluatedLeftToRight() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                assign(path(x), binary(P4Opcode.ADD, call(path(F)), call(path(G)))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<8> tmp_0;
                    bit<8> tmp_1;
                    bit<8> x;
                    {
                        tmp = f();
                        tmp_0 = g();
                        tmp_1 = tmp + tmp_0;
                        x = tmp_1;
                    }
                }""", result);
    }

    @Test
    public void testShortCircuitAnd() {
        P4Parameter c = parameter(P4Direction.IN, BOOL, "c");
        P4DeclarationVariable b = variable(BOOL, "b");
        P4Function run = function("run", List.of(c), b,
                assign(path(b), and(path(c), call(path(F2)))));
        String result = simplify(program(run), "run");
        // f2 is only called when c is true
        Assert.assertEquals("""
                void run(in bool c) {
                    bool tmp;
                    bool tmp_0;
                    bool b;
                    {
                        if (!c) tmp = false; else {
                            tmp_0 = f2();
                            tmp = tmp_0;
                        }
                        b = tmp;
                    }
                }""", result);
    }

    @Test
    public void testInoutCopyBack() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                statement(call(path(UPDATE), path(x))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<8> x;
                    {
                        tmp = x;
                        update(tmp);
                        x = tmp;
                    }
                }""", result);
    }

    @Test
    public void testVoidCallIsUnchanged() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                statement(call(path(LOG), path(x))),
                assign(path(x), call(path(HASH), path(x))));
        P4Program program = program(run);
        P4Program result = new P4Compiler().simplifyExpressions(program);
        Assert.assertSame(program, result);
    }

    @Test
    public void testTableHitIsNotHoisted() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4Table t = new P4Table(NONE, "t", List.of("NoAction"));
        P4Control c = new P4Control(NONE, "c", List.of(h), List.of(t), block(
                new P4IfStatement(NONE, applyResult(t, TableApplySolver.HIT),
                        assign(field(path(h), "a"), constant(1)), null)));
        P4Program program = program(c);
        P4Program result = new P4Compiler().simplifyExpressions(program);
        Assert.assertSame(program, result);
    }

    @Test
    public void testSwitchOnActionRun() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4Table t = new P4Table(NONE, "t", List.of("NoAction"));
        P4SwitchCase defaultCase = new P4SwitchCase(NONE, null,
                block(assign(field(path(h), "b"), call(path(F)))));
        P4Control c = new P4Control(NONE, "c", List.of(h), List.of(t), block(
                new P4SwitchStatement(NONE, applyResult(t, TableApplySolver.ACTION_RUN), List.of(defaultCase))));
        String result = simplify(program(c), "c");
        Assert.assertEquals("""
                control c(inout H h) {
                    table t {
                        actions = { NoAction; }
                    }
                    bit<8> tmp;
                    apply {
                        switch (t.apply().action_run) {
                            default: {
                                {
                                    tmp = f();
                                    h.b = tmp;
                                }
                            }
                        }
                    }
                }""", result);
    }

    @Test
    public void testEnumComparisonIsHoisted() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4DeclarationVariable cond = variable(BOOL, "tmp_cond");
        P4Function run = function("run", List.of(h), cond,
                assign(path(cond), binary(P4Opcode.EQ, enumMember(ENUM, "First"), enumMember(ENUM, "Second"))),
                new P4IfStatement(NONE, path(cond),
                        assign(field(path(h), "c"), field(path(h), "a")),
                        assign(field(path(h), "c"), field(path(h), "b"))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run(inout H h) {
                    bool tmp;
                    bool tmp_cond;
                    {
                        tmp = E.First == E.Second;
                        tmp_cond = tmp;
                    }
                    if (tmp_cond) h.c = h.a; else h.c = h.b;
                }""", result);
    }

    @Test
    public void testTemporariesInControlAndAction() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4Action a = action("a", List.of(), assign(field(path(h), "a"), call(path(F))));
        P4Control c = new P4Control(NONE, "c", List.of(h), List.of(a), block(
                assign(field(path(h), "b"), binary(P4Opcode.ADD, call(path(F)), constant(1)))));
        String result = simplify(program(c), "c");
        Assert.assertEquals("""
                control c(inout H h) {
                    action a() {
                        bit<8> tmp;
                        {
                            tmp = f();
                            h.a = tmp;
                        }
                    }
                    bit<8> tmp_0;
                    bit<8> tmp_1;
                    apply {
                        {
                            tmp_0 = f();
                            tmp_1 = tmp_0 + 8w1;
                            h.b = tmp_1;
                        }
                    }
                }""", result);
    }

    @Test
    public void testParserState() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4SelectExpression select = new P4SelectExpression(NONE,
                List.of(binary(P4Opcode.ADD, field(path(h), "a"), constant(1))),
                List.of(new P4SelectCase(NONE, constant(1), "accept"),
                        new P4SelectCase(NONE, null, "reject")));
        P4ParserState start = new P4ParserState(NONE, "start",
                List.of(assign(field(path(h), "a"), call(path(F)))), select, null);
        P4Parser p = new P4Parser(NONE, "p", List.of(h), List.of(), List.of(start));
        P4Compiler compiler = new P4Compiler();
        P4Program result = compiler.simplifyExpressions(program(p));
        P4ParserState state = result.getDeclaration("p").to(P4Parser.class).states.get(0);
        Assert.assertEquals("""
                state start {
                    bit<8> tmp;
                    bit<8> tmp_0;
                    {
                        tmp = f();
                        h.a = tmp;
                    }
                    tmp_0 = h.a + 8w1;
                    transition select(tmp_0) {
                        8w1: accept;
                        default: reject;
                    }
                }""", state.toString());
    }

    @Test
    public void testVariableInitializer() {
        P4DeclarationVariable x = new P4DeclarationVariable(NONE, BIT8, "x", call(path(F)));
        P4Function run = function("run", List.of(), x,
                statement(call(path(LOG), path(x))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<8> x;
                    {
                        tmp = f();
                        x = tmp;
                    }
                    log_value(x);
                }""", result);
    }

    @Test
    public void testReturn() {
        P4Parameter v = parameter(P4Direction.IN, BIT8, "v");
        P4Function compute = new P4Function(NONE, BIT8, "compute", List.of(v), block(
                new P4ReturnStatement(NONE, binary(P4Opcode.ADD, path(v), call(path(F))))));
        String result = simplify(program(compute), "compute");
        Assert.assertEquals("""
                bit<8> compute(in bit<8> v) {
                    bit<8> tmp;
                    bit<8> tmp_0;
                    {
                        tmp = f();
                        tmp_0 = v + tmp;
                        return tmp_0;
                    }
                }""", result);
    }

    @Test
    public void testConditionBeforeBranches() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                new P4IfStatement(NONE, call(path(F2)), assign(path(x), call(path(F))), null));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bool tmp;
                    bit<8> tmp_0;
                    bit<8> x;
                    {
                        tmp = f2();
                        if (tmp) {
                            tmp_0 = f();
                            x = tmp_0;
                        }
                    }
                }""", result);
    }

    @Test
    public void testTempPrefix() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x, assign(path(x), call(path(F))));
        P4Compiler compiler = new P4Compiler(CompilerOptions.parse("--tempPrefix", "t"));
        P4Program result = compiler.simplifyExpressions(program(run));
        Assert.assertEquals("""
                void run() {
                    bit<8> t;
                    bit<8> x;
                    {
                        t = f();
                        x = t;
                    }
                }""", result.getDeclaration("run").toString());
    }

    @Test
    public void testFreshNamesAvoidProgramNames() {
        P4DeclarationVariable tmp = variable(BIT8, "tmp");
        P4Function run = function("run", List.of(), tmp, assign(path(tmp), call(path(F))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp_0;
                    bit<8> tmp;
                    {
                        tmp_0 = f();
                        tmp = tmp_0;
                    }
                }""", result);
    }

    @Test
    public void testConditionalExpression() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                assign(path(x), mux(call(path(F2)), call(path(F)), constant(0))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bool tmp;
                    bit<8> tmp_0;
                    bit<8> tmp_1;
                    bit<8> x;
                    {
                        tmp = f2();
                        if (tmp) {
                            tmp_1 = f();
                            tmp_0 = tmp_1;
                        } else {
                            tmp_0 = 8w0;
                        }
                        x = tmp_0;
                    }
                }""", result);
    }

    @Test
    public void testControlLocalInitializer() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4DeclarationVariable x = new P4DeclarationVariable(NONE, BIT8, "x", call(path(F)));
        P4DeclarationVariable y = new P4DeclarationVariable(NONE, BIT8, "y", constant(2));
        P4Control c = new P4Control(NONE, "c", List.of(h), List.of(x, y), block(
                assign(field(path(h), "a"), path(x))));
        String result = simplify(program(c), "c");
        Assert.assertEquals("""
                control c(inout H h) {
                    bit<8> x;
                    bit<8> y = 8w2;
                    bit<8> tmp;
                    apply {
                        {
                            tmp = f();
                            x = tmp;
                        }
                        h.a = x;
                    }
                }""", result);
    }

    @Test
    public void testParserLocalInitializer() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4DeclarationVariable x = new P4DeclarationVariable(NONE, BIT8, "x", call(path(F)));
        P4ParserState start = new P4ParserState(NONE, P4ParserState.START,
                List.of(assign(field(path(h), "a"), path(x))), null, "accept");
        P4Parser p = new P4Parser(NONE, "p", List.of(h), List.of(x), List.of(start));
        String result = simplify(program(p), "p");
        Assert.assertEquals("""
                parser p(inout H h) {
                    bit<8> x;
                    bit<8> tmp;
                    state start {
                        {
                            tmp = f();
                            x = tmp;
                        }
                        h.a = x;
                        transition accept;
                    }
                }""", result);
    }

    @Test(expected = InternalCompilerError.class)
    public void testParserInitializerWithoutStartState() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4DeclarationVariable x = new P4DeclarationVariable(NONE, BIT8, "x", call(path(F)));
        P4ParserState first = new P4ParserState(NONE, "first",
                List.of(assign(field(path(h), "a"), path(x))), null, "accept");
        P4Parser p = new P4Parser(NONE, "p", List.of(h), List.of(x), List.of(first));
        simplify(program(p), "p");
    }

    @Test
    public void testSwitchOnComputedSelector() {
        P4Parameter h = parameter(P4Direction.INOUT, HEADER, "h");
        P4SwitchCase one = new P4SwitchCase(NONE, constant(1),
                block(assign(field(path(h), "a"), call(path(G)))));
        P4SwitchCase defaultCase = new P4SwitchCase(NONE, null, block());
        P4Function run = function("run", List.of(h),
                new P4SwitchStatement(NONE,
                        new P4UnaryExpression(NONE, BIT8, P4Opcode.NEG, call(path(F))),
                        List.of(one, defaultCase)));
        String result = simplify(program(run), "run");
        // The selector is evaluated before any case body
        Assert.assertEquals("""
                void run(inout H h) {
                    bit<8> tmp;
                    bit<8> tmp_0;
                    {
                        tmp = f();
                        switch (-tmp) {
                            8w1: {
                                {
                                    tmp_0 = g();
                                    h.a = tmp_0;
                                }
                            }
                            default: { }
                        }
                    }
                }""", result);
    }

    @Test
    public void testUnaryOfCall() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                assign(path(x), new P4UnaryExpression(NONE, BIT8, P4Opcode.CMPL, call(path(F)))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<8> x;
                    {
                        tmp = f();
                        x = ~tmp;
                    }
                }""", result);
    }

    @Test
    public void testCastOfCall() {
        P4TypeBits bit16 = new P4TypeBits(NONE, 16, false);
        P4DeclarationVariable wide = variable(bit16, "wide");
        P4Function run = function("run", List.of(), wide,
                assign(path(wide), new P4CastExpression(NONE, bit16, call(path(F)))));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<16> wide;
                    {
                        tmp = f();
                        wide = (bit<16>)tmp;
                    }
                }""", result);
    }

    @Test
    public void testExitIsKept() {
        P4DeclarationVariable x = variable(BIT8, "x");
        P4Function run = function("run", List.of(), x,
                assign(path(x), call(path(F))),
                new P4ExitStatement(NONE));
        String result = simplify(program(run), "run");
        Assert.assertEquals("""
                void run() {
                    bit<8> tmp;
                    bit<8> x;
                    {
                        tmp = f();
                        x = tmp;
                    }
                    exit;
                }""", result);
    }
}
