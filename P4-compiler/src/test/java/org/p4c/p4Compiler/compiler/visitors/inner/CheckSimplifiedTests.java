package org.p4c.p4Compiler.compiler.visitors.inner;

import org.p4c.p4Compiler.compiler.IrBuilder;
import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.compiler.errors.InternalCompilerError;
import org.p4c.p4Compiler.ir.IP4StatOrDecl;
import org.p4c.p4Compiler.ir.P4Direction;
import org.p4c.p4Compiler.ir.P4Parameter;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.declaration.P4Table;
import org.p4c.p4Compiler.ir.expression.P4Opcode;
import org.p4c.p4Compiler.ir.statement.P4EmptyStatement;
import org.p4c.p4Compiler.ir.statement.P4IfStatement;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

public class CheckSimplifiedTests {
    static final P4Parameter C = parameter(P4Direction.IN, BOOL, "c");
    static final P4DeclarationVariable X = variable(BIT8, "x");
    static final P4Table T = new P4Table(NONE, "t", List.of());

    static void check(IP4StatOrDecl... body) {
        IP4StatOrDecl[] components = new IP4StatOrDecl[body.length + 1];
        components[0] = X;
        System.arraycopy(body, 0, components, 1, body.length);
        P4Program program = program(T, function("run", List.of(C), components));
        P4Compiler compiler = IrBuilder.prepare(program);
        new CheckSimplified(compiler).apply(program);
    }

    @Test
    public void testSimpleStatements() {
        check(assign(path(X), call(path(F))),
                statement(call(path(UPDATE), path(X))),
                assign(path(X), binary(P4Opcode.ADD, path(X), call(path(HASH), path(X)))),
                new P4IfStatement(NONE, applyResult(T, "hit"), new P4EmptyStatement(NONE), null));
    }

    @Test(expected = InternalCompilerError.class)
    public void testNestedCall() {
        check(assign(path(X), binary(P4Opcode.ADD, call(path(F)), call(path(G)))));
    }

    @Test(expected = InternalCompilerError.class)
    public void testCallAsArgument() {
        check(statement(call(path(LOG), call(path(F)))));
    }

    @Test(expected = InternalCompilerError.class)
    public void testCallInCondition() {
        check(new P4IfStatement(NONE, call(path(F2)), new P4EmptyStatement(NONE), null));
    }

    @Test(expected = InternalCompilerError.class)
    public void testShortCircuit() {
        check(new P4IfStatement(NONE, and(path(C), path(C)), new P4EmptyStatement(NONE), null));
    }

    @Test(expected = InternalCompilerError.class)
    public void testConditional() {
        check(assign(path(X), mux(path(C), constant(1), constant(2))));
    }
}
