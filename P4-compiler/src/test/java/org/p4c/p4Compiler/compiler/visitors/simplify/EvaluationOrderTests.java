package org.p4c.p4Compiler.compiler.visitors.simplify;

import org.p4c.p4Compiler.compiler.P4Compiler;
import org.p4c.p4Compiler.ir.declaration.P4DeclarationVariable;
import org.p4c.p4Compiler.ir.expression.P4PathExpression;
import org.junit.Assert;
import org.junit.Test;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

public class EvaluationOrderTests {
    @Test
    public void testEmptyOrderIsSimple() {
        EvaluationOrder order = new EvaluationOrder(new P4Compiler());
        Assert.assertTrue(order.simple());
        Assert.assertNull(order.getFinal());
    }

    @Test
    public void testCreateTemporary() {
        P4Compiler compiler = new P4Compiler();
        compiler.getReferenceMap().declareName("tmp");
        EvaluationOrder order = new EvaluationOrder(compiler);
        P4DeclarationVariable first = order.createTemporary(BIT8);
        P4DeclarationVariable second = order.createTemporary(BOOL);
        Assert.assertEquals("bit<8> tmp_0;", first.toString());
        Assert.assertEquals("bool tmp_1;", second.toString());
        Assert.assertNull(first.initializer);
        Assert.assertFalse(order.simple());
        Assert.assertTrue(order.getStatements().isEmpty());
    }

    @Test
    public void testAddAssignment() {
        P4Compiler compiler = new P4Compiler();
        EvaluationOrder order = new EvaluationOrder(compiler);
        P4DeclarationVariable temporary = order.createTemporary(BIT8);
        P4PathExpression reference = order.addAssignment(temporary, constant(3));
        Assert.assertEquals("tmp = 8w3;", order.getStatements().get(0).toString());
        Assert.assertEquals("tmp", reference.toString());
        // Each reference is a distinct node bound to the temporary
        Assert.assertNotSame(reference, order.reference(temporary));
        Assert.assertSame(temporary, compiler.getReferenceMap().getDeclaration(reference));
        Assert.assertTrue(compiler.getTypeMap().isLeftValue(reference));
    }

    @Test
    public void testBranchSharesTemporaries() {
        P4Compiler compiler = new P4Compiler();
        EvaluationOrder order = new EvaluationOrder(compiler);
        EvaluationOrder branch = order.branch();
        P4DeclarationVariable temporary = branch.createTemporary(BIT8);
        branch.addAssignment(temporary, constant(1));
        Assert.assertEquals(1, order.getTemporaries().size());
        Assert.assertTrue(order.getStatements().isEmpty());
        Assert.assertEquals(1, branch.getStatements().size());
        Assert.assertEquals("""
                {
                    tmp = 8w1;
                }""", branch.toBlock(NONE).toString());
    }
}
