package org.p4c.p4Compiler.compiler;

import com.beust.jcommander.ParameterException;
import org.p4c.p4Compiler.compiler.visitors.simplify.DismantleExpression;
import org.p4c.p4Compiler.ir.P4Program;
import org.p4c.util.Logger;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

import static org.p4c.p4Compiler.compiler.IrBuilder.*;

public class CompilerOptionsTests {
    @Test
    public void testDefaults() {
        CompilerOptions options = CompilerOptions.parse();
        Assert.assertEquals("tmp", options.languageOptions.tempPrefix);
        Assert.assertTrue(options.languageOptions.validate);
        Assert.assertTrue(options.same(CompilerOptions.getDefault()));
    }

    @Test
    public void testLanguageOptions() {
        CompilerOptions options = CompilerOptions.parse("--tempPrefix", "t", "--validate", "false");
        Assert.assertEquals("t", options.languageOptions.tempPrefix);
        Assert.assertFalse(options.languageOptions.validate);
        Assert.assertFalse(options.same(CompilerOptions.getDefault()));
    }

    @Test(expected = ParameterException.class)
    public void testUnknownOption() {
        CompilerOptions.parse("--unroll");
    }

    @Test(expected = ParameterException.class)
    public void testBadLoggingLevel() {
        CompilerOptions.parse("-TDismantleExpression=high");
    }

    @Test
    public void testLogging() {
        CompilerOptions options = CompilerOptions.parse("-TDismantleExpression=1");
        StringBuilder log = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(log);
        try {
            P4Compiler compiler = new P4Compiler(options);
            Assert.assertEquals(1, Logger.INSTANCE.getLoggingLevel(DismantleExpression.class));
            P4Program program = program(function("run", List.of(),
                    statement(call(path(LOG), call(path(F))))));
            compiler.simplifyExpressions(program);
            String output = log.toString();
            Assert.assertTrue(output, output.contains("Dismantling log_value(f()) on the right"));
            Assert.assertTrue(output, output.contains("Result is"));
        } finally {
            Logger.INSTANCE.reset();
            Logger.INSTANCE.setDebugStream(save);
        }
    }

    @Test
    public void testVerbosity() {
        CompilerOptions options = CompilerOptions.parse("-v", "2");
        StringBuilder log = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(log);
        try {
            P4Compiler compiler = new P4Compiler(options);
            compiler.simplifyExpressions(program(function("run", List.of(),
                    statement(call(path(LOG), call(path(F)))))));
            String output = log.toString();
            Assert.assertTrue(output, output.contains("Simplifying expressions in program"));
            Assert.assertTrue(output, output.contains("tmp = f();"));
        } finally {
            Logger.INSTANCE.reset();
            Logger.INSTANCE.setDebugStream(save);
        }
    }
}
