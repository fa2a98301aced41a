package org.atoms.util;

import org.atoms.analogCompiler.compiler.errors.CompilationError;
import org.junit.Assert;
import org.junit.Test;

/** Unit tests for per-class logging levels */
public class LoggerTests {
    static class BaseStage implements IWritesLogs {}

    static class DerivedStage extends BaseStage {}

    static class OtherStage implements IWritesLogs {}

    static String log(IWritesLogs module, int level) {
        StringBuilder builder = new StringBuilder();
        Appendable save = Logger.INSTANCE.setDebugStream(builder);
        try {
            Logger.INSTANCE.belowLevel(module, level).append("message").newline();
        } finally {
            Logger.INSTANCE.setDebugStream(save);
        }
        return builder.toString();
    }

    @Test
    public void testInheritedLevel() {
        int previous = Logger.INSTANCE.setLoggingLevel(BaseStage.class, 2);
        try {
            Assert.assertEquals(2, Logger.INSTANCE.getLoggingLevel(DerivedStage.class));
            Assert.assertTrue(log(new DerivedStage(), 2).contains("message"));
            Assert.assertEquals("", log(new DerivedStage(), 3));
            Assert.assertEquals("", log(new OtherStage(), 1));

            int derived = Logger.INSTANCE.setLoggingLevel(DerivedStage.class, 0);
            Assert.assertEquals("", log(new DerivedStage(), 1));
            Assert.assertTrue(log(new BaseStage(), 1).contains("message"));
            Logger.INSTANCE.setLoggingLevel(DerivedStage.class, derived);
        } finally {
            Logger.INSTANCE.setLoggingLevel(BaseStage.class, previous);
        }
    }

    @Test
    public void testLevelByName() {
        Logger.INSTANCE.instrument(OtherStage.class);
        int previous = Logger.INSTANCE.setLoggingLevel("OtherStage", 1);
        try {
            Assert.assertEquals(1, Logger.INSTANCE.getLoggingLevel(OtherStage.class));
            Assert.assertTrue(log(new OtherStage(), 1).contains("message"));
        } finally {
            Logger.INSTANCE.setLoggingLevel(OtherStage.class, previous);
        }
        CompilationError error = Assert.assertThrows(CompilationError.class,
                () -> Logger.INSTANCE.setLoggingLevel("UnknownStage", 1));
        Assert.assertTrue(error.getMessage(), error.getMessage().contains("UnknownStage"));
    }
}
