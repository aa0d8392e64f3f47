package club.ppmc.aidbg.service;

import static org.junit.jupiter.api.Assertions.*;

import club.ppmc.aidbg.model.ErrorKind;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateExpressionEvaluatorTest {

    private final TemplateExpressionEvaluator evaluator = new TemplateExpressionEvaluator();

    @Test
    void substitutesGlobalAndLocalVariables() {
        evaluator.setVariable("entry", "0x401000");
        assertEquals("bp 0x401000", evaluator.evaluate("bp ${entry}").getValue());
        assertEquals("bp 0x500000", evaluator.evaluate("bp ${entry}", Map.of("entry", "0x500000")).getValue());
        assertEquals("no placeholders", evaluator.evaluate("no placeholders").getValue());
    }

    @Test
    void replacementTextIsLiteral() {
        evaluator.setVariable("v", "$1\\x");
        assertEquals("a $1\\x b", evaluator.evaluate("a ${v} b").getValue());
    }

    @Test
    void undefinedVariableIsValidationError() {
        assertEquals(ErrorKind.VALIDATION, evaluator.evaluate("bp ${missing}").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, evaluator.getVariable("missing").getErrorKind());
        assertEquals(ErrorKind.VALIDATION, evaluator.evaluate(null, Map.of()).getErrorKind());
    }

    @Test
    void nullValueRemovesVariable() {
        evaluator.setVariable("x", "1");
        assertEquals("1", evaluator.getVariable("x").getValue());
        evaluator.setVariable("x", null);
        assertTrue(evaluator.getVariable("x").isError());
    }

    @Test
    void rejectsInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> evaluator.setVariable("1abc", "v"));
        assertThrows(IllegalArgumentException.class, () -> evaluator.setVariable(null, "v"));
    }

    @Test
    void closeClearsGlobals() {
        evaluator.setVariable("x", "1");
        evaluator.close();
        assertTrue(evaluator.getVariable("x").isError());
    }
}
