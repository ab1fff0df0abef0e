import org.junit.jupiter.api.Test;

import com.elara.pine.PineTranspiler;
import com.elara.pine.TranspileResult;
import com.elara.pine.ValidationResult;
import com.elara.pine.debug.Debug;
import com.elara.pine.generator.FunctionRegistry;
import com.fasterxml.jackson.databind.JsonNode;

import static org.junit.jupiter.api.Assertions.*;

public class PineTranspilerTest {

    private static final String SCRIPT =
            "//@version=5\n" +
            "indicator(\"Momentum\", overlay=false)\n" +
            "len = input.int(10, \"Length\")\n" +
            "mom = close - close[len]\n" +
            "plot(mom, \"Momentum\")\n" +
            "alertcondition(mom > 0, \"Up\")\n" +
            "alertcondition(mom < 0, \"Down\")\n";

    @Test
    public void transpilesScriptWithMetadata() {
        TranspileResult result = new PineTranspiler().transpile(SCRIPT);

        assertTrue(result.success, () -> result.error);
        assertNull(result.error);
        assertTrue(result.output.startsWith("const _series_close = context.new_var(close);\n"), result.output);
        assertTrue(result.output.contains("let mom = (close - _getHistorical_close(len));"), result.output);
        assertEquals("Momentum", result.metadata.name());
        assertEquals(1, result.metadata.inputs().size());
        assertEquals(1, result.metadata.plots().size());
        assertEquals(1, result.metadata.warnings().size());
        assertTrue(result.parseErrors.isEmpty());
    }

    @Test
    public void strictModeFailsOnFirstSyntaxError() {
        TranspileResult result = new PineTranspiler().transpile("x = 1 +\ny = 2\n");

        assertFalse(result.success);
        assertNull(result.output);
        assertTrue(result.error.contains("Expect expression."), result.error);
        assertEquals(Integer.valueOf(1), result.errorLine);
        assertNotNull(result.errorColumn);
        assertEquals(1, result.parseErrors.size());
    }

    @Test
    public void lenientModeGeneratesFromPartialTree() {
        PineTranspiler transpiler = new PineTranspiler();
        transpiler.setMode(PineTranspiler.Mode.LENIENT);
        TranspileResult result = transpiler.transpile("x = 1 +\ny = 2\n");

        assertTrue(result.success);
        assertEquals("let y = 2;\n", result.output);
        assertEquals(1, result.parseErrors.size());
    }

    @Test
    public void lexErrorsBecomeResults() {
        TranspileResult result = new PineTranspiler().transpile("s = \"abc\n");

        assertFalse(result.success);
        assertTrue(result.error.contains("Unterminated string literal"), result.error);
        assertEquals(Integer.valueOf(1), result.errorLine);
        assertEquals(Integer.valueOf(5), result.errorColumn);
    }

    @Test
    public void tokenLimitBecomesResult() {
        PineTranspiler transpiler = new PineTranspiler();
        transpiler.setMaxTokenCount(10);
        String source = "x = 1 + 2 + 3 + 4 + 5 + 6\n";

        TranspileResult result = transpiler.transpile(source);
        assertFalse(result.success);
        assertTrue(result.error.startsWith("Input too large"), result.error);

        ValidationResult validation = transpiler.validate(source);
        assertFalse(validation.valid);
        assertTrue(validation.reason.startsWith("Input too large"), validation.reason);
    }

    @Test
    public void recursionCeilingIsConfigurable() {
        PineTranspiler transpiler = new PineTranspiler();
        transpiler.setMaxRecursionDepth(20);
        String deep = "x = " + "(".repeat(30) + "1" + ")".repeat(30) + "\n";

        TranspileResult result = assertDoesNotThrow(() -> transpiler.transpile(deep));
        assertFalse(result.success);
        assertTrue(result.error.contains("recursion depth"), result.error);
    }

    @Test
    public void emptySourceGivesEmptyOutput() {
        TranspileResult result = new PineTranspiler().transpile("  \n\t\n");
        assertTrue(result.success);
        assertEquals("", result.output);
        assertEquals("Untitled Script", result.metadata.name());

        assertTrue(new PineTranspiler().transpile(null).success);
    }

    @Test
    public void validateRunsLexerAndParserOnly() {
        PineTranspiler transpiler = new PineTranspiler();

        ValidationResult ok = transpiler.validate("x = 1\nplot(x)\n");
        assertTrue(ok.valid);
        assertNull(ok.reason);

        ValidationResult bad = transpiler.validate("x = 1 +\ny = 2\n");
        assertFalse(bad.valid);
        assertTrue(bad.reason.startsWith("[line 1:"), bad.reason);

        ValidationResult lexBad = transpiler.validate("x = 1 $ 2\n");
        assertFalse(lexBad.valid);
        assertTrue(lexBad.reason.contains("Unexpected character"), lexBad.reason);
    }

    @Test
    public void settersShapeTheOutput() {
        PineTranspiler transpiler = new PineTranspiler();
        transpiler.setMaxLoopIterations(25);
        transpiler.setIndentUnit("\t");

        TranspileResult result = transpiler.transpile("while x\n    x := false\n");
        assertTrue(result.output.contains("\tif (++_loop_0 > 25) throw new Error(\"Loop limit exceeded (max 25 iterations)\");"),
                result.output);

        assertThrows(IllegalArgumentException.class, () -> transpiler.setMaxLoopIterations(0));
    }

    @Test
    public void emptyRegistryPassesCallsThrough() {
        PineTranspiler transpiler = new PineTranspiler();
        transpiler.setFunctionRegistry(FunctionRegistry.empty());
        TranspileResult result = transpiler.transpile("a = ta.sma(close, 5)\n");
        assertEquals("let a = ta.sma(close, 5);\n", result.output);
    }

    @Test
    public void resultSerializesToJson() {
        JsonNode ok = new PineTranspiler().transpile(SCRIPT).toJson();
        assertTrue(ok.get("success").asBoolean());
        assertTrue(ok.get("output").asText().contains("_getHistorical_close"));
        assertEquals("Momentum", ok.get("metadata").get("name").asText());
        assertEquals("unsupported", ok.get("metadata").get("warnings").get(0).get("severity").asText());

        JsonNode failed = new PineTranspiler().transpile("x = )\n").toJson();
        assertFalse(failed.get("success").asBoolean());
        assertEquals(1, failed.get("errorLine").asInt());
        assertEquals(1, failed.get("parseErrors").size());
        assertFalse(failed.has("output"));
    }

    @Test
    public void transpilesWithNoSinkInstalled() {
        Debug.get().setSink(null);
        TranspileResult result = assertDoesNotThrow(() -> new PineTranspiler().transpile("x = 1 + 2\n"));
        assertTrue(result.success, () -> result.error);
        assertEquals("let x = (1 + 2);\n", result.output);
        assertTrue(new PineTranspiler().validate("x = 1\n").valid);
    }

    @Test
    public void longOperatorChainFailsCleanly() {
        String chain = "x = 1" + " + 1".repeat(40_000) + "\n";
        PineTranspiler transpiler = new PineTranspiler();

        TranspileResult result = assertDoesNotThrow(() -> transpiler.transpile(chain));
        assertFalse(result.success);
        assertTrue(result.error.contains("recursion depth"), result.error);

        ValidationResult validation = assertDoesNotThrow(() -> transpiler.validate(chain));
        assertFalse(validation.valid);
    }

    @Test
    public void longConditionalChainFailsCleanly() {
        String chain = "x = " + "c ? 1 : ".repeat(20_000) + "0\n";
        PineTranspiler transpiler = new PineTranspiler();

        TranspileResult result = assertDoesNotThrow(() -> transpiler.transpile(chain));
        assertFalse(result.success);
        assertTrue(result.error.contains("recursion depth"), result.error);

        ValidationResult validation = assertDoesNotThrow(() -> transpiler.validate(chain));
        assertFalse(validation.valid);
    }
}
