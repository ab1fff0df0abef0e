import org.junit.jupiter.api.Test;

import com.elara.pine.generator.FunctionMapping;
import com.elara.pine.generator.FunctionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class PineFunctionRegistryTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    public void bundledDefaultsCoverTechnicalAnalysisAndMath() {
        FunctionRegistry registry = FunctionRegistry.defaults();

        FunctionMapping sma = registry.lookup("ta.sma").orElseThrow();
        assertEquals("Std.sma", sma.targetName);
        assertTrue(sma.needsSeries);
        assertEquals(FunctionMapping.ContextArg.APPEND, sma.contextArg);
        assertEquals(2, sma.arity);

        FunctionMapping abs = registry.lookup("math.abs").orElseThrow();
        assertEquals("Math.abs", abs.targetName);
        assertFalse(abs.needsSeries);
        assertEquals(FunctionMapping.ContextArg.NONE, abs.contextArg);

        assertTrue(registry.lookup("plot").isEmpty());
        assertTrue(registry.lookup(null).isEmpty());
        assertSame(registry, FunctionRegistry.defaults());
    }

    @Test
    public void loadsFromJson() throws IOException {
        FunctionRegistry registry = FunctionRegistry.fromJson(new ObjectMapper(), json(
                "{ \"acme.score\": { \"target\": \"Acme.score\", \"context\": \"prepend\", \"description\": \"d\" } }"));
        assertEquals(1, registry.size());

        FunctionMapping m = registry.lookup("acme.score").orElseThrow();
        assertEquals("Acme.score", m.targetName);
        assertEquals(FunctionMapping.ContextArg.PREPEND, m.contextArg);
        assertEquals(FunctionMapping.ANY_ARITY, m.arity);
        assertEquals("d", m.description);
    }

    @Test
    public void rejectsMappingWithoutTarget() {
        IOException e = assertThrows(IOException.class,
                () -> FunctionRegistry.fromJson(new ObjectMapper(), json("{ \"x\": { \"arity\": 1 } }")));
        assertTrue(e.getMessage().contains("'x'"), e.getMessage());
    }

    @Test
    public void rejectsNonObjectRoot() {
        assertThrows(IOException.class,
                () -> FunctionRegistry.fromJson(new ObjectMapper(), json("[1, 2]")));
    }

    @Test
    public void emptyRegistryMatchesNothing() {
        assertTrue(FunctionRegistry.empty().lookup("ta.sma").isEmpty());
        assertEquals(0, FunctionRegistry.empty().size());
    }

    @Test
    public void rejectsUnknownContextPlacement() {
        IOException e = assertThrows(IOException.class, () -> FunctionRegistry.fromJson(new ObjectMapper(),
                json("{ \"f\": { \"target\": \"g\", \"context\": \"middle\" } }")));
        assertTrue(e.getMessage().contains("middle"), e.getMessage());

        assertThrows(IOException.class, () -> FunctionRegistry.fromJson(new ObjectMapper(),
                json("{ \"f\": { \"target\": \"\" } }")));
    }
}
