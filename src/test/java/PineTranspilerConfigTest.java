import org.junit.jupiter.api.Test;

import com.elara.pine.PineTranspiler;
import com.elara.pine.TranspilerConfig;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class PineTranspilerConfigTest {

    @Test
    public void classpathDefaults() {
        TranspilerConfig config = TranspilerConfig.defaults();
        assertEquals(PineTranspiler.Mode.STRICT, config.mode);
        assertEquals(100_000, config.maxTokenCount);
        assertEquals(500, config.maxRecursionDepth);
        assertEquals(10_000, config.maxLoopIterations);
        assertEquals("  ", config.indentUnit);
    }

    @Test
    public void propertiesOverrideBuiltIns() {
        Properties props = new Properties();
        props.setProperty("pine.mode", "lenient");
        props.setProperty("pine.indentWidth", "4");
        props.setProperty("pine.maxLoopIterations", " 250 ");

        TranspilerConfig config = TranspilerConfig.fromProperties(props);
        assertEquals(PineTranspiler.Mode.LENIENT, config.mode);
        assertEquals("    ", config.indentUnit);
        assertEquals(250, config.maxLoopIterations);
        assertEquals(500, config.maxRecursionDepth);
    }

    @Test
    public void malformedValuesAreRejected() {
        Properties notANumber = new Properties();
        notANumber.setProperty("pine.maxTokenCount", "lots");
        assertThrows(IllegalArgumentException.class, () -> TranspilerConfig.fromProperties(notANumber));

        Properties zero = new Properties();
        zero.setProperty("pine.maxRecursionDepth", "0");
        assertThrows(IllegalArgumentException.class, () -> TranspilerConfig.fromProperties(zero));

        Properties badMode = new Properties();
        badMode.setProperty("pine.mode", "sloppy");
        assertThrows(IllegalArgumentException.class, () -> TranspilerConfig.fromProperties(badMode));
    }
}
