import org.junit.jupiter.api.Test;

import com.elara.pine.debug.Debug;
import com.elara.pine.debug.DebugLevel;
import com.elara.pine.debug.DebugSink;

import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PineDebugTest {

    @Test
    public void freshHubDiscardsWithoutInstalledSink() throws Exception {
        // a private loader gives a Debug class whose statics initialize here, whatever ran before
        URL classes = Debug.class.getProtectionDomain().getCodeSource().getLocation();
        try (URLClassLoader isolated = new URLClassLoader(new URL[] {classes}, null)) {
            Class<?> hub = isolated.loadClass(Debug.class.getName());
            assertNotSame(Debug.class, hub);

            Object debug = hub.getMethod("get").invoke(null);
            assertNotNull(hub.getMethod("getSink").invoke(debug));
            assertDoesNotThrow(() -> hub.getMethod("w", String.class, String.class).invoke(debug, "Test", "no sink"));
        }
    }

    @Test
    public void sinkReceivesMessagesAndNullRestoresDiscard() {
        List<String> seen = new ArrayList<>();
        DebugSink capture = (level, tag, message, error) -> seen.add(level + " " + tag + " " + message);
        Debug.get().setSink(capture);
        try {
            Debug.get().w("Parser", "recovered");
            assertEquals(List.of(DebugLevel.WARN + " Parser recovered"), seen);
        } finally {
            Debug.get().setSink(null);
        }
        assertNotNull(Debug.get().getSink());
        assertDoesNotThrow(() -> Debug.get().e("Parser", "dropped"));
        assertEquals(1, seen.size());
    }
}
