import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.elara.pine.PineCli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PineCliTest {

    @TempDir
    Path dir;

    private Path write(String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    @Test
    public void transpilesToOutputFile() throws IOException {
        Path src = write("ok.pine", "x = close + 1\n");
        Path out = dir.resolve("ok.js");

        int code = PineCli.run(new String[] {"transpile", src.toString(), "-o", out.toString()});

        assertEquals(PineCli.EXIT_OK, code);
        assertEquals("let x = (close + 1);\n", Files.readString(out, StandardCharsets.UTF_8));
    }

    @Test
    public void writesJsonResult() throws IOException {
        Path src = write("ok.pine", "indicator(\"J\")\nplot(close)\n");
        Path out = dir.resolve("ok.json");

        assertEquals(PineCli.EXIT_OK,
                PineCli.run(new String[] {"transpile", src.toString(), "--json", "-o", out.toString()}));
        String json = Files.readString(out, StandardCharsets.UTF_8);
        assertTrue(json.contains("\"success\" : true"), json);
        assertTrue(json.contains("\"name\" : \"J\""), json);
    }

    @Test
    public void failedTranspileExitsWithOne() throws IOException {
        Path src = write("bad.pine", "x = (1 +\n");
        assertEquals(PineCli.EXIT_FAILED, PineCli.run(new String[] {"transpile", src.toString()}));
    }

    @Test
    public void validateReportsVerdict() throws IOException {
        Path good = write("good.pine", "x = 1\n");
        Path bad = write("bad.pine", "x = 1 @\n");
        assertEquals(PineCli.EXIT_OK, PineCli.run(new String[] {"validate", good.toString()}));
        assertEquals(PineCli.EXIT_FAILED, PineCli.run(new String[] {"validate", bad.toString()}));
    }

    @Test
    public void usageErrors() {
        assertEquals(PineCli.EXIT_USAGE, PineCli.run(new String[] {}));
        assertEquals(PineCli.EXIT_USAGE, PineCli.run(new String[] {"compile", "x.pine"}));
        assertEquals(PineCli.EXIT_USAGE, PineCli.run(new String[] {"transpile", "x.pine", "--fast"}));
        assertEquals(PineCli.EXIT_USAGE, PineCli.run(new String[] {"validate", "x.pine", "--json"}));
    }

    @Test
    public void unreadableFileExitsWithThree() {
        String missing = dir.resolve("missing.pine").toString();
        assertEquals(PineCli.EXIT_IO, PineCli.run(new String[] {"transpile", missing}));
    }
}
