package com.elara.pine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.elara.pine.debug.Debug;
import com.elara.pine.debug.DebugLevel;
import com.elara.pine.metadata.Warning;

/**
 * Command line front end.
 *
 * <pre>
 * pine-transpiler transpile &lt;file&gt; [-o out.js] [--json]
 * pine-transpiler validate &lt;file&gt;
 * </pre>
 *
 * Exit codes: 0 ok, 1 transpile/validation failure, 2 usage, 3 file I/O.
 */
public final class PineCli {
    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: pine-transpiler transpile <file> [-o out.js] [--json]\n"
            + "       pine-transpiler validate <file>";

    public static void main(String[] args) {
        Debug.useStdErr(DebugLevel.WARN);
        System.exit(run(args));
    }

    public static int run(String[] args) {
        if (args.length < 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        String command = args[0];
        Path input = Path.of(args[1]);
        Path outFile = null;
        boolean json = false;
        for (int i = 2; i < args.length; i++) {
            if ("--json".equals(args[i])) {
                json = true;
            } else if ("-o".equals(args[i]) && i + 1 < args.length) {
                outFile = Path.of(args[++i]);
            } else {
                System.err.println("Unknown option: " + args[i]);
                System.err.println(USAGE);
                return EXIT_USAGE;
            }
        }
        if (!"transpile".equals(command) && !"validate".equals(command)) {
            System.err.println("Unknown command: " + command);
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        if ("validate".equals(command) && (outFile != null || json)) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        final String source;
        try {
            source = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            System.err.println("Failed to read source file: " + input);
            e.printStackTrace(System.err);
            return EXIT_IO;
        }

        PineTranspiler transpiler = new PineTranspiler();

        if ("validate".equals(command)) {
            ValidationResult result = transpiler.validate(source);
            if (result.valid) {
                System.out.println("OK: " + input);
                return EXIT_OK;
            }
            System.err.println(input + ": " + result.reason);
            return EXIT_FAILED;
        }

        TranspileResult result = transpiler.transpile(source);
        if (result.metadata != null) {
            for (Warning w : result.metadata.warnings()) {
                System.err.println("warning [" + w.severity.id() + "] " + w.message);
            }
        }

        String text = json ? result.toJson().toPrettyString() : result.output;
        if (!result.success && !json) {
            System.err.println(input + ": " + result.error);
            return EXIT_FAILED;
        }

        if (outFile == null) {
            System.out.println(text);
        } else {
            try {
                Files.writeString(outFile, text, StandardCharsets.UTF_8);
            } catch (IOException e) {
                System.err.println("Failed to write output file: " + outFile);
                e.printStackTrace(System.err);
                return EXIT_IO;
            }
        }
        return result.success ? EXIT_OK : EXIT_FAILED;
    }

    private PineCli() {}
}
