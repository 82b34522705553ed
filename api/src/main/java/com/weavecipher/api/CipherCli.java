package com.weavecipher.api;

import com.weavecipher.common.CharacterDomain;
import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;
import com.weavecipher.common.TransformException;
import com.weavecipher.config.CipherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Command-line front end.
 *
 * <pre>
 * weavecipher help | h
 * weavecipher demo | d
 * weavecipher &lt;string-or-path&gt; &lt;s|f&gt; &lt;e|d&gt; &lt;key1&gt; [key2]
 * </pre>
 *
 * Set {@code -Dweavecipher.config=<file.json>} to load a configuration file.
 */
public final class CipherCli {
    private static final Logger logger = LoggerFactory.getLogger(CipherCli.class);

    static final String CONFIG_PROPERTY = "weavecipher.config";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_BAD_INPUT = 2;
    static final int EXIT_IO = 3;

    static final String DEMO_TEXT = "Master of Puppets, The New Order, Rust In Peace";
    static final String DEMO_KEY = "sayaka";

    static final String USAGE = String.join("\n",
            "Usage: weavecipher <string or path> <s|f> <e|d> <key1> [key2]",
            "       weavecipher help | demo",
            "",
            "  s      treat the first argument as the text to transform",
            "  f      treat the first argument as a file; output is written next to it",
            "  e      encode",
            "  d      decode",
            "  key1   required key (7-bit ASCII, non-empty)",
            "  key2   optional second key; a fixed public default is used when omitted",
            "",
            "Configuration: -D" + CONFIG_PROPERTY + "=<config.json>");

    private final PrintStream out;
    private final PrintStream err;

    CipherCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int code = new CipherCli(System.out, System.err).run(args);
        System.exit(code);
    }

    int run(String[] args) {
        if (args.length == 1) {
            switch (args[0].toLowerCase(Locale.ROOT)) {
                case "help", "h" -> {
                    out.println(USAGE);
                    return EXIT_OK;
                }
                case "demo", "d" -> {
                    return demo();
                }
                default -> { /* falls through to the argument-count check */ }
            }
        }

        if (args.length != 4 && args.length != 5) {
            err.println("Invalid Arguments: too few or too many. For help enter \"help\"");
            return EXIT_USAGE;
        }

        final CipherBootstrap.Components components;
        try {
            components = CipherBootstrap.init(loadConfig());
        } catch (CipherConfig.ConfigLoadException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        final TransformDirection direction;
        try {
            direction = TransformDirection.fromSelector(args[2]);
        } catch (IllegalArgumentException e) {
            err.println("Invalid encryption flag. Use E for encryption or D for decryption");
            return EXIT_USAGE;
        }

        String mode = args[1].toLowerCase(Locale.ROOT);
        try {
            CipherKey key1 = CipherKey.of(args[3]);
            CipherKey key2 = (args.length == 5)
                    ? CipherKey.of(args[4])
                    : components.transformService.getDefaultKey2();

            switch (mode) {
                case "s" -> {
                    return processString(components, direction, args[0], key1, key2);
                }
                case "f" -> {
                    return processFile(components, direction, Paths.get(args[0]), key1, key2);
                }
                default -> {
                    err.println("Invalid mode flag. Use S for a string or F for a file. For help enter \"help\"");
                    return EXIT_USAGE;
                }
            }
        } catch (TransformException e) {
            err.println(e.getMessage());
            return EXIT_BAD_INPUT;
        } catch (FileAlreadyExistsException e) {
            err.println("Output already exists: " + e.getFile());
            return EXIT_IO;
        } catch (IOException e) {
            logger.error("File transform failed for {}", args[0], e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO;
        }
    }

    private int processString(CipherBootstrap.Components c, TransformDirection direction,
                              String subject, CipherKey key1, CipherKey key2) {
        byte[] result = c.transformService.transform(direction,
                CharacterDomain.toCodes(subject), key1, key2);
        out.println(CharacterDomain.fromCodes(result));
        return EXIT_OK;
    }

    private int processFile(CipherBootstrap.Components c, TransformDirection direction,
                            Path file, CipherKey key1, CipherKey key2) throws IOException {
        if (!Files.isRegularFile(file)) {
            err.println("Could not open file: " + file);
            return EXIT_USAGE;
        }
        Path written = c.fileTransformer.transformFile(direction, file, key1, key2);
        out.printf("%s -> %s%n", file, written);
        return EXIT_OK;
    }

    private int demo() {
        CipherBootstrap.Components c = CipherBootstrap.init(new CipherConfig());
        String cipherText = c.transformService.encodeString(DEMO_TEXT, DEMO_KEY, CipherKey.DEFAULT_SECOND_KEY);
        String decrypted = c.transformService.decodeString(cipherText, DEMO_KEY, CipherKey.DEFAULT_SECOND_KEY);
        out.println("Plain text: " + DEMO_TEXT);
        out.println("Cipher text: " + cipherText);
        out.println("Decrypted text: " + decrypted);
        return EXIT_OK;
    }

    private static CipherConfig loadConfig() throws CipherConfig.ConfigLoadException {
        String path = System.getProperty(CONFIG_PROPERTY);
        if (path == null || path.isBlank()) {
            return new CipherConfig();
        }
        return CipherConfig.load(path, false);
    }
}
