package com.weavecipher.config;

import com.weavecipher.common.CipherKey;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CipherConfig Unit Tests")
public class CipherConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void tearDown() {
        CipherConfig.clearCache();
    }

    private Path write(String name, String json) throws Exception {
        Path p = tempDir.resolve(name);
        Files.writeString(p, json);
        return p;
    }

    // =========================================================
    // DEFAULTS
    // =========================================================

    @Test
    void defaultsWithoutFile() {
        CipherConfig cfg = new CipherConfig();
        assertEquals(CipherKey.defaultSecondKey(), cfg.getDefaultKey2());
        assertEquals(FileMode.BUFFERED, cfg.getFileMode());
        assertEquals(8192, cfg.getStreamBufferSize());
        assertTrue(cfg.isMetricsEnabled());
        assertEquals(".enc", cfg.getOutput().getEncodedSuffix());
        assertEquals(".dec", cfg.getOutput().getDecodedSuffix());
        assertFalse(cfg.getOutput().isOverwrite());
    }

    @Test
    void emptyObjectKeepsDefaults() throws Exception {
        Path p = write("empty.json", "{}");
        CipherConfig cfg = CipherConfig.load(p.toString(), true);
        assertEquals(CipherKey.defaultSecondKey(), cfg.getDefaultKey2());
        assertEquals(FileMode.BUFFERED, cfg.getFileMode());
    }

    // =========================================================
    // LOADING
    // =========================================================

    @Test
    void loadsAllFields() throws Exception {
        Path p = write("full.json", """
                {
                  "defaultKey2": "pepper",
                  "fileMode": "STREAMING",
                  "streamBufferSize": 1024,
                  "metricsEnabled": false,
                  "output": { "encodedSuffix": ".wv", "decodedSuffix": ".plain", "overwrite": true },
                  "somethingElse": 42
                }
                """);
        CipherConfig cfg = CipherConfig.load(p.toString(), true);

        assertEquals(CipherKey.of("pepper"), cfg.getDefaultKey2());
        assertEquals(FileMode.STREAMING, cfg.getFileMode());
        assertEquals(1024, cfg.getStreamBufferSize());
        assertFalse(cfg.isMetricsEnabled());
        assertEquals(".wv", cfg.getOutput().getEncodedSuffix());
        assertEquals(".plain", cfg.getOutput().getDecodedSuffix());
        assertTrue(cfg.getOutput().isOverwrite());
    }

    @Test
    void bufferSizeIsClamped() throws Exception {
        Path tiny = write("tiny.json", "{\"streamBufferSize\": 0}");
        Path huge = write("huge.json", "{\"streamBufferSize\": 2147483647}");
        assertEquals(1, CipherConfig.load(tiny.toString(), true).getStreamBufferSize());
        assertEquals(1 << 20, CipherConfig.load(huge.toString(), true).getStreamBufferSize());
    }

    @Test
    void cachedUntilRefresh() throws Exception {
        Path p = write("cache.json", "{\"fileMode\": \"STREAMING\"}");
        CipherConfig first = CipherConfig.load(p.toString(), false);
        assertSame(first, CipherConfig.load(p.toString(), false));

        Files.writeString(p, "{\"fileMode\": \"BUFFERED\"}");
        assertEquals(FileMode.STREAMING, CipherConfig.load(p.toString(), false).getFileMode());
        assertEquals(FileMode.BUFFERED, CipherConfig.load(p.toString(), true).getFileMode());
    }

    // =========================================================
    // FAILURES
    // =========================================================

    @Test
    void missingFileFails() {
        Path p = tempDir.resolve("nope.json");
        assertThrows(CipherConfig.ConfigLoadException.class, () -> CipherConfig.load(p.toString(), true));
    }

    @Test
    void malformedJsonFails() throws Exception {
        Path p = write("bad.json", "{ \"fileMode\": ");
        CipherConfig.ConfigLoadException ex = assertThrows(CipherConfig.ConfigLoadException.class,
                () -> CipherConfig.load(p.toString(), true));
        assertNotNull(ex.getCause());
    }

    @Test
    void unknownFileModeFails() throws Exception {
        Path p = write("mode.json", "{\"fileMode\": \"SIDEWAYS\"}");
        assertThrows(CipherConfig.ConfigLoadException.class, () -> CipherConfig.load(p.toString(), true));
    }

    @Test
    void emptyDefaultKeyFails() throws Exception {
        Path p = write("key.json", "{\"defaultKey2\": \"\"}");
        CipherConfig.ConfigLoadException ex = assertThrows(CipherConfig.ConfigLoadException.class,
                () -> CipherConfig.load(p.toString(), true));
        assertTrue(ex.getMessage().contains("defaultKey2"));
    }

    @Test
    void nonAsciiDefaultKeyFails() throws Exception {
        Path p = write("key8.json", "{\"defaultKey2\": \"caf\\u00e9\"}");
        assertThrows(CipherConfig.ConfigLoadException.class, () -> CipherConfig.load(p.toString(), true));
    }

    @Test
    void identicalSuffixesFail() throws Exception {
        Path p = write("suffix.json", "{\"output\": {\"encodedSuffix\": \".x\", \"decodedSuffix\": \".x\"}}");
        assertThrows(CipherConfig.ConfigLoadException.class, () -> CipherConfig.load(p.toString(), true));
    }

    @Test
    void nullPathRejected() {
        assertThrows(NullPointerException.class, () -> CipherConfig.load(null, false));
    }
}
