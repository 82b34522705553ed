package com.weavecipher.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.weavecipher.common.CipherKey;
import com.weavecipher.common.InvalidCipherKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Runtime configuration for weavecipher.
 *
 * - Loaded from JSON via {@link #load(String, boolean)}.
 * - Cached per real path.
 * - {@code new CipherConfig()} gives the built-in defaults.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CipherConfig {
    private static final Logger logger = LoggerFactory.getLogger(CipherConfig.class);

    private static final int MIN_BUFFER = 1;
    private static final int MAX_BUFFER = 1 << 20;

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    /** Per-path cache for loaded configs. */
    private static final ConcurrentMap<String, CipherConfig> configCache = new ConcurrentHashMap<>();

    /* ======================== Top-level fields ======================== */

    @JsonProperty("defaultKey2")
    private String defaultKey2 = CipherKey.DEFAULT_SECOND_KEY;

    @JsonProperty("fileMode")
    private FileMode fileMode = FileMode.BUFFERED;

    @JsonProperty("streamBufferSize")
    private int streamBufferSize = 8192;

    @JsonProperty("metricsEnabled")
    private boolean metricsEnabled = true;

    @JsonProperty("output")
    private OutputConfig output = new OutputConfig();

    /* ======================== Static loading API ======================== */

    public static CipherConfig load(String path, boolean refresh) throws ConfigLoadException {
        Objects.requireNonNull(path, "Config path cannot be null");
        String key;
        try {
            Path p = Paths.get(path).toAbsolutePath().normalize();
            if (Files.exists(p)) {
                p = p.toRealPath();
            }
            key = p.toString();
        } catch (Exception e) {
            throw new ConfigLoadException("Invalid config path: " + path, e);
        }

        if (!refresh) {
            CipherConfig cached = configCache.get(key);
            if (cached != null) return cached;
        }

        CipherConfig cfg;
        try {
            Path p = Paths.get(key);
            if (!Files.isRegularFile(p) || !Files.isReadable(p)) {
                throw new IOException("Config file not found or not readable: " + key);
            }
            cfg = MAPPER.readValue(p.toFile(), CipherConfig.class);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read/parse CipherConfig from " + key, e);
        }

        cfg.validate(key);
        cfg.streamBufferSize = clamp(cfg.streamBufferSize, MIN_BUFFER, MAX_BUFFER);

        configCache.put(key, cfg);
        logger.info("Loaded cipher config from {} (fileMode={}, metrics={})", key, cfg.fileMode, cfg.metricsEnabled);
        return cfg;
    }

    public static void clearCache() {
        configCache.clear();
    }

    private void validate(String source) throws ConfigLoadException {
        if (defaultKey2 == null) {
            defaultKey2 = CipherKey.DEFAULT_SECOND_KEY;
        }
        try {
            CipherKey.of(defaultKey2);
        } catch (InvalidCipherKeyException e) {
            throw new ConfigLoadException("Invalid defaultKey2 in " + source + ": " + e.getMessage(), e);
        }
        if (fileMode == null) {
            fileMode = FileMode.BUFFERED;
        }
        if (output == null) {
            output = new OutputConfig();
        }
        if (output.encodedSuffix == null || output.encodedSuffix.isBlank()
                || output.decodedSuffix == null || output.decodedSuffix.isBlank()) {
            throw new ConfigLoadException("output suffixes must be non-blank in " + source, null);
        }
        if (output.encodedSuffix.equals(output.decodedSuffix)) {
            throw new ConfigLoadException("output.encodedSuffix and output.decodedSuffix must differ in " + source, null);
        }
    }

    /* ======================== Getters ======================== */

    public CipherKey getDefaultKey2() {
        return CipherKey.of(defaultKey2);
    }

    public FileMode getFileMode() {
        return fileMode;
    }

    public int getStreamBufferSize() {
        return clamp(streamBufferSize, MIN_BUFFER, MAX_BUFFER);
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public OutputConfig getOutput() {
        return output;
    }

    /* ======================== Nested blocks ======================== */

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OutputConfig {
        @JsonProperty("encodedSuffix")
        private String encodedSuffix = ".enc";

        @JsonProperty("decodedSuffix")
        private String decodedSuffix = ".dec";

        @JsonProperty("overwrite")
        private boolean overwrite = false;

        public String getEncodedSuffix() {
            return encodedSuffix;
        }

        public String getDecodedSuffix() {
            return decodedSuffix;
        }

        public boolean isOverwrite() {
            return overwrite;
        }
    }

    private static int clamp(int v, int min, int max) {
        if (v < min) return min;
        if (v > max) return max;
        return v;
    }

    /* ======================== Exception type ======================== */

    public static class ConfigLoadException extends Exception {
        public ConfigLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
