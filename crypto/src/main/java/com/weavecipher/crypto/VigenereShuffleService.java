package com.weavecipher.crypto;

import com.weavecipher.common.CharacterDomain;
import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;
import com.weavecipher.config.CipherConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Double-keyed Vigenere substitution + interleave.
 *
 * Holds no per-call state, so one instance can serve many threads.
 * Metrics are recorded only when a {@link MeterRegistry} is supplied.
 */
public class VigenereShuffleService implements TransformService {

    private static final Logger logger = LoggerFactory.getLogger(VigenereShuffleService.class);

    static final String TIMER_NAME = "weavecipher.transform.duration";
    static final String COUNTER_NAME = "weavecipher.transform.chars";

    private final MeterRegistry metrics;
    private final CipherKey defaultKey2;

    public VigenereShuffleService() {
        this(null, CipherKey.defaultSecondKey());
    }

    public VigenereShuffleService(MeterRegistry metrics) {
        this(metrics, CipherKey.defaultSecondKey());
    }

    public VigenereShuffleService(MeterRegistry metrics, CipherKey defaultKey2) {
        this.metrics = metrics;
        this.defaultKey2 = Objects.requireNonNull(defaultKey2, "defaultKey2 cannot be null");
        logger.info("VigenereShuffleService initialized (metrics={})", metrics != null);
    }

    /** Wires the configured default key; the registry is dropped when metrics are disabled. */
    public static VigenereShuffleService fromConfig(CipherConfig cfg, MeterRegistry registry) {
        Objects.requireNonNull(cfg, "cfg cannot be null");
        return new VigenereShuffleService(cfg.isMetricsEnabled() ? registry : null, cfg.getDefaultKey2());
    }

    @Override
    public byte[] encode(byte[] plaintext, CipherKey key1, CipherKey key2) {
        Objects.requireNonNull(plaintext, "plaintext cannot be null");
        long start = System.nanoTime();

        byte[] substituted = Substitution.substitute(plaintext, key1, key2);
        byte[] out = Interleave.shuffle(substituted);

        record(TransformDirection.ENCODE, out.length, start);
        return out;
    }

    @Override
    public byte[] decode(byte[] ciphertext, CipherKey key1, CipherKey key2) {
        Objects.requireNonNull(ciphertext, "ciphertext cannot be null");
        // positions in the error refer to the ciphertext as given, not the unshuffled order
        CharacterDomain.requireInDomain(ciphertext);
        long start = System.nanoTime();

        byte[] unshuffled = Interleave.unshuffle(ciphertext);
        byte[] out = Substitution.unsubstitute(unshuffled, key1, key2);

        record(TransformDirection.DECODE, out.length, start);
        return out;
    }

    @Override
    public CipherKey getDefaultKey2() {
        return defaultKey2;
    }

    private void record(TransformDirection direction, int length, long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        logger.debug("{} of {} chars took {} us", direction.tag(), length, elapsed / 1_000);
        if (metrics == null) {
            return;
        }
        Timer.builder(TIMER_NAME)
                .tag("direction", direction.tag())
                .register(metrics)
                .record(elapsed, TimeUnit.NANOSECONDS);
        Counter.builder(COUNTER_NAME)
                .tag("direction", direction.tag())
                .register(metrics)
                .increment(length);
    }
}
