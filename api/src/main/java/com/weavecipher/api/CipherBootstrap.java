package com.weavecipher.api;

import com.weavecipher.config.CipherConfig;
import com.weavecipher.crypto.StreamTransformer;
import com.weavecipher.crypto.TransformService;
import com.weavecipher.crypto.VigenereShuffleService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Objects;

public final class CipherBootstrap {

    public static final class Components {
        public final CipherConfig config;
        public final MeterRegistry registry;
        public final TransformService transformService;
        public final StreamTransformer streamTransformer;
        public final FileTransformer fileTransformer;

        Components(CipherConfig cfg,
                   MeterRegistry registry,
                   TransformService transformService,
                   StreamTransformer streamTransformer,
                   FileTransformer fileTransformer) {
            this.config = cfg;
            this.registry = registry;
            this.transformService = transformService;
            this.streamTransformer = streamTransformer;
            this.fileTransformer = fileTransformer;
        }
    }

    public static Components init(CipherConfig cfg) {
        Objects.requireNonNull(cfg, "cfg");

        // Metrics
        MeterRegistry registry = new SimpleMeterRegistry();

        // Engine
        TransformService transform = VigenereShuffleService.fromConfig(cfg, registry);
        StreamTransformer streams = StreamTransformer.fromConfig(transform, cfg);

        // File adapter
        FileTransformer files = new FileTransformer(transform, streams, cfg);

        return new Components(cfg, registry, transform, streams, files);
    }

    private CipherBootstrap() {}
}
