package com.weavecipher.api;

import com.weavecipher.common.CipherKey;
import com.weavecipher.common.TransformDirection;
import com.weavecipher.config.CipherConfig;
import com.weavecipher.config.FileMode;
import com.weavecipher.crypto.StreamTransformer;
import com.weavecipher.crypto.TransformService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Transforms whole files, writing the result next to the input.
 *
 * encode: notes.txt     -> notes.txt.enc
 * decode: notes.txt.enc -> notes.txt.dec   (suffixes come from {@link CipherConfig.OutputConfig})
 */
public class FileTransformer {
    private static final Logger logger = LoggerFactory.getLogger(FileTransformer.class);

    private final TransformService transformService;
    private final StreamTransformer streamTransformer;
    private final CipherConfig config;

    public FileTransformer(TransformService transformService, StreamTransformer streamTransformer, CipherConfig config) {
        this.transformService = Objects.requireNonNull(transformService, "transformService");
        this.streamTransformer = Objects.requireNonNull(streamTransformer, "streamTransformer");
        this.config = Objects.requireNonNull(config, "config");
    }

    public Path encodeFile(Path input, CipherKey key1, CipherKey key2) throws IOException {
        return transformFile(TransformDirection.ENCODE, input, key1, key2);
    }

    public Path encodeFile(Path input, CipherKey key1) throws IOException {
        return encodeFile(input, key1, transformService.getDefaultKey2());
    }

    public Path decodeFile(Path input, CipherKey key1, CipherKey key2) throws IOException {
        return transformFile(TransformDirection.DECODE, input, key1, key2);
    }

    public Path decodeFile(Path input, CipherKey key1) throws IOException {
        return decodeFile(input, key1, transformService.getDefaultKey2());
    }

    /**
     * Nothing is left at the output path when the transform fails.
     *
     * @return path of the written output file
     * @throws NoSuchFileException if {@code input} is not a regular file
     * @throws FileAlreadyExistsException if the output exists and overwrite is disabled
     */
    public Path transformFile(TransformDirection direction, Path input, CipherKey key1, CipherKey key2)
            throws IOException {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(key1, "key1");
        Objects.requireNonNull(key2, "key2");

        if (!Files.isRegularFile(input)) {
            throw new NoSuchFileException(input.toString());
        }
        Path output = outputPathFor(direction, input);
        boolean overwrite = config.getOutput().isOverwrite();
        if (Files.exists(output) && !overwrite) {
            throw new FileAlreadyExistsException(output.toString(), null, "refusing to overwrite");
        }

        FileMode mode = config.getFileMode();
        // Output is staged in a sibling temp file and moved into place only on success.
        Path staged = Files.createTempFile(output.toAbsolutePath().getParent(), output.getFileName().toString(), ".part");
        try {
            long n;
            try (InputStream in = new BufferedInputStream(Files.newInputStream(input));
                 OutputStream out = new BufferedOutputStream(Files.newOutputStream(staged,
                         StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {
                n = (mode == FileMode.STREAMING)
                        ? streamTransformer.substituteStream(direction, in, out, key1, key2)
                        : streamTransformer.transformBuffered(direction, in, out, key1, key2);
            }
            if (overwrite) {
                Files.move(staged, output, StandardCopyOption.REPLACE_EXISTING);
            } else {
                // without REPLACE_EXISTING the move fails if the output appeared meanwhile
                Files.move(staged, output);
            }
            logger.info("{} {} -> {} ({} bytes, {})", direction.tag(), input, output, n, mode);
        } catch (IOException | RuntimeException e) {
            discard(staged, e);
            throw e;
        }
        return output;
    }

    private static void discard(Path staged, Exception failure) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            logger.warn("Could not remove staged output {}", staged, e);
            failure.addSuppressed(e);
        }
    }

    /** Output location for {@code input}; does not touch the file system. */
    public Path outputPathFor(TransformDirection direction, Path input) {
        String name = input.getFileName().toString();
        String enc = config.getOutput().getEncodedSuffix();
        String dec = config.getOutput().getDecodedSuffix();

        String outName;
        if (direction == TransformDirection.ENCODE) {
            outName = name + enc;
        } else if (name.endsWith(enc) && name.length() > enc.length()) {
            outName = name.substring(0, name.length() - enc.length()) + dec;
        } else {
            outName = name + dec;
        }
        return input.resolveSibling(outName);
    }
}
