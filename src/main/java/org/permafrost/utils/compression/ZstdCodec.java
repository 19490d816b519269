package org.permafrost.utils.compression;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Zstandard codec backed by zstd-jni. Archive documents are repetitive JSON and compress well
 * at the default level 3.
 */
public class ZstdCodec implements ICompressionCodec {

    private static final Logger log = LoggerFactory.getLogger(ZstdCodec.class);

    private static final int MIN_LEVEL = 1;
    private static final int MAX_LEVEL = 22;
    private static final int DEFAULT_LEVEL = 3;

    private final int level;

    public ZstdCodec() {
        this(DEFAULT_LEVEL);
    }

    /**
     * @param config Compression block with an optional {@code level}; out-of-range levels are clamped.
     */
    public ZstdCodec(Config config) {
        int configured = config.hasPath("level") ? config.getInt("level") : DEFAULT_LEVEL;
        this.level = clamp(configured);
        if (configured != this.level) {
            log.warn("Zstd compression level {} is outside [{}, {}], using {}", configured, MIN_LEVEL, MAX_LEVEL, this.level);
        }
    }

    public ZstdCodec(int level) {
        this.level = clamp(level);
    }

    private static int clamp(int level) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, level));
    }

    @Override
    public OutputStream wrapOutputStream(OutputStream out) throws IOException {
        return new ZstdOutputStream(out, level);
    }

    @Override
    public InputStream wrapInputStream(InputStream in) throws IOException {
        return new ZstdInputStream(in);
    }

    @Override
    public String getName() {
        return "zstd";
    }

    @Override
    public String getFileExtension() {
        return ".zst";
    }

    @Override
    public int getLevel() {
        return level;
    }

    /**
     * Compresses and decompresses a probe string to make sure the native library loaded.
     *
     * @throws CompressionException if zstd-jni is missing or broken on this platform
     */
    @Override
    public void validateEnvironment() throws CompressionException {
        try {
            byte[] probe = "permafrost compression probe".getBytes(StandardCharsets.UTF_8);
            byte[] restored = Zstd.decompress(Zstd.compress(probe, level), probe.length);
            if (!Arrays.equals(probe, restored)) {
                throw new CompressionException("Zstd library loaded but the round-trip probe failed");
            }
        } catch (UnsatisfiedLinkError e) {
            throw new CompressionException("Zstd native library not found: " + e.getMessage()
                + ". Use a glibc-based platform or disable compression.", e);
        } catch (RuntimeException e) {
            throw new CompressionException("Unexpected error during zstd environment validation: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return String.format("ZstdCodec{name='zstd', level=%d}", level);
    }
}
