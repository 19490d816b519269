package org.permafrost.utils.compression;

import com.typesafe.config.Config;

/**
 * Creates codecs from a {@code compression { enabled, codec, level }} block.
 * A missing block or {@code enabled = false} yields {@link NoneCodec}.
 */
public final class CompressionCodecFactory {

    private CompressionCodecFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * @param config Configuration containing an optional {@code compression} block.
     * @return the codec, never null
     * @throws IllegalArgumentException if compression is enabled with a missing or unknown codec
     */
    public static ICompressionCodec create(Config config) {
        if (!config.hasPath("compression")) {
            return new NoneCodec();
        }
        Config compression = config.getConfig("compression");
        boolean enabled = compression.hasPath("enabled") && compression.getBoolean("enabled");
        if (!enabled) {
            return new NoneCodec();
        }
        if (!compression.hasPath("codec")) {
            throw new IllegalArgumentException("Compression is enabled but 'codec' parameter is missing. "
                + "Specify a codec: compression { enabled = true, codec = \"zstd\" }");
        }
        return byName(compression.getString("codec"), compression);
    }

    /**
     * @param config Configuration containing an optional {@code compression} block.
     * @return a codec whose environment was validated
     * @throws CompressionException if validation fails
     */
    public static ICompressionCodec createAndValidate(Config config) throws CompressionException {
        ICompressionCodec codec = create(config);
        codec.validateEnvironment();
        return codec;
    }

    /**
     * Picks the codec that wrote a file, judged by its extension.
     *
     * @param fileName File name.
     * @return zstd for {@code .zst} files, otherwise none
     */
    public static ICompressionCodec forFileName(String fileName) {
        return fileName.endsWith(".zst") ? new ZstdCodec() : new NoneCodec();
    }

    private static ICompressionCodec byName(String name, Config compression) {
        return switch (name.toLowerCase()) {
            case "zstd" -> new ZstdCodec(compression);
            case "none" -> new NoneCodec();
            default -> throw new IllegalArgumentException("Unknown compression codec: '" + name + "'. "
                + "Supported codecs: 'zstd', 'none'");
        };
    }
}
