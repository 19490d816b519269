package org.permafrost.utils.compression;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Stream-based compression codec for archive and world files.
 * <p>
 * Codecs are stateless and can be reused for any number of streams. {@link NoneCodec} is the
 * pass-through used when compression is disabled.
 * </p>
 */
public interface ICompressionCodec {

    /**
     * @param out Stream receiving compressed bytes. The caller must close the returned stream.
     * @return a compressing stream
     * @throws IOException if the stream cannot be created
     */
    OutputStream wrapOutputStream(OutputStream out) throws IOException;

    /**
     * @param in Stream of compressed bytes.
     * @return a decompressing stream
     * @throws IOException if the stream cannot be created
     */
    InputStream wrapInputStream(InputStream in) throws IOException;

    /**
     * @return codec name used in configuration ("zstd", "none")
     */
    String getName();

    /**
     * @return file name suffix including the dot, or an empty string
     */
    String getFileExtension();

    int getLevel();

    /**
     * Checks once at start-up that the codec can run on this platform.
     *
     * @throws CompressionException if native support is missing or broken
     */
    void validateEnvironment() throws CompressionException;
}
