package org.permafrost.utils.compression;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * Pass-through codec for uncompressed files.
 */
public class NoneCodec implements ICompressionCodec {

    @Override
    public OutputStream wrapOutputStream(OutputStream out) {
        return out;
    }

    @Override
    public InputStream wrapInputStream(InputStream in) {
        return in;
    }

    @Override
    public String getName() {
        return "none";
    }

    @Override
    public String getFileExtension() {
        return "";
    }

    @Override
    public int getLevel() {
        return 0;
    }

    @Override
    public void validateEnvironment() {
        // nothing to check
    }

    @Override
    public String toString() {
        return "NoneCodec{name='none', compression=disabled}";
    }
}
