package gitcontext.utils.crypto;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * Utility class for decompressing zlib streams, the format Git uses for loose
 * objects.
 */
public class CompressionUtils {

    private static final int BUFFER_SIZE = 8192;

    /**
     * Wraps a compressed stream so that reads return inflated bytes. The
     * returned stream owns both the source and its {@link Inflater}; closing it
     * releases both.
     */
    public static InputStream inflating(InputStream compressed) {
        return new InflaterInputStream(new BufferedInputStream(compressed, BUFFER_SIZE), new Inflater(), BUFFER_SIZE) {
            private boolean closed;

            @Override
            public void close() throws IOException {
                if (closed) {
                    return;
                }
                closed = true;
                try {
                    super.close();
                } finally {
                    inf.end();
                }
            }
        };
    }
}
