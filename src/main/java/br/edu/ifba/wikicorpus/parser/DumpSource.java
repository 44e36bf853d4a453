package br.edu.ifba.wikicorpus.parser;

import br.edu.ifba.wikicorpus.exception.DumpStreamException;
import org.jboss.logging.Logger;
import org.jetbrains.annotations.NotNull;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Opens dump files for {@link DumpStreamParser}, decompressing gzip input
 * when the stream starts with the gzip magic bytes.
 */
public final class DumpSource {

    private static final Logger LOG = Logger.getLogger(DumpSource.class);

    private static final int GZIP_MAGIC_1 = 0x1f;
    private static final int GZIP_MAGIC_2 = 0x8b;
    private static final int BUFFER_SIZE = 64 * 1024;

    private DumpSource() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Opens a dump file. The caller owns the returned stream.
     *
     * @throws DumpStreamException if the file cannot be opened
     */
    public static InputStream open(@NotNull Path path) {
        try {
            InputStream raw = Files.newInputStream(path);
            try {
                return wrap(raw);
            } catch (IOException e) {
                raw.close();
                throw e;
            }
        } catch (IOException e) {
            throw new DumpStreamException("Failed to open dump " + path, e);
        }
    }

    /**
     * Wraps a raw stream, adding gzip decompression when the magic bytes match.
     */
    public static InputStream wrap(@NotNull InputStream raw) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(raw, BUFFER_SIZE);
        if (isGzip(buffered)) {
            LOG.debug("Detected gzip-compressed dump");
            return new BufferedInputStream(new GZIPInputStream(buffered, BUFFER_SIZE), BUFFER_SIZE);
        }
        return buffered;
    }

    static boolean isGzip(final BufferedInputStream in) throws IOException {
        in.mark(2);
        try {
            int first = in.read();
            int second = in.read();
            return first == GZIP_MAGIC_1 && second == GZIP_MAGIC_2;
        } finally {
            in.reset();
        }
    }
}
