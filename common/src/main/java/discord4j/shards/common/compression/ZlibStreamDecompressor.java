package discord4j.shards.common.compression;

import reactor.util.Logger;
import reactor.util.Loggers;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * A {@link Decompressor} for a single zlib stream shared by every message of a connection. Messages carry no length
 * prefix; a message is complete when the buffered data ends with the {@code 00 00 FF FF} sync flush marker.
 */
public class ZlibStreamDecompressor implements Decompressor {

    private static final Logger log = Loggers.getLogger(ZlibStreamDecompressor.class);

    static final byte[] FLUSH_MARKER = {0x00, 0x00, (byte) 0xFF, (byte) 0xFF};

    private static final byte[] EMPTY = new byte[0];
    private static final int INFLATE_BUFFER_SIZE = 8192;

    private final int maxChunkSize;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private final byte[] inflateBuffer = new byte[INFLATE_BUFFER_SIZE];
    private final byte[] tail = new byte[FLUSH_MARKER.length];
    private int tailLength;

    private Inflater inflater;
    private long bytesIn;
    private long bytesOut;

    public ZlibStreamDecompressor(int maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    @Override
    public void initialize() {
        destroy();
        inflater = new Inflater();
        bytesIn = 0;
        bytesOut = 0;
    }

    @Override
    public byte[] decompress(byte[] chunk) {
        if (inflater == null) {
            throw new DecompressionException("Decompressor is not initialized");
        }
        if (chunk.length > maxChunkSize) {
            throw new DecompressionException("Chunk of " + chunk.length + " bytes exceeds maximum of " + maxChunkSize);
        }
        if (pending.size() + chunk.length > maxChunkSize) {
            clearPending();
            throw new DecompressionException("Buffered frame exceeds maximum of " + maxChunkSize + " bytes");
        }
        pending.write(chunk, 0, chunk.length);
        bytesIn += chunk.length;
        updateTail(chunk);
        if (tailLength < FLUSH_MARKER.length || !Arrays.equals(tail, FLUSH_MARKER)) {
            return EMPTY;
        }
        byte[] input = pending.toByteArray();
        clearPending();
        return inflate(input);
    }

    /**
     * Keep the last four bytes received for the current message. A marker split over several tiny chunks is still
     * recognized.
     */
    private void updateTail(byte[] chunk) {
        int size = FLUSH_MARKER.length;
        if (chunk.length >= size) {
            System.arraycopy(chunk, chunk.length - size, tail, 0, size);
            tailLength = size;
            return;
        }
        int keep = Math.min(tailLength, size - chunk.length);
        System.arraycopy(tail, tailLength - keep, tail, 0, keep);
        System.arraycopy(chunk, 0, tail, keep, chunk.length);
        tailLength = keep + chunk.length;
    }

    private void clearPending() {
        pending.reset();
        tailLength = 0;
    }

    private byte[] inflate(byte[] input) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
        inflater.setInput(input);
        try {
            while (true) {
                int n = inflater.inflate(inflateBuffer);
                out.write(inflateBuffer, 0, n);
                if (n == 0) {
                    if (inflater.needsDictionary()) {
                        throw new DecompressionException("zlib stream requested a preset dictionary");
                    }
                    if (inflater.needsInput() || inflater.finished()) {
                        break;
                    }
                }
            }
        } catch (DataFormatException e) {
            throw new DecompressionException("Corrupt zlib stream", e);
        }
        if (inflater.finished()) {
            log.debug("zlib stream ended by the remote");
        }
        bytesOut += out.size();
        return out.toByteArray();
    }

    @Override
    public void reset() {
        clearPending();
        if (inflater != null) {
            inflater.reset();
        }
    }

    @Override
    public void destroy() {
        clearPending();
        if (inflater != null) {
            inflater.end();
            inflater = null;
        }
    }

    @Override
    public long getBytesIn() {
        return bytesIn;
    }

    @Override
    public long getBytesOut() {
        return bytesOut;
    }
}
