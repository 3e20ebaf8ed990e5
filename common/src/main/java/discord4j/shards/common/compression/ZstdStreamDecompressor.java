package discord4j.shards.common.compression;

import com.github.luben.zstd.ZstdDecompressCtx;
import com.github.luben.zstd.ZstdException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * A {@link Decompressor} for a zstd stream where the remote flushes after every message. A chunk is pushed through the
 * native context until the input is consumed and no output remains buffered; whatever was produced is one message.
 */
public class ZstdStreamDecompressor implements Decompressor {

    private static final byte[] EMPTY = new byte[0];
    private static final int OUTPUT_BUFFER_SIZE = 128 * 1024;

    private final int maxChunkSize;
    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

    private ZstdDecompressCtx context;
    private ByteBuffer input;
    private ByteBuffer output;
    private long bytesIn;
    private long bytesOut;

    public ZstdStreamDecompressor(int maxChunkSize) {
        this.maxChunkSize = maxChunkSize;
    }

    @Override
    public void initialize() {
        destroy();
        context = new ZstdDecompressCtx();
        input = ByteBuffer.allocateDirect(Math.min(maxChunkSize, 64 * 1024));
        output = ByteBuffer.allocateDirect(OUTPUT_BUFFER_SIZE);
        bytesIn = 0;
        bytesOut = 0;
    }

    @Override
    public byte[] decompress(byte[] chunk) {
        if (context == null) {
            throw new DecompressionException("Decompressor is not initialized");
        }
        if (chunk.length > maxChunkSize) {
            throw new DecompressionException("Chunk of " + chunk.length + " bytes exceeds maximum of " + maxChunkSize);
        }
        bytesIn += chunk.length;
        ByteBuffer src = inputBuffer(chunk.length);
        src.put(chunk);
        src.flip();
        try {
            while (true) {
                output.clear();
                context.decompressDirectByteBufferStream(output, src);
                output.flip();
                int produced = output.remaining();
                byte[] bytes = new byte[produced];
                output.get(bytes);
                pending.write(bytes, 0, produced);
                if (!src.hasRemaining() && produced < output.capacity()) {
                    break;
                }
            }
        } catch (ZstdException e) {
            pending.reset();
            throw new DecompressionException("Corrupt zstd stream", e);
        }
        if (pending.size() == 0) {
            return EMPTY;
        }
        byte[] frame = pending.toByteArray();
        pending.reset();
        bytesOut += frame.length;
        return frame;
    }

    private ByteBuffer inputBuffer(int required) {
        if (input.capacity() < required) {
            input = ByteBuffer.allocateDirect(required);
        }
        input.clear();
        return input;
    }

    @Override
    public void reset() {
        pending.reset();
        if (context != null) {
            context.close();
            context = new ZstdDecompressCtx();
        }
    }

    @Override
    public void destroy() {
        pending.reset();
        if (context != null) {
            context.close();
            context = null;
        }
        input = null;
        output = null;
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
