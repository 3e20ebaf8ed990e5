package discord4j.shards.common.compression;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.Deflater;

import static org.junit.Assert.*;

public class ZlibStreamDecompressorTest {

    private final Deflater deflater = new Deflater();
    private ZlibStreamDecompressor decompressor;

    @Before
    public void setUp() {
        decompressor = new ZlibStreamDecompressor(1024 * 1024);
        decompressor.initialize();
    }

    @After
    public void tearDown() {
        decompressor.destroy();
        deflater.end();
    }

    @Test
    public void inflateMessageSplitAcrossChunks() {
        String message = "{\"op\":10,\"d\":{\"heartbeat_interval\":41250},\"s\":null,\"t\":null}";
        byte[] compressed = compress(message);
        int third = compressed.length / 3;

        assertEquals(0, decompressor.decompress(Arrays.copyOfRange(compressed, 0, third)).length);
        assertEquals(0, decompressor.decompress(Arrays.copyOfRange(compressed, third, 2 * third)).length);
        byte[] result = decompressor.decompress(Arrays.copyOfRange(compressed, 2 * third, compressed.length));

        assertEquals(message, new String(result, StandardCharsets.UTF_8));
        assertEquals(compressed.length, decompressor.getBytesIn());
        assertEquals(result.length, decompressor.getBytesOut());
    }

    @Test
    public void recognizeFlushMarkerSplitOverSingleByteChunks() {
        String message = "{\"op\":11,\"d\":null,\"s\":null,\"t\":null}";
        byte[] compressed = compress(message);

        for (int i = 0; i < compressed.length - 1; i++) {
            assertEquals(0, decompressor.decompress(new byte[]{compressed[i]}).length);
        }
        byte[] result = decompressor.decompress(new byte[]{compressed[compressed.length - 1]});

        assertEquals(message, new String(result, StandardCharsets.UTF_8));
    }

    @Test
    public void markerOfPreviousMessageDoesNotCompleteNextOne() {
        String first = "{\"op\":11}";
        String second = "{\"op\":1,\"d\":42}";
        assertEquals(first, new String(decompressor.decompress(compress(first)), StandardCharsets.UTF_8));

        byte[] next = compress(second);
        assertEquals(0, decompressor.decompress(new byte[]{next[0]}).length);
        byte[] result = decompressor.decompress(Arrays.copyOfRange(next, 1, next.length));

        assertEquals(second, new String(result, StandardCharsets.UTF_8));
    }

    @Test
    public void keepContextAcrossMessages() {
        String first = "{\"op\":0,\"t\":\"GUILD_CREATE\",\"d\":{\"name\":\"first guild\"}}";
        String second = "{\"op\":0,\"t\":\"GUILD_CREATE\",\"d\":{\"name\":\"second guild\"}}";

        byte[] one = decompressor.decompress(compress(first));
        byte[] two = decompressor.decompress(compress(second));

        assertEquals(first, new String(one, StandardCharsets.UTF_8));
        assertEquals(second, new String(two, StandardCharsets.UTF_8));
    }

    @Test
    public void rejectOversizedChunk() {
        ZlibStreamDecompressor small = new ZlibStreamDecompressor(16);
        small.initialize();
        try {
            small.decompress(new byte[17]);
            fail("Expected oversized chunk to be rejected");
        } catch (DecompressionException e) {
            assertTrue(e.getMessage().contains("exceeds"));
        } finally {
            small.destroy();
        }
    }

    @Test(expected = DecompressionException.class)
    public void rejectCorruptStream() {
        byte[] garbage = {0x12, 0x34, 0x56, 0x78, 0x00, 0x00, (byte) 0xFF, (byte) 0xFF};
        decompressor.decompress(garbage);
    }

    @Test(expected = DecompressionException.class)
    public void rejectUseAfterDestroy() {
        decompressor.destroy();
        decompressor.decompress(new byte[]{1});
    }

    private byte[] compress(String message) {
        deflater.setInput(message.getBytes(StandardCharsets.UTF_8));
        byte[] buffer = new byte[4096];
        int length = deflater.deflate(buffer, 0, buffer.length, Deflater.SYNC_FLUSH);
        byte[] compressed = Arrays.copyOf(buffer, length);
        byte[] tail = Arrays.copyOfRange(compressed, compressed.length - 4, compressed.length);
        assertArrayEquals(ZlibStreamDecompressor.FLUSH_MARKER, tail);
        return compressed;
    }
}
