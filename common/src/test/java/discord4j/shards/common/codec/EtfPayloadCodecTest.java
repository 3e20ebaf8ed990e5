package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.zip.Deflater;

import static org.junit.Assert.*;

public class EtfPayloadCodecTest {

    private final JsonNodeFactory factory = JsonNodeFactory.instance;
    private final EtfPayloadCodec codec = new EtfPayloadCodec(factory);

    @Test
    public void decodeHelloWithAtomKeys() throws IOException {
        Term term = new Term();
        term.map(4);
        term.atom("op").smallInt(10);
        term.atom("d").map(1).atom("heartbeat_interval").integer(41250);
        term.atom("s").atom("nil");
        term.atom("t").atom("nil");

        GatewayPayload payload = codec.decode(term.bytes());

        assertEquals(Opcode.HELLO, payload.getOpcode());
        assertEquals(41250, payload.getData().get("heartbeat_interval").intValue());
        assertNull(payload.getSequence());
        assertNull(payload.getEventName());
    }

    @Test
    public void decodeBigIntegersAsStrings() throws IOException {
        Term term = new Term();
        term.map(4);
        term.atom("op").smallInt(0);
        term.atom("d").map(2).binary("id").smallBig(175928847299117063L).binary("unavailable").atom("false");
        term.atom("s").integer(7);
        term.atom("t").binary("GUILD_CREATE");

        GatewayPayload payload = codec.decode(term.bytes());

        assertEquals("175928847299117063", payload.getData().get("id").textValue());
        assertFalse(payload.getData().get("unavailable").booleanValue());
        assertEquals(Integer.valueOf(7), payload.getSequence());
        assertEquals("GUILD_CREATE", payload.getEventName());
    }

    @Test
    public void decodeEncodedPayload() {
        ObjectNode data = factory.objectNode();
        data.put("token", "abc");
        data.put("large_threshold", 250);
        data.put("compress", false);
        data.put("ratio", 0.5);
        data.putArray("shard").add(1).add(4);
        data.putArray("empty");
        data.putNull("presence");
        data.put("name", "grüße");
        GatewayPayload payload = GatewayPayload.outbound(Opcode.IDENTIFY, data);

        GatewayPayload decoded = codec.decode(codec.encode(payload));

        assertEquals(payload, decoded);
    }

    @Test
    public void encodeLongsAsBigIntegers() {
        ObjectNode data = factory.objectNode().put("guild_id", 1L << 40).put("negative", -70000L);

        GatewayPayload decoded = codec.decode(codec.encode(GatewayPayload.outbound(Opcode.VOICE_STATE_UPDATE, data)));

        assertEquals(String.valueOf(1L << 40), decoded.getData().get("guild_id").textValue());
        assertEquals(-70000, decoded.getData().get("negative").intValue());
    }

    @Test
    public void encodeUsesBinaryFrames() {
        assertTrue(codec.isBinary());
        assertEquals(131, codec.encode(GatewayPayload.outbound(Opcode.HEARTBEAT, null))[0] & 0xFF);
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectUnknownVersion() {
        codec.decode(new byte[]{(byte) 130, 106});
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectTruncatedTerm() {
        codec.decode(new byte[]{(byte) 131, 116, 0, 0, 0, 1});
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectTrailingBytes() {
        codec.decode(new byte[]{(byte) 131, 106, 106});
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectImproperList() throws IOException {
        Term term = new Term();
        term.out.writeByte(108);
        term.out.writeInt(1);
        term.smallInt(1).smallInt(2);
        codec.decode(term.bytes());
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectNonMapEnvelope() {
        codec.decode(new byte[]{(byte) 131, 97, 1});
    }

    @Test
    public void decodeCompressedTerm() throws IOException {
        Term inner = new Term();
        inner.map(2);
        inner.atom("op").smallInt(11);
        inner.atom("d").atom("nil");

        GatewayPayload payload = codec.decode(compressed(inner.bytes(), 0));

        assertEquals(Opcode.HEARTBEAT_ACK, payload.getOpcode());
    }

    @Test
    public void rejectCompressedTermDeclaringHugeSize() {
        byte[] frame = {(byte) 131, 80, 0x7F, (byte) 0xFF, (byte) 0xFF, (byte) 0xF0, 0x78, (byte) 0x9C, 0x03, 0x00};
        try {
            codec.decode(frame);
            fail("Expected the declared size to be rejected");
        } catch (PayloadCodecException e) {
            assertTrue(e.getMessage().contains("exceeds"));
        }
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectCompressedTermAboveConfiguredLimit() throws IOException {
        Term inner = new Term();
        inner.map(1).atom("op").smallInt(11);

        new EtfPayloadCodec(factory, 4).decode(compressed(inner.bytes(), 0));
    }

    @Test(expected = PayloadCodecException.class)
    public void rejectCompressedTermShorterThanDeclared() throws IOException {
        Term inner = new Term();
        inner.map(1).atom("op").smallInt(11);

        codec.decode(compressed(inner.bytes(), 100));
    }

    private static byte[] compressed(byte[] term, int extraDeclared) throws IOException {
        byte[] body = Arrays.copyOfRange(term, 1, term.length);
        Deflater deflater = new Deflater();
        deflater.setInput(body);
        deflater.finish();
        byte[] buffer = new byte[body.length + 64];
        int length = deflater.deflate(buffer);
        deflater.end();

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(bytes);
        out.writeByte(131);
        out.writeByte(80);
        out.writeInt(body.length + extraDeclared);
        out.write(buffer, 0, length);
        return bytes.toByteArray();
    }

    static class Term {

        final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        final DataOutputStream out = new DataOutputStream(bytes);

        Term() throws IOException {
            out.writeByte(131);
        }

        Term map(int arity) throws IOException {
            out.writeByte(116);
            out.writeInt(arity);
            return this;
        }

        Term atom(String name) throws IOException {
            byte[] raw = name.getBytes(StandardCharsets.UTF_8);
            out.writeByte(119);
            out.writeByte(raw.length);
            out.write(raw);
            return this;
        }

        Term binary(String value) throws IOException {
            byte[] raw = value.getBytes(StandardCharsets.UTF_8);
            out.writeByte(109);
            out.writeInt(raw.length);
            out.write(raw);
            return this;
        }

        Term smallInt(int value) throws IOException {
            out.writeByte(97);
            out.writeByte(value);
            return this;
        }

        Term integer(int value) throws IOException {
            out.writeByte(98);
            out.writeInt(value);
            return this;
        }

        Term smallBig(long value) throws IOException {
            out.writeByte(110);
            out.writeByte(8);
            out.writeByte(0);
            for (int i = 0; i < 8; i++) {
                out.writeByte((int) (value >>> (8 * i)) & 0xFF);
            }
            return this;
        }

        byte[] bytes() {
            return bytes.toByteArray();
        }
    }
}
