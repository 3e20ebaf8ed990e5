package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import io.netty.buffer.ByteBuf;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.Map;

import static discord4j.shards.common.codec.EtfTags.*;

/**
 * Writes a Jackson tree as an ETF term. Object keys and text are written as binaries, booleans and null as atoms.
 */
final class EtfWriter {

    void write(ByteBuf out, JsonNode node) {
        out.writeByte(FORMAT_VERSION);
        writeTerm(out, node);
    }

    private void writeTerm(ByteBuf out, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            writeAtom(out, "nil");
        } else if (node.isBoolean()) {
            writeAtom(out, node.booleanValue() ? "true" : "false");
        } else if (node.isTextual()) {
            writeBinary(out, node.textValue().getBytes(StandardCharsets.UTF_8));
        } else if (node.isBinary()) {
            try {
                writeBinary(out, node.binaryValue());
            } catch (IOException e) {
                throw new PayloadCodecException("Unable to read binary node", e);
            }
        } else if (node.isIntegralNumber()) {
            writeInteger(out, node);
        } else if (node.isNumber()) {
            out.writeByte(NEW_FLOAT_EXT);
            out.writeDouble(node.doubleValue());
        } else if (node.isArray()) {
            writeList(out, node);
        } else if (node.isObject()) {
            writeMap(out, node);
        } else {
            throw new PayloadCodecException("Unsupported node type for ETF: " + node.getNodeType());
        }
    }

    private void writeInteger(ByteBuf out, JsonNode node) {
        if (node.canConvertToInt()) {
            int value = node.intValue();
            if (value >= 0 && value <= 255) {
                out.writeByte(SMALL_INTEGER_EXT);
                out.writeByte(value);
            } else {
                out.writeByte(INTEGER_EXT);
                out.writeInt(value);
            }
            return;
        }
        BigInteger value = node.bigIntegerValue();
        byte[] bigEndian = value.abs().toByteArray();
        int offset = bigEndian[0] == 0 ? 1 : 0;
        int length = bigEndian.length - offset;
        if (length <= 255) {
            out.writeByte(SMALL_BIG_EXT);
            out.writeByte(length);
        } else {
            out.writeByte(LARGE_BIG_EXT);
            out.writeInt(length);
        }
        out.writeByte(value.signum() < 0 ? 1 : 0);
        for (int i = bigEndian.length - 1; i >= offset; i--) {
            out.writeByte(bigEndian[i]);
        }
    }

    private void writeList(ByteBuf out, JsonNode node) {
        if (node.size() > 0) {
            out.writeByte(LIST_EXT);
            out.writeInt(node.size());
            for (JsonNode element : node) {
                writeTerm(out, element);
            }
        }
        out.writeByte(NIL_EXT);
    }

    private void writeMap(ByteBuf out, JsonNode node) {
        out.writeByte(MAP_EXT);
        out.writeInt(node.size());
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            writeBinary(out, field.getKey().getBytes(StandardCharsets.UTF_8));
            writeTerm(out, field.getValue());
        }
    }

    private static void writeBinary(ByteBuf out, byte[] bytes) {
        out.writeByte(BINARY_EXT);
        out.writeInt(bytes.length);
        out.writeBytes(bytes);
    }

    private static void writeAtom(ByteBuf out, String name) {
        byte[] bytes = name.getBytes(StandardCharsets.UTF_8);
        out.writeByte(SMALL_ATOM_UTF8_EXT);
        out.writeByte(bytes.length);
        out.writeBytes(bytes);
    }
}
