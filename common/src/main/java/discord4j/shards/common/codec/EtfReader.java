package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

import java.math.BigInteger;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

import static discord4j.shards.common.codec.EtfTags.*;

/**
 * Reads an ETF term into a Jackson tree. Atoms become text except {@code true}, {@code false}, {@code nil} and
 * {@code null}; big integers become decimal strings so snowflakes look the same as in the JSON encoding.
 */
final class EtfReader {

    private static final int MAX_DEPTH = 256;
    private static final int INFLATE_CHUNK_SIZE = 8192;

    private final JsonNodeFactory factory;
    private final int maxTermSize;

    EtfReader(JsonNodeFactory factory, int maxTermSize) {
        this.factory = factory;
        this.maxTermSize = maxTermSize;
    }

    JsonNode read(ByteBuf buf) {
        int version = buf.readUnsignedByte();
        if (version != FORMAT_VERSION) {
            throw new PayloadCodecException("Unsupported ETF version: " + version);
        }
        JsonNode term = readTerm(buf, 0);
        if (buf.isReadable()) {
            throw new PayloadCodecException("Trailing bytes after ETF term: " + buf.readableBytes());
        }
        return term;
    }

    private JsonNode readTerm(ByteBuf buf, int depth) {
        if (depth > MAX_DEPTH) {
            throw new PayloadCodecException("ETF term nested too deeply");
        }
        int tag = buf.readUnsignedByte();
        switch (tag) {
            case SMALL_INTEGER_EXT:
                return factory.numberNode((int) buf.readUnsignedByte());
            case INTEGER_EXT:
                return factory.numberNode(buf.readInt());
            case NEW_FLOAT_EXT:
                return factory.numberNode(buf.readDouble());
            case FLOAT_EXT:
                return readOldFloat(buf);
            case ATOM_EXT:
                return atom(readString(buf, buf.readUnsignedShort(), StandardCharsets.ISO_8859_1));
            case SMALL_ATOM_EXT:
                return atom(readString(buf, buf.readUnsignedByte(), StandardCharsets.ISO_8859_1));
            case ATOM_UTF8_EXT:
                return atom(readString(buf, buf.readUnsignedShort(), StandardCharsets.UTF_8));
            case SMALL_ATOM_UTF8_EXT:
                return atom(readString(buf, buf.readUnsignedByte(), StandardCharsets.UTF_8));
            case SMALL_TUPLE_EXT:
                return readElements(buf, buf.readUnsignedByte(), depth);
            case LARGE_TUPLE_EXT:
                return readElements(buf, checkedLength(buf, buf.readUnsignedInt()), depth);
            case NIL_EXT:
                return factory.arrayNode();
            case STRING_EXT:
                return factory.textNode(readString(buf, buf.readUnsignedShort(), StandardCharsets.ISO_8859_1));
            case LIST_EXT:
                return readList(buf, depth);
            case BINARY_EXT:
                return factory.textNode(readString(buf, checkedLength(buf, buf.readUnsignedInt()),
                        StandardCharsets.UTF_8));
            case SMALL_BIG_EXT:
                return readBig(buf, buf.readUnsignedByte());
            case LARGE_BIG_EXT:
                return readBig(buf, checkedLength(buf, buf.readUnsignedInt()));
            case MAP_EXT:
                return readMap(buf, depth);
            case COMPRESSED:
                return readCompressed(buf, depth);
            default:
                throw new PayloadCodecException("Unknown ETF tag: " + tag);
        }
    }

    private JsonNode atom(String name) {
        switch (name) {
            case "nil":
            case "null":
                return factory.nullNode();
            case "true":
                return factory.booleanNode(true);
            case "false":
                return factory.booleanNode(false);
            default:
                return factory.textNode(name);
        }
    }

    private JsonNode readOldFloat(ByteBuf buf) {
        String text = readString(buf, 31, StandardCharsets.ISO_8859_1).trim();
        int end = text.indexOf('\0');
        try {
            return factory.numberNode(Double.parseDouble(end >= 0 ? text.substring(0, end) : text));
        } catch (NumberFormatException e) {
            throw new PayloadCodecException("Invalid ETF float: " + text, e);
        }
    }

    private ArrayNode readElements(ByteBuf buf, int count, int depth) {
        ArrayNode array = factory.arrayNode();
        for (int i = 0; i < count; i++) {
            array.add(readTerm(buf, depth + 1));
        }
        return array;
    }

    private ArrayNode readList(ByteBuf buf, int depth) {
        ArrayNode array = readElements(buf, checkedLength(buf, buf.readUnsignedInt()), depth);
        JsonNode tail = readTerm(buf, depth + 1);
        if (!tail.isArray() || tail.size() != 0) {
            throw new PayloadCodecException("Improper ETF lists are not supported");
        }
        return array;
    }

    private ObjectNode readMap(ByteBuf buf, int depth) {
        int arity = checkedLength(buf, buf.readUnsignedInt());
        ObjectNode object = factory.objectNode();
        for (int i = 0; i < arity; i++) {
            JsonNode key = readTerm(buf, depth + 1);
            if (!key.isTextual() && !key.isNumber()) {
                throw new PayloadCodecException("Unsupported ETF map key: " + key);
            }
            object.set(key.asText(), readTerm(buf, depth + 1));
        }
        return object;
    }

    private JsonNode readBig(ByteBuf buf, int length) {
        int sign = buf.readUnsignedByte();
        byte[] magnitude = new byte[checkedLength(buf, length)];
        for (int i = length - 1; i >= 0; i--) {
            magnitude[i] = buf.readByte();
        }
        BigInteger value = new BigInteger(1, magnitude);
        return factory.textNode((sign == 0 ? value : value.negate()).toString());
    }

    private JsonNode readCompressed(ByteBuf buf, int depth) {
        int size = checkedSize(buf.readUnsignedInt());
        byte[] compressed = new byte[buf.readableBytes()];
        buf.readBytes(compressed);
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            // grow with the inflated output instead of trusting the declared size
            byte[] chunk = new byte[Math.max(1, Math.min(size, INFLATE_CHUNK_SIZE))];
            ByteBuf term = Unpooled.buffer(chunk.length);
            while (term.readableBytes() < size && !inflater.finished()) {
                int read = inflater.inflate(chunk, 0, Math.min(chunk.length, size - term.readableBytes()));
                if (read == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                term.writeBytes(chunk, 0, read);
            }
            if (term.readableBytes() != size || !inflater.finished()) {
                throw new PayloadCodecException("Compressed ETF term does not match its declared size " + size);
            }
            return readTerm(term, depth + 1);
        } catch (DataFormatException e) {
            throw new PayloadCodecException("Invalid compressed ETF term", e);
        } finally {
            inflater.end();
        }
    }

    private static String readString(ByteBuf buf, int length, Charset charset) {
        checkedLength(buf, length);
        String value = buf.toString(buf.readerIndex(), length, charset);
        buf.skipBytes(length);
        return value;
    }

    private static int checkedLength(ByteBuf buf, long length) {
        if (length > buf.readableBytes()) {
            throw new PayloadCodecException("ETF length " + length + " exceeds remaining " + buf.readableBytes());
        }
        return (int) length;
    }

    private int checkedSize(long size) {
        if (size > maxTermSize) {
            throw new PayloadCodecException("Compressed ETF term of " + size + " bytes exceeds " + maxTermSize);
        }
        return (int) size;
    }
}
