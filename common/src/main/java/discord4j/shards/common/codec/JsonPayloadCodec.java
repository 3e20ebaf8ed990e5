/*
 * This file is part of Discord4J.
 *
 * Discord4J is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Discord4J is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with Discord4J. If not, see <http://www.gnu.org/licenses/>.
 */

package discord4j.shards.common.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.Map;

/**
 * A {@link PayloadCodec} for the text encoding, backed by Jackson. Integers that cannot be represented exactly as a
 * double are written as decimal strings.
 */
public class JsonPayloadCodec implements PayloadCodec {

    static final long MAX_SAFE_INTEGER = (1L << 53) - 1;

    private static final BigInteger MAX_SAFE = BigInteger.valueOf(MAX_SAFE_INTEGER);
    private static final BigInteger MIN_SAFE = MAX_SAFE.negate();

    private final ObjectMapper mapper;

    public JsonPayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] encode(GatewayPayload payload) {
        JsonNodeFactory factory = mapper.getNodeFactory();
        ObjectNode root = Envelopes.toTree(factory, payload, safeIntegers(factory, payload.getData()));
        try {
            return mapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new PayloadCodecException("Unable to encode payload with op " + payload.getOp(), e);
        }
    }

    @Override
    public GatewayPayload decode(byte[] data) {
        JsonNode root;
        try {
            root = mapper.readTree(data);
        } catch (IOException e) {
            throw new PayloadCodecException("Error while decoding JSON: " + e.getMessage(), e);
        }
        return Envelopes.fromTree(root);
    }

    @Override
    public PayloadEncoding getEncoding() {
        return PayloadEncoding.JSON;
    }

    private static JsonNode safeIntegers(JsonNodeFactory factory, JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isIntegralNumber()) {
            BigInteger value = node.bigIntegerValue();
            if (value.compareTo(MAX_SAFE) > 0 || value.compareTo(MIN_SAFE) < 0) {
                return factory.textNode(value.toString());
            }
            return node;
        }
        if (node.isObject()) {
            ObjectNode copy = factory.objectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                copy.set(field.getKey(), safeIntegers(factory, field.getValue()));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = factory.arrayNode(node.size());
            for (JsonNode element : node) {
                copy.add(safeIntegers(factory, element));
            }
            return copy;
        }
        return node;
    }
}
