package discord4j.shards.common.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Envelope shape shared by both encodings: {@code {"op": int, "d": any, "s": int|null, "t": string|null}}.
 */
final class Envelopes {

    static final String OP_FIELD = "op";
    static final String D_FIELD = "d";
    static final String S_FIELD = "s";
    static final String T_FIELD = "t";

    private Envelopes() {
    }

    static GatewayPayload fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PayloadCodecException("Payload is not an object");
        }
        JsonNode op = root.get(OP_FIELD);
        if (op == null || !op.isIntegralNumber() || !op.canConvertToInt()) {
            throw new PayloadCodecException("Payload op is not numeric: " + op);
        }
        JsonNode s = root.get(S_FIELD);
        Integer sequence = null;
        if (s != null && !s.isNull()) {
            if (!s.isIntegralNumber() || !s.canConvertToInt()) {
                throw new PayloadCodecException("Payload sequence is not numeric: " + s);
            }
            sequence = s.intValue();
        }
        JsonNode t = root.get(T_FIELD);
        String eventName = null;
        if (t != null && !t.isNull()) {
            if (!t.isTextual()) {
                throw new PayloadCodecException("Payload event name is not text: " + t);
            }
            eventName = t.textValue();
        }
        return new GatewayPayload(op.intValue(), root.get(D_FIELD), sequence, eventName);
    }

    static ObjectNode toTree(JsonNodeFactory factory, GatewayPayload payload, JsonNode data) {
        ObjectNode root = factory.objectNode();
        root.put(OP_FIELD, payload.getOp());
        root.set(D_FIELD, data == null ? factory.nullNode() : data);
        if (payload.getSequence() == null) {
            root.putNull(S_FIELD);
        } else {
            root.put(S_FIELD, payload.getSequence());
        }
        if (payload.getEventName() == null) {
            root.putNull(T_FIELD);
        } else {
            root.put(T_FIELD, payload.getEventName());
        }
        return root;
    }
}
