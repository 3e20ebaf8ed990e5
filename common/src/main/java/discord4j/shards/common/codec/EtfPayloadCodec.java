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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;

/**
 * A {@link PayloadCodec} for the binary Erlang term encoding. Payloads must be sent as binary frames.
 */
public class EtfPayloadCodec implements PayloadCodec {

    /**
     * Largest inflated size accepted for a compressed term, in bytes.
     */
    public static final int DEFAULT_MAX_TERM_SIZE = 64 * 1024 * 1024;

    private final JsonNodeFactory factory;
    private final EtfReader reader;
    private final EtfWriter writer = new EtfWriter();

    public EtfPayloadCodec(JsonNodeFactory factory) {
        this(factory, DEFAULT_MAX_TERM_SIZE);
    }

    public EtfPayloadCodec(JsonNodeFactory factory, int maxTermSize) {
        this.factory = factory;
        this.reader = new EtfReader(factory, maxTermSize);
    }

    @Override
    public byte[] encode(GatewayPayload payload) {
        ByteBuf buf = Unpooled.buffer();
        try {
            writer.write(buf, Envelopes.toTree(factory, payload, payload.getData()));
            byte[] bytes = new byte[buf.readableBytes()];
            buf.readBytes(bytes);
            return bytes;
        } finally {
            buf.release();
        }
    }

    @Override
    public GatewayPayload decode(byte[] data) {
        JsonNode root;
        try {
            root = reader.read(Unpooled.wrappedBuffer(data));
        } catch (IndexOutOfBoundsException e) {
            throw new PayloadCodecException("Truncated ETF payload", e);
        }
        return Envelopes.fromTree(root);
    }

    @Override
    public PayloadEncoding getEncoding() {
        return PayloadEncoding.ETF;
    }
}
