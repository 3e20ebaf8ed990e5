package discord4j.shards.common.codec;

/**
 * Bidirectional transform between wire bytes and {@link GatewayPayload}. One instance is selected when a connection is
 * set up and used for its whole lifetime.
 */
public interface PayloadCodec {

    /**
     * Encode a payload for sending.
     *
     * @param payload the envelope to encode
     * @return the wire bytes
     * @throws PayloadCodecException if the payload cannot be represented in this encoding
     */
    byte[] encode(GatewayPayload payload);

    /**
     * Decode one fully reassembled inbound frame.
     *
     * @param data the frame bytes
     * @return the decoded envelope
     * @throws PayloadCodecException if the bytes are malformed or the envelope shape is invalid
     */
    GatewayPayload decode(byte[] data);

    /**
     * Return the encoding implemented by this codec.
     *
     * @return the encoding
     */
    PayloadEncoding getEncoding();

    /**
     * Whether encoded payloads must be sent as binary frames rather than text frames.
     *
     * @return {@code true} for binary encodings
     */
    default boolean isBinary() {
        return getEncoding().isBinary();
    }
}
