package discord4j.shards.common.transport;

import java.time.Duration;

/**
 * Receives the events of one transport connection. Callbacks for a given connection are never invoked concurrently.
 */
public interface TransportListener {

    /**
     * A complete message was received.
     *
     * @param data the raw message bytes, owned by the listener
     * @param binary whether the message arrived as a binary frame
     */
    void onFrame(byte[] data, boolean binary);

    /**
     * The connection was closed, either by the remote or locally. Invoked at most once per connection.
     *
     * @param status the close code and reason, {@link CloseStatus#ABNORMAL_CLOSE} if no close frame was received
     */
    void onClose(CloseStatus status);

    /**
     * The connection failed after being established. {@link #onClose(CloseStatus)} follows.
     *
     * @param error the failure, usually a {@link GatewayTransportException}
     */
    void onError(Throwable error);

    default void onHighLatency(Duration latency) {
    }
}
