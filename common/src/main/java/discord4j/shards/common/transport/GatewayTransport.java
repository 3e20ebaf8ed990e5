package discord4j.shards.common.transport;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Owns at most one physical socket to the Gateway.
 */
public interface GatewayTransport {

    /**
     * Open a new connection, tearing down any previous one first. Events of the new connection are delivered to the
     * given listener; the previous connection's listener receives nothing further.
     *
     * @param url the address to connect to
     * @param listener the listener for this connection
     * @return a {@link Mono} completing once the socket is open, or failing with a {@link GatewayTransportException}
     */
    Mono<Void> connect(String url, TransportListener listener);

    /**
     * Queue a message for transmission.
     *
     * @param data the bytes to send
     * @param binary {@code true} to send a binary frame, {@code false} for a text frame
     * @throws GatewayTransportException if the socket is not open
     */
    void send(byte[] data, boolean binary);

    /**
     * Close the current connection with the given status. The listener is still notified through
     * {@link TransportListener#onClose(CloseStatus)}.
     *
     * @param status the close status to send
     */
    void close(CloseStatus status);

    /**
     * Close the socket and drop every listener. Idempotent.
     */
    void destroy();

    boolean isOpen();

    long getBytesSent();

    long getBytesReceived();

    /**
     * Return the last ping round trip, or {@link Duration#ZERO} if none was measured yet.
     *
     * @return the latency
     */
    Duration getLatency();
}
