package discord4j.shards.common.transport;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.websocketx.BinaryWebSocketFrame;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PingWebSocketFrame;
import io.netty.handler.codec.http.websocketx.PongWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.netty.http.client.HttpClient;
import reactor.netty.http.client.WebsocketClientSpec;
import reactor.util.Logger;
import reactor.util.Loggers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.LockSupport;

/**
 * A {@link GatewayTransport} backed by a Reactor Netty websocket client. Latency is measured with websocket pings.
 */
public class ReactorNettyGatewayTransport implements GatewayTransport {

    private static final Logger log = Loggers.getLogger(ReactorNettyGatewayTransport.class);

    private final int shardId;
    private final HttpClient httpClient;
    private final int maxFramePayloadLength;
    private final Duration pingInterval;
    private final Duration highLatencyThreshold;
    private final Scheduler timerScheduler;

    private final AtomicReference<Connection> current = new AtomicReference<>();
    private final AtomicLong bytesSent = new AtomicLong();
    private final AtomicLong bytesReceived = new AtomicLong();
    private final AtomicLong latencyNanos = new AtomicLong();

    public ReactorNettyGatewayTransport(int shardId, int maxFramePayloadLength, Duration pingInterval,
                                        Duration highLatencyThreshold) {
        this(shardId, HttpClient.create(), maxFramePayloadLength, pingInterval, highLatencyThreshold,
                Schedulers.parallel());
    }

    public ReactorNettyGatewayTransport(int shardId, HttpClient httpClient, int maxFramePayloadLength,
                                        Duration pingInterval, Duration highLatencyThreshold,
                                        Scheduler timerScheduler) {
        this.shardId = shardId;
        this.httpClient = httpClient;
        this.maxFramePayloadLength = maxFramePayloadLength;
        this.pingInterval = pingInterval;
        this.highLatencyThreshold = highLatencyThreshold;
        this.timerScheduler = timerScheduler;
    }

    @Override
    public Mono<Void> connect(String url, TransportListener listener) {
        return Mono.defer(() -> {
            Connection connection = new Connection(listener);
            Connection previous = current.getAndSet(connection);
            if (previous != null) {
                previous.dispose();
            }
            log.debug("[shard={}] Opening websocket to {}", shardId, url);
            connection.subscription = httpClient
                    .websocket(WebsocketClientSpec.builder()
                            .maxFramePayloadLength(maxFramePayloadLength)
                            .build())
                    .uri(url)
                    .handle((in, out) -> {
                        connection.open.set(true);
                        connection.opened.tryEmitEmpty();

                        Disposable closeStatus = in.receiveCloseStatus()
                                .subscribe(status -> connection.remoteClose.set(
                                        new CloseStatus(status.code(), status.reasonText())));

                        Disposable pings = Flux.interval(pingInterval, pingInterval, timerScheduler)
                                .subscribe(tick -> connection.ping());

                        Mono<Void> inbound = in.aggregateFrames(maxFramePayloadLength)
                                .receiveFrames()
                                .doOnNext(connection::receive)
                                .doFinally(signal -> {
                                    pings.dispose();
                                    closeStatus.dispose();
                                    connection.outbound.tryEmitComplete();
                                })
                                .then();

                        Mono<Void> outbound = out.sendObject(connection.outbound.asFlux()).then();

                        return Mono.zip(inbound, outbound).then();
                    })
                    .then()
                    .subscribe(null, connection::fail, connection::complete);
            return connection.opened.asMono();
        });
    }

    @Override
    public void send(byte[] data, boolean binary) {
        Connection connection = current.get();
        if (connection == null || !connection.open.get()) {
            throw new GatewayTransportException("Transport of shard " + shardId + " is not open");
        }
        ByteBuf buf = Unpooled.wrappedBuffer(data);
        connection.emit(binary ? new BinaryWebSocketFrame(buf) : new TextWebSocketFrame(buf));
        bytesSent.addAndGet(data.length);
    }

    @Override
    public void close(CloseStatus status) {
        Connection connection = current.get();
        if (connection != null && connection.open.get()) {
            log.debug("[shard={}] Closing websocket with {}", shardId, status);
            connection.localClose.set(status);
            connection.emit(new CloseWebSocketFrame(status.getCode(),
                    status.getReason() == null ? "" : status.getReason()));
            connection.outbound.tryEmitComplete();
        }
    }

    @Override
    public void destroy() {
        Connection connection = current.getAndSet(null);
        if (connection != null) {
            connection.dispose();
        }
    }

    @Override
    public boolean isOpen() {
        Connection connection = current.get();
        return connection != null && connection.open.get();
    }

    @Override
    public long getBytesSent() {
        return bytesSent.get();
    }

    @Override
    public long getBytesReceived() {
        return bytesReceived.get();
    }

    @Override
    public Duration getLatency() {
        return Duration.ofNanos(latencyNanos.get());
    }

    private class Connection {

        private final TransportListener listener;
        private final Sinks.Many<WebSocketFrame> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Sinks.One<Void> opened = Sinks.one();
        private final AtomicBoolean open = new AtomicBoolean();
        private final AtomicBoolean terminated = new AtomicBoolean();
        private final AtomicBoolean disposed = new AtomicBoolean();
        private final AtomicReference<CloseStatus> remoteClose = new AtomicReference<>();
        private final AtomicReference<CloseStatus> localClose = new AtomicReference<>();
        private final AtomicLong pingSentAt = new AtomicLong();
        private volatile Disposable subscription;

        Connection(TransportListener listener) {
            this.listener = listener;
        }

        void emit(WebSocketFrame frame) {
            Sinks.EmitResult result;
            while ((result = outbound.tryEmitNext(frame)) == Sinks.EmitResult.FAIL_NON_SERIALIZED) {
                LockSupport.parkNanos(10);
            }
            if (result.isFailure()) {
                frame.release();
                throw new GatewayTransportException("Unable to queue frame for shard " + shardId + ": " + result);
            }
        }

        void ping() {
            if (!open.get()) {
                return;
            }
            pingSentAt.set(System.nanoTime());
            try {
                emit(new PingWebSocketFrame(Unpooled.EMPTY_BUFFER));
            } catch (GatewayTransportException e) {
                log.debug("[shard={}] Skipping ping: {}", shardId, e.getMessage());
            }
        }

        void receive(WebSocketFrame frame) {
            if (disposed.get()) {
                return;
            }
            if (frame instanceof PongWebSocketFrame) {
                long sentAt = pingSentAt.get();
                if (sentAt != 0) {
                    Duration latency = Duration.ofNanos(System.nanoTime() - sentAt);
                    latencyNanos.set(latency.toNanos());
                    if (latency.compareTo(highLatencyThreshold) > 0) {
                        listener.onHighLatency(latency);
                    }
                }
                return;
            }
            if (frame instanceof TextWebSocketFrame || frame instanceof BinaryWebSocketFrame) {
                byte[] data = ByteBufUtil.getBytes(frame.content());
                bytesReceived.addAndGet(data.length);
                listener.onFrame(data, frame instanceof BinaryWebSocketFrame);
            }
        }

        void fail(Throwable error) {
            GatewayTransportException exception = error instanceof GatewayTransportException ?
                    (GatewayTransportException) error :
                    new GatewayTransportException("Websocket failure on shard " + shardId, error);
            if (!open.get()) {
                opened.tryEmitError(exception);
                terminate(false);
                return;
            }
            if (!disposed.get()) {
                listener.onError(exception);
            }
            terminate(true);
        }

        void complete() {
            if (!open.get()) {
                opened.tryEmitError(new GatewayTransportException("Websocket of shard " + shardId
                        + " closed before opening"));
            }
            terminate(true);
        }

        private void terminate(boolean notify) {
            open.set(false);
            current.compareAndSet(this, null);
            if (terminated.compareAndSet(false, true) && notify && !disposed.get()) {
                // a close we initiated is reported with our code, whatever the server or Netty echoes back
                CloseStatus status = localClose.get();
                if (status == null) {
                    status = remoteClose.get();
                }
                listener.onClose(status == null ? CloseStatus.ABNORMAL_CLOSE : status);
            }
        }

        void dispose() {
            disposed.set(true);
            open.set(false);
            outbound.tryEmitComplete();
            Disposable s = subscription;
            if (s != null) {
                s.dispose();
            }
            opened.tryEmitError(new GatewayTransportException("Connection of shard " + shardId + " was disposed"));
        }
    }
}
