package discord4j.shards.common.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import discord4j.shards.common.transport.CloseStatus;
import discord4j.shards.common.transport.GatewayTransport;
import discord4j.shards.common.transport.GatewayTransportException;
import discord4j.shards.common.transport.TransportListener;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * An in-memory transport driven by the test: inbound frames are pushed with {@link #receive(String)} and outbound
 * frames are recorded.
 */
class ScriptedTransport implements GatewayTransport {

    private final ObjectMapper mapper = new ObjectMapper();

    final List<String> urls = new CopyOnWriteArrayList<>();
    final List<byte[]> sent = new CopyOnWriteArrayList<>();
    final List<CloseStatus> closes = new CopyOnWriteArrayList<>();

    private volatile TransportListener listener;
    private volatile boolean open;
    private volatile boolean destroyed;
    private volatile RuntimeException connectError;

    void failNextConnect(RuntimeException error) {
        this.connectError = error;
    }

    @Override
    public Mono<Void> connect(String url, TransportListener listener) {
        return Mono.fromRunnable(() -> {
            urls.add(url);
            RuntimeException error = connectError;
            if (error != null) {
                connectError = null;
                throw error;
            }
            this.listener = listener;
            this.open = true;
        });
    }

    void receive(String json) {
        listener.onFrame(json.getBytes(StandardCharsets.UTF_8), false);
    }

    void receiveBinary(byte[] data) {
        listener.onFrame(data, true);
    }

    void remoteClose(int code) {
        open = false;
        listener.onClose(new CloseStatus(code, "closed by test"));
    }

    List<JsonNode> sentPayloads() {
        return sent.stream().map(bytes -> {
            try {
                return mapper.readTree(bytes);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }).collect(Collectors.toList());
    }

    List<JsonNode> sentWithOp(int op) {
        return sentPayloads().stream()
                .filter(node -> node.get("op").intValue() == op)
                .collect(Collectors.toList());
    }

    @Override
    public void send(byte[] data, boolean binary) {
        if (!open) {
            throw new GatewayTransportException("Not open");
        }
        sent.add(data);
    }

    @Override
    public void close(CloseStatus status) {
        closes.add(status);
        boolean wasOpen = open;
        open = false;
        if (wasOpen && listener != null) {
            listener.onClose(status);
        }
    }

    @Override
    public void destroy() {
        open = false;
        destroyed = true;
    }

    boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public long getBytesSent() {
        return sent.stream().mapToLong(bytes -> bytes.length).sum();
    }

    @Override
    public long getBytesReceived() {
        return 0;
    }

    @Override
    public Duration getLatency() {
        return Duration.ZERO;
    }
}
