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

package discord4j.shards.common.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import discord4j.shards.common.ShardGatewayException;
import discord4j.shards.common.codec.GatewayPayload;
import discord4j.shards.common.codec.Opcode;
import discord4j.shards.common.codec.PayloadCodec;
import discord4j.shards.common.codec.PayloadCodecException;
import discord4j.shards.common.compression.CompressionMode;
import discord4j.shards.common.compression.DecompressionException;
import discord4j.shards.common.compression.Decompressor;
import discord4j.shards.common.event.DispatchEvent;
import discord4j.shards.common.event.GatewayEventSink;
import discord4j.shards.common.event.LifecycleEvent;
import discord4j.shards.common.limiter.GatewayRateLimiter;
import discord4j.shards.common.limiter.IdentifyLimiter;
import discord4j.shards.common.limiter.LimiterAbortedException;
import discord4j.shards.common.transport.CloseStatus;
import discord4j.shards.common.transport.GatewayTransport;
import discord4j.shards.common.transport.GatewayTransportException;
import discord4j.shards.common.transport.TransportListener;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The session state machine of one shard: connects, identifies or resumes, heartbeats, forwards dispatches and
 * reconnects with backoff until destroyed.
 * <p>
 * Every transport callback and timer runs on a single {@link Scheduler.Worker}, so frames of this shard are handled
 * strictly one after the other. Each connection gets a generation number; callbacks from an older connection are
 * ignored.
 */
public class DefaultShardClient implements ShardClient {

    private static final Logger log = Loggers.getLogger(DefaultShardClient.class);
    private static final Logger senderLog = Loggers.getLogger("discord4j.shards.protocol.sender");
    private static final Logger receiverLog = Loggers.getLogger("discord4j.shards.protocol.receiver");

    private final GatewayOptions options;
    private final ShardSession session;
    private final int maxConcurrency;
    private final GatewayEventSink events;
    private final GatewayTransport transport;
    private final GatewayRateLimiter rateLimiter;
    private final IdentifyLimiter identifyLimiter;
    private final Scheduler scheduler;
    private final Scheduler.Worker worker;
    private final JsonNodeFactory nodes;

    private final AtomicInteger generation = new AtomicInteger();
    private final AtomicBoolean destroyed = new AtomicBoolean();
    private final AtomicReference<Sinks.One<Void>> readySink = new AtomicReference<>();
    private final Sinks.One<Boolean> destroySignal = Sinks.one();
    private final Object decompressorLock = new Object();

    private final Disposable.Swap connectTask = Disposables.swap();
    private final Disposable.Swap heartbeatTask = Disposables.swap();
    private final Disposable.Swap ackTimeout = Disposables.swap();
    private final Disposable.Swap reconnectTask = Disposables.swap();
    private final Disposable.Swap identifyWait = Disposables.swap();

    // only accessed from the worker
    private PayloadCodec codec;
    // guarded by decompressorLock, destroy() releases it from the caller's thread
    @Nullable
    private Decompressor decompressor;
    private long heartbeatInterval;
    private long lastHeartbeatSent = -1;

    public DefaultShardClient(GatewayOptions options, int shardId, int numShards, int maxConcurrency,
                              GatewayEventSink events) {
        this.options = options;
        this.session = new ShardSession(shardId, numShards, maxConcurrency, options.getLargeThreshold());
        this.maxConcurrency = maxConcurrency;
        this.events = events;
        this.transport = options.getTransportFactory().create(shardId);
        this.rateLimiter = options.getRateLimiter();
        this.identifyLimiter = options.getIdentifyLimiter();
        this.scheduler = options.getScheduler();
        this.worker = scheduler.createWorker();
        this.nodes = options.getObjectMapper().getNodeFactory();
        this.codec = options.getEncoding().createCodec(options.getObjectMapper());
    }

    @Override
    public int getShardId() {
        return session.getShardId();
    }

    @Override
    public ShardSession getSession() {
        return session;
    }

    public GatewayTransport getTransport() {
        return transport;
    }

    @Override
    public Mono<Void> connect() {
        return Mono.defer(() -> {
            if (destroyed.get()) {
                return Mono.error(new GatewayTransportException("Shard " + getShardId() + " was destroyed"));
            }
            ShardStatus status = session.getStatus();
            if (status == ShardStatus.CONNECTED) {
                return Mono.empty();
            }
            Sinks.One<Void> current = readySink.get();
            if (current != null && status != ShardStatus.IDLE && status != ShardStatus.DISCONNECTED) {
                return current.asMono();
            }
            if (status == ShardStatus.DISCONNECTED) {
                session.resetAttempts();
            }
            Sinks.One<Void> ready = Sinks.one();
            readySink.set(ready);
            if (!schedule(this::openConnection)) {
                return Mono.error(new GatewayTransportException("Shard " + getShardId() + " was destroyed"));
            }
            return ready.asMono();
        });
    }

    @Override
    public Mono<Void> send(GatewayCommand command) {
        return Mono.defer(() -> {
            if (session.getStatus() != ShardStatus.CONNECTED) {
                return Mono.error(new GatewayTransportException("Shard " + getShardId() + " is not connected"));
            }
            int gen = generation.get();
            return rateLimiter.acquire()
                    .takeUntilOther(destroySignal.asMono())
                    .then(Mono.<Void>create(sink -> {
                        if (destroyed.get()) {
                            sink.error(new GatewayTransportException("Shard " + getShardId() + " was destroyed"));
                            return;
                        }
                        boolean queued = schedule(() -> {
                            if (gen != generation.get() || destroyed.get()) {
                                sink.error(new GatewayTransportException("Connection of shard " + getShardId()
                                        + " changed before the command was sent"));
                                return;
                            }
                            try {
                                sendNow(command.toPayload());
                                sink.success();
                            } catch (ShardGatewayException e) {
                                sink.error(e);
                            }
                        });
                        if (!queued) {
                            sink.error(new GatewayTransportException("Shard " + getShardId() + " was destroyed"));
                        }
                    }));
        });
    }

    @Override
    public void destroy() {
        if (!destroyed.compareAndSet(false, true)) {
            return;
        }
        generation.incrementAndGet();
        destroySignal.tryEmitValue(true);
        connectTask.dispose();
        heartbeatTask.dispose();
        ackTimeout.dispose();
        reconnectTask.dispose();
        identifyWait.dispose();
        worker.dispose();
        if (transport.isOpen()) {
            transport.close(CloseStatus.NORMAL_CLOSE);
        }
        transport.destroy();
        releaseDecompressor();
        session.setStatus(ShardStatus.DESTROYED);
        log.info("[shard={}] Destroyed", getShardId());
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.SHARD_DISCONNECT, "Shard destroyed",
                null, CloseStatus.NORMAL_CLOSE));
        Sinks.One<Void> ready = readySink.get();
        if (ready != null) {
            ready.tryEmitError(new LimiterAbortedException("Shard " + getShardId() + " was destroyed"));
        }
    }

    // Connection lifecycle

    private void openConnection() {
        if (destroyed.get()) {
            return;
        }
        int gen = generation.incrementAndGet();
        releaseDecompressor();
        session.incrementConnectAttempts();
        boolean resuming = session.canResume();
        session.setStatus(ShardStatus.CONNECTING);

        codec = options.getEncoding().createCodec(options.getObjectMapper());
        synchronized (decompressorLock) {
            if (destroyed.get()) {
                return;
            }
            decompressor = options.getCompression().createDecompressor(options.getMaxChunkSize());
            if (decompressor != null) {
                decompressor.initialize();
            }
        }

        String resumeUrl = session.getResumeUrl();
        String url = buildUrl(resuming && resumeUrl != null ? resumeUrl : options.getGatewayUrl());
        log.info("[shard={}] Connecting to {}", getShardId(), url);
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.CONNECTING,
                resuming ? "Connecting to resume session" : "Connecting"));

        connectTask.update(transport.connect(url, new ConnectionListener(gen))
                .subscribe(null,
                        error -> execute(gen, () -> onConnectError(error)),
                        () -> log.debug("[shard={}] Websocket open", getShardId())));
    }

    String buildUrl(String base) {
        StringBuilder url = new StringBuilder(base.endsWith("/") ? base.substring(0, base.length() - 1) : base)
                .append("/?v=").append(options.getVersion())
                .append("&encoding=").append(options.getEncoding().getQueryValue());
        String compress = options.getCompression().getQueryValue();
        if (compress != null) {
            url.append("&compress=").append(compress);
        }
        return url.toString();
    }

    private void onConnectError(Throwable error) {
        warn("Unable to connect: " + error.getMessage(), error);
        scheduleReconnect(error);
    }

    private void handleClose(CloseStatus status) {
        stopHeartbeat();
        DisconnectBehavior behavior = CloseCodes.behaviorFor(status.getCode());
        log.info("[shard={}] Disconnected with {}, next action: {}", getShardId(), status, behavior);
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.SHARD_DISCONNECT,
                "Disconnected: " + behavior, null, status));
        switch (behavior) {
            case STOP:
                fail(new GatewayClosedException(getShardId(), status), status);
                break;
            case REIDENTIFY:
                session.resetSession();
                scheduleReconnect(null);
                break;
            default:
                scheduleReconnect(null);
                break;
        }
    }

    /**
     * Drop the current connection and connect again.
     *
     * @param resumable whether the session is kept for a resume
     */
    private void reconnect(boolean resumable, String reason, @Nullable Throwable cause) {
        generation.incrementAndGet();
        stopHeartbeat();
        identifyWait.update(Disposables.disposed());
        if (transport.isOpen()) {
            transport.close(resumable ? new CloseStatus(CloseCodes.RESUMABLE_CLOSE, reason) :
                    CloseStatus.NORMAL_CLOSE);
        }
        if (!resumable) {
            session.resetSession();
        }
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.SHARD_DISCONNECT, reason, cause, null));
        scheduleReconnect(cause);
    }

    private void scheduleReconnect(@Nullable Throwable cause) {
        int attempt = session.incrementReconnectAttempts();
        long maxRetries = options.getReconnectOptions().getMaxRetries();
        if (attempt > maxRetries) {
            fail(new ReconnectExhaustedException(getShardId(), attempt - 1, cause), null);
            return;
        }
        Duration delay = options.getReconnectOptions().getBackoff(attempt);
        session.setStatus(ShardStatus.RECONNECTING);
        log.info("[shard={}] Reconnecting in {} ms (attempt {} of {})", getShardId(), delay.toMillis(), attempt,
                maxRetries);
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.RECONNECTING,
                "Reconnect attempt " + attempt + " in " + delay.toMillis() + " ms", cause, null));
        reconnectTask.update(scheduleDelayed(generation.get(), this::openConnection, delay.toMillis()));
    }

    private void fail(ShardGatewayException error, @Nullable CloseStatus status) {
        generation.incrementAndGet();
        stopHeartbeat();
        identifyWait.update(Disposables.disposed());
        transport.destroy();
        releaseDecompressor();
        session.setStatus(ShardStatus.DISCONNECTED);
        log.error("[shard={}] {}", getShardId(), error.getMessage());
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.ERROR, error.getMessage(), error,
                status));
        Sinks.One<Void> ready = readySink.get();
        if (ready != null) {
            ready.tryEmitError(error);
        }
    }

    private void releaseDecompressor() {
        synchronized (decompressorLock) {
            if (decompressor != null) {
                decompressor.destroy();
                decompressor = null;
            }
        }
    }

    // Inbound

    private void handleFrame(byte[] data, boolean binary) {
        byte[] bytes = data;
        if (binary && options.getCompression() != CompressionMode.NONE) {
            try {
                synchronized (decompressorLock) {
                    if (decompressor == null) {
                        return;
                    }
                    bytes = decompressor.decompress(data);
                }
            } catch (DecompressionException e) {
                warn("Dropping connection after decompression failure: " + e.getMessage(), e);
                reconnect(true, "Decompression failure", e);
                return;
            }
            if (bytes.length == 0) {
                return;
            }
        }
        GatewayPayload payload;
        try {
            payload = codec.decode(bytes);
        } catch (PayloadCodecException e) {
            warn("Dropping malformed payload: " + e.getMessage(), e);
            return;
        }
        logPayload(receiverLog, payload);
        handlePayload(payload);
    }

    private void handlePayload(GatewayPayload payload) {
        Integer sequence = payload.getSequence();
        if (sequence != null) {
            session.updateSequence(sequence);
        }
        Opcode opcode = payload.getOpcode();
        if (opcode == null) {
            log.debug("[shard={}] Ignoring unknown opcode {}", getShardId(), payload.getOp());
            return;
        }
        switch (opcode) {
            case DISPATCH:
                handleDispatch(payload);
                break;
            case HEARTBEAT:
                sendHeartbeat();
                break;
            case RECONNECT:
                debug("Reconnect requested by the Gateway");
                reconnect(true, "Reconnect requested", null);
                break;
            case INVALID_SESSION:
                handleInvalidSession(payload);
                break;
            case HELLO:
                handleHello(payload);
                break;
            case HEARTBEAT_ACK:
                handleHeartbeatAck();
                break;
            default:
                log.debug("[shard={}] Ignoring opcode {}", getShardId(), opcode);
                break;
        }
    }

    private void handleHello(GatewayPayload payload) {
        JsonNode data = payload.getData();
        long interval = data == null ? 0 : data.path("heartbeat_interval").asLong(0);
        if (interval <= 0) {
            warn("HELLO without a heartbeat interval", null);
            reconnect(true, "Invalid HELLO", null);
            return;
        }
        startHeartbeat(interval);
        if (session.canResume()) {
            resume();
        } else {
            identify();
        }
    }

    private void handleDispatch(GatewayPayload payload) {
        String eventName = payload.getEventName();
        JsonNode data = payload.getData();
        if (eventName == null) {
            log.debug("[shard={}] Ignoring dispatch without event name", getShardId());
            return;
        }
        switch (eventName) {
            case "READY":
                handleReady(data);
                break;
            case "RESUMED":
                handleResumed();
                break;
            case "GUILD_CREATE":
                if (data != null && data.hasNonNull("id")) {
                    session.addGuild(data.get("id").asText());
                }
                break;
            case "GUILD_DELETE":
                if (data != null && data.hasNonNull("id") && !data.path("unavailable").asBoolean(false)) {
                    session.removeGuild(data.get("id").asText());
                }
                break;
            default:
                break;
        }
        events.publish(new DispatchEvent(getShardId(), eventName, data, payload.getSequence()));
    }

    private void handleReady(@Nullable JsonNode data) {
        JsonNode ready = data == null ? nodes.missingNode() : data;
        String sessionId = ready.path("session_id").asText(null);
        if (sessionId == null) {
            warn("READY without a session id", null);
        }
        session.clearGuilds();
        for (JsonNode guild : ready.path("guilds")) {
            if (guild.hasNonNull("id")) {
                session.addGuild(guild.get("id").asText());
            }
        }
        session.onReady(sessionId, ready.path("resume_gateway_url").asText(null));
        session.setStatus(ShardStatus.CONNECTED);
        log.info("[shard={}] Ready with {} guilds", getShardId(), session.getGuildCount());
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.CONNECTED, "Identified"));
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.SHARD_READY,
                "Ready with " + session.getGuildCount() + " guilds"));
        completeReady();
    }

    private void handleResumed() {
        session.onResumed();
        session.setStatus(ShardStatus.CONNECTED);
        log.info("[shard={}] Resumed at sequence {}", getShardId(), session.getSequence());
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.CONNECTED, "Resumed"));
        completeReady();
    }

    private void completeReady() {
        Sinks.One<Void> ready = readySink.get();
        if (ready != null) {
            ready.tryEmitEmpty();
        }
    }

    private void handleInvalidSession(GatewayPayload payload) {
        JsonNode data = payload.getData();
        boolean resumable = data != null && data.asBoolean(false);
        if (resumable && session.canResume()) {
            debug("Invalid session, resuming on a new connection");
            reconnect(true, "Invalid session", null);
            return;
        }
        session.resetSession();
        session.setStatus(ShardStatus.IDENTIFYING);
        long pause = ThreadLocalRandom.current().nextLong(1000, 5001);
        debug("Invalid session, identifying again in " + pause + " ms");
        reconnectTask.update(scheduleDelayed(generation.get(), this::identify, pause));
    }

    // Outbound

    private void identify() {
        int gen = generation.get();
        session.resetSession();
        session.setStatus(ShardStatus.IDENTIFYING);
        log.debug("[shard={}] Waiting for identify grant in bucket {}", getShardId(), session.getBucketId());
        identifyWait.update(identifyLimiter.acquireIdentify(getShardId(), maxConcurrency)
                .then(rateLimiter.acquire())
                .subscribe(null,
                        error -> execute(gen, () -> onGrantError(error)),
                        () -> execute(gen, () -> {
                            if (trySend(identifyPayload())) {
                                log.info("[shard={}] Identifying", getShardId());
                            }
                        })));
    }

    private void resume() {
        int gen = generation.get();
        session.setStatus(ShardStatus.RESUMING);
        identifyWait.update(rateLimiter.acquire()
                .subscribe(null,
                        error -> execute(gen, () -> onGrantError(error)),
                        () -> execute(gen, () -> {
                            if (trySend(resumePayload())) {
                                log.info("[shard={}] Resuming session at sequence {}", getShardId(),
                                        session.getSequence());
                            }
                        })));
    }

    private void onGrantError(Throwable error) {
        warn("Unable to obtain a rate limit grant: " + error.getMessage(), error);
        reconnect(false, "Rate limit grant failed", error);
    }

    GatewayPayload identifyPayload() {
        ObjectNode data = nodes.objectNode();
        data.put("token", options.getToken());
        ObjectNode properties = data.putObject("properties");
        properties.put("os", options.getOs());
        properties.put("browser", options.getBrowser());
        properties.put("device", options.getDevice());
        data.put("compress", false);
        data.put("large_threshold", session.getLargeThreshold());
        ArrayNode shard = data.putArray("shard");
        shard.add(getShardId());
        shard.add(session.getNumShards());
        data.put("intents", options.getIntents());
        if (options.getInitialPresence() != null) {
            data.set("presence", options.getInitialPresence());
        }
        return GatewayPayload.outbound(Opcode.IDENTIFY, data);
    }

    GatewayPayload resumePayload() {
        ObjectNode data = nodes.objectNode();
        data.put("token", options.getToken());
        data.put("session_id", session.getSessionId());
        Integer sequence = session.getSequence();
        if (sequence == null) {
            data.putNull("seq");
        } else {
            data.put("seq", sequence);
        }
        return GatewayPayload.outbound(Opcode.RESUME, data);
    }

    // Heartbeat

    private void startHeartbeat(long interval) {
        int gen = generation.get();
        heartbeatInterval = interval;
        lastHeartbeatSent = -1;
        session.setHeartbeatAcked(true);
        long firstDelay = (long) (interval * ThreadLocalRandom.current().nextDouble());
        log.debug("[shard={}] Heartbeating every {} ms, first in {} ms", getShardId(), interval, firstDelay);
        try {
            heartbeatTask.update(worker.schedulePeriodically(() -> runIfCurrent(gen, this::heartbeatTick),
                    firstDelay, interval, TimeUnit.MILLISECONDS));
        } catch (RejectedExecutionException e) {
            log.debug("[shard={}] Heartbeat not scheduled after shutdown", getShardId());
        }
    }

    private void stopHeartbeat() {
        heartbeatTask.update(Disposables.disposed());
        ackTimeout.update(Disposables.disposed());
    }

    private void heartbeatTick() {
        if (lastHeartbeatSent >= 0 && !session.isHeartbeatAcked()) {
            warn("Previous heartbeat was never acknowledged, connection is a zombie", null);
            reconnect(false, "Zombie connection", null);
            return;
        }
        sendHeartbeat();
    }

    private void sendHeartbeat() {
        int gen = generation.get();
        rateLimiter.acquire().takeUntilOther(destroySignal.asMono()).subscribe(null,
                error -> log.warn("[shard={}] Heartbeat not sent: {}", getShardId(), error.toString()),
                () -> execute(gen, () -> {
                    Integer sequence = session.getSequence();
                    JsonNode data = sequence == null ? nodes.nullNode() : nodes.numberNode(sequence);
                    if (trySend(GatewayPayload.outbound(Opcode.HEARTBEAT, data))) {
                        long sentAt = now();
                        lastHeartbeatSent = sentAt;
                        session.setHeartbeatAcked(false);
                        ackTimeout.update(scheduleDelayed(gen, () -> checkHeartbeatAck(sentAt), ackWindow()));
                    }
                }));
    }

    private long ackWindow() {
        Duration window = options.getHeartbeatAckWindow();
        return window != null ? window.toMillis() : heartbeatInterval;
    }

    private void checkHeartbeatAck(long sentAt) {
        if (!session.isHeartbeatAcked() && lastHeartbeatSent == sentAt) {
            warn("Heartbeat not acknowledged within " + ackWindow() + " ms, connection is a zombie", null);
            reconnect(false, "Zombie connection", null);
        }
    }

    private void handleHeartbeatAck() {
        session.setHeartbeatAcked(true);
        ackTimeout.update(Disposables.disposed());
        if (lastHeartbeatSent >= 0) {
            session.setLatency(Duration.ofMillis(now() - lastHeartbeatSent));
        }
    }

    // Plumbing

    private void sendNow(GatewayPayload payload) {
        byte[] bytes = codec.encode(payload);
        if (bytes.length > options.getMaxPayloadSize()) {
            throw new PayloadCodecException("Payload of " + bytes.length + " bytes exceeds the maximum of "
                    + options.getMaxPayloadSize());
        }
        transport.send(bytes, codec.isBinary());
        logPayload(senderLog, payload);
    }

    private boolean trySend(GatewayPayload payload) {
        try {
            sendNow(payload);
            return true;
        } catch (ShardGatewayException e) {
            log.warn("[shard={}] Unable to send {}: {}", getShardId(), payload.getOpcode(), e.getMessage());
            return false;
        }
    }

    private void logPayload(Logger logger, GatewayPayload payload) {
        if (logger.isTraceEnabled()) {
            logger.trace("[shard={}] {}", getShardId(),
                    payload.toString().replaceAll("(\"token\": ?\")([A-Za-z0-9._-]*)(\")", "$1hunter2$3"));
        }
    }

    private void debug(String message) {
        log.debug("[shard={}] {}", getShardId(), message);
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.DEBUG, message));
    }

    private void warn(String message, @Nullable Throwable cause) {
        log.warn("[shard={}] {}", getShardId(), message);
        events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.WARN, message, cause, null));
    }

    private long now() {
        return scheduler.now(TimeUnit.MILLISECONDS);
    }

    private boolean schedule(Runnable task) {
        try {
            worker.schedule(task);
            return true;
        } catch (RejectedExecutionException e) {
            log.debug("[shard={}] Task rejected after shutdown", getShardId());
            return false;
        }
    }

    private void execute(int gen, Runnable task) {
        schedule(() -> runIfCurrent(gen, task));
    }

    private Disposable scheduleDelayed(int gen, Runnable task, long delayMillis) {
        try {
            return worker.schedule(() -> runIfCurrent(gen, task), delayMillis, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[shard={}] Timer rejected after shutdown", getShardId());
            return Disposables.disposed();
        }
    }

    private void runIfCurrent(int gen, Runnable task) {
        if (gen != generation.get() || destroyed.get()) {
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("[shard={}] Unexpected error", getShardId(), e);
            events.publish(new LifecycleEvent(getShardId(), LifecycleEvent.Type.ERROR,
                    "Unexpected error: " + e.getMessage(), e, null));
        }
    }

    private class ConnectionListener implements TransportListener {

        private final int gen;

        ConnectionListener(int gen) {
            this.gen = gen;
        }

        @Override
        public void onFrame(byte[] data, boolean binary) {
            execute(gen, () -> handleFrame(data, binary));
        }

        @Override
        public void onClose(CloseStatus status) {
            execute(gen, () -> handleClose(status));
        }

        @Override
        public void onError(Throwable error) {
            execute(gen, () -> warn("Transport error: " + error.getMessage(), error));
        }

        @Override
        public void onHighLatency(Duration latency) {
            execute(gen, () -> warn("High latency: " + latency.toMillis() + " ms", null));
        }
    }
}
