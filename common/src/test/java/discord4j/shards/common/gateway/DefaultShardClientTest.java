package discord4j.shards.common.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import discord4j.shards.common.codec.Opcode;
import discord4j.shards.common.codec.PayloadCodecException;
import discord4j.shards.common.compression.CompressionMode;
import discord4j.shards.common.event.DispatchEvent;
import discord4j.shards.common.event.GatewayEvent;
import discord4j.shards.common.event.GatewayEventSink;
import discord4j.shards.common.event.LifecycleEvent;
import discord4j.shards.common.limiter.GatewayRateLimiter;
import discord4j.shards.common.limiter.LimiterAbortedException;
import discord4j.shards.common.limiter.RateLimiterOptions;
import discord4j.shards.common.retry.ReconnectOptions;
import discord4j.shards.common.transport.GatewayTransportException;
import com.github.luben.zstd.Zstd;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.Deflater;

import static org.junit.Assert.*;

public class DefaultShardClientTest {

    private static final String HELLO = "{\"op\":10,\"d\":{\"heartbeat_interval\":45000},\"s\":null,\"t\":null}";
    private static final String READY = "{\"op\":0,\"s\":1,\"t\":\"READY\",\"d\":{\"session_id\":\"abc\"," +
            "\"resume_gateway_url\":\"wss://resume.example\",\"guilds\":[{\"id\":\"10\"},{\"id\":\"20\"}]}}";

    private VirtualTimeScheduler scheduler;
    private ScriptedTransport transport;
    private GatewayRateLimiter limiter;
    private GatewayEventSink events;
    private List<GatewayEvent> received;
    private DefaultShardClient client;

    @Before
    public void setUp() {
        scheduler = VirtualTimeScheduler.create();
        transport = new ScriptedTransport();
        limiter = new GatewayRateLimiter(RateLimiterOptions.builder().setScheduler(scheduler).build());
        events = new GatewayEventSink();
        received = new CopyOnWriteArrayList<>();
        events.asFlux().subscribe(received::add);
    }

    @After
    public void tearDown() {
        if (client != null) {
            client.destroy();
        }
        limiter.destroy();
        scheduler.dispose();
    }

    private GatewayOptions.Builder options() {
        return GatewayOptions.builder("secret-token")
                .setScheduler(scheduler)
                .setRateLimiter(limiter)
                .setTransportFactory(shardId -> transport)
                .setReconnectOptions(ReconnectOptions.builder()
                        .setFirstBackoff(Duration.ofSeconds(1))
                        .setJitterFactor(0)
                        .setMaxRetries(2)
                        .setBackoffScheduler(scheduler)
                        .build());
    }

    private AtomicBoolean connect(GatewayOptions options) {
        client = new DefaultShardClient(options, 1, 4, 1, events);
        AtomicBoolean ready = new AtomicBoolean();
        client.connect().subscribe(null, null, () -> ready.set(true));
        return ready;
    }

    @Test
    public void identifyAfterHelloAndBecomeReady() {
        AtomicBoolean ready = connect(options().build());

        assertEquals("wss://gateway.discord.gg/?v=10&encoding=json", transport.urls.get(0));
        assertEquals(ShardStatus.CONNECTING, client.getSession().getStatus());

        transport.receive(HELLO);

        List<JsonNode> identifies = transport.sentWithOp(2);
        assertEquals(1, identifies.size());
        JsonNode identify = identifies.get(0).get("d");
        assertEquals("secret-token", identify.get("token").asText());
        assertEquals(1, identify.get("shard").get(0).intValue());
        assertEquals(4, identify.get("shard").get(1).intValue());
        assertEquals(ShardStatus.IDENTIFYING, client.getSession().getStatus());
        assertFalse(ready.get());

        transport.receive(READY);

        assertTrue(ready.get());
        assertTrue(client.isConnected());
        ShardInfo info = client.getInfo();
        assertEquals("abc", info.getSessionId());
        assertEquals(Integer.valueOf(1), info.getSequence());
        assertEquals(2, info.getGuildCount());
        assertTrue(received.stream().anyMatch(e -> e instanceof DispatchEvent
                && "READY".equals(((DispatchEvent) e).getEventName())));
        assertTrue(received.stream().anyMatch(e -> e instanceof LifecycleEvent
                && ((LifecycleEvent) e).getType() == LifecycleEvent.Type.SHARD_READY));
    }

    @Test
    public void trackSequenceAndGuilds() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        transport.receive("{\"op\":0,\"s\":5,\"t\":\"GUILD_CREATE\",\"d\":{\"id\":\"30\"}}");
        transport.receive("{\"op\":0,\"s\":3,\"t\":\"GUILD_DELETE\",\"d\":{\"id\":\"10\"}}");
        transport.receive("{\"op\":0,\"s\":6,\"t\":\"GUILD_DELETE\",\"d\":{\"id\":\"20\",\"unavailable\":true}}");

        assertEquals(Integer.valueOf(6), client.getSession().getSequence());
        assertEquals(2, client.getSession().getGuildCount());
    }

    @Test
    public void heartbeatCarriesSequenceAndMeasuresLatency() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        scheduler.advanceTimeBy(Duration.ofMillis(45000));

        List<JsonNode> heartbeats = transport.sentWithOp(1);
        assertEquals(1, heartbeats.size());
        assertEquals(1, heartbeats.get(0).get("d").intValue());

        scheduler.advanceTimeBy(Duration.ofMillis(120));
        transport.receive("{\"op\":11}");

        assertTrue(client.getSession().isHeartbeatAcked());
        assertTrue(client.getSession().getLatency().toMillis() >= 120);
    }

    @Test
    public void heartbeatRequestIsAnsweredImmediately() {
        connect(options().build());
        transport.receive(HELLO);

        transport.receive("{\"op\":1,\"d\":null}");

        assertEquals(1, transport.sentWithOp(1).size());
    }

    @Test
    public void missingHeartbeatAckReconnectsWithNewSession() {
        connect(options().setHeartbeatAckWindow(Duration.ofSeconds(5)).build());
        transport.receive(HELLO);
        transport.receive(READY);

        scheduler.advanceTimeBy(Duration.ofSeconds(50));

        assertEquals(1000, transport.closes.get(0).getCode());
        assertTrue(received.stream().anyMatch(e -> e instanceof LifecycleEvent
                && ((LifecycleEvent) e).getType() == LifecycleEvent.Type.RECONNECTING));

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertNull(client.getSession().getSessionId());

        assertEquals(2, transport.urls.size());
        assertEquals("wss://gateway.discord.gg/?v=10&encoding=json", transport.urls.get(1));
    }

    @Test
    public void resumeAfterResumableClose() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);
        transport.receive("{\"op\":0,\"s\":5,\"t\":\"MESSAGE_CREATE\",\"d\":{\"id\":\"1\"}}");

        transport.remoteClose(4000);
        assertEquals(ShardStatus.RECONNECTING, client.getSession().getStatus());

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals("wss://resume.example/?v=10&encoding=json", transport.urls.get(1));
        transport.receive(HELLO);

        List<JsonNode> resumes = transport.sentWithOp(6);
        assertEquals(1, resumes.size());
        assertEquals("abc", resumes.get(0).get("d").get("session_id").asText());
        assertEquals(5, resumes.get(0).get("d").get("seq").intValue());
        assertEquals(ShardStatus.RESUMING, client.getSession().getStatus());

        transport.receive("{\"op\":0,\"s\":6,\"t\":\"RESUMED\",\"d\":{}}");

        assertTrue(client.isConnected());
        assertEquals(0, client.getSession().getReconnectAttempts());
        assertEquals(1, transport.sentWithOp(2).size());
    }

    @Test
    public void sessionClosesIdentifyAgain() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        transport.remoteClose(4009);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals("wss://gateway.discord.gg/?v=10&encoding=json", transport.urls.get(1));
        transport.receive(HELLO);
        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertEquals(2, transport.sentWithOp(2).size());
        assertTrue(transport.sentWithOp(6).isEmpty());
    }

    @Test
    public void nonResumableInvalidSessionIdentifiesAgain() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        transport.receive("{\"op\":9,\"d\":false}");

        assertNull(client.getSession().getSessionId());
        assertEquals(1, transport.sentWithOp(2).size());

        scheduler.advanceTimeBy(Duration.ofSeconds(5));

        assertEquals(2, transport.sentWithOp(2).size());
        assertEquals(1, transport.urls.size());
    }

    @Test
    public void resumableInvalidSessionReconnects() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);
        transport.receive("{\"op\":0,\"s\":2,\"t\":\"TYPING_START\",\"d\":{}}");

        transport.receive("{\"op\":9,\"d\":true}");

        assertEquals(4900, transport.closes.get(0).getCode());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        assertEquals("wss://resume.example/?v=10&encoding=json", transport.urls.get(1));
    }

    @Test
    public void fatalCloseStopsShard() {
        connect(options().build());
        AtomicReference<Throwable> error = new AtomicReference<>();
        client.connect().subscribe(null, error::set);
        transport.receive(HELLO);

        transport.remoteClose(4004);
        scheduler.advanceTimeBy(Duration.ofMinutes(1));

        assertTrue(error.get() instanceof GatewayClosedException);
        assertEquals(4004, ((GatewayClosedException) error.get()).getCloseStatus().getCode());
        assertEquals(ShardStatus.DISCONNECTED, client.getSession().getStatus());
        assertEquals(1, transport.urls.size());
    }

    @Test
    public void giveUpAfterMaxReconnects() {
        client = new DefaultShardClient(options().build(), 1, 4, 1, events);
        AtomicReference<Throwable> error = new AtomicReference<>();
        client.connect().subscribe(null, error::set);

        transport.remoteClose(4000);
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        transport.remoteClose(4000);
        scheduler.advanceTimeBy(Duration.ofSeconds(2));
        transport.remoteClose(4000);

        assertTrue(error.get() instanceof ReconnectExhaustedException);
        assertEquals(3, transport.urls.size());
        assertEquals(ShardStatus.DISCONNECTED, client.getSession().getStatus());
    }

    @Test
    public void connectFailureIsRetried() {
        transport.failNextConnect(new GatewayTransportException("refused"));
        AtomicBoolean ready = connect(options().build());

        assertEquals(ShardStatus.RECONNECTING, client.getSession().getStatus());
        scheduler.advanceTimeBy(Duration.ofSeconds(1));
        transport.receive(HELLO);
        transport.receive(READY);

        assertTrue(ready.get());
        assertEquals(2, client.getSession().getConnectAttempts());
    }

    @Test
    public void malformedFrameIsDropped() {
        connect(options().build());
        transport.receive(HELLO);

        transport.receive("{not json");
        transport.receive(READY);

        assertTrue(client.isConnected());
        assertTrue(received.stream().anyMatch(e -> e instanceof LifecycleEvent
                && ((LifecycleEvent) e).getType() == LifecycleEvent.Type.WARN));
    }

    @Test
    public void sendRequiresConnection() {
        connect(options().build());

        AtomicReference<Throwable> error = new AtomicReference<>();
        client.send(GatewayCommand.of(Opcode.PRESENCE_UPDATE, JsonNodeFactory.instance.objectNode()))
                .subscribe(null, error::set);

        assertTrue(error.get() instanceof GatewayTransportException);
    }

    @Test
    public void sendRejectsOversizedPayload() {
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        char[] filler = new char[5000];
        Arrays.fill(filler, 'x');
        ObjectNode data = JsonNodeFactory.instance.objectNode().put("status", new String(filler));
        AtomicReference<Throwable> error = new AtomicReference<>();
        client.send(GatewayCommand.of(Opcode.PRESENCE_UPDATE, data)).subscribe(null, error::set);

        assertTrue(error.get() instanceof PayloadCodecException);

        AtomicBoolean sent = new AtomicBoolean();
        client.send(GatewayCommand.updatePresence(JsonNodeFactory.instance.objectNode().put("status", "idle")))
                .subscribe(null, null, () -> sent.set(true));
        assertTrue(sent.get());
        assertEquals(1, transport.sentWithOp(3).size());
    }

    @Test
    public void inflateZlibStreamFrames() {
        connect(options().setCompression(CompressionMode.ZLIB_STREAM).build());

        assertEquals("wss://gateway.discord.gg/?v=10&encoding=json&compress=zlib-stream", transport.urls.get(0));

        Deflater deflater = new Deflater();
        byte[] hello = deflate(deflater, HELLO);
        transport.receiveBinary(Arrays.copyOfRange(hello, 0, hello.length / 2));
        assertTrue(transport.sentWithOp(2).isEmpty());
        transport.receiveBinary(Arrays.copyOfRange(hello, hello.length / 2, hello.length));
        assertEquals(1, transport.sentWithOp(2).size());

        transport.receiveBinary(deflate(deflater, READY));
        assertTrue(client.isConnected());
        deflater.end();
    }

    @Test
    public void destroyReleasesPendingConnect() {
        AtomicReference<Throwable> error = new AtomicReference<>();
        client = new DefaultShardClient(options().build(), 1, 4, 1, events);
        client.connect().subscribe(null, error::set);

        client.destroy();

        assertTrue(error.get() instanceof LimiterAbortedException);
        assertEquals(ShardStatus.DESTROYED, client.getSession().getStatus());
        assertTrue(transport.isDestroyed());
    }

    @Test
    public void corruptCompressedFrameResetsContextAndReconnects() {
        connect(options().setCompression(CompressionMode.ZLIB_STREAM).build());
        Deflater deflater = new Deflater();
        transport.receiveBinary(deflate(deflater, HELLO));
        transport.receiveBinary(deflate(deflater, READY));
        deflater.end();
        assertTrue(client.isConnected());

        // stored block with mismatching length fields, terminated by the flush suffix
        transport.receiveBinary(new byte[]{0x01, 0x02, 0x03, 0x04, 0x00, 0x00, (byte) 0xff, (byte) 0xff});

        assertEquals(1, transport.closes.size());
        assertEquals(CloseCodes.RESUMABLE_CLOSE, transport.closes.get(0).getCode());
        assertEquals(ShardStatus.RECONNECTING, client.getSession().getStatus());
        assertTrue(received.stream().anyMatch(e -> e instanceof LifecycleEvent
                && ((LifecycleEvent) e).getType() == LifecycleEvent.Type.RECONNECTING));

        scheduler.advanceTimeBy(Duration.ofSeconds(1));

        assertEquals("wss://resume.example/?v=10&encoding=json&compress=zlib-stream", transport.urls.get(1));
        Deflater fresh = new Deflater();
        transport.receiveBinary(deflate(fresh, HELLO));
        assertEquals(1, transport.sentWithOp(6).size());
        transport.receiveBinary(deflate(fresh, "{\"op\":0,\"s\":2,\"t\":\"RESUMED\",\"d\":{}}"));
        fresh.end();
        assertTrue(client.isConnected());
    }

    @Test
    public void destroyWhileFramesAreInflatedOnAnotherThread() throws InterruptedException {
        connect(options().setCompression(CompressionMode.ZSTD_STREAM).build());
        byte[] ack = Zstd.compress("{\"op\":11,\"d\":null}".getBytes(StandardCharsets.UTF_8));
        AtomicReference<Throwable> feederError = new AtomicReference<>();
        CountDownLatch started = new CountDownLatch(1);
        Thread feeder = new Thread(() -> {
            try {
                for (int i = 0; i < 5000; i++) {
                    transport.receiveBinary(ack);
                    started.countDown();
                }
            } catch (Throwable t) {
                feederError.set(t);
            }
        });
        feeder.start();
        assertTrue(started.await(10, TimeUnit.SECONDS));

        client.destroy();
        feeder.join(10000);

        assertNull(feederError.get());
        assertEquals(ShardStatus.DESTROYED, client.getSession().getStatus());
        assertTrue(received.stream().noneMatch(e -> e instanceof LifecycleEvent
                && ((LifecycleEvent) e).getType() == LifecycleEvent.Type.ERROR));
    }

    @Test
    public void destroyCancelsCommandsWaitingForTokens() {
        limiter.destroy();
        limiter = new GatewayRateLimiter(RateLimiterOptions.builder()
                .setCommandCapacity(2)
                .setScheduler(scheduler)
                .build());
        connect(options().build());
        transport.receive(HELLO);
        transport.receive(READY);

        client.send(GatewayCommand.updatePresence(JsonNodeFactory.instance.objectNode().put("status", "idle")))
                .subscribe();
        AtomicReference<Throwable> error = new AtomicReference<>();
        client.send(GatewayCommand.updatePresence(JsonNodeFactory.instance.objectNode().put("status", "dnd")))
                .subscribe(null, error::set);
        assertNull(error.get());

        client.destroy();

        assertTrue(error.get() instanceof GatewayTransportException);
        scheduler.advanceTimeBy(Duration.ofSeconds(61));
        assertEquals(2, limiter.getBucketInfo(GatewayRateLimiter.GLOBAL_BUCKET).getRemaining());
        assertEquals(1, transport.sentWithOp(3).size());
    }

    private static byte[] deflate(Deflater deflater, String message) {
        deflater.setInput(message.getBytes(StandardCharsets.UTF_8));
        byte[] buffer = new byte[4096];
        int length = deflater.deflate(buffer, 0, buffer.length, Deflater.SYNC_FLUSH);
        return Arrays.copyOf(buffer, length);
    }
}
