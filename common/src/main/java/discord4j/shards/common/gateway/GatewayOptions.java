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
import com.fasterxml.jackson.databind.ObjectMapper;
import discord4j.shards.common.codec.PayloadEncoding;
import discord4j.shards.common.compression.CompressionMode;
import discord4j.shards.common.limiter.GatewayRateLimiter;
import discord4j.shards.common.limiter.IdentifyLimiter;
import discord4j.shards.common.retry.ReconnectOptions;
import discord4j.shards.common.transport.ReactorNettyGatewayTransport;
import discord4j.shards.common.transport.TransportFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.annotation.Nullable;

import java.time.Duration;
import java.util.Objects;

/**
 * Settings shared by every shard connection. Connection parameters such as encoding and compression are read once
 * per connection.
 */
public class GatewayOptions {

    public static final String DEFAULT_GATEWAY_URL = "wss://gateway.discord.gg";
    public static final int DEFAULT_VERSION = 10;
    public static final int MAX_PAYLOAD_SIZE = 4096;
    public static final int DEFAULT_MAX_CHUNK_SIZE = 4 * 1024 * 1024;

    private final String token;
    private final String gatewayUrl;
    private final int version;
    private final long intents;
    private final int largeThreshold;
    private final String os;
    private final String browser;
    private final String device;
    @Nullable
    private final JsonNode initialPresence;
    private final PayloadEncoding encoding;
    private final CompressionMode compression;
    private final ObjectMapper objectMapper;
    private final int maxPayloadSize;
    private final int maxChunkSize;
    @Nullable
    private final Duration heartbeatAckWindow;
    private final Duration highLatencyThreshold;
    private final Duration pingInterval;
    private final ReconnectOptions reconnectOptions;
    private final GatewayRateLimiter rateLimiter;
    private final IdentifyLimiter identifyLimiter;
    private final TransportFactory transportFactory;
    private final Scheduler scheduler;

    protected GatewayOptions(Builder builder) {
        this.token = Objects.requireNonNull(builder.token, "token");
        this.gatewayUrl = builder.gatewayUrl;
        this.version = builder.version;
        this.intents = builder.intents;
        this.largeThreshold = builder.largeThreshold;
        this.os = builder.os;
        this.browser = builder.browser;
        this.device = builder.device;
        this.initialPresence = builder.initialPresence;
        this.encoding = builder.encoding;
        this.compression = builder.compression;
        this.objectMapper = builder.objectMapper;
        this.maxPayloadSize = builder.maxPayloadSize;
        this.maxChunkSize = builder.maxChunkSize;
        this.heartbeatAckWindow = builder.heartbeatAckWindow;
        this.highLatencyThreshold = builder.highLatencyThreshold;
        this.pingInterval = builder.pingInterval;
        this.reconnectOptions = builder.reconnectOptions;
        this.rateLimiter = builder.rateLimiter != null ? builder.rateLimiter : new GatewayRateLimiter();
        this.identifyLimiter = builder.identifyLimiter != null ? builder.identifyLimiter : this.rateLimiter;
        this.transportFactory = builder.transportFactory != null ? builder.transportFactory :
                shardId -> new ReactorNettyGatewayTransport(shardId, maxChunkSize, pingInterval,
                        highLatencyThreshold);
        this.scheduler = builder.scheduler;
    }

    public static Builder builder(String token) {
        return new Builder(token);
    }

    public String getToken() {
        return token;
    }

    public String getGatewayUrl() {
        return gatewayUrl;
    }

    public int getVersion() {
        return version;
    }

    public long getIntents() {
        return intents;
    }

    public int getLargeThreshold() {
        return largeThreshold;
    }

    public String getOs() {
        return os;
    }

    public String getBrowser() {
        return browser;
    }

    public String getDevice() {
        return device;
    }

    @Nullable
    public JsonNode getInitialPresence() {
        return initialPresence;
    }

    public PayloadEncoding getEncoding() {
        return encoding;
    }

    public CompressionMode getCompression() {
        return compression;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public int getMaxPayloadSize() {
        return maxPayloadSize;
    }

    public int getMaxChunkSize() {
        return maxChunkSize;
    }

    /**
     * Return the time a heartbeat may stay unacknowledged, or {@code null} to use the heartbeat interval.
     *
     * @return the acknowledgment window
     */
    @Nullable
    public Duration getHeartbeatAckWindow() {
        return heartbeatAckWindow;
    }

    public Duration getHighLatencyThreshold() {
        return highLatencyThreshold;
    }

    public Duration getPingInterval() {
        return pingInterval;
    }

    public ReconnectOptions getReconnectOptions() {
        return reconnectOptions;
    }

    public GatewayRateLimiter getRateLimiter() {
        return rateLimiter;
    }

    public IdentifyLimiter getIdentifyLimiter() {
        return identifyLimiter;
    }

    public TransportFactory getTransportFactory() {
        return transportFactory;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public static class Builder {

        private final String token;
        private String gatewayUrl = DEFAULT_GATEWAY_URL;
        private int version = DEFAULT_VERSION;
        private long intents;
        private int largeThreshold = 50;
        private String os = System.getProperty("os.name");
        private String browser = "discord4j-shards";
        private String device = "discord4j-shards";
        @Nullable
        private JsonNode initialPresence;
        private PayloadEncoding encoding = PayloadEncoding.JSON;
        private CompressionMode compression = CompressionMode.NONE;
        private ObjectMapper objectMapper = new ObjectMapper();
        private int maxPayloadSize = MAX_PAYLOAD_SIZE;
        private int maxChunkSize = DEFAULT_MAX_CHUNK_SIZE;
        @Nullable
        private Duration heartbeatAckWindow;
        private Duration highLatencyThreshold = Duration.ofSeconds(1);
        private Duration pingInterval = Duration.ofSeconds(30);
        private ReconnectOptions reconnectOptions = ReconnectOptions.create();
        @Nullable
        private GatewayRateLimiter rateLimiter;
        @Nullable
        private IdentifyLimiter identifyLimiter;
        @Nullable
        private TransportFactory transportFactory;
        private Scheduler scheduler = Schedulers.parallel();

        protected Builder(String token) {
            this.token = Objects.requireNonNull(token, "token");
        }

        public Builder setGatewayUrl(String gatewayUrl) {
            this.gatewayUrl = Objects.requireNonNull(gatewayUrl);
            return this;
        }

        public Builder setVersion(int version) {
            this.version = version;
            return this;
        }

        public Builder setIntents(long intents) {
            this.intents = intents;
            return this;
        }

        /**
         * Set the member count above which a guild is sent without its offline members.
         *
         * @param largeThreshold a value between 50 and 250
         * @return this builder
         */
        public Builder setLargeThreshold(int largeThreshold) {
            if (largeThreshold < 50 || largeThreshold > 250) {
                throw new IllegalArgumentException("largeThreshold must be between 50 and 250");
            }
            this.largeThreshold = largeThreshold;
            return this;
        }

        public Builder setIdentifyProperties(String os, String browser, String device) {
            this.os = Objects.requireNonNull(os);
            this.browser = Objects.requireNonNull(browser);
            this.device = Objects.requireNonNull(device);
            return this;
        }

        public Builder setInitialPresence(@Nullable JsonNode initialPresence) {
            this.initialPresence = initialPresence;
            return this;
        }

        public Builder setEncoding(PayloadEncoding encoding) {
            this.encoding = Objects.requireNonNull(encoding);
            return this;
        }

        public Builder setCompression(CompressionMode compression) {
            this.compression = Objects.requireNonNull(compression);
            return this;
        }

        public Builder setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = Objects.requireNonNull(objectMapper);
            return this;
        }

        public Builder setMaxPayloadSize(int maxPayloadSize) {
            this.maxPayloadSize = maxPayloadSize;
            return this;
        }

        public Builder setMaxChunkSize(int maxChunkSize) {
            this.maxChunkSize = maxChunkSize;
            return this;
        }

        public Builder setHeartbeatAckWindow(@Nullable Duration heartbeatAckWindow) {
            this.heartbeatAckWindow = heartbeatAckWindow;
            return this;
        }

        public Builder setHighLatencyThreshold(Duration highLatencyThreshold) {
            this.highLatencyThreshold = Objects.requireNonNull(highLatencyThreshold);
            return this;
        }

        public Builder setPingInterval(Duration pingInterval) {
            this.pingInterval = Objects.requireNonNull(pingInterval);
            return this;
        }

        public Builder setReconnectOptions(ReconnectOptions reconnectOptions) {
            this.reconnectOptions = Objects.requireNonNull(reconnectOptions);
            return this;
        }

        /**
         * Set the limiter every shard built from these options shares. Defaults to a new limiter with default
         * budgets.
         *
         * @param rateLimiter the process-wide limiter
         * @return this builder
         */
        public Builder setRateLimiter(GatewayRateLimiter rateLimiter) {
            this.rateLimiter = Objects.requireNonNull(rateLimiter);
            return this;
        }

        /**
         * Set a limiter granting identifies, for instance one coordinating several processes. Defaults to the
         * {@link #setRateLimiter(GatewayRateLimiter) rate limiter}.
         *
         * @param identifyLimiter the identify limiter
         * @return this builder
         */
        public Builder setIdentifyLimiter(@Nullable IdentifyLimiter identifyLimiter) {
            this.identifyLimiter = identifyLimiter;
            return this;
        }

        public Builder setTransportFactory(@Nullable TransportFactory transportFactory) {
            this.transportFactory = transportFactory;
            return this;
        }

        public Builder setScheduler(Scheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler);
            return this;
        }

        public GatewayOptions build() {
            return new GatewayOptions(this);
        }
    }
}
