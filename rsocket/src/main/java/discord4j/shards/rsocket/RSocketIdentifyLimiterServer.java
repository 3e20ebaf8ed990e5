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

package discord4j.shards.rsocket;

import discord4j.shards.common.limiter.GatewayRateLimiter;
import io.rsocket.Payload;
import io.rsocket.RSocket;
import io.rsocket.core.RSocketServer;
import io.rsocket.transport.netty.server.CloseableChannel;
import io.rsocket.transport.netty.server.TcpServerTransport;
import io.rsocket.util.DefaultPayload;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;

import java.net.InetSocketAddress;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Serves identify grants to {@link RSocketIdentifyLimiter} clients, serializing them per concurrency bucket with a
 * local {@link GatewayRateLimiter}.
 * <p>
 * Requests are {@code identify:<shardId>:<maxConcurrency>} and answered with {@code identify.success} once granted.
 * {@code request.pending} answers the number of identifies waiting across all clients.
 */
public class RSocketIdentifyLimiterServer {

    private static final Logger log = Loggers.getLogger(RSocketIdentifyLimiterServer.class);

    static final String IDENTIFY_PREFIX = "identify:";
    static final String IDENTIFY_SUCCESS = "identify.success";
    static final String REQUEST_PENDING = "request.pending";

    private final TcpServerTransport serverTransport;
    private final GatewayRateLimiter limiter;
    private final AtomicInteger pending = new AtomicInteger();

    public RSocketIdentifyLimiterServer(InetSocketAddress socketAddress) {
        this(socketAddress, new GatewayRateLimiter());
    }

    public RSocketIdentifyLimiterServer(InetSocketAddress socketAddress, GatewayRateLimiter limiter) {
        this.serverTransport = TcpServerTransport.create(socketAddress);
        this.limiter = limiter;
    }

    public Mono<CloseableChannel> start() {
        return RSocketServer.create((setup, sendingSocket) -> Mono.just(socketAcceptor()))
                .bind(serverTransport)
                .doOnNext(channel -> log.info("Identify limiter server listening on {}", channel.address()));
    }

    public GatewayRateLimiter getLimiter() {
        return limiter;
    }

    private RSocket socketAcceptor() {
        return new RSocket() {

            @Override
            public Mono<Payload> requestResponse(Payload payload) {
                String value = payload.getDataUtf8();
                payload.release();
                log.debug("[request_response] >: {}", value);
                if (value.startsWith(IDENTIFY_PREFIX)) {
                    String[] tokens = value.substring(IDENTIFY_PREFIX.length()).split(":");
                    int shardId;
                    int maxConcurrency;
                    try {
                        shardId = Integer.parseInt(tokens[0]);
                        maxConcurrency = tokens.length > 1 ? Integer.parseInt(tokens[1]) : 1;
                    } catch (NumberFormatException e) {
                        return Mono.error(new IllegalArgumentException("Malformed identify request: " + value));
                    }
                    return limiter.acquireIdentify(shardId, maxConcurrency)
                            .doOnSubscribe(s -> pending.incrementAndGet())
                            .doFinally(signal -> pending.decrementAndGet())
                            .then(Mono.fromCallable(() -> DefaultPayload.create(IDENTIFY_SUCCESS)));
                } else if (value.equals(REQUEST_PENDING)) {
                    return Mono.fromCallable(pending::get).map(count -> DefaultPayload.create(String.valueOf(count)));
                }
                return Mono.error(new IllegalArgumentException("Unknown request: " + value));
            }
        };
    }
}
