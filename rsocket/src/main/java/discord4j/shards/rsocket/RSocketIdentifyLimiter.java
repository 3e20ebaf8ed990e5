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

import discord4j.shards.common.limiter.IdentifyLimiter;
import discord4j.shards.common.limiter.LimiterAbortedException;
import discord4j.shards.common.retry.ReconnectOptions;
import io.rsocket.Payload;
import io.rsocket.RSocket;
import io.rsocket.core.RSocketConnector;
import io.rsocket.exceptions.ApplicationErrorException;
import io.rsocket.RSocketErrorException;
import io.rsocket.transport.netty.client.TcpClientTransport;
import io.rsocket.util.DefaultPayload;
import reactor.core.publisher.Mono;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.retry.RetryBackoffSpec;

import java.net.InetSocketAddress;

/**
 * An {@link IdentifyLimiter} asking a remote {@link RSocketIdentifyLimiterServer} for identify grants, so shards
 * spread over several processes share one identify budget.
 * <p>
 * The connection to the server is shared by every shard of this process and re-established with the given
 * {@link ReconnectOptions} when it drops. A grant request interrupted by a lost connection is sent again; a request
 * the server answered with an error is not.
 */
public class RSocketIdentifyLimiter implements IdentifyLimiter {

    private static final Logger log = Loggers.getLogger(RSocketIdentifyLimiter.class);

    private final InetSocketAddress serverAddress;
    private final RetryBackoffSpec retrySpec;
    private final Mono<RSocket> server;

    public RSocketIdentifyLimiter(InetSocketAddress serverAddress) {
        this(serverAddress, ReconnectOptions.create());
    }

    public RSocketIdentifyLimiter(InetSocketAddress serverAddress, ReconnectOptions reconnectOptions) {
        this.serverAddress = serverAddress;
        this.retrySpec = reconnectOptions.toRetrySpec()
                .filter(t -> !(t instanceof RSocketErrorException));
        this.server = RSocketConnector.create()
                .reconnect(retrySpec.doBeforeRetry(signal -> log.debug("Reconnecting to identify server {} " +
                        "(attempt {}): {}", serverAddress, signal.totalRetriesInARow() + 1, signal.failure().toString())))
                .connect(TcpClientTransport.create(serverAddress))
                .doOnSubscribe(s -> log.debug("Connecting to identify server {}", serverAddress));
    }

    @Override
    public Mono<Void> acquireIdentify(int shardId, int maxConcurrency) {
        String request = RSocketIdentifyLimiterServer.IDENTIFY_PREFIX + shardId + ":" + maxConcurrency;
        return server.flatMap(rSocket -> rSocket.requestResponse(DefaultPayload.create(request)))
                .retryWhen(retrySpec.doBeforeRetry(signal -> log.debug("[shard={}] Asking {} again for an identify " +
                        "grant (attempt {}): {}", shardId, serverAddress, signal.totalRetriesInARow() + 1,
                        signal.failure().toString())))
                .doOnNext(payload -> onGrant(shardId, payload))
                .onErrorMap(ApplicationErrorException.class,
                        e -> new LimiterAbortedException("Identify rejected by server: " + e.getMessage()))
                .then();
    }

    private static void onGrant(int shardId, Payload payload) {
        try {
            String response = payload.getDataUtf8();
            if (!RSocketIdentifyLimiterServer.IDENTIFY_SUCCESS.equals(response)) {
                throw new LimiterAbortedException("Unexpected identify response: " + response);
            }
            log.debug("[shard={}] Identify granted", shardId);
        } finally {
            payload.release();
        }
    }
}
