package discord4j.shards.examples;

import discord4j.shards.rsocket.RSocketIdentifyLimiterServer;
import reactor.util.Logger;
import reactor.util.Loggers;

import java.net.InetSocketAddress;

public class ExampleIdentifyLimiterServer {

    private static final Logger log = Loggers.getLogger(ExampleIdentifyLimiterServer.class);

    public static void main(String[] args) {
        new RSocketIdentifyLimiterServer(new InetSocketAddress(Constants.IDENTIFY_SERVER_PORT))
                .start()
                .doOnNext(cc -> log.info("Started identify limiter server at {}", cc.address()))
                .blockOptional()
                .orElseThrow(RuntimeException::new)
                .onClose()
                .block();
    }
}
