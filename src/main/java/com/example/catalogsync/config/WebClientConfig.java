package com.example.catalogsync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient used to read the open-data portal.
 */
@Configuration
public class WebClientConfig {

    /** Maximum in-memory buffer size for responses (32 MB, law texts are large) */
    private static final int MAX_IN_MEMORY_SIZE_BYTES = 32 * 1024 * 1024;

    /** Max connection pool size */
    private static final int MAX_CONNECTIONS = 10;

    /** Pending acquire timeout in seconds */
    private static final int PENDING_ACQUIRE_TIMEOUT_SECONDS = 60;

    /** Max idle time for connections in seconds */
    private static final int MAX_IDLE_TIME_SECONDS = 30;

    /**
     * WebClient.Builder with the portal timeouts, a small connection pool and keep-alive.
     *
     * @param sourceConfig portal settings providing connect and read timeouts
     * @return WebClient.Builder configured with custom HTTP client settings
     */
    @Bean
    public WebClient.Builder webClientBuilder(SourceApiConfig sourceConfig) {
        ConnectionProvider connectionProvider = ConnectionProvider.builder("ods-connection-pool")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(Duration.ofSeconds(PENDING_ACQUIRE_TIMEOUT_SECONDS))
                .maxIdleTime(Duration.ofSeconds(MAX_IDLE_TIME_SECONDS))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, sourceConfig.getConnectionTimeout())
                .option(ChannelOption.SO_KEEPALIVE, true)
                .responseTimeout(Duration.ofMillis(sourceConfig.getReadTimeout()))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(sourceConfig.getReadTimeout(), TimeUnit.MILLISECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(sourceConfig.getReadTimeout(), TimeUnit.MILLISECONDS)));

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE_BYTES))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies);
    }
}
