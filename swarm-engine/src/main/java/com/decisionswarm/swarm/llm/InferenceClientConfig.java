package com.decisionswarm.swarm.llm;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

@Configuration
public class InferenceClientConfig {

    private static final Logger log = LoggerFactory.getLogger(InferenceClientConfig.class);

    /** Largest swarm size; the pool must never serialize a full stage fan-out. */
    static final int MIN_CONNECTIONS = 6;

    @Bean
    public ConnectionProvider inferenceConnectionProvider(InferenceProperties properties) {
        int maxConnections = Math.max(MIN_CONNECTIONS, properties.getMaxConnections());
        log.info("[Inference] connection pool maxConnections={} regions={}",
            maxConnections, properties.getRegions().keySet());
        return ConnectionProvider.builder("swarm-inference")
            .maxConnections(maxConnections)
            .pendingAcquireTimeout(Duration.ofSeconds(10))
            .build();
    }

    @Bean
    public WebClient inferenceWebClient(WebClient.Builder builder,
                                        ConnectionProvider inferenceConnectionProvider,
                                        InferenceProperties properties) {
        HttpClient httpClient = HttpClient.create(inferenceConnectionProvider)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) properties.getConnectTimeout().toMillis());

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .filter(loggingFilter())
            .build();
    }

    private ExchangeFilterFunction loggingFilter() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            boolean keyed = clientRequest.headers().containsKey(HttpInferenceClient.API_KEY_HEADER);
            log.debug("Outbound inference request: {} {} apiKey={}",
                clientRequest.method(), clientRequest.url(), keyed ? "***" : "none");
            return Mono.just(clientRequest);
        });
    }
}
