package com.example.boundary.config;

import com.example.boundary.config.properties.AnalyticsApiProperties;
import com.example.boundary.config.properties.ContextStoreProperties;
import io.netty.channel.ChannelOption;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;

import java.time.Duration;

/**
 * WebClient configuration for the context store and the external analytical service.
 *
 * Each client gets its own connection pool so a slow analytics service cannot starve
 * context reads.
 */
@Configuration
public class WebClientConfig {

    /**
     * Bean qualifier for the context store WebClient.
     */
    public static final String CONTEXT_STORE_WEBCLIENT = "contextStoreWebClient";

    /**
     * Bean qualifier for the analytical service WebClient.
     */
    public static final String ANALYTICS_WEBCLIENT = "analyticsWebClient";

    @Bean
    @Qualifier(CONTEXT_STORE_WEBCLIENT)
    public WebClient contextStoreWebClient(
            WebClient.Builder webClientBuilder,
            ContextStoreProperties properties) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("context-store-pool")
                .maxConnections(50)
                .pendingAcquireMaxCount(250)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(properties.timeout())
                .keepAlive(true);

        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(properties.baseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    @Qualifier(ANALYTICS_WEBCLIENT)
    public WebClient analyticsWebClient(
            WebClient.Builder webClientBuilder,
            AnalyticsApiProperties properties) {

        ConnectionProvider connectionProvider = ConnectionProvider.builder("analytics-pool")
                .maxConnections(20)
                .pendingAcquireMaxCount(100)
                .pendingAcquireTimeout(Duration.ofSeconds(10))
                .maxIdleTime(Duration.ofSeconds(30))
                .maxLifeTime(Duration.ofMinutes(5))
                .evictInBackground(Duration.ofSeconds(30))
                .build();

        HttpClient httpClient = HttpClient.create(connectionProvider)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(properties.timeout())
                .keepAlive(true);

        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(properties.baseUrl())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
