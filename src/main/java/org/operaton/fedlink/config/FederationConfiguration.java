package org.operaton.fedlink.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.observation.ObservationRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.io.HttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.operaton.fedlink.loader.CachingDocumentLoader;
import org.operaton.fedlink.loader.DocumentLoader;
import org.operaton.fedlink.loader.HttpDocumentLoader;
import org.operaton.fedlink.loader.UrlValidator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Beans shared by the loader, the resolver and the delivery transport.
 */
@Configuration
@Slf4j
public class FederationConfiguration {

    /**
     * REST template for making HTTP requests to remote ActivityPub servers.
     * Redirects are not followed by the client: the document loader follows them
     * itself so that every hop is validated, and deliveries must not be redirected.
     */
    @Bean
    public RestTemplate restTemplate(@Value("${fedlink.loader.timeout-seconds:10}") long timeoutSeconds) {
        Timeout timeout = Timeout.ofSeconds(timeoutSeconds);
        HttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build())
            .build();

        HttpClient httpClient = HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(timeout)
                .build())
            .disableRedirectHandling()
            .build();

        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(httpClient));
    }

    @Bean
    public UrlValidator urlValidator(@Value("${fedlink.loader.allow-private-ips:false}") boolean allowPrivateIps) {
        if (allowPrivateIps) {
            log.warn("Fetching documents from private and loopback addresses is allowed");
        }
        return new UrlValidator(allowPrivateIps);
    }

    /**
     * The process-wide default document loader: HTTP with a TTL cache in front.
     */
    @Bean
    public DocumentLoader documentLoader(RestTemplate restTemplate, ObjectMapper objectMapper,
                                         UrlValidator urlValidator, Clock clock,
                                         @Value("${fedlink.loader.user-agent:Fedlink/0.1}") String userAgent,
                                         @Value("${fedlink.loader.cache-ttl-seconds:3600}") long cacheTtlSeconds,
                                         @Value("${fedlink.loader.cache-max-size:10000}") long cacheMaxSize) {
        HttpDocumentLoader httpLoader = new HttpDocumentLoader(restTemplate, objectMapper, urlValidator, userAgent);
        return new CachingDocumentLoader(httpLoader, Duration.ofSeconds(cacheTtlSeconds), cacheMaxSize, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ObservationRegistry observationRegistry() {
        return ObservationRegistry.create();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
