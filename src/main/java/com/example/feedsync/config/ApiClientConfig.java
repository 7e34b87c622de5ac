package com.example.feedsync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * REST clients for the two outbound collaborators. Every outbound call carries
 * explicit connect and read timeouts; a timeout surfaces as a
 * {@link org.springframework.web.client.ResourceAccessException} which the
 * clients translate into a retryable failure.
 */
@Configuration
public class ApiClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApiClientConfig.class);

    @Bean
    @Qualifier("hubRestTemplate")
    public RestTemplate hubRestTemplate(RestTemplateBuilder builder,
                                        @Value("${app.hub.connect-timeout:10s}") Duration connectTimeout,
                                        @Value("${app.hub.read-timeout:30s}") Duration readTimeout) {
        logger.info("Initializing hubRestTemplate (connect={}, read={})", connectTimeout, readTimeout);
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors(loggingInterceptor("Hub"))
                .build();
    }

    @Bean
    @Qualifier("metadataRestTemplate")
    public RestTemplate metadataRestTemplate(RestTemplateBuilder builder,
                                             @Value("${app.metadata.base-url}") String baseUrl,
                                             @Value("${app.metadata.connect-timeout:5s}") Duration connectTimeout,
                                             @Value("${app.metadata.read-timeout:15s}") Duration readTimeout) {
        logger.info("Initializing metadataRestTemplate for {} (connect={}, read={})", baseUrl, connectTimeout, readTimeout);
        return builder
                .rootUri(baseUrl)
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .additionalInterceptors(loggingInterceptor("Metadata"))
                .build();
    }

    private ClientHttpRequestInterceptor loggingInterceptor(String target) {
        return (request, body, execution) -> {
            logger.debug("{} request: {} {}", target, request.getMethod(), request.getURI());
            var response = execution.execute(request, body);
            logger.debug("{} response status: {}", target, response.getStatusCode());
            return response;
        };
    }
}
