package dev.pekelund.ezexpense.scoring;

import dev.pekelund.ezexpense.reconciliation.ConfidenceScorer;
import dev.pekelund.ezexpense.reconciliation.ReceiptMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(ScoringProperties.class)
public class ScoringConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public ConfidenceScorer confidenceScorer(RestClient.Builder restClientBuilder, ScoringProperties properties) {
        if (!properties.isConfigured()) {
            log.warn("scoring.base-url is not set; receipt confidences will stay unknown");
            return new DisabledConfidenceScorer();
        }
        return new RemoteConfidenceScorer(buildRestClient(restClientBuilder, properties), properties);
    }

    @Bean
    @ConditionalOnProperty(value = "reconciliation.matching.mode", havingValue = "remote")
    public ReceiptMatcher bulkMatchingClient(RestClient.Builder restClientBuilder, ScoringProperties properties) {
        if (!properties.isConfigured()) {
            throw new IllegalStateException(
                "reconciliation.matching.mode=remote requires scoring.base-url to be configured");
        }
        log.info("Bulk matching is delegated to {}{}", properties.getBaseUrl(), properties.getBulkMatchPath());
        return new BulkMatchingClient(buildRestClient(restClientBuilder, properties), properties);
    }

    private static RestClient buildRestClient(RestClient.Builder restClientBuilder, ScoringProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        return restClientBuilder
            .requestFactory(requestFactory)
            .build();
    }
}
