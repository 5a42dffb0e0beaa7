package dev.pekelund.ezexpense.categories;

import dev.pekelund.ezexpense.reconciliation.CategoryCatalog;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(CategoryProperties.class)
public class CategoryConfig {

    private static final Logger log = LoggerFactory.getLogger(CategoryConfig.class);

    @Bean
    public CategoryCatalog categoryCatalog(RestClient.Builder restClientBuilder, CategoryProperties properties) {
        if (!properties.isConfigured()) {
            List<String> fallback = List.copyOf(properties.getFallback());
            log.info("categories.base-url is not set; validating against {} configured categories", fallback.size());
            return () -> fallback;
        }
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());
        RestClient restClient = restClientBuilder
            .requestFactory(requestFactory)
            .build();
        return new RemoteCategoryCatalog(restClient, properties);
    }
}
