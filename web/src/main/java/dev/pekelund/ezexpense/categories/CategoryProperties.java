package dev.pekelund.ezexpense.categories;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "categories")
public class CategoryProperties {

    /**
     * Base URL of the service publishing the valid expense categories. The fallback list is used when empty.
     */
    private String baseUrl;

    /**
     * Path returning {@code {"categories": [...]}}.
     */
    private String path = "/api/category-list";

    /**
     * Categories used when no endpoint is configured.
     */
    private List<String> fallback = new ArrayList<>();

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(10);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public List<String> getFallback() {
        return fallback;
    }

    public void setFallback(List<String> fallback) {
        this.fallback = fallback;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public boolean isConfigured() {
        return StringUtils.hasText(baseUrl);
    }
}
