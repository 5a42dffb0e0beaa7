package dev.pekelund.ezexpense.scoring;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    /**
     * Base URL of the receipt scoring service. Scoring is disabled when empty.
     */
    private String baseUrl;

    /**
     * Path that scores one expense against one receipt.
     */
    private String scorePath = "/api/expenses/match-receipt";

    /**
     * Path that runs a bulk matching round.
     */
    private String bulkMatchPath = "/api/expenses/match-bulk-receipts";

    /**
     * HTTP connect timeout used when calling the scoring service.
     */
    private Duration connectTimeout = Duration.ofSeconds(5);

    /**
     * HTTP read timeout used when calling the scoring service.
     */
    private Duration readTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getScorePath() {
        return scorePath;
    }

    public void setScorePath(String scorePath) {
        this.scorePath = scorePath;
    }

    public String getBulkMatchPath() {
        return bulkMatchPath;
    }

    public void setBulkMatchPath(String bulkMatchPath) {
        this.bulkMatchPath = bulkMatchPath;
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
