package dev.pekelund.ezexpense.reconciliation;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "reconciliation")
public class ReconciliationProperties {

    /**
     * Minimum score, as a fraction between 0 and 1, for the bulk matcher to accept a pair.
     */
    private double matchThreshold = 0.5;

    /**
     * Largest receipt file accepted for upload.
     */
    private DataSize maxUploadSize = DataSize.ofMegabytes(16);

    /**
     * Content types accepted for upload.
     */
    private List<String> allowedContentTypes = new ArrayList<>(
        List.of("image/jpeg", "image/jpg", "image/png", "image/gif", "application/pdf"));

    private final Matching matching = new Matching();

    private final FanOut fanOut = new FanOut();

    public double getMatchThreshold() {
        return matchThreshold;
    }

    public void setMatchThreshold(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public DataSize getMaxUploadSize() {
        return maxUploadSize;
    }

    public void setMaxUploadSize(DataSize maxUploadSize) {
        this.maxUploadSize = maxUploadSize;
    }

    public List<String> getAllowedContentTypes() {
        return allowedContentTypes;
    }

    public void setAllowedContentTypes(List<String> allowedContentTypes) {
        this.allowedContentTypes = allowedContentTypes;
    }

    public Matching getMatching() {
        return matching;
    }

    public FanOut getFanOut() {
        return fanOut;
    }

    public enum MatchingMode {
        /** Greedy matching on top of the confidence scorer. */
        LOCAL,
        /** Delegate the whole round to the bulk matching service. */
        REMOTE
    }

    public static class Matching {

        private MatchingMode mode = MatchingMode.LOCAL;

        public MatchingMode getMode() {
            return mode;
        }

        public void setMode(MatchingMode mode) {
            this.mode = mode;
        }
    }

    public static class FanOut {

        /**
         * Worker threads used for parallel storage and scoring calls.
         */
        private int poolSize = 8;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }
    }
}
