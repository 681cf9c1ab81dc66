package com.insurance.claims.bootstrap.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.insurance.claims.domain.valueobject.SubmissionSettings;

@ConfigurationProperties(prefix = "claims")
public class ClaimsProperties {

    private final Media media = new Media();
    private final RateLimit rateLimit = new RateLimit();
    private final InFlight inFlight = new InFlight();
    private final Decision decision = new Decision();
    private final Kafka kafka = new Kafka();
    private final Audit audit = new Audit();
    private final Pipeline pipeline = new Pipeline();

    public Media getMedia() {
        return media;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public InFlight getInFlight() {
        return inFlight;
    }

    public Decision getDecision() {
        return decision;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Audit getAudit() {
        return audit;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public SubmissionSettings toSubmissionSettings() {
        return new SubmissionSettings(media.getMaxBytes(), media.getDestination(), media.getMaxVideoDuration(),
                pipeline.getAttemptRetention());
    }

    public static class Media {
        private long maxBytes = SubmissionSettings.DEFAULT_MAX_MEDIA_BYTES;
        private Duration maxVideoDuration = SubmissionSettings.DEFAULT_MAX_VIDEO_DURATION;
        private String destination = "claims-video-evidence";
        private String region = "us-east-1";
        /** Only artifacts under this directory are accepted as local media references */
        private String stagingDir = "/var/lib/claims/staging";

        public long getMaxBytes() {
            return maxBytes;
        }

        public void setMaxBytes(long maxBytes) {
            this.maxBytes = maxBytes;
        }

        public Duration getMaxVideoDuration() {
            return maxVideoDuration;
        }

        public void setMaxVideoDuration(Duration maxVideoDuration) {
            this.maxVideoDuration = maxVideoDuration;
        }

        public String getDestination() {
            return destination;
        }

        public void setDestination(String destination) {
            this.destination = destination;
        }

        public String getRegion() {
            return region;
        }

        public void setRegion(String region) {
            this.region = region;
        }

        public String getStagingDir() {
            return stagingDir;
        }

        public void setStagingDir(String stagingDir) {
            this.stagingDir = stagingDir;
        }
    }

    public static class RateLimit {
        private String keyPrefix = "claims:ratelimit:";
        private int maxSubmissions = 3;
        private Duration window = Duration.ofMinutes(10);

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public int getMaxSubmissions() {
            return maxSubmissions;
        }

        public void setMaxSubmissions(int maxSubmissions) {
            this.maxSubmissions = maxSubmissions;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }

    public static class InFlight {
        /** redis or local */
        private String store = "redis";
        private String keyPrefix = "claims:inflight:";
        private Duration ttl = Duration.ofMinutes(5);

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }
    }

    public static class Decision {
        private String baseUrl = "http://claims-decision-service:8080";
        private Duration connectTimeout = Duration.ofSeconds(2);
        private Duration readTimeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
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
    }

    public static class Kafka {
        private final Topics topics = new Topics();
        private long publishAckTimeoutMs = 3000;

        public Topics getTopics() {
            return topics;
        }

        public long getPublishAckTimeoutMs() {
            return publishAckTimeoutMs;
        }

        public void setPublishAckTimeoutMs(long publishAckTimeoutMs) {
            this.publishAckTimeoutMs = publishAckTimeoutMs;
        }
    }

    public static class Topics {
        private String submissionEvents = "claims.submission-events";
        private String statusSubscriptions = "claims.status-subscriptions";

        public String getSubmissionEvents() {
            return submissionEvents;
        }

        public void setSubmissionEvents(String submissionEvents) {
            this.submissionEvents = submissionEvents;
        }

        public String getStatusSubscriptions() {
            return statusSubscriptions;
        }

        public void setStatusSubscriptions(String statusSubscriptions) {
            this.statusSubscriptions = statusSubscriptions;
        }
    }

    public static class Audit {
        private int historyLimit = 20;

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }
    }

    public static class Pipeline {
        private int corePoolSize = 8;
        private int maxPoolSize = 32;
        private int queueCapacity = 500;
        // How long a finished attempt stays readable through currentAttempt
        private Duration attemptRetention = Duration.ofMinutes(15);

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public Duration getAttemptRetention() {
            return attemptRetention;
        }

        public void setAttemptRetention(Duration attemptRetention) {
            this.attemptRetention = attemptRetention;
        }
    }
}
