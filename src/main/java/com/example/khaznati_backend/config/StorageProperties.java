package com.example.khaznati_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Chunk pipeline settings plus the connection settings of each object backend variant.
 */
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
    private String backend = "local";
    private int chunkSizeBytes = 20 * 1024 * 1024;
    private int maxConcurrentChunks = 3;
    private int maxAttempts = 3;
    private int maxThrottleWaits = 5;
    private Duration chunkTimeout = Duration.ofMinutes(2);
    private Duration uploadTimeout = Duration.ofMinutes(30);
    private Duration downloadTimeout = Duration.ofMinutes(30);
    private Duration sessionTtl = Duration.ofHours(1);
    private long defaultQuotaBytes = 5L * 1024 * 1024 * 1024;
    private String tempDir;

    private Local local = new Local();
    private Telegram telegram = new Telegram();
    private S3 s3 = new S3();

    public String getBackend() { return backend; }
    public void setBackend(String backend) { this.backend = backend; }

    public int getChunkSizeBytes() { return chunkSizeBytes; }
    public void setChunkSizeBytes(int chunkSizeBytes) { this.chunkSizeBytes = chunkSizeBytes; }

    public int getMaxConcurrentChunks() { return maxConcurrentChunks; }
    public void setMaxConcurrentChunks(int maxConcurrentChunks) { this.maxConcurrentChunks = maxConcurrentChunks; }

    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

    public int getMaxThrottleWaits() { return maxThrottleWaits; }
    public void setMaxThrottleWaits(int maxThrottleWaits) { this.maxThrottleWaits = maxThrottleWaits; }

    public Duration getChunkTimeout() { return chunkTimeout; }
    public void setChunkTimeout(Duration chunkTimeout) { this.chunkTimeout = chunkTimeout; }

    public Duration getUploadTimeout() { return uploadTimeout; }
    public void setUploadTimeout(Duration uploadTimeout) { this.uploadTimeout = uploadTimeout; }

    public Duration getDownloadTimeout() { return downloadTimeout; }
    public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }

    public Duration getSessionTtl() { return sessionTtl; }
    public void setSessionTtl(Duration sessionTtl) { this.sessionTtl = sessionTtl; }

    public long getDefaultQuotaBytes() { return defaultQuotaBytes; }
    public void setDefaultQuotaBytes(long defaultQuotaBytes) { this.defaultQuotaBytes = defaultQuotaBytes; }

    public String getTempDir() { return tempDir; }
    public void setTempDir(String tempDir) { this.tempDir = tempDir; }

    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }

    public Telegram getTelegram() { return telegram; }
    public void setTelegram(Telegram telegram) { this.telegram = telegram; }

    public S3 getS3() { return s3; }
    public void setS3(S3 s3) { this.s3 = s3; }

    public static class Local {
        private String baseDir = "./data";
        private String chunkPrefix = "chunks";

        public String getBaseDir() { return baseDir; }
        public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

        public String getChunkPrefix() { return chunkPrefix; }
        public void setChunkPrefix(String chunkPrefix) { this.chunkPrefix = chunkPrefix; }
    }

    public static class Telegram {
        private String baseUrl = "https://api.telegram.org";
        private String botToken;
        private String channelId;
        private Duration connectTimeout = Duration.ofSeconds(60);
        /** Used when a 429 reply carries no retry_after parameter. */
        private Duration defaultFloodWait = Duration.ofMinutes(5);
        /** getFile refuses documents above 20 MB (decimal), so stored chunks must stay at or below it. */
        private int maxChunkBytes = 20_000_000;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getBotToken() { return botToken; }
        public void setBotToken(String botToken) { this.botToken = botToken; }

        public String getChannelId() { return channelId; }
        public void setChannelId(String channelId) { this.channelId = channelId; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

        public Duration getDefaultFloodWait() { return defaultFloodWait; }
        public void setDefaultFloodWait(Duration defaultFloodWait) { this.defaultFloodWait = defaultFloodWait; }

        public int getMaxChunkBytes() { return maxChunkBytes; }
        public void setMaxChunkBytes(int maxChunkBytes) { this.maxChunkBytes = maxChunkBytes; }
    }

    public static class S3 {
        private String endpointUrl;
        private String region = "auto";
        private String bucketName = "khaznati-files";
        private String accessKeyId;
        private String secretAccessKey;
        private String keyPrefix = "chunks/";
        private boolean pathStyleAccess = true;
        private Duration slowDownBackoff = Duration.ofSeconds(5);

        public String getEndpointUrl() { return endpointUrl; }
        public void setEndpointUrl(String endpointUrl) { this.endpointUrl = endpointUrl; }

        public String getRegion() { return region; }
        public void setRegion(String region) { this.region = region; }

        public String getBucketName() { return bucketName; }
        public void setBucketName(String bucketName) { this.bucketName = bucketName; }

        public String getAccessKeyId() { return accessKeyId; }
        public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

        public String getSecretAccessKey() { return secretAccessKey; }
        public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

        public String getKeyPrefix() { return keyPrefix; }
        public void setKeyPrefix(String keyPrefix) { this.keyPrefix = keyPrefix; }

        public boolean isPathStyleAccess() { return pathStyleAccess; }
        public void setPathStyleAccess(boolean pathStyleAccess) { this.pathStyleAccess = pathStyleAccess; }

        public Duration getSlowDownBackoff() { return slowDownBackoff; }
        public void setSlowDownBackoff(Duration slowDownBackoff) { this.slowDownBackoff = slowDownBackoff; }
    }
}
