package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.StorageException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.ApiCallAttemptTimeoutException;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadBucketRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * S3-compatible object store (R2, MinIO, AWS). One object per chunk under {@code keyPrefix}.
 */
public class S3ObjectBackend implements ObjectBackend, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(S3ObjectBackend.class);
    public static final String NAME = "s3";

    private final S3Client s3;
    private final String bucket;
    private final String keyPrefix;
    private final Duration slowDownBackoff;
    private final Clock clock;
    private final Cooldown cooldown;
    private final BackendConnection connection;

    public S3ObjectBackend(S3Client s3, String bucket, String keyPrefix, Duration slowDownBackoff, Clock clock) {
        this.s3 = s3;
        this.bucket = bucket;
        this.keyPrefix = keyPrefix == null ? "" : (keyPrefix.isEmpty() || keyPrefix.endsWith("/") ? keyPrefix : keyPrefix + "/");
        this.slowDownBackoff = slowDownBackoff;
        this.clock = clock;
        this.cooldown = new Cooldown(NAME, clock);
        this.connection = new BackendConnection(NAME, this::headBucket, Duration.ofSeconds(30));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String put(byte[] payload) {
        cooldown.checkOpen();
        connection.ensureConnected();
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(ZoneOffset.UTC));
        String key = "%s%d/%02d/%s".formatted(keyPrefix, now.getYear(), now.getMonthValue(), UUID.randomUUID());
        try {
            s3.putObject(PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentLength((long) payload.length)
                            .contentType("application/octet-stream")
                            .build(),
                    RequestBody.fromBytes(payload));
        } catch (S3Exception e) {
            throw translate("put", key, e);
        } catch (SdkClientException e) {
            throw translate("put", key, e);
        }
        LOGGER.debug("S3 chunk stored bucket={} key={} bytes={}", bucket, key, payload.length);
        return key;
    }

    @Override
    public byte[] get(String locator) {
        cooldown.checkOpen();
        connection.ensureConnected();
        try {
            return s3.getObjectAsBytes(GetObjectRequest.builder().bucket(bucket).key(locator).build()).asByteArray();
        } catch (NoSuchKeyException e) {
            throw new NotFoundException("Chunk not found: " + locator, e);
        } catch (S3Exception e) {
            throw translate("get", locator, e);
        } catch (SdkClientException e) {
            throw translate("get", locator, e);
        }
    }

    @Override
    public void delete(String locator) {
        connection.ensureConnected();
        try {
            s3.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(locator).build());
        } catch (NoSuchKeyException e) {
            LOGGER.debug("S3 object already gone key={}", locator);
        } catch (S3Exception e) {
            throw translate("delete", locator, e);
        } catch (SdkClientException e) {
            throw translate("delete", locator, e);
        }
    }

    @Override
    public ConnectionState connectionState() {
        return connection.state();
    }

    @Override
    public void close() {
        s3.close();
    }

    private void headBucket() {
        try {
            s3.headBucket(HeadBucketRequest.builder().bucket(bucket).build());
            LOGGER.info("S3 bucket reachable bucket={} prefix={}", bucket, keyPrefix);
        } catch (S3Exception e) {
            throw new BackendUnavailableException("Bucket " + bucket + " not accessible: status=" + e.statusCode(), e);
        } catch (SdkClientException e) {
            throw new BackendUnavailableException("Bucket " + bucket + " not reachable: " + e.getMessage(), e, true);
        }
    }

    private StorageException translate(String operation, String key, S3Exception e) {
        String code = e.awsErrorDetails() == null ? null : e.awsErrorDetails().errorCode();
        if (e.statusCode() == 503 || "SlowDown".equals(code)) {
            return cooldown.trip(slowDownBackoff);
        }
        if (e.statusCode() == 403) {
            connection.reset();
        }
        return new BackendUnavailableException(
                "S3 %s failed key=%s status=%d code=%s".formatted(operation, key, e.statusCode(), code), e, e.statusCode() >= 500);
    }

    private StorageException translate(String operation, String key, SdkClientException e) {
        if (e instanceof ApiCallTimeoutException || e instanceof ApiCallAttemptTimeoutException) {
            return new TransferTimeoutException("S3 " + operation + " timed out key=" + key, e);
        }
        return new BackendUnavailableException("S3 " + operation + " transport error key=" + key + ": " + e.getMessage(), e, true);
    }
}
