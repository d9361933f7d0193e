package com.example.khaznati_backend.config;

import com.example.khaznati_backend.backend.LocalObjectBackend;
import com.example.khaznati_backend.backend.S3ObjectBackend;
import com.example.khaznati_backend.backend.TelegramObjectBackend;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.BackendType;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import io.netty.resolver.DefaultAddressResolverGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.HttpProtocol;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Wires the object backend selected by {@code storage.backend}.
 */
@Configuration
public class StorageConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageConfig.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 10_000;
    private static final int MAX_CONNECTIONS = 10;
    private static final Duration PENDING_ACQUIRE_TIMEOUT = Duration.ofSeconds(30);
    private static final Duration MAX_IDLE_TIME = Duration.ofSeconds(20);
    private static final Duration MAX_LIFE_TIME = Duration.ofMinutes(5);

    @Bean
    public ObjectBackend objectBackend(StorageProperties props, Clock clock) {
        BackendType type = BackendType.fromProperty(props.getBackend());
        if (type == BackendType.TELEGRAM) {
            requireTelegramChunkSize(props);
        }
        ObjectBackend backend = switch (type) {
            case LOCAL -> new LocalObjectBackend(
                    Path.of(props.getLocal().getBaseDir()), props.getLocal().getChunkPrefix(), clock);
            case TELEGRAM -> new TelegramObjectBackend(
                    telegramWebClient(props), props.getTelegram(), props.getChunkTimeout(), clock);
            case S3 -> new S3ObjectBackend(
                    s3Client(props.getS3(), props.getChunkTimeout()),
                    props.getS3().getBucketName(),
                    props.getS3().getKeyPrefix(),
                    props.getS3().getSlowDownBackoff(),
                    clock);
        };
        LOGGER.info("Storage wired: backend={} chunkSize={} window={} maxAttempts={}",
                backend.name(), props.getChunkSizeBytes(), props.getMaxConcurrentChunks(), props.getMaxAttempts());
        return backend;
    }

    static void requireTelegramChunkSize(StorageProperties props) {
        int limit = props.getTelegram().getMaxChunkBytes();
        if (props.getChunkSizeBytes() > limit) {
            throw new IllegalStateException(("storage.chunk-size-bytes=%d is above the %d bytes the Telegram backend "
                    + "can download again; set STORAGE_CHUNK_SIZE to at most %d").formatted(
                    props.getChunkSizeBytes(), limit, limit));
        }
    }

    private WebClient telegramWebClient(StorageProperties props) {
        Duration callTimeout = props.getChunkTimeout();
        ConnectionProvider provider = ConnectionProvider.builder("telegram-http")
                .maxConnections(MAX_CONNECTIONS)
                .pendingAcquireTimeout(PENDING_ACQUIRE_TIMEOUT)
                .maxIdleTime(MAX_IDLE_TIME)
                .maxLifeTime(MAX_LIFE_TIME)
                .build();

        HttpClient httpClient = HttpClient.create(provider)
                .protocol(HttpProtocol.HTTP11)
                .compress(false)
                .responseTimeout(callTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .resolver(DefaultAddressResolverGroup.INSTANCE)
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(callTimeout.toSeconds(), TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(callTimeout.toSeconds(), TimeUnit.SECONDS))
                );

        LOGGER.info("Configuring Telegram WebClient baseUrl={} channel={} connect={}ms response={}s maxConn={}",
                props.getTelegram().getBaseUrl(), props.getTelegram().getChannelId(),
                CONNECT_TIMEOUT_MILLIS, callTimeout.toSeconds(), MAX_CONNECTIONS);

        // a chunk plus multipart framing has to fit in memory
        int maxInMemory = Math.max(props.getChunkSizeBytes() * 2, 16 * 1024 * 1024);
        return WebClient.builder()
                .baseUrl(props.getTelegram().getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("Accept", "application/json")
                .codecs(c -> c.defaultCodecs().maxInMemorySize(maxInMemory))
                .build();
    }

    private S3Client s3Client(StorageProperties.S3 s3, Duration callTimeout) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.getRegion()))
                .credentialsProvider(credentials(s3))
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(callTimeout)
                        .build())
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(s3.isPathStyleAccess())
                        .checksumValidationEnabled(false)
                        .build());
        if (s3.getEndpointUrl() != null && !s3.getEndpointUrl().isBlank()) {
            builder.endpointOverride(URI.create(s3.getEndpointUrl()));
        }
        LOGGER.info("Configuring S3 client endpoint={} region={} bucket={}", s3.getEndpointUrl(), s3.getRegion(), s3.getBucketName());
        return builder.build();
    }

    private static AwsCredentialsProvider credentials(StorageProperties.S3 s3) {
        if (s3.getAccessKeyId() != null && !s3.getAccessKeyId().isBlank()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.getAccessKeyId(), s3.getSecretAccessKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
