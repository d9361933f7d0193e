package com.example.khaznati_backend.backend;

import com.example.khaznati_backend.config.StorageProperties;
import com.example.khaznati_backend.exception.BackendUnavailableException;
import com.example.khaznati_backend.exception.NotFoundException;
import com.example.khaznati_backend.exception.TransferTimeoutException;
import com.example.khaznati_backend.service.Interfaces.ObjectBackend;
import com.example.khaznati_backend.util.ConnectionState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.TimeoutException;

/**
 * Relays chunks through a Telegram bot: every chunk is posted as a document to the storage channel.
 * Locators have the form {@code <messageId>:<fileId>}; the message id is needed to delete, the file id
 * to download.
 */
public class TelegramObjectBackend implements ObjectBackend {
    private static final Logger LOGGER = LoggerFactory.getLogger(TelegramObjectBackend.class);
    public static final String NAME = "telegram";
    private static final String MESSAGE_GONE = "message to delete not found";

    private final WebClient client;
    private final StorageProperties.Telegram props;
    private final Duration callTimeout;
    private final Cooldown cooldown;
    private final BackendConnection connection;
    private final ObjectMapper om = new ObjectMapper();

    public TelegramObjectBackend(WebClient client, StorageProperties.Telegram props, Duration callTimeout, Clock clock) {
        this.client = client;
        this.props = props;
        this.callTimeout = callTimeout;
        this.cooldown = new Cooldown(NAME, clock);
        this.connection = new BackendConnection(NAME, this::validateToken, props.getConnectTimeout());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String put(byte[] payload) {
        cooldown.checkOpen();
        connection.ensureConnected();
        String filename = "chunk-" + UUID.randomUUID() + ".bin";
        MultipartBodyBuilder form = new MultipartBodyBuilder();
        form.part("chat_id", props.getChannelId());
        form.part("document", new ByteArrayResource(payload) {
            @Override
            public String getFilename() {
                return filename;
            }
        });

        JsonNode result = call("sendDocument", client.post()
                .uri(method("sendDocument"))
                .body(BodyInserters.fromMultipartData(form.build()))
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new Reply(resp.statusCode().value(), body))));
        ensureOk("sendDocument", result);

        JsonNode message = result.path("result");
        long messageId = message.path("message_id").asLong(-1);
        String fileId = message.path("document").path("file_id").asText("");
        if (messageId < 0 || fileId.isBlank()) {
            throw new BackendUnavailableException("Telegram sendDocument reply misses message_id or file_id");
        }
        LOGGER.debug("Telegram chunk stored messageId={} bytes={}", messageId, payload.length);
        return messageId + ":" + fileId;
    }

    @Override
    public byte[] get(String locator) {
        cooldown.checkOpen();
        connection.ensureConnected();
        Locator parsed = Locator.parse(locator);

        JsonNode reply = call("getFile", client.get()
                .uri(method("getFile") + "?file_id={fileId}", parsed.fileId())
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new Reply(resp.statusCode().value(), body))));
        if (!reply.path("ok").asBoolean(false) && reply.path("error_code").asInt() == 400) {
            throw new NotFoundException("Telegram file not found: " + locator);
        }
        ensureOk("getFile", reply);
        String filePath = reply.path("result").path("file_path").asText("");
        if (filePath.isBlank()) {
            throw new NotFoundException("Telegram file has no download path: " + locator);
        }

        byte[] bytes = block("download", client.get()
                .uri("/file/bot" + props.getBotToken() + "/" + filePath)
                .retrieve()
                .onStatus(status -> status.value() == 404, resp -> Mono.just(
                        new NotFoundException("Telegram file not found: " + locator)))
                .bodyToMono(byte[].class));
        return bytes == null ? new byte[0] : bytes;
    }

    @Override
    public void delete(String locator) {
        connection.ensureConnected();
        Locator parsed = Locator.parse(locator);
        JsonNode reply = call("deleteMessage", client.post()
                .uri(method("deleteMessage") + "?chat_id={chatId}&message_id={messageId}",
                        props.getChannelId(), parsed.messageId())
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new Reply(resp.statusCode().value(), body))));
        if (!reply.path("ok").asBoolean(false)
                && reply.path("description").asText("").toLowerCase(Locale.ROOT).contains(MESSAGE_GONE)) {
            LOGGER.debug("Telegram message already gone messageId={}", parsed.messageId());
            return;
        }
        ensureOk("deleteMessage", reply);
    }

    @Override
    public ConnectionState connectionState() {
        return connection.state();
    }

    public Cooldown cooldown() {
        return cooldown;
    }

    private void validateToken() {
        if (props.getBotToken() == null || props.getBotToken().isBlank()) {
            throw new BackendUnavailableException("storage.telegram.bot-token is not configured");
        }
        JsonNode reply = call("getMe", client.get()
                .uri(method("getMe"))
                .exchangeToMono(resp -> resp.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new Reply(resp.statusCode().value(), body))));
        ensureOk("getMe", reply);
        LOGGER.info("Telegram bot connected username={} channel={}",
                reply.path("result").path("username").asText("?"), props.getChannelId());
    }

    private String method(String name) {
        return "/bot" + props.getBotToken() + "/" + name;
    }

    /** Runs one Bot API call and trips the cooldown on flood control. */
    private JsonNode call(String operation, Mono<Reply> request) {
        Reply reply = block(operation, request);
        if (reply == null) {
            throw new BackendUnavailableException("Empty reply from Telegram " + operation, null, true);
        }
        JsonNode root = parse(operation, reply);
        if (reply.status() == 429 || root.path("error_code").asInt() == 429) {
            long retryAfter = root.path("parameters").path("retry_after").asLong(-1);
            Duration wait = retryAfter > 0 ? Duration.ofSeconds(retryAfter) : props.getDefaultFloodWait();
            throw cooldown.trip(wait);
        }
        if (reply.status() == 401) {
            connection.reset();
        }
        return root;
    }

    private <T> T block(String operation, Mono<T> request) {
        try {
            return request.timeout(callTimeout).block();
        } catch (WebClientRequestException e) {
            throw new BackendUnavailableException("Telegram " + operation + " transport error: " + e.getMessage(), e, true);
        } catch (NotFoundException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new TransferTimeoutException("Telegram " + operation + " timed out after " + callTimeout.toSeconds() + "s", cause);
            }
            throw new BackendUnavailableException("Telegram " + operation + " failed: " + cause.getMessage(), cause, true);
        }
    }

    private JsonNode parse(String operation, Reply reply) {
        try {
            return om.readTree(reply.body().isBlank() ? "{}" : reply.body());
        } catch (JsonProcessingException e) {
            throw new BackendUnavailableException(
                    "Telegram %s returned non-JSON reply status=%d".formatted(operation, reply.status()), e, reply.status() >= 500);
        }
    }

    private static void ensureOk(String operation, JsonNode root) {
        if (root.path("ok").asBoolean(false)) {
            return;
        }
        int code = root.path("error_code").asInt(0);
        String description = root.path("description").asText("unknown error");
        throw new BackendUnavailableException("Telegram %s error %d: %s".formatted(operation, code, description), null, code >= 500);
    }

    private record Reply(int status, String body) {
    }

    record Locator(long messageId, String fileId) {
        static Locator parse(String locator) {
            int sep = locator == null ? -1 : locator.indexOf(':');
            if (sep <= 0 || sep == locator.length() - 1) {
                throw new NotFoundException("Malformed Telegram locator: " + locator);
            }
            try {
                return new Locator(Long.parseLong(locator.substring(0, sep)), locator.substring(sep + 1));
            } catch (NumberFormatException e) {
                throw new NotFoundException("Malformed Telegram locator: " + locator, e);
            }
        }
    }
}
