package io.herald4j.telegram;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.herald4j.ChatTransport;
import io.herald4j.TransportException;
import io.herald4j.core.Attachment;
import io.herald4j.core.InlineButton;
import io.herald4j.core.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ChatTransport} over the Telegram Bot HTTP API.
 *
 * <p>Every call is a JSON POST to {@code <apiUrl>/bot<token>/<method>}. A response with
 * {@code "ok": false}, an HTTP error or an I/O failure becomes a {@link TransportException}.
 */
public class TelegramBotApiTransport implements ChatTransport {
    private static final Logger log = LoggerFactory.getLogger(TelegramBotApiTransport.class);

    private static final Set<String> ADMIN_STATUSES = Set.of("creator", "administrator");

    private final RestTemplate rest;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public TelegramBotApiTransport(RestTemplate rest, ObjectMapper mapper, String apiUrl, String botToken) {
        this.rest = Objects.requireNonNull(rest, "rest must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        Objects.requireNonNull(apiUrl, "apiUrl must not be null");
        Objects.requireNonNull(botToken, "botToken must not be null");
        if (botToken.isBlank()) {
            throw new IllegalArgumentException("botToken must not be blank");
        }
        String root = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
        this.baseUrl = root + "/bot" + botToken + "/";
    }

    @Override
    public void resolve(String destination) throws TransportException {
        call("getChat", Map.of("chat_id", destination));
    }

    @Override
    public void send(String destination, OutboundMessage message) throws TransportException {
        Objects.requireNonNull(message, "message must not be null");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", destination);

        String method;
        Attachment attachment = message.attachment();
        if (attachment == null) {
            method = "sendMessage";
            body.put("text", message.text());
        } else if (Attachment.PHOTO.equals(attachment.type())) {
            method = "sendPhoto";
            body.put("photo", attachment.ref());
            body.put("caption", message.text());
        } else if (Attachment.VIDEO.equals(attachment.type())) {
            method = "sendVideo";
            body.put("video", attachment.ref());
            body.put("caption", message.text());
        } else {
            throw new TransportException("Unsupported attachment type: " + attachment.type());
        }

        if (message.hasKeyboard()) {
            body.put("reply_markup", Map.of("inline_keyboard", keyboardOf(message.keyboard())));
        }

        call(method, body);
        log.debug("Sent {} to destination={}", method, destination);
    }

    @Override
    public boolean isAdmin(String userId, String destination) throws TransportException {
        // anonymous admins post as the group itself
        if (Objects.equals(userId, destination)) {
            return true;
        }
        JsonNode member = call("getChatMember", Map.of("chat_id", destination, "user_id", userId));
        return ADMIN_STATUSES.contains(member.path("status").asText(""));
    }

    /**
     * Long-poll for updates.
     *
     * @param offset         id of the first update to return
     * @param timeoutSeconds how long the server may hold the request open
     */
    public List<JsonNode> getUpdates(long offset, long timeoutSeconds) throws TransportException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("offset", offset);
        body.put("timeout", timeoutSeconds);
        body.put("allowed_updates", List.of("message"));

        JsonNode result = call("getUpdates", body);
        List<JsonNode> updates = new ArrayList<>(result.size());
        result.forEach(updates::add);
        return updates;
    }

    private JsonNode call(String method, Map<String, Object> body) throws TransportException {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        String payload;
        try {
            payload = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new TransportException("Failed to encode " + method + " request", e);
        }

        String responseBody;
        try {
            ResponseEntity<String> resp = rest.postForEntity(baseUrl + method, new HttpEntity<>(payload, headers), String.class);
            responseBody = resp.getBody();
        } catch (HttpStatusCodeException e) {
            // Telegram reports errors as JSON with a description
            responseBody = e.getResponseBodyAsString();
            if (responseBody == null || responseBody.isBlank()) {
                throw new TransportException(method + " failed: HTTP " + e.getStatusCode().value(), e);
            }
        } catch (RestClientException e) {
            throw new TransportException(method + " failed: " + e.getMessage(), e);
        }

        JsonNode root;
        try {
            root = mapper.readTree(responseBody == null ? "" : responseBody);
        } catch (JsonProcessingException e) {
            throw new TransportException(method + " returned an unreadable response", e);
        }
        if (root == null || !root.path("ok").asBoolean(false)) {
            String description = root == null ? "empty response" : root.path("description").asText("unknown error");
            throw new TransportException(method + " failed: " + description);
        }
        return root.path("result");
    }

    private static List<List<Map<String, String>>> keyboardOf(List<List<InlineButton>> rows) {
        List<List<Map<String, String>>> keyboard = new ArrayList<>(rows.size());
        for (List<InlineButton> row : rows) {
            List<Map<String, String>> out = new ArrayList<>(row.size());
            for (InlineButton b : row) {
                out.add(Map.of("text", b.text(), "url", b.url()));
            }
            keyboard.add(out);
        }
        return keyboard;
    }
}
