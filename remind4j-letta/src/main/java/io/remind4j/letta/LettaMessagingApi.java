package io.remind4j.letta;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.remind4j.delivery.MessagingApi;
import io.remind4j.delivery.MessagingApiException;
import io.remind4j.recipient.RecipientDirectory;
import io.remind4j.recipient.RecipientInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link MessagingApi} and {@link RecipientDirectory} backed by the Letta REST API.
 *
 * <ul>
 *   <li>send: {@code POST /v1/agents/{id}/messages}</li>
 *   <li>sendStreaming: {@code POST /v1/agents/{id}/messages/stream}, body drained to completion</li>
 *   <li>listRecipients: {@code GET /v1/agents/}</li>
 * </ul>
 *
 * <p>HTTP errors surface as {@link MessagingApiException} carrying the status and body; I/O
 * failures carry {@link MessagingApiException#NO_RESPONSE}.
 */
public class LettaMessagingApi implements MessagingApi, RecipientDirectory {
    private static final Logger log = LoggerFactory.getLogger(LettaMessagingApi.class);

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;

    /**
     * @param restTemplate configured with auth and timeouts, see {@link #createRestTemplate(LettaClientSettings)}
     */
    public LettaMessagingApi(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
    }

    public LettaMessagingApi(LettaClientSettings settings, ObjectMapper objectMapper) {
        this(createRestTemplate(settings), objectMapper, settings.baseUrl());
    }

    /**
     * RestTemplate with the settings' timeouts and a bearer token on every request.
     */
    public static RestTemplate createRestTemplate(LettaClientSettings settings) {
        Objects.requireNonNull(settings, "settings must not be null");
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) settings.connectTimeout().toMillis());
        factory.setReadTimeout((int) settings.readTimeout().toMillis());

        RestTemplate restTemplate = new RestTemplate(factory);
        String token = settings.resolveToken();
        restTemplate.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().setBearerAuth(token);
            return execution.execute(request, body);
        });
        log.info("remind letta client configured {}", settings);
        return restTemplate;
    }

    @Override
    public void send(String recipientId, String message) {
        String url = baseUrl + "/v1/agents/{agentId}/messages";
        try {
            restTemplate.postForEntity(url, messageRequest(message), String.class, recipientId);
            log.debug("remind letta message accepted agent={}", recipientId);
        } catch (HttpStatusCodeException ex) {
            throw fromStatus("send", recipientId, ex);
        } catch (ResourceAccessException ex) {
            throw MessagingApiException.noResponse("Letta unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw MessagingApiException.noResponse("Letta request failed: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void sendStreaming(String recipientId, String message) {
        String url = baseUrl + "/v1/agents/{agentId}/messages/stream";
        HttpEntity<String> request = messageRequest(message);
        try {
            Long bytes = restTemplate.execute(url, HttpMethod.POST,
                    restTemplate.httpEntityCallback(request),
                    response -> drain(response.getBody()),
                    recipientId);
            log.debug("remind letta stream completed agent={} bytes={}", recipientId, bytes);
        } catch (HttpStatusCodeException ex) {
            throw fromStatus("stream", recipientId, ex);
        } catch (ResourceAccessException ex) {
            throw MessagingApiException.noResponse("Letta stream interrupted: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw MessagingApiException.noResponse("Letta stream failed: " + ex.getMessage(), ex);
        }
    }

    private static long drain(InputStream body) throws IOException {
        if (body == null) {
            return 0;
        }
        return StreamUtils.drain(body);
    }

    @Override
    public List<RecipientInfo> listRecipients() {
        String body;
        try {
            body = restTemplate.getForObject(baseUrl + "/v1/agents/", String.class);
        } catch (HttpStatusCodeException ex) {
            throw fromStatus("listAgents", null, ex);
        } catch (ResourceAccessException ex) {
            throw MessagingApiException.noResponse("Letta unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw MessagingApiException.noResponse("Letta request failed: " + ex.getMessage(), ex);
        }
        return parseAgents(body);
    }

    private List<RecipientInfo> parseAgents(String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new MessagingApiException(200, "Unparseable agent list: " + ex.getMessage(), body, ex);
        }

        List<RecipientInfo> out = new ArrayList<>();
        for (JsonNode agent : root) {
            String id = agent.path("id").asText(null);
            if (id == null) {
                continue;
            }
            out.add(new RecipientInfo(id, agent.path("name").asText(null), parseInstant(agent.path("created_at").asText(null))));
        }
        return out;
    }

    private static Instant parseInstant(String s) {
        if (s == null) {
            return null;
        }
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    /**
     * Lists agents to check the server is reachable and the credentials are accepted.
     */
    public ConnectionStatus testConnection() {
        try {
            int count = listRecipients().size();
            log.info("remind letta connection ok baseUrl={} agents={}", baseUrl, count);
            return ConnectionStatus.ok(baseUrl, count);
        } catch (MessagingApiException ex) {
            log.warn("remind letta connection failed baseUrl={} status={} msg={}", baseUrl, ex.statusCode(), ex.getMessage());
            return ConnectionStatus.failed(baseUrl, ex.getMessage());
        }
    }

    private HttpEntity<String> messageRequest(String message) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode messages = root.putArray("messages");
        ObjectNode user = messages.addObject();
        user.put("role", "user");
        ObjectNode text = user.putArray("content").addObject();
        text.put("type", "text");
        text.put("text", message);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON, MediaType.TEXT_EVENT_STREAM));
        return new HttpEntity<>(root.toString(), headers);
    }

    private static MessagingApiException fromStatus(String operation, String agentId, HttpStatusCodeException ex) {
        int status = ex.getStatusCode().value();
        String body = ex.getResponseBodyAsString(StandardCharsets.UTF_8);
        log.debug("remind letta {} failed agent={} status={} body={}", operation, agentId, status, body);
        return new MessagingApiException(status, "Letta " + operation + " returned " + status + ": " + ex.getStatusText(), body, ex);
    }
}
