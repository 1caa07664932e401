package io.remind4j.letta;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.remind4j.delivery.DeliveryFailureClassifier;
import io.remind4j.delivery.MessagingApiException;
import io.remind4j.recipient.RecipientInfo;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.mock.http.client.MockClientHttpRequest;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class LettaMessagingApiTest {

    private static final String BASE = "http://letta.test";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockRestServiceServer server;
    private LettaMessagingApi api;

    @BeforeEach
    void setUp() {
        LettaClientSettings settings = new LettaClientSettings(BASE + "/", "key-1", null,
                Duration.ofSeconds(1), Duration.ofSeconds(1));
        RestTemplate restTemplate = LettaMessagingApi.createRestTemplate(settings);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        api = new LettaMessagingApi(restTemplate, objectMapper, settings.baseUrl());
    }

    @Test
    void sendShouldPostUserMessageWithBearerToken() {
        server.expect(requestTo(BASE + "/v1/agents/agent-1/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-1"))
                .andExpect(request -> {
                    JsonNode body = objectMapper.readTree(((MockClientHttpRequest) request).getBodyAsString());
                    JsonNode message = body.path("messages").get(0);
                    assertThat(message.path("role").asText()).isEqualTo("user");
                    assertThat(message.path("content").get(0).path("type").asText()).isEqualTo("text");
                    assertThat(message.path("content").get(0).path("text").asText()).isEqualTo("ping \"quoted\"");
                })
                .andRespond(withSuccess("{\"messages\":[]}", MediaType.APPLICATION_JSON));

        api.send("agent-1", "ping \"quoted\"");

        server.verify();
    }

    @Test
    void notFoundShouldCarryStatusAndBody() {
        server.expect(requestTo(BASE + "/v1/agents/ghost/messages"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND).body("{\"detail\":\"Agent not found\"}"));

        MessagingApiException ex = catchThrowableOfType(() -> api.send("ghost", "ping"), MessagingApiException.class);

        assertThat(ex.statusCode()).isEqualTo(404);
        assertThat(ex.responseBody()).contains("Agent not found");
        assertThat(DeliveryFailureClassifier.classify(ex)).isEqualTo(DeliveryFailureClassifier.FailureKind.PERMANENT);
    }

    @Test
    void serializationDefectShouldBeRecognisedFromBody() {
        server.expect(requestTo(BASE + "/v1/agents/agent-1/messages"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body("{\"detail\":\"KeyError: 'description' in ChatMLInnerMonologueWrapper\"}"));

        MessagingApiException ex = catchThrowableOfType(() -> api.send("agent-1", "ping"), MessagingApiException.class);

        assertThat(DeliveryFailureClassifier.classify(ex))
                .isEqualTo(DeliveryFailureClassifier.FailureKind.MALFORMED_RESPONSE);
    }

    @Test
    void ioFailureShouldReportNoResponse() {
        server.expect(requestTo(BASE + "/v1/agents/agent-1/messages"))
                .andRespond(withException(new IOException("Connection refused")));

        MessagingApiException ex = catchThrowableOfType(() -> api.send("agent-1", "ping"), MessagingApiException.class);

        assertThat(ex.hasResponse()).isFalse();
        assertThat(DeliveryFailureClassifier.classify(ex)).isEqualTo(DeliveryFailureClassifier.FailureKind.TRANSIENT);
    }

    @Test
    void streamingShouldConsumeEventStream() {
        server.expect(requestTo(BASE + "/v1/agents/agent-1/messages/stream"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer key-1"))
                .andRespond(withSuccess("data: {\"message_type\":\"assistant_message\"}\n\ndata: [DONE]\n\n",
                        MediaType.TEXT_EVENT_STREAM));

        api.sendStreaming("agent-1", "ping");

        server.verify();
    }

    @Test
    void streamingErrorShouldCarryStatus() {
        server.expect(requestTo(BASE + "/v1/agents/agent-1/messages/stream"))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        MessagingApiException ex = catchThrowableOfType(() -> api.sendStreaming("agent-1", "ping"),
                MessagingApiException.class);

        assertThat(ex.statusCode()).isEqualTo(502);
    }

    @Test
    void listRecipientsShouldParseAgents() {
        server.expect(requestTo(BASE + "/v1/agents/"))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess("[{\"id\":\"agent-1\",\"name\":\"Ada\",\"created_at\":\"2025-01-01T00:00:00Z\"},"
                        + "{\"id\":\"agent-2\",\"name\":\"Bob\"},{\"name\":\"no id\"}]", MediaType.APPLICATION_JSON));

        List<RecipientInfo> agents = api.listRecipients();

        assertThat(agents).containsExactly(
                new RecipientInfo("agent-1", "Ada", Instant.parse("2025-01-01T00:00:00Z")),
                new RecipientInfo("agent-2", "Bob", null));
    }

    @Test
    void existsShouldUseAgentList() {
        server.expect(requestTo(BASE + "/v1/agents/"))
                .andRespond(withSuccess("[{\"id\":\"agent-1\"}]", MediaType.APPLICATION_JSON));

        assertThat(api.exists("agent-9")).isFalse();
    }

    @Test
    void testConnectionShouldReportCountOrError() {
        server.expect(requestTo(BASE + "/v1/agents/"))
                .andRespond(withSuccess("[{\"id\":\"a\"},{\"id\":\"b\"}]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/v1/agents/"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        ConnectionStatus ok = api.testConnection();
        ConnectionStatus denied = api.testConnection();

        assertThat(ok.ok()).isTrue();
        assertThat(ok.recipientCount()).isEqualTo(2);
        assertThat(denied.ok()).isFalse();
        assertThat(denied.error()).contains("401");
    }
}
