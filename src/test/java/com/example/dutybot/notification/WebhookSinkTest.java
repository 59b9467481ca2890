package com.example.dutybot.notification;

import com.example.dutybot.config.AppConfig;
import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.example.dutybot.domain.Transition;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WebhookSinkTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private MockWebServer server;
    private WebhookSink sink;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        SinkConfig config = new SinkConfig(SinkKind.WEBHOOK, server.url("/hook").toString(), null, 3,
                Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofSeconds(1));
        sink = new WebhookSink(config, new OkHttpClient(), objectMapper);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static Transition aliceToBob() {
        DutyState alice = DutyState.fresh("oncall", new Person("alice", "Alice Smith"), null, null, "r1");
        DutyState bob = DutyState.fresh("oncall", new Person("bob", "Bob Jones"),
                Instant.parse("2026-10-01T09:00:00Z"), Instant.parse("2026-10-02T09:00:00Z"), "r2");
        return new Transition("oncall", alice, bob, Instant.parse("2026-10-01T09:00:05Z"));
    }

    @Test
    void postsTransitionAsJson() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(204));

        sink.deliver(aliceToBob());

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(request.getPath()).isEqualTo("/hook");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("provider_id").asText()).isEqualTo("oncall");
        assertThat(body.path("person").path("id").asText()).isEqualTo("bob");
        assertThat(body.path("person").path("display_name").asText()).isEqualTo("Bob Jones");
        assertThat(body.path("previous_person").path("id").asText()).isEqualTo("alice");
        assertThat(body.path("source_revision").asText()).isEqualTo("r2");
        assertThat(body.path("valid_until").asText()).isEqualTo("2026-10-02T09:00:00Z");
        assertThat(body.path("detected_at").asText()).isEqualTo("2026-10-01T09:00:05Z");
    }

    @Test
    void serverErrorIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> sink.deliver(aliceToBob()))
                .isInstanceOfSatisfying(DispatchException.class, e -> {
                    assertThat(e.isTransient()).isTrue();
                    assertThat(e.getMessage()).contains("503");
                });
    }

    @Test
    void clientErrorIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(400));

        assertThatThrownBy(() -> sink.deliver(aliceToBob()))
                .isInstanceOfSatisfying(DispatchException.class, e -> assertThat(e.isTransient()).isFalse());
    }

    @Test
    void rateLimitIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(429));

        assertThatThrownBy(() -> sink.deliver(aliceToBob()))
                .isInstanceOfSatisfying(DispatchException.class, e -> assertThat(e.isTransient()).isTrue());
    }

    @Test
    void slowReceiverTimesOutAsTransient() {
        server.enqueue(new MockResponse().setHeadersDelay(3, java.util.concurrent.TimeUnit.SECONDS));

        assertThatThrownBy(() -> sink.deliver(aliceToBob()))
                .isInstanceOfSatisfying(DispatchException.class, e -> assertThat(e.isTransient()).isTrue());
    }
}
