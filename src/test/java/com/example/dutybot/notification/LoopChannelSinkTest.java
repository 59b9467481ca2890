package com.example.dutybot.notification;

import com.example.dutybot.config.SinkConfig;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.example.dutybot.domain.Transition;
import com.example.dutybot.loop.LoopApi;
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

class LoopChannelSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private LoopChannelSink sink;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/").toString().replaceAll("/$", "");
        SinkConfig config = new SinkConfig(SinkKind.LOOP, null, "duty-channel", 3,
                Duration.ofMillis(1), Duration.ofMillis(2), Duration.ofSeconds(1));
        LoopApi api = new LoopApi(baseUrl, "t1", null, Duration.ofSeconds(1), new OkHttpClient(), objectMapper);
        sink = new LoopChannelSink(config, api);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void postsMentionToChannel() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"id\":\"p1\",\"channel_id\":\"duty-channel\"}"));
        DutyState alice = DutyState.fresh("loop", Person.of("alice"), null, null, "r1");
        DutyState bob = DutyState.fresh("loop", Person.of("bob"), null, null, "r2");

        sink.deliver(new Transition("loop", alice, bob, Instant.now()));

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/api/v4/posts");
        JsonNode body = objectMapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("channel_id").asText()).isEqualTo("duty-channel");
        assertThat(body.path("message").asText()).isEqualTo("@bob is now on duty for loop (was @alice)");
        assertThat(body.has("root_id")).isFalse();
    }

    @Test
    void messageMentionsEndOfShift() {
        DutyState carol = DutyState.fresh("oncall", Person.of("carol"), null,
                Instant.parse("2026-10-02T09:00:00Z"), "r1");

        assertThat(LoopChannelSink.message(new Transition("oncall", null, carol, Instant.now())))
                .isEqualTo("@carol is now on duty for oncall, until 2026-10-02T09:00:00Z");
    }

    @Test
    void forbiddenIsPermanent() {
        server.enqueue(new MockResponse().setResponseCode(403));
        DutyState bob = DutyState.fresh("loop", Person.of("bob"), null, null, "r2");

        assertThatThrownBy(() -> sink.deliver(new Transition("loop", null, bob, Instant.now())))
                .isInstanceOfSatisfying(DispatchException.class, e -> assertThat(e.isTransient()).isFalse());
    }

    @Test
    void badGatewayIsTransient() {
        server.enqueue(new MockResponse().setResponseCode(502));
        DutyState bob = DutyState.fresh("loop", Person.of("bob"), null, null, "r2");

        assertThatThrownBy(() -> sink.deliver(new Transition("loop", null, bob, Instant.now())))
                .isInstanceOfSatisfying(DispatchException.class, e -> assertThat(e.isTransient()).isTrue());
    }
}
