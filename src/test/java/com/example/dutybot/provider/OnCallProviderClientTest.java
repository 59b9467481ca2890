package com.example.dutybot.provider;

import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.domain.DutyState;
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

class OnCallProviderClientTest {

    private static final String SCHEDULES =
            "{\"results\":[{\"id\":\"S1\",\"name\":\"Other\"},{\"id\":\"S2\",\"name\":\"SRE Primary\"}]}";

    private MockWebServer server;
    private ProviderClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ProviderConfig config = new ProviderConfig(ProviderKind.ONCALL, "oncall",
                server.url("/").toString().replaceAll("/$", ""), "t2", "sre primary", null,
                Duration.ofSeconds(60), Duration.ofSeconds(2));
        client = ProviderKind.ONCALL.createClient(config, new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void resolvesScheduleByNameAndReturnsFirstUser() throws InterruptedException {
        server.enqueue(json(SCHEDULES));
        server.enqueue(json("{\"users\":[{\"user\":{\"username\":\"carol\",\"name\":\"Carol King\"},"
                + "\"shift_start\":\"2026-10-01T08:00:00Z\",\"shift_end\":\"2026-10-02T08:00:00Z\"},"
                + "{\"username\":\"dave\"}]}"));

        DutyState state = client.fetch();

        assertThat(state.providerId()).isEqualTo("oncall");
        assertThat(state.person().id()).isEqualTo("carol");
        assertThat(state.person().displayName()).isEqualTo("Carol King");
        assertThat(state.validFrom()).isEqualTo(Instant.parse("2026-10-01T08:00:00Z"));
        assertThat(state.validUntil()).isEqualTo(Instant.parse("2026-10-02T08:00:00Z"));

        RecordedRequest schedules = server.takeRequest();
        assertThat(schedules.getPath()).isEqualTo("/api/v1/schedules");
        assertThat(schedules.getHeader("Authorization")).isEqualTo("t2");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v1/schedules/S2/on_call");
    }

    @Test
    void fallsBackToOnCallQueryOn404() throws InterruptedException {
        server.enqueue(json(SCHEDULES));
        server.enqueue(new MockResponse().setResponseCode(404));
        server.enqueue(json("[{\"login\":\"erin\"},{\"login\":\"erin\"}]"));

        DutyState state = client.fetch();

        assertThat(state.person().id()).isEqualTo("erin");
        server.takeRequest();
        server.takeRequest();
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v1/on_call/?schedule=S2");
    }

    @Test
    void unknownScheduleIsMalformed() {
        server.enqueue(json("{\"results\":[{\"id\":\"S1\",\"name\":\"Other\"}]}"));

        assertThatThrownBy(client::fetch)
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void nobodyOnCallIsMalformed() {
        server.enqueue(json(SCHEDULES));
        server.enqueue(json("{\"results\":[]}"));
        server.enqueue(json("[]"));

        assertThatThrownBy(client::fetch)
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("Nobody");
    }

    @Test
    void forbiddenIsAuthError() {
        server.enqueue(new MockResponse().setResponseCode(403));

        assertThatThrownBy(client::fetch).isInstanceOf(ProviderAuthException.class);
    }

    @Test
    void badGatewayIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThatThrownBy(client::fetch).isInstanceOf(ProviderUnavailableException.class);
    }

    @Test
    void revisionFollowsUserList() {
        server.enqueue(json(SCHEDULES));
        server.enqueue(json("[{\"username\":\"carol\"}]"));
        server.enqueue(json(SCHEDULES));
        server.enqueue(json("[{\"username\":\"carol\"},{\"username\":\"dave\"}]"));

        DutyState first = client.fetch();
        DutyState second = client.fetch();

        assertThat(second.person()).isEqualTo(first.person());
        assertThat(second.sourceRevision()).isNotEqualTo(first.sourceRevision());
    }
}
