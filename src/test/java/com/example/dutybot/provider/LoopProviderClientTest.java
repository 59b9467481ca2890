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
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LoopProviderClientTest {

    private MockWebServer server;
    private ProviderClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        ProviderConfig config = new ProviderConfig(ProviderKind.LOOP, "loop",
                server.url("/").toString().replaceAll("/$", ""), "t1", "primary", "lemanapro",
                Duration.ofSeconds(60), Duration.ofSeconds(1));
        client = ProviderKind.LOOP.createClient(config, new OkHttpClient(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }

    @Test
    void firstGroupMemberIsOnDuty() throws InterruptedException {
        server.enqueue(json("[{\"user_id\":\"u1\"},{\"user_id\":\"u2\"}]"));
        server.enqueue(json("{\"id\":\"u1\",\"username\":\"alice\",\"first_name\":\"Alice\",\"last_name\":\"Smith\"}"));

        DutyState state = client.fetch();

        assertThat(state.providerId()).isEqualTo("loop");
        assertThat(state.person().id()).isEqualTo("alice");
        assertThat(state.person().displayName()).isEqualTo("Alice Smith");
        assertThat(state.stale()).isFalse();
        assertThat(state.sourceRevision()).hasSize(32);

        RecordedRequest members = server.takeRequest();
        assertThat(members.getPath()).isEqualTo("/api/v4/groups/primary/members");
        assertThat(members.getHeader("Authorization")).isEqualTo("Bearer t1");
        assertThat(members.getHeader("X-Loop-Team")).isEqualTo("lemanapro");
        assertThat(server.takeRequest().getPath()).isEqualTo("/api/v4/users/u1");
    }

    @Test
    void ldapIdIsPreferredAndProfilesAreCached() {
        server.enqueue(json("{\"members\":[{\"id\":\"u1\"}]}"));
        server.enqueue(json("{\"id\":\"u1\",\"username\":\"asmith\",\"ldap_id\":\"alice\"}"));
        server.enqueue(json("{\"members\":[{\"id\":\"u1\"}]}"));

        DutyState first = client.fetch();
        DutyState second = client.fetch();

        assertThat(first.person().id()).isEqualTo("alice");
        assertThat(second.sourceRevision()).isEqualTo(first.sourceRevision());
        assertThat(server.getRequestCount()).isEqualTo(3);
    }

    @Test
    void memberOrderChangesRevision() {
        server.enqueue(json("[{\"user_id\":\"u1\"},{\"user_id\":\"u2\"}]"));
        server.enqueue(json("{\"id\":\"u1\",\"username\":\"alice\"}"));
        server.enqueue(json("[{\"user_id\":\"u2\"},{\"user_id\":\"u1\"}]"));
        server.enqueue(json("{\"id\":\"u2\",\"username\":\"bob\"}"));

        DutyState first = client.fetch();
        DutyState second = client.fetch();

        assertThat(second.person().id()).isEqualTo("bob");
        assertThat(second.sourceRevision()).isNotEqualTo(first.sourceRevision());
    }

    @Test
    void unauthorizedIsAuthError() {
        server.enqueue(new MockResponse().setResponseCode(401));

        assertThatThrownBy(client::fetch).isInstanceOf(ProviderAuthException.class);
    }

    @Test
    void serverErrorIsUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(client::fetch)
                .isInstanceOf(ProviderUnavailableException.class)
                .hasMessageContaining("[loop]");
    }

    @Test
    void emptyGroupIsMalformed() {
        server.enqueue(json("[]"));

        assertThatThrownBy(client::fetch)
                .isInstanceOf(MalformedResponseException.class)
                .hasMessageContaining("no members");
    }

    @Test
    void invalidJsonIsMalformed() {
        server.enqueue(json("<html>maintenance</html>"));

        assertThatThrownBy(client::fetch).isInstanceOf(MalformedResponseException.class);
    }

    @Test
    void slowServerIsTimeout() {
        server.enqueue(json("[]").setHeadersDelay(3, TimeUnit.SECONDS));

        assertThatThrownBy(client::fetch).isInstanceOf(ProviderTimeoutException.class);
    }
}
