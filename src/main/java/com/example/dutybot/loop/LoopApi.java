package com.example.dutybot.loop;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.*;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thin client for the Loop (Mattermost compatible) REST API v4.
 *
 * Every request carries the bot token as a bearer token and, when configured,
 * the team in {@code X-Loop-Team}. User profiles are cached for the life of the client.
 */
@Slf4j
public class LoopApi {

    private static final MediaType JSON = MediaType.get("application/json");

    private final String baseUrl;
    private final String token;
    private final String team;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, LoopUser> userCache = new ConcurrentHashMap<>();

    public LoopApi(String baseUrl, String token, String team, Duration timeout,
                   OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.baseUrl = baseUrl;
        this.token = token;
        this.team = team;
        this.httpClient = httpClient.newBuilder()
                .callTimeout(timeout)
                .readTimeout(timeout)
                .build();
        this.objectMapper = objectMapper;
    }

    /**
     * Member ids of a group, in the order the server returns them.
     */
    public List<String> getGroupMemberIds(String groupId) throws LoopApiException {
        String path = "/api/v4/groups/" + encode(groupId) + "/members";
        JsonNode response = request("GET", path, null);
        JsonNode members = response.isArray() ? response : response.path("members");
        if (!members.isArray()) {
            throw new LoopApiException("Unexpected response type for " + path + ": " + response.getNodeType(), 200);
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode member : members) {
            String id = firstText(member, "user_id", "id");
            if (!id.isEmpty() && !ids.contains(id)) {
                ids.add(id);
            }
        }
        return ids;
    }

    public LoopUser getUser(String userId) throws LoopApiException {
        LoopUser cached = userCache.get(userId);
        if (cached != null) {
            return cached;
        }
        JsonNode response = request("GET", "/api/v4/users/" + encode(userId), null);
        if (!response.isObject()) {
            throw new LoopApiException("Unexpected user profile for " + userId, 200);
        }
        String username = response.path("username").asText("");
        String ldap = firstText(response, "ldap_id", "auth_data", "username", "email");
        String fullName = (response.path("first_name").asText("") + " " + response.path("last_name").asText("")).trim();
        LoopUser user = new LoopUser(userId, username, ldap, fullName.isEmpty() ? username : fullName);
        userCache.put(userId, user);
        return user;
    }

    /**
     * Posts a message to a channel, optionally as a reply in the thread {@code rootId}.
     */
    public LoopPost sendMessage(String channelId, String message, String rootId) throws LoopApiException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("channel_id", channelId);
        payload.put("message", message);
        if (rootId != null && !rootId.isEmpty()) {
            payload.put("root_id", rootId);
        }
        JsonNode response = request("POST", "/api/v4/posts", payload);
        String id = response.path("id").asText("");
        if (id.isEmpty()) {
            throw new LoopApiException("Loop did not return a post id", 200);
        }
        return toPost(id, response);
    }

    /**
     * All posts of a thread, oldest first.
     */
    public List<LoopPost> fetchThread(String threadId) throws LoopApiException {
        JsonNode thread = request("GET", "/api/v4/posts/" + encode(threadId) + "/thread", null);
        JsonNode posts = thread.path("posts");
        List<LoopPost> result = new ArrayList<>();
        JsonNode order = thread.path("order");
        if (order.isArray()) {
            for (JsonNode postId : order) {
                JsonNode post = posts.get(postId.asText());
                if (post != null && post.isObject()) {
                    result.add(toPost(postId.asText(), post));
                }
            }
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = posts.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (entry.getValue().isObject()) {
                result.add(toPost(entry.getKey(), entry.getValue()));
            }
        }
        result.sort(Comparator.comparingLong(LoopPost::createAt));
        return result;
    }

    private LoopPost toPost(String id, JsonNode post) {
        String rootId = post.path("root_id").asText("");
        return new LoopPost(id, rootId.isEmpty() ? id : rootId,
                post.path("user_id").asText(""),
                post.path("message").asText(""),
                post.path("create_at").asLong(0));
    }

    private JsonNode request(String method, String path, Object payload) throws LoopApiException {
        String url = baseUrl + path;
        Request.Builder builder = new Request.Builder()
                .url(url)
                .addHeader("Authorization", "Bearer " + token);
        if (team != null) {
            builder.addHeader("X-Loop-Team", team);
        }
        try {
            RequestBody body = payload == null ? null
                    : RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
            builder.method(method, body);
        } catch (IOException e) {
            throw new LoopApiException("Failed to encode payload for " + path, false, e);
        }

        log.debug("{} {}", method, url);
        try (Response response = httpClient.newCall(builder.build()).execute()) {
            String responseBody = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                log.error("HTTP error while requesting {} with {}: {} {}", url, method, response.code(),
                        responseBody.isEmpty() ? "<empty body>" : responseBody);
                throw new LoopApiException(method + " " + path + " returned HTTP " + response.code(), response.code());
            }
            log.debug("Response {} {}", response.code(), responseBody);
            try {
                return objectMapper.readTree(responseBody.isEmpty() ? "{}" : responseBody);
            } catch (IOException e) {
                throw new LoopApiException("Malformed JSON from " + path + ": " + e.getMessage(), 200);
            }
        } catch (LoopApiException e) {
            throw e;
        } catch (InterruptedIOException e) {
            throw new LoopApiException("Timed out calling " + url, true, e);
        } catch (IOException e) {
            log.error("Failed to reach {} with {}: {}", url, method, e.getMessage());
            throw new LoopApiException("Failed to reach " + url + ": " + e.getMessage(), false, e);
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText("").trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static String encode(String segment) {
        return HttpUrl.parse("http://x/").newBuilder().addPathSegment(segment).build().encodedPath().substring(1);
    }
}
