package com.example.dutybot.provider;

import com.example.dutybot.config.ProviderConfig;
import com.example.dutybot.domain.DutyState;
import com.example.dutybot.domain.Person;
import com.example.dutybot.loop.LoopApi;
import com.example.dutybot.loop.LoopApiException;
import com.example.dutybot.loop.LoopUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Reads the duty lane from a Loop group: the first member of the configured
 * group is the person on duty.
 */
@Slf4j
public class LoopProviderClient implements ProviderClient {

    private final ProviderConfig config;
    private final LoopApi api;

    public LoopProviderClient(ProviderConfig config, LoopApi api) {
        this.config = config;
        this.api = api;
    }

    @Override
    public ProviderConfig config() {
        return config;
    }

    /**
     * Group members, then the profile of the first one.
     */
    @Override
    public Duration fetchBudget() {
        return config.timeout().multipliedBy(2);
    }

    @Override
    public DutyState fetch() {
        try {
            List<String> memberIds = api.getGroupMemberIds(config.scheduleId());
            if (memberIds.isEmpty()) {
                throw new MalformedResponseException(providerId(),
                        "Duty group " + config.scheduleId() + " has no members");
            }
            LoopUser user = api.getUser(memberIds.get(0));
            String id = user.ldap().isEmpty() ? user.id() : user.ldap();
            String revision = DigestUtils.md5DigestAsHex(
                    String.join(",", memberIds).getBytes(StandardCharsets.UTF_8));
            log.debug("Loop group {} resolved to {} (revision {})", config.scheduleId(), id, revision);
            return DutyState.fresh(providerId(), new Person(id, user.displayName()), null, null, revision);
        } catch (LoopApiException e) {
            throw translate(e);
        }
    }

    private ProviderException translate(LoopApiException e) {
        if (e.isTimeout()) {
            return new ProviderTimeoutException(providerId(), e.getMessage(), e);
        }
        int status = e.getStatusCode();
        if (status == 401 || status == 403) {
            return new ProviderAuthException(providerId(), e.getMessage(), e);
        }
        if (e.isMalformed() || status == 404) {
            return new MalformedResponseException(providerId(), e.getMessage(), e);
        }
        return new ProviderUnavailableException(providerId(), e.getMessage(), e);
    }
}
