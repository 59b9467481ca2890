package com.example.dutybot.provider;

import com.example.dutybot.config.DutyConfig;
import com.example.dutybot.config.ProviderConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One {@link ProviderClient} per configured provider lane.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();

    @Autowired
    public ProviderRegistry(DutyConfig dutyConfig, OkHttpClient httpClient, ObjectMapper objectMapper) {
        for (ProviderConfig config : dutyConfig.providers()) {
            register(config.kind().createClient(config, httpClient, objectMapper));
        }
    }

    public ProviderRegistry(List<ProviderClient> clients) {
        clients.forEach(this::register);
    }

    private void register(ProviderClient client) {
        clients.put(client.providerId(), client);
        log.info("Registered duty provider: {}", client.config());
    }

    public Collection<ProviderClient> getClients() {
        return clients.values();
    }

    public boolean contains(String providerId) {
        return clients.containsKey(providerId);
    }

    public int getProviderCount() {
        return clients.size();
    }
}
